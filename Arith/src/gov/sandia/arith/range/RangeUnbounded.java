/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

public class RangeUnbounded extends Range
{
    public static final RangeUnbounded instance = new RangeUnbounded ();

    protected RangeUnbounded ()
    {
    }

    public String toString ()
    {
        return "[?,?]";
    }
}
