/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

/**
    The "no information" sentinel. Distinct from every numeric value, it participates in
    digests and comparisons like any other node, but never evaluates.
**/
public class Unknown extends Operator
{
    public static final Unknown instance = new Unknown ();

    protected Unknown ()
    {
        simplified = true;
    }

    public String name ()
    {
        return "?";
    }

    protected int computeDigest ()
    {
        return 0x3fac31;
    }

    public String toString ()
    {
        return "?";
    }
}
