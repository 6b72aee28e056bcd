/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.range.Range;
import gov.sandia.arith.range.RangeUnbounded;

/**
    Stands in for a value that cannot be named, but whose range is known.
    Identity is the range, so two placeholders over the same range are equal.
**/
public class ArithFunction extends Operator
{
    public final Range range;

    public ArithFunction ()
    {
        this (RangeUnbounded.instance);
    }

    public ArithFunction (Range range)
    {
        this.range = range;
        simplified = true;
    }

    public String name ()
    {
        return "function";
    }

    protected int computeDigest ()
    {
        return 0x3105f133 ^ range.digest ();
    }

    protected boolean equalsLeaf (Operator that)
    {
        return range.digest () == ((ArithFunction) that).range.digest ();
    }
}
