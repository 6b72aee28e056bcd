/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

import gov.sandia.arith.language.Operator;

import java.util.Map;

/**
    Bounded below only.
**/
public class RangeFrom extends Range
{
    public final Operator start;

    public RangeFrom (Operator start)
    {
        this.start = start;
    }

    public Range scale (Operator k)
    {
        return new RangeFrom (start.multiply (k));
    }

    public Operator min ()
    {
        return start;
    }

    public Range substitute (Map<Operator,Operator> bindings)
    {
        return new RangeFrom (start.substitute (bindings));
    }

    public String toString ()
    {
        return "[" + start + ",?]";
    }
}
