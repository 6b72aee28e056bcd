/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

import gov.sandia.arith.language.Operator;

import java.util.Map;

/**
    Bounded above only.
**/
public class RangeTo extends Range
{
    public final Operator end;

    public RangeTo (Operator end)
    {
        this.end = end;
    }

    public Range scale (Operator k)
    {
        return new RangeTo (end.multiply (k));
    }

    public Operator max ()
    {
        return end;
    }

    public Range substitute (Map<Operator,Operator> bindings)
    {
        return new RangeTo (end.substitute (bindings));
    }

    public String toString ()
    {
        return "[?," + end + "]";
    }
}
