/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.Unknown;

import java.util.Map;

/**
    The set of values a variable may take. Endpoints are expressions, and either side may be Unknown.
    Ranges are immutable. The shapes are RangeUnbounded, RangeFrom, RangeTo, RangeStepped and RangeScaled.
**/
public abstract class Range
{
    /**
        @return A range of the same shape with its endpoints multiplied by k.
        The progression step or multiplier is not scaled.
    **/
    public Range scale (Operator k)
    {
        return this;
    }

    public Operator min ()
    {
        return Unknown.instance;
    }

    public Operator max ()
    {
        return Unknown.instance;
    }

    /**
        Replaces subtrees of the endpoints according to the bindings.
    **/
    public Range substitute (Map<Operator,Operator> bindings)
    {
        return this;
    }

    /**
        Order-sensitive in the endpoints. Shapes with a progression parameter fold it in as well.
    **/
    public int digest ()
    {
        return Integer.rotateLeft (min ().digest (), 7) ^ max ().digest ();
    }

    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (o == null  ||  o.getClass () != getClass ()) return false;
        return digest () == ((Range) o).digest ();
    }

    public int hashCode ()
    {
        return digest ();
    }
}
