/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

import gov.sandia.arith.language.Operator;

import java.util.Map;

/**
    Geometric progression start, start*multiplier, ... up to stop.
**/
public class RangeScaled extends Range
{
    public final Operator start;
    public final Operator stop;
    public final Operator multiplier;

    public RangeScaled (Operator start, Operator stop, Operator multiplier)
    {
        this.start      = start;
        this.stop       = stop;
        this.multiplier = multiplier;
    }

    public Range scale (Operator k)
    {
        return new RangeScaled (start.multiply (k), stop.multiply (k), multiplier);
    }

    public Operator min ()
    {
        return start;
    }

    public Operator max ()
    {
        return stop;
    }

    public int digest ()
    {
        return super.digest () ^ Integer.rotateLeft (Operator.mix (multiplier.digest ()), 13);
    }

    public Range substitute (Map<Operator,Operator> bindings)
    {
        return new RangeScaled (start.substitute (bindings), stop.substitute (bindings), multiplier.substitute (bindings));
    }

    public String toString ()
    {
        return "[" + start + "," + stop + " times " + multiplier + "]";
    }
}
