/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.range;

import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;

import java.util.Map;

/**
    Arithmetic progression start, start+step, ... up to stop.
**/
public class RangeStepped extends Range
{
    public final Operator start;
    public final Operator stop;
    public final Operator step;

    public RangeStepped (Operator start, Operator stop, Operator step)
    {
        this.start = start;
        this.stop  = stop;
        this.step  = step;
    }

    /**
        Progression with unit step.
    **/
    public static RangeStepped continuous (Operator start, Operator stop)
    {
        return new RangeStepped (start, stop, Constant.ONE);
    }

    /**
        Scales both endpoints but keeps the step as is.
    **/
    public Range scale (Operator k)
    {
        return new RangeStepped (start.multiply (k), stop.multiply (k), step);
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
        return super.digest () ^ Integer.rotateLeft (Operator.mix (step.digest ()), 13);
    }

    public Range substitute (Map<Operator,Operator> bindings)
    {
        return new RangeStepped (start.substitute (bindings), stop.substitute (bindings), step.substitute (bindings));
    }

    public String toString ()
    {
        return "[" + start + "," + stop + " step " + step + "]";
    }
}
