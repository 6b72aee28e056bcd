/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.function;

import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;

/**
    Derived functions built purely from conditionals.
**/
public class ArithMath
{
    /**
        Both operands are simplified first, so the two copies of each in the conditional are the same node.
    **/
    public static Operator min (Operator x, Operator y)
    {
        Operator sx = x.simplify ();
        Operator sy = y.simplify ();
        return sx.le (sy).then (sx).otherwise (sy);
    }

    public static Operator max (Operator x, Operator y)
    {
        Operator sx = x.simplify ();
        Operator sy = y.simplify ();
        return sx.gt (sy).then (sx).otherwise (sy);
    }

    public static Operator clamp (Operator x, Operator lo, Operator hi)
    {
        return min (max (x, lo), hi);
    }

    public static Operator abs (Operator x)
    {
        return x.lt (Constant.ZERO).then (Constant.ZERO.subtract (x)).otherwise (x);
    }
}
