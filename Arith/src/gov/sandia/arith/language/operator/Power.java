/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.operator;

import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.OperatorBinary;

/**
    General exponentiation. An exponent of -1 encodes a reciprocal, which lets an exact
    fraction appear as a factor of a product without introducing integer division.
**/
public class Power extends OperatorBinary
{
    /**
        @throws ArithmeticException if the base is the literal zero and the exponent a negative constant.
    **/
    public Power (Operator base, Operator exponent)
    {
        super (base, exponent);
        if (Constant.isValue (base, 0)  &&  exponent instanceof Constant  &&  ((Constant) exponent).value < 0)
        {
            throw new ArithmeticException ("Division by zero: 0 raised to " + exponent);
        }
    }

    public String name ()
    {
        return "pow";
    }

    public Operator create (Operator operand0, Operator operand1)
    {
        return new Power (operand0, operand1);
    }

    protected int salt ()
    {
        return 0x63fcd7c2;
    }

    protected Operator rules (Operator base, Operator exponent)
    {
        if (Constant.isValue (exponent, 0)) return Constant.ONE;
        if (Constant.isValue (exponent, 1)) return base;
        if (Constant.isValue (base, 1))     return Constant.ONE;
        if (! (exponent instanceof Constant)) return null;

        long e = ((Constant) exponent).value;
        if (Constant.isValue (base, 0)  &&  e > 0) return Constant.ZERO;
        if (Constant.isValue (base, -1)) return (e % 2 == 0) ? Constant.ONE : Constant.MINUS_ONE;

        if (base instanceof Constant)
        {
            long b = ((Constant) base).value;
            if (e > 0)
            {
                Long result = power (b, e);
                if (result == null) return null;  // overflow, so leave unfolded
                return new Constant (result);
            }
            // Canonical reciprocal: c^-n = (c^n)^-1
            if (e < -1)
            {
                Long result = power (b, -e);
                if (result == null) return null;
                return new Power (new Constant (result), Constant.MINUS_ONE);
            }
            return null;
        }

        // (x^a)^b = x^(a*b)
        if (base instanceof Power)
        {
            Power p = (Power) base;
            if (p.operand1 instanceof Constant)
            {
                try
                {
                    return p.operand0.pow (Math.multiplyExact (((Constant) p.operand1).value, e));
                }
                catch (ArithmeticException x)
                {
                    return null;
                }
            }
        }

        // (x*y)^c = x^c * y^c
        if (base instanceof Product)
        {
            Operator result = Constant.ONE;
            for (Operator f : ((Product) base).operands) result = result.multiply (f.pow (exponent));
            return result;
        }

        return null;
    }

    /**
        Exact integer power.
        @return The result, or null on overflow.
    **/
    public static Long power (long base, long exponent)
    {
        long result = 1;
        try
        {
            for (long i = 0; i < exponent; i++)
            {
                result = Math.multiplyExact (result, base);
                if (result == 0  ||  result == 1) break;
            }
        }
        catch (ArithmeticException e)
        {
            return null;
        }
        return result;
    }

    public double evalDouble ()
    {
        return Math.pow (operand0.evalDouble (), operand1.evalDouble ());
    }

    /**
        Bounds are known when base and exponent each lie at a single point, or when the base is
        non-negative and the exponent strictly one-signed, so that the power is monotonic.
    **/
    public Operator min ()
    {
        Operator[] b = bounds ();
        if (b == null) return super.min ();
        return b[0];
    }

    public Operator max ()
    {
        Operator[] b = bounds ();
        if (b == null) return super.max ();
        return b[1];
    }

    protected Operator[] bounds ()
    {
        Operator bMin = operand0.min ();
        Operator bMax = operand0.max ();
        Operator eMin = operand1.min ();
        Operator eMax = operand1.max ();
        if (! (bMin instanceof Constant  &&  bMax instanceof Constant  &&  eMin instanceof Constant  &&  eMax instanceof Constant)) return null;
        long x = ((Constant) bMin).value;
        long y = ((Constant) bMax).value;
        long a = ((Constant) eMin).value;
        long b = ((Constant) eMax).value;
        if (x == y  &&  a == b)
        {
            if (x == 0  &&  a < 0) return null;
            Operator point = bMin.pow (eMin);
            return new Operator[] {point, point};
        }
        if (x >= 0  &&  y >= 0  &&  a > 0  &&  b > 0) return new Operator[] {bMin.pow (eMin), bMax.pow (eMax)};
        if (x >  0  &&  y >  0  &&  a < 0  &&  b < 0) return new Operator[] {bMax.pow (eMin), bMin.pow (eMax)};
        return null;
    }
}
