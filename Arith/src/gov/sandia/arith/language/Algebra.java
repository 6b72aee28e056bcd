/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.language.operator.Divide;
import gov.sandia.arith.language.operator.Power;
import gov.sandia.arith.language.operator.Product;
import gov.sandia.arith.language.operator.Sum;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
    Structural algebra over expression trees: greatest common divisor, divisibility and magnitude tests.
    The rule tables call these. They never call the rule tables directly, only the builders.
**/
public class Algebra
{
    private static Logger logger = Logger.getLogger (Algebra.class);

    /**
        Structural greatest common divisor. Falls back to 1 whenever no common factor is evident.
        Never returns a fraction (a reciprocal or a Divide), since that is not a valid divisor.
    **/
    public static Operator gcd (Operator a, Operator b)
    {
        Operator g = gcdInner (a, b);
        if (isDivision (g)  ||  g instanceof Divide) return Constant.ONE;
        return g;
    }

    protected static Operator gcdInner (Operator a, Operator b)
    {
        if (a instanceof Constant  &&  b instanceof Constant)
        {
            return new Constant (gcd (Math.abs (((Constant) a).value), Math.abs (((Constant) b).value)));
        }

        if (a instanceof Divide) return Constant.ONE;
        if (a.equals (b)) return a;

        // Powers: find a matching base and take the smaller exponent. Fractions are never factored out.
        if (isNegativePower (a)  ||  isNegativePower (b)) return Constant.ONE;
        if (b instanceof Power  &&  ((Power) b).operand0.equals (a)) return a;
        if (a instanceof Power  &&  b instanceof Power)
        {
            Power pa = (Power) a;
            Power pb = (Power) b;
            if (pa.operand0.equals (pb.operand0))
            {
                try
                {
                    return pa.operand0.pow (Bounds.declared.smaller (pa.operand1, pb.operand1));
                }
                catch (NotEvaluableException e)
                {
                    logger.trace ("Exponents not comparable: " + pa.operand1 + ", " + pb.operand1);
                    return Constant.ONE;
                }
            }
        }
        if (a instanceof Power  &&  b instanceof Product  &&  ((Product) b).hasOperand (((Power) a).operand0)) return ((Power) a).operand0;
        if (a instanceof Product  &&  b instanceof Power  &&  ((Product) a).hasOperand (((Power) b).operand0)) return ((Power) b).operand0;
        if (a instanceof Power  &&  ((Power) a).operand0.equals (b)) return b;

        // Products: combine the gcd of each pair of factors.
        if (a instanceof Product  &&  b instanceof Product)
        {
            Operator result = Constant.ONE;
            for (Operator f1 : ((Product) a).operands)
            {
                for (Operator f2 : ((Product) b).operands) result = result.multiply (gcd (f1, f2));
            }
            return result;
        }
        if (a instanceof Product  &&  b instanceof Constant) return gcd (b, a);
        if (a instanceof Constant  &&  b instanceof Product)
        {
            Constant c = ((Product) b).constantFactor ();
            if (c == null) return Constant.ONE;
            return gcd (a, c);
        }
        if (a instanceof Product  &&  ((Product) a).hasOperand (b)) return b;
        if (b instanceof Product  &&  ((Product) b).hasOperand (a)) return a;

        // Sums: factor each one, then intersect the factorizations.
        if (a instanceof Sum  &&  b instanceof Sum)
        {
            Operator fac1 = factorize ((Sum) a);
            if (isOne (fac1)) return fac1;
            Operator fac2 = factorize ((Sum) b);
            if (isOne (fac2)) return fac2;

            // The gcd could be either the factor or the remainder.
            List<Operator> common = new ArrayList<Operator> ();
            common.add (fac1);
            common.add (a.ordinalDivide (fac1));
            List<Operator> other = new ArrayList<Operator> ();
            other.add (fac2);
            other.add (b.ordinalDivide (fac2));
            common.retainAll (other);
            if (common.isEmpty ()) return Constant.ONE;
            return common.get (0);
        }
        if (b instanceof Sum) return gcd (b, a);
        if (a instanceof Sum)
        {
            Operator factor = factorize ((Sum) a);
            if (isOne (factor)) return factor;
            return gcd (factor, b);
        }

        return Constant.ONE;
    }

    /**
        Numeric Euclidean gcd of two non-negative numbers.
    **/
    public static long gcd (long a, long b)
    {
        while (b != 0)
        {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    /**
        Finds a factor common to all terms of a sum, by combining the gcd of every pair of terms.
        Each unordered pair is visited once, in ascending digest order.
        @return The common factor, or 1 if there is none.
    **/
    public static Operator factorize (Sum s)
    {
        Operator result = null;
        for (Operator t1 : s.operands)
        {
            for (Operator t2 : s.operands)
            {
                if (t1.digest () >= t2.digest ()) continue;
                Operator g = gcd (t1, t2);
                if (isOne (g)) return g;
                if (result == null) result = g;
                else                result = gcd (result, g);
                if (isOne (result)) return result;
            }
        }
        if (result == null) return Constant.ONE;
        return result;
    }

    /**
        Determines whether value is an integer multiple of divisor.
        A false result means "not proven", not "proven otherwise".
    **/
    public static boolean multipleOf (Operator divisor, Operator value)
    {
        value = value.simplify ();

        if (value instanceof Product  &&  divisor instanceof Product)
        {
            // Look for inclusion, with the same number of reciprocal factors on each side.
            List<Operator> vf = ((Product) value).operands;
            List<Operator> df = ((Product) divisor).operands;
            if (countDivisions (vf) != countDivisions (df)) return false;
            for (Operator f : df)
            {
                if (f instanceof Power)
                {
                    boolean found = false;
                    for (Operator t : vf)
                    {
                        if (multipleOf (f, t))
                        {
                            found = true;
                            break;
                        }
                    }
                    if (! found) return false;
                }
                else if (! vf.contains (f))
                {
                    return false;
                }
            }
            return true;
        }

        // Multiple of a constant if the constant factor of the product is.
        if (value instanceof Product  &&  divisor instanceof Constant)
        {
            Constant c = ((Product) value).constantFactor ();
            long d = ((Constant) divisor).value;
            return c != null  &&  d != 0  &&  c.value % d == 0;
        }

        if (value instanceof Product)
        {
            List<Operator> vf = ((Product) value).operands;
            return ! hasDivision (vf)  &&  vf.contains (divisor);
        }

        if (value instanceof Constant  &&  divisor instanceof Constant)
        {
            long d = ((Constant) divisor).value;
            return d != 0  &&  ((Constant) value).value % d == 0;
        }

        // Fractions: the numerators divide and the denominators divide the other way.
        if (value instanceof Divide  &&  divisor instanceof Divide)
        {
            Divide v = (Divide) value;
            Divide d = (Divide) divisor;
            return multipleOf (v.operand1, d.operand1)  &&  multipleOf (d.operand0, v.operand0);
        }

        if (isDivision (value)  &&  isDivision (divisor))
        {
            return multipleOf (((Power) value).operand0, ((Power) divisor).operand0);
        }

        return value.equals (divisor);
    }

    /**
        Best effort test of whether a is always strictly smaller than b.
        Compares the value of a with its variables at their maximum against b.
        @return true if proven. false means "not proven", never "proven not smaller".
    **/
    public static boolean isSmaller (Operator a, Operator b)
    {
        try
        {
            Operator atMax = Bounds.declared.atMax (a);

            if (atMax instanceof Product)
            {
                List<Operator> factors = ((Product) atMax).operands;
                if (hasDivision (factors))
                {
                    Operator stripped = Constant.ONE;
                    for (Operator f : factors) if (! isDivision (f)) stripped = stripped.multiply (f);
                    if (stripped.equals (b)) return true;
                }
            }

            if (atMax.equals (b)) return true;
            if (Bounds.declared.atMax (a, true).eval () < b.eval ()) return true;
        }
        catch (NotEvaluableException e)
        {
            logger.trace ("isSmaller undecided: " + e.getMessage ());
        }
        return false;
    }

    /**
        @return false only if the lower bound of e is known to be non-negative.
    **/
    public static boolean mightBeNegative (Operator e)
    {
        try
        {
            return Bounds.declared.min (e).eval () < 0;
        }
        catch (NotEvaluableException x)
        {
            return true;
        }
    }

    /**
        A reciprocal: anything raised to the power -1.
    **/
    public static boolean isDivision (Operator e)
    {
        if (! (e instanceof Power)) return false;
        Operator exponent = ((Power) e).operand1;
        return exponent instanceof Constant  &&  ((Constant) exponent).value == -1;
    }

    public static boolean hasDivision (List<Operator> factors)
    {
        for (Operator f : factors) if (isDivision (f)) return true;
        return false;
    }

    protected static int countDivisions (List<Operator> factors)
    {
        int result = 0;
        for (Operator f : factors) if (isDivision (f)) result++;
        return result;
    }

    protected static boolean isNegativePower (Operator e)
    {
        if (! (e instanceof Power)) return false;
        Operator exponent = ((Power) e).operand1;
        return exponent instanceof Constant  &&  ((Constant) exponent).value < 0;
    }

    protected static boolean isOne (Operator e)
    {
        return e instanceof Constant  &&  ((Constant) e).value == 1;
    }
}
