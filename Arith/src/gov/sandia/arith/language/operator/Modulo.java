/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.operator;

import gov.sandia.arith.language.Algebra;
import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.OperatorBinary;
import gov.sandia.arith.language.Variable;
import gov.sandia.arith.language.function.ArithMath;

import java.util.ArrayList;
import java.util.List;

/**
    Remainder of truncating division, defined for negative dividends so that
    (a / b) * b + a % b == a.
**/
public class Modulo extends OperatorBinary
{
    /**
        @throws ArithmeticException if the divisor is the literal zero.
    **/
    public Modulo (Operator dividend, Operator divisor)
    {
        super (dividend, divisor);
        if (Constant.isValue (divisor, 0)) throw new ArithmeticException ("Division by zero: " + dividend + " % 0");
    }

    public String name ()
    {
        return "%";
    }

    public Operator create (Operator operand0, Operator operand1)
    {
        return new Modulo (operand0, operand1);
    }

    protected int salt ()
    {
        return 0xedf6bb88;
    }

    protected Operator rules (Operator dividend, Operator divisor)
    {
        Operator result = strideIdiom (dividend, divisor);
        if (result != null) return result;

        if (Constant.isValue (divisor, 1)) return Constant.ZERO;

        // 0 and 1 pass through unchanged, regardless of the divisor.
        if (Constant.isValue (dividend, 0)  ||  Constant.isValue (dividend, 1)) return dividend;

        if (dividend instanceof Constant  &&  divisor instanceof Constant)
        {
            return new Constant (((Constant) dividend).value % ((Constant) divisor).value);
        }

        if (dividend.equals (divisor)) return Constant.ZERO;

        if (Algebra.isSmaller (ArithMath.abs (dividend), ArithMath.abs (divisor))) return dividend;

        if (Algebra.multipleOf (divisor, dividend)) return Constant.ZERO;

        // Already reduced by the same divisor.
        if (dividend instanceof Modulo  &&  ((Modulo) dividend).operand1.equals (divisor)) return dividend;

        // The gcd below does not return fractions, but the divisor could be one.
        if (dividend instanceof Product)
        {
            Product p = (Product) dividend;
            if (p.hasOperand (divisor)  &&  ! Algebra.hasDivision (p.operands)) return Constant.ZERO;
        }

        if (Algebra.gcd (dividend, divisor).equals (divisor)) return Constant.ZERO;

        // Fold a large constant term down, to keep intermediate magnitudes small.
        if (dividend instanceof Sum  &&  divisor instanceof Constant)
        {
            Sum  s = (Sum) dividend;
            long d = ((Constant) divisor).value;
            Constant c = null;
            for (Operator t : s.operands)
            {
                if (t instanceof Constant)
                {
                    c = (Constant) t;
                    break;
                }
            }
            if (c != null  &&  d > 0  &&  c.value >= d)
            {
                return s.withoutTerm (c).add (c.value % d).modulo (divisor);
            }
        }

        // Drop the terms that are multiples of the divisor, as long as what remains can't be negative.
        if (dividend instanceof Sum  &&  ! Algebra.mightBeNegative (dividend))
        {
            Sum s = (Sum) dividend;
            List<Operator> multiples = new ArrayList<Operator> ();
            for (Operator t : s.operands) if (isMultipleTerm (t, divisor)) multiples.add (t);
            if (! multiples.isEmpty ())
            {
                Operator shorter = s.withoutTerms (multiples);
                if (! Algebra.mightBeNegative (shorter)) return shorter.modulo (divisor);
            }
        }

        return null;
    }

    /**
        Recognizes (c*a + a*m + e) % (c + m), in any order of terms and factors, and reduces it to e % (c + m).
        This shape comes from tile and stride normalization of index expressions.
    **/
    protected static Operator strideIdiom (Operator dividend, Operator divisor)
    {
        if (! (dividend instanceof Sum)  ||  ! (divisor instanceof Sum)) return null;
        List<Operator> terms = ((Sum) dividend).operands;
        List<Operator> parts = ((Sum) divisor).operands;
        if (terms.size () != 3  ||  parts.size () != 2) return null;

        Constant c = null;
        Variable m = null;
        for (Operator p : parts)
        {
            if      (p instanceof Constant) c = (Constant) p;
            else if (p instanceof Variable) m = (Variable) p;
        }
        if (c == null  ||  m == null) return null;

        for (int i = 0; i < 3; i++)
        {
            Operator a = otherFactor (terms.get (i), c);  // c*a
            if (a == null) continue;
            for (int j = 0; j < 3; j++)
            {
                if (j == i) continue;
                Operator a2 = otherFactor (terms.get (j), m);  // a*m
                if (a2 == null  ||  ! a2.equals (a)) continue;
                Operator e = terms.get (3 - i - j);
                return e.modulo (divisor);
            }
        }
        return null;
    }

    /**
        @return If term is a product of exactly two factors, one of which equals factor, the other one.
        Otherwise null.
    **/
    protected static Operator otherFactor (Operator term, Operator factor)
    {
        if (! (term instanceof Product)) return null;
        List<Operator> factors = ((Product) term).operands;
        if (factors.size () != 2) return null;
        if (factors.get (0).equals (factor)) return factors.get (1);
        if (factors.get (1).equals (factor)) return factors.get (0);
        return null;
    }

    /**
        Determines whether a term of a sum vanishes modulo the divisor.
    **/
    protected static boolean isMultipleTerm (Operator term, Operator divisor)
    {
        if (term instanceof Product  &&  divisor instanceof Product)
        {
            List<Operator> factors = ((Product) term).operands;
            return factors.containsAll (((Product) divisor).operands);
        }
        if (term instanceof Product  &&  ((Product) term).hasOperand (divisor)) return true;
        if (Algebra.multipleOf (divisor, term)) return true;
        return Algebra.gcd (term, divisor).equals (divisor);
    }

    public double evalDouble ()
    {
        return operand0.eval () % operand1.eval ();
    }

    /**
        Zero if the dividend starts at zero, otherwise 1 minus the smallest divisor.
    **/
    public Operator min ()
    {
        if (Constant.isValue (operand0.min (), 0)) return Constant.ZERO;
        return Constant.ONE.subtract (operand1.min ());
    }

    public Operator max ()
    {
        return operand1.max ().subtract (Constant.ONE);
    }
}
