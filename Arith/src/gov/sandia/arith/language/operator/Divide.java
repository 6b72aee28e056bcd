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
import gov.sandia.arith.language.Unknown;

import java.util.ArrayList;
import java.util.List;

/**
    Integer division, truncating toward zero.
**/
public class Divide extends OperatorBinary
{
    /**
        @throws ArithmeticException if the denominator is the literal zero.
    **/
    public Divide (Operator numerator, Operator denominator)
    {
        super (numerator, denominator);
        if (Constant.isValue (denominator, 0)) throw new ArithmeticException ("Division by zero: " + numerator + " / 0");
    }

    public String name ()
    {
        return "/";
    }

    public Operator create (Operator operand0, Operator operand1)
    {
        return new Divide (operand0, operand1);
    }

    protected int salt ()
    {
        return 0xf233de5a;
    }

    protected Operator rules (Operator n, Operator d)
    {
        if (Constant.isValue (d, 1)) return n;
        if (Constant.isValue (n, 0)) return Constant.ZERO;
        if (n.equals (d)) return Constant.ONE;
        if (n instanceof Constant  &&  d instanceof Constant)
        {
            long a = ((Constant) n).value;
            long b = ((Constant) d).value;
            if (a == Long.MIN_VALUE  &&  b == -1) return null;
            return new Constant (a / b);
        }
        if (Constant.isValue (d, -1)) return n.multiply (Constant.MINUS_ONE);

        // (x/a)/b = x/(a*b) for positive constants
        if (n instanceof Divide  &&  d instanceof Constant)
        {
            Divide inner = (Divide) n;
            long b = ((Constant) d).value;
            if (inner.operand1 instanceof Constant  &&  b > 0)
            {
                long a = ((Constant) inner.operand1).value;
                if (a > 0)
                {
                    try
                    {
                        return inner.operand0.divide (Math.multiplyExact (a, b));
                    }
                    catch (ArithmeticException e)
                    {
                        return null;
                    }
                }
            }
        }

        if (! Algebra.mightBeNegative (n)  &&  Algebra.isSmaller (n, d)) return Constant.ZERO;

        if (Algebra.multipleOf (d, n))
        {
            Operator q = n.ordinalDivide (d);
            if (! containsDivision (q)) return q;
        }

        // Split off the part of a non-negative sum that divides exactly.
        if (n instanceof Sum  &&  ! Algebra.mightBeNegative (d))
        {
            Sum s = (Sum) n;
            List<Operator> multiples = new ArrayList<Operator> ();
            for (Operator t : s.operands) if (Algebra.multipleOf (d, t)) multiples.add (t);
            if (! multiples.isEmpty ()  &&  multiples.size () < s.operands.size ())
            {
                Operator exact     = new Sum (multiples).simplify ();
                Operator remainder = s.withoutTerms (multiples);
                if (! Algebra.mightBeNegative (exact)  &&  ! Algebra.mightBeNegative (remainder))
                {
                    Operator q = exact.ordinalDivide (d);
                    if (! containsDivision (q)) return q.add (remainder.divide (d));
                }
            }
        }

        return null;
    }

    /**
        @return true if the tree holds a reciprocal or an integer division anywhere.
    **/
    public static boolean containsDivision (Operator e)
    {
        return e.visitUntil (new Operator.Condition ()
        {
            public boolean test (Operator op)
            {
                return Algebra.isDivision (op)  ||  op instanceof Divide;
            }
        });
    }

    public double evalDouble ()
    {
        double q = operand0.evalDouble () / operand1.evalDouble ();
        if (q < 0) return Math.ceil (q);
        return Math.floor (q);
    }

    /**
        The smallest numerator over the largest denominator, and the largest numerator over the smallest denominator.
    **/
    public Operator min ()
    {
        if (numeratorBelowDenominator ()) return Constant.ZERO;
        Operator dMin = operand1.min ();
        if (Constant.isValue (dMin, 0)) return Constant.ZERO;
        return quotient (operand0.min (), operand1.max ());
    }

    public Operator max ()
    {
        if (numeratorBelowDenominator ()) return Constant.ZERO;
        return quotient (operand0.max (), operand1.min ());
    }

    protected boolean numeratorBelowDenominator ()
    {
        Operator gap = operand0.max ().subtract (operand1.min ());
        return gap instanceof Constant  &&  ((Constant) gap).value < 0;
    }

    /**
        A bound that would divide by zero is unknown.
    **/
    protected static Operator quotient (Operator n, Operator d)
    {
        if (Constant.isValue (d, 0)) return Unknown.instance;
        return n.divide (d);
    }
}
