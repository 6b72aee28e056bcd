/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.operator;

import gov.sandia.arith.language.Algebra;
import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.OperatorAssociative;

import java.util.ArrayList;
import java.util.List;

/**
    Product of two or more factors. In canonical form the constant factor, if any, comes first,
    and no factor is a Sum, since products distribute over sums.
    A reciprocal appears as a factor raised to the power -1.
**/
public class Product extends OperatorAssociative
{
    public Product (List<Operator> factors)
    {
        super (factors);
    }

    public Product (Operator... factors)
    {
        super (factors);
    }

    public String name ()
    {
        return "*";
    }

    public Operator create (List<Operator> operands)
    {
        return new Product (operands);
    }

    protected int salt ()
    {
        return 0x286be17e;
    }

    protected Operator rules (Operator[] factors)
    {
        List<Operator> flat = flatten (factors);
        for (Operator f : flat) if (f instanceof Constant  &&  ((Constant) f).value == 0) return Constant.ZERO;

        List<Operator> result = new ArrayList<Operator> ();
        for (Operator f : flat) insert (result, f);

        // Distribute over the first sum.
        for (int i = 0; i < result.size (); i++)
        {
            if (! (result.get (i) instanceof Sum)) continue;
            Sum s = (Sum) result.remove (i);
            Operator sum = Constant.ZERO;
            for (Operator t : s.operands)
            {
                List<Operator> term = new ArrayList<Operator> (result);
                term.add (t);
                sum = sum.add (new Product (term).simplify ());
            }
            return sum;
        }

        // Move the constant factor to the front, keeping the order of any that overflowed.
        List<Operator> constants = new ArrayList<Operator> ();
        for (Operator f : result) if (f instanceof Constant) constants.add (f);
        result.removeAll (constants);
        result.addAll (0, constants);

        if (result.size () == 0) return Constant.ONE;
        if (result.size () == 1) return result.get (0);
        if (same (result, factors)) return null;
        return new Product (result);
    }

    protected static void insert (List<Operator> factors, Operator factor)
    {
        if (factor instanceof Constant  &&  ((Constant) factor).value == 1) return;
        if (factor instanceof Product)
        {
            for (Operator f : ((Product) factor).operands) insert (factors, f);
            return;
        }
        for (int i = 0; i < factors.size (); i++)
        {
            Operator merged = combine (factors.get (i), factor);
            if (merged == null) continue;
            factors.remove (i);
            insert (factors, merged);
            return;
        }
        factors.add (factor);
    }

    /**
        @return The single expression equal to a*b, or null if the two factors don't combine.
    **/
    protected static Operator combine (Operator a, Operator b)
    {
        if (a instanceof Constant  &&  b instanceof Constant)
        {
            try
            {
                return new Constant (Math.multiplyExact (((Constant) a).value, ((Constant) b).value));
            }
            catch (ArithmeticException e)
            {
                return null;
            }
        }

        // Equal bases: x^a * x^b = x^(a+b)
        // Two plain sums are left for distribution instead.
        Operator baseA = base (a);
        Operator baseB = base (b);
        boolean plainSums = a instanceof Sum  &&  b instanceof Sum;
        if (baseA.equals (baseB)  &&  ! plainSums)
        {
            return baseA.pow (exponent (a).add (exponent (b)));
        }

        // Constant against a constant reciprocal
        if (a instanceof Constant  &&  isConstantReciprocal (b)) return cancel ((Constant) a, (Constant) ((Power) b).operand0);
        if (b instanceof Constant  &&  isConstantReciprocal (a)) return cancel ((Constant) b, (Constant) ((Power) a).operand0);
        if (isConstantReciprocal (a)  &&  isConstantReciprocal (b))
        {
            try
            {
                long d = Math.multiplyExact (((Constant) ((Power) a).operand0).value, ((Constant) ((Power) b).operand0).value);
                return new Constant (d).pow (Constant.MINUS_ONE);
            }
            catch (ArithmeticException e)
            {
                return null;
            }
        }
        return null;
    }

    /**
        c * d^-1 when one of c and d divides the other.
    **/
    protected static Operator cancel (Constant c, Constant d)
    {
        if (c.value % d.value == 0) return new Constant (c.value / d.value);
        if (d.value % c.value == 0) return new Constant (d.value / c.value).pow (Constant.MINUS_ONE);
        return null;
    }

    protected static boolean isConstantReciprocal (Operator e)
    {
        return Algebra.isDivision (e)  &&  ((Power) e).operand0 instanceof Constant;
    }

    protected static Operator base (Operator e)
    {
        if (e instanceof Power) return ((Power) e).operand0;
        return e;
    }

    protected static Operator exponent (Operator e)
    {
        if (e instanceof Power) return ((Power) e).operand1;
        return Constant.ONE;
    }

    /**
        @return The constant factor, or null if there is none.
    **/
    public Constant constantFactor ()
    {
        for (Operator f : operands) if (f instanceof Constant) return (Constant) f;
        return null;
    }

    /**
        @return true if this product is the negation of some expression, that is, its constant factor is -1.
    **/
    public boolean isNegatedTerm ()
    {
        Constant c = constantFactor ();
        return c != null  &&  c.value == -1;
    }

    /**
        Removes the given factors. Removing factors creates no new opportunity for simplification,
        so the remainder of a simplified product is built without going through the rules again.
        @return The remaining product, a single factor, or one if nothing remains.
    **/
    public Operator withoutFactors (List<Operator> removed)
    {
        List<Operator> rest = new ArrayList<Operator> (operands);
        for (Operator r : removed) rest.remove (r);
        if (! simplified) return new Product (rest).simplify ();
        return canonical (rest, Constant.ONE);
    }

    public Operator withoutFactor (Operator removed)
    {
        List<Operator> list = new ArrayList<Operator> ();
        list.add (removed);
        return withoutFactors (list);
    }

    protected void sanityCheck ()
    {
        super.sanityCheck ();
        for (Operator f : operands) assertTrue (! (f instanceof Sum), "* should not contain a +");
    }

    public double evalDouble ()
    {
        double result = 1;
        for (Operator f : operands) result *= f.evalDouble ();
        return result;
    }

    public Operator min ()
    {
        Operator result = Constant.ONE;
        for (Operator f : operands) result = result.multiply (f.min ());
        return result;
    }

    public Operator max ()
    {
        Operator result = Constant.ONE;
        for (Operator f : operands) result = result.multiply (f.max ());
        return result;
    }
}
