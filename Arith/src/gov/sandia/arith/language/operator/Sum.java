/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language.operator;

import gov.sandia.arith.language.Constant;
import gov.sandia.arith.language.Operator;
import gov.sandia.arith.language.OperatorAssociative;

import java.util.ArrayList;
import java.util.List;

/**
    Sum of two or more terms. In canonical form the constant term, if any, comes last.
**/
public class Sum extends OperatorAssociative
{
    public Sum (List<Operator> terms)
    {
        super (terms);
    }

    public Sum (Operator... terms)
    {
        super (terms);
    }

    public String name ()
    {
        return "+";
    }

    public Operator create (List<Operator> operands)
    {
        return new Sum (operands);
    }

    protected int salt ()
    {
        return 0x8e535130;
    }

    protected Operator rules (Operator[] terms)
    {
        List<Operator> flat = flatten (terms);
        List<Operator> result = new ArrayList<Operator> ();
        for (Operator t : flat) insert (result, t);

        // Move the constant term to the end. There is more than one only when their sum overflows.
        List<Operator> constants = new ArrayList<Operator> ();
        for (Operator t : result) if (t instanceof Constant) constants.add (t);
        result.removeAll (constants);
        result.addAll (constants);

        if (result.size () == 0) return Constant.ZERO;
        if (result.size () == 1) return result.get (0);
        if (same (result, terms)) return null;
        return new Sum (result);
    }

    /**
        Adds a term to the list, combining it with the first existing term it merges with.
        The outcome of a merge is inserted in turn, since it may combine further.
    **/
    protected static void insert (List<Operator> terms, Operator term)
    {
        if (isZero (term)) return;
        if (term instanceof Sum)
        {
            for (Operator t : ((Sum) term).operands) insert (terms, t);
            return;
        }
        for (int i = 0; i < terms.size (); i++)
        {
            Operator merged = combine (terms.get (i), term);
            if (merged == null) continue;
            terms.remove (i);
            insert (terms, merged);
            return;
        }
        terms.add (term);
    }

    /**
        @return The single expression equal to a+b, or null if the two terms don't combine.
    **/
    protected static Operator combine (Operator a, Operator b)
    {
        if (a instanceof Constant  &&  b instanceof Constant)
        {
            try
            {
                return new Constant (Math.addExact (((Constant) a).value, ((Constant) b).value));
            }
            catch (ArithmeticException e)
            {
                return null;  // overflow, so leave the terms apart
            }
        }
        if (a instanceof Constant  ||  b instanceof Constant) return null;

        long     ca = coefficient (a);
        long     cb = coefficient (b);
        Operator ra = rest (a);
        Operator rb = rest (b);

        // Like terms: c1*x + c2*x = (c1+c2)*x
        if (ra.equals (rb))
        {
            try
            {
                return ra.multiply (Math.addExact (ca, cb));
            }
            catch (ArithmeticException e)
            {
                return null;
            }
        }

        // Truncating division identity: (n/d)*d + n%d = n
        Operator n = divisionIdentity (a, b);
        if (n == null) n = divisionIdentity (b, a);
        if (n != null) return n;
        if (ca == cb  &&  ca != 1)
        {
            n = divisionIdentity (ra, rb);
            if (n == null) n = divisionIdentity (rb, ra);
            if (n != null) return n.multiply (ca);
        }
        return null;
    }

    /**
        @return n if m is n%d and p is (n/d)*d, otherwise null.
    **/
    protected static Operator divisionIdentity (Operator m, Operator p)
    {
        if (! (m instanceof Modulo)  ||  ! (p instanceof Product)) return null;
        Modulo   mod     = (Modulo) m;
        Product  product = (Product) p;
        Operator divisor = mod.operand1;
        if (! product.hasOperand (divisor)) return null;
        Operator quotient = product.withoutFactor (divisor);
        if (! (quotient instanceof Divide)) return null;
        Divide d = (Divide) quotient;
        if (d.operand0.equals (mod.operand0)  &&  d.operand1.equals (divisor)) return mod.operand0;
        return null;
    }

    /**
        The constant multiplier of a term, or 1 if it has none.
    **/
    protected static long coefficient (Operator term)
    {
        if (term instanceof Product)
        {
            Constant c = ((Product) term).constantFactor ();
            if (c != null) return c.value;
        }
        return 1;
    }

    /**
        A term without its constant multiplier.
    **/
    protected static Operator rest (Operator term)
    {
        if (term instanceof Product)
        {
            Product p = (Product) term;
            Constant c = p.constantFactor ();
            if (c != null) return p.withoutFactor (c);
        }
        return term;
    }

    protected static boolean isZero (Operator e)
    {
        return e instanceof Constant  &&  ((Constant) e).value == 0;
    }

    /**
        @return The constant term, or zero if there is none.
    **/
    public Constant constantTerm ()
    {
        long result = 0;
        for (Operator t : operands) if (t instanceof Constant) result += ((Constant) t).value;
        if (result == 0) return Constant.ZERO;
        return new Constant (result);
    }

    /**
        Removes the given terms. Removing terms creates no new opportunity for simplification,
        so the remainder of a simplified sum is built without going through the rules again.
        @return The remaining sum, a single term, or zero if nothing remains.
    **/
    public Operator withoutTerms (List<Operator> removed)
    {
        List<Operator> rest = new ArrayList<Operator> (operands);
        for (Operator r : removed) rest.remove (r);
        if (! simplified) return new Sum (rest).simplify ();
        return canonical (rest, Constant.ZERO);
    }

    public Operator withoutTerm (Operator removed)
    {
        List<Operator> list = new ArrayList<Operator> ();
        list.add (removed);
        return withoutTerms (list);
    }

    public double evalDouble ()
    {
        double result = 0;
        for (Operator t : operands) result += t.evalDouble ();
        return result;
    }

    public Operator min ()
    {
        Operator result = Constant.ZERO;
        for (Operator t : operands) result = result.add (t.min ());
        return result;
    }

    public Operator max ()
    {
        Operator result = Constant.ZERO;
        for (Operator t : operands) result = result.add (t.max ());
        return result;
    }
}
