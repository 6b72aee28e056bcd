/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import gov.sandia.arith.db.Settings;
import gov.sandia.arith.language.function.IfThenElse;
import gov.sandia.arith.language.operator.Divide;
import gov.sandia.arith.language.operator.Modulo;
import gov.sandia.arith.language.operator.Power;
import gov.sandia.arith.language.operator.Product;
import gov.sandia.arith.language.operator.Sum;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

/**
    Base class of the integer expression tree.

    Nodes are immutable once built. Equality is digest equality: every node kind mixes a fixed salt
    with the digests of its operands, so two structurally equal trees compare equal regardless of
    how they were built. A collision between structurally different trees is possible but unlikely.
    Use equalsStructure() where a strict comparison is needed.

    The builders (add(), multiply(), pow() and so on) never return a raw node. They construct the node
    and route it through simplify(), which first simplifies the operands, then applies the rule table of
    the node kind until no further rule fires.
**/
public abstract class Operator
{
    private static Logger logger = Logger.getLogger (Operator.class);

    /**
        Set on nodes that have already passed through their rule table. Leaves are always simplified.
        Only the code that constructs a node may set this.
    **/
    protected boolean simplified;

    protected int     digest;
    protected boolean hashed;

    public interface Condition
    {
        /**
            @return true to stop the traversal.
        **/
        public boolean test (Operator op);
    }

    /**
        Short name of the node kind, used in diagnostics.
    **/
    public abstract String name ();

    // Structure -------------------------------------------------------------

    /**
        @return A fresh array holding the operands of this node, in order. Leaves return an empty array.
        Modifying the array does not affect this node.
    **/
    public boolean isSimplified ()
    {
        return simplified;
    }

    public Operator[] operands ()
    {
        return new Operator[0];
    }

    /**
        Constructs an unsimplified node of the same kind as this one from the given operands.
        Leaves ignore the operands and return themselves.
    **/
    public Operator create (Operator[] operands)
    {
        return this;
    }

    /**
        Constructs a node of the same kind from the given operands, then simplifies it.
    **/
    public Operator rebuild (Operator[] operands)
    {
        return create (operands).simplify ();
    }

    // Simplification --------------------------------------------------------

    /**
        Applies the rule table of this node kind to a set of already-simplified operands.
        @return The reduced expression, or null if no rule applies.
    **/
    protected Operator rules (Operator[] operands)
    {
        return null;
    }

    /**
        Verifies invariants that a node marked as simplified must hold.
        @throws IllegalStateException if an invariant is violated.
    **/
    protected void sanityCheck ()
    {
    }

    protected void assertTrue (boolean condition, String reason)
    {
        if (! condition) throw new IllegalStateException ("Sanity check failed: " + reason + " in " + this);
    }

    /**
        Brings this expression to canonical form.
        Operands are simplified first, then the rule table of this node kind runs. When a rule fires,
        its result is simplified in turn. When none fires, the canonical node is built and marked simplified.
        If simplification is disabled in the settings, the node is returned as is.
        @throws ExpressionDepthException if the tree is too deep to process on the current call stack.
    **/
    public Operator simplify ()
    {
        if (simplified  ||  ! Settings.simplify ()) return this;
        try
        {
            Operator[] reduced = operands ();
            for (int i = 0; i < reduced.length; i++) reduced[i] = reduced[i].simplify ();

            Operator result = rules (reduced);
            if (result != null)
            {
                if (logger.isTraceEnabled ()) logger.trace (name () + " rule: " + this + " --> " + result);
                return result.simplify ();
            }

            result = create (reduced);
            result.simplified = true;
            if (Settings.sanityCheck ()) result.sanityCheck ();
            return result;
        }
        catch (StackOverflowError e)
        {
            throw new ExpressionDepthException ("Expression too deep to simplify: " + name (), e);
        }
    }

    // Builders --------------------------------------------------------------

    public Operator add (Operator that)
    {
        return new Sum (this, that).simplify ();
    }

    public Operator add (long that)
    {
        return add (new Constant (that));
    }

    /**
        Subtraction is addition of the negated right-hand side.
    **/
    public Operator subtract (Operator that)
    {
        return add (that.multiply (Constant.MINUS_ONE));
    }

    public Operator subtract (long that)
    {
        return subtract (new Constant (that));
    }

    public Operator multiply (Operator that)
    {
        return new Product (this, that).simplify ();
    }

    public Operator multiply (long that)
    {
        return multiply (new Constant (that));
    }

    /**
        Truncating integer division.
        @throws ArithmeticException if the divisor is the literal zero.
    **/
    public Operator divide (Operator that)
    {
        return new Divide (this, that).simplify ();
    }

    public Operator divide (long that)
    {
        return divide (new Constant (that));
    }

    /**
        Remainder of truncating division, so that (a / b) * b + a % b == a.
        @throws ArithmeticException if the divisor is the literal zero.
    **/
    public Operator modulo (Operator that)
    {
        return new Modulo (this, that).simplify ();
    }

    public Operator modulo (long that)
    {
        return modulo (new Constant (that));
    }

    /**
        @throws ArithmeticException if the base is the literal zero and the exponent a negative constant.
    **/
    public Operator pow (Operator that)
    {
        return new Power (this, that).simplify ();
    }

    public Operator pow (long that)
    {
        return pow (new Constant (that));
    }

    /**
        Division in the rationals. Rather than introduce a Divide node, the divisor is folded in
        as a reciprocal factor unless the quotient is exact.
    **/
    public Operator ordinalDivide (Operator that)
    {
        if (that instanceof Constant  &&  ((Constant) that).value == 1) return this;
        if (this instanceof Constant  &&  that instanceof Constant)
        {
            long x = ((Constant) this).value;
            long y = ((Constant) that).value;
            if (y != 0  &&  x % y == 0) return new Constant (x / y);
        }
        if (equals (that)) return Constant.ONE;
        if (equals (that.multiply (Constant.MINUS_ONE))) return Constant.MINUS_ONE;
        return multiply (that.pow (Constant.MINUS_ONE));
    }

    public Operator ordinalDivide (long that)
    {
        return ordinalDivide (new Constant (that));
    }

    public Predicate lt (Operator that)
    {
        return new Predicate (this, that, Predicate.Comparison.LT);
    }

    public Predicate gt (Operator that)
    {
        return new Predicate (this, that, Predicate.Comparison.GT);
    }

    public Predicate le (Operator that)
    {
        return new Predicate (this, that, Predicate.Comparison.LE);
    }

    public Predicate ge (Operator that)
    {
        return new Predicate (this, that, Predicate.Comparison.GE);
    }

    public Predicate eq (Operator that)
    {
        return new Predicate (this, that, Predicate.Comparison.EQ);
    }

    public Predicate ne (Operator that)
    {
        return new Predicate (this, that, Predicate.Comparison.NE);
    }

    public Predicate lt (long that)
    {
        return lt (new Constant (that));
    }

    public Predicate gt (long that)
    {
        return gt (new Constant (that));
    }

    // Traversal -------------------------------------------------------------

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator o : operands ()) o.visit (visitor);
    }

    /**
        Pre-order traversal that stops as soon as the condition holds.
        @return true if the condition held for some node.
    **/
    public boolean visitUntil (Condition condition)
    {
        if (condition.test (this)) return true;
        for (Operator o : operands ()) if (o.visitUntil (condition)) return true;
        return false;
    }

    /**
        Rewrites this tree. Where the transformer declines a node, its operands are transformed
        and the node is rebuilt through the simplifier.
    **/
    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        Operator[] o = operands ();
        if (o.length == 0) return this;
        for (int i = 0; i < o.length; i++) o[i] = o[i].transform (transformer);
        return rebuild (o);
    }

    /**
        Replaces every subtree that equals a key of the map with the associated value.
        Rebuilt nodes go through the simplifier, so the result is simplified.
    **/
    public Operator substitute (Map<Operator,Operator> bindings)
    {
        return transform (new Substitute (bindings));
    }

    public Operator substitute (Operator from, Operator to)
    {
        Map<Operator,Operator> bindings = new HashMap<Operator,Operator> ();
        bindings.put (from, to);
        return substitute (bindings);
    }

    public boolean contains (final Operator target)
    {
        return visitUntil (new Condition ()
        {
            public boolean test (Operator op)
            {
                return op.equals (target);
            }
        });
    }

    /**
        @return The distinct variables that appear anywhere in this tree, in order of first appearance.
    **/
    public Set<Variable> variables ()
    {
        final Set<Variable> result = new LinkedHashSet<Variable> ();
        visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof Variable) result.add ((Variable) op);
                return true;
            }
        });
        return result;
    }

    /**
        @return The distinct opaque function placeholders in this tree, in order of first appearance.
    **/
    public Set<ArithFunction> functions ()
    {
        final Set<ArithFunction> result = new LinkedHashSet<ArithFunction> ();
        visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof ArithFunction) result.add ((ArithFunction) op);
                return true;
            }
        });
        return result;
    }

    // Evaluation ------------------------------------------------------------

    /**
        Determines whether eval() has any chance of success. Free variables, opaque functions,
        conditionals and the Unknown sentinel all block evaluation.
    **/
    public boolean isEvaluable ()
    {
        return ! visitUntil (new Condition ()
        {
            public boolean test (Operator op)
            {
                return op instanceof Unknown  ||  op instanceof ArithFunction  ||  op instanceof Variable  ||  op instanceof IfThenElse;
            }
        });
    }

    /**
        Fully evaluates this expression.
        Evaluation goes through double precision, so very large constants may lose precision.
        @throws NotEvaluableException if the tree is not evaluable or does not land on an exact integer.
    **/
    public long eval ()
    {
        if (! isEvaluable ()) throw new NotEvaluableException ("Not evaluable: " + this);
        double result = evalDouble ();
        if (result != Math.rint (result)  ||  Math.abs (result) >= 0x1p63) throw new NotEvaluableException ("Not an integer: " + this);
        return (long) result;
    }

    /**
        Recursive worker for eval(). Node kinds without a numeric meaning throw NotEvaluableException.
    **/
    public double evalDouble ()
    {
        throw new NotEvaluableException ("Not evaluable: " + this);
    }

    /**
        Simplifies this expression and requires the result to be a constant.
        @throws NotEvaluableException if the result is anything else.
    **/
    public long toInt ()
    {
        return asConstant ().value;
    }

    public Constant asConstant ()
    {
        Operator s = simplify ();
        if (s instanceof Constant) return (Constant) s;
        throw new NotEvaluableException ("Not a constant: " + s);
    }

    // Bounds ----------------------------------------------------------------

    /**
        Lower bound formula of this node, derived from the bounds of its operands.
        Unknown when the node kind has no formula.
    **/
    public Operator min ()
    {
        return Unknown.instance;
    }

    /**
        Upper bound formula of this node.
        @see #min()
    **/
    public Operator max ()
    {
        return Unknown.instance;
    }

    // Equality --------------------------------------------------------------

    public int digest ()
    {
        if (! hashed)
        {
            digest = computeDigest ();
            hashed = true;
        }
        return digest;
    }

    /**
        Avalanche step from MurmurHash3 (fmix32). Leaf digests and the operand digests of commutative
        nodes pass through this, so that XOR-combining them does not cancel linearly related values.
    **/
    public static int mix (int h)
    {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    protected abstract int computeDigest ();

    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (! (o instanceof Operator)) return false;
        return digest () == ((Operator) o).digest ();
    }

    public int hashCode ()
    {
        return digest ();
    }

    /**
        Strict recursive comparison, for debugging digest collisions.
        Sums and products compare as multisets of operands. Other nodes compare operands in order.
    **/
    public boolean equalsStructure (Operator that)
    {
        if (this == that) return true;
        if (that == null  ||  getClass () != that.getClass ()) return false;
        if (! equalsLeaf (that)) return false;
        Operator[] a = operands ();
        Operator[] b = that.operands ();
        if (a.length != b.length) return false;
        for (int i = 0; i < a.length; i++) if (! a[i].equalsStructure (b[i])) return false;
        return true;
    }

    /**
        Compares the parts of this node that are not operands.
    **/
    protected boolean equalsLeaf (Operator that)
    {
        return true;
    }

    /**
        Helper for multiset comparison of operand lists.
    **/
    protected static boolean equalsMultiset (List<Operator> a, List<Operator> b)
    {
        if (a.size () != b.size ()) return false;
        List<Operator> remaining = new ArrayList<Operator> (b);
        for (Operator x : a)
        {
            boolean found = false;
            for (int i = 0; i < remaining.size (); i++)
            {
                if (x.equalsStructure (remaining.get (i)))
                {
                    remaining.remove (i);
                    found = true;
                    break;
                }
            }
            if (! found) return false;
        }
        return true;
    }

    /**
        Diagnostic rendering. Not intended for code generation.
    **/
    public String toString ()
    {
        Operator[] o = operands ();
        StringBuilder result = new StringBuilder (name ());
        result.append ("(");
        for (int i = 0; i < o.length; i++)
        {
            if (i > 0) result.append (",");
            result.append (o[i]);
        }
        result.append (")");
        return result.toString ();
    }
}
