/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
    N-ary node for an associative and commutative operator.
    The operand list is flat once simplified: no operand is a node of the same kind, and there are
    at least two operands. The digest XORs the operands, so it does not depend on their order.
**/
public abstract class OperatorAssociative extends Operator
{
    public final List<Operator> operands;

    public OperatorAssociative (List<Operator> operands)
    {
        this.operands = Collections.unmodifiableList (new ArrayList<Operator> (operands));
    }

    public OperatorAssociative (Operator... operands)
    {
        this (Arrays.asList (operands));
    }

    public Operator[] operands ()
    {
        return operands.toArray (new Operator[operands.size ()]);
    }

    public Operator create (Operator[] operands)
    {
        return create (Arrays.asList (operands));
    }

    public abstract Operator create (List<Operator> operands);

    /**
        Builds a node from operands that are already known to be in canonical form, for example
        a subset of the operands of a simplified node. Collapses the trivial cases, so the result
        need not be of this kind. Bypasses the rule table.
        @param identity The value of an empty list.
    **/
    protected Operator canonical (List<Operator> operands, Operator identity)
    {
        if (operands.isEmpty ()) return identity;
        if (operands.size () == 1) return operands.get (0);
        Operator result = create (operands);
        result.simplified = true;
        return result;
    }

    protected abstract int salt ();

    protected int computeDigest ()
    {
        int result = salt ();
        for (Operator o : operands) result ^= mix (o.digest ());
        return result;
    }

    /**
        Shallow membership test. Operator.contains() searches the whole tree.
    **/
    public boolean hasOperand (Operator operand)
    {
        return operands.contains (operand);
    }

    /**
        Expands every operand that is itself a node of the same kind.
    **/
    protected List<Operator> flatten (Operator[] operands)
    {
        List<Operator> result = new ArrayList<Operator> ();
        for (Operator o : operands)
        {
            if (o.getClass () == getClass ()) result.addAll (((OperatorAssociative) o).operands);
            else                              result.add (o);
        }
        return result;
    }

    /**
        @return true if the list holds exactly the given operands, in the same order and as the same objects.
    **/
    protected static boolean same (List<Operator> list, Operator[] operands)
    {
        if (list.size () != operands.length) return false;
        for (int i = 0; i < operands.length; i++) if (list.get (i) != operands[i]) return false;
        return true;
    }

    protected void sanityCheck ()
    {
        assertTrue (operands.size () > 1, name () + " should have at least two operands");
        for (Operator o : operands) assertTrue (o.getClass () != getClass (), name () + " cannot contain a " + name ());
    }

    public boolean equalsStructure (Operator that)
    {
        if (this == that) return true;
        if (that == null  ||  getClass () != that.getClass ()) return false;
        return equalsMultiset (operands, ((OperatorAssociative) that).operands);
    }
}
