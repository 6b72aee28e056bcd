/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

/**
    Node with two ordered operands. The digest complements the second operand,
    so that f(a,b) and f(b,a) almost certainly differ.
**/
public abstract class OperatorBinary extends Operator
{
    public final Operator operand0;
    public final Operator operand1;

    public OperatorBinary (Operator operand0, Operator operand1)
    {
        this.operand0 = operand0;
        this.operand1 = operand1;
    }

    public Operator[] operands ()
    {
        return new Operator[] {operand0, operand1};
    }

    public Operator create (Operator[] operands)
    {
        return create (operands[0], operands[1]);
    }

    public abstract Operator create (Operator operand0, Operator operand1);

    protected Operator rules (Operator[] operands)
    {
        return rules (operands[0], operands[1]);
    }

    protected Operator rules (Operator operand0, Operator operand1)
    {
        return null;
    }

    /**
        Salt that identifies the node kind in the digest.
    **/
    protected abstract int salt ();

    /**
        The second operand is complemented and rotated, since a plain complement would still
        give f(a,b) the same digest as f(b,a).
    **/
    protected int computeDigest ()
    {
        return salt () ^ operand0.digest () ^ Integer.rotateLeft (~operand1.digest (), 1);
    }
}
