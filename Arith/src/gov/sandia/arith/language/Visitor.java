/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

/**
    Callback for Operator.visit(). Each node is offered before its operands.
    The default accepts every node and so walks the whole tree.
**/
public class Visitor
{
    /**
        @return false to leave the operands of op unvisited.
    **/
    public boolean visit (Operator op)
    {
        return true;
    }
}
