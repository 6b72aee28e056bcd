/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

/**
    Thrown when an expression is nested too deeply to simplify within the available call stack.
**/
public class ExpressionDepthException extends RuntimeException
{
    public ExpressionDepthException (String msg, Throwable cause)
    {
        super (msg, cause);
    }
}
