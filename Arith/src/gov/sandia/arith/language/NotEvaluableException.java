/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.arith.language;

/**
    Signals that an expression, or a bound it needs, cannot be resolved to a concrete integer
    with the information at hand. This is a control signal that callers with a fallback catch
    locally, so it carries no stack trace.
**/
public class NotEvaluableException extends EvaluationException
{
    public NotEvaluableException (String msg)
    {
        super (msg, false);
    }
}
