package io.plangraph.core.structure;

/**
 * Thrown when an expression tree is malformed: a composite without children,
 * or a task name that appears in more than one leaf.
 */
public class StructureException
        extends RuntimeException
{
    public StructureException(String message)
    {
        super(message);
    }

    public StructureException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
