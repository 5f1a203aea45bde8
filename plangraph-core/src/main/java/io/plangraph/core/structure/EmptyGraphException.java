package io.plangraph.core.structure;

/**
 * Thrown when a graph without tasks is structured.
 */
public class EmptyGraphException
        extends RuntimeException
{
    public EmptyGraphException()
    {
        super("Empty graph");
    }
}
