package io.plangraph.core.notation;

import static java.util.Locale.ENGLISH;

/**
 * Syntax error in one of the text notations.
 */
public class NotationException
        extends RuntimeException
{
    private final int line;
    private final int column;

    public NotationException(String message, int line, int column)
    {
        super(String.format(ENGLISH, "%s (line %d, column %d)", message, line, column));
        this.line = line;
        this.column = column;
    }

    public NotationException(String message, Throwable cause)
    {
        super(message, cause);
        this.line = 0;
        this.column = 0;
    }

    public int getLine()
    {
        return line;
    }

    public int getColumn()
    {
        return column;
    }
}
