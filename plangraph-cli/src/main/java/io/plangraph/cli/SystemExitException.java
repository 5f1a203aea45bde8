package io.plangraph.cli;

import com.google.common.base.Optional;

/**
 * Ends a command with an exit code instead of a failure report. Without a
 * message the command stops successfully, as after printing usage.
 */
public class SystemExitException
        extends Exception
{
    private static final int EXIT_OK = 0;
    private static final int EXIT_ERROR = 1;

    private final int code;

    private SystemExitException(int code, String message)
    {
        super(message, null, false, false);
        this.code = code;
    }

    public static SystemExitException systemExit(String errorMessage)
    {
        if (errorMessage == null) {
            return new SystemExitException(EXIT_OK, null);
        }
        return new SystemExitException(EXIT_ERROR, errorMessage);
    }

    public int getCode()
    {
        return code;
    }

    public Optional<String> getErrorMessage()
    {
        return Optional.fromNullable(getMessage());
    }
}
