package io.pacer.cli;

/**
 * Ends a command with an exit status. Main prints the message, if any, as an error.
 */
public class SystemExitException
        extends Exception
{
    static final int SUCCESS = 0;
    static final int FAILURE = 1;

    private final int code;

    private SystemExitException(int code, String message)
    {
        super(message);
        this.code = code;
    }

    /**
     * Exits with {@link #FAILURE} and the message, or with {@link #SUCCESS} after help
     * was shown if the message is null.
     */
    public static SystemExitException systemExit(String errorMessage)
    {
        return errorMessage == null
            ? new SystemExitException(SUCCESS, null)
            : new SystemExitException(FAILURE, errorMessage);
    }

    /**
     * Exits with {@link #FAILURE} when the command already printed why.
     */
    public static SystemExitException quietFailure()
    {
        return new SystemExitException(FAILURE, null);
    }

    public int getCode()
    {
        return code;
    }
}
