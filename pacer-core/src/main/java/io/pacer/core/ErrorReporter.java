package io.pacer.core;

/**
 * Receives errors that background threads catch and ignore, for forwarding to an
 * external error tracker.
 */
public interface ErrorReporter
{
    void reportUncaughtError(Throwable error);

    static ErrorReporter empty()
    {
        return new ErrorReporter()
        {
            @Override
            public void reportUncaughtError(Throwable error)
            { }
        };
    }
}
