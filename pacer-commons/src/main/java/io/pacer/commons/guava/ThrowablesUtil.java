package io.pacer.commons.guava;

import com.google.common.base.Throwables;

/**
 * Replacements of the deprecated rethrow helpers of {@link Throwables}.
 */
public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows unchecked throwables as-is and wraps checked ones in a RuntimeException.
     * Declared to return an exception so that callers can write {@code throw propagate(ex)}.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }
}
