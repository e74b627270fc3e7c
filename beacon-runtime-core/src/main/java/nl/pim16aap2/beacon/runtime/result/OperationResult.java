package nl.pim16aap2.beacon.runtime.result;

import org.jspecify.annotations.Nullable;

/**
 * Common shape of every result returned by an exposed launcher operation.
 */
public interface OperationResult
{
    /**
     * @return whether the operation succeeded.
     */
    boolean success();

    /**
     * @return a human-readable description of the failure, or {@code null} on success.
     */
    @Nullable String error();

    /**
     * @return whether the caller has to run an interactive authentication before retrying.
     */
    default boolean requiresAuth()
    {
        return false;
    }
}
