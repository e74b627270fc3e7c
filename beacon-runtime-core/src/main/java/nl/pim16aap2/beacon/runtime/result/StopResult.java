package nl.pim16aap2.beacon.runtime.result;

import org.jspecify.annotations.Nullable;

/**
 * The outcome of stopping the client.
 *
 * @param success
 *     Whether no client process is running anymore.
 * @param error
 *     The failure description.
 * @param wasRunning
 *     Whether a process was running when the stop was requested.
 * @param forced
 *     Whether the process had to be killed forcibly.
 */
public record StopResult(
    boolean success,
    @Nullable String error,
    boolean wasRunning,
    boolean forced
) implements OperationResult
{
    public static StopResult notRunning()
    {
        return new StopResult(true, null, false, false);
    }

    public static StopResult stopped(boolean forced)
    {
        return new StopResult(true, null, true, forced);
    }

    public static StopResult failure(String error)
    {
        return new StopResult(false, error, true, false);
    }
}
