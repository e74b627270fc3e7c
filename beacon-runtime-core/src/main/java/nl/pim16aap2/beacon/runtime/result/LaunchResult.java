package nl.pim16aap2.beacon.runtime.result;

import nl.pim16aap2.beacon.runtime.ClientProcessHandle;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of launching the client.
 *
 * @param success
 *     Whether the client was started and survived the start grace window.
 * @param error
 *     The failure description.
 * @param requiresAuth
 *     Whether the launch was refused because the user has to authenticate.
 * @param startFailure
 *     Whether the process was spawned but exited during the start grace window.
 * @param handle
 *     The handle of the running process.
 */
public record LaunchResult(
    boolean success,
    @Nullable String error,
    boolean requiresAuth,
    boolean startFailure,
    @Nullable ClientProcessHandle handle
) implements OperationResult
{
    public static LaunchResult started(ClientProcessHandle handle)
    {
        return new LaunchResult(true, null, false, false, handle);
    }

    public static LaunchResult authRequired(String error)
    {
        return new LaunchResult(false, error, true, false, null);
    }

    public static LaunchResult startFailure(String error)
    {
        return new LaunchResult(false, error, false, true, null);
    }

    public static LaunchResult failure(String error)
    {
        return new LaunchResult(false, error, false, false, null);
    }
}
