package nl.pim16aap2.beacon.runtime.result;

import nl.pim16aap2.beacon.runtime.ClientProcessHandle;
import org.jspecify.annotations.Nullable;

/**
 * The liveness of the client process.
 *
 * @param running
 *     Whether a tracked client process is alive.
 * @param handle
 *     The handle of the running process, or {@code null} if none is running.
 */
public record StatusResult(
    boolean running,
    @Nullable ClientProcessHandle handle
) implements OperationResult
{
    public static StatusResult notRunning()
    {
        return new StatusResult(false, null);
    }

    public static StatusResult running(ClientProcessHandle handle)
    {
        return new StatusResult(true, handle);
    }

    @Override
    public boolean success()
    {
        return true;
    }

    @Override
    public @Nullable String error()
    {
        return null;
    }
}
