package nl.pim16aap2.beacon.runtime.event;

import nl.pim16aap2.beacon.runtime.ClientProcessHandle;

/**
 * Published when a tracked client process has exited.
 *
 * @param handle
 *     The handle of the process that exited.
 * @param exitCode
 *     The exit code of the process.
 * @param requested
 *     Whether the exit was caused by a stop request rather than by the client itself.
 */
public record ClientStoppedEvent(
    ClientProcessHandle handle,
    int exitCode,
    boolean requested
)
{
}
