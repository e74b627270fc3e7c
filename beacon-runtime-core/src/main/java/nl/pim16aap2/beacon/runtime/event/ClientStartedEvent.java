package nl.pim16aap2.beacon.runtime.event;

import nl.pim16aap2.beacon.runtime.ClientProcessHandle;

/**
 * Published once a client process survived its start grace window.
 *
 * @param handle
 *     The handle of the started process.
 */
public record ClientStartedEvent(ClientProcessHandle handle)
{
}
