package nl.pim16aap2.beacon.runtime;

import java.time.Instant;

/**
 * Identifies a spawned client process.
 *
 * @param pid
 *     The process id.
 * @param versionId
 *     The profile the process was launched with.
 * @param startedAt
 *     The moment the process was spawned.
 */
public record ClientProcessHandle(
    long pid,
    String versionId,
    Instant startedAt
)
{
}
