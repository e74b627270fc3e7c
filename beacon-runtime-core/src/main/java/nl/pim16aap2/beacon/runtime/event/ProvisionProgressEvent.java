package nl.pim16aap2.beacon.runtime.event;

/**
 * Progress of a provisioning phase.
 *
 * @param versionId
 *     The version being provisioned.
 * @param phase
 *     The phase, e.g. {@code libraries} or {@code assets}.
 * @param completed
 *     The number of finished items in this phase.
 * @param total
 *     The total number of items in this phase.
 */
public record ProvisionProgressEvent(
    String versionId,
    String phase,
    int completed,
    int total
)
{
}
