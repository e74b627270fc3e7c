package nl.pim16aap2.beacon.runtime.result;

/**
 * A single failed unit of a batch operation.
 *
 * @param item
 *     What failed, e.g. a file name or library coordinate.
 * @param reason
 *     Why it failed.
 */
public record ItemFailure(
    String item,
    String reason
)
{
}
