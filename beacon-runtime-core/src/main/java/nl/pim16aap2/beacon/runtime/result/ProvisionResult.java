package nl.pim16aap2.beacon.runtime.result;

import nl.pim16aap2.beacon.runtime.VersionProfile;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The outcome of provisioning a version.
 * <p>
 * A provisioning run that resolved the profile succeeds even when individual files failed; those failures are listed
 * in {@link #errors()}.
 *
 * @param success
 *     Whether the profile was resolved and its files were processed.
 * @param error
 *     The failure description.
 * @param profile
 *     The resolved profile.
 * @param successCount
 *     The number of files that are present on disk after the run, downloaded or already there.
 * @param skippedCount
 *     The number of files that were already present and not downloaded again.
 * @param extractedCount
 *     The number of native binaries extracted.
 * @param errors
 *     The failed files and archives.
 */
public record ProvisionResult(
    boolean success,
    @Nullable String error,
    @Nullable VersionProfile profile,
    int successCount,
    int skippedCount,
    int extractedCount,
    List<ItemFailure> errors
) implements OperationResult
{
    public ProvisionResult
    {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ProvisionResult failure(String error)
    {
        return new ProvisionResult(false, error, null, 0, 0, 0, List.of());
    }
}
