package nl.pim16aap2.beacon.launcher.download;

import nl.pim16aap2.beacon.runtime.result.ItemFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * The outcome of fetching a batch of files.
 *
 * @param successCount
 *     The number of files present on disk after the batch, downloaded or already there.
 * @param skippedCount
 *     The number of files that were already present and were not downloaded.
 * @param errors
 *     The files that could not be fetched.
 */
public record FetchResult(
    int successCount,
    int skippedCount,
    List<ItemFailure> errors
)
{
    public static final FetchResult EMPTY = new FetchResult(0, 0, List.of());

    public FetchResult
    {
        errors = List.copyOf(errors);
    }

    public FetchResult plus(FetchResult other)
    {
        final List<ItemFailure> combinedErrors = new ArrayList<>(errors);
        combinedErrors.addAll(other.errors());
        return new FetchResult(
            successCount + other.successCount(),
            skippedCount + other.skippedCount(),
            combinedErrors
        );
    }
}
