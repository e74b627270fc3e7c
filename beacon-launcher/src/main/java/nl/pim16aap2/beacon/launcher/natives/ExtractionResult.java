package nl.pim16aap2.beacon.launcher.natives;

import nl.pim16aap2.beacon.runtime.result.ItemFailure;

import java.util.List;

/**
 * The outcome of extracting the native libraries of a profile.
 *
 * @param extractedCount
 *     The number of files written to the natives directory.
 * @param errors
 *     The archives that could not be extracted.
 */
public record ExtractionResult(
    int extractedCount,
    List<ItemFailure> errors
)
{
    public ExtractionResult
    {
        errors = List.copyOf(errors);
    }
}
