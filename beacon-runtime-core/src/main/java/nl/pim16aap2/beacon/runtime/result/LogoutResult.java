package nl.pim16aap2.beacon.runtime.result;

import org.jspecify.annotations.Nullable;

/**
 * The outcome of discarding the stored credentials.
 *
 * @param success
 *     Whether the credentials are gone from memory and disk.
 * @param error
 *     The failure description.
 */
public record LogoutResult(
    boolean success,
    @Nullable String error
) implements OperationResult
{
    public static LogoutResult loggedOut()
    {
        return new LogoutResult(true, null);
    }

    public static LogoutResult failure(String error)
    {
        return new LogoutResult(false, error);
    }
}
