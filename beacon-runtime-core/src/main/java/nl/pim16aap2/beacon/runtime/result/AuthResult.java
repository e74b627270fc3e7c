package nl.pim16aap2.beacon.runtime.result;

import nl.pim16aap2.beacon.runtime.CredentialRecord;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of an authentication or credential validation.
 *
 * @param success
 *     Whether usable credentials are available.
 * @param error
 *     The failure description.
 * @param requiresAuth
 *     Whether the user has to authenticate interactively.
 * @param refreshed
 *     Whether a silent refresh was performed.
 * @param usedCache
 *     Whether the refresh failed and the existing token is used instead.
 * @param playerName
 *     The player name of the usable credentials.
 * @param playerId
 *     The player id of the usable credentials.
 */
public record AuthResult(
    boolean success,
    @Nullable String error,
    boolean requiresAuth,
    boolean refreshed,
    boolean usedCache,
    @Nullable String playerName,
    @Nullable String playerId
) implements OperationResult
{
    public static AuthResult valid(CredentialRecord credentials)
    {
        return new AuthResult(true, null, false, false, false, credentials.playerName(), credentials.playerId());
    }

    public static AuthResult refreshed(CredentialRecord credentials)
    {
        return new AuthResult(true, null, false, true, false, credentials.playerName(), credentials.playerId());
    }

    public static AuthResult cached(CredentialRecord credentials)
    {
        return new AuthResult(true, null, false, false, true, credentials.playerName(), credentials.playerId());
    }

    public static AuthResult authRequired(String error)
    {
        return new AuthResult(false, error, true, false, false, null, null);
    }

    public static AuthResult failure(String error)
    {
        return new AuthResult(false, error, false, false, false, null, null);
    }
}
