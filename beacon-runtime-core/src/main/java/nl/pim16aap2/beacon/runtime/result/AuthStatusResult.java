package nl.pim16aap2.beacon.runtime.result;

import nl.pim16aap2.beacon.runtime.CredentialFreshness;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * A snapshot of the stored credentials without touching the network.
 *
 * @param authenticated
 *     Whether a credential record is present and not expired.
 * @param playerName
 *     The stored player name.
 * @param playerId
 *     The stored player id.
 * @param age
 *     The age of the record.
 * @param freshness
 *     The freshness state of the record, or {@code null} when no record is present.
 * @param refreshDue
 *     Whether the next {@code ensureValid} call would try a silent refresh.
 */
public record AuthStatusResult(
    boolean authenticated,
    @Nullable String playerName,
    @Nullable String playerId,
    @Nullable Duration age,
    @Nullable CredentialFreshness freshness,
    boolean refreshDue
) implements OperationResult
{
    public static AuthStatusResult notAuthenticated()
    {
        return new AuthStatusResult(false, null, null, null, null, false);
    }

    @Override
    public boolean success()
    {
        return true;
    }

    @Override
    public @Nullable String error()
    {
        return null;
    }

    @Override
    public boolean requiresAuth()
    {
        return !authenticated;
    }
}
