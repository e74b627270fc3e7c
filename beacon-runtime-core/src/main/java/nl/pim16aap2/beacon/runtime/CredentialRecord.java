package nl.pim16aap2.beacon.runtime;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The result of a successful authentication, including whatever is needed to attempt a refresh later.
 *
 * @param accessToken
 *     The game-service access token.
 * @param identityRefreshToken
 *     The identity-provider refresh token. When absent, the record can only be validated, not refreshed.
 * @param identityAccessToken
 *     The last identity-provider access token, if known.
 * @param clientToken
 *     The client token identifying this launcher installation.
 * @param playerId
 *     The player id in canonical dashed UUID form.
 * @param playerName
 *     The player display name.
 * @param savedAt
 *     The moment the record was created by an interactive authentication.
 * @param lastRefresh
 *     The moment of the last successful silent refresh, if any.
 */
public record CredentialRecord(
    String accessToken,
    @Nullable String identityRefreshToken,
    @Nullable String identityAccessToken,
    String clientToken,
    String playerId,
    String playerName,
    Instant savedAt,
    @Nullable Instant lastRefresh
)
{
    private static final Pattern UNDASHED_UUID = Pattern.compile("[0-9a-fA-F]{32}");

    public CredentialRecord
    {
        Objects.requireNonNull(accessToken, "accessToken may not be null.");
        Objects.requireNonNull(clientToken, "clientToken may not be null.");
        Objects.requireNonNull(playerId, "playerId may not be null.");
        Objects.requireNonNull(playerName, "playerName may not be null.");
        Objects.requireNonNull(savedAt, "savedAt may not be null.");
        if (accessToken.isBlank())
            throw new IllegalArgumentException("accessToken may not be blank.");
        playerId = formatPlayerId(playerId);
    }

    /**
     * Gets the moment from which the age of this record is measured.
     *
     * @return the last refresh moment, or the creation moment if the record was never refreshed.
     */
    public Instant trustedSince()
    {
        return lastRefresh == null ? savedAt : lastRefresh;
    }

    /**
     * Gets the age of this record at the given moment.
     *
     * @param now
     *     The current moment.
     * @return the time elapsed since {@link #trustedSince()}, never negative.
     */
    public Duration age(Instant now)
    {
        final Duration age = Duration.between(trustedSince(), now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    /**
     * Checks whether this record carries a fragment that allows a silent refresh.
     *
     * @return {@code true} if an identity-provider refresh token is present.
     */
    public boolean canRefresh()
    {
        return identityRefreshToken != null && !identityRefreshToken.isBlank();
    }

    /**
     * Creates a copy of this record with the tokens of a successful silent refresh.
     * <p>
     * The existing identity refresh token is kept when the provider did not issue a new one.
     *
     * @param newAccessToken
     *     The new game-service access token.
     * @param newIdentityRefreshToken
     *     The new identity refresh token, or {@code null} to keep the current one.
     * @param newIdentityAccessToken
     *     The new identity access token.
     * @param refreshedAt
     *     The moment of the refresh.
     * @return the refreshed record.
     */
    public CredentialRecord refreshed(
        String newAccessToken,
        @Nullable String newIdentityRefreshToken,
        @Nullable String newIdentityAccessToken,
        Instant refreshedAt)
    {
        return new CredentialRecord(
            newAccessToken,
            newIdentityRefreshToken == null ? identityRefreshToken : newIdentityRefreshToken,
            newIdentityAccessToken,
            clientToken,
            playerId,
            playerName,
            savedAt,
            refreshedAt
        );
    }

    /**
     * Formats a player id as a dashed UUID if it was supplied in the compact 32 character form.
     *
     * @param playerId
     *     The player id to format.
     * @return the player id in {@code 8-4-4-4-12} form, or the input if it is not a compact UUID.
     */
    public static String formatPlayerId(String playerId)
    {
        if (!UNDASHED_UUID.matcher(playerId).matches())
            return playerId;

        final String lower = playerId.toLowerCase(Locale.ROOT);
        return "%s-%s-%s-%s-%s".formatted(
            lower.substring(0, 8),
            lower.substring(8, 12),
            lower.substring(12, 16),
            lower.substring(16, 20),
            lower.substring(20)
        );
    }

    @Override
    public String toString()
    {
        return "CredentialRecord[playerId=%s, playerName=%s, savedAt=%s, lastRefresh=%s, canRefresh=%s]"
            .formatted(playerId, playerName, savedAt, lastRefresh, canRefresh());
    }
}
