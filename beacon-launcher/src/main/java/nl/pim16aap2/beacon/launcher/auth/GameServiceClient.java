package nl.pim16aap2.beacon.launcher.auth;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.LauncherEndpoints;
import nl.pim16aap2.beacon.launcher.net.JsonHttpClient;
import nl.pim16aap2.beacon.runtime.error.LauncherException;

import java.util.Map;
import java.util.Objects;

/**
 * Client for the game service, the last hop of the authorization chain.
 */
@Log
public final class GameServiceClient
{
    private final JsonHttpClient httpClient;
    private final LauncherEndpoints endpoints;

    public GameServiceClient(JsonHttpClient httpClient, LauncherEndpoints endpoints)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints may not be null.");
    }

    /**
     * Logs in with a broker token.
     *
     * @param brokerToken
     *     The token issued by the authorization broker.
     * @return the game-service access token.
     *
     * @throws LauncherException
     *     If the login was rejected or the service could not be reached.
     */
    public String login(XboxBrokerClient.BrokerToken brokerToken)
        throws LauncherException
    {
        final JsonNode root = httpClient.postJson(
            endpoints.gameLoginUri(),
            Map.of("identityToken", brokerToken.identityToken()),
            Map.of()
        );
        return MicrosoftIdentityClient.requireText(root, "access_token");
    }

    /**
     * Fetches the profile that belongs to an access token.
     *
     * @param accessToken
     *     The game-service access token.
     * @return the player profile.
     *
     * @throws LauncherException
     *     If the account has no profile or the service could not be reached.
     */
    public GameProfile profile(String accessToken)
        throws LauncherException
    {
        final JsonNode root = httpClient.getJson(endpoints.gameProfileUri(), bearer(accessToken));
        return new GameProfile(
            MicrosoftIdentityClient.requireText(root, "id"),
            MicrosoftIdentityClient.requireText(root, "name")
        );
    }

    /**
     * Checks whether the game service still accepts an access token.
     *
     * @param accessToken
     *     The access token to check.
     * @return {@link TokenValidation#VALID} if the profile endpoint answered with 200,
     * {@link TokenValidation#UNREACHABLE} if the service could not be reached or failed with a server error, and
     * {@link TokenValidation#REJECTED} otherwise.
     */
    public TokenValidation validate(String accessToken)
    {
        try
        {
            final int statusCode = httpClient.getStatus(endpoints.gameProfileUri(), bearer(accessToken));
            if (statusCode == 200)
                return TokenValidation.VALID;
            if (statusCode >= 500 || statusCode == 429)
                return TokenValidation.UNREACHABLE;
            log.fine(() -> "Game service rejected the cached access token with status " + statusCode + ".");
            return TokenValidation.REJECTED;
        }
        catch (LauncherException exception)
        {
            log.warning(() -> "Could not reach the game service to validate the access token: " +
                exception.getMessage());
            return TokenValidation.UNREACHABLE;
        }
    }

    private static Map<String, String> bearer(String accessToken)
    {
        return Map.of("Authorization", "Bearer " + accessToken);
    }

    /**
     * The outcome of validating an access token.
     */
    public enum TokenValidation
    {
        VALID,
        REJECTED,
        UNREACHABLE
    }

    /**
     * The player profile of an account.
     *
     * @param id
     *     The player id.
     * @param name
     *     The player name.
     */
    public record GameProfile(
        String id,
        String name
    )
    {
    }
}
