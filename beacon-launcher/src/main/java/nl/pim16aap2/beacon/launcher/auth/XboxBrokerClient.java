package nl.pim16aap2.beacon.launcher.auth;

import com.fasterxml.jackson.databind.JsonNode;
import nl.pim16aap2.beacon.launcher.LauncherEndpoints;
import nl.pim16aap2.beacon.launcher.net.JsonHttpClient;
import nl.pim16aap2.beacon.runtime.error.LauncherException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Client for the authorization broker, the second hop of the authorization chain.
 * <p>
 * The broker hop consists of two calls: the identity token is exchanged for a user token, which is then authorized
 * for the game service. The result is a service token together with the user hash the game service expects.
 */
public final class XboxBrokerClient
{
    private static final String USER_AUTH_RELYING_PARTY = "http://auth.xboxlive.com";
    private static final String GAME_SERVICE_RELYING_PARTY = "rp://api.minecraftservices.com/";
    private static final Map<String, String> HEADERS = Map.of("x-xbl-contract-version", "1");

    private final JsonHttpClient httpClient;
    private final LauncherEndpoints endpoints;

    public XboxBrokerClient(JsonHttpClient httpClient, LauncherEndpoints endpoints)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints may not be null.");
    }

    /**
     * Exchanges an identity access token for a game-service scoped broker token.
     *
     * @param identityAccessToken
     *     The access token issued by the identity provider.
     * @return the broker token.
     *
     * @throws LauncherException
     *     If either broker call fails.
     */
    public BrokerToken authorize(String identityAccessToken)
        throws LauncherException
    {
        final JsonNode userAuth = httpClient.postJson(
            endpoints.brokerUserAuthUri(),
            Map.of(
                "Properties", Map.of(
                    "AuthMethod", "RPS",
                    "SiteName", "user.auth.xboxlive.com",
                    "RpsTicket", "d=" + identityAccessToken
                ),
                "RelyingParty", USER_AUTH_RELYING_PARTY,
                "TokenType", "JWT"
            ),
            HEADERS
        );
        final String userToken = MicrosoftIdentityClient.requireText(userAuth, "Token");

        final JsonNode authorization = httpClient.postJson(
            endpoints.brokerAuthorizeUri(),
            Map.of(
                "Properties", Map.of(
                    "SandboxId", "RETAIL",
                    "UserTokens", List.of(userToken)
                ),
                "RelyingParty", GAME_SERVICE_RELYING_PARTY,
                "TokenType", "JWT"
            ),
            HEADERS
        );

        return new BrokerToken(
            MicrosoftIdentityClient.requireText(authorization, "Token"),
            extractUserHash(authorization)
        );
    }

    private static String extractUserHash(JsonNode authorization)
        throws LauncherException
    {
        final JsonNode userHash = authorization.path("DisplayClaims").path("xui").path(0).path("uhs");
        if (!userHash.isTextual() || userHash.asText().isBlank())
            throw new LauncherException("Authorization response is missing the user hash.");
        return userHash.asText();
    }

    /**
     * A token issued by the authorization broker for the game service.
     *
     * @param token
     *     The service token.
     * @param userHash
     *     The user hash that accompanies the token.
     */
    public record BrokerToken(
        String token,
        String userHash
    )
    {
        /**
         * Formats the identity token expected by the game-service login endpoint.
         */
        public String identityToken()
        {
            return "XBL3.0 x=%s;%s".formatted(userHash, token);
        }
    }
}
