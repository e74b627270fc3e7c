package nl.pim16aap2.beacon.launcher.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.LauncherEndpoints;
import nl.pim16aap2.beacon.launcher.net.JsonHttpClient;
import nl.pim16aap2.beacon.launcher.net.Sleeper;
import nl.pim16aap2.beacon.runtime.error.HttpStatusException;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Client for the identity provider, the first hop of the authorization chain.
 * <p>
 * Interactive logins use the device-code grant: the user enters a short code in a browser while this client polls
 * the token endpoint. Silent logins use the refresh-token grant.
 */
@Log
public final class MicrosoftIdentityClient
{
    /**
     * The public client id of the game's own launcher.
     */
    public static final String DEFAULT_CLIENT_ID = "00000000402b5328";

    static final String SCOPE = "XboxLive.signin offline_access";
    private static final String DEVICE_CODE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";
    private static final Duration SLOW_DOWN_INCREMENT = Duration.ofSeconds(5);

    private final JsonHttpClient httpClient;
    private final LauncherEndpoints endpoints;
    private final String clientId;
    private final Clock clock;
    private final Sleeper sleeper;

    public MicrosoftIdentityClient(
        JsonHttpClient httpClient,
        LauncherEndpoints endpoints,
        String clientId,
        Clock clock,
        Sleeper sleeper)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints may not be null.");
        this.clientId = Objects.requireNonNull(clientId, "clientId may not be null.");
        this.clock = Objects.requireNonNull(clock, "clock may not be null.");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper may not be null.");
    }

    /**
     * Requests a new device code.
     *
     * @return the device code the user has to enter.
     *
     * @throws LauncherException
     *     If the identity provider could not be reached or returned an unusable response.
     */
    public DeviceCode requestDeviceCode()
        throws LauncherException
    {
        final Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("scope", SCOPE);
        form.put("response_type", "device_code");

        final JsonNode root = httpClient.postForm(endpoints.identityDeviceCodeUri(), form);
        return new DeviceCode(
            requireText(root, "user_code"),
            requireText(root, "device_code"),
            URI.create(requireText(root, "verification_uri")),
            Duration.ofSeconds(Math.max(1, root.path("interval").asLong(5))),
            Duration.ofSeconds(root.path("expires_in").asLong(900))
        );
    }

    /**
     * Polls the token endpoint until the user completed the device-code login.
     *
     * @param deviceCode
     *     The device code returned by {@link #requestDeviceCode()}.
     * @return the identity token.
     *
     * @throws LauncherException
     *     If the code expired, the user declined, or the provider could not be reached.
     */
    public IdentityToken awaitDeviceToken(DeviceCode deviceCode)
        throws LauncherException
    {
        final Instant deadline = clock.instant().plus(deviceCode.expiresIn());
        Duration interval = deviceCode.interval();

        final Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("grant_type", DEVICE_CODE_GRANT);
        form.put("device_code", deviceCode.deviceCode());

        while (clock.instant().isBefore(deadline))
        {
            try
            {
                return parseToken(httpClient.postForm(endpoints.identityTokenUri(), form));
            }
            catch (HttpStatusException exception)
            {
                final String error = errorCode(exception);
                if ("slow_down".equals(error))
                    interval = interval.plus(SLOW_DOWN_INCREMENT);
                else if (!"authorization_pending".equals(error))
                    throw exception;
            }
            pause(interval);
        }
        throw new LauncherException("The device code expired before the login was completed.");
    }

    /**
     * Exchanges a refresh token for a new identity token.
     *
     * @param refreshToken
     *     The stored refresh token.
     * @return the new identity token. Its refresh token is {@code null} when the provider did not rotate it.
     *
     * @throws LauncherException
     *     If the refresh was rejected or the provider could not be reached.
     */
    public IdentityToken refresh(String refreshToken)
        throws LauncherException
    {
        final Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("refresh_token", refreshToken);
        form.put("grant_type", "refresh_token");
        form.put("scope", SCOPE);

        return parseToken(httpClient.postForm(endpoints.identityTokenUri(), form));
    }

    private void pause(Duration interval)
        throws LauncherException
    {
        try
        {
            sleeper.sleep(interval);
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            throw new LauncherException("Interrupted while waiting for the device-code login.", exception);
        }
    }

    private @Nullable String errorCode(HttpStatusException exception)
    {
        try
        {
            final JsonNode body = httpClient.objectMapper().readTree(exception.body());
            return body.path("error").isTextual() ? body.path("error").asText() : null;
        }
        catch (JsonProcessingException parseFailure)
        {
            log.finest(() -> "Token endpoint error body is not JSON: " + parseFailure.getMessage());
            return null;
        }
    }

    private static IdentityToken parseToken(JsonNode root)
        throws LauncherException
    {
        final String refreshToken = root.path("refresh_token").asText("");
        return new IdentityToken(
            requireText(root, "access_token"),
            refreshToken.isBlank() ? null : refreshToken
        );
    }

    static String requireText(JsonNode root, String field)
        throws LauncherException
    {
        final JsonNode node = root.path(field);
        if (!node.isTextual() || node.asText().isBlank())
            throw new LauncherException("Response is missing field '%s'.".formatted(field));
        return node.asText();
    }

    /**
     * A device code issued by the identity provider.
     *
     * @param userCode
     *     The code the user enters.
     * @param deviceCode
     *     The code this client polls with.
     * @param verificationUri
     *     Where the user enters the code.
     * @param interval
     *     The minimum delay between polls.
     * @param expiresIn
     *     How long the code stays valid.
     */
    public record DeviceCode(
        String userCode,
        String deviceCode,
        URI verificationUri,
        Duration interval,
        Duration expiresIn
    )
    {
    }

    /**
     * A token issued by the identity provider.
     *
     * @param accessToken
     *     The access token for the authorization broker.
     * @param refreshToken
     *     The refresh token, if one was issued.
     */
    public record IdentityToken(
        String accessToken,
        @Nullable String refreshToken
    )
    {
    }
}
