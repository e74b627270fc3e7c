package nl.pim16aap2.beacon.launcher.auth;

import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.auth.GameServiceClient.GameProfile;
import nl.pim16aap2.beacon.launcher.auth.MicrosoftIdentityClient.DeviceCode;
import nl.pim16aap2.beacon.launcher.auth.MicrosoftIdentityClient.IdentityToken;
import nl.pim16aap2.beacon.launcher.auth.XboxBrokerClient.BrokerToken;
import nl.pim16aap2.beacon.runtime.AuthState;
import nl.pim16aap2.beacon.runtime.error.AuthenticationException;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.event.DeviceCodeEvent;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs the three hops of the delegated authorization chain as a linear state machine.
 * <p>
 * Every run starts at {@link AuthState#NOT_AUTHENTICATED} and advances one state per successful hop. When a hop
 * fails, the run is aborted with an {@link AuthenticationException} that names the last state reached, so callers
 * can tell which hop failed.
 */
@Log
public final class AuthenticationChain
{
    private final MicrosoftIdentityClient identityClient;
    private final XboxBrokerClient brokerClient;
    private final GameServiceClient gameServiceClient;

    public AuthenticationChain(
        MicrosoftIdentityClient identityClient,
        XboxBrokerClient brokerClient,
        GameServiceClient gameServiceClient)
    {
        this.identityClient = Objects.requireNonNull(identityClient, "identityClient may not be null.");
        this.brokerClient = Objects.requireNonNull(brokerClient, "brokerClient may not be null.");
        this.gameServiceClient = Objects.requireNonNull(gameServiceClient, "gameServiceClient may not be null.");
    }

    /**
     * Runs the chain with an interactive device-code login as its first hop.
     *
     * @param deviceCodeListener
     *     Receives the device code that has to be shown to the user.
     * @return the outcome of the completed chain.
     *
     * @throws AuthenticationException
     *     If any hop fails.
     */
    public ChainResult authenticateInteractively(Consumer<DeviceCodeEvent> deviceCodeListener)
        throws AuthenticationException
    {
        final IdentityToken identityToken = runIdentityHop(() ->
        {
            final DeviceCode deviceCode = identityClient.requestDeviceCode();
            deviceCodeListener.accept(
                new DeviceCodeEvent(deviceCode.userCode(), deviceCode.verificationUri(), deviceCode.expiresIn()));
            return identityClient.awaitDeviceToken(deviceCode);
        });
        return completeChain(identityToken);
    }

    /**
     * Runs the chain with a refresh-token grant as its first hop.
     *
     * @param identityRefreshToken
     *     The stored identity-provider refresh token.
     * @return the outcome of the completed chain.
     *
     * @throws AuthenticationException
     *     If any hop fails.
     */
    public ChainResult refresh(String identityRefreshToken)
        throws AuthenticationException
    {
        final IdentityToken identityToken = runIdentityHop(() -> identityClient.refresh(identityRefreshToken));
        return completeChain(identityToken);
    }

    private IdentityToken runIdentityHop(Hop<IdentityToken> hop)
        throws AuthenticationException
    {
        return runHop(AuthState.NOT_AUTHENTICATED, "identity provider", hop);
    }

    private ChainResult completeChain(IdentityToken identityToken)
        throws AuthenticationException
    {
        final BrokerToken brokerToken = runHop(
            AuthState.IDENTITY_OK,
            "authorization broker",
            () -> brokerClient.authorize(identityToken.accessToken())
        );

        final GameLogin gameLogin = runHop(
            AuthState.BROKER_OK,
            "game service",
            () ->
            {
                final String accessToken = gameServiceClient.login(brokerToken);
                return new GameLogin(accessToken, gameServiceClient.profile(accessToken));
            }
        );

        return new ChainResult(identityToken, gameLogin.accessToken(), gameLogin.profile());
    }

    private static <T> T runHop(AuthState from, String hopName, Hop<T> hop)
        throws AuthenticationException
    {
        final T result;
        try
        {
            result = hop.run();
        }
        catch (LauncherException exception)
        {
            throw new AuthenticationException(
                from,
                "Authentication failed at the %s: %s".formatted(hopName, exception.getMessage()),
                exception
            );
        }
        log.fine(() -> "Authentication advanced from %s to %s.".formatted(from, from.next()));
        return result;
    }

    @FunctionalInterface
    private interface Hop<T>
    {
        T run()
            throws LauncherException;
    }

    private record GameLogin(
        String accessToken,
        GameProfile profile
    )
    {
    }

    /**
     * The outcome of a completed chain. The chain is in state {@link AuthState#GAME_SERVICE_OK}.
     *
     * @param identityToken
     *     The identity token obtained by the first hop.
     * @param gameAccessToken
     *     The game-service access token.
     * @param profile
     *     The player profile.
     */
    public record ChainResult(
        IdentityToken identityToken,
        String gameAccessToken,
        GameProfile profile
    )
    {
    }
}
