package nl.pim16aap2.beacon.launcher.auth;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.auth.AuthenticationChain.ChainResult;
import nl.pim16aap2.beacon.launcher.auth.GameServiceClient.TokenValidation;
import nl.pim16aap2.beacon.launcher.event.LauncherEventBus;
import nl.pim16aap2.beacon.runtime.CredentialFreshness;
import nl.pim16aap2.beacon.runtime.CredentialRecord;
import nl.pim16aap2.beacon.runtime.error.AuthenticationException;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.result.AuthResult;
import nl.pim16aap2.beacon.runtime.result.AuthStatusResult;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns acquisition, validation, refresh and persistence of the credentials of one client installation.
 * <p>
 * The age of a record decides how much it is trusted:
 * <ul>
 *     <li>younger than {@link #FRESH_WINDOW}: used as is;</li>
 *     <li>between {@link #FRESH_WINDOW} and {@link #EXPIRY_THRESHOLD}: silently refreshed before use, falling back
 *     to the cached token when the refresh fails but the token still validates;</li>
 *     <li>older than {@link #EXPIRY_THRESHOLD}: discarded.</li>
 * </ul>
 * A record is never discarded because the game service could not be reached.
 */
@Log
public final class CredentialLifecycleManager
{
    public static final Duration FRESH_WINDOW = Duration.ofDays(30);
    public static final Duration EXPIRY_THRESHOLD = Duration.ofDays(90);

    private final AuthenticationChain authenticationChain;
    private final GameServiceClient gameServiceClient;
    private final CredentialStore credentialStore;
    private final LauncherEventBus eventBus;
    private final Clock clock;
    private final Duration freshWindow;
    private final Duration expiryThreshold;

    private final ReentrantLock refreshLock = new ReentrantLock();

    @GuardedBy("refreshLock")
    private @Nullable CompletableFuture<AuthResult> inFlightRefresh;

    private volatile @Nullable CredentialRecord credentials;

    public CredentialLifecycleManager(
        AuthenticationChain authenticationChain,
        GameServiceClient gameServiceClient,
        CredentialStore credentialStore,
        LauncherEventBus eventBus,
        Clock clock,
        Duration freshWindow,
        Duration expiryThreshold)
    {
        this.authenticationChain =
            Objects.requireNonNull(authenticationChain, "authenticationChain may not be null.");
        this.gameServiceClient = Objects.requireNonNull(gameServiceClient, "gameServiceClient may not be null.");
        this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore may not be null.");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus may not be null.");
        this.clock = Objects.requireNonNull(clock, "clock may not be null.");
        this.freshWindow = Objects.requireNonNull(freshWindow, "freshWindow may not be null.");
        this.expiryThreshold = Objects.requireNonNull(expiryThreshold, "expiryThreshold may not be null.");
        if (freshWindow.compareTo(expiryThreshold) >= 0)
            throw new IllegalArgumentException(
                "freshWindow (%s) must be shorter than expiryThreshold (%s).".formatted(freshWindow, expiryThreshold));
    }

    /**
     * Runs an interactive authentication.
     * <p>
     * The device code is published as a {@link nl.pim16aap2.beacon.runtime.event.DeviceCodeEvent}. The new record
     * replaces the in-memory credentials but is not written to disk; call {@link #persist()} for that.
     *
     * @return the new credential record.
     *
     * @throws AuthenticationException
     *     If any hop of the chain fails.
     */
    public CredentialRecord authenticate()
        throws AuthenticationException
    {
        final ChainResult result = authenticationChain.authenticateInteractively(eventBus::post);
        final CredentialRecord newCredentials = new CredentialRecord(
            result.gameAccessToken(),
            result.identityToken().refreshToken(),
            result.identityToken().accessToken(),
            UUID.randomUUID().toString(),
            result.profile().id(),
            result.profile().name(),
            clock.instant(),
            null
        );
        credentials = newCredentials;
        log.info(() -> "Authenticated as " + newCredentials.playerName() + ".");
        return newCredentials;
    }

    /**
     * Writes the current credentials to the credential file.
     *
     * @throws LauncherException
     *     If there are no credentials or the file could not be written.
     */
    public void persist()
        throws LauncherException
    {
        final CredentialRecord current = credentials;
        if (current == null)
            throw new LauncherException("There are no credentials to persist.");
        credentialStore.write(current);
    }

    /**
     * Loads the credential file into memory.
     *
     * @return the load result; a missing file is reported, not thrown.
     */
    public CredentialStore.LoadResult load()
    {
        final CredentialStore.LoadResult result = credentialStore.read();
        if (result.status() == CredentialStore.LoadStatus.FOUND)
            credentials = result.credentials();
        return result;
    }

    public Optional<CredentialRecord> credentials()
    {
        return Optional.ofNullable(credentials);
    }

    /**
     * Determines the freshness of a record at the current moment.
     */
    public CredentialFreshness freshnessOf(CredentialRecord record)
    {
        final Duration age = record.age(clock.instant());
        if (age.compareTo(expiryThreshold) >= 0)
            return CredentialFreshness.EXPIRED;
        if (age.compareTo(freshWindow) >= 0)
            return CredentialFreshness.STALE;
        return CredentialFreshness.FRESH;
    }

    /**
     * Makes sure the current credentials can be used to launch the client.
     * <p>
     * Concurrent callers share a single in-flight refresh and all receive its result.
     *
     * @param forceRefresh
     *     Whether to refresh even when the record is still fresh.
     * @return the outcome. {@link AuthResult#requiresAuth()} is set when the user has to authenticate again.
     */
    public AuthResult ensureValid(boolean forceRefresh)
    {
        final CredentialRecord current = credentials;
        if (current == null)
            return AuthResult.authRequired("Not logged in. Please authenticate first.");

        final CredentialFreshness freshness = freshnessOf(current);
        if (freshness == CredentialFreshness.EXPIRED)
        {
            log.info(() -> "Stored credentials for %s are older than %d days; re-authentication is required."
                .formatted(current.playerName(), expiryThreshold.toDays()));
            discard(current);
            return AuthResult.authRequired("Stored credentials have expired. Please authenticate again.");
        }

        if (freshness == CredentialFreshness.FRESH && !forceRefresh)
            return AuthResult.valid(current);

        return refreshOnce(current);
    }

    /**
     * Clears the credentials from memory and disk.
     *
     * @throws LauncherException
     *     If the credential file could not be deleted.
     */
    public void logout()
        throws LauncherException
    {
        credentials = null;
        credentialStore.delete();
        log.info("Logged out.");
    }

    /**
     * Describes the stored credentials without touching the network.
     */
    public AuthStatusResult status()
    {
        final CredentialRecord current = credentials;
        if (current == null)
            return AuthStatusResult.notAuthenticated();

        final CredentialFreshness freshness = freshnessOf(current);
        return new AuthStatusResult(
            freshness != CredentialFreshness.EXPIRED,
            current.playerName(),
            current.playerId(),
            current.age(clock.instant()),
            freshness,
            freshness == CredentialFreshness.STALE
        );
    }

    private AuthResult refreshOnce(CredentialRecord current)
    {
        final @Nullable CompletableFuture<AuthResult> future;
        final boolean owner;
        refreshLock.lock();
        try
        {
            owner = inFlightRefresh == null && credentials == current;
            if (owner)
                inFlightRefresh = new CompletableFuture<>();
            future = inFlightRefresh;
        }
        finally
        {
            refreshLock.unlock();
        }

        // No refresh is running, but the record was replaced after the caller read it.
        if (future == null)
        {
            log.fine("Credentials changed before the refresh started; checking the new record.");
            return ensureValid(false);
        }

        if (!owner)
            return awaitRefresh(future);

        try
        {
            final AuthResult result = refreshOrFallBack(current);
            future.complete(result);
            return result;
        }
        catch (RuntimeException exception)
        {
            future.completeExceptionally(exception);
            throw exception;
        }
        finally
        {
            refreshLock.lock();
            try
            {
                inFlightRefresh = null;
            }
            finally
            {
                refreshLock.unlock();
            }
        }
    }

    private static AuthResult awaitRefresh(CompletableFuture<AuthResult> future)
    {
        try
        {
            return future.get();
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();
            return AuthResult.failure("Interrupted while waiting for the credential refresh.");
        }
        catch (ExecutionException exception)
        {
            final Throwable cause = exception.getCause() == null ? exception : exception.getCause();
            return AuthResult.failure("Credential refresh failed: " + cause.getMessage());
        }
    }

    private AuthResult refreshOrFallBack(CredentialRecord current)
    {
        final String refreshToken = current.identityRefreshToken();
        if (refreshToken == null || !current.canRefresh())
        {
            log.fine("Stored credentials cannot be refreshed; validating the cached access token instead.");
            return validateCached(current);
        }

        try
        {
            final ChainResult result = authenticationChain.refresh(refreshToken);
            final CredentialRecord refreshed = current.refreshed(
                result.gameAccessToken(),
                result.identityToken().refreshToken(),
                result.identityToken().accessToken(),
                clock.instant()
            );
            credentials = refreshed;
            persistRefreshed(refreshed);
            log.info(() -> "Refreshed credentials for " + refreshed.playerName() + ".");
            return AuthResult.refreshed(refreshed);
        }
        catch (AuthenticationException exception)
        {
            log.warning(() -> "Silent refresh failed after reaching %s: %s"
                .formatted(exception.reachedState(), exception.getMessage()));
            return validateCached(current);
        }
    }

    private AuthResult validateCached(CredentialRecord current)
    {
        final TokenValidation validation = gameServiceClient.validate(current.accessToken());
        return switch (validation)
        {
            case VALID ->
            {
                log.info("Cached access token is still valid; continuing with it.");
                yield AuthResult.cached(current);
            }
            case UNREACHABLE ->
            {
                log.warning("Game service unreachable; continuing with the cached access token.");
                yield AuthResult.cached(current);
            }
            case REJECTED ->
            {
                discard(current);
                yield AuthResult.authRequired("Stored credentials were rejected. Please authenticate again.");
            }
        };
    }

    private void persistRefreshed(CredentialRecord refreshed)
    {
        try
        {
            credentialStore.write(refreshed);
        }
        catch (LauncherException exception)
        {
            log.warning(() -> "Refreshed credentials could not be saved: " + exception.getMessage());
        }
    }

    private void discard(CredentialRecord current)
    {
        if (credentials == current)
            credentials = null;
        try
        {
            credentialStore.delete();
        }
        catch (LauncherException exception)
        {
            log.warning(() -> "Discarded credentials could not be removed from disk: " + exception.getMessage());
        }
    }
}
