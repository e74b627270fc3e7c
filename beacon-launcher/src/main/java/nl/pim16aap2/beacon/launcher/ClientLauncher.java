package nl.pim16aap2.beacon.launcher;

import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.auth.AuthenticationChain;
import nl.pim16aap2.beacon.launcher.auth.CredentialLifecycleManager;
import nl.pim16aap2.beacon.launcher.auth.CredentialStore;
import nl.pim16aap2.beacon.launcher.auth.GameServiceClient;
import nl.pim16aap2.beacon.launcher.auth.MicrosoftIdentityClient;
import nl.pim16aap2.beacon.launcher.auth.XboxBrokerClient;
import nl.pim16aap2.beacon.launcher.download.AssetLibraryFetcher;
import nl.pim16aap2.beacon.launcher.download.FetchResult;
import nl.pim16aap2.beacon.launcher.event.LauncherEventBus;
import nl.pim16aap2.beacon.launcher.launch.LaunchArgumentBuilder;
import nl.pim16aap2.beacon.launcher.launch.LaunchOptions;
import nl.pim16aap2.beacon.launcher.natives.ExtractionResult;
import nl.pim16aap2.beacon.launcher.natives.NativeLibraryExtractor;
import nl.pim16aap2.beacon.launcher.net.JsonHttpClient;
import nl.pim16aap2.beacon.launcher.net.RetryPolicy;
import nl.pim16aap2.beacon.launcher.net.Sleeper;
import nl.pim16aap2.beacon.launcher.process.ClientProcessSupervisor;
import nl.pim16aap2.beacon.launcher.resolver.LibraryMerger;
import nl.pim16aap2.beacon.launcher.resolver.LoaderSpec;
import nl.pim16aap2.beacon.launcher.resolver.Platform;
import nl.pim16aap2.beacon.launcher.resolver.RemoteDescriptorSource;
import nl.pim16aap2.beacon.launcher.resolver.VersionDescriptorParser;
import nl.pim16aap2.beacon.launcher.resolver.VersionResolver;
import nl.pim16aap2.beacon.runtime.ClientProcessHandle;
import nl.pim16aap2.beacon.runtime.CredentialRecord;
import nl.pim16aap2.beacon.runtime.LaunchPlan;
import nl.pim16aap2.beacon.runtime.VersionProfile;
import nl.pim16aap2.beacon.runtime.error.AuthenticationException;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.ProcessStartFailureException;
import nl.pim16aap2.beacon.runtime.error.ResourceMissingException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;
import nl.pim16aap2.beacon.runtime.result.AuthResult;
import nl.pim16aap2.beacon.runtime.result.AuthStatusResult;
import nl.pim16aap2.beacon.runtime.result.ItemFailure;
import nl.pim16aap2.beacon.runtime.result.LaunchResult;
import nl.pim16aap2.beacon.runtime.result.LogoutResult;
import nl.pim16aap2.beacon.runtime.result.ProvisionResult;
import nl.pim16aap2.beacon.runtime.result.StatusResult;
import nl.pim16aap2.beacon.runtime.result.StopResult;
import org.jspecify.annotations.Nullable;

import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the launcher.
 * <p>
 * Every operation returns a result record instead of throwing. A result with {@code requiresAuth} set means the user
 * has to run {@link #authenticate()} before the operation can succeed.
 */
@Log
public final class ClientLauncher
{
    private final LauncherSettings settings;
    private final LauncherEventBus eventBus;
    private final CredentialLifecycleManager credentials;
    private final VersionResolver versionResolver;
    private final AssetLibraryFetcher fetcher;
    private final NativeLibraryExtractor nativeExtractor;
    private final LaunchArgumentBuilder argumentBuilder;
    private final ClientProcessSupervisor supervisor;
    private final RetryPolicy provisioningPolicy;
    private final ClientLayout layout;

    private final Map<String, VersionProfile> profiles = new ConcurrentHashMap<>();
    private final AtomicBoolean credentialsLoaded = new AtomicBoolean(false);

    public ClientLauncher(LauncherSettings settings)
    {
        this(settings, Platform.current(), Clock.systemUTC(), Sleeper.SYSTEM);
    }

    ClientLauncher(LauncherSettings settings, Platform platform, Clock clock, Sleeper sleeper)
    {
        this.settings = Objects.requireNonNull(settings, "settings may not be null.");
        Objects.requireNonNull(platform, "platform may not be null.");
        Objects.requireNonNull(clock, "clock may not be null.");
        Objects.requireNonNull(sleeper, "sleeper may not be null.");

        final LauncherEndpoints endpoints = settings.endpoints();
        this.layout = settings.layout();
        this.eventBus = new LauncherEventBus();

        final RetryPolicy networkPolicy = RetryPolicy.defaultNetworkPolicy().withSleeper(sleeper);
        final JsonHttpClient httpClient = new JsonHttpClient(settings.userAgent(), networkPolicy);

        final GameServiceClient gameServiceClient = new GameServiceClient(httpClient, endpoints);
        final AuthenticationChain authenticationChain = new AuthenticationChain(
            new MicrosoftIdentityClient(httpClient, endpoints, settings.clientId(), clock, sleeper),
            new XboxBrokerClient(httpClient, endpoints),
            gameServiceClient
        );
        this.credentials = new CredentialLifecycleManager(
            authenticationChain,
            gameServiceClient,
            new CredentialStore(settings.clientDataDirectory()),
            eventBus,
            clock,
            settings.freshWindow(),
            settings.expiryThreshold()
        );

        this.versionResolver = new VersionResolver(
            new RemoteDescriptorSource(httpClient, endpoints, layout.versionsDirectory()),
            new VersionDescriptorParser(platform, endpoints.librariesBaseUri()),
            new LibraryMerger()
        );
        this.fetcher = new AssetLibraryFetcher(
            settings.downloaderType().create(settings.userAgent()),
            networkPolicy,
            layout,
            eventBus,
            endpoints.assetBaseUri(),
            settings.downloadThreads()
        );
        this.nativeExtractor = new NativeLibraryExtractor(layout);
        this.argumentBuilder = new LaunchArgumentBuilder(
            platform, layout, settings.launcherName(), settings.launcherVersion());
        this.supervisor =
            new ClientProcessSupervisor(eventBus, settings.startGracePeriod(), settings.stopGracePeriod());
        this.provisioningPolicy = RetryPolicy.defaultProvisioningPolicy().withSleeper(sleeper);
    }

    /**
     * Gets the event bus on which device codes, provisioning progress and process lifecycle events are published.
     */
    public LauncherEventBus eventBus()
    {
        return eventBus;
    }

    /**
     * Runs an interactive login and stores the resulting credentials.
     * <p>
     * The device code to show to the user is published as a
     * {@link nl.pim16aap2.beacon.runtime.event.DeviceCodeEvent}.
     */
    public AuthResult authenticate()
    {
        final CredentialRecord record;
        try
        {
            record = credentials.authenticate();
        }
        catch (AuthenticationException exception)
        {
            log.warning(() -> "Authentication failed: " + exception.getMessage());
            return AuthResult.failure(String.valueOf(exception.getMessage()));
        }
        credentialsLoaded.set(true);

        try
        {
            credentials.persist();
        }
        catch (LauncherException exception)
        {
            log.warning(() -> "Authenticated, but failed to store the credentials: " + exception.getMessage());
        }
        return AuthResult.valid(record);
    }

    /**
     * Makes sure stored credentials are usable, refreshing them when they are getting old.
     *
     * @param forceRefresh
     *     Whether to refresh even if the credentials are still fresh.
     */
    public AuthResult ensureValid(boolean forceRefresh)
    {
        loadCredentialsOnce();
        return credentials.ensureValid(forceRefresh);
    }

    /**
     * Resolves a version and downloads and extracts everything it needs.
     *
     * @param versionId
     *     The base version.
     * @param loaderSpec
     *     The loader to install on top of the base version, or {@code null} for none.
     */
    public ProvisionResult provision(String versionId, @Nullable LoaderSpec loaderSpec)
    {
        final AtomicReference<@Nullable ProvisionResult> lastAttempt = new AtomicReference<>();
        try
        {
            return provisioningPolicy.execute("provisioning of " + versionId, () ->
            {
                final ProvisionResult result = provisionOnce(versionId, loaderSpec);
                lastAttempt.set(result);
                if (!result.success())
                    throw new TransientNetworkException(
                        "%d item(s) of %s failed.".formatted(result.errors().size(), versionId));
                return result;
            });
        }
        catch (TransientNetworkException exception)
        {
            final ProvisionResult incomplete = lastAttempt.get();
            if (incomplete != null)
                return incomplete;
            return ProvisionResult.failure(String.valueOf(exception.getMessage()));
        }
        catch (LauncherException exception)
        {
            log.warning(() -> "Provisioning of %s failed: %s".formatted(versionId, exception.getMessage()));
            return ProvisionResult.failure(String.valueOf(exception.getMessage()));
        }
    }

    private ProvisionResult provisionOnce(String versionId, @Nullable LoaderSpec loaderSpec)
        throws LauncherException
    {
        final VersionProfile profile = versionResolver.resolve(versionId, loaderSpec);
        final FetchResult fetchResult = fetcher.fetchAll(profile);
        final ExtractionResult extractionResult =
            nativeExtractor.extract(profile, layout.nativesDirectory(profile.id()));

        final List<ItemFailure> errors = new ArrayList<>(fetchResult.errors());
        errors.addAll(extractionResult.errors());
        profiles.put(profile.id(), profile);

        return new ProvisionResult(
            errors.isEmpty(),
            errors.isEmpty() ? null : "%d item(s) could not be provisioned.".formatted(errors.size()),
            profile,
            fetchResult.successCount(),
            fetchResult.skippedCount(),
            extractionResult.extractedCount(),
            errors
        );
    }

    /**
     * Launches a provisioned version with the configured Java executable, game directory and memory ceiling.
     *
     * @param versionId
     *     The id of the provisioned profile, which is the loader profile id when a loader was installed.
     */
    public LaunchResult launch(String versionId)
    {
        return launch(new LaunchOptions(
            versionId,
            settings.javaExecutable(),
            settings.gameDirectory(),
            settings.memoryMb(),
            null,
            null
        ));
    }

    /**
     * Launches a provisioned version.
     * <p>
     * The credentials are validated first. The version must have been provisioned, either by this launcher or by an
     * earlier one using the same client data directory.
     */
    public LaunchResult launch(LaunchOptions options)
    {
        final AuthResult authResult = ensureValid(false);
        if (authResult.requiresAuth())
            return LaunchResult.authRequired(String.valueOf(authResult.error()));
        if (!authResult.success())
            return LaunchResult.failure(String.valueOf(authResult.error()));

        final Optional<CredentialRecord> record = credentials.credentials();
        if (record.isEmpty())
            return LaunchResult.authRequired("Not logged in. Please authenticate first.");

        try
        {
            final VersionProfile profile = provisionedProfile(options.versionId());
            final LaunchPlan plan = argumentBuilder.build(profile, record.get(), options);
            final ClientProcessHandle handle = supervisor.launch(plan);
            return LaunchResult.started(handle);
        }
        catch (ProcessStartFailureException exception)
        {
            return LaunchResult.startFailure("%s Output:%n%s"
                .formatted(exception.getMessage(), exception.outputTail()));
        }
        catch (LauncherException exception)
        {
            log.warning(() -> "Failed to launch %s: %s".formatted(options.versionId(), exception.getMessage()));
            return LaunchResult.failure(String.valueOf(exception.getMessage()));
        }
    }

    /**
     * Gets a provisioned profile, from this launcher's own provisioning runs or otherwise from the descriptors an
     * earlier run stored on disk.
     */
    private VersionProfile provisionedProfile(String versionId)
        throws LauncherException
    {
        final VersionProfile known = profiles.get(versionId);
        if (known != null)
            return known;

        final VersionProfile stored = versionResolver.resolveStored(versionId);
        if (!Files.isRegularFile(layout.clientJar(stored.clientJarVersion())))
            throw new ResourceMissingException("Version %s has not been provisioned.".formatted(versionId));
        log.fine(() -> "Loaded provisioned profile %s from disk.".formatted(versionId));
        profiles.put(versionId, stored);
        return stored;
    }

    public StopResult stop()
    {
        return supervisor.stop();
    }

    public StatusResult status()
    {
        return supervisor.status();
    }

    /**
     * Forgets the stored credentials.
     */
    public LogoutResult logout()
    {
        credentialsLoaded.set(true);
        try
        {
            credentials.logout();
            return LogoutResult.loggedOut();
        }
        catch (LauncherException exception)
        {
            return LogoutResult.failure(String.valueOf(exception.getMessage()));
        }
    }

    /**
     * Describes the stored credentials without contacting any service.
     */
    public AuthStatusResult authStatus()
    {
        loadCredentialsOnce();
        return credentials.status();
    }

    private void loadCredentialsOnce()
    {
        if (!credentialsLoaded.compareAndSet(false, true))
            return;

        final CredentialStore.LoadResult result = credentials.load();
        switch (result.status())
        {
            case FOUND -> log.fine("Loaded stored credentials.");
            case NOT_FOUND -> log.fine("No stored credentials found.");
            case CORRUPT -> log.warning(() -> "Ignoring unreadable credential file: " + result.error());
        }
    }
}
