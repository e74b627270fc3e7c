package nl.pim16aap2.beacon.launcher;

import nl.pim16aap2.beacon.launcher.auth.CredentialLifecycleManager;
import nl.pim16aap2.beacon.launcher.auth.MicrosoftIdentityClient;
import nl.pim16aap2.beacon.launcher.download.AssetLibraryFetcher;
import nl.pim16aap2.beacon.launcher.download.DownloaderType;
import nl.pim16aap2.beacon.launcher.launch.LaunchOptions;
import nl.pim16aap2.beacon.launcher.process.ClientProcessSupervisor;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * The configuration of a {@link ClientLauncher}.
 *
 * @param clientDataDirectory
 *     The directory holding versions, libraries, assets, natives and the credential file.
 * @param gameDirectory
 *     The working directory of the client process.
 * @param javaExecutable
 *     The Java executable used to start the client.
 * @param memoryMb
 *     The heap ceiling of the client in megabytes.
 * @param clientId
 *     The identity-provider application id.
 * @param userAgent
 *     The user agent sent with every request.
 * @param launcherName
 *     The launcher name passed to the client.
 * @param launcherVersion
 *     The launcher version passed to the client.
 * @param downloadThreads
 *     The number of files downloaded in parallel.
 * @param downloaderType
 *     The download implementation.
 * @param freshWindow
 *     How long a credential record is used without refreshing it.
 * @param expiryThreshold
 *     The age at which a credential record is discarded.
 * @param startGracePeriod
 *     How long the client has to survive to count as started.
 * @param stopGracePeriod
 *     How long the client gets to exit before it is killed.
 * @param endpoints
 *     The remote services.
 */
public record LauncherSettings(
    Path clientDataDirectory,
    Path gameDirectory,
    String javaExecutable,
    int memoryMb,
    String clientId,
    String userAgent,
    String launcherName,
    String launcherVersion,
    int downloadThreads,
    DownloaderType downloaderType,
    Duration freshWindow,
    Duration expiryThreshold,
    Duration startGracePeriod,
    Duration stopGracePeriod,
    LauncherEndpoints endpoints
)
{
    public static final String PROPERTY_PREFIX = "beacon.";
    public static final String DEFAULT_LAUNCHER_NAME = "beacon";
    public static final String DEFAULT_LAUNCHER_VERSION = "0.1.0";

    public LauncherSettings
    {
        Objects.requireNonNull(clientDataDirectory, "clientDataDirectory may not be null.");
        Objects.requireNonNull(gameDirectory, "gameDirectory may not be null.");
        Objects.requireNonNull(javaExecutable, "javaExecutable may not be null.");
        Objects.requireNonNull(clientId, "clientId may not be null.");
        Objects.requireNonNull(userAgent, "userAgent may not be null.");
        Objects.requireNonNull(launcherName, "launcherName may not be null.");
        Objects.requireNonNull(launcherVersion, "launcherVersion may not be null.");
        Objects.requireNonNull(downloaderType, "downloaderType may not be null.");
        Objects.requireNonNull(freshWindow, "freshWindow may not be null.");
        Objects.requireNonNull(expiryThreshold, "expiryThreshold may not be null.");
        Objects.requireNonNull(startGracePeriod, "startGracePeriod may not be null.");
        Objects.requireNonNull(stopGracePeriod, "stopGracePeriod may not be null.");
        Objects.requireNonNull(endpoints, "endpoints may not be null.");
        if (memoryMb <= 0)
            throw new IllegalArgumentException("memoryMb must be positive, got " + memoryMb + ".");
        if (downloadThreads < 1)
            throw new IllegalArgumentException("downloadThreads must be at least 1, got " + downloadThreads + ".");
    }

    /**
     * Creates the default settings for a client data directory.
     * <p>
     * The game directory is the client data directory itself and the client runs on the JVM running the launcher.
     *
     * @param clientDataDirectory
     *     The client data directory.
     * @return the default settings.
     */
    public static LauncherSettings defaults(Path clientDataDirectory)
    {
        return new LauncherSettings(
            clientDataDirectory,
            clientDataDirectory,
            defaultJavaExecutable(),
            LaunchOptions.DEFAULT_MAX_MEMORY_MB,
            MicrosoftIdentityClient.DEFAULT_CLIENT_ID,
            DEFAULT_LAUNCHER_NAME + "/" + DEFAULT_LAUNCHER_VERSION,
            DEFAULT_LAUNCHER_NAME,
            DEFAULT_LAUNCHER_VERSION,
            AssetLibraryFetcher.DEFAULT_CONCURRENCY,
            DownloaderType.HTTP_CLIENT,
            CredentialLifecycleManager.FRESH_WINDOW,
            CredentialLifecycleManager.EXPIRY_THRESHOLD,
            ClientProcessSupervisor.START_GRACE_PERIOD,
            ClientProcessSupervisor.STOP_GRACE_PERIOD,
            LauncherEndpoints.defaults()
        );
    }

    /**
     * Reads settings from {@code beacon.*} properties, falling back to {@link #defaults(Path)} for missing keys.
     * <p>
     * Supported keys: {@code beacon.clientDataDirectory}, {@code beacon.gameDirectory},
     * {@code beacon.javaExecutable}, {@code beacon.memoryMb}, {@code beacon.clientId}, {@code beacon.userAgent},
     * {@code beacon.launcherName}, {@code beacon.launcherVersion}, {@code beacon.downloadThreads},
     * {@code beacon.downloaderType}, {@code beacon.freshWindowDays}, {@code beacon.expiryThresholdDays},
     * {@code beacon.startGraceMillis}, {@code beacon.stopGraceMillis} and {@code beacon.endpointBaseUri}.
     *
     * @param properties
     *     The properties to read.
     * @param defaultClientDataDirectory
     *     The client data directory to use when {@code beacon.clientDataDirectory} is not set.
     * @return the settings.
     *
     * @throws IllegalArgumentException
     *     If a property has a value that cannot be parsed.
     */
    public static LauncherSettings fromProperties(Properties properties, Path defaultClientDataDirectory)
    {
        final Path clientDataDirectory =
            path(properties, "clientDataDirectory", defaultClientDataDirectory);
        final LauncherSettings defaults = defaults(clientDataDirectory);
        final String endpointBaseUri = property(properties, "endpointBaseUri");

        return new LauncherSettings(
            clientDataDirectory,
            path(properties, "gameDirectory", defaults.gameDirectory()),
            string(properties, "javaExecutable", defaults.javaExecutable()),
            integer(properties, "memoryMb", defaults.memoryMb()),
            string(properties, "clientId", defaults.clientId()),
            string(properties, "userAgent", defaults.userAgent()),
            string(properties, "launcherName", defaults.launcherName()),
            string(properties, "launcherVersion", defaults.launcherVersion()),
            integer(properties, "downloadThreads", defaults.downloadThreads()),
            downloaderType(properties, defaults.downloaderType()),
            Duration.ofDays(integer(properties, "freshWindowDays", (int) defaults.freshWindow().toDays())),
            Duration.ofDays(integer(properties, "expiryThresholdDays", (int) defaults.expiryThreshold().toDays())),
            Duration.ofMillis(integer(properties, "startGraceMillis", (int) defaults.startGracePeriod().toMillis())),
            Duration.ofMillis(integer(properties, "stopGraceMillis", (int) defaults.stopGracePeriod().toMillis())),
            endpointBaseUri == null ? defaults.endpoints() : LauncherEndpoints.underBaseUri(URI.create(endpointBaseUri))
        );
    }

    /**
     * Reads settings from the given properties with the JVM system properties layered on top.
     *
     * @param properties
     *     The base properties, for example read from a configuration file.
     * @param defaultClientDataDirectory
     *     The client data directory to use when none is configured.
     * @return the settings.
     */
    public static LauncherSettings fromPropertiesAndSystem(Properties properties, Path defaultClientDataDirectory)
    {
        final Properties merged = new Properties();
        merged.putAll(properties);
        for (final String name : System.getProperties().stringPropertyNames())
        {
            if (name.startsWith(PROPERTY_PREFIX))
                merged.setProperty(name, System.getProperty(name));
        }
        return fromProperties(merged, defaultClientDataDirectory);
    }

    public ClientLayout layout()
    {
        return new ClientLayout(clientDataDirectory);
    }

    private static String defaultJavaExecutable()
    {
        return Path.of(System.getProperty("java.home", ""), "bin", "java").toString();
    }

    private static @Nullable String property(Properties properties, String key)
    {
        final String value = properties.getProperty(PROPERTY_PREFIX + key);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static String string(Properties properties, String key, String fallback)
    {
        final String value = property(properties, key);
        return value == null ? fallback : value;
    }

    private static Path path(Properties properties, String key, Path fallback)
    {
        final String value = property(properties, key);
        return value == null ? fallback : Path.of(value);
    }

    private static int integer(Properties properties, String key, int fallback)
    {
        final String value = property(properties, key);
        if (value == null)
            return fallback;
        try
        {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException exception)
        {
            throw new IllegalArgumentException(
                "Property '%s%s' must be an integer, got '%s'.".formatted(PROPERTY_PREFIX, key, value), exception);
        }
    }

    private static DownloaderType downloaderType(Properties properties, DownloaderType fallback)
    {
        final String value = property(properties, "downloaderType");
        if (value == null)
            return fallback;
        try
        {
            return DownloaderType.valueOf(value.toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException exception)
        {
            throw new IllegalArgumentException(
                "Property '%sdownloaderType' has unknown value '%s'.".formatted(PROPERTY_PREFIX, value), exception);
        }
    }
}
