package nl.pim16aap2.beacon.launcher.launch;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The per-launch choices that do not come from the profile.
 *
 * @param versionId
 *     The identifier of the provisioned profile to launch.
 * @param javaExecutable
 *     The Java executable to start the client with.
 * @param gameDirectory
 *     The working directory of the client.
 * @param maxMemoryMb
 *     The heap ceiling in megabytes.
 * @param serverHost
 *     The server to join directly after start-up, or {@code null} to open the main menu.
 * @param serverPort
 *     The port of {@link #serverHost()}, or {@code null} to use the default port.
 */
public record LaunchOptions(
    String versionId,
    String javaExecutable,
    Path gameDirectory,
    int maxMemoryMb,
    @Nullable String serverHost,
    @Nullable Integer serverPort
)
{
    public static final int DEFAULT_MAX_MEMORY_MB = 4096;

    public LaunchOptions
    {
        Objects.requireNonNull(versionId, "versionId may not be null.");
        Objects.requireNonNull(javaExecutable, "javaExecutable may not be null.");
        Objects.requireNonNull(gameDirectory, "gameDirectory may not be null.");
        if (maxMemoryMb <= 0)
            throw new IllegalArgumentException("maxMemoryMb must be positive, got " + maxMemoryMb + ".");
        if (serverPort != null && (serverPort < 1 || serverPort > 65_535))
            throw new IllegalArgumentException("serverPort must be between 1 and 65535, got " + serverPort + ".");
    }

    public static LaunchOptions of(String versionId, String javaExecutable, Path gameDirectory)
    {
        return new LaunchOptions(versionId, javaExecutable, gameDirectory, DEFAULT_MAX_MEMORY_MB, null, null);
    }

    public LaunchOptions withServer(String host, @Nullable Integer port)
    {
        return new LaunchOptions(versionId, javaExecutable, gameDirectory, maxMemoryMb, host, port);
    }

    public LaunchOptions withMaxMemoryMb(int newMaxMemoryMb)
    {
        return new LaunchOptions(versionId, javaExecutable, gameDirectory, newMaxMemoryMb, serverHost, serverPort);
    }
}
