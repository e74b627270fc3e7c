package nl.pim16aap2.beacon.launcher.resolver;

import java.util.Locale;
import java.util.Objects;

/**
 * The operating system and architecture descriptors are evaluated against.
 *
 * @param osName
 *     The descriptor name of the operating system: {@code windows}, {@code osx} or {@code linux}.
 * @param arch
 *     The descriptor name of the architecture: {@code x86}, {@code x86_64}, {@code arm64} or {@code arm32}.
 * @param osVersion
 *     The version of the operating system.
 */
public record Platform(
    String osName,
    String arch,
    String osVersion
)
{
    public static final String WINDOWS = "windows";
    public static final String OSX = "osx";
    public static final String LINUX = "linux";

    public Platform
    {
        Objects.requireNonNull(osName, "osName may not be null.");
        Objects.requireNonNull(arch, "arch may not be null.");
        Objects.requireNonNull(osVersion, "osVersion may not be null.");
    }

    /**
     * Detects the platform of the running JVM.
     */
    public static Platform current()
    {
        return new Platform(
            normalizeOsName(System.getProperty("os.name", "")),
            normalizeArch(System.getProperty("os.arch", "")),
            System.getProperty("os.version", "")
        );
    }

    /**
     * Gets the pointer width used to expand {@code ${arch}} in legacy native classifiers.
     *
     * @return {@code 32} for 32-bit architectures and {@code 64} otherwise.
     */
    public String archBits()
    {
        return "x86".equals(arch) || "arm32".equals(arch) ? "32" : "64";
    }

    /**
     * Gets the separator used to join classpath entries on this platform.
     */
    public String classpathSeparator()
    {
        return WINDOWS.equals(osName) ? ";" : ":";
    }

    static String normalizeOsName(String osName)
    {
        final String lower = osName.toLowerCase(Locale.ROOT);
        if (lower.contains("win"))
            return WINDOWS;
        if (lower.contains("mac") || lower.contains("darwin"))
            return OSX;
        return LINUX;
    }

    static String normalizeArch(String arch)
    {
        final String lower = arch.toLowerCase(Locale.ROOT);
        return switch (lower)
        {
            case "amd64", "x86_64", "x64" -> "x86_64";
            case "aarch64", "arm64" -> "arm64";
            case "x86", "i386", "i486", "i586", "i686" -> "x86";
            default -> lower.startsWith("arm") ? "arm32" : lower;
        };
    }
}
