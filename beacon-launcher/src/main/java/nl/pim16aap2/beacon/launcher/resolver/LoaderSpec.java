package nl.pim16aap2.beacon.launcher.resolver;

import java.util.Objects;

/**
 * Selects a loader to overlay on a base version.
 *
 * @param type
 *     The loader type.
 * @param version
 *     The loader version, or {@link #LATEST} for the newest stable release.
 */
public record LoaderSpec(
    LoaderType type,
    String version
)
{
    public static final String LATEST = "latest";

    public LoaderSpec
    {
        Objects.requireNonNull(type, "type may not be null.");
        Objects.requireNonNull(version, "version may not be null.");
        if (version.isBlank())
            version = LATEST;
    }

    public static LoaderSpec fabric(String version)
    {
        return new LoaderSpec(LoaderType.FABRIC, version);
    }

    public boolean isLatest()
    {
        return LATEST.equalsIgnoreCase(version);
    }

    /**
     * The supported loaders.
     */
    public enum LoaderType
    {
        FABRIC
    }
}
