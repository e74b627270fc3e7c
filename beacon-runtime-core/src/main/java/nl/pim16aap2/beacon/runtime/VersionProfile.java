package nl.pim16aap2.beacon.runtime;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * The resolved description of everything needed to run one version of the client, possibly with a loader on top.
 *
 * @param id
 *     The identifier of the profile, e.g. {@code 1.21.4} or {@code fabric-loader-0.16.14-1.21.4}.
 * @param inheritsFrom
 *     The identifier of the base version this profile was merged onto, if any.
 * @param mainClass
 *     The main entry class.
 * @param type
 *     The version type, e.g. {@code release}.
 * @param libraries
 *     The deduplicated, ordered library list.
 * @param assetIndex
 *     The asset index reference, if any.
 * @param clientDownload
 *     The download descriptor of the base client archive, if any.
 * @param gameArguments
 *     The templated game arguments.
 * @param jvmArguments
 *     The templated JVM arguments. Empty for profiles that only define legacy game arguments.
 */
public record VersionProfile(
    String id,
    @Nullable String inheritsFrom,
    String mainClass,
    String type,
    List<LibraryEntry> libraries,
    @Nullable AssetIndexReference assetIndex,
    @Nullable DownloadReference clientDownload,
    List<String> gameArguments,
    List<String> jvmArguments
)
{
    public VersionProfile
    {
        Objects.requireNonNull(id, "id may not be null.");
        Objects.requireNonNull(mainClass, "mainClass may not be null.");
        Objects.requireNonNull(type, "type may not be null.");
        libraries = libraries == null ? List.of() : List.copyOf(libraries);
        gameArguments = gameArguments == null ? List.of() : List.copyOf(gameArguments);
        jvmArguments = jvmArguments == null ? List.of() : List.copyOf(jvmArguments);
    }

    /**
     * Gets the identifier of the version that owns the client archive.
     *
     * @return {@link #inheritsFrom()} when present, otherwise {@link #id()}.
     */
    public String clientJarVersion()
    {
        return inheritsFrom == null ? id : inheritsFrom;
    }

    /**
     * A downloadable artifact.
     *
     * @param url
     *     Where to download the artifact from.
     * @param size
     *     The expected size in bytes, if known.
     * @param sha1
     *     The expected SHA-1 hash, if known.
     */
    public record DownloadReference(
        URI url,
        @Nullable Long size,
        @Nullable String sha1
    )
    {
    }

    /**
     * A reference to the asset index of a version.
     *
     * @param id
     *     The asset index id, used as the file name under {@code assets/indexes}.
     * @param url
     *     Where to download the index from.
     * @param size
     *     The expected size of the index in bytes, if known.
     * @param sha1
     *     The expected SHA-1 hash of the index, if known.
     */
    public record AssetIndexReference(
        String id,
        URI url,
        @Nullable Long size,
        @Nullable String sha1
    )
    {
    }
}
