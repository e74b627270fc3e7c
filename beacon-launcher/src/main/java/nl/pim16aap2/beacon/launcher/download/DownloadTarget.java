package nl.pim16aap2.beacon.launcher.download;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A file to download.
 *
 * @param name
 *     A short description used in errors, e.g. a library coordinate or asset name.
 * @param url
 *     Where to download the file from.
 * @param destination
 *     Where to store the file.
 * @param size
 *     The expected size in bytes, if known.
 * @param sha1
 *     The expected SHA-1 hash, if known.
 * @param archive
 *     Whether the file must be a readable zip archive.
 */
public record DownloadTarget(
    String name,
    URI url,
    Path destination,
    @Nullable Long size,
    @Nullable String sha1,
    boolean archive
)
{
    public DownloadTarget
    {
        Objects.requireNonNull(name, "name may not be null.");
        Objects.requireNonNull(url, "url may not be null.");
        Objects.requireNonNull(destination, "destination may not be null.");
    }

    public static DownloadTarget of(String name, URI url, Path destination, @Nullable Long size, @Nullable String sha1)
    {
        return new DownloadTarget(name, url, destination, size, sha1, false);
    }
}
