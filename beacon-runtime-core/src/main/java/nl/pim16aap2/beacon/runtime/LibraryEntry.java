package nl.pim16aap2.beacon.runtime;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.Objects;

/**
 * A single library that is part of a version profile.
 *
 * @param coordinate
 *     The coordinate of the library.
 * @param path
 *     The path of the artifact relative to the libraries directory, separated with forward slashes.
 * @param url
 *     The download location, or {@code null} if the artifact is expected to be present already.
 * @param size
 *     The expected size in bytes, if known.
 * @param sha1
 *     The expected SHA-1 hash, if known.
 * @param nativeLibrary
 *     Whether this artifact contains platform-specific binaries for the current platform.
 * @param priority
 *     The merge priority. Entries with a higher priority win when two entries share a merge key.
 */
public record LibraryEntry(
    LibraryCoordinate coordinate,
    String path,
    @Nullable URI url,
    @Nullable Long size,
    @Nullable String sha1,
    boolean nativeLibrary,
    long priority
)
{
    public LibraryEntry
    {
        Objects.requireNonNull(coordinate, "coordinate may not be null.");
        Objects.requireNonNull(path, "path may not be null.");
    }

    /**
     * Gets the key under which this entry is deduplicated.
     * <p>
     * Ordinary libraries are keyed by {@code group:artifact}. Native libraries and other classified artifacts are
     * keyed by their full coordinate, so they never collapse with the plain artifact or with each other.
     *
     * @return the merge key.
     */
    public String mergeKey()
    {
        if (nativeLibrary || coordinate.classifier() != null)
            return coordinate.toString();
        return coordinate.groupAndArtifact();
    }

    /**
     * Creates a copy of this entry with another priority.
     *
     * @param newPriority
     *     The priority to use.
     * @return the new entry.
     */
    public LibraryEntry withPriority(long newPriority)
    {
        return new LibraryEntry(coordinate, path, url, size, sha1, nativeLibrary, newPriority);
    }
}
