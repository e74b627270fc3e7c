package nl.pim16aap2.beacon.runtime;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A Maven-style library coordinate.
 *
 * @param group
 *     The group id, e.g. {@code org.ow2.asm}.
 * @param artifact
 *     The artifact id, e.g. {@code asm}.
 * @param version
 *     The version string.
 * @param classifier
 *     The optional classifier, e.g. {@code natives-linux}.
 * @param extension
 *     The file extension, {@code jar} unless the coordinate specified otherwise with {@code @ext}.
 */
public record LibraryCoordinate(
    String group,
    String artifact,
    String version,
    @Nullable String classifier,
    String extension
)
{
    private static final String DEFAULT_EXTENSION = "jar";

    public LibraryCoordinate
    {
        Objects.requireNonNull(group, "group may not be null.");
        Objects.requireNonNull(artifact, "artifact may not be null.");
        Objects.requireNonNull(version, "version may not be null.");
        Objects.requireNonNull(extension, "extension may not be null.");
        if (classifier != null && classifier.isBlank())
            classifier = null;
    }

    /**
     * Parses a coordinate of the form {@code group:artifact:version[:classifier][@extension]}.
     *
     * @param name
     *     The coordinate string.
     * @return the parsed coordinate.
     *
     * @throws IllegalArgumentException
     *     If the coordinate does not have at least three parts.
     */
    public static LibraryCoordinate parse(String name)
    {
        Objects.requireNonNull(name, "name may not be null.");

        String coordinates = name.trim();
        String extension = DEFAULT_EXTENSION;
        final int extensionIndex = coordinates.indexOf('@');
        if (extensionIndex >= 0)
        {
            extension = coordinates.substring(extensionIndex + 1);
            coordinates = coordinates.substring(0, extensionIndex);
        }

        final String[] parts = coordinates.split(":");
        if (parts.length < 3 || parts.length > 4)
            throw new IllegalArgumentException("Invalid library coordinate: '%s'.".formatted(name));

        return new LibraryCoordinate(parts[0], parts[1], parts[2], parts.length == 4 ? parts[3] : null, extension);
    }

    /**
     * Creates a copy of this coordinate with another classifier.
     *
     * @param newClassifier
     *     The classifier to use.
     * @return the new coordinate.
     */
    public LibraryCoordinate withClassifier(@Nullable String newClassifier)
    {
        return new LibraryCoordinate(group, artifact, version, newClassifier, extension);
    }

    /**
     * Gets the {@code group:artifact} pair.
     *
     * @return the group and artifact joined by a colon.
     */
    public String groupAndArtifact()
    {
        return group + ":" + artifact;
    }

    /**
     * Gets the repository-relative path of this artifact using the standard Maven layout.
     *
     * @return the path, always separated with forward slashes.
     */
    public String mavenPath()
    {
        return "%s/%s/%s/%s-%s%s.%s".formatted(
            group.replace('.', '/'),
            artifact,
            version,
            artifact,
            version,
            classifier == null ? "" : "-" + classifier,
            extension
        );
    }

    @Override
    public String toString()
    {
        final String base = "%s:%s:%s".formatted(group, artifact, version);
        final String withClassifier = classifier == null ? base : base + ":" + classifier;
        return DEFAULT_EXTENSION.equals(extension) ? withClassifier : withClassifier + "@" + extension;
    }
}
