package nl.pim16aap2.beacon.launcher.resolver;

import nl.pim16aap2.beacon.runtime.LibraryEntry;

/**
 * A library that must be present in exactly one designated version, regardless of merge priority.
 *
 * @param group
 *     The group id.
 * @param artifact
 *     The artifact id.
 * @param version
 *     The pinned version. Patch releases of this version, such as {@code 9.8.1} for {@code 9.8}, also match.
 */
public record PinnedLibrary(
    String group,
    String artifact,
    String version
)
{
    /**
     * The bytecode library both the base client and the loader ship; mixing its versions breaks class
     * transformation.
     */
    public static final PinnedLibrary ASM = new PinnedLibrary("org.ow2.asm", "asm", "9.8");

    public boolean appliesTo(LibraryEntry entry)
    {
        return !entry.nativeLibrary() &&
            entry.coordinate().classifier() == null &&
            group.equals(entry.coordinate().group()) &&
            artifact.equals(entry.coordinate().artifact());
    }

    public boolean isPinnedVersion(LibraryEntry entry)
    {
        final String candidate = entry.coordinate().version();
        return candidate.equals(version) || candidate.startsWith(version + ".");
    }
}
