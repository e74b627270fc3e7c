package nl.pim16aap2.beacon.launcher.resolver;

import nl.pim16aap2.beacon.runtime.LibraryCoordinate;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes merge priorities for library families that are known to conflict when two descriptors bring different
 * versions. Every other library has priority 0.
 */
public final class LibraryPriority
{
    static final Set<String> CONFLICT_PRONE_GROUPS = Set.of("org.ow2.asm");

    private static final Pattern VERSION_PATTERN = Pattern.compile("^(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

    private LibraryPriority()
    {
    }

    public static long of(LibraryCoordinate coordinate)
    {
        if (!CONFLICT_PRONE_GROUPS.contains(coordinate.group()))
            return 0L;
        return fromVersion(coordinate.version());
    }

    /**
     * Encodes the leading {@code major.minor.patch} numbers of a version so that newer versions sort higher.
     *
     * @param version
     *     the version string.
     * @return the encoded version, or 0 if the version does not start with a number.
     */
    static long fromVersion(String version)
    {
        final Matcher matcher = VERSION_PATTERN.matcher(version.trim());
        if (!matcher.find())
            return 0L;
        return part(matcher, 1) * 1_000_000L + part(matcher, 2) * 1_000L + part(matcher, 3);
    }

    private static long part(Matcher matcher, int group)
    {
        final String value = matcher.group(group);
        return value == null ? 0L : Math.min(Long.parseLong(value), 999L);
    }
}
