package nl.pim16aap2.beacon.launcher.launch;

import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.ClientLayout;
import nl.pim16aap2.beacon.launcher.resolver.Platform;
import nl.pim16aap2.beacon.runtime.CredentialRecord;
import nl.pim16aap2.beacon.runtime.LaunchPlan;
import nl.pim16aap2.beacon.runtime.LibraryEntry;
import nl.pim16aap2.beacon.runtime.VersionProfile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@link LaunchPlan} for a profile.
 * <p>
 * The templated arguments of the profile are filled in with the credential, the on-disk layout and the launch
 * options. Placeholders this builder does not know are kept as they are.
 */
@Log
public final class LaunchArgumentBuilder
{
    static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_]+)}");
    static final int INITIAL_HEAP_CAP_MB = 1024;
    static final String USER_TYPE = "msa";

    /**
     * The garbage collector tuning flags added to every launch.
     */
    public static final List<String> GC_FLAGS = List.of(
        "-XX:+UseG1GC",
        "-XX:+ParallelRefProcEnabled",
        "-XX:MaxGCPauseMillis=200",
        "-XX:+UnlockExperimentalVMOptions",
        "-XX:+DisableExplicitGC",
        "-XX:+AlwaysPreTouch",
        "-XX:G1NewSizePercent=30",
        "-XX:G1MaxNewSizePercent=40",
        "-XX:G1HeapRegionSize=8M",
        "-XX:G1ReservePercent=20",
        "-XX:G1HeapWastePercent=5",
        "-XX:G1MixedGCCountTarget=4",
        "-XX:InitiatingHeapOccupancyPercent=15",
        "-XX:G1MixedGCLiveThresholdPercent=90",
        "-XX:G1RSetUpdatingPauseTimePercent=5",
        "-XX:SurvivorRatio=32",
        "-XX:+PerfDisableSharedMem",
        "-XX:MaxTenuringThreshold=1"
    );

    private final Platform platform;
    private final ClientLayout layout;
    private final String launcherName;
    private final String launcherVersion;

    public LaunchArgumentBuilder(Platform platform, ClientLayout layout, String launcherName, String launcherVersion)
    {
        this.platform = Objects.requireNonNull(platform, "platform may not be null.");
        this.layout = Objects.requireNonNull(layout, "layout may not be null.");
        this.launcherName = Objects.requireNonNull(launcherName, "launcherName may not be null.");
        this.launcherVersion = Objects.requireNonNull(launcherVersion, "launcherVersion may not be null.");
    }

    public LaunchPlan build(VersionProfile profile, CredentialRecord credential, LaunchOptions options)
    {
        final Path nativesDirectory = layout.nativesDirectory(profile.id());
        final List<String> classpath = classpath(profile);
        final String joinedClasspath = String.join(platform.classpathSeparator(), classpath);
        final Map<String, String> values = placeholderValues(profile, credential, options, nativesDirectory,
            joinedClasspath);

        final List<String> jvmArguments = new ArrayList<>();
        jvmArguments.add("-Xmx" + options.maxMemoryMb() + "M");
        jvmArguments.add("-Xms" + Math.min(INITIAL_HEAP_CAP_MB, options.maxMemoryMb()) + "M");
        jvmArguments.addAll(GC_FLAGS);

        if (!references(profile.jvmArguments(), "natives_directory"))
            jvmArguments.add("-Djava.library.path=" + nativesDirectory);
        jvmArguments.addAll(substituteAll(profile.jvmArguments(), values));
        if (!references(profile.jvmArguments(), "classpath"))
        {
            jvmArguments.add("-cp");
            jvmArguments.add(joinedClasspath);
        }

        final List<String> gameArguments = new ArrayList<>(substituteAll(profile.gameArguments(), values));
        final String serverHost = options.serverHost();
        if (serverHost != null && !serverHost.isBlank())
        {
            gameArguments.add("--server");
            gameArguments.add(serverHost);
            final Integer serverPort = options.serverPort();
            if (serverPort != null)
            {
                gameArguments.add("--port");
                gameArguments.add(Integer.toString(serverPort));
            }
        }

        log.fine(() -> "Built launch plan for %s with %d classpath entries."
            .formatted(profile.id(), classpath.size()));
        return new LaunchPlan(
            profile.id(),
            options.javaExecutable(),
            jvmArguments,
            profile.mainClass(),
            gameArguments,
            classpath,
            nativesDirectory,
            options.gameDirectory()
        );
    }

    /**
     * Lists the classpath of a profile: every library followed by the client archive, without duplicates.
     */
    List<String> classpath(VersionProfile profile)
    {
        final Set<String> entries = new LinkedHashSet<>();
        for (final LibraryEntry library : profile.libraries())
            entries.add(layout.library(library.path()).toString());
        entries.add(layout.clientJar(profile.clientJarVersion()).toString());
        return List.copyOf(entries);
    }

    private Map<String, String> placeholderValues(
        VersionProfile profile,
        CredentialRecord credential,
        LaunchOptions options,
        Path nativesDirectory,
        String joinedClasspath)
    {
        final VersionProfile.AssetIndexReference assetIndex = profile.assetIndex();

        final Map<String, String> values = new HashMap<>();
        values.put("auth_player_name", credential.playerName());
        values.put("auth_uuid", credential.playerId());
        values.put("auth_access_token", credential.accessToken());
        values.put("auth_user_type", USER_TYPE);
        values.put("user_type", USER_TYPE);
        values.put("auth_xuid", "0");
        values.put("clientid", credential.clientToken());
        values.put("user_properties", "{}");
        values.put("version_name", profile.id());
        values.put("version_type", profile.type());
        values.put("game_directory", options.gameDirectory().toString());
        values.put("assets_root", layout.assetsDirectory().toString());
        values.put("assets_index_name", assetIndex == null ? profile.clientJarVersion() : assetIndex.id());
        values.put("natives_directory", nativesDirectory.toString());
        values.put("launcher_name", launcherName);
        values.put("launcher_version", launcherVersion);
        values.put("classpath", joinedClasspath);
        values.put("classpath_separator", platform.classpathSeparator());
        values.put("library_directory", layout.librariesDirectory().toString());
        return values;
    }

    private static List<String> substituteAll(List<String> templates, Map<String, String> values)
    {
        final List<String> result = new ArrayList<>(templates.size());
        for (final String template : templates)
            result.add(substitute(template, values));
        return result;
    }

    /**
     * Replaces every known {@code ${name}} placeholder in a template.
     *
     * @param template
     *     The template to fill in.
     * @param values
     *     The placeholder values by name.
     * @return the filled in template. Unknown placeholders are kept verbatim.
     */
    static String substitute(String template, Map<String, String> values)
    {
        final Matcher matcher = PLACEHOLDER.matcher(template);
        final StringBuilder result = new StringBuilder();
        while (matcher.find())
        {
            final String value = values.get(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static boolean references(List<String> templates, String placeholder)
    {
        final String token = "${" + placeholder + "}";
        return templates.stream().anyMatch(template -> template.contains(token));
    }
}
