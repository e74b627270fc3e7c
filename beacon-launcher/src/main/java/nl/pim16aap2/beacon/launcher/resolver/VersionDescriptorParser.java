package nl.pim16aap2.beacon.launcher.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.runtime.LibraryCoordinate;
import nl.pim16aap2.beacon.runtime.LibraryEntry;
import nl.pim16aap2.beacon.runtime.VersionProfile;
import nl.pim16aap2.beacon.runtime.VersionProfile.AssetIndexReference;
import nl.pim16aap2.beacon.runtime.VersionProfile.DownloadReference;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Parses a version descriptor into a {@link VersionProfile} for one platform.
 * <p>
 * Libraries and arguments whose rules do not allow the platform are left out. Legacy {@code natives} maps are
 * expanded into classifier entries, and libraries without an explicit artifact are located with the Maven layout.
 */
@Log
public final class VersionDescriptorParser
{
    public static final String DEFAULT_MAIN_CLASS = "net.minecraft.client.main.Main";
    private static final String NATIVES_CLASSIFIER_PREFIX = "natives-";

    private final Platform platform;
    private final RuleEvaluator ruleEvaluator;
    private final URI defaultLibraryRepository;

    public VersionDescriptorParser(Platform platform, URI defaultLibraryRepository)
    {
        this.platform = Objects.requireNonNull(platform, "platform may not be null.");
        this.ruleEvaluator = new RuleEvaluator(platform);
        this.defaultLibraryRepository =
            Objects.requireNonNull(defaultLibraryRepository, "defaultLibraryRepository may not be null.");
    }

    public VersionProfile parse(JsonNode root)
        throws LauncherException
    {
        final String id = root.path("id").asText("");
        if (id.isBlank())
            throw new LauncherException("Version descriptor has no id.");

        final JsonNode arguments = root.path("arguments");
        final List<String> gameArguments;
        final List<String> jvmArguments;
        if (arguments.isObject())
        {
            gameArguments = parseArguments(arguments.path("game"));
            jvmArguments = parseArguments(arguments.path("jvm"));
        }
        else
        {
            gameArguments = splitLegacyArguments(root.path("minecraftArguments").asText(""));
            jvmArguments = List.of();
        }

        return new VersionProfile(
            id,
            textOrNull(root, "inheritsFrom"),
            root.path("mainClass").asText(DEFAULT_MAIN_CLASS),
            root.path("type").asText("release"),
            parseLibraries(id, root.path("libraries")),
            parseAssetIndex(root.path("assetIndex")),
            parseDownload(root.path("downloads").path("client")),
            gameArguments,
            jvmArguments
        );
    }

    private List<LibraryEntry> parseLibraries(String versionId, JsonNode libraries)
    {
        final List<LibraryEntry> entries = new ArrayList<>();
        for (final JsonNode library : libraries)
        {
            if (!ruleEvaluator.isAllowed(library.path("rules")))
                continue;

            final String name = library.path("name").asText("");
            final LibraryCoordinate coordinate;
            try
            {
                coordinate = LibraryCoordinate.parse(name);
            }
            catch (IllegalArgumentException exception)
            {
                log.warning(() -> "Skipping library with invalid name '%s' in version %s.".formatted(name, versionId));
                continue;
            }

            final JsonNode downloads = library.path("downloads");
            final JsonNode natives = library.path("natives");
            if (natives.isObject())
            {
                final @Nullable LibraryEntry nativeEntry = parseLegacyNative(library, coordinate, natives);
                if (nativeEntry != null)
                    entries.add(nativeEntry);
                // Legacy native-only libraries have no main artifact.
                if (!downloads.path("artifact").isObject())
                    continue;
            }

            final boolean nativeLibrary = coordinate.classifier() != null &&
                coordinate.classifier().startsWith(NATIVES_CLASSIFIER_PREFIX);
            entries.add(createEntry(library, coordinate, downloads.path("artifact"), nativeLibrary));
        }
        return entries;
    }

    private @Nullable LibraryEntry parseLegacyNative(
        JsonNode library,
        LibraryCoordinate coordinate,
        JsonNode natives)
    {
        final String classifierTemplate = natives.path(platform.osName()).asText("");
        if (classifierTemplate.isBlank())
            return null;

        final String classifier = classifierTemplate.replace("${arch}", platform.archBits());
        final JsonNode artifact = library.path("downloads").path("classifiers").path(classifier);
        return createEntry(library, coordinate.withClassifier(classifier), artifact, true);
    }

    private LibraryEntry createEntry(
        JsonNode library,
        LibraryCoordinate coordinate,
        JsonNode artifact,
        boolean nativeLibrary)
    {
        final String path = artifact.path("path").asText("");
        final String url = artifact.path("url").asText("");
        final String resolvedPath = path.isBlank() ? coordinate.mavenPath() : path;

        final @Nullable URI resolvedUrl;
        if (!url.isBlank())
            resolvedUrl = URI.create(url);
        else if (artifact.isObject())
            // An explicit artifact without a URL is expected to be installed by other means.
            resolvedUrl = null;
        else
            resolvedUrl = URI.create(withTrailingSlash(library.path("url").asText(defaultLibraryRepository.toString()))
                + resolvedPath);

        return new LibraryEntry(
            coordinate,
            resolvedPath,
            resolvedUrl,
            artifact.has("size") ? artifact.path("size").asLong() : null,
            textOrNull(artifact, "sha1"),
            nativeLibrary,
            LibraryPriority.of(coordinate)
        );
    }

    private List<String> parseArguments(JsonNode arguments)
    {
        final List<String> parsed = new ArrayList<>();
        for (final JsonNode argument : arguments)
        {
            if (argument.isTextual())
            {
                parsed.add(argument.asText());
                continue;
            }

            if (!ruleEvaluator.isAllowed(argument.path("rules")))
                continue;

            final JsonNode value = argument.path("value");
            if (value.isTextual())
                parsed.add(value.asText());
            else if (value.isArray())
                value.forEach(element -> parsed.add(element.asText()));
        }
        return parsed;
    }

    private static @Nullable AssetIndexReference parseAssetIndex(JsonNode assetIndex)
    {
        if (!assetIndex.isObject() || !assetIndex.hasNonNull("id") || !assetIndex.hasNonNull("url"))
            return null;
        return new AssetIndexReference(
            assetIndex.path("id").asText(),
            URI.create(assetIndex.path("url").asText()),
            assetIndex.has("size") ? assetIndex.path("size").asLong() : null,
            textOrNull(assetIndex, "sha1")
        );
    }

    private static @Nullable DownloadReference parseDownload(JsonNode download)
    {
        if (!download.isObject() || !download.hasNonNull("url"))
            return null;
        return new DownloadReference(
            URI.create(download.path("url").asText()),
            download.has("size") ? download.path("size").asLong() : null,
            textOrNull(download, "sha1")
        );
    }

    private static List<String> splitLegacyArguments(String arguments)
    {
        if (arguments.isBlank())
            return List.of();
        return Arrays.asList(arguments.trim().split("\\s+"));
    }

    private static @Nullable String textOrNull(JsonNode node, String field)
    {
        final JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    private static String withTrailingSlash(String url)
    {
        return url.endsWith("/") ? url : url + "/";
    }
}
