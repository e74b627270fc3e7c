package nl.pim16aap2.beacon.launcher.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.LauncherEndpoints;
import nl.pim16aap2.beacon.launcher.net.JsonHttpClient;
import nl.pim16aap2.beacon.launcher.util.FileUtil;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.ResourceMissingException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetches descriptors from the runtime version manifest and the loader metadata service.
 * <p>
 * Every fetched descriptor is stored as {@code versions/<id>/<id>.json}. When a service cannot be reached, a
 * previously stored descriptor is used instead.
 */
@Log
public final class RemoteDescriptorSource implements DescriptorSource
{
    private final JsonHttpClient httpClient;
    private final LauncherEndpoints endpoints;
    private final Path versionsDirectory;
    private final ObjectMapper writer = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @GuardedBy("this")
    private @Nullable JsonNode versionManifest;

    public RemoteDescriptorSource(JsonHttpClient httpClient, LauncherEndpoints endpoints, Path versionsDirectory)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient may not be null.");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints may not be null.");
        this.versionsDirectory = Objects.requireNonNull(versionsDirectory, "versionsDirectory may not be null.");
    }

    public static Path descriptorPath(Path versionsDirectory, String versionId)
    {
        return versionsDirectory.resolve(versionId).resolve(versionId + ".json");
    }

    @Override
    public JsonNode baseDescriptor(String versionId)
        throws LauncherException
    {
        try
        {
            final URI descriptorUri = findVersionUri(versionManifest(), versionId);
            final JsonNode descriptor = httpClient.getJson(descriptorUri);
            store(versionId, descriptor);
            return descriptor;
        }
        catch (TransientNetworkException exception)
        {
            return readStored(versionId, exception);
        }
    }

    @Override
    public JsonNode loaderDescriptor(String baseVersionId, LoaderSpec loaderSpec)
        throws LauncherException
    {
        final String loaderVersion;
        try
        {
            loaderVersion = loaderSpec.isLatest() ? latestLoaderVersion() : loaderSpec.version();
        }
        catch (TransientNetworkException exception)
        {
            throw new TransientNetworkException(
                "Could not resolve the latest %s loader version.".formatted(loaderSpec.type()), exception);
        }

        final String loaderId = "fabric-loader-%s-%s".formatted(loaderVersion, baseVersionId);
        try
        {
            final URI profileUri = URI.create("%s/versions/loader/%s/%s/profile/json".formatted(
                endpoints.loaderMetaUri(), encode(baseVersionId), encode(loaderVersion)));
            final JsonNode descriptor = httpClient.getJson(profileUri);
            store(descriptor.path("id").asText(loaderId), descriptor);
            return descriptor;
        }
        catch (TransientNetworkException exception)
        {
            return readStored(loaderId, exception);
        }
    }

    private String latestLoaderVersion()
        throws LauncherException
    {
        final JsonNode loaders = httpClient.getJson(URI.create(endpoints.loaderMetaUri() + "/versions/loader"));
        @Nullable JsonNode first = null;
        for (final JsonNode loader : loaders)
        {
            if (first == null)
                first = loader;
            if (loader.path("stable").asBoolean(false))
                return requireVersion(loader);
        }
        if (first == null)
            throw new ResourceMissingException("The loader metadata service lists no loader versions.");
        return requireVersion(first);
    }

    private synchronized JsonNode versionManifest()
        throws LauncherException
    {
        if (versionManifest == null)
            versionManifest = httpClient.getJson(endpoints.versionManifestUri());
        return versionManifest;
    }

    private static URI findVersionUri(JsonNode manifest, String versionId)
        throws LauncherException
    {
        for (final JsonNode version : manifest.path("versions"))
        {
            if (versionId.equals(version.path("id").asText()))
            {
                final String url = version.path("url").asText("");
                if (url.isBlank())
                    break;
                return URI.create(url);
            }
        }
        throw new ResourceMissingException("Version '%s' is not listed in the version manifest.".formatted(versionId));
    }

    private void store(String versionId, JsonNode descriptor)
        throws LauncherException
    {
        final Path path = descriptorPath(versionsDirectory, versionId);
        FileUtil.createDirectories(path.getParent(), "version directory");
        try
        {
            writer.writeValue(path.toFile(), descriptor);
        }
        catch (IOException exception)
        {
            throw new LauncherException("Failed to store descriptor at '%s'.".formatted(path), exception);
        }
    }

    @Override
    public Optional<JsonNode> storedDescriptor(String versionId)
        throws LauncherException
    {
        final Path path = descriptorPath(versionsDirectory, versionId);
        if (!Files.isRegularFile(path))
            return Optional.empty();
        try
        {
            return Optional.of(writer.readTree(path.toFile()));
        }
        catch (IOException exception)
        {
            throw new LauncherException("Failed to read stored descriptor '%s'.".formatted(path), exception);
        }
    }

    private JsonNode readStored(String versionId, TransientNetworkException cause)
        throws LauncherException
    {
        final Optional<JsonNode> stored = storedDescriptor(versionId);
        if (stored.isEmpty())
            throw cause;

        log.warning(() -> "Using stored descriptor for %s because the service is unreachable: %s"
            .formatted(versionId, cause.getMessage()));
        return stored.get();
    }

    private static String requireVersion(JsonNode loader)
        throws LauncherException
    {
        final String version = loader.path("version").asText("");
        if (version.isBlank())
            throw new LauncherException("Loader metadata entry has no version.");
        return version;
    }

    private static String encode(String value)
    {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
