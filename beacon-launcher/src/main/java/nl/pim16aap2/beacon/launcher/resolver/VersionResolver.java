package nl.pim16aap2.beacon.launcher.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.runtime.VersionProfile;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.ResourceMissingException;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a version, optionally with a loader, into one flattened version profile.
 * <p>
 * Resolution has no side effects besides those of the {@link DescriptorSource}: the same descriptors always produce
 * the same profile.
 */
@Log
public final class VersionResolver
{
    private final DescriptorSource descriptorSource;
    private final VersionDescriptorParser parser;
    private final LibraryMerger libraryMerger;

    public VersionResolver(
        DescriptorSource descriptorSource,
        VersionDescriptorParser parser,
        LibraryMerger libraryMerger)
    {
        this.descriptorSource = Objects.requireNonNull(descriptorSource, "descriptorSource may not be null.");
        this.parser = Objects.requireNonNull(parser, "parser may not be null.");
        this.libraryMerger = Objects.requireNonNull(libraryMerger, "libraryMerger may not be null.");
    }

    /**
     * Resolves a version.
     *
     * @param versionId
     *     The base version id.
     * @param loaderSpec
     *     The loader to overlay, or {@code null} for the plain base version.
     * @return the resolved profile. Without a loader, this is the base descriptor as is.
     *
     * @throws LauncherException
     *     If a descriptor could not be obtained or parsed.
     */
    public VersionProfile resolve(String versionId, @Nullable LoaderSpec loaderSpec)
        throws LauncherException
    {
        final VersionProfile base = parser.parse(descriptorSource.baseDescriptor(versionId));
        if (loaderSpec == null)
        {
            log.fine(() -> "Resolved %s with %d libraries.".formatted(base.id(), base.libraries().size()));
            return base;
        }

        final VersionProfile loader = parser.parse(descriptorSource.loaderDescriptor(versionId, loaderSpec));
        final VersionProfile merged = merge(base, loader);
        log.fine(() -> "Resolved %s on top of %s with %d libraries."
            .formatted(merged.id(), base.id(), merged.libraries().size()));
        return merged;
    }

    /**
     * Resolves a profile from the descriptors stored by an earlier {@link #resolve(String, LoaderSpec)}, without
     * contacting any service.
     *
     * @param profileId
     *     The id of the resolved profile, which is the loader profile id when a loader was installed.
     * @return the same profile {@link #resolve(String, LoaderSpec)} produced from those descriptors.
     *
     * @throws ResourceMissingException
     *     If the profile, or the base version it inherits from, has no stored descriptor.
     * @throws LauncherException
     *     If a stored descriptor could not be read or parsed.
     */
    public VersionProfile resolveStored(String profileId)
        throws LauncherException
    {
        final VersionProfile profile = parser.parse(requireStored(profileId));
        final @Nullable String baseId = profile.inheritsFrom();
        if (baseId == null)
            return profile;
        return merge(parser.parse(requireStored(baseId)), profile);
    }

    private JsonNode requireStored(String versionId)
        throws LauncherException
    {
        return descriptorSource.storedDescriptor(versionId)
            .orElseThrow(() -> new ResourceMissingException(
                "Version %s has not been provisioned.".formatted(versionId)));
    }

    /**
     * Overlays a loader profile on its base profile.
     *
     * @param base
     *     The base profile.
     * @param loader
     *     The loader profile.
     * @return the merged profile, identified by the loader's id.
     */
    VersionProfile merge(VersionProfile base, VersionProfile loader)
    {
        return new VersionProfile(
            loader.id(),
            base.id(),
            loader.mainClass(),
            base.type(),
            libraryMerger.merge(loader.libraries(), base.libraries()),
            loader.assetIndex() != null ? loader.assetIndex() : base.assetIndex(),
            loader.clientDownload() != null ? loader.clientDownload() : base.clientDownload(),
            concat(base.gameArguments(), loader.gameArguments()),
            concat(base.jvmArguments(), loader.jvmArguments())
        );
    }

    private static List<String> concat(List<String> first, List<String> second)
    {
        final List<String> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }
}
