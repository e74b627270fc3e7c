package nl.pim16aap2.beacon.launcher.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import nl.pim16aap2.beacon.runtime.error.LauncherException;

import java.util.Optional;

/**
 * Supplies raw version descriptors.
 */
public interface DescriptorSource
{
    /**
     * Gets the descriptor of a base runtime version.
     *
     * @param versionId
     *     The version id, e.g. {@code 1.21.4}.
     * @return the descriptor.
     *
     * @throws LauncherException
     *     If the version is unknown or its descriptor could not be obtained.
     */
    JsonNode baseDescriptor(String versionId)
        throws LauncherException;

    /**
     * Gets the descriptor of a loader for a base version.
     *
     * @param baseVersionId
     *     The base version the loader targets.
     * @param loaderSpec
     *     The loader to get the descriptor for.
     * @return the descriptor.
     *
     * @throws LauncherException
     *     If the loader version is unknown or its descriptor could not be obtained.
     */
    JsonNode loaderDescriptor(String baseVersionId, LoaderSpec loaderSpec)
        throws LauncherException;

    /**
     * Gets a descriptor stored by an earlier resolution without contacting any service.
     *
     * @param versionId
     *     The id of the stored profile, which is the loader profile id for loader profiles.
     * @return the stored descriptor, or an empty optional if there is none.
     *
     * @throws LauncherException
     *     If a stored descriptor exists but could not be read.
     */
    Optional<JsonNode> storedDescriptor(String versionId)
        throws LauncherException;
}
