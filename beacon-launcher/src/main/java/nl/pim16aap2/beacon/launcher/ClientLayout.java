package nl.pim16aap2.beacon.launcher;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The on-disk layout of a client installation.
 *
 * @param root
 *     The client data directory.
 */
public record ClientLayout(Path root)
{
    public ClientLayout
    {
        Objects.requireNonNull(root, "root may not be null.");
    }

    public Path versionsDirectory()
    {
        return root.resolve("versions");
    }

    public Path versionDirectory(String versionId)
    {
        return versionsDirectory().resolve(versionId);
    }

    public Path descriptor(String versionId)
    {
        return versionDirectory(versionId).resolve(versionId + ".json");
    }

    public Path clientJar(String versionId)
    {
        return versionDirectory(versionId).resolve(versionId + ".jar");
    }

    public Path librariesDirectory()
    {
        return root.resolve("libraries");
    }

    /**
     * Resolves a library path written with forward slashes against the libraries directory.
     *
     * @param relativePath
     *     the path relative to the libraries directory.
     * @return the absolute location of the library.
     */
    public Path library(String relativePath)
    {
        Path path = librariesDirectory();
        for (final String segment : relativePath.split("/"))
        {
            if (!segment.isEmpty())
                path = path.resolve(segment);
        }
        return path;
    }

    public Path assetsDirectory()
    {
        return root.resolve("assets");
    }

    public Path assetIndex(String indexId)
    {
        return assetsDirectory().resolve("indexes").resolve(indexId + ".json");
    }

    public Path assetObject(String hash)
    {
        return assetsDirectory().resolve("objects").resolve(hash.substring(0, 2)).resolve(hash);
    }

    public Path nativesDirectory(String versionId)
    {
        return root.resolve("natives").resolve(versionId);
    }
}
