package nl.pim16aap2.beacon.launcher.util;

import nl.pim16aap2.beacon.runtime.error.LauncherException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class FileUtil
{
    private FileUtil()
    {
    }

    /**
     * Creates a directory if it does not already exist.
     *
     * @param path
     *     the directory to create.
     * @param name
     *     the name of the directory. This is used for error messages only.
     * @throws LauncherException
     *     If the path exists but is not a directory, or if the directory could not be created.
     */
    public static void createDirectories(Path path, String name)
        throws LauncherException
    {
        if (Files.exists(path) && !Files.isDirectory(path))
        {
            throw new LauncherException(
                "The path '" + path + "' exists but is not a directory."
            );
        }

        try
        {
            Files.createDirectories(path);
        }
        catch (IOException exception)
        {
            throw new LauncherException(
                "Failed to create directory '" + name + "' at path '" + path + "'.",
                exception
            );
        }
    }

    /**
     * Checks whether a file is already present with the expected size.
     * <p>
     * When no size is known, any non-empty regular file counts as present.
     *
     * @param file
     *     the file to check.
     * @param expectedSize
     *     the expected size in bytes, or {@code null} if unknown.
     * @return {@code true} if the file exists and matches the expected size.
     */
    public static boolean isPresentWithSize(Path file, @Nullable Long expectedSize)
    {
        if (!Files.isRegularFile(file))
            return false;

        try
        {
            final long actualSize = Files.size(file);
            return expectedSize == null ? actualSize > 0 : actualSize == expectedSize;
        }
        catch (IOException exception)
        {
            return false;
        }
    }

    /**
     * Moves a fully written temporary file to its final location, replacing whatever is there.
     *
     * @param source
     *     the temporary file.
     * @param target
     *     the final location.
     * @throws IOException
     *     If the file could not be moved.
     */
    public static void moveIntoPlace(Path source, Path target)
        throws IOException
    {
        try
        {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        catch (AtomicMoveNotSupportedException exception)
        {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Creates a sibling temporary file for downloading into {@code target}.
     *
     * @param target
     *     the final location of the download.
     * @return the temporary file path. The file itself is not created.
     */
    public static Path temporarySibling(Path target)
    {
        return target.resolveSibling(target.getFileName() + ".part");
    }
}
