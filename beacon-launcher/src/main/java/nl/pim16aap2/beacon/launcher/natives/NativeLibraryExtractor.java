package nl.pim16aap2.beacon.launcher.natives;

import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.ClientLayout;
import nl.pim16aap2.beacon.runtime.LibraryEntry;
import nl.pim16aap2.beacon.runtime.VersionProfile;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.result.ItemFailure;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Copies the platform libraries out of the native archives of a profile into a flat directory.
 */
@Log
public final class NativeLibraryExtractor
{
    static final List<String> NATIVE_SUFFIXES = List.of(".so", ".dll", ".dylib", ".jnilib");
    private static final String METADATA_DIRECTORY = "META-INF/";

    private final ClientLayout layout;

    public NativeLibraryExtractor(ClientLayout layout)
    {
        this.layout = Objects.requireNonNull(layout, "layout may not be null.");
    }

    /**
     * Extracts the native libraries of every native entry in the profile.
     * <p>
     * Files that already exist in the natives directory are left untouched. An archive that cannot be read is
     * recorded as a failure and does not stop the other archives.
     *
     * @param profile
     *     The resolved profile.
     * @param nativesDirectory
     *     The directory to extract into.
     * @return the number of extracted files and the archives that failed.
     * @throws LauncherException
     *     If the natives directory could not be created.
     */
    public ExtractionResult extract(VersionProfile profile, Path nativesDirectory)
        throws LauncherException
    {
        try
        {
            FileUtils.forceMkdir(nativesDirectory.toFile());
        }
        catch (IOException exception)
        {
            throw new LauncherException(
                "Failed to create natives directory '%s'.".formatted(nativesDirectory), exception);
        }

        int extractedCount = 0;
        final List<ItemFailure> errors = new ArrayList<>();
        for (final LibraryEntry library : profile.libraries())
        {
            if (!library.nativeLibrary())
                continue;

            final Path archive = layout.library(library.path());
            try
            {
                extractedCount += extractArchive(archive, nativesDirectory);
            }
            catch (IOException exception)
            {
                log.warning(() -> "Failed to extract natives from '%s': %s".formatted(archive, exception));
                errors.add(new ItemFailure(library.coordinate().toString(),
                    "Failed to extract '%s': %s".formatted(archive, exception.getMessage())));
            }
        }

        final int finalExtractedCount = extractedCount;
        log.fine(() -> "Extracted %d native files for %s into '%s'."
            .formatted(finalExtractedCount, profile.id(), nativesDirectory));
        return new ExtractionResult(extractedCount, errors);
    }

    static int extractArchive(Path archivePath, Path nativesDirectory)
        throws IOException
    {
        int extracted = 0;
        try (ZipInputStream zipInputStream = new ZipInputStream(Files.newInputStream(archivePath)))
        {
            ZipEntry entry;
            while ((entry = zipInputStream.getNextEntry()) != null)
            {
                final String entryName = entry.getName();
                if (entry.isDirectory() || !isNativeEntry(entryName))
                    continue;

                final String fileName = fileName(entryName);
                if (fileName.isEmpty() || fileName.equals("..") || fileName.equals("."))
                    continue;

                final Path target = nativesDirectory.resolve(fileName);
                if (Files.exists(target))
                    continue;

                try (OutputStream outputStream = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW))
                {
                    zipInputStream.transferTo(outputStream);
                    ++extracted;
                }
                catch (FileAlreadyExistsException exception)
                {
                    log.finest(() -> "Native file '%s' appeared during extraction; keeping it.".formatted(target));
                }
                zipInputStream.closeEntry();
            }
        }
        return extracted;
    }

    static boolean isNativeEntry(String entryName)
    {
        if (entryName.isBlank() || entryName.startsWith(METADATA_DIRECTORY))
            return false;

        final String lowerCaseName = entryName.toLowerCase(Locale.ROOT);
        return NATIVE_SUFFIXES.stream().anyMatch(lowerCaseName::endsWith);
    }

    private static String fileName(String entryName)
    {
        final String normalized = entryName.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
