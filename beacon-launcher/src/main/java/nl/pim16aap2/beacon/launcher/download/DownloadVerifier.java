package nl.pim16aap2.beacon.launcher.download;

import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.ResourceMissingException;
import nl.pim16aap2.beacon.runtime.error.VerificationFailedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.ZipFile;

/**
 * Checks a downloaded file against what its {@link DownloadTarget} promises.
 * <p>
 * A file that fails a check is deleted so it is downloaded again on the next run.
 */
@Log
final class DownloadVerifier
{
    private DownloadVerifier()
    {
    }

    /**
     * Verifies the size, the SHA-1 hash and, for archives, the readability of a downloaded file.
     *
     * @param target
     *     The target that was just downloaded.
     * @throws VerificationFailedException
     *     If the file does not match; the file has been deleted.
     * @throws ResourceMissingException
     *     If the file does not exist.
     */
    static void verify(DownloadTarget target)
        throws LauncherException
    {
        final Path destination = target.destination();
        if (!Files.isRegularFile(destination))
            throw new ResourceMissingException(
                "Expected '%s' to exist after downloading %s.".formatted(destination, target.name()));

        final Long expectedSize = target.size();
        if (expectedSize != null)
        {
            final long actualSize = size(destination);
            if (actualSize != expectedSize)
                reject(target, "expected %d bytes but got %d".formatted(expectedSize, actualSize));
        }

        final String expectedSha1 = target.sha1();
        if (expectedSha1 != null)
        {
            final String actualSha1 = sha1(destination);
            if (!actualSha1.equals(expectedSha1.toLowerCase(Locale.ROOT)))
                reject(target, "expected SHA-1 %s but got %s".formatted(expectedSha1, actualSha1));
        }

        if (target.archive())
            verifyArchive(target);
    }

    /**
     * Computes the lowercase hex SHA-1 hash of a file.
     */
    // The game's metadata only publishes SHA-1 checksums.
    @SuppressWarnings("deprecation")
    static String sha1(Path file)
        throws VerificationFailedException
    {
        try
        {
            return MoreFiles.asByteSource(file).hash(Hashing.sha1()).toString();
        }
        catch (IOException exception)
        {
            throw new VerificationFailedException("Failed to compute SHA-1 for file '%s'.".formatted(file), exception);
        }
    }

    private static long size(Path file)
        throws VerificationFailedException
    {
        try
        {
            return Files.size(file);
        }
        catch (IOException exception)
        {
            throw new VerificationFailedException("Failed to read the size of '%s'.".formatted(file), exception);
        }
    }

    private static void verifyArchive(DownloadTarget target)
        throws VerificationFailedException
    {
        try (ZipFile ignored = new ZipFile(target.destination().toFile()))
        {
            log.finest(() -> "Verified archive " + target.destination() + ".");
        }
        catch (IOException exception)
        {
            reject(target, "it is not a readable archive");
        }
    }

    private static void reject(DownloadTarget target, String reason)
        throws VerificationFailedException
    {
        try
        {
            Files.deleteIfExists(target.destination());
        }
        catch (IOException exception)
        {
            throw new VerificationFailedException(
                "Rejected %s (%s) but failed to delete it.".formatted(target.name(), reason), exception);
        }
        throw new VerificationFailedException("Rejected download of %s: %s.".formatted(target.name(), reason));
    }
}
