package nl.pim16aap2.beacon.launcher.download;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import nl.pim16aap2.beacon.runtime.error.ResourceMissingException;
import nl.pim16aap2.beacon.runtime.error.VerificationFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownloadVerifierTest
{
    private static final String ABC_SHA1 = "a9993e364706816aba3e25717850c26c9cd0d89d";
    private static final URI SOURCE = URI.create("https://resources.example.net/abc");

    @TempDir
    Path directory;

    @Test
    void sha1_shouldHashFileContents()
        throws IOException, VerificationFailedException
    {
        // setup
        try (FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix()))
        {
            final Path file = fileSystem.getPath("abc.txt");
            Files.writeString(file, "abc");

            // execute
            final String hash = DownloadVerifier.sha1(file);

            // verify
            assertThat(hash).isEqualTo(ABC_SHA1);
        }
    }

    @Test
    void sha1_shouldThrowForMissingFile()
        throws IOException
    {
        // setup
        try (FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix()))
        {
            final Path file = fileSystem.getPath("missing.txt");

            // execute & verify
            assertThatThrownBy(() -> DownloadVerifier.sha1(file))
                .isInstanceOf(VerificationFailedException.class)
                .hasMessageContaining("missing.txt");
        }
    }

    @Test
    void verify_shouldAcceptUppercaseExpectedHash()
        throws IOException
    {
        // setup
        final Path file = Files.writeString(directory.resolve("abc"), "abc");

        // execute & verify
        assertThatCode(() -> DownloadVerifier.verify(
            DownloadTarget.of("abc", SOURCE, file, 3L, ABC_SHA1.toUpperCase(Locale.ROOT))))
            .doesNotThrowAnyException();
        assertThat(file).exists();
    }

    @Test
    void verify_shouldDeleteFileWithWrongSize()
        throws IOException
    {
        // setup
        final Path file = Files.writeString(directory.resolve("abc"), "abc");

        // execute & verify
        assertThatThrownBy(() -> DownloadVerifier.verify(DownloadTarget.of("abc", SOURCE, file, 4L, null)))
            .isInstanceOf(VerificationFailedException.class)
            .hasMessage("Rejected download of abc: expected 4 bytes but got 3.");
        assertThat(file).doesNotExist();
    }

    @Test
    void verify_shouldReportMissingFile()
    {
        // setup
        final Path file = directory.resolve("absent");

        // execute & verify
        assertThatThrownBy(() -> DownloadVerifier.verify(DownloadTarget.of("absent", SOURCE, file, null, null)))
            .isInstanceOf(ResourceMissingException.class);
    }

    @Test
    void verify_shouldRejectArchiveThatCannotBeOpened()
        throws IOException
    {
        // setup
        final Path file = Files.writeString(directory.resolve("client.jar"), "not a zip");

        // execute & verify
        assertThatThrownBy(() -> DownloadVerifier.verify(
            new DownloadTarget("client", SOURCE, file, null, null, true)))
            .isInstanceOf(VerificationFailedException.class)
            .hasMessageContaining("not a readable archive");
        assertThat(file).doesNotExist();
    }
}
