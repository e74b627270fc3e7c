package nl.pim16aap2.beacon.launcher.auth;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.util.FileUtil;
import nl.pim16aap2.beacon.runtime.CredentialRecord;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.Objects;

/**
 * Reads and writes the credential file of a client installation.
 * <p>
 * Only the scalar fields of a {@link CredentialRecord} are written; timestamps are stored as epoch milliseconds.
 */
@Log
public final class CredentialStore
{
    public static final String FILE_NAME = "beacon-auth.json";

    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public CredentialStore(Path clientDataDirectory)
    {
        this.file = Objects.requireNonNull(clientDataDirectory, "clientDataDirectory may not be null.")
            .resolve(FILE_NAME);
    }

    public Path file()
    {
        return file;
    }

    public void write(CredentialRecord credentials)
        throws LauncherException
    {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null)
            FileUtil.createDirectories(parent, "client data directory");

        final Path temporaryFile = FileUtil.temporarySibling(file);
        try
        {
            objectMapper.writeValue(temporaryFile.toFile(), StoredCredentials.of(credentials));
            restrictToOwner(temporaryFile);
            FileUtil.moveIntoPlace(temporaryFile, file);
        }
        catch (IOException exception)
        {
            throw new LauncherException("Failed to write credentials to '%s'.".formatted(file), exception);
        }
        log.fine(() -> "Saved credentials for " + credentials.playerName() + ".");
    }

    /**
     * Reads the credential file.
     *
     * @return the load result. A missing file yields {@link LoadStatus#NOT_FOUND} and an unreadable or incomplete file
     * yields {@link LoadStatus#CORRUPT}; neither is thrown.
     */
    public LoadResult read()
    {
        if (Files.notExists(file))
            return new LoadResult(LoadStatus.NOT_FOUND, null, null);

        try
        {
            final StoredCredentials stored = objectMapper.readValue(file.toFile(), StoredCredentials.class);
            return new LoadResult(LoadStatus.FOUND, stored.toRecord(), null);
        }
        catch (IOException | RuntimeException exception)
        {
            log.warning(() -> "Credential file '%s' could not be read: %s".formatted(file, exception.getMessage()));
            return new LoadResult(
                LoadStatus.CORRUPT,
                null,
                "Credential file '%s' could not be read: %s".formatted(file, exception.getMessage())
            );
        }
    }

    /**
     * Deletes the credential file.
     *
     * @return {@code true} if a file was deleted.
     *
     * @throws LauncherException
     *     If the file exists but could not be deleted.
     */
    public boolean delete()
        throws LauncherException
    {
        try
        {
            return Files.deleteIfExists(file);
        }
        catch (IOException exception)
        {
            throw new LauncherException("Failed to delete credential file '%s'.".formatted(file), exception);
        }
    }

    private static void restrictToOwner(Path path)
        throws IOException
    {
        if (path.getFileSystem().supportedFileAttributeViews().contains("posix"))
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
    }

    /**
     * The outcome of reading the credential file.
     */
    public enum LoadStatus
    {
        FOUND,
        NOT_FOUND,
        CORRUPT
    }

    /**
     * @param status
     *     The outcome.
     * @param credentials
     *     The loaded credentials when {@code status} is {@link LoadStatus#FOUND}.
     * @param error
     *     The reason the file could not be read when {@code status} is {@link LoadStatus#CORRUPT}.
     */
    public record LoadResult(
        LoadStatus status,
        @Nullable CredentialRecord credentials,
        @Nullable String error
    )
    {
    }

    private record StoredCredentials(
        String accessToken,
        @Nullable String identityRefreshToken,
        @Nullable String identityAccessToken,
        String clientToken,
        String playerId,
        String playerName,
        long savedAt,
        @Nullable Long lastRefresh
    )
    {
        static StoredCredentials of(CredentialRecord credentials)
        {
            final Instant lastRefresh = credentials.lastRefresh();
            return new StoredCredentials(
                credentials.accessToken(),
                credentials.identityRefreshToken(),
                credentials.identityAccessToken(),
                credentials.clientToken(),
                credentials.playerId(),
                credentials.playerName(),
                credentials.savedAt().toEpochMilli(),
                lastRefresh == null ? null : lastRefresh.toEpochMilli()
            );
        }

        CredentialRecord toRecord()
        {
            return new CredentialRecord(
                accessToken,
                identityRefreshToken,
                identityAccessToken,
                clientToken,
                playerId,
                playerName,
                Instant.ofEpochMilli(savedAt),
                lastRefresh == null ? null : Instant.ofEpochMilli(lastRefresh)
            );
        }
    }
}
