package nl.pim16aap2.beacon.launcher.download;

import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.net.HttpStatusPolicy;
import nl.pim16aap2.beacon.launcher.util.FileUtil;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Downloads files with {@link URLConnection}, writing them through commons-io.
 * <p>
 * Redirects are followed here rather than by the connection, which refuses to switch protocols.
 */
@Log
public final class UrlConnectionDownloader implements Downloader
{
    private static final int BUFFER_SIZE = 8192;

    private final String userAgent;
    private final Duration requestTimeout;

    public UrlConnectionDownloader(String userAgent)
    {
        this(userAgent, REQUEST_TIMEOUT);
    }

    UrlConnectionDownloader(String userAgent, Duration requestTimeout)
    {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent may not be null.");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout may not be null.");
    }

    @Override
    public void download(URI uri, Path target)
        throws LauncherException
    {
        final long deadline = System.nanoTime() + requestTimeout.toNanos();
        download(uri, target, 0, deadline);
    }

    private void download(URI uri, Path target, int redirects, long deadline)
        throws LauncherException
    {
        final URLConnection connection = open(uri);
        if (!(connection instanceof HttpURLConnection))
        {
            writeBody(uri, connection, target, deadline);
            return;
        }

        final HttpURLConnection httpConnection = (HttpURLConnection) connection;
        try
        {
            final int statusCode = statusCode(uri, httpConnection);
            if (HttpStatusPolicy.isRedirect(statusCode))
            {
                final URI location = redirectLocation(uri, httpConnection);
                if (redirects >= MAX_REDIRECTS)
                    throw new LauncherException("Too many redirects while downloading '%s'.".formatted(uri));
                log.finer(() -> "Following redirect from %s to %s.".formatted(uri, location));
                httpConnection.disconnect();
                download(location, target, redirects + 1, deadline);
                return;
            }

            if (!HttpStatusPolicy.isSuccess(statusCode))
                HttpStatusPolicy.throwForStatus(uri, statusCode, errorBody(httpConnection));

            writeBody(uri, httpConnection, target, deadline);
        }
        finally
        {
            httpConnection.disconnect();
        }
    }

    private URLConnection open(URI uri)
        throws LauncherException
    {
        final URLConnection connection;
        try
        {
            connection = uri.toURL().openConnection();
        }
        catch (MalformedURLException | IllegalArgumentException exception)
        {
            throw new LauncherException("Invalid download URI '%s'.".formatted(uri), exception);
        }
        catch (IOException exception)
        {
            throw HttpStatusPolicy.networkFailure(uri, exception);
        }

        final int timeoutMillis = (int) Math.min(requestTimeout.toMillis(), Integer.MAX_VALUE);
        connection.setConnectTimeout((int) Math.min(CONNECT_TIMEOUT.toMillis(), timeoutMillis));
        connection.setReadTimeout(timeoutMillis);
        connection.setRequestProperty("User-Agent", userAgent);
        if (connection instanceof HttpURLConnection)
            ((HttpURLConnection) connection).setInstanceFollowRedirects(false);
        return connection;
    }

    private static int statusCode(URI uri, HttpURLConnection connection)
        throws LauncherException
    {
        try
        {
            return connection.getResponseCode();
        }
        catch (IOException exception)
        {
            throw HttpStatusPolicy.networkFailure(uri, exception);
        }
    }

    private static URI redirectLocation(URI uri, HttpURLConnection connection)
        throws LauncherException
    {
        final String location = connection.getHeaderField("Location");
        if (location == null)
            throw new LauncherException("Redirect from '%s' has no Location header.".formatted(uri));
        return uri.resolve(location);
    }

    private static String errorBody(HttpURLConnection connection)
    {
        final InputStream errorStream = connection.getErrorStream();
        if (errorStream == null)
            return "";
        try (errorStream)
        {
            return IOUtils.toString(errorStream, StandardCharsets.UTF_8);
        }
        catch (IOException exception)
        {
            log.finest(() -> "Failed to read error body: " + exception.getMessage());
            return "";
        }
    }

    private void writeBody(URI uri, URLConnection connection, Path target, long deadline)
        throws LauncherException
    {
        final long expectedLength = connection.getContentLengthLong();
        final Path temporaryFile = FileUtil.temporarySibling(target);
        try
        {
            final long written;
            try (InputStream body = connection.getInputStream();
                 OutputStream output = FileUtils.openOutputStream(temporaryFile.toFile()))
            {
                written = copyBefore(uri, body, output, deadline);
            }

            if (expectedLength >= 0 && expectedLength != written)
                throw new TransientNetworkException(
                    "Incomplete download from '%s': expected %d bytes, got %d.".formatted(uri, expectedLength, written));
            FileUtil.moveIntoPlace(temporaryFile, target);
        }
        catch (IOException exception)
        {
            deleteTemporary(temporaryFile);
            throw HttpStatusPolicy.networkFailure(uri, exception);
        }
        catch (LauncherException exception)
        {
            deleteTemporary(temporaryFile);
            throw exception;
        }
    }

    /**
     * Copies the body, failing once the deadline has passed. A single read is bounded by the read timeout.
     */
    private long copyBefore(URI uri, InputStream body, OutputStream output, long deadline)
        throws IOException, TransientNetworkException
    {
        final byte[] buffer = new byte[BUFFER_SIZE];
        long written = 0;
        int read;
        while ((read = body.read(buffer)) != IOUtils.EOF)
        {
            output.write(buffer, 0, read);
            written += read;
            if (System.nanoTime() - deadline > 0)
                throw new TransientNetworkException(
                    "Download from '%s' did not complete within %d ms.".formatted(uri, requestTimeout.toMillis()));
        }
        return written;
    }

    private static void deleteTemporary(Path temporaryFile)
    {
        try
        {
            Files.deleteIfExists(temporaryFile);
        }
        catch (IOException exception)
        {
            log.fine(() -> "Failed to delete partial download '%s': %s".formatted(temporaryFile, exception));
        }
    }
}
