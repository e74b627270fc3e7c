package nl.pim16aap2.beacon.launcher.download;

import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.net.HttpStatusPolicy;
import nl.pim16aap2.beacon.launcher.util.FileUtil;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Downloads files with {@link HttpClient}, following redirects itself.
 * <p>
 * Successful bodies are streamed straight into the temporary sibling of the target. The whole exchange runs against
 * the request timeout, so a body that stops arriving is abandoned.
 */
@Log
public final class HttpClientDownloader implements Downloader
{
    private final String userAgent;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public HttpClientDownloader(String userAgent)
    {
        this(userAgent, REQUEST_TIMEOUT);
    }

    HttpClientDownloader(String userAgent, Duration requestTimeout)
    {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent may not be null.");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout may not be null.");
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(CONNECT_TIMEOUT.compareTo(requestTimeout) < 0 ? CONNECT_TIMEOUT : requestTimeout)
            .build();
    }

    @Override
    public void download(URI uri, Path target)
        throws LauncherException
    {
        final Path parent = target.getParent();
        if (parent != null)
            FileUtil.createDirectories(parent, "download target");
        download(uri, target, 0);
    }

    private void download(URI uri, Path target, int redirects)
        throws LauncherException
    {
        final HttpRequest request = HttpRequest.newBuilder(uri)
            .header("User-Agent", userAgent)
            .timeout(requestTimeout)
            .GET()
            .build();

        final Path temporaryFile = FileUtil.temporarySibling(target);
        final HttpResponse<Path> response = send(uri, request, temporaryFile);

        final int statusCode = response.statusCode();
        if (HttpStatusPolicy.isRedirect(statusCode))
        {
            final URI location = redirectLocation(uri, response);
            if (redirects >= MAX_REDIRECTS)
                throw new LauncherException("Too many redirects while downloading '%s'.".formatted(uri));
            log.finer(() -> "Following redirect from %s to %s.".formatted(uri, location));
            download(location, target, redirects + 1);
            return;
        }

        if (!HttpStatusPolicy.isSuccess(statusCode))
            HttpStatusPolicy.throwForStatus(uri, statusCode, "");

        moveIntoPlace(uri, response, temporaryFile, target);
    }

    private HttpResponse<Path> send(URI uri, HttpRequest request, Path temporaryFile)
        throws LauncherException
    {
        final CompletableFuture<HttpResponse<Path>> future =
            httpClient.sendAsync(request, bodyHandler(temporaryFile));
        try
        {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException exception)
        {
            future.cancel(true);
            deleteTemporary(temporaryFile);
            throw new TransientNetworkException(
                "Download from '%s' did not complete within %d ms.".formatted(uri, requestTimeout.toMillis()),
                exception);
        }
        catch (ExecutionException exception)
        {
            deleteTemporary(temporaryFile);
            final Throwable cause = exception.getCause();
            if (cause instanceof IOException)
                throw HttpStatusPolicy.networkFailure(uri, (IOException) cause);
            throw new LauncherException(
                "Download from '%s' failed.".formatted(uri), cause == null ? exception : cause);
        }
        catch (InterruptedException exception)
        {
            future.cancel(true);
            deleteTemporary(temporaryFile);
            throw HttpStatusPolicy.interrupted(uri, exception);
        }
    }

    /**
     * Writes successful bodies to the temporary file and discards all others.
     */
    private static HttpResponse.BodyHandler<Path> bodyHandler(Path temporaryFile)
    {
        return responseInfo -> HttpStatusPolicy.isSuccess(responseInfo.statusCode()) ?
            HttpResponse.BodySubscribers.ofFile(
                temporaryFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING) :
            HttpResponse.BodySubscribers.replacing(temporaryFile);
    }

    private static URI redirectLocation(URI uri, HttpResponse<Path> response)
        throws LauncherException
    {
        final String location = response.headers().firstValue("Location")
            .orElseThrow(() -> new LauncherException(
                "Redirect from '%s' has no Location header.".formatted(uri)));
        return uri.resolve(location);
    }

    private static void moveIntoPlace(URI uri, HttpResponse<Path> response, Path temporaryFile, Path target)
        throws LauncherException
    {
        final OptionalLong expectedLength = response.headers().firstValueAsLong("Content-Length");
        try
        {
            final long written = Files.size(temporaryFile);
            if (expectedLength.isPresent() && expectedLength.getAsLong() != written)
            {
                Files.deleteIfExists(temporaryFile);
                throw new TransientNetworkException(
                    "Incomplete download from '%s': expected %d bytes, got %d."
                        .formatted(uri, expectedLength.getAsLong(), written));
            }
            FileUtil.moveIntoPlace(temporaryFile, target);
        }
        catch (IOException exception)
        {
            deleteTemporary(temporaryFile);
            throw HttpStatusPolicy.networkFailure(uri, exception);
        }
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
