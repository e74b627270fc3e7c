package nl.pim16aap2.beacon.launcher.net;

import nl.pim16aap2.beacon.runtime.error.HttpStatusException;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.TransientNetworkException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;

/**
 * Maps HTTP outcomes onto the launcher's error taxonomy.
 */
public final class HttpStatusPolicy
{
    private static final int MAX_BODY_IN_MESSAGE = 512;

    private HttpStatusPolicy()
    {
    }

    public static boolean isSuccess(int statusCode)
    {
        return statusCode >= 200 && statusCode < 300;
    }

    public static boolean isRedirect(int statusCode)
    {
        return statusCode == 301 || statusCode == 302 || statusCode == 303 || statusCode == 307 ||
            statusCode == 308;
    }

    /**
     * Checks whether a status code indicates a condition that may clear up on its own.
     *
     * @param statusCode
     *     the status code to check.
     * @return {@code true} for request timeouts, rate limiting and server errors.
     */
    public static boolean isTransient(int statusCode)
    {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    /**
     * Throws the exception matching a non-success status.
     *
     * @param uri
     *     the requested URI.
     * @param statusCode
     *     the status code of the response.
     * @param body
     *     the response body, used for diagnostics.
     * @throws LauncherException
     *     Always; a {@link TransientNetworkException} for retryable statuses and a {@link HttpStatusException}
     *     otherwise.
     */
    public static void throwForStatus(URI uri, int statusCode, String body)
        throws LauncherException
    {
        if (isTransient(statusCode))
            throw new TransientNetworkException(
                "Request to '%s' failed with status %d.".formatted(uri, statusCode));
        throw new HttpStatusException(uri, statusCode, truncate(body));
    }

    /**
     * Wraps an I/O failure of a request.
     *
     * @param uri
     *     the requested URI.
     * @param exception
     *     the failure.
     * @return the exception to throw.
     */
    public static TransientNetworkException networkFailure(URI uri, IOException exception)
    {
        if (exception instanceof HttpTimeoutException)
            return new TransientNetworkException("Request to '%s' timed out.".formatted(uri), exception);
        return new TransientNetworkException("Request to '%s' failed.".formatted(uri), exception);
    }

    /**
     * Wraps an interruption of a request and restores the interrupt flag.
     *
     * @param uri
     *     the requested URI.
     * @param exception
     *     the interruption.
     * @return the exception to throw.
     */
    public static LauncherException interrupted(URI uri, InterruptedException exception)
    {
        Thread.currentThread().interrupt();
        return new LauncherException("Interrupted while requesting '%s'.".formatted(uri), exception);
    }

    private static String truncate(String body)
    {
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
