package nl.pim16aap2.beacon.runtime.error;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.URI;

/**
 * Thrown when a remote endpoint answers with a terminal non-success status.
 */
@Getter
@Accessors(fluent = true)
public class HttpStatusException extends LauncherException
{
    private final URI uri;
    private final int statusCode;
    private final String body;

    public HttpStatusException(URI uri, int statusCode, String body)
    {
        super("Request to '%s' failed with status %d.".formatted(uri, statusCode));
        this.uri = uri;
        this.statusCode = statusCode;
        this.body = body;
    }
}
