package nl.pim16aap2.beacon.launcher.download;

import nl.pim16aap2.beacon.runtime.error.LauncherException;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Downloads a single file.
 * <p>
 * Implementations make exactly one attempt and report retryable failures as
 * {@link nl.pim16aap2.beacon.runtime.error.TransientNetworkException}; retrying is up to the caller. Redirects are
 * followed up to {@link #MAX_REDIRECTS} hops, also across protocols. Non-success statuses are mapped by
 * {@link nl.pim16aap2.beacon.launcher.net.HttpStatusPolicy}. A single attempt never takes longer than its request
 * timeout, body included. A target is either replaced completely or left untouched.
 */
public interface Downloader
{
    int MAX_REDIRECTS = 5;

    Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);

    /**
     * The hard limit for one request, from sending it until the last byte of the body has been written.
     */
    Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    void download(URI uri, Path target)
        throws LauncherException;
}
