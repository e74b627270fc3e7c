package nl.pim16aap2.beacon.launcher.download;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.java.Log;
import nl.pim16aap2.beacon.launcher.ClientLayout;
import nl.pim16aap2.beacon.launcher.event.LauncherEventBus;
import nl.pim16aap2.beacon.launcher.net.RetryPolicy;
import nl.pim16aap2.beacon.launcher.util.FileUtil;
import nl.pim16aap2.beacon.runtime.LibraryEntry;
import nl.pim16aap2.beacon.runtime.VersionProfile;
import nl.pim16aap2.beacon.runtime.error.LauncherException;
import nl.pim16aap2.beacon.runtime.error.VerificationFailedException;
import nl.pim16aap2.beacon.runtime.event.ProvisionProgressEvent;
import nl.pim16aap2.beacon.runtime.result.ItemFailure;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads every file a resolved profile references: the client archive, the libraries, the asset index and the
 * asset objects.
 * <p>
 * A file that is already present with the recorded size is not downloaded again. Every download is retried according
 * to the {@link RetryPolicy}, and a file that still fails is reported in the result without affecting the others.
 */
@Log
public final class AssetLibraryFetcher
{
    public static final int DEFAULT_CONCURRENCY = 8;
    private static final int PROGRESS_INTERVAL = 50;

    private final Downloader downloader;
    private final RetryPolicy retryPolicy;
    private final ClientLayout layout;
    private final LauncherEventBus eventBus;
    private final URI assetBaseUri;
    private final int concurrency;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public AssetLibraryFetcher(
        Downloader downloader,
        RetryPolicy retryPolicy,
        ClientLayout layout,
        LauncherEventBus eventBus,
        URI assetBaseUri,
        int concurrency)
    {
        this.downloader = Objects.requireNonNull(downloader, "downloader may not be null.");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy may not be null.");
        this.layout = Objects.requireNonNull(layout, "layout may not be null.");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus may not be null.");
        this.assetBaseUri = Objects.requireNonNull(assetBaseUri, "assetBaseUri may not be null.");
        if (concurrency < 1)
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency + ".");
        this.concurrency = concurrency;
    }

    /**
     * Fetches every file referenced by a profile.
     *
     * @param profile
     *     The resolved profile.
     * @return the combined result of all phases.
     */
    public FetchResult fetchAll(VersionProfile profile)
    {
        final long startTimeNanos = System.nanoTime();

        FetchResult result = fetchBatch(profile.id(), "client", clientTargets(profile));
        result = result.plus(fetchLibraries(profile));

        final VersionProfile.AssetIndexReference assetIndex = profile.assetIndex();
        if (assetIndex != null)
            result = result.plus(fetchAssets(profile.id(), assetIndex));

        final FetchResult finalResult = result;
        final long durationMillis = (System.nanoTime() - startTimeNanos) / 1_000_000L;
        log.info(() -> "Fetched files for %s in %d ms: %d present (%d already there), %d failed."
            .formatted(profile.id(), durationMillis, finalResult.successCount(), finalResult.skippedCount(),
                finalResult.errors().size()));
        return finalResult;
    }

    /**
     * Fetches a batch of independent files with bounded concurrency.
     *
     * @param versionId
     *     The version the batch belongs to. This is used for progress events only.
     * @param phase
     *     The name of the batch. This is used for progress events only.
     * @param targets
     *     The files to fetch.
     * @return the result of the batch. Failed files are listed in the same order as the targets.
     */
    public FetchResult fetchBatch(String versionId, String phase, List<DownloadTarget> targets)
    {
        if (targets.isEmpty())
            return FetchResult.EMPTY;

        final ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(concurrency, targets.size()),
            new ThreadFactoryBuilder().setNameFormat("beacon-download-%d").setDaemon(true).build()
        );
        final AtomicInteger completed = new AtomicInteger();
        try
        {
            final List<Future<Outcome>> futures = new ArrayList<>(targets.size());
            for (final DownloadTarget target : targets)
            {
                futures.add(executor.submit(() ->
                {
                    try
                    {
                        return fetch(target);
                    }
                    finally
                    {
                        reportProgress(versionId, phase, completed.incrementAndGet(), targets.size());
                    }
                }));
            }
            return collect(targets, futures);
        }
        finally
        {
            executor.shutdownNow();
        }
    }

    private FetchResult collect(List<DownloadTarget> targets, List<Future<Outcome>> futures)
    {
        int successCount = 0;
        int skippedCount = 0;
        final List<ItemFailure> errors = new ArrayList<>();

        final Iterator<DownloadTarget> targetIterator = targets.iterator();
        for (final Future<Outcome> future : futures)
        {
            final DownloadTarget target = targetIterator.next();
            try
            {
                final Outcome outcome = future.get();
                ++successCount;
                if (outcome == Outcome.SKIPPED)
                    ++skippedCount;
            }
            catch (InterruptedException exception)
            {
                Thread.currentThread().interrupt();
                errors.add(new ItemFailure(target.name(), "Interrupted before the download completed."));
            }
            catch (ExecutionException exception)
            {
                final Throwable cause = exception.getCause() == null ? exception : exception.getCause();
                log.warning(() -> "Failed to fetch %s: %s".formatted(target.name(), cause.getMessage()));
                errors.add(new ItemFailure(target.name(), String.valueOf(cause.getMessage())));
            }
        }
        return new FetchResult(successCount, skippedCount, errors);
    }

    private Outcome fetch(DownloadTarget target)
        throws LauncherException
    {
        if (FileUtil.isPresentWithSize(target.destination(), target.size()))
            return Outcome.SKIPPED;

        retryPolicy.execute("download of " + target.name(), () ->
        {
            downloader.download(target.url(), target.destination());
            return null;
        });
        DownloadVerifier.verify(target);
        return Outcome.DOWNLOADED;
    }

    private List<DownloadTarget> clientTargets(VersionProfile profile)
    {
        final VersionProfile.DownloadReference client = profile.clientDownload();
        if (client == null)
            return List.of();

        final String clientVersion = profile.clientJarVersion();
        return List.of(new DownloadTarget(
            "client " + clientVersion,
            client.url(),
            layout.clientJar(clientVersion),
            client.size(),
            client.sha1(),
            true
        ));
    }

    private FetchResult fetchLibraries(VersionProfile profile)
    {
        final List<DownloadTarget> targets = new ArrayList<>();
        int presentWithoutUrl = 0;
        final List<ItemFailure> missing = new ArrayList<>();

        for (final LibraryEntry library : profile.libraries())
        {
            final Path destination = layout.library(library.path());
            final URI url = library.url();
            if (url == null)
            {
                if (Files.isRegularFile(destination))
                    ++presentWithoutUrl;
                else
                    missing.add(new ItemFailure(library.coordinate().toString(),
                        "No download location and not present at '%s'.".formatted(destination)));
                continue;
            }
            targets.add(DownloadTarget.of(
                library.coordinate().toString(), url, destination, library.size(), library.sha1()));
        }

        return new FetchResult(presentWithoutUrl, presentWithoutUrl, missing)
            .plus(fetchBatch(profile.id(), "libraries", targets));
    }

    private FetchResult fetchAssets(String versionId, VersionProfile.AssetIndexReference assetIndex)
    {
        final DownloadTarget indexTarget = DownloadTarget.of(
            "asset index " + assetIndex.id(),
            assetIndex.url(),
            layout.assetIndex(assetIndex.id()),
            assetIndex.size(),
            assetIndex.sha1()
        );
        final FetchResult indexResult = fetchBatch(versionId, "asset index", List.of(indexTarget));
        if (!indexResult.errors().isEmpty())
            return indexResult;

        final List<DownloadTarget> assetTargets;
        try
        {
            assetTargets = assetTargets(indexTarget.destination());
        }
        catch (LauncherException exception)
        {
            return indexResult.plus(new FetchResult(0, 0,
                List.of(new ItemFailure(indexTarget.name(), String.valueOf(exception.getMessage())))));
        }
        return indexResult.plus(fetchBatch(versionId, "assets", assetTargets));
    }

    /**
     * Reads an asset index and lists one download per distinct object hash.
     */
    List<DownloadTarget> assetTargets(Path indexFile)
        throws LauncherException
    {
        final JsonNode root;
        try
        {
            root = objectMapper.readTree(indexFile.toFile());
        }
        catch (IOException exception)
        {
            throw new VerificationFailedException("Asset index '%s' is not valid JSON.".formatted(indexFile),
                exception);
        }

        final Map<String, DownloadTarget> targets = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> objects = root.path("objects").fields();
        while (objects.hasNext())
        {
            final Map.Entry<String, JsonNode> object = objects.next();
            final String hash = object.getValue().path("hash").asText("").toLowerCase(Locale.ROOT);
            if (hash.length() < 2 || targets.containsKey(hash))
                continue;

            final JsonNode size = object.getValue().path("size");
            targets.put(hash, DownloadTarget.of(
                object.getKey(),
                URI.create("%s/%s/%s".formatted(assetBaseUri, hash.substring(0, 2), hash)),
                layout.assetObject(hash),
                size.isNumber() ? size.asLong() : null,
                hash
            ));
        }
        return new ArrayList<>(targets.values());
    }

    private void reportProgress(String versionId, String phase, int completed, int total)
    {
        if (completed == total || completed % PROGRESS_INTERVAL == 0)
            eventBus.post(new ProvisionProgressEvent(versionId, phase, completed, total));
    }

    private enum Outcome
    {
        DOWNLOADED,
        SKIPPED
    }
}
