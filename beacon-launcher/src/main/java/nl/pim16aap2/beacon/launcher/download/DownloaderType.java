package nl.pim16aap2.beacon.launcher.download;

/**
 * The available {@link Downloader} implementations.
 */
public enum DownloaderType
{
    /**
     * Downloads with {@link java.net.http.HttpClient}.
     */
    HTTP_CLIENT
        {
            @Override
            public Downloader create(String userAgent)
            {
                return new HttpClientDownloader(userAgent);
            }
        },

    /**
     * Downloads with {@link java.net.URLConnection}.
     */
    URL_CONNECTION
        {
            @Override
            public Downloader create(String userAgent)
            {
                return new UrlConnectionDownloader(userAgent);
            }
        };

    public abstract Downloader create(String userAgent);
}
