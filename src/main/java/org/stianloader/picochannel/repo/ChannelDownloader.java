package org.stianloader.picochannel.repo;

import org.jetbrains.annotations.NotNull;

/**
 * Fetches the raw bytes behind a URL. Implementations are configured through the
 * {@link org.stianloader.picochannel.ChannelSettings} of the resolver that uses them and are
 * responsible for timeouts, proxies and the user agent. They do not retry on their own.
 */
@FunctionalInterface
public interface ChannelDownloader {

    /**
     * Downloads a URL.
     *
     * @param url The absolute http or https URL
     * @param errorMessage A short description of the operation, prefixed to the message of a thrown exception
     * @return The response body
     * @throws DownloaderException If the download failed for any reason
     */
    byte @NotNull[] fetch(@NotNull String url, @NotNull String errorMessage) throws DownloaderException;
}
