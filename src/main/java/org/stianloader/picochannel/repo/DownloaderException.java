package org.stianloader.picochannel.repo;

import java.io.IOException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown by a {@link ChannelDownloader} if a URL could not be fetched.
 */
public class DownloaderException extends IOException {

    private static final long serialVersionUID = -5163618406520232155L;

    private final int statusCode;

    public DownloaderException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public DownloaderException(@NotNull String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Obtains the HTTP status code the server answered with.
     *
     * @return The status code, or -1 if the request failed before a response was received
     */
    @Contract(pure = true)
    public int getStatusCode() {
        return this.statusCode;
    }
}
