package org.stianloader.picochannel;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of all failures to obtain usable information out of a channel.
 * A failure is never cached: querying a broken channel again reproduces the same exception.
 */
public class ChannelException extends Exception {

    private static final long serialVersionUID = 7137427045366451372L;

    @NotNull
    private final String channelUrl;

    public ChannelException(@NotNull String channelUrl, @NotNull String message) {
        super(message);
        this.channelUrl = channelUrl;
    }

    public ChannelException(@NotNull String channelUrl, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.channelUrl = channelUrl;
    }

    /**
     * Obtains the location of the channel that caused the exception.
     *
     * @return The URL or filesystem path of the channel
     */
    @NotNull
    @Contract(pure = true)
    public String getChannelUrl() {
        return this.channelUrl;
    }
}
