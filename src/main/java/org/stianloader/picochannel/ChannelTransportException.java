package org.stianloader.picochannel;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown if the channel could not be read, either because the network request failed or because
 * the channel file is absent or unreadable.
 */
public class ChannelTransportException extends ChannelException {

    private static final long serialVersionUID = 2948716093340137782L;

    public ChannelTransportException(@NotNull String channelUrl, @NotNull String message, @Nullable Throwable cause) {
        super(channelUrl, message, cause);
    }
}
