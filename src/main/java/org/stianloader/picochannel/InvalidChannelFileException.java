package org.stianloader.picochannel;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown if the content of a channel could be retrieved, but is not a valid channel document:
 * malformed JSON, missing required keys or an unsupported "schema_version".
 */
public class InvalidChannelFileException extends ChannelException {

    private static final long serialVersionUID = -2652417317960563052L;

    public InvalidChannelFileException(@NotNull String channelUrl, @NotNull String reason) {
        this(channelUrl, reason, null);
    }

    public InvalidChannelFileException(@NotNull String channelUrl, @NotNull String reason, @Nullable Throwable cause) {
        super(channelUrl, "Channel " + channelUrl + " does not appear to be a valid channel file because " + reason, cause);
    }
}
