package org.stianloader.picochannel.repo;

import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.logging.LoggingAdapter;

/**
 * Maps repository URLs pointing to retired hosting endpoints to their current equivalents.
 * The mapping is pure, it never touches the network.
 */
public final class RepositoryUrls {

    private static final Pattern CODELOAD_ZIPBALL = Pattern.compile("^(https://codeload\\.github\\.com/[^/#?]+/[^/#?]+/)zipball(/.*)$");

    /**
     * The location every channel of the retired "sublime.wbond.net" host moved to.
     */
    public static final String CURRENT_CHANNEL = "https://packagecontrol.io/channel_v3.json";

    /**
     * Rewrites a URL that references a deprecated endpoint. URLs that do not need rewriting
     * are returned as-is.
     *
     * @param url The URL to update, may be null
     * @param debug Whether to log rewrites
     * @return The current URL, null if the input was null
     */
    @Nullable
    @Contract(pure = true, value = "null, _ -> null; !null, _ -> !null")
    public static String update(@Nullable String url, boolean debug) {
        if (url == null || url.isEmpty()) {
            return url;
        }

        String original = url;
        url = url.replace("://raw.github.com/", "://raw.githubusercontent.com/");
        url = url.replace("://nodeload.github.com/", "://codeload.github.com/");
        url = CODELOAD_ZIPBALL.matcher(url).replaceFirst("$1zip$2");

        // Old clients were pointed at these, the host now only serves the current channel
        if (url.equals("https://sublime.wbond.net/repositories.json") || url.equals("https://sublime.wbond.net/channel.json")) {
            url = CURRENT_CHANNEL;
        }

        if (debug && !url.equals(original)) {
            LoggingAdapter.getDefaultLogger().debug(RepositoryUrls.class, "Fixed URL from {} to {}", original, url);
        }
        return url;
    }

    private RepositoryUrls() {
        throw new AssertionError();
    }
}
