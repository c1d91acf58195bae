package org.stianloader.picochannel;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.internal.JsonUtil;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Settings used when retrieving a channel. {@link ChannelResolver} takes a {@link #copy() copy}
 * of the settings it is constructed with, so later modifications have no effect on existing resolvers.
 */
public final class ChannelSettings {

    public static final int DEFAULT_TIMEOUT = 30;

    @NotNull
    public static final String DEFAULT_USER_AGENT = "picochannel";

    /**
     * Reads settings from a JSON object using the snake_case keys known from the settings files
     * of the package manager: "cache_length", "debug", "timeout", "user_agent", "http_proxy",
     * "https_proxy", "proxy_username", "proxy_password" and "query_string_params". Absent keys
     * keep their defaults.
     *
     * @param settings The settings object
     * @return A new settings instance
     * @throws IllegalArgumentException If a key has a value of the wrong type
     */
    @NotNull
    public static ChannelSettings fromJson(@NotNull JsonNode settings) {
        if (!settings.isObject()) {
            throw new IllegalArgumentException("Channel settings must be a JSON object");
        }
        ChannelSettings out = new ChannelSettings();
        if (settings.hasNonNull("cache_length")) {
            out.setCacheLength(ChannelSettings.requireInt(settings, "cache_length"));
        }
        if (settings.hasNonNull("debug")) {
            out.setDebug(settings.get("debug").asBoolean());
        }
        if (settings.hasNonNull("timeout")) {
            out.setTimeout(ChannelSettings.requireInt(settings, "timeout"));
        }
        String userAgent = JsonUtil.optText(settings, "user_agent");
        if (userAgent != null) {
            out.setUserAgent(userAgent);
        }
        out.setHttpProxy(JsonUtil.optText(settings, "http_proxy"));
        out.setHttpsProxy(JsonUtil.optText(settings, "https_proxy"));
        out.setProxyCredentials(JsonUtil.optText(settings, "proxy_username"), JsonUtil.optText(settings, "proxy_password"));

        JsonNode params = settings.get("query_string_params");
        if (params != null && !params.isNull()) {
            if (!params.isObject()) {
                throw new IllegalArgumentException("the \"query_string_params\" key must be an object.");
            }
            Iterator<String> hosts = params.fieldNames();
            while (hosts.hasNext()) {
                String host = hosts.next();
                out.setQueryStringParams(host, JsonUtil.optStringMap(params, host));
            }
        }
        return out;
    }

    private static int requireInt(@NotNull JsonNode settings, @NotNull String key) {
        JsonNode node = settings.get(key);
        if (!node.canConvertToInt()) {
            throw new IllegalArgumentException("the \"" + key + "\" key must be an integer.");
        }
        return node.asInt();
    }

    private int cacheLength;
    private boolean debug;
    @Nullable
    private String httpProxy;
    @Nullable
    private String httpsProxy;
    @Nullable
    private String proxyPassword;
    @Nullable
    private String proxyUsername;
    @NotNull
    private final Map<String, Map<String, String>> queryStringParams = new LinkedHashMap<>();
    private int timeout = DEFAULT_TIMEOUT;
    @NotNull
    private String userAgent = DEFAULT_USER_AGENT;

    @NotNull
    @Contract(pure = true, value = "-> new")
    public ChannelSettings copy() {
        ChannelSettings copy = new ChannelSettings();
        copy.cacheLength = this.cacheLength;
        copy.debug = this.debug;
        copy.httpProxy = this.httpProxy;
        copy.httpsProxy = this.httpsProxy;
        copy.proxyPassword = this.proxyPassword;
        copy.proxyUsername = this.proxyUsername;
        this.queryStringParams.forEach(copy::setQueryStringParams);
        copy.timeout = this.timeout;
        copy.userAgent = this.userAgent;
        return copy;
    }

    /**
     * Obtains the amount of seconds downloaded content may be cached by the downloader.
     * The channel itself is never cached beyond the lifetime of a {@link ChannelResolver}.
     *
     * @return The cache length in seconds
     */
    @Contract(pure = true)
    public int getCacheLength() {
        return this.cacheLength;
    }

    @Nullable
    @Contract(pure = true)
    public String getHttpProxy() {
        return this.httpProxy;
    }

    @Nullable
    @Contract(pure = true)
    public String getHttpsProxy() {
        return this.httpsProxy;
    }

    @Nullable
    @Contract(pure = true)
    public String getProxyPassword() {
        return this.proxyPassword;
    }

    @Nullable
    @Contract(pure = true)
    public String getProxyUsername() {
        return this.proxyUsername;
    }

    /**
     * Obtains the query string parameters to append to every request made to the given host.
     *
     * @param host The host name, compared case-insensitively
     * @return An unmodifiable map of parameters, empty if none are configured
     */
    @NotNull
    @Contract(pure = true)
    public Map<String, String> getQueryStringParams(@NotNull String host) {
        for (Map.Entry<String, Map<String, String>> entry : this.queryStringParams.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(host)) {
                return entry.getValue();
            }
        }
        return Collections.emptyMap();
    }

    /**
     * Obtains the connect and read timeout of downloads.
     *
     * @return The timeout in seconds
     */
    @Contract(pure = true)
    public int getTimeout() {
        return this.timeout;
    }

    @NotNull
    @Contract(pure = true)
    public String getUserAgent() {
        return this.userAgent;
    }

    @Contract(pure = true)
    public boolean isDebug() {
        return this.debug;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ChannelSettings setCacheLength(int cacheLength) {
        if (cacheLength < 0) {
            throw new IllegalArgumentException("cacheLength may not be negative, got " + cacheLength);
        }
        this.cacheLength = cacheLength;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ChannelSettings setDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    /**
     * Sets the proxy used for plain HTTP requests.
     *
     * @param httpProxy The proxy as "http://host:port" or "host:port", null for a direct connection
     * @return The current instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ChannelSettings setHttpProxy(@Nullable String httpProxy) {
        this.httpProxy = httpProxy == null || httpProxy.isEmpty() ? null : httpProxy;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ChannelSettings setHttpsProxy(@Nullable String httpsProxy) {
        this.httpsProxy = httpsProxy == null || httpsProxy.isEmpty() ? null : httpsProxy;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public ChannelSettings setProxyCredentials(@Nullable String username, @Nullable String password) {
        this.proxyUsername = username == null || username.isEmpty() ? null : username;
        this.proxyPassword = password;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null, _ -> fail; _, null -> fail; _, _ -> this")
    public ChannelSettings setQueryStringParams(@NotNull String host, @NotNull Map<String, String> params) {
        Objects.requireNonNull(host, "host may not be null");
        this.queryStringParams.put(host, Collections.unmodifiableMap(new LinkedHashMap<>(params)));
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ChannelSettings setTimeout(int timeout) {
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public ChannelSettings setUserAgent(@NotNull String userAgent) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent may not be null");
        return this;
    }
}
