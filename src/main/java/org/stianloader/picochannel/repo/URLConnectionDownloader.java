package org.stianloader.picochannel.repo;

import java.io.IOException;
import java.io.InputStream;
import java.net.Authenticator;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.Proxy;
import java.net.URI;
import java.net.URLConnection;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.ChannelSettings;
import org.stianloader.picochannel.logging.LoggingAdapter;

/**
 * {@link ChannelDownloader} based on {@link HttpURLConnection}, honouring the timeout, user agent,
 * proxy and query string settings of a {@link ChannelSettings} instance. Responses are requested
 * gzip-compressed and decompressed transparently.
 */
public class URLConnectionDownloader implements ChannelDownloader {

    @NotNull
    static String appendQueryString(@NotNull String url, @NotNull Map<String, String> params) {
        if (params.isEmpty()) {
            return url;
        }
        StringBuilder builder = new StringBuilder(url);
        char separator = url.indexOf('?') == -1 ? '?' : '&';
        for (Map.Entry<String, String> param : params.entrySet()) {
            builder.append(separator)
                .append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return builder.toString();
    }

    @NotNull
    static Proxy parseProxy(@NotNull String proxy) {
        URI uri = URI.create(proxy.contains("://") ? proxy : "http://" + proxy);
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("Proxy \"" + proxy + "\" does not name a host");
        }
        int port = uri.getPort() == -1 ? 80 : uri.getPort();
        return new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(host, port));
    }

    @NotNull
    private final ChannelSettings settings;

    public URLConnectionDownloader(@NotNull ChannelSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings may not be null").copy();
    }

    @Override
    public byte @NotNull[] fetch(@NotNull String url, @NotNull String errorMessage) throws DownloaderException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new DownloaderException(errorMessage + " Invalid URL " + url + ".", e);
        }
        String host = uri.getHost() == null ? "" : uri.getHost();
        String target = URLConnectionDownloader.appendQueryString(url, this.settings.getQueryStringParams(host));

        if (this.settings.isDebug()) {
            LoggingAdapter.getDefaultLogger().debug(URLConnectionDownloader.class, "Downloading {}", target);
        }

        HttpURLConnection connection = null;
        try {
            connection = this.openConnection(URI.create(target), uri.getScheme());
            int status = connection.getResponseCode();
            if ((status / 100) != 2) {
                throw new DownloaderException(errorMessage + " HTTP error " + status + " (" + connection.getResponseMessage() + ") downloading " + url + ".", status);
            }

            InputStream raw = connection.getInputStream();
            if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
                raw = new GZIPInputStream(raw);
            }
            try (InputStream is = raw) {
                return is.readAllBytes();
            }
        } catch (DownloaderException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DownloaderException(errorMessage + " " + e.getClass().getSimpleName() + " downloading " + url + ": " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    @NotNull
    @Contract(pure = true)
    public ChannelSettings getSettings() {
        return this.settings.copy();
    }

    @NotNull
    protected HttpURLConnection openConnection(@NotNull URI uri, @Nullable String scheme) throws IOException {
        String proxySetting = "https".equalsIgnoreCase(scheme) ? this.settings.getHttpsProxy() : this.settings.getHttpProxy();
        URLConnection connection;
        if (proxySetting == null) {
            connection = uri.toURL().openConnection();
        } else {
            connection = uri.toURL().openConnection(URLConnectionDownloader.parseProxy(proxySetting));
        }

        if (!(connection instanceof HttpURLConnection)) {
            throw new IOException("Only http and https URLs can be downloaded, got " + uri.getScheme() + " for " + uri);
        }
        HttpURLConnection http = (HttpURLConnection) connection;

        int timeoutMillis = this.settings.getTimeout() * 1000;
        http.setConnectTimeout(timeoutMillis);
        http.setReadTimeout(timeoutMillis);
        http.setRequestProperty("User-Agent", this.settings.getUserAgent());
        http.setRequestProperty("Accept-Encoding", "gzip");

        String username = this.settings.getProxyUsername();
        if (proxySetting != null && username != null) {
            String password = this.settings.getProxyPassword();
            char[] passwordChars = password == null ? new char[0] : password.toCharArray();
            http.setAuthenticator(new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    if (this.getRequestorType() == RequestorType.PROXY) {
                        return new PasswordAuthentication(username, passwordChars);
                    }
                    return null;
                }
            });
        }

        if (this.settings.isDebug() && proxySetting != null) {
            LoggingAdapter.getDefaultLogger().debug(URLConnectionDownloader.class, "Using proxy {} for {}", proxySetting, uri);
        }
        return http;
    }
}
