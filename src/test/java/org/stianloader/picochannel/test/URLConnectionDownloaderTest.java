package org.stianloader.picochannel.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.GZIPOutputStream;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stianloader.picochannel.ChannelResolver;
import org.stianloader.picochannel.ChannelSettings;
import org.stianloader.picochannel.ChannelTransportException;
import org.stianloader.picochannel.PackageRecord;
import org.stianloader.picochannel.repo.DownloaderException;
import org.stianloader.picochannel.repo.URLConnectionDownloader;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

public class URLConnectionDownloaderTest {

    private static void respond(@NotNull HttpExchange exchange, int status, byte @NotNull[] body) throws IOException {
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @NotNull
    private final Map<String, String> lastRequest = new ConcurrentHashMap<>();
    private HttpServer server;

    @BeforeEach
    public void startServer() throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        this.server.createContext("/plain.txt", exchange -> {
            this.lastRequest.put("User-Agent", String.valueOf(exchange.getRequestHeaders().getFirst("User-Agent")));
            this.lastRequest.put("Accept-Encoding", String.valueOf(exchange.getRequestHeaders().getFirst("Accept-Encoding")));
            this.lastRequest.put("query", String.valueOf(exchange.getRequestURI().getRawQuery()));
            URLConnectionDownloaderTest.respond(exchange, 200, "hello channel".getBytes(StandardCharsets.UTF_8));
        });
        this.server.createContext("/gzip.txt", exchange -> {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(baos)) {
                gzip.write("compressed channel".getBytes(StandardCharsets.UTF_8));
            }
            exchange.getResponseHeaders().add("Content-Encoding", "gzip");
            URLConnectionDownloaderTest.respond(exchange, 200, baos.toByteArray());
        });
        this.server.createContext("/missing.json", exchange -> {
            URLConnectionDownloaderTest.respond(exchange, 404, "not here".getBytes(StandardCharsets.UTF_8));
        });
        this.server.createContext("/channels/channel.json", exchange -> {
            URLConnectionDownloaderTest.respond(exchange, 200, ChannelFixtures.read("channel_v4.json"));
        });
        this.server.start();
    }

    @AfterEach
    public void stopServer() {
        this.server.stop(0);
    }

    @NotNull
    private String url(@NotNull String path) {
        return "http://127.0.0.1:" + this.server.getAddress().getPort() + path;
    }

    @Test
    public void testDownload() throws Exception {
        ChannelSettings settings = new ChannelSettings().setUserAgent("picochannel-test/1.0");
        byte[] body = new URLConnectionDownloader(settings).fetch(this.url("/plain.txt"), "Error downloading channel.");
        assertArrayEquals("hello channel".getBytes(StandardCharsets.UTF_8), body);
        assertEquals("picochannel-test/1.0", this.lastRequest.get("User-Agent"));
        assertEquals("gzip", this.lastRequest.get("Accept-Encoding"));
        assertEquals("null", this.lastRequest.get("query"));
    }

    @Test
    public void testQueryStringParams() throws Exception {
        ChannelSettings settings = new ChannelSettings().setQueryStringParams("127.0.0.1", Collections.singletonMap("token", "a b&c"));
        new URLConnectionDownloader(settings).fetch(this.url("/plain.txt"), "Error downloading channel.");
        assertEquals("token=a+b%26c", this.lastRequest.get("query"));

        new URLConnectionDownloader(settings).fetch(this.url("/plain.txt?x=1"), "Error downloading channel.");
        assertEquals("x=1&token=a+b%26c", this.lastRequest.get("query"));

        settings = new ChannelSettings().setQueryStringParams("example.com", Collections.singletonMap("token", "abc"));
        new URLConnectionDownloader(settings).fetch(this.url("/plain.txt"), "Error downloading channel.");
        assertEquals("null", this.lastRequest.get("query"));
    }

    @Test
    public void testGzip() throws Exception {
        byte[] body = new URLConnectionDownloader(new ChannelSettings()).fetch(this.url("/gzip.txt"), "Error downloading channel.");
        assertEquals("compressed channel", new String(body, StandardCharsets.UTF_8));
    }

    @Test
    public void testHttpError() {
        URLConnectionDownloader downloader = new URLConnectionDownloader(new ChannelSettings());
        DownloaderException e = assertThrows(DownloaderException.class, () -> downloader.fetch(this.url("/missing.json"), "Error downloading channel."));
        assertEquals(404, e.getStatusCode());
        assertTrue(e.getMessage().startsWith("Error downloading channel."));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    public void testConnectionRefused() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        URLConnectionDownloader downloader = new URLConnectionDownloader(new ChannelSettings().setTimeout(2));
        DownloaderException e = assertThrows(DownloaderException.class, () -> downloader.fetch("http://127.0.0.1:" + port + "/channel.json", "Error downloading channel."));
        assertEquals(-1, e.getStatusCode());
    }

    @Test
    public void testRemoteChannel() throws Exception {
        ChannelResolver resolver = new ChannelResolver(this.url("/channels/channel.json"), new ChannelSettings());
        assertEquals(Arrays.asList(
                "https://example.com/repository.json",
                this.url("/channels/local/repository.json"),
                "http://cdn.example.com/repository.json",
                "https://raw.githubusercontent.com/user/repo/master/repository.json"), resolver.getRepositories());
        Map<String, PackageRecord> packages = resolver.getPackages("https://example.com/repository.json");
        assertEquals(2, packages.size());
    }

    @Test
    public void testRemoteChannelMissing() {
        ChannelResolver resolver = new ChannelResolver(this.url("/missing.json"), new ChannelSettings());
        ChannelTransportException e = assertThrows(ChannelTransportException.class, resolver::fetch);
        assertEquals(404, ((DownloaderException) e.getCause()).getStatusCode());
    }
}
