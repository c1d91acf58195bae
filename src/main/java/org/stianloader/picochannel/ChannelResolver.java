package org.stianloader.picochannel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.internal.JsonUtil;
import org.stianloader.picochannel.logging.LoggingAdapter;
import org.stianloader.picochannel.repo.ChannelDownloader;
import org.stianloader.picochannel.repo.DownloaderException;
import org.stianloader.picochannel.repo.RepositoryUrlResolver;
import org.stianloader.picochannel.repo.RepositoryUrls;
import org.stianloader.picochannel.repo.URLConnectionDownloader;
import org.stianloader.picochannel.schema.ReleaseNormalizer;
import org.stianloader.picochannel.schema.ReleaseNormalizer.NormalizedReleases;
import org.stianloader.picochannel.schema.SchemaVersion;
import org.stianloader.picochannel.version.ReleaseSorter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Retrieves a channel and provides a schema independent view on its content.
 *
 * <p>Channels cache the information of the repositories they list, sparing clients from
 * querying every repository on their own. Over time the layout of channels changed several times,
 * the {@link SchemaVersion} of the channel decides how it is read. All query methods return data in
 * the layout of the latest schema.
 *
 * <p>The channel is fetched lazily upon the first query and kept for the lifetime of the resolver.
 * There is no way to refresh a resolver, a new instance has to be created instead. A fetch that fails
 * is not remembered: every query against a broken channel fails with the same exception.
 * Resolvers may be shared between threads, the channel is fetched at most once.
 */
public class ChannelResolver {

    private enum FetchState {
        UNFETCHED,
        FETCHED;
    }

    @NotNull
    private static final Pattern HTTP_PATTERN = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

    /**
     * Checks whether a {@link ChannelResolver} can handle the given location.
     * Anything that is not an http or https URL is read as a filesystem path, so every location is accepted.
     *
     * @param channelUrl The channel location
     * @return Always true
     */
    @Contract(pure = true, value = "_ -> true")
    public static boolean matchUrl(@NotNull String channelUrl) {
        return true;
    }

    @NotNull
    private final String channelUrl;
    @Nullable
    private ChannelDocument document;
    @NotNull
    private final ChannelDownloader downloader;
    @NotNull
    private final Object fetchLock = new Object();
    @NotNull
    private final ChannelSettings settings;
    @NotNull
    private FetchState state = FetchState.UNFETCHED;

    public ChannelResolver(@NotNull String channelUrl, @NotNull ChannelSettings settings) {
        this(channelUrl, settings, new URLConnectionDownloader(settings));
    }

    public ChannelResolver(@NotNull String channelUrl, @NotNull ChannelSettings settings, @NotNull ChannelDownloader downloader) {
        this.channelUrl = Objects.requireNonNull(channelUrl, "channelUrl may not be null");
        this.settings = Objects.requireNonNull(settings, "settings may not be null").copy();
        this.downloader = Objects.requireNonNull(downloader, "downloader may not be null");
    }

    /**
     * Retrieves and validates the channel unless that already happened.
     *
     * @throws InvalidChannelFileException If the channel is not valid JSON or lacks a supported "schema_version"
     * @throws ChannelTransportException If the channel could not be downloaded or read
     */
    public void fetch() throws ChannelException {
        this.document();
    }

    @NotNull
    @Contract(pure = true)
    public String getChannelUrl() {
        return this.channelUrl;
    }

    /**
     * Obtains the libraries a repository provides, as cached by the channel.
     *
     * @param repositoryUrl The URL of the repository, in any historical form
     * @return An unmodifiable map of library name to library, in document order.
     * Empty if the channel does not cache the repository.
     * @throws ChannelException If the channel can not be fetched or a library record is malformed
     */
    @NotNull
    public Map<@NotNull String, @NotNull LibraryRecord> getLibraries(@NotNull String repositoryUrl) throws ChannelException {
        ChannelDocument document = this.document();
        String repository = RepositoryUrls.update(Objects.requireNonNull(repositoryUrl, "repositoryUrl may not be null"), this.settings.isDebug());
        Map<String, LibraryRecord> out = new LinkedHashMap<>();
        try {
            int index = 0;
            for (JsonNode library : document.getLibraries(repository)) {
                String name = JsonUtil.requireText(library, "name", "library #" + index++ + " of repository " + repository);
                List<ReleaseRecord> releases = ReleaseNormalizer.readReleases(library, document.getSchemaVersion().getSchemaMajor());
                out.put(name, new LibraryRecord(name,
                        JsonUtil.optText(library, "load_order"),
                        JsonUtil.optText(library, "description"),
                        JsonUtil.optJoinedText(library, "author"),
                        JsonUtil.optText(library, "issues"),
                        ReleaseSorter.sort(releases, true)));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidChannelFileException(this.channelUrl, e.getMessage(), e);
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Obtains the mapping of URL slugs to package names. The mapping was retired with schema 2.0,
     * newer channels always yield an empty map.
     *
     * @return An unmodifiable map of slug to package name
     * @throws ChannelException If the channel can not be fetched
     */
    @NotNull
    public Map<@NotNull String, @NotNull String> getNameMap() throws ChannelException {
        return this.document().getNameMap();
    }

    /**
     * Obtains the packages a repository provides, as cached by the channel.
     * Releases are ordered newest first.
     *
     * @param repositoryUrl The URL of the repository, in any historical form
     * @return An unmodifiable map of package name to package, in document order.
     * Empty if the channel does not cache the repository.
     * @throws ChannelException If the channel can not be fetched or a package record is malformed
     */
    @NotNull
    public Map<@NotNull String, @NotNull PackageRecord> getPackages(@NotNull String repositoryUrl) throws ChannelException {
        ChannelDocument document = this.document();
        boolean debug = this.settings.isDebug();
        String repository = RepositoryUrls.update(Objects.requireNonNull(repositoryUrl, "repositoryUrl may not be null"), debug);
        Map<String, PackageRecord> out = new LinkedHashMap<>();
        try {
            int index = 0;
            for (JsonNode raw : document.getPackages(repository)) {
                String name = JsonUtil.requireText(raw, "name", "package #" + index++ + " of repository " + repository);
                NormalizedReleases normalized = ReleaseNormalizer.normalize(raw, document.getSchemaVersion(), debug);
                out.put(name, new PackageRecord(name,
                        JsonUtil.optText(raw, "description"),
                        JsonUtil.optJoinedText(raw, "author"),
                        JsonUtil.optText(raw, "homepage"),
                        normalized.lastModified(),
                        ReleaseSorter.sort(normalized.releases(), true),
                        JsonUtil.optStringList(raw, "previous_names"),
                        JsonUtil.optStringList(raw, "labels"),
                        JsonUtil.optText(raw, "readme"),
                        JsonUtil.optText(raw, "issues"),
                        JsonUtil.optText(raw, "donate"),
                        JsonUtil.optText(raw, "buy")));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidChannelFileException(this.channelUrl, e.getMessage(), e);
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Obtains the packages that have been renamed, mapping each previous name to the current name.
     * If two packages claim the same previous name, the package listed last in the channel wins.
     *
     * @return An unmodifiable map of previous name to current name
     * @throws ChannelException If the channel can not be fetched or a package record is malformed
     */
    @NotNull
    public Map<@NotNull String, @NotNull String> getRenamedPackages() throws ChannelException {
        ChannelDocument document = this.document();
        if (document.getSchemaVersion().getSchemaMajor().hasExplicitRenames()) {
            return document.getRenamedPackages();
        }

        Map<String, String> out = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, List<JsonNode>> repository : document.getPackageCache().entrySet()) {
                int index = 0;
                for (JsonNode raw : repository.getValue()) {
                    String name = JsonUtil.requireText(raw, "name", "package #" + index++ + " of repository " + repository.getKey());
                    for (String previousName : JsonUtil.optStringList(raw, "previous_names")) {
                        out.put(previousName, name);
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidChannelFileException(this.channelUrl, e.getMessage(), e);
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Obtains the repositories listed by the channel. Relative and protocol-relative entries are
     * resolved against the channel location, root-absolute entries are dropped.
     * Order and duplicates are preserved.
     *
     * @return An unmodifiable list of repository URLs and filesystem paths
     * @throws InvalidChannelFileException If the "repositories" key is missing or malformed
     * @throws ChannelException If the channel can not be fetched
     */
    @NotNull
    public List<@NotNull String> getRepositories() throws ChannelException {
        JsonNode repositories = this.document().getRepositories();
        if (repositories == null) {
            throw new InvalidChannelFileException(this.channelUrl, "the \"repositories\" JSON key is missing.");
        } else if (!repositories.isArray()) {
            throw new InvalidChannelFileException(this.channelUrl, "the \"repositories\" JSON key must be a list of strings.");
        }

        RepositoryUrlResolver resolver = new RepositoryUrlResolver(this.channelUrl, this.settings.isDebug());
        List<String> out = new ArrayList<>(repositories.size());
        for (JsonNode repository : repositories) {
            if (!repository.isTextual()) {
                throw new InvalidChannelFileException(this.channelUrl, "the \"repositories\" JSON key must be a list of strings.");
            }
            String resolved = resolver.resolve(repository.textValue());
            if (resolved != null) {
                out.add(resolved);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Obtains the schema version the channel is written in.
     *
     * @return The schema version
     * @throws ChannelException If the channel can not be fetched
     */
    @NotNull
    public SchemaVersion getSchemaVersion() throws ChannelException {
        return this.document().getSchemaVersion();
    }

    @NotNull
    @Contract(pure = true)
    public ChannelSettings getSettings() {
        return this.settings.copy();
    }

    /**
     * Obtains the URLs and paths directly referenced by the channel.
     * Same as {@link #getRepositories()}.
     *
     * @return An unmodifiable list of repository URLs and filesystem paths
     * @throws ChannelException If the channel can not be fetched or the repositories are malformed
     */
    @NotNull
    public List<@NotNull String> getSources() throws ChannelException {
        return this.getRepositories();
    }

    /**
     * Performs all I/O up front, so that later queries do not block.
     *
     * @throws ChannelException If the channel can not be fetched
     */
    public void prefetch() throws ChannelException {
        this.fetch();
    }

    @NotNull
    private ChannelDocument document() throws ChannelException {
        synchronized (this.fetchLock) {
            if (this.state == FetchState.UNFETCHED) {
                ChannelDocument document = ChannelDocument.parse(this.channelUrl, this.retrieve(), this.settings.isDebug());
                this.document = document;
                this.state = FetchState.FETCHED;
            }
            return Objects.requireNonNull(this.document);
        }
    }

    private byte @NotNull[] retrieve() throws ChannelTransportException {
        if (HTTP_PATTERN.matcher(this.channelUrl).find()) {
            try {
                return this.downloader.fetch(this.channelUrl, "Error downloading channel.");
            } catch (DownloaderException e) {
                throw new ChannelTransportException(this.channelUrl, e.getMessage() == null ? "Error downloading channel." : e.getMessage(), e);
            }
        }

        // Anything else must be a filesystem path
        Path path;
        try {
            path = Paths.get(this.channelUrl);
        } catch (InvalidPathException e) {
            throw new ChannelTransportException(this.channelUrl, "Error, file " + this.channelUrl + " does not exist", e);
        }
        if (!Files.exists(path)) {
            throw new ChannelTransportException(this.channelUrl, "Error, file " + this.channelUrl + " does not exist", null);
        }

        if (this.settings.isDebug()) {
            LoggingAdapter.getDefaultLogger().debug(ChannelResolver.class, "Loading {} as a channel", this.channelUrl);
        }

        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ChannelTransportException(this.channelUrl, "Error reading channel file " + this.channelUrl, e);
        }
    }
}
