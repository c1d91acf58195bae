package org.stianloader.picochannel.repo;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.logging.LoggingAdapter;

/**
 * Resolves the repository entries of a channel against the location of the channel itself.
 *
 * <ul>
 * <li>Protocol-relative entries ("//host/path") inherit the scheme of the channel URL,
 * or "https:" if the channel is read from the filesystem.</li>
 * <li>Root-absolute entries ("/path") are not permitted and are skipped.</li>
 * <li>Relative entries ("./path" or "../path") are joined with the channel URL, or with the directory
 * containing the channel file.</li>
 * <li>Everything else is taken as-is.</li>
 * </ul>
 *
 * Every resolved entry is passed through {@link RepositoryUrls#update(String, boolean)}.
 */
public class RepositoryUrlResolver {

    private static final Pattern SCHEME_PATTERN = Pattern.compile("^(https?:)//", Pattern.CASE_INSENSITIVE);

    @NotNull
    private final String channelUrl;
    private final boolean debug;
    @Nullable
    private final String scheme;

    public RepositoryUrlResolver(@NotNull String channelUrl, boolean debug) {
        this.channelUrl = Objects.requireNonNull(channelUrl, "channelUrl may not be null");
        this.debug = debug;
        Matcher matcher = SCHEME_PATTERN.matcher(channelUrl);
        this.scheme = matcher.find() ? matcher.group(1) : null;
    }

    @Contract(pure = true)
    public boolean isRemoteChannel() {
        return this.scheme != null;
    }

    /**
     * Resolves a single repository entry.
     *
     * @param repository The entry as written in the channel
     * @return The absolute URL or filesystem path, or null if the entry is skipped
     */
    @Nullable
    public String resolve(@NotNull String repository) {
        String resolved;
        if (repository.startsWith("//")) {
            resolved = (this.scheme == null ? "https:" : this.scheme) + repository;
        } else if (repository.startsWith("/")) {
            return null;
        } else if (repository.startsWith("./") || repository.startsWith("../")) {
            resolved = this.resolveRelative(repository);
            if (resolved == null) {
                return null;
            }
        } else {
            resolved = repository;
        }
        return RepositoryUrls.update(resolved, this.debug);
    }

    /**
     * {@link URI#resolve(URI)} keeps ".." segments that would climb above the root of the path,
     * e.g. "https://example.com/../x.json". The root has no parent, so these segments are removed.
     *
     * @param uri The resolved URI
     * @return The string form of the URI without leading ".." segments
     */
    @NotNull
    private static String dropLeadingParentSegments(@NotNull URI uri) {
        String text = uri.toString();
        String authority = uri.getRawAuthority();
        if (authority == null) {
            return text;
        }
        String prefix = uri.getScheme() + "://" + authority;
        if (!text.startsWith(prefix)) {
            return text;
        }
        String rest = text.substring(prefix.length());
        while (rest.startsWith("/../")) {
            rest = rest.substring(3);
        }
        if (rest.equals("/..") || rest.startsWith("/..?") || rest.startsWith("/..#")) {
            rest = "/" + rest.substring(3);
        }
        return prefix + rest;
    }

    @Nullable
    private String resolveRelative(@NotNull String repository) {
        try {
            if (this.scheme != null) {
                return RepositoryUrlResolver.dropLeadingParentSegments(URI.create(this.channelUrl).resolve(repository));
            }
            Path parent = Paths.get(this.channelUrl).getParent();
            Path base = parent == null ? Paths.get("") : parent;
            // InvalidPathException is an IllegalArgumentException
            return base.resolve(repository).normalize().toString();
        } catch (IllegalArgumentException e) {
            LoggingAdapter.getDefaultLogger().warn(RepositoryUrlResolver.class, "Skipping repository \"{}\" of channel {} as it can not be resolved", repository, this.channelUrl, e);
            return null;
        }
    }
}
