package org.stianloader.picochannel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.version.VersionedRelease;

/**
 * A single downloadable release of a package or library.
 *
 * <p>Regardless of the schema generation a release was read from, the libraries it requires
 * are always exposed as {@link #libraries()}. Older documents call them "dependencies".
 *
 * @param sublimeText The version constraint on the editor build, "*" for any build
 * @param platforms The platform identifiers the release is published for, "*" for all of them
 * @param url The download location
 * @param date The release date as written in the document, usually "yyyy-MM-dd HH:mm:ss"
 * @param version The version of the release
 * @param libraries The names of the libraries the release requires
 * @param sha256 The hex encoded SHA-256 digest of the download. Only set for library releases
 */
public final record ReleaseRecord(@NotNull String sublimeText, @NotNull List<@NotNull String> platforms,
        @Nullable String url, @Nullable String date, @Nullable String version,
        @NotNull List<@NotNull String> libraries, @Nullable String sha256) implements VersionedRelease {

    @NotNull
    public static final String ANY = "*";

    public ReleaseRecord {
        Objects.requireNonNull(sublimeText, "sublimeText may not be null");
        platforms = Collections.unmodifiableList(new ArrayList<>(platforms));
        libraries = Collections.unmodifiableList(new ArrayList<>(libraries));
    }

    /**
     * Checks whether the release can be installed on a given platform. A release for "windows"
     * is compatible with "windows-x64" and "windows-x32", while a release for "windows-x64" is not
     * compatible with "windows".
     *
     * @param platform A platform identifier such as "linux", "osx-arm64" or "windows-x64"
     * @return True if the release declares the platform, its operating system or the wildcard
     */
    @Contract(pure = true)
    public boolean isCompatibleWith(@NotNull String platform) {
        if (this.platforms.contains(ReleaseRecord.ANY) || this.platforms.contains(platform)) {
            return true;
        }
        int separator = platform.indexOf('-');
        return separator != -1 && this.platforms.contains(platform.substring(0, separator));
    }
}
