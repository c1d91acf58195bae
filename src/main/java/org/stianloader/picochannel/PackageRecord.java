package org.stianloader.picochannel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A package as cached in a channel, in the canonical shape shared by all schema generations.
 * Fields a generation does not know about are filled with defaults: null for the URLs and
 * empty lists for {@link #previousNames()} and {@link #labels()}.
 *
 * @param releases The releases of the package, newest and most platform specific first
 */
public final record PackageRecord(@NotNull String name, @Nullable String description, @Nullable String author,
        @Nullable String homepage, @Nullable String lastModified, @NotNull List<@NotNull ReleaseRecord> releases,
        @NotNull List<@NotNull String> previousNames, @NotNull List<@NotNull String> labels,
        @Nullable String readme, @Nullable String issues, @Nullable String donate, @Nullable String buy) {

    public PackageRecord {
        Objects.requireNonNull(name, "name may not be null");
        releases = Collections.unmodifiableList(new ArrayList<>(releases));
        previousNames = Collections.unmodifiableList(new ArrayList<>(previousNames));
        labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }
}
