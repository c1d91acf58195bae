package org.stianloader.picochannel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A library (called "dependency" before schema 4) as cached in a channel.
 *
 * @param loadOrder Two digit string defining when the library is loaded relative to others
 * @param releases The releases of the library, newest first
 */
public final record LibraryRecord(@NotNull String name, @Nullable String loadOrder, @Nullable String description,
        @Nullable String author, @Nullable String issues, @NotNull List<@NotNull ReleaseRecord> releases) {

    public LibraryRecord {
        Objects.requireNonNull(name, "name may not be null");
        releases = Collections.unmodifiableList(new ArrayList<>(releases));
    }
}
