package org.stianloader.picochannel.version;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Anything that can be ordered by {@link ReleaseSorter}.
 */
public interface VersionedRelease {

    /**
     * The platforms a release is published for. The wildcard "*" denotes all platforms.
     *
     * @return The platform identifiers
     */
    @NotNull
    List<@NotNull String> platforms();

    @Nullable
    String version();
}
