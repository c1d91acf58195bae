package org.stianloader.picochannel.version;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Orders releases by their {@link ReleaseVersion}.
 *
 * <p>Releases sharing a version are ordered by platform specificity: in ascending order a release
 * for the "*" wildcard comes before one naming concrete platforms, which in turn places the
 * platform specific download first when sorting newest-first. Releases without any version
 * sort as the oldest. The sort is stable, that is releases that compare equal keep their document order.
 */
public final class ReleaseSorter {

    @NotNull
    private static final Comparator<VersionedRelease> ASCENDING = Comparator
            .comparing(ReleaseSorter::parseVersion, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ReleaseSorter::isPlatformSpecific)
            .thenComparing(release -> String.join(",", release.platforms()));

    @Contract(pure = true)
    private static boolean isPlatformSpecific(@NotNull VersionedRelease release) {
        return !release.platforms().isEmpty() && !release.platforms().contains("*");
    }

    @Nullable
    private static ReleaseVersion parseVersion(@NotNull VersionedRelease release) {
        String version = release.version();
        return version == null ? null : ReleaseVersion.parse(version);
    }

    @NotNull
    @Contract(pure = true)
    public static <T extends VersionedRelease> Comparator<T> comparator(boolean reverse) {
        Comparator<VersionedRelease> comparator = reverse ? ReleaseSorter.ASCENDING.reversed() : ReleaseSorter.ASCENDING;
        return comparator::compare;
    }

    /**
     * Sorts releases by version.
     *
     * @param <T> The type of release
     * @param releases The releases to sort, left untouched
     * @param reverse True to sort the newest release first
     * @return A new, unmodifiable sorted list
     */
    @NotNull
    public static <T extends VersionedRelease> List<T> sort(@NotNull Collection<T> releases, boolean reverse) {
        List<T> sorted = new ArrayList<>(releases);
        sorted.sort(ReleaseSorter.comparator(reverse));
        return Collections.unmodifiableList(sorted);
    }

    private ReleaseSorter() {
        throw new AssertionError();
    }
}
