package org.stianloader.picochannel.schema;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The known generations of the channel schema. Everything that differs between two generations
 * is declared here, so that callers only ever branch on a {@link SchemaMajor} constant rather
 * than comparing version numbers by hand.
 */
public enum SchemaMajor {

    /**
     * Schema 1.x. Packages carry a single platform list instead of releases, the package cache is
     * stored under "packages" and renames as well as the URL slug mapping are explicit top level maps.
     */
    V1(1, "packages", "dependencies_cache", "dependencies"),

    /**
     * Schema 2.0. Introduced explicit release lists and the "packages_cache" key. Renames are derived
     * from "previous_names".
     */
    V2(2, "packages_cache", "dependencies_cache", "dependencies"),

    /**
     * Schema 3.0.0.
     */
    V3(3, "packages_cache", "dependencies_cache", "dependencies"),

    /**
     * Schema 4.0.0. "Dependencies" were renamed to "libraries", both in the library cache
     * and within individual releases.
     */
    V4(4, "packages_cache", "libraries_cache", "libraries");

    @Nullable
    @Contract(pure = true)
    public static SchemaMajor fromNumber(int major) {
        for (SchemaMajor schema : SchemaMajor.values()) {
            if (schema.major == major) {
                return schema;
            }
        }
        return null;
    }

    @NotNull
    private final String librariesKey;
    private final int major;
    @NotNull
    private final String packagesKey;
    @NotNull
    private final String releaseLibrariesKey;

    private SchemaMajor(int major, @NotNull String packagesKey, @NotNull String librariesKey, @NotNull String releaseLibrariesKey) {
        this.major = major;
        this.packagesKey = packagesKey;
        this.librariesKey = librariesKey;
        this.releaseLibrariesKey = releaseLibrariesKey;
    }

    /**
     * Whether the document lists packages by platform instead of by release, requiring releases
     * to be synthesized out of the platform list.
     *
     * @return True for documents predating explicit release lists
     */
    @Contract(pure = true)
    public boolean hasPlatformReleases() {
        return this == V1;
    }

    /**
     * Whether the top-level "package_name_map" key is honoured. Later generations retired the feature.
     *
     * @return True if the name map is read
     */
    @Contract(pure = true)
    public boolean hasNameMap() {
        return this == V1;
    }

    /**
     * Whether renames are stated through the top-level "renamed_packages" key instead of being
     * derived from the "previous_names" of each package.
     *
     * @return True if the explicit rename map is read
     */
    @Contract(pure = true)
    public boolean hasExplicitRenames() {
        return this == V1;
    }

    @NotNull
    @Contract(pure = true)
    public String getLibrariesKey() {
        return this.librariesKey;
    }

    @Contract(pure = true)
    public int getMajor() {
        return this.major;
    }

    @NotNull
    @Contract(pure = true)
    public String getPackagesKey() {
        return this.packagesKey;
    }

    /**
     * Obtains the key under which a release lists the libraries it requires.
     * Canonical records always expose this list as "libraries", regardless of the generation.
     *
     * @return The key within a release object
     */
    @NotNull
    @Contract(pure = true)
    public String getReleaseLibrariesKey() {
        return this.releaseLibrariesKey;
    }
}
