package org.stianloader.picochannel.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.ReleaseRecord;
import org.stianloader.picochannel.internal.JsonUtil;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns the raw releases of a package or library record into {@link ReleaseRecord} instances.
 * The JSON tree handed to the normalizer is never modified.
 */
public final class ReleaseNormalizer {

    @NotNull
    private static final String DEPENDENCIES = "dependencies";

    @NotNull
    private static final String LIBRARIES = "libraries";

    /**
     * The outcome of normalizing the releases of one record.
     *
     * @param releases The releases in document order, not yet sorted
     * @param lastModified The newest release date, or for schema 1 the date the record states itself
     */
    public static final record NormalizedReleases(@NotNull List<@NotNull ReleaseRecord> releases, @Nullable String lastModified) {
    }

    @NotNull
    public static NormalizedReleases normalize(@NotNull JsonNode record, @NotNull SchemaVersion version, boolean debug) {
        SchemaMajor schema = version.getSchemaMajor();
        if (schema.hasPlatformReleases()) {
            return new NormalizedReleases(PlatformReleases.synthesize(record, debug), JsonUtil.optText(record, "last_modified"));
        }

        List<ReleaseRecord> releases = ReleaseNormalizer.readReleases(record, schema);
        String lastModified = null;
        for (ReleaseRecord release : releases) {
            String date = release.date();
            // Dates are "yyyy-MM-dd HH:mm:ss", thus lexical order is chronological order
            if (date != null && (lastModified == null || date.compareTo(lastModified) > 0)) {
                lastModified = date;
            }
        }
        return new NormalizedReleases(releases, lastModified);
    }

    @NotNull
    public static ReleaseRecord readRelease(@NotNull JsonNode release, @NotNull SchemaMajor schema) {
        List<String> platforms = JsonUtil.optStringList(release, "platforms");
        String sublimeText = JsonUtil.optText(release, "sublime_text");
        return new ReleaseRecord(sublimeText == null ? ReleaseRecord.ANY : sublimeText,
                platforms.isEmpty() ? Collections.singletonList(ReleaseRecord.ANY) : platforms,
                JsonUtil.optText(release, "url"),
                JsonUtil.optText(release, "date"),
                JsonUtil.optText(release, "version"),
                ReleaseNormalizer.readLibraries(release, schema),
                JsonUtil.optText(release, "sha256"));
    }

    /**
     * Reads the libraries a release requires. The key of the schema generation takes precedence,
     * but documents mixing generations exist: a schema 3 release may already say "libraries"
     * and a schema 4 release may still say "dependencies".
     *
     * @param release The release object
     * @param schema The schema generation of the owning document
     * @return The library names, empty if the release lists none
     */
    @NotNull
    private static List<@NotNull String> readLibraries(@NotNull JsonNode release, @NotNull SchemaMajor schema) {
        String key = schema.getReleaseLibrariesKey();
        if (!release.hasNonNull(key)) {
            key = LIBRARIES.equals(key) ? DEPENDENCIES : LIBRARIES;
        }
        return JsonUtil.optStringList(release, key);
    }

    /**
     * Reads the "releases" list of a record of schema 2 or later.
     *
     * @param record The package or library object
     * @param schema The schema generation of the owning document
     * @return The releases in document order
     */
    @NotNull
    public static List<@NotNull ReleaseRecord> readReleases(@NotNull JsonNode record, @NotNull SchemaMajor schema) {
        List<JsonNode> raw = JsonUtil.objectList(record.get("releases"), "releases");
        List<ReleaseRecord> releases = new ArrayList<>(raw.size());
        for (JsonNode release : raw) {
            releases.add(ReleaseNormalizer.readRelease(release, schema));
        }
        return Collections.unmodifiableList(releases);
    }

    private ReleaseNormalizer() {
        throw new AssertionError();
    }
}
