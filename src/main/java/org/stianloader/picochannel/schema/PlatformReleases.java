package org.stianloader.picochannel.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.ReleaseRecord;
import org.stianloader.picochannel.internal.JsonUtil;
import org.stianloader.picochannel.logging.LoggingAdapter;
import org.stianloader.picochannel.repo.RepositoryUrls;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Compatibility shim for schema 1 packages, which predate release lists. Such packages state
 * their downloads through a "platforms" key, in one of two shapes:
 *
 * <ul>
 * <li>An object mapping each platform to a list of <code>{"version": ..., "url": ...}</code> downloads.
 * Downloads with the same version and URL are merged into one release spanning all their platforms.</li>
 * <li>A plain list of platform names. The package itself then carries "version", "url" and "date",
 * making up a single release.</li>
 * </ul>
 *
 * All schema 1 packages were published for editor builds below 3000, which is reflected in
 * the {@link ReleaseRecord#sublimeText() constraint} of the synthesized releases. Releases without
 * a date of their own take the "last_modified" date of the package, and download URLs pointing to
 * retired hosts are rewritten through {@link RepositoryUrls#update(String, boolean)}.
 */
public final class PlatformReleases {

    @NotNull
    static final String LEGACY_BUILDS = "<3000";

    @NotNull
    private static String key(@Nullable String version, @Nullable String url) {
        return version + '\u0000' + url;
    }

    /**
     * Synthesizes the releases of a platform-keyed package.
     *
     * @param record The raw package object
     * @param debug Whether to log the outcome
     * @return An unmodifiable list of releases in document order. Empty if the package has no platforms.
     */
    @NotNull
    public static List<@NotNull ReleaseRecord> synthesize(@NotNull JsonNode record, boolean debug) {
        JsonNode platforms = record.get("platforms");
        List<ReleaseRecord> releases = new ArrayList<>();

        if (platforms != null && platforms.isObject()) {
            Map<String, JsonNode> firstDownload = new LinkedHashMap<>();
            Map<String, List<String>> platformsByDownload = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = platforms.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                for (JsonNode download : JsonUtil.objectList(entry.getValue(), "platforms")) {
                    String key = PlatformReleases.key(JsonUtil.optText(download, "version"), JsonUtil.optText(download, "url"));
                    firstDownload.putIfAbsent(key, download);
                    platformsByDownload.computeIfAbsent(key, ignored -> new ArrayList<>()).add(entry.getKey());
                }
            }
            String lastModified = JsonUtil.optText(record, "last_modified");
            for (Map.Entry<String, JsonNode> download : firstDownload.entrySet()) {
                JsonNode node = download.getValue();
                String date = JsonUtil.optText(node, "date");
                releases.add(new ReleaseRecord(LEGACY_BUILDS, platformsByDownload.get(download.getKey()),
                        RepositoryUrls.update(JsonUtil.optText(node, "url"), debug), date == null ? lastModified : date,
                        JsonUtil.optText(node, "version"), Collections.emptyList(), null));
            }
        } else if (platforms != null && !platforms.isNull()) {
            List<String> names = JsonUtil.optStringList(record, "platforms");
            String date = JsonUtil.optText(record, "date");
            if (date == null) {
                date = JsonUtil.optText(record, "last_modified");
            }
            releases.add(new ReleaseRecord(LEGACY_BUILDS, names.isEmpty() ? Collections.singletonList(ReleaseRecord.ANY) : names,
                    RepositoryUrls.update(JsonUtil.optText(record, "url"), debug), date, JsonUtil.optText(record, "version"),
                    Collections.emptyList(), null));
        }

        if (debug) {
            LoggingAdapter.getDefaultLogger().debug(PlatformReleases.class, "Synthesized {} release(s) for \"{}\" out of its platform list",
                    releases.size(), JsonUtil.optText(record, "name"));
        }
        return Collections.unmodifiableList(releases);
    }

    private PlatformReleases() {
        throw new AssertionError();
    }
}
