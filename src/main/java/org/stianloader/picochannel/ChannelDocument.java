package org.stianloader.picochannel;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picochannel.internal.JsonUtil;
import org.stianloader.picochannel.repo.RepositoryUrls;
import org.stianloader.picochannel.schema.SchemaMajor;
import org.stianloader.picochannel.schema.SchemaVersion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A decoded and validated channel document. Instances are immutable and only ever created
 * by {@link #parse(String, byte[], boolean)}, which already rewrites the repository URLs keying
 * the package and library caches through {@link RepositoryUrls#update(String, boolean)}.
 * The package and library records themselves are kept as raw JSON and normalized on demand.
 */
final class ChannelDocument {

    @NotNull
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @NotNull
    static ChannelDocument parse(@NotNull String channelUrl, byte @NotNull[] content, boolean debug) throws InvalidChannelFileException {
        JsonNode root;
        try {
            String json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            root = MAPPER.readTree(json);
        } catch (CharacterCodingException | JsonProcessingException e) {
            throw new InvalidChannelFileException(channelUrl, "parsing JSON failed.", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidChannelFileException(channelUrl, "parsing JSON failed.");
        }

        JsonNode rawVersion = root.get("schema_version");
        if (rawVersion == null) {
            throw new InvalidChannelFileException(channelUrl, "the \"schema_version\" JSON key is missing.");
        }
        SchemaVersion version;
        try {
            version = SchemaVersion.parse(rawVersion);
        } catch (IllegalArgumentException e) {
            throw new InvalidChannelFileException(channelUrl, e.getMessage(), e);
        }

        SchemaMajor schema = version.getSchemaMajor();
        try {
            Map<String, List<JsonNode>> packages = ChannelDocument.readCache(root, schema.getPackagesKey(), debug);
            Map<String, List<JsonNode>> libraries = ChannelDocument.readCache(root, schema.getLibrariesKey(), debug);
            Map<String, String> nameMap = schema.hasNameMap() ? JsonUtil.optStringMap(root, "package_name_map") : Collections.emptyMap();
            Map<String, String> renamed = schema.hasExplicitRenames() ? JsonUtil.optStringMap(root, "renamed_packages") : Collections.emptyMap();
            return new ChannelDocument(version, root.get("repositories"), packages, libraries, nameMap, renamed);
        } catch (IllegalArgumentException e) {
            throw new InvalidChannelFileException(channelUrl, e.getMessage(), e);
        }
    }

    @NotNull
    private static Map<String, List<JsonNode>> readCache(@NotNull JsonNode root, @NotNull String key, boolean debug) {
        JsonNode cache = root.get(key);
        if (cache == null || cache.isNull()) {
            return Collections.emptyMap();
        } else if (!cache.isObject()) {
            throw new IllegalArgumentException("the \"" + key + "\" JSON key must be an object.");
        }

        Map<String, List<JsonNode>> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = cache.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String repository = RepositoryUrls.update(entry.getKey(), debug);
            out.put(repository, JsonUtil.objectList(entry.getValue(), key));
        }
        return Collections.unmodifiableMap(out);
    }

    @NotNull
    private final Map<String, List<JsonNode>> libraries;
    @NotNull
    private final Map<String, String> nameMap;
    @NotNull
    private final Map<String, List<JsonNode>> packages;
    @NotNull
    private final Map<String, String> renamedPackages;
    @Nullable
    private final JsonNode repositories;
    @NotNull
    private final SchemaVersion schemaVersion;

    private ChannelDocument(@NotNull SchemaVersion schemaVersion, @Nullable JsonNode repositories,
            @NotNull Map<String, List<JsonNode>> packages, @NotNull Map<String, List<JsonNode>> libraries,
            @NotNull Map<String, String> nameMap, @NotNull Map<String, String> renamedPackages) {
        this.schemaVersion = schemaVersion;
        this.repositories = repositories;
        this.packages = packages;
        this.libraries = libraries;
        this.nameMap = nameMap;
        this.renamedPackages = renamedPackages;
    }

    /**
     * Obtains the raw library records cached for a repository.
     *
     * @param repository The already rewritten repository URL
     * @return The records, empty if the repository is unknown
     */
    @NotNull
    @Contract(pure = true)
    List<@NotNull JsonNode> getLibraries(@NotNull String repository) {
        return this.libraries.getOrDefault(repository, Collections.emptyList());
    }

    @NotNull
    @Contract(pure = true)
    Map<String, String> getNameMap() {
        return this.nameMap;
    }

    @NotNull
    @Contract(pure = true)
    Map<String, List<JsonNode>> getPackageCache() {
        return this.packages;
    }

    @NotNull
    @Contract(pure = true)
    List<@NotNull JsonNode> getPackages(@NotNull String repository) {
        return this.packages.getOrDefault(repository, Collections.emptyList());
    }

    @NotNull
    @Contract(pure = true)
    Map<String, String> getRenamedPackages() {
        return this.renamedPackages;
    }

    /**
     * Obtains the "repositories" node. Its presence is only validated once repositories are queried.
     *
     * @return The raw node, null if the key is absent
     */
    @Nullable
    @Contract(pure = true)
    JsonNode getRepositories() {
        return this.repositories;
    }

    @NotNull
    @Contract(pure = true)
    SchemaVersion getSchemaVersion() {
        return this.schemaVersion;
    }
}
