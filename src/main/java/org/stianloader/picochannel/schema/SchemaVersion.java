package org.stianloader.picochannel.schema;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "schema_version" of a channel document.
 *
 * <p>Old documents state the version as a bare number ({@code 2} or {@code 1.2}), newer ones as
 * a string such as {@code "4.0.0"}. Both forms are accepted by {@link #parse(Object)}, however only the
 * {@link #getSchemaMajor() major version} influences how a document is read.
 */
public final class SchemaVersion implements Comparable<SchemaVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

    @NotNull
    private static IllegalArgumentException unrecognized(@Nullable Object raw) {
        return new IllegalArgumentException("the \"schema_version\" value \"" + raw + "\" is not recognized. "
                + "Supported schema versions are 1.x, 2.0, 3.0.0 and 4.0.0.");
    }

    /**
     * Parses a schema version out of a raw JSON value.
     *
     * @param raw A {@link Number}, a {@link CharSequence} or a numeric or textual {@link JsonNode}
     * @return The parsed version
     * @throws IllegalArgumentException If the value is absent, of the wrong type, malformed or of an unsupported major version
     */
    @NotNull
    public static SchemaVersion parse(@Nullable Object raw) {
        String text;
        if (raw instanceof JsonNode) {
            JsonNode node = (JsonNode) raw;
            if (node.isIntegralNumber()) {
                text = node.bigIntegerValue().toString();
            } else if (node.isNumber()) {
                text = node.decimalValue().toPlainString();
            } else if (node.isTextual()) {
                text = node.textValue();
            } else {
                throw SchemaVersion.unrecognized(node);
            }
        } else if (raw instanceof Double || raw instanceof Float) {
            text = BigDecimal.valueOf(((Number) raw).doubleValue()).toPlainString();
        } else if (raw instanceof BigDecimal) {
            text = ((BigDecimal) raw).toPlainString();
        } else if (raw instanceof Number || raw instanceof CharSequence) {
            text = raw.toString();
        } else {
            throw SchemaVersion.unrecognized(raw);
        }

        Matcher matcher = VERSION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw SchemaVersion.unrecognized(text);
        }

        try {
            int major = Integer.parseInt(matcher.group(1));
            int minor = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
            int patch = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
            SchemaMajor schema = SchemaMajor.fromNumber(major);
            if (schema == null) {
                throw SchemaVersion.unrecognized(text);
            }
            return new SchemaVersion(schema, minor, patch, text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(SchemaVersion.unrecognized(text).getMessage(), e);
        }
    }

    private final int minor;
    @NotNull
    private final String originText;
    private final int patch;
    @NotNull
    private final SchemaMajor schema;

    private SchemaVersion(@NotNull SchemaMajor schema, int minor, int patch, @NotNull String originText) {
        this.schema = schema;
        this.minor = minor;
        this.patch = patch;
        this.originText = originText;
    }

    @Override
    public int compareTo(@NotNull SchemaVersion other) {
        int cmp = Integer.compare(this.getMajor(), other.getMajor());
        if (cmp == 0) {
            cmp = Integer.compare(this.minor, other.minor);
            if (cmp == 0) {
                cmp = Integer.compare(this.patch, other.patch);
            }
        }
        return cmp;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof SchemaVersion) {
            SchemaVersion other = (SchemaVersion) obj;
            return other.schema == this.schema
                    && other.minor == this.minor
                    && other.patch == this.patch;
        }
        return false;
    }

    @Contract(pure = true)
    public int getMajor() {
        return this.schema.getMajor();
    }

    @Contract(pure = true)
    public int getMinor() {
        return this.minor;
    }

    /**
     * Obtains the string this version was parsed from. Numeric values are represented
     * in their plain decimal form, e.g. {@code "3.0"}.
     *
     * @return The origin text
     */
    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Contract(pure = true)
    public int getPatch() {
        return this.patch;
    }

    @NotNull
    @Contract(pure = true)
    public SchemaMajor getSchemaMajor() {
        return this.schema;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.schema, this.minor, this.patch);
    }

    @Override
    public String toString() {
        return this.getMajor() + "." + this.minor + "." + this.patch;
    }
}
