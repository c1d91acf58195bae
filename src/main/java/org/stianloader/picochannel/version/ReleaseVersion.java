package org.stianloader.picochannel.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A semantic-version-like release version as found in channel documents.
 *
 * <p>The parser is deliberately lenient as channels contain decades worth of version strings:
 * <ul>
 * <li>A leading "v" is ignored ("v1.2" equals "1.2").</li>
 * <li>Any amount of numeric components is permitted, so date based versions such as
 * "2020.01.31.10.00.00" are ordered like any other version. Missing components count as 0.</li>
 * <li>Everything after the first "-" is a pre-release tag. A version with pre-release tag is older
 * than the same version without one. Tags are compared identifier by identifier, digit runs are
 * compared numerically.</li>
 * <li>Build metadata (after "+") is ignored for ordering.</li>
 * <li>A numeric component with trailing garbage, e.g. "2a", counts as its leading digits while the
 * remainder becomes a pre-release identifier.</li>
 * </ul>
 *
 * <p>Parsing never fails.
 */
public final class ReleaseVersion implements Comparable<ReleaseVersion> {

    private static int compareIdentifiers(@NotNull String a, @NotNull String b) {
        boolean numericA = ReleaseVersion.isNumeric(a);
        boolean numericB = ReleaseVersion.isNumeric(b);
        if (numericA && numericB) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        } else if (numericA) {
            return -1;
        } else if (numericB) {
            return 1;
        }

        // Natural ordering so that "rc10" is newer than "rc2"
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int endA = i;
                while (endA < a.length() && Character.isDigit(a.charAt(endA))) {
                    endA++;
                }
                int endB = j;
                while (endB < b.length() && Character.isDigit(b.charAt(endB))) {
                    endB++;
                }
                int cmp = new BigInteger(a.substring(i, endA)).compareTo(new BigInteger(b.substring(j, endB)));
                if (cmp != 0) {
                    return cmp;
                }
                i = endA;
                j = endB;
            } else {
                if (ca != cb) {
                    return Character.compare(ca, cb);
                }
                i++;
                j++;
            }
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    /**
     * Lower-cases an identifier and strips leading zeros from each of its digit runs,
     * so that identifiers comparing equal are also textually equal ("RC01" becomes "rc1").
     */
    @NotNull
    @Contract(pure = true)
    private static String canonicalIdentifier(@NotNull String identifier) {
        String lower = identifier.toLowerCase(Locale.ROOT);
        StringBuilder builder = new StringBuilder(lower.length());
        int i = 0;
        while (i < lower.length()) {
            char c = lower.charAt(i);
            if (!Character.isDigit(c)) {
                builder.append(c);
                i++;
                continue;
            }
            int end = i;
            while (end < lower.length() && Character.isDigit(lower.charAt(end))) {
                end++;
            }
            builder.append(new BigInteger(lower.substring(i, end)).toString());
            i = end;
        }
        return builder.toString();
    }

    @Contract(pure = true)
    private static boolean isNumeric(@NotNull String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @NotNull
    public static ReleaseVersion parse(@NotNull String string) {
        String text = string.trim();
        if (!text.isEmpty() && (text.charAt(0) == 'v' || text.charAt(0) == 'V')) {
            text = text.substring(1);
        }

        int buildSeparator = text.indexOf('+');
        if (buildSeparator != -1) {
            text = text.substring(0, buildSeparator);
        }

        String main = text;
        String tag = null;
        int tagSeparator = text.indexOf('-');
        if (tagSeparator != -1) {
            main = text.substring(0, tagSeparator);
            tag = text.substring(tagSeparator + 1);
        }

        List<BigInteger> components = new ArrayList<>();
        List<String> prerelease = new ArrayList<>();
        if (!main.isEmpty()) {
            for (String part : main.split("\\.", -1)) {
                int digits = 0;
                while (digits < part.length() && Character.isDigit(part.charAt(digits))) {
                    digits++;
                }
                components.add(digits == 0 ? BigInteger.ZERO : new BigInteger(part.substring(0, digits)));
                if (digits != part.length()) {
                    prerelease.add(ReleaseVersion.canonicalIdentifier(part.substring(digits)));
                    break;
                }
            }
        }

        if (tag != null) {
            for (String identifier : tag.split("[.\\-]")) {
                if (!identifier.isEmpty()) {
                    prerelease.add(ReleaseVersion.canonicalIdentifier(identifier));
                }
            }
        }

        // Trailing zeros carry no meaning: 1.0.0 == 1.0 == 1
        int significant = components.size();
        while (significant > 0 && components.get(significant - 1).signum() == 0) {
            significant--;
        }

        return new ReleaseVersion(string, components.subList(0, significant), prerelease);
    }

    @NotNull
    private final List<@NotNull BigInteger> components;
    @NotNull
    private final String originText;
    @NotNull
    private final List<@NotNull String> prerelease;

    private ReleaseVersion(@NotNull String originText, @NotNull List<@NotNull BigInteger> components, @NotNull List<@NotNull String> prerelease) {
        this.originText = originText;
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
        this.prerelease = Collections.unmodifiableList(new ArrayList<>(prerelease));
    }

    @Override
    public int compareTo(@NotNull ReleaseVersion other) {
        int length = Math.max(this.components.size(), other.components.size());
        for (int i = 0; i < length; i++) {
            BigInteger a = i < this.components.size() ? this.components.get(i) : BigInteger.ZERO;
            BigInteger b = i < other.components.size() ? other.components.get(i) : BigInteger.ZERO;
            int cmp = a.compareTo(b);
            if (cmp != 0) {
                return cmp;
            }
        }

        if (this.prerelease.isEmpty() || other.prerelease.isEmpty()) {
            // A release is newer than any of its pre-releases
            return Boolean.compare(this.prerelease.isEmpty(), other.prerelease.isEmpty());
        }

        int tagLength = Math.min(this.prerelease.size(), other.prerelease.size());
        for (int i = 0; i < tagLength; i++) {
            int cmp = ReleaseVersion.compareIdentifiers(this.prerelease.get(i), other.prerelease.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(this.prerelease.size(), other.prerelease.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ReleaseVersion) {
            return this.compareTo((ReleaseVersion) obj) == 0;
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.components, this.prerelease);
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull ReleaseVersion other) {
        return this.compareTo(other) > 0;
    }

    @Contract(pure = true)
    public boolean isPrerelease() {
        return !this.prerelease.isEmpty();
    }

    @Override
    public String toString() {
        return this.originText;
    }
}
