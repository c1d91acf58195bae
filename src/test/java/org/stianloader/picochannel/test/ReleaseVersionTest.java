package org.stianloader.picochannel.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.picochannel.version.ReleaseVersion;

public class ReleaseVersionTest {

    private boolean isNewer(@NotNull String newer, @NotNull String older) {
        return ReleaseVersion.parse(newer).isNewerThan(ReleaseVersion.parse(older));
    }

    @Test
    public void testNumericOrdering() {
        assertTrue(isNewer("1.0.1", "1.0.0"));
        assertTrue(isNewer("1.10.0", "1.9.0"));
        assertTrue(isNewer("2", "1.99.99"));
        assertFalse(isNewer("1.0.0", "1.0.0"));
        assertFalse(isNewer("1.9.0", "1.10.0"));
        assertTrue(isNewer("1.0.10.2", "1.0.9.3"));
    }

    @Test
    public void testTrailingZeros() {
        assertEquals(ReleaseVersion.parse("1"), ReleaseVersion.parse("1.0.0"));
        assertEquals(ReleaseVersion.parse("1.0").hashCode(), ReleaseVersion.parse("1.0.0").hashCode());
        assertFalse(isNewer("1.0.0", "1"));
        assertFalse(isNewer("1", "1.0.0"));
    }

    @Test
    public void testPrefix() {
        assertEquals(ReleaseVersion.parse("v2.1.0"), ReleaseVersion.parse("2.1.0"));
        assertEquals("v2.1.0", ReleaseVersion.parse("v2.1.0").getOriginText());
    }

    @Test
    public void testPrerelease() {
        assertTrue(isNewer("1.0.0", "1.0.0-rc.1"));
        assertFalse(isNewer("1.0.0-rc.1", "1.0.0"));
        assertTrue(isNewer("1.0.0-rc.1", "1.0.0-beta.2"));
        assertTrue(isNewer("1.0.0-beta.11", "1.0.0-beta.2"));
        assertTrue(isNewer("1.0.0-rc10", "1.0.0-rc2"));
        assertTrue(isNewer("1.0.0-alpha.1", "1.0.0-alpha"));
        assertTrue(isNewer("1.0.0-alpha", "1.0.0-1"));
        assertTrue(isNewer("1.0.0-beta", "0.9.9"));
        assertTrue(ReleaseVersion.parse("1.0.0-beta").isPrerelease());
        assertFalse(ReleaseVersion.parse("1.0.0").isPrerelease());
    }

    @Test
    public void testEqualVersionsShareHash() {
        ReleaseVersion a = ReleaseVersion.parse("1.0-rc01");
        ReleaseVersion b = ReleaseVersion.parse("1.0-RC1");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        a = ReleaseVersion.parse("2.0.0-beta.007");
        b = ReleaseVersion.parse("v2-beta.7");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        a = ReleaseVersion.parse("1.2a03");
        b = ReleaseVersion.parse("1.2A3");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(isNewer("1.0-rc010", "1.0-rc9"));
    }

    @Test
    public void testBuildMetadata() {
        assertEquals(ReleaseVersion.parse("1.0.0+20200101"), ReleaseVersion.parse("1.0.0+20210101"));
        assertFalse(isNewer("1.0.0+2", "1.0.0+1"));
    }

    @Test
    public void testDateVersions() {
        assertTrue(isNewer("2020.01.31.10.00.00", "2019.12.31.23.59.59"));
        assertTrue(isNewer("2020.02.01.00.00.00", "2020.01.31.23.59.59"));
    }

    @Test
    public void testRogueVersions() {
        ReleaseVersion.parse("");
        ReleaseVersion.parse("-");
        ReleaseVersion.parse("...");
        ReleaseVersion.parse("garbage");
        assertTrue(isNewer("1.2", "1.2a"));
        assertTrue(isNewer("1.2a", "1.1"));
    }
}
