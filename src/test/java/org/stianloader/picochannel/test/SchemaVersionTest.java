package org.stianloader.picochannel.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.stianloader.picochannel.schema.SchemaMajor;
import org.stianloader.picochannel.schema.SchemaVersion;

import com.fasterxml.jackson.databind.ObjectMapper;

public class SchemaVersionTest {

    @Test
    public void testLegacyNumbers() {
        assertSame(SchemaMajor.V2, SchemaVersion.parse(2).getSchemaMajor());
        assertSame(SchemaMajor.V3, SchemaVersion.parse(3.0).getSchemaMajor());

        SchemaVersion legacy = SchemaVersion.parse(1.2);
        assertSame(SchemaMajor.V1, legacy.getSchemaMajor());
        assertEquals(1, legacy.getMajor());
        assertEquals(2, legacy.getMinor());
    }

    @Test
    public void testStrings() {
        SchemaVersion version = SchemaVersion.parse("4.0.0");
        assertSame(SchemaMajor.V4, version.getSchemaMajor());
        assertEquals(0, version.getMinor());
        assertEquals(0, version.getPatch());
        assertEquals("4.0.0", version.getOriginText());

        assertEquals(SchemaVersion.parse("3.0.0"), SchemaVersion.parse(3));
        assertTrue(SchemaVersion.parse("4.0.0").compareTo(SchemaVersion.parse("2.0")) > 0);
    }

    @Test
    public void testJsonValues() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertSame(SchemaMajor.V2, SchemaVersion.parse(mapper.readTree("2.0")).getSchemaMajor());
        assertSame(SchemaMajor.V3, SchemaVersion.parse(mapper.readTree("3")).getSchemaMajor());
        assertSame(SchemaMajor.V4, SchemaVersion.parse(mapper.readTree("\"4.0.0\"")).getSchemaMajor());
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse(mapper.readTree("true")));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse(mapper.readTree("null")));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse(mapper.readTree("[4]")));
    }

    @Test
    public void testRejected() {
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse(null));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse("5.0.0"));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse(0));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse("four"));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse("4.0.0-beta"));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse(-2));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse("9"));
        assertTrue(e.getMessage().contains("schema_version"));
    }

    @Test
    public void testGenerationKeys() {
        assertEquals("packages", SchemaMajor.V1.getPackagesKey());
        assertEquals("packages_cache", SchemaMajor.V2.getPackagesKey());
        assertEquals("dependencies_cache", SchemaMajor.V3.getLibrariesKey());
        assertEquals("libraries_cache", SchemaMajor.V4.getLibrariesKey());
        assertEquals("dependencies", SchemaMajor.V3.getReleaseLibrariesKey());
        assertEquals("libraries", SchemaMajor.V4.getReleaseLibrariesKey());
    }
}
