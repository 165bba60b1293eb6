package org.deltaio.storage.api;

import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ObjectPathTest {

    @Test
    void testParse_StripsLeadingAndTrailingDelimiter() {
        assertEquals("databases/foo/bar", ObjectPath.parse("/databases/foo/bar").asString());
        assertEquals("a/b", ObjectPath.parse("a/b/").asString());
        assertEquals(ObjectPath.parse("/a/b/"), ObjectPath.parse("a/b"));
    }

    @Test
    void testParse_SlashIsRoot() {
        assertTrue(ObjectPath.parse("/").isRoot());
        assertTrue(ObjectPath.parse("").isRoot());
        assertEquals("", ObjectPath.root().toString());
    }

    @Test
    void testParse_RejectsIllegalParts() {
        assertThrows(IllegalArgumentException.class, () -> ObjectPath.parse("a//b"));
        assertThrows(IllegalArgumentException.class, () -> ObjectPath.parse("a/../b"));
        assertThrows(IllegalArgumentException.class, () -> ObjectPath.parse("./a"));
        assertThrows(IllegalArgumentException.class, () -> ObjectPath.parse("a\nb"));
    }

    @Test
    void testFrom_DropsEmptyParts() {
        assertEquals("a/b/c", ObjectPath.from("//a//b/c/").asString());
        assertTrue(ObjectPath.from(null).isRoot());
    }

    @Test
    void testFromUrlPath_DecodesPercentEncoding() {
        assertEquals("data/my table", ObjectPath.fromUrlPath("/data/my%20table").asString());
        assertEquals("a+b", ObjectPath.fromUrlPath("/a+b").asString());
    }

    @Test
    void testChildAndJoin() {
        ObjectPath base = ObjectPath.parse("a/b");
        assertEquals("a/b/c", base.child("c").asString());
        assertEquals("a/b/c/d", base.join(ObjectPath.parse("c/d")).asString());
        assertSame(base, base.join(ObjectPath.root()));
        assertEquals("x", ObjectPath.root().child("x").asString());
        assertThrows(IllegalArgumentException.class, () -> base.child("c/d"));
    }

    @Test
    void testStripPrefix_MatchesWholeParts() {
        ObjectPath path = ObjectPath.parse("a/b/c");
        assertThat(path.stripPrefix(ObjectPath.parse("a/b"))).contains(ObjectPath.parse("c"));
        assertThat(path.stripPrefix(ObjectPath.parse("a/b/c"))).contains(ObjectPath.root());
        assertThat(ObjectPath.parse("a/bc").stripPrefix(ObjectPath.parse("a/b"))).isEmpty();
        assertThat(path.stripPrefix(ObjectPath.root())).contains(path);
    }

    @Test
    void testIsStrictlyUnder() {
        ObjectPath prefix = ObjectPath.parse("a/b");
        assertTrue(ObjectPath.parse("a/b/c").isStrictlyUnder(prefix));
        assertFalse(prefix.isStrictlyUnder(prefix));
        assertFalse(ObjectPath.parse("a/bc").isStrictlyUnder(prefix));
    }

    @Test
    void testPartsAndFilename() {
        ObjectPath path = ObjectPath.parse("_delta_log/00000000000000000001.json");
        assertEquals(List.of("_delta_log", "00000000000000000001.json"), path.parts());
        assertThat(path.filename()).contains("00000000000000000001.json");
        assertThat(ObjectPath.root().filename()).isEmpty();
        assertTrue(ObjectPath.root().parts().isEmpty());
    }
}
