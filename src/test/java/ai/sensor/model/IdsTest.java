package ai.sensor.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdsTest {

    @Test
    void shouldDeriveHunkIdFromPositionAndContent() {
        final String id = Ids.hunkId("a.c", 1, 1, 1, 1, List.of("-x", "+y"));

        assertEquals(id, Ids.hunkId("a.c", 1, 1, 1, 1, List.of("-x", "+y")));
        assertNotEquals(id, Ids.hunkId("a.c", 2, 1, 2, 1, List.of("-x", "+y")));
        assertNotEquals(id, Ids.hunkId("b.c", 1, 1, 1, 1, List.of("-x", "+y")));
        assertTrue(id.matches("hunk:[0-9a-f]{16}"), id);
    }

    @Test
    void shouldKeepPartsSeparateInDigest() {
        assertNotEquals(Ids.templateId("ab", "c", "x"), Ids.templateId("a", "bc", "x"));
    }

    @Test
    void shouldFormatReadableIds() {
        assertEquals("sym:_main", Ids.symbolId("_main", 1));
        assertEquals("sym:_main#3", Ids.symbolId("_main", 3));
        assertEquals("imp:/usr/lib/libz.dylib", Ids.importId("/usr/lib/libz.dylib"));
        assertEquals("feat:parsing-logic-:abc", Ids.featureId(SourceFeatureKind.PARSING_LOGIC, ChangeSide.REMOVED, "hunk:abc"));
        assertEquals("diff:parserd@b1..b2", Ids.diffId("b1", "b2", "parserd"));
        assertEquals("art:b2/parserd/logs", Ids.artifactId("b2", "parserd", "logs"));
        assertEquals("src/x.c", Ids.normalizePath("src\\x.c"));
    }

    @Test
    void shouldScopeMatchIdByTemplateAndString() {
        final String tpl = Ids.templateId("s", "c", "f");

        assertTrue(Ids.matchId(tpl, "str").startsWith("l2b:" + tpl.substring(4) + ":"));
        assertNotEquals(Ids.matchId(tpl, "one"), Ids.matchId(tpl, "two"));
    }
}
