package com.catalog.core.fetch;

import com.catalog.common.model.CatalogFragment;
import com.catalog.common.model.SiteEntry;
import com.catalog.common.model.SiteKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FragmentParserTest {

    private final FragmentParser parser = new FragmentParser();

    private CatalogFragment parse(String json) throws SourceParseException {
        return parser.parse("s1", "https://feed.example/s1.json", json.getBytes(StandardCharsets.UTF_8), 42L);
    }

    @Test
    void testParsesSitesLivesParsersAndRules() throws Exception {
        CatalogFragment fragment = parse("""
                {
                  "spider": "ignored.jar",
                  "wallpaper": "https://img.example/bg.jpg",
                  "sites": [
                    {"key": "a", "name": "Alpha", "type": 3, "api": "csp_Alpha", "searchable": 1,
                     "quickSearch": "true", "ext": {"token": "x"}, "style": {"type": "rect"},
                     "fallbackParsers": ["jx1", "jx2"], "header": {"User-Agent": "okhttp"}},
                    {"key": "b", "name": "Beta", "type": 7, "api": "https://b.example/api"}
                  ],
                  "parses": [{"name": "jx1", "type": 1, "url": "https://jx.example/?url=", "flag": ["qq"]}],
                  "rules": [{"host": "*.cdn.example", "regex": ["\\\\.ts$"]}],
                  "lives": [{"name": "TV", "url": "https://tv.example/list.m3u", "ua": "player/1"}]
                }
                """);

        assertEquals(2, fragment.getSites().size());
        SiteEntry a = fragment.getSites().get(0);
        assertEquals(SiteKind.VIDEO_SCRIPT, a.getKind());
        assertTrue(a.isSearchable());
        assertTrue(a.isQuickSearch());
        assertFalse(a.isFilterable());
        assertEquals(List.of("jx1", "jx2"), a.getHint().getFallbackParsers());
        assertEquals("okhttp", a.getHeaders().get("User-Agent"));
        assertTrue(a.getExtension().getUnknownFields().containsKey("style"));
        assertEquals("x", a.getExtension().getExt().getAsJsonObject().get("token").getAsString());

        SiteEntry b = fragment.getSites().get(1);
        assertEquals(SiteKind.OTHER, b.getKind());
        assertEquals(7, b.getKindCode());

        assertEquals("jx1", fragment.getResolvers().get(0).name());
        assertEquals(List.of("*.cdn.example"), fragment.getRules().get(0).hosts());
        assertEquals("player/1", fragment.getLives().get(0).userAgent());
        assertEquals(List.of("https://img.example/bg.jpg"), fragment.getWallpapers());
        assertEquals(42L, fragment.getFetchedAt());
        assertEquals(0, fragment.getRejectedEntries());
    }

    @Test
    void testMissingSitesIsParseError() {
        assertThrows(SourceParseException.class, () -> parse("{\"lives\": []}"));
        assertThrows(SourceParseException.class, () -> parse("{\"sites\": {}}"));
        assertThrows(SourceParseException.class, () -> parse("[1, 2]"));
        assertThrows(SourceParseException.class, () -> parse("{broken"));
        assertThrows(SourceParseException.class, () -> parse(""));
    }

    @Test
    void testInvalidEntriesAreDroppedAndCounted() throws Exception {
        CatalogFragment fragment = parse("""
                {"sites": [
                   {"key": "ok", "name": "Ok", "api": "x"},
                   {"key": "noapi", "name": "No api"},
                   {"name": "no key", "api": "x"},
                   "garbage"
                 ],
                 "lives": [{"name": "no url"}],
                 "parses": [{"url": "https://no-name"}]}
                """);

        assertEquals(1, fragment.getSites().size());
        assertEquals(5, fragment.getRejectedEntries());
    }

    @Test
    void testDuplicateKeysKeepFirst() throws Exception {
        CatalogFragment fragment = parse("""
                {"sites": [
                   {"key": "dup", "name": "First", "api": "x"},
                   {"key": "dup", "name": "Second", "api": "y"}
                 ]}
                """);

        assertEquals(1, fragment.getSites().size());
        assertEquals("First", fragment.getSites().get(0).getName());
    }

    @Test
    void testByteOrderMarkIsTolerated() throws Exception {
        CatalogFragment fragment = parse("\uFEFF{\"sites\": []}");
        assertTrue(fragment.getSites().isEmpty());
    }
}
