package com.catalog.core.fetch;

import com.catalog.common.model.CatalogFragment;
import com.catalog.common.model.LiveEntry;
import com.catalog.common.model.ResolveHint;
import com.catalog.common.model.ResolverDescriptor;
import com.catalog.common.model.RuleEntry;
import com.catalog.common.model.SiteEntry;
import com.catalog.common.model.SiteExtension;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Turns the raw JSON of a config feed into a {@link CatalogFragment}.
 * <p>
 * The top level must be an object with a {@code sites} array. Unknown top-level fields
 * are ignored; unknown site fields are kept as opaque extension payload. Entries missing
 * their required fields are dropped and counted.
 */
public class FragmentParser {
    private static final Logger logger = LoggerFactory.getLogger(FragmentParser.class);

    private static final Set<String> KNOWN_SITE_FIELDS = Set.of(
            "key", "name", "type", "api", "searchable", "quickSearch", "filterable",
            "ext", "header", "fallbackParsers", "updatedAt");

    public CatalogFragment parse(String sourceId, String sourceUrl, byte[] raw, long fetchedAt)
            throws SourceParseException {
        if (raw == null || raw.length == 0) {
            throw new SourceParseException(sourceId, "Empty response body");
        }
        String text = new String(raw, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) text = text.substring(1);

        JsonElement root;
        try {
            root = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new SourceParseException(sourceId, "Malformed JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new SourceParseException(sourceId, "Top level is not a JSON object");
        }
        JsonObject obj = root.getAsJsonObject();
        JsonElement sitesEl = obj.get("sites");
        if (sitesEl == null || !sitesEl.isJsonArray()) {
            throw new SourceParseException(sourceId, "Required field 'sites' missing or not an array");
        }

        int[] rejected = {0};
        List<SiteEntry> sites = parseSites(sourceId, sitesEl.getAsJsonArray(), rejected);
        List<ResolverDescriptor> resolvers = parseResolvers(array(obj, "parses"), rejected);
        List<RuleEntry> rules = parseRules(array(obj, "rules"));
        List<LiveEntry> lives = parseLives(array(obj, "lives"), rejected);
        List<String> wallpapers = parseWallpapers(obj.get("wallpaper"));

        if (rejected[0] > 0) {
            logger.warn("Source {}: dropped {} invalid entries", sourceId, rejected[0]);
        }
        return new CatalogFragment(sourceId, sourceUrl, fetchedAt, sites, resolvers, rules, lives,
                wallpapers, rejected[0]);
    }

    // --- Sites ---

    private List<SiteEntry> parseSites(String sourceId, JsonArray array, int[] rejected) {
        Map<String, SiteEntry> byKey = new LinkedHashMap<>();
        for (JsonElement el : array) {
            if (!el.isJsonObject()) {
                rejected[0]++;
                continue;
            }
            JsonObject s = el.getAsJsonObject();
            String key = string(s, "key");
            String name = string(s, "name");
            String api = string(s, "api");
            if (isBlank(key) || isBlank(name) || isBlank(api)) {
                rejected[0]++;
                continue;
            }
            if (byKey.containsKey(key)) {
                logger.debug("Source {}: duplicate site key '{}', keeping first", sourceId, key);
                continue;
            }

            Map<String, JsonElement> unknown = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> field : s.entrySet()) {
                if (!KNOWN_SITE_FIELDS.contains(field.getKey())) unknown.put(field.getKey(), field.getValue());
            }

            SiteEntry site = SiteEntry.builder(key, name, api)
                    .kindCode(integer(s, "type", 0))
                    .searchable(flag(s, "searchable"))
                    .quickSearch(flag(s, "quickSearch"))
                    .filterable(flag(s, "filterable"))
                    .extension(new SiteExtension(s.get("ext"), unknown))
                    .hint(new ResolveHint(strings(s.get("fallbackParsers"))))
                    .headers(stringMap(s.get("header")))
                    .updatedAt(longValue(s, "updatedAt", 0L))
                    .build();
            byKey.put(key, site);
        }
        return new ArrayList<>(byKey.values());
    }

    // --- Parses / Rules / Lives ---

    private List<ResolverDescriptor> parseResolvers(JsonArray array, int[] rejected) {
        List<ResolverDescriptor> result = new ArrayList<>();
        for (JsonElement el : array) {
            if (!el.isJsonObject()) { rejected[0]++; continue; }
            JsonObject p = el.getAsJsonObject();
            String name = string(p, "name");
            String url = string(p, "url");
            if (isBlank(name) || isBlank(url)) { rejected[0]++; continue; }
            result.add(new ResolverDescriptor(name, integer(p, "type", 0), url, text(p.get("ext")),
                    strings(p.get("flag")), stringMap(p.get("header"))));
        }
        return result;
    }

    private List<RuleEntry> parseRules(JsonArray array) {
        List<RuleEntry> result = new ArrayList<>();
        for (JsonElement el : array) {
            if (!el.isJsonObject()) continue;
            JsonObject r = el.getAsJsonObject();
            String name = string(r, "name");
            List<String> hosts = strings(r.has("hosts") ? r.get("hosts") : r.get("host"));
            if (isBlank(name) && hosts.isEmpty()) continue;
            result.add(new RuleEntry(name != null ? name : String.join(",", hosts), hosts,
                    strings(r.get("regex")), strings(r.get("script"))));
        }
        return result;
    }

    private List<LiveEntry> parseLives(JsonArray array, int[] rejected) {
        List<LiveEntry> result = new ArrayList<>();
        for (JsonElement el : array) {
            if (!el.isJsonObject()) { rejected[0]++; continue; }
            JsonObject l = el.getAsJsonObject();
            String name = string(l, "name");
            String url = string(l, "url");
            if (isBlank(name) || isBlank(url)) { rejected[0]++; continue; }
            result.add(new LiveEntry(name, integer(l, "type", 0), url, string(l, "playerType"),
                    string(l, "ua"), string(l, "epg"), string(l, "logo"), flag(l, "boot")));
        }
        return result;
    }

    private List<String> parseWallpapers(JsonElement el) {
        if (el == null || el.isJsonNull()) return List.of();
        if (el.isJsonPrimitive()) {
            String s = el.getAsString().trim();
            return s.isEmpty() ? List.of() : List.of(s);
        }
        List<String> list = strings(el);
        list.removeIf(String::isBlank);
        return list;
    }

    // --- Lenient JSON helpers (Feeds sind oft unsauber) ---

    private static JsonArray array(JsonObject obj, String field) {
        JsonElement el = obj.get(field);
        return el != null && el.isJsonArray() ? el.getAsJsonArray() : new JsonArray();
    }

    private static String string(JsonObject obj, String field) {
        return text(obj.get(field));
    }

    private static String text(JsonElement el) {
        if (el == null || el.isJsonNull()) return null;
        if (el.isJsonPrimitive()) return el.getAsString();
        return el.toString();
    }

    private static int integer(JsonObject obj, String field, int def) {
        return (int) longValue(obj, field, def);
    }

    private static long longValue(JsonObject obj, String field, long def) {
        JsonElement el = obj.get(field);
        if (el == null || !el.isJsonPrimitive()) return def;
        try {
            return el.getAsJsonPrimitive().isNumber() ? el.getAsLong() : Long.parseLong(el.getAsString().trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static boolean flag(JsonObject obj, String field) {
        JsonElement el = obj.get(field);
        if (el == null || !el.isJsonPrimitive()) return false;
        if (el.getAsJsonPrimitive().isBoolean()) return el.getAsBoolean();
        if (el.getAsJsonPrimitive().isNumber()) return el.getAsInt() != 0;
        String s = el.getAsString().trim();
        return s.equalsIgnoreCase("true") || s.equals("1");
    }

    private static List<String> strings(JsonElement el) {
        List<String> list = new ArrayList<>();
        if (el == null || el.isJsonNull()) return list;
        if (el.isJsonArray()) {
            for (JsonElement item : el.getAsJsonArray()) {
                if (item.isJsonPrimitive()) list.add(item.getAsString());
            }
        } else if (el.isJsonPrimitive()) {
            list.add(el.getAsString());
        }
        return list;
    }

    private static Map<String, String> stringMap(JsonElement el) {
        Map<String, String> map = new LinkedHashMap<>();
        if (el == null || !el.isJsonObject()) return map;
        for (Map.Entry<String, JsonElement> e : el.getAsJsonObject().entrySet()) {
            String v = text(e.getValue());
            if (v != null) map.put(e.getKey(), v);
        }
        return map;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
