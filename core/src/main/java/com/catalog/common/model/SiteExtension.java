package com.catalog.common.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opaque pass-through payload of a site entry: the raw {@code ext} value plus every
 * field the parser does not know. Merge logic never looks inside.
 */
public final class SiteExtension {
    public static final SiteExtension EMPTY = new SiteExtension(null, Collections.emptyMap());

    private final JsonElement ext;
    private final Map<String, JsonElement> unknownFields;

    public SiteExtension(JsonElement ext, Map<String, JsonElement> unknownFields) {
        this.ext = ext != null ? ext.deepCopy() : null;
        Map<String, JsonElement> copy = new LinkedHashMap<>();
        if (unknownFields != null) unknownFields.forEach((k, v) -> copy.put(k, v.deepCopy()));
        this.unknownFields = Collections.unmodifiableMap(copy);
    }

    public JsonElement getExt() {
        return ext != null ? ext.deepCopy() : null;
    }

    /** ext as plain text, when the feed delivered a string (e.g. a script url). */
    public String getExtAsString() {
        if (ext == null || !ext.isJsonPrimitive()) return null;
        return ext.getAsString();
    }

    public Map<String, JsonElement> getUnknownFields() {
        return unknownFields;
    }

    public boolean isEmpty() {
        return ext == null && unknownFields.isEmpty();
    }

    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        unknownFields.forEach((k, v) -> obj.add(k, v.deepCopy()));
        if (ext != null) obj.add("ext", ext.deepCopy());
        return obj;
    }
}
