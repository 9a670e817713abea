package com.marketobserver.input;

import com.marketobserver.model.NewsItem;
import com.marketobserver.model.Origin;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a JSON array of items. {@code text} and {@code origin} are interpreted; every other
 * field is kept as metadata. A {@code source} of exactly {@code domestic} or {@code foreign}
 * stands in for a missing {@code origin}; any other {@code source} is a feed name and stays in metadata.
 */
public final class NewsInputReader {

    public List<NewsItem> read(Path path) throws IOException {
        String txt = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return parse(new JSONArray(txt));
        } catch (JSONException e) {
            throw new IllegalArgumentException("input must be a JSON array of objects: " + path + ", err=" + e.getMessage(), e);
        }
    }

    public List<NewsItem> parse(JSONArray array) {
        List<NewsItem> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject o = array.optJSONObject(i);
            if (o == null) {
                System.err.println("WARN: input item skipped, not an object. index=" + i);
                continue;
            }
            out.add(toItem(o));
        }
        return out;
    }

    NewsItem toItem(JSONObject o) {
        String text = o.optString("text", "");
        String originRaw = o.optString("origin", "");
        boolean sourceIsOrigin = false;
        if (!o.has("origin")) {
            String source = o.optString("source", "");
            sourceIsOrigin = isOriginName(source);
            if (sourceIsOrigin) {
                originRaw = source;
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (String key : o.keySet()) {
            if ("text".equals(key) || "origin".equals(key) || ("source".equals(key) && sourceIsOrigin)) {
                continue;
            }
            Object value = o.get(key);
            metadata.put(key, value == JSONObject.NULL ? null : value);
        }
        return new NewsItem(text, Origin.parse(originRaw), metadata);
    }

    private static boolean isOriginName(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return Origin.DOMESTIC.wireName().equals(value) || Origin.FOREIGN.wireName().equals(value);
    }
}
