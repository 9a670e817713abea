package com.marketobserver.input;

import com.marketobserver.model.NewsItem;
import com.marketobserver.model.Origin;
import org.json.JSONArray;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsInputReaderTest {

    private final NewsInputReader reader = new NewsInputReader();

    @TempDir
    Path tempDir;

    @Test
    void parse_shouldMapSourceAndKeepOtherFieldsAsMetadata() {
        JSONArray array = new JSONArray("["
                + "{\"text\":\"円安が進行\",\"source\":\"foreign\",\"title\":\"FX\",\"url\":\"https://example.com/fx\",\"author\":null},"
                + "{\"text\":\"日経平均が上昇\"},"
                + "\"not an object\","
                + "{\"text\":\"金利据え置き\",\"origin\":\"foreign\"}"
                + "]");

        List<NewsItem> items = reader.parse(array);

        assertEquals(3, items.size());
        assertEquals(Origin.FOREIGN, items.get(0).origin);
        assertFalse(items.get(0).metadata.containsKey("source"));
        assertEquals("FX", items.get(0).metadata("title"));
        assertTrue(items.get(0).metadata.containsKey("author"));
        assertNull(items.get(0).metadata("author"));
        assertFalse(items.get(0).metadata.containsKey("text"));
        assertEquals(Origin.DOMESTIC, items.get(1).origin);
        assertEquals(Origin.FOREIGN, items.get(2).origin);
    }

    @Test
    void toItem_shouldPreferOriginAndKeepFeedNameSource() {
        JSONArray array = new JSONArray("["
                + "{\"text\":\"Fed holds rates\",\"origin\":\"foreign\",\"source\":\"Reuters\"},"
                + "{\"text\":\"日銀会合\",\"source\":\"NHK\"},"
                + "{\"text\":\"円安\",\"origin\":\"domestic\",\"source\":\"foreign\"}"
                + "]");

        List<NewsItem> items = reader.parse(array);

        assertEquals(Origin.FOREIGN, items.get(0).origin);
        assertEquals("Reuters", items.get(0).metadata("source"));
        assertEquals(Origin.DOMESTIC, items.get(1).origin);
        assertEquals("NHK", items.get(1).metadata("source"));
        assertEquals(Origin.DOMESTIC, items.get(2).origin);
        assertEquals("foreign", items.get(2).metadata("source"));
    }

    @Test
    void read_shouldLoadUtf8File() throws Exception {
        Path file = tempDir.resolve("input.json");
        Files.writeString(file, "[{\"text\":\"半導体株が堅調\",\"source\":\"domestic\"}]", StandardCharsets.UTF_8);

        List<NewsItem> items = reader.read(file);

        assertEquals(1, items.size());
        assertEquals("半導体株が堅調", items.get(0).text);
    }

    @Test
    void read_shouldRejectNonArrayDocument() throws Exception {
        Path file = tempDir.resolve("input.json");
        Files.writeString(file, "{\"text\":\"x\"}", StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> reader.read(file));
    }

    @Test
    void read_shouldPropagateMissingFile() {
        assertThrows(NoSuchFileException.class, () -> reader.read(tempDir.resolve("missing.json")));
    }
}
