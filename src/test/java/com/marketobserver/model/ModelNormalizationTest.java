package com.marketobserver.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ModelNormalizationTest {

    @Test
    void parseOrigin_shouldFallBackToDomestic() {
        assertEquals(Origin.FOREIGN, Origin.parse(" Foreign "));
        assertEquals(Origin.DOMESTIC, Origin.parse("domestic"));
        assertEquals(Origin.DOMESTIC, Origin.parse(""));
        assertEquals(Origin.DOMESTIC, Origin.parse(null));
        assertEquals(Origin.DOMESTIC, Origin.parse("overseas"));
    }

    @Test
    void classification_shouldDefaultToMarketAndDropBlankSubCategory() {
        Classification c = new Classification(null, " ");

        assertEquals(Category.MARKET, c.category());
        assertNull(c.subCategory());
    }

    @Test
    void newsItem_shouldCopyMetadata() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("title", "a");
        NewsItem item = new NewsItem(null, null, metadata);
        metadata.put("title", "b");

        assertEquals("", item.text);
        assertEquals(Origin.DOMESTIC, item.origin);
        assertEquals("a", item.metadata("title"));
        assertThrows(UnsupportedOperationException.class, () -> item.metadata.put("x", 1));
    }

    @Test
    void alert_shouldRequireType() {
        assertThrows(IllegalArgumentException.class, () -> new Alert(null, Severity.INFO, "x"));
    }
}
