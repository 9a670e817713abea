package com.marketobserver.analyzer;

import com.marketobserver.model.ClassifiedItem;
import com.marketobserver.model.NewsItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Tags an item with category and sub-category. Alternative classifiers (for example a
 * model-backed one) plug in here and must return the same shape as {@link TextClassifier}.
 */
public interface ItemClassifier {

    ClassifiedItem classify(NewsItem item);

    /**
     * Classifies each item independently. An item that fails is logged and left out,
     * so callers compare the returned size against the submitted size.
     */
    default List<ClassifiedItem> classifyBatch(List<NewsItem> items) {
        Logger log = LogManager.getLogger(getClass());
        List<ClassifiedItem> out = new ArrayList<>();
        if (items == null) {
            return out;
        }
        for (int i = 0; i < items.size(); i++) {
            try {
                out.add(classify(items.get(i)));
            } catch (RuntimeException e) {
                log.warn("classify skipped item index={} err={}", i, e.toString());
            }
        }
        return out;
    }
}
