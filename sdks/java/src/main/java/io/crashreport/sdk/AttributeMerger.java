package io.crashreport.sdk;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds ordered attribute overlays into one map.
 *
 * <p>Later overlays win. The merge is shallow: a key present in a later overlay replaces the
 * earlier value entirely, nested maps included.
 */
public final class AttributeMerger {

    private AttributeMerger() {}

    public static Map<String, Object> merge(List<? extends Map<String, ?>> overlays) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map<String, ?> overlay : overlays) {
            if (overlay != null) {
                merged.putAll(overlay);
            }
        }
        return merged;
    }
}
