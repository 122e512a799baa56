package com.chicu.trafficvolume.ml.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One ordered input row: {@code names.get(i)} is the name of {@code values.get(i)}.
 */
public record FeatureVector(List<String> names, List<Object> values) {

    public FeatureVector {
        if (names == null || values == null || names.size() != values.size()) {
            throw new IllegalArgumentException("names/values size mismatch");
        }
        names = List.copyOf(names);
        values = Collections.unmodifiableList(values);
    }

    public int size() {
        return names.size();
    }

    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            m.put(names.get(i), values.get(i));
        }
        return m;
    }
}
