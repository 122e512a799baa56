package com.chicu.trafficvolume.ml.features;

import com.chicu.trafficvolume.model.FeatureField;
import com.chicu.trafficvolume.model.FeatureRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Column names and order agreed with the trained pipeline.
 * The names are the original dataset columns, which are also the request wire names.
 */
public class FeatureSchema {

    private static final FeatureSchema CANONICAL = new FeatureSchema(List.of(FeatureField.values()));

    private final List<FeatureField> fields;
    private final List<String> names;

    FeatureSchema(List<FeatureField> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("schema fields are empty");
        }
        this.fields = List.copyOf(fields);
        this.names = this.fields.stream().map(FeatureField::wireName).toList();
    }

    public static FeatureSchema canonical() {
        return CANONICAL;
    }

    public List<String> featureNames() {
        return names;
    }

    public FeatureVector toVector(FeatureRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record is null");
        }
        List<Object> x = new ArrayList<>(fields.size());
        for (FeatureField f : fields) {
            x.add(record.valueOf(f));
        }
        return new FeatureVector(names, x);
    }
}
