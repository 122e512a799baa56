package com.chicu.trafficvolume.model;

import java.util.Arrays;
import java.util.List;

/**
 * The ten traffic-context inputs, in canonical model order, with wire names and hard bounds.
 * A {@code null} bound means the side is open.
 */
public enum FeatureField {

    HOLIDAY("holiday", ValueType.STRING, null, null),
    TEMP("temp", ValueType.DOUBLE, 200.0, 350.0),
    RAIN_1H("rain_1h", ValueType.DOUBLE, 0.0, null),
    SNOW_1H("snow_1h", ValueType.DOUBLE, 0.0, null),
    CLOUDS_ALL("clouds_all", ValueType.INTEGER, 0.0, 100.0),
    WEATHER_MAIN("weather_main", ValueType.STRING, null, null),
    HOUR("hour", ValueType.INTEGER, 0.0, 23.0),
    DAY_OF_WEEK("day_of_week", ValueType.INTEGER, 0.0, 6.0),
    MONTH("month", ValueType.INTEGER, 1.0, 12.0),
    IS_RUSH_HOUR("is_rush_hour", ValueType.FLAG, 0.0, 1.0);

    public enum ValueType {
        STRING, DOUBLE, INTEGER, FLAG
    }

    private final String wireName;
    private final ValueType type;
    private final Double min;
    private final Double max;

    FeatureField(String wireName, ValueType type, Double min, Double max) {
        this.wireName = wireName;
        this.type = type;
        this.min = min;
        this.max = max;
    }

    public String wireName() {
        return wireName;
    }

    public ValueType type() {
        return type;
    }

    public Double min() {
        return min;
    }

    public Double max() {
        return max;
    }

    public boolean inBounds(double v) {
        if (!Double.isFinite(v)) return false;
        if (min != null && v < min) return false;
        return max == null || v <= max;
    }

    /** Human readable bound, e.g. {@code [0, 100]} or {@code >= 0.0}. */
    public String describeBounds() {
        if (min != null && max != null) return "[" + fmt(min) + ", " + fmt(max) + "]";
        if (min != null) return ">= " + fmt(min);
        if (max != null) return "<= " + fmt(max);
        return "any";
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(FeatureField::wireName).toList();
    }

    private String fmt(double v) {
        return type == ValueType.DOUBLE ? String.valueOf(v) : String.valueOf((long) v);
    }
}
