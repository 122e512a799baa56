package com.chicu.trafficvolume.validation;

import com.chicu.trafficvolume.model.FeatureField;
import com.chicu.trafficvolume.model.FeatureRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns an untyped request object into a {@link FeatureRecord}.
 * <p>
 * Absent fields take their defaults, unknown fields are ignored, present fields must have
 * the right type and lie within their hard bounds. Nothing is clamped.
 * Categorical fields accept any string: encoding unseen categories is the model's concern.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureRecordValidator {

    private final ValidationProperties props;

    public FeatureRecord validate(Map<String, ?> raw) {
        Map<String, ?> in = raw != null ? raw : Map.of();

        FeatureRecord.FeatureRecordBuilder b = FeatureRecord.defaults().toBuilder();
        List<FieldViolation> violations = new ArrayList<>();

        for (FeatureField f : FeatureField.values()) {
            if (!in.containsKey(f.wireName())) continue;
            Object value = coerce(f, in.get(f.wireName()), violations);
            if (value != null) {
                apply(b, f, value);
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        if (log.isDebugEnabled()) {
            List<String> ignored = in.keySet().stream()
                    .filter(k -> !FeatureField.wireNames().contains(k))
                    .toList();
            if (!ignored.isEmpty()) {
                log.debug("Ignoring unknown input fields: {}", ignored);
            }
        }

        FeatureRecord record = b.build();
        if (props.isDeriveRushHour() && !in.containsKey(FeatureField.IS_RUSH_HOUR.wireName())) {
            record = record.toBuilder().isRushHour(RushHour.flagFor(record.hour())).build();
        }
        return record;
    }

    // ---------- coercion ----------

    private static Object coerce(FeatureField f, Object v, List<FieldViolation> out) {
        if (v == null) {
            out.add(new FieldViolation(f.wireName(), "must not be null"));
            return null;
        }
        return switch (f.type()) {
            case STRING -> coerceString(f, v, out);
            case DOUBLE -> coerceDouble(f, v, out);
            case INTEGER -> coerceInteger(f, v, out);
            case FLAG -> coerceFlag(f, v, out);
        };
    }

    private static Object coerceString(FeatureField f, Object v, List<FieldViolation> out) {
        if (v instanceof String s) return s;
        out.add(new FieldViolation(f.wireName(), "must be a string (got " + typeName(v) + ")"));
        return null;
    }

    private static Object coerceDouble(FeatureField f, Object v, List<FieldViolation> out) {
        Double d = toDouble(v);
        if (d == null) {
            out.add(new FieldViolation(f.wireName(), "must be a number (got " + typeName(v) + ")"));
            return null;
        }
        if (!f.inBounds(d)) {
            out.add(outOfBounds(f, v));
            return null;
        }
        return d;
    }

    private static Object coerceInteger(FeatureField f, Object v, List<FieldViolation> out) {
        Double d = toDouble(v);
        if (d == null || !Double.isFinite(d) || d != Math.rint(d)) {
            out.add(new FieldViolation(f.wireName(), "must be an integer (got " + describe(v) + ")"));
            return null;
        }
        if (!f.inBounds(d)) {
            out.add(outOfBounds(f, v));
            return null;
        }
        return d.intValue();
    }

    private static Object coerceFlag(FeatureField f, Object v, List<FieldViolation> out) {
        if (v instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        return coerceInteger(f, v, out);
    }

    private static Double toDouble(Object v) {
        if (v instanceof Boolean) return null;
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) {
            // plain decimal notation only, no Java literal suffixes or hex
            try {
                return new BigDecimal(s.trim()).doubleValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static FieldViolation outOfBounds(FeatureField f, Object v) {
        return new FieldViolation(f.wireName(), "must be in " + f.describeBounds() + " (got " + describe(v) + ")");
    }

    private static void apply(FeatureRecord.FeatureRecordBuilder b, FeatureField f, Object value) {
        switch (f) {
            case HOLIDAY -> b.holiday((String) value);
            case TEMP -> b.temp((Double) value);
            case RAIN_1H -> b.rain1h((Double) value);
            case SNOW_1H -> b.snow1h((Double) value);
            case CLOUDS_ALL -> b.cloudsAll((Integer) value);
            case WEATHER_MAIN -> b.weatherMain((String) value);
            case HOUR -> b.hour((Integer) value);
            case DAY_OF_WEEK -> b.dayOfWeek((Integer) value);
            case MONTH -> b.month((Integer) value);
            case IS_RUSH_HOUR -> b.isRushHour((Integer) value);
        }
    }

    private static String describe(Object v) {
        return v instanceof String s ? "\"" + s + "\"" : String.valueOf(v);
    }

    private static String typeName(Object v) {
        if (v instanceof Map<?, ?>) return "object";
        if (v instanceof List<?>) return "array";
        if (v instanceof Boolean) return "boolean";
        if (v instanceof Number) return "number";
        if (v instanceof String) return "string";
        return v.getClass().getSimpleName();
    }
}
