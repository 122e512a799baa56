package com.chicu.trafficvolume.ml.features;

import com.chicu.trafficvolume.model.FeatureField;
import com.chicu.trafficvolume.model.FeatureRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureSchemaTest {

    private final FeatureSchema schema = FeatureSchema.canonical();

    @Test
    void canonicalOrder_shouldMatchTrainingColumns() {
        assertEquals(List.of(
                "holiday", "temp", "rain_1h", "snow_1h", "clouds_all",
                "weather_main", "hour", "day_of_week", "month", "is_rush_hour"
        ), schema.featureNames());
        assertEquals(FeatureField.wireNames(), schema.featureNames());
    }

    @Test
    void toVector_shouldPlaceEveryValueUnderItsName() {
        FeatureRecord r = FeatureRecord.builder()
                .holiday("Labor Day")
                .temp(295.15)
                .rain1h(1.5)
                .snow1h(0.25)
                .cloudsAll(75)
                .weatherMain("Rain")
                .hour(17)
                .dayOfWeek(0)
                .month(6)
                .isRushHour(1)
                .build();

        FeatureVector x = schema.toVector(r);

        assertEquals(10, x.size());
        assertEquals(schema.featureNames(), x.names());
        assertEquals(List.of("Labor Day", 295.15, 1.5, 0.25, 75, "Rain", 17, 0, 6, 1), x.values());

        Map<String, Object> m = x.asMap();
        assertEquals(List.copyOf(m.keySet()), schema.featureNames());
        assertEquals(0.25, m.get("snow_1h"));
        assertEquals(0, m.get("day_of_week"));
    }

    @Test
    void integerFeatures_shouldStayIntegers() {
        FeatureVector x = schema.toVector(FeatureRecord.defaults());

        assertInstanceOf(Integer.class, x.asMap().get("hour"));
        assertInstanceOf(Integer.class, x.asMap().get("is_rush_hour"));
        assertInstanceOf(Double.class, x.asMap().get("temp"));
        assertInstanceOf(String.class, x.asMap().get("holiday"));
    }

    @Test
    void vector_shouldRejectMismatchedSizes() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureVector(List.of("a", "b"), List.of(1)));
        assertThrows(IllegalArgumentException.class, () -> schema.toVector(null));
    }
}
