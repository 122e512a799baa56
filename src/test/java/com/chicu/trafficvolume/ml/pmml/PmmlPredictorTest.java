package com.chicu.trafficvolume.ml.pmml;

import com.chicu.trafficvolume.ml.PredictorLoadException;
import com.chicu.trafficvolume.ml.features.FeatureSchema;
import com.chicu.trafficvolume.model.FeatureRecord;
import org.jpmml.evaluator.EvaluationException;
import org.jpmml.evaluator.Evaluator;
import org.jpmml.evaluator.InputField;
import org.jpmml.evaluator.LoadingModelEvaluatorBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PmmlPredictorTest {

    private static final String FIXTURE = "/models/traffic-regression.pmml";

    private static final String CLOSED_FIXTURE = "/models/traffic-regression-closed.pmml";

    private static PmmlPredictor predictor;

    private final FeatureSchema schema = FeatureSchema.canonical();

    @BeforeAll
    static void load() throws Exception {
        predictor = loadFixture(FIXTURE);
    }

    private static PmmlPredictor loadFixture(String path) throws Exception {
        try (InputStream in = PmmlPredictorTest.class.getResourceAsStream(path)) {
            assertNotNull(in, "fixture missing: " + path);
            return PmmlPredictor.load(in, "classpath:" + path);
        }
    }

    private static FeatureRecord scenarioOne() {
        return FeatureRecord.builder()
                .holiday("None")
                .temp(295.15)
                .rain1h(0.0)
                .snow1h(0.0)
                .cloudsAll(75)
                .weatherMain("Clouds")
                .hour(17)
                .dayOfWeek(0)
                .month(6)
                .isRushHour(1)
                .build();
    }

    @Test
    void modelInputs_shouldMatchRequestSchema() {
        assertEquals(schema.featureNames(), predictor.inputNames());
        assertEquals("traffic_volume", predictor.targetName());
    }

    @Test
    void scenarioOne_shouldEvaluateLinearModel() throws Exception {
        // 100 + 2*295.15 + 75 + 50*17 - 30*0 + 5*6 + 1500
        assertEquals(3145.3, predictor.predict(schema.toVector(scenarioOne())), 1e-9);
    }

    @Test
    void defaults_shouldEvaluate() throws Exception {
        // 100 + 2*288.28 + 40 + 50*9 - 30*1 + 5*10 + 1500
        assertEquals(2686.56, predictor.predict(schema.toVector(FeatureRecord.defaults())), 1e-9);
    }

    @Test
    void knownCategory_shouldApplyItsCoefficient() throws Exception {
        FeatureRecord clear = scenarioOne().toBuilder().weatherMain("Clear").build();

        assertEquals(3145.3 + 25.5, predictor.predict(schema.toVector(clear)), 1e-9);
    }

    @Test
    void unseenCategory_shouldBeTolerated() throws Exception {
        FeatureRecord unseen = scenarioOne().toBuilder().weatherMain("Volcanic Ash").holiday("Festivus").build();

        assertEquals(3145.3, predictor.predict(schema.toVector(unseen)), 1e-9);
    }

    @Test
    void model_canReturnNegativeRawValues() throws Exception {
        FeatureRecord worst = FeatureRecord.builder()
                .holiday("Christmas Day")
                .temp(200.0)
                .rain1h(0.0)
                .snow1h(30.0)
                .cloudsAll(0)
                .weatherMain("Snow")
                .hour(0)
                .dayOfWeek(6)
                .month(1)
                .isRushHour(0)
                .build();

        assertEquals(-1475.0, predictor.predict(schema.toVector(worst)), 1e-9);
    }

    @Test
    void closedVocabulary_unseenCategory_shouldBePassedAsMissing() throws Exception {
        PmmlPredictor closed = loadFixture(CLOSED_FIXTURE);
        FeatureRecord unseen = scenarioOne().toBuilder().weatherMain("Volcanic Ash").build();

        assertEquals(3145.3, closed.predict(schema.toVector(unseen)), 1e-9);
        assertEquals(2686.56, closed.predict(schema.toVector(FeatureRecord.defaults().toBuilder().weatherMain("Haze").build())), 1e-9);
    }

    @Test
    void closedVocabulary_knownCategory_shouldStillApplyItsCoefficient() throws Exception {
        PmmlPredictor closed = loadFixture(CLOSED_FIXTURE);
        FeatureRecord snow = scenarioOne().toBuilder().weatherMain("Snow").build();

        assertEquals(3145.3 - 400.0, closed.predict(schema.toVector(snow)), 1e-9);
    }

    @Test
    void closedVocabulary_fixtureRejectsUnseenValuesOnItsOwn() throws Exception {
        Evaluator evaluator;
        try (InputStream in = PmmlPredictorTest.class.getResourceAsStream(CLOSED_FIXTURE)) {
            evaluator = new LoadingModelEvaluatorBuilder().load(in).build();
        }
        InputField weather = evaluator.getInputFields().stream()
                .filter(f -> "weather_main".equals(f.getName()))
                .findFirst()
                .orElseThrow();

        assertThrows(EvaluationException.class, () -> weather.prepare("Volcanic Ash"));
    }

    @Test
    void garbage_shouldNotLoad() {
        InputStream in = new ByteArrayInputStream("this is not pmml".getBytes(StandardCharsets.UTF_8));

        PredictorLoadException e = assertThrows(PredictorLoadException.class, () -> PmmlPredictor.load(in, "memory"));
        assertTrue(e.getMessage().contains("memory"));
    }
}
