package com.chicu.trafficvolume.ml.pmml;

import com.chicu.trafficvolume.ml.Predictor;
import com.chicu.trafficvolume.ml.PredictorEvaluationException;
import com.chicu.trafficvolume.ml.PredictorLoadException;
import com.chicu.trafficvolume.ml.features.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.dmg.pmml.OpType;
import org.jpmml.evaluator.EvaluationException;
import org.jpmml.evaluator.Evaluator;
import org.jpmml.evaluator.EvaluatorUtil;
import org.jpmml.evaluator.FieldValue;
import org.jpmml.evaluator.InputField;
import org.jpmml.evaluator.LoadingModelEvaluatorBuilder;
import org.jpmml.evaluator.TargetField;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Predictor} backed by a PMML document (for example a scikit-learn pipeline exported with sklearn2pmml).
 * <p>
 * The JPMML evaluator is immutable after {@code build()} and may be shared between threads.
 * Categorical values the model's schema rejects are passed on as missing values so the
 * model's own missing-value treatment applies.
 */
@Slf4j
public class PmmlPredictor implements Predictor {

    private final Evaluator evaluator;
    private final List<InputField> inputFields;
    private final List<String> inputNames;
    private final String targetName;
    private final String source;

    PmmlPredictor(Evaluator evaluator, String source) throws PredictorLoadException {
        this.evaluator = evaluator;
        this.source = source;
        this.inputFields = List.copyOf(evaluator.getInputFields());
        this.inputNames = inputFields.stream().map(InputField::getName).toList();

        List<TargetField> targets = evaluator.getTargetFields();
        if (targets.size() != 1) {
            throw new PredictorLoadException("PMML model must have exactly one target field, found " + targets.size(), null);
        }
        this.targetName = targets.get(0).getName();
    }

    public static PmmlPredictor load(InputStream in, String source) throws PredictorLoadException {
        Evaluator evaluator;
        try {
            evaluator = new LoadingModelEvaluatorBuilder()
                    .load(in)
                    .build();
            evaluator.verify();
        } catch (Exception e) {
            throw new PredictorLoadException("Cannot read PMML model from " + source + ": " + e.getMessage(), e);
        }
        return new PmmlPredictor(evaluator, source);
    }

    @Override
    public double predict(FeatureVector x) throws PredictorEvaluationException {
        Map<String, Object> row = x.asMap();

        Object raw;
        try {
            Map<String, FieldValue> arguments = new LinkedHashMap<>();
            for (InputField field : inputFields) {
                arguments.put(field.getName(), prepare(field, row.get(field.getName())));
            }

            Map<String, ?> results = evaluator.evaluate(arguments);
            raw = EvaluatorUtil.decode(results.get(targetName));
        } catch (EvaluationException e) {
            throw new PredictorEvaluationException("PMML evaluation failed: " + e.getMessage(), e);
        }

        if (!(raw instanceof Number n)) {
            throw new PredictorEvaluationException("PMML model returned no numeric value for " + targetName + ": " + raw);
        }
        return n.doubleValue();
    }

    @Override
    public List<String> inputNames() {
        return inputNames;
    }

    public String targetName() {
        return targetName;
    }

    public String source() {
        return source;
    }

    private static FieldValue prepare(InputField field, Object value) {
        try {
            return field.prepare(value);
        } catch (EvaluationException e) {
            if (value == null || field.getOpType() != OpType.CATEGORICAL) {
                throw e;
            }
            log.debug("🧠 {}={} is not a known category, passing it as missing", field.getName(), value);
            return field.prepare(null);
        }
    }
}
