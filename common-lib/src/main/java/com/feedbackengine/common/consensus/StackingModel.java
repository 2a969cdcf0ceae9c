package com.feedbackengine.common.consensus;

import com.feedbackengine.common.exception.ConfigurationException;
import com.feedbackengine.common.model.TradeAction;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Multinomial logistic-regression parameters for the stacking meta-learner.
 *
 * <p>Feature order: {@code buy_ratio, sell_ratio, hold_ratio, avg_confidence, confidence_std}.
 * Features are standardized with {@code (x - mean) / scale} before the linear layer.
 */
public record StackingModel(
    @JsonProperty("classes")      List<TradeAction> classes,
    @JsonProperty("coefficients") double[][] coefficients,
    @JsonProperty("intercepts")   double[] intercepts,
    @JsonProperty("scalerMean")   double[] scalerMean,
    @JsonProperty("scalerScale")  double[] scalerScale
) {

    public static final int FEATURES = 5;

    public StackingModel {
        if (classes == null || classes.isEmpty()) {
            throw new ConfigurationException("Stacking model has no classes");
        }
        if (coefficients == null || coefficients.length != classes.size()
            || intercepts == null || intercepts.length != classes.size()) {
            throw new ConfigurationException("Stacking model coefficient rows must match classes=" + classes);
        }
        for (double[] row : coefficients) {
            if (row.length != FEATURES) {
                throw new ConfigurationException("Stacking model expects " + FEATURES + " features per class");
            }
        }
        if (scalerMean == null || scalerMean.length != FEATURES
            || scalerScale == null || scalerScale.length != FEATURES) {
            throw new ConfigurationException("Stacking scaler must have " + FEATURES + " entries");
        }
        classes = List.copyOf(classes);
    }

    /** Built-in meta-learner: rewards agreement and high, consistent confidence. */
    public static StackingModel defaults() {
        return new StackingModel(
            List.of(TradeAction.BUY, TradeAction.HOLD, TradeAction.SELL),
            new double[][] {
                { 2.0, -1.0, -1.0,  0.8, -0.5},
                {-1.0, -1.0,  2.0, -0.2,  0.8},
                {-1.0,  2.0, -1.0,  0.8, -0.5}
            },
            new double[] {0.0, 0.0, 0.0},
            new double[] {0.4, 0.4, 0.2, 75.0, 10.0},
            new double[] {0.3, 0.3, 0.2, 10.0, 5.0});
    }

    public static StackingModel load(Path path, ObjectMapper mapper) {
        try {
            return mapper.readValue(Files.readString(path), StackingModel.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read stacking model " + path + ": " + e.getMessage());
        }
    }

    /** Softmax class probabilities for raw (unscaled) features. */
    double[] predictProba(double[] features) {
        double[] logits = new double[classes.size()];
        double max = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < logits.length; k++) {
            double z = intercepts[k];
            for (int j = 0; j < FEATURES; j++) {
                double scale = scalerScale[j] != 0 ? scalerScale[j] : 1.0;
                z += coefficients[k][j] * (features[j] - scalerMean[j]) / scale;
            }
            logits[k] = z;
            max = Math.max(max, z);
        }
        double sum = 0.0;
        for (int k = 0; k < logits.length; k++) {
            logits[k] = Math.exp(logits[k] - max);
            sum += logits[k];
        }
        for (int k = 0; k < logits.length; k++) {
            logits[k] /= sum;
        }
        return logits;
    }
}
