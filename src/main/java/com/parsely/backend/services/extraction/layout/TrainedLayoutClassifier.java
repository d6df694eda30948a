package com.parsely.backend.services.extraction.layout;

import java.util.List;
import java.util.Map;

import com.parsely.backend.enums.LayoutCategory;
import com.parsely.backend.services.extraction.DocumentText;

import lombok.extern.slf4j.Slf4j;

/**
 * Softmax over a {@link LayoutModel}. Predictions below the model's minimum confidence, and any
 * failure while scoring, defer to the fallback classifier.
 */
@Slf4j
public class TrainedLayoutClassifier implements LayoutClassifier {

    private final LayoutModel model;
    private final LayoutClassifier fallback;

    public TrainedLayoutClassifier(LayoutModel model, LayoutClassifier fallback) {
        if (model == null) {
            throw new IllegalArgumentException("LayoutModel is required");
        }
        this.model = model;
        this.fallback = fallback == null ? new RuleBasedLayoutClassifier() : fallback;
    }

    @Override
    public LayoutPrediction classify(DocumentText document) {
        try {
            double[] probabilities = predictProbabilities(document);
            int best = 0;
            for (int i = 1; i < probabilities.length; i++) {
                if (probabilities[i] > probabilities[best]) best = i;
            }

            LayoutCategory category = LayoutCategory.fromLabel(model.getClasses().get(best));
            if (probabilities[best] < model.getMinConfidence()) {
                log.debug("[LayoutClassifier] trained -> {} p={} below {}; using fallback",
                        category.getLabel(), String.format("%.3f", probabilities[best]), model.getMinConfidence());
                return fallback.classify(document);
            }
            log.debug("[LayoutClassifier] trained -> {} p={}", category.getLabel(), String.format("%.3f", probabilities[best]));
            return new LayoutPrediction(category, probabilities[best], LayoutPrediction.TRAINED);
        } catch (RuntimeException e) {
            log.warn("[LayoutClassifier] Trained classifier failed ({}); using fallback", e.getMessage());
            return fallback.classify(document);
        }
    }

    double[] predictProbabilities(DocumentText document) {
        Map<String, Double> features = LayoutFeatureExtractor.extract(document);
        List<String> names = model.getFeatureNames();
        double[] x = new double[names.size()];
        for (int f = 0; f < x.length; f++) {
            double raw = features.getOrDefault(names.get(f), 0.0);
            if (model.getFeatureMeans() != null) raw -= model.getFeatureMeans()[f];
            if (model.getFeatureScales() != null) raw /= model.getFeatureScales()[f];
            x[f] = raw;
        }

        double[][] w = model.getWeights();
        double[] logits = new double[w.length];
        double maxLogit = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < w.length; c++) {
            double z = model.getBias()[c];
            for (int f = 0; f < x.length; f++) {
                z += w[c][f] * x[f];
            }
            logits[c] = z;
            maxLogit = Math.max(maxLogit, z);
        }

        double sum = 0.0;
        double[] p = new double[logits.length];
        for (int c = 0; c < logits.length; c++) {
            p[c] = Math.exp(logits[c] - maxLogit);
            sum += p[c];
        }
        for (int c = 0; c < p.length; c++) {
            p[c] /= sum;
        }
        return p;
    }
}
