package com.ryuqq.aiorchestrator.adapter.backend.classifier;

import java.util.Map;

/**
 * In-process trained classifier.
 *
 * <p>Implementations wrap a loaded model (e.g. a small feed-forward network trained offline)
 * and must be safe for concurrent use.</p>
 */
public interface ClassifierRuntime {

    /**
     * Predicts class probabilities for free text.
     *
     * @param text input text
     * @return probability per class label, values in [0, 1]
     */
    Map<String, Double> predict(String text);

    /**
     * Predicts class probabilities for a precomputed feature vector.
     *
     * <p>Text-only classifiers do not override this.</p>
     *
     * @param features named features
     * @return probability per class label
     * @throws UnsupportedOperationException if the classifier only accepts text
     */
    default Map<String, Double> predict(Map<String, Object> features) {
        throw new UnsupportedOperationException("this classifier only accepts text input");
    }
}
