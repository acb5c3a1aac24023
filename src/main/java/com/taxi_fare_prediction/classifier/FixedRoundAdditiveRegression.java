package com.taxi_fare_prediction.classifier;

import weka.classifiers.meta.AdditiveRegression;

import java.io.Serial;

/**
 * Stagewise additive regression that always builds {@code numIterations} base models. The stock
 * implementation stops at the first round that leaves the squared error unchanged, which on small
 * training sets can happen after a single tree.
 */
public class FixedRoundAdditiveRegression extends AdditiveRegression {

    @Serial
    private static final long serialVersionUID = 1L;

    @Override
    public boolean next() throws Exception {
        // The superclass treats an unchanged error as convergence
        m_Diff = Double.MAX_VALUE;
        return super.next();
    }

    /**
     * Number of base models built by the last call to {@link #buildClassifier}.
     */
    public int getNumRoundsPerformed() {
        return m_Classifiers == null ? 0 : m_Classifiers.size();
    }
}
