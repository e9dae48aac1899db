package com.phillippitts.hierarchicalforecast.service.bootstrap;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Produces simulated forecast paths from in-sample errors, used to build empirical
 * (distribution-free) prediction intervals.
 *
 * <p>Implementations must be thread-safe; the dispatcher may call them from several workers.
 */
public interface BootstrapSampler {

    /** Sample count used when none is configured. */
    int DEFAULT_SAMPLE_COUNT = 1_000;

    /**
     * Samples forecast paths.
     *
     * @param insample series x time historical observations
     * @param fitted series x time in-sample fitted values of the model
     * @param pointForecast series x horizon out-of-sample point forecasts
     * @param sampleCount number of paths to draw
     * @return sampled paths, each series x horizon
     */
    BootstrapSamples sample(RealMatrix insample, RealMatrix fitted, RealMatrix pointForecast, int sampleCount);
}
