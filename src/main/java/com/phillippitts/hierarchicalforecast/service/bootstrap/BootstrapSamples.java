package com.phillippitts.hierarchicalforecast.service.bootstrap;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.List;
import java.util.Objects;

/**
 * Simulated forecast paths, each a series x horizon matrix.
 *
 * @param paths sampled paths (never empty)
 */
public record BootstrapSamples(List<RealMatrix> paths) {

    public BootstrapSamples {
        Objects.requireNonNull(paths, "paths must not be null");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("at least one sample path is required");
        }
        paths = List.copyOf(paths);
    }

    public int size() {
        return paths.size();
    }

    public RealMatrix path(int index) {
        return paths.get(index).copy();
    }
}
