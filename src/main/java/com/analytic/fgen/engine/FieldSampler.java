package com.analytic.fgen.engine;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeometricMetadata;

import java.util.Objects;
import java.util.stream.IntStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates a bound generator tree on a structured grid.
 *
 * <p>
 * Grid point {@code (i, j, k)} sits at {@code x = i / (nx - 1)} (0 when
 * {@code nx == 1}), {@code y = 2 pi j / ny}, {@code z = 2 pi k / nz}. Results are
 * stored with {@code k} fastest, see {@link Grid#index(int, int, int)}.
 *
 * <p>
 * Because bound trees are immutable, {@link #sampleParallel} evaluates slabs of
 * constant {@code i} on the common fork-join pool and returns exactly what
 * {@link #sample} returns.
 */
public final class FieldSampler {
    private static final Logger log = LogManager.getLogger(FieldSampler.class);

    private static final double TWO_PI = 2.0 * Math.PI;

    /** Grid dimensions; every dimension is at least 1. */
    public record Grid(int nx, int ny, int nz) {
        public Grid {
            if (nx < 1 || ny < 1 || nz < 1)
                throw new IllegalArgumentException(
                        "Grid dimensions must be positive, got " + nx + "x" + ny + "x" + nz);
        }

        public int size() {
            return Math.multiplyExact(Math.multiplyExact(nx, ny), nz);
        }

        public int index(int i, int j, int k) {
            return (i * ny + j) * nz + k;
        }
    }

    private final Grid grid;
    private final GeometricMetadata metadata;

    public FieldSampler(Grid grid) {
        this(grid, null);
    }

    /**
     * @param metadata Passed to every context; may be null.
     */
    public FieldSampler(Grid grid, GeometricMetadata metadata) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.metadata = metadata;
    }

    public Grid grid() {
        return grid;
    }

    public Context contextAt(int i, int j, int k, double t) {
        double x = grid.nx() > 1 ? (double) i / (grid.nx() - 1) : 0.0;
        double y = TWO_PI * j / grid.ny();
        double z = TWO_PI * k / grid.nz();
        return new Context(x, y, z, t, metadata);
    }

    public double[] sample(FieldGenerator generator, double t) {
        Objects.requireNonNull(generator, "generator");
        long start = System.nanoTime();
        double[] out = new double[grid.size()];
        for (int i = 0; i < grid.nx(); i++)
            fillSlab(generator, t, i, out);
        logRun("sequential", generator, start);
        return out;
    }

    public double[] sampleParallel(FieldGenerator generator, double t) {
        Objects.requireNonNull(generator, "generator");
        long start = System.nanoTime();
        double[] out = new double[grid.size()];
        IntStream.range(0, grid.nx()).parallel().forEach(i -> fillSlab(generator, t, i, out));
        logRun("parallel", generator, start);
        return out;
    }

    private void fillSlab(FieldGenerator generator, double t, int i, double[] out) {
        for (int j = 0; j < grid.ny(); j++) {
            for (int k = 0; k < grid.nz(); k++)
                out[grid.index(i, j, k)] = generator.generate(contextAt(i, j, k, t));
        }
    }

    private void logRun(String mode, FieldGenerator generator, long startNanos) {
        if (log.isDebugEnabled()) {
            log.debug("Sampled {} on {}x{}x{} grid ({}) in {} us", generator.str(), grid.nx(), grid.ny(),
                    grid.nz(), mode, (System.nanoTime() - startNanos) / 1_000);
        }
    }
}
