package com.analytic.fgen.api;

/**
 * Read-only view of the domain geometry, supplied by the mesh/coordinate layer.
 *
 * <p>
 * The domain is periodic in {@code y} (period 2π). On closed flux surfaces,
 * going once around in {@code y} also displaces the toroidal angle {@code z}
 * by a surface-dependent amount, the periodic shift.
 *
 * <p>
 * Implementations are queried concurrently during evaluation and must not
 * change while a tree is being evaluated.
 */
public interface GeometricMetadata {

    /**
     * @param x Radial coordinate.
     * @return true if the surface through {@code x} is closed (periodic in y).
     */
    boolean isPeriodicY(double x);

    /**
     * Shift in {@code z} accumulated over one period in {@code y}, already
     * converted to the same angular units as {@link Context#z()}.
     *
     * <p>
     * Only meaningful when {@link #isPeriodicY(double)} is true for the same
     * {@code x}.
     *
     * @param x Radial coordinate.
     * @return The periodic angular shift of the surface at {@code x}.
     */
    double periodicShiftAt(double x);

    /**
     * Geometry with a single closed surface family and a uniform shift.
     */
    static GeometricMetadata uniform(double shift) {
        return new GeometricMetadata() {
            @Override
            public boolean isPeriodicY(double x) {
                return true;
            }

            @Override
            public double periodicShiftAt(double x) {
                return shift;
            }
        };
    }

    /**
     * Geometry with only open surfaces.
     */
    static GeometricMetadata open() {
        return new GeometricMetadata() {
            @Override
            public boolean isPeriodicY(double x) {
                return false;
            }

            @Override
            public double periodicShiftAt(double x) {
                return 0.0;
            }
        };
    }
}
