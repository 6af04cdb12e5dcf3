package com.analytic.fgen.api;

/**
 * The coordinates a generator is evaluated at.
 *
 * <p>
 * {@code x}, {@code y}, {@code z} are the spatial position (normally {@code x}
 * in [0, 1] and {@code y}, {@code z} angles in [0, 2π)), {@code t} the time.
 * {@code metadata} is the geometry of the domain; only nodes that need the
 * domain topology look at it, and it may be {@code null}.
 *
 * <p>
 * Instances are immutable. Nodes that need a displaced position (see
 * {@link #withY(double)} / {@link #withZ(double)}) derive a new context and
 * never modify the one they were given.
 */
public record Context(double x, double y, double z, double t, GeometricMetadata metadata) {

    /** Origin, time zero, no geometry. */
    public static final Context ORIGIN = new Context(0.0, 0.0, 0.0, 0.0, null);

    public static Context of(double x, double y, double z) {
        return new Context(x, y, z, 0.0, null);
    }

    public static Context of(double x, double y, double z, double t) {
        return new Context(x, y, z, t, null);
    }

    public Context withY(double newY) {
        return new Context(x, newY, z, t, metadata);
    }

    public Context withZ(double newZ) {
        return new Context(x, y, newZ, t, metadata);
    }
}
