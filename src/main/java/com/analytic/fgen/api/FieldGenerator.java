package com.analytic.fgen.api;

import java.util.List;

/**
 * A node in an analytic expression tree.
 *
 * <p>
 * Every function name known to a {@link com.analytic.fgen.io.GeneratorFactory}
 * is registered once as a <em>prototype</em>. While an expression is being
 * built, the prototype for each call is asked to {@link #clone(List)} itself
 * with the already-built argument nodes; the result is a new, fully bound
 * node. Bound nodes are immutable, so a sub-tree may be shared by several
 * parents, and a whole tree may be evaluated from several threads at once.
 *
 * <p>
 * Numeric anomalies are not checked: {@code sqrt(-1)} yields NaN, {@code 1/0}
 * yields infinity, and so on. {@link #generate(Context)} never throws for a
 * valid tree.
 */
public interface FieldGenerator {

    /**
     * Evaluates this node at the given position.
     *
     * <p>
     * Must not modify any state; repeated calls with the same context return the
     * same value (unless an external scalar referenced by a leaf changed in
     * between).
     *
     * @param pos Evaluation context.
     * @return The value of the expression at {@code pos}.
     */
    double generate(Context pos);

    /**
     * Creates a new node of the same kind, bound to the given arguments.
     *
     * <p>
     * Construction parameters carried by this node (a seed, a copy count, a
     * geometry reference) are carried over to the new node. The call either
     * returns a complete node or throws; it never returns a partially built one.
     *
     * @param args Arguments, in call order.
     * @return A new bound node.
     * @throws ArityException if {@code args.size()} is not accepted by this kind.
     */
    FieldGenerator clone(List<FieldGenerator> args);

    /**
     * @return The kind of this node.
     */
    GeneratorType type();

    /**
     * @return The bound arguments, in call order; empty for leaves and prototypes.
     */
    default List<FieldGenerator> args() {
        return List.of();
    }

    /**
     * Renders this node and its arguments as a call expression. For diagnostics;
     * not guaranteed to reproduce the input text.
     */
    default String str() {
        return "?";
    }
}
