package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;

import java.util.List;

/**
 * Arc tangent. {@code atan(a)} is {@link Math#atan(double)};
 * {@code atan(a, b)} is {@code Math.atan2(a, b)}, arguments in that order.
 */
public final class AtanNode extends AbstractGenerator {
    private final FieldGenerator a;
    private final FieldGenerator b;

    /** Prototype. */
    public AtanNode() {
        this(null, null);
    }

    public AtanNode(FieldGenerator a, FieldGenerator b) {
        super("atan", GeneratorType.ATAN);
        this.a = a;
        this.b = b;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new AtanNode(args.get(0), args.size() == 2 ? args.get(1) : null);
    }

    @Override
    public double generate(Context pos) {
        if (b == null)
            return Math.atan(a.generate(pos));
        double y = a.generate(pos);
        return Math.atan2(y, b.generate(pos));
    }

    @Override
    public List<FieldGenerator> args() {
        return present(a, b);
    }

    @Override
    public String str() {
        return b == null ? call(name(), a) : call(name(), a, b);
    }
}
