package com.analytic.fgen.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a set of named expressions.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExpressionDefinition {
    private List<ExpressionDef> expressions;

    /** A named expression tree. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ExpressionDef {
        private String name, description;
        private CallDef root;
    }

    /**
     * One node of an expression tree. Exactly one of {@code fn} (a call, with
     * optional {@code args}), {@code value} (a literal) or {@code ref} (a bound
     * scalar or an earlier expression) is set.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CallDef {
        private String fn;
        private List<CallDef> args;
        private Double value;
        private String ref;
    }
}
