package io.exprtree.standalone.config;

import io.exprtree.core.engine.EvalLimits;
import io.exprtree.core.engine.EvaluationMode;

/**
 * Root configuration for the demo driver.
 *
 * <p>
 * All fields have defaults. Use {@link #builder()} to construct instances.
 *
 * @param engineMode    lenient or strict evaluation
 * @param maxDepth      deepest tree the engine accepts
 * @param variableValue value bound to {@code var} in the demo tree
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record DemoConfig(
        EvaluationMode engineMode, int maxDepth, double variableValue, String loggingFormat, String loggingLevel) {

    /** Configuration with every field at its default. */
    public static final DemoConfig DEFAULT = builder().build();

    /** Engine limits derived from {@link #maxDepth()}. */
    public EvalLimits evalLimits() {
        return new EvalLimits(maxDepth);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the documented defaults. */
    public static final class Builder {
        private EvaluationMode engineMode = EvaluationMode.LENIENT;
        private int maxDepth = EvalLimits.DEFAULT.maxDepth();
        private double variableValue = 10.0;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder engineMode(EvaluationMode engineMode) {
            this.engineMode = engineMode;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder variableValue(double variableValue) {
            this.variableValue = variableValue;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public DemoConfig build() {
            return new DemoConfig(engineMode, maxDepth, variableValue, loggingFormat, loggingLevel);
        }
    }
}
