package com.sweetpick.monitoring.alerting;

import java.util.Locale;
import java.util.Optional;

/** Comparison applied as {@code value OP threshold}. */
public enum AlertOperator {
    GT("gt") {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    LT("lt") {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    EQ("eq") {
        @Override
        public boolean test(double value, double threshold) {
            return value == threshold;
        }
    },
    GTE("gte") {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LTE("lte") {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    };

    private final String symbol;

    AlertOperator(String symbol) {
        this.symbol = symbol;
    }

    public abstract boolean test(double value, double threshold);

    public String symbol() {
        return symbol;
    }

    public static Optional<AlertOperator> parse(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AlertOperator op : values()) {
            if (op.symbol.equals(normalized)) return Optional.of(op);
        }
        return Optional.empty();
    }

    /** Unknown operators never breach. */
    public static boolean evaluate(String operator, double value, double threshold) {
        return parse(operator).map(op -> op.test(value, threshold)).orElse(false);
    }
}
