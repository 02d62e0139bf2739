package com.seismic.sentinel.monitor.enums;

public enum ComparisonOperator {
    GTE(">="),
    LT("<"),
    EQ("==");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double observed, double threshold) {
        return switch (this) {
            case GTE -> observed >= threshold;
            case LT -> observed < threshold;
            case EQ -> Double.compare(observed, threshold) == 0;
        };
    }
}
