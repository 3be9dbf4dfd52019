package com.eventbacktest.backtester.walkforward;

import java.math.BigDecimal;

/**
 * Which direction of change counts as a regression for a metric.
 */
public enum MetricPolarity {

    /** Regresses when it drops by more than the tolerance. */
    HIGHER_IS_BETTER {
        @Override
        public boolean isRegression(BigDecimal changePct, BigDecimal tolerancePct) {
            return changePct.compareTo(tolerancePct.negate()) < 0;
        }
    },

    /** Regresses when it rises by more than the tolerance. */
    LOWER_IS_BETTER {
        @Override
        public boolean isRegression(BigDecimal changePct, BigDecimal tolerancePct) {
            return changePct.compareTo(tolerancePct) > 0;
        }
    },

    /** Regresses when it moves either way by more than the tolerance. */
    EITHER {
        @Override
        public boolean isRegression(BigDecimal changePct, BigDecimal tolerancePct) {
            return changePct.abs().compareTo(tolerancePct) > 0;
        }
    };

    public abstract boolean isRegression(BigDecimal changePct, BigDecimal tolerancePct);
}
