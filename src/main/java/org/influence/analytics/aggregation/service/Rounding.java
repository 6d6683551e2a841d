package org.influence.analytics.aggregation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Rounding {

    private Rounding() {
    }

    static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
