package com.example.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outlier cleansing parameters.
 *
 * @param method          detection method, {@code auto} by default
 * @param sigmaMultiplier band width for sigma methods (3.0)
 * @param rollingWindow   window length for rolling sigma (6)
 * @param iqrMultiplier   fence width for seasonal IQR (2.0)
 * @param correctionType  how detected outliers are corrected ({@code limit})
 * @param mandatory       when true, a cleansing failure fails the segment instead of degrading
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OutlierConfig(
        @JsonProperty("method") OutlierMethod method,
        @JsonProperty("sigma_multiplier") Double sigmaMultiplier,
        @JsonProperty("rolling_window") Integer rollingWindow,
        @JsonProperty("iqr_multiplier") Double iqrMultiplier,
        @JsonProperty("correction_type") CorrectionType correctionType,
        @JsonProperty("mandatory") Boolean mandatory
) {
    public OutlierConfig {
        if (method == null) method = OutlierMethod.AUTO;
        if (sigmaMultiplier == null) sigmaMultiplier = 3.0;
        if (rollingWindow == null) rollingWindow = 6;
        if (iqrMultiplier == null) iqrMultiplier = 2.0;
        if (correctionType == null) correctionType = CorrectionType.LIMIT;
        if (mandatory == null) mandatory = false;
        if (!(sigmaMultiplier > 0)) {
            throw new IllegalArgumentException("outlier.sigma_multiplier must be > 0");
        }
        if (rollingWindow < 2) {
            throw new IllegalArgumentException("outlier.rolling_window must be >= 2");
        }
        if (!(iqrMultiplier > 0)) {
            throw new IllegalArgumentException("outlier.iqr_multiplier must be > 0");
        }
    }

    public static OutlierConfig defaults() {
        return new OutlierConfig(null, null, null, null, null, null);
    }
}
