package com.metaperception.core.shock;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One statistically significant outlier in a single feature series.
 *
 * <p>Unresolved events make up the state's active shock set; resolved ones stay in the
 * snapshot for audit only.
 *
 * @param shockId           stable identifier, {@code feature:fingerprint}, suffixed {@code #n} on a repeated fingerprint
 * @param feature           series the outlier was found in
 * @param index             position within the series
 * @param value             observed value
 * @param zScore            signed z-score
 * @param intensity         |z| / 3
 * @param severity          band of the intensity
 * @param shockType         class derived from the feature name
 * @param expectedDirection side of the mean
 * @param resolved          true once the spike is older than the decay window
 */
public record ShockEvent(
    @JsonProperty("shockId")           String shockId,
    @JsonProperty("feature")           String feature,
    @JsonProperty("index")             int index,
    @JsonProperty("value")             double value,
    @JsonProperty("zScore")            double zScore,
    @JsonProperty("intensity")         double intensity,
    @JsonProperty("severity")          ShockSeverity severity,
    @JsonProperty("shockType")         ShockType shockType,
    @JsonProperty("expectedDirection") PriceDirection expectedDirection,
    @JsonProperty("resolved")          boolean resolved
) {
    public boolean isCritical() {
        return severity == ShockSeverity.CRITICAL;
    }

    public boolean isActive() {
        return !resolved;
    }
}
