package com.buildsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One metric that the scoring models flagged as anomalous, e.g. build
 * duration far above its baseline.
 *
 * @since 1.0.0
 */
public final class AnomalousFeature implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String feature;
    private final double observed;
    private final double expected;
    private final double zScore;

    /**
     * @param feature  metric name, e.g. {@code duration}; must not be blank
     * @param observed observed value
     * @param expected baseline value
     * @param zScore   standardised deviation of {@code observed} from
     *                 {@code expected}
     * @throws NullPointerException     if {@code feature} is {@code null}
     * @throws IllegalArgumentException if {@code feature} is blank
     */
    @JsonCreator
    public AnomalousFeature(@JsonProperty(value = "feature", required = true) String feature,
            @JsonProperty("observed") @JsonAlias("value") double observed,
            @JsonProperty("expected") double expected,
            @JsonProperty("z_score") double zScore) {
        this.feature = Objects.requireNonNull(feature, "feature must not be null");
        if (feature.isBlank()) {
            throw new IllegalArgumentException("feature must not be blank");
        }
        this.observed = observed;
        this.expected = expected;
        this.zScore = zScore;
    }

    @JsonProperty("feature")
    public String getFeature() {
        return feature;
    }

    @JsonProperty("observed")
    public double getObserved() {
        return observed;
    }

    @JsonProperty("expected")
    public double getExpected() {
        return expected;
    }

    @JsonProperty("z_score")
    public double getZScore() {
        return zScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalousFeature that))
            return false;
        return Double.compare(observed, that.observed) == 0
                && Double.compare(expected, that.expected) == 0
                && Double.compare(zScore, that.zScore) == 0
                && feature.equals(that.feature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, observed, expected, zScore);
    }

    @Override
    public String toString() {
        return "AnomalousFeature{" +
                "feature='" + feature + '\'' +
                ", observed=" + observed +
                ", expected=" + expected +
                ", zScore=" + zScore +
                '}';
    }
}
