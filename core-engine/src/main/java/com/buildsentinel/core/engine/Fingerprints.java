package com.buildsentinel.core.engine;

import com.buildsentinel.core.model.AnomalousFeature;
import com.buildsentinel.core.model.AnomalyEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Deterministic identity of "this kind of anomaly for this job".
 *
 * <p>
 * The fingerprint is the MD5 hex digest of {@code job|f1|f2|...} where the
 * feature names are de-duplicated and sorted. Observed values and z-scores do
 * not take part, so two events with the same job and the same set of
 * anomalous features always collide.
 * </p>
 *
 * @since 1.0.0
 */
public final class Fingerprints {

    private static final String SEPARATOR = "|";

    private Fingerprints() {
        // not instantiable
    }

    /**
     * @param event anomaly event; must not be {@code null}
     * @return 32-character lowercase hex fingerprint
     */
    public static String of(AnomalyEvent event) {
        Objects.requireNonNull(event, "Event must not be null");
        List<String> names = new ArrayList<>(event.getFeatures().size());
        for (AnomalousFeature f : event.getFeatures()) {
            names.add(f.getFeature());
        }
        return of(event.getJobName(), names);
    }

    /**
     * @param jobName      job name; must not be {@code null}
     * @param featureNames anomalous feature names in any order
     * @return 32-character lowercase hex fingerprint
     */
    public static String of(String jobName, Collection<String> featureNames) {
        Objects.requireNonNull(jobName, "Job name must not be null");
        StringBuilder raw = new StringBuilder(jobName);
        for (String name : new TreeSet<>(featureNames)) {
            raw.append(SEPARATOR).append(name);
        }
        return HexFormat.of().formatHex(md5().digest(raw.toString().getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
