package com.buildsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * What happened to one flushed batch.
 *
 * <p>
 * A batch counts as {@link AlertState#SENT} if at least one channel accepted
 * it, otherwise every event in it is {@link AlertState#DELIVERY_FAILED}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BatchDelivery {

    private final AlertBatch batch;
    private final List<DeliveryResult> results;

    public BatchDelivery(AlertBatch batch, List<DeliveryResult> results) {
        this.batch = Objects.requireNonNull(batch, "batch must not be null");
        this.results = List.copyOf(results);
    }

    public AlertBatch getBatch() {
        return batch;
    }

    public List<DeliveryResult> getResults() {
        return results;
    }

    public boolean isDelivered() {
        return results.stream().anyMatch(DeliveryResult::isSuccess);
    }

    public AlertState getState() {
        return isDelivered() ? AlertState.SENT : AlertState.DELIVERY_FAILED;
    }

    @Override
    public String toString() {
        return "BatchDelivery{batch=" + batch + ", results=" + results + '}';
    }
}
