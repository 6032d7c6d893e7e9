package com.forecastsentinel.batch;

import com.forecastsentinel.core.model.AnomalyRecord;
import com.forecastsentinel.core.model.AnomalyStatus;
import com.forecastsentinel.core.model.Dataset;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-status row counts of one detection run, logged when the job finishes.
 *
 * <p>
 * Rows whose {@code status} cell is missing or not a known status are counted
 * under {@link #getUnclassified()}, which happens when a writer stage drops or
 * reformats the status column.
 * </p>
 */
public final class DetectionSummary {

    private final Map<AnomalyStatus, Integer> counts;
    private final int total;
    private final int unclassified;

    private DetectionSummary(Map<AnomalyStatus, Integer> counts, int total, int unclassified) {
        this.counts = Collections.unmodifiableMap(counts);
        this.total = total;
        this.unclassified = unclassified;
    }

    /**
     * @param result detection output
     * @return counts of the result's rows by status
     */
    public static DetectionSummary of(Dataset result) {
        Objects.requireNonNull(result, "Dataset must not be null");
        Map<AnomalyStatus, Integer> counts = new EnumMap<>(AnomalyStatus.class);
        for (AnomalyStatus status : AnomalyStatus.values()) {
            counts.put(status, 0);
        }
        int unclassified = 0;
        for (Object cell : result.hasColumn(AnomalyRecord.COL_STATUS)
                ? result.columnValues(AnomalyRecord.COL_STATUS)
                : Collections.nCopies(result.size(), null)) {
            AnomalyStatus status = parse(cell);
            if (status == null) {
                unclassified++;
            } else {
                counts.merge(status, 1, Integer::sum);
            }
        }
        return new DetectionSummary(counts, result.size(), unclassified);
    }

    private static AnomalyStatus parse(Object cell) {
        if (cell instanceof AnomalyStatus status) {
            return status;
        }
        if (cell != null) {
            for (AnomalyStatus status : AnomalyStatus.values()) {
                if (status.name().equals(String.valueOf(cell))) {
                    return status;
                }
            }
        }
        return null;
    }

    public int getCount(AnomalyStatus status) {
        return counts.get(status);
    }

    /** @return rows that are {@code BELOW_LOWER} or {@code ABOVE_UPPER} */
    public int getAnomalyCount() {
        return getCount(AnomalyStatus.BELOW_LOWER) + getCount(AnomalyStatus.ABOVE_UPPER);
    }

    public int getTotal() {
        return total;
    }

    public int getUnclassified() {
        return unclassified;
    }

    @Override
    public String toString() {
        return "DetectionSummary{total=" + total + ", anomalies=" + getAnomalyCount() + ", counts=" + counts
                + ", unclassified=" + unclassified + '}';
    }
}
