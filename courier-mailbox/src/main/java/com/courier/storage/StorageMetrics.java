package com.courier.storage;

/**
 * Snapshot of {@link MeteredStorage} counters at a point in time.
 *
 * @param totalAppended the number of elements appended since creation
 * @param totalDropped the number of elements dropped since creation
 * @param buffered the number of elements buffered when the snapshot was taken
 * @param highWaterMark the largest number of elements buffered at once
 */
public record StorageMetrics(
    long totalAppended,
    long totalDropped,
    long buffered,
    int highWaterMark
) {
    @Override
    public String toString() {
        return String.format(
            "StorageMetrics{appended=%d, dropped=%d, buffered=%d, highWaterMark=%d}",
            totalAppended, totalDropped, buffered, highWaterMark
        );
    }
}
