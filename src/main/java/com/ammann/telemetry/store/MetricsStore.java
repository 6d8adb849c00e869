/* (C)2026 */
package com.ammann.telemetry.store;

import com.ammann.telemetry.exception.MetricsStoreException;
import com.ammann.telemetry.model.Sample;
import com.ammann.telemetry.model.Series;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to stored metric samples.
 *
 * <p>The analytics services only read through this interface; ingestion, retention and
 * retries belong to the implementation. Implementations must be safe for concurrent
 * readers and should abort promptly when the calling thread is interrupted.
 *
 * <p>All methods report failures as {@link MetricsStoreException}.
 */
public interface MetricsStore
{
    /**
     * Returns the most recent samples of one series, oldest first.
     *
     * @param entityId   monitored entity
     * @param metricType metric type key
     * @param windowSize maximum number of samples to return
     * @return the series, empty when nothing is stored
     */
    Series recentSamples(String entityId, String metricType, int windowSize);

    /**
     * Returns the samples of one series within the lookback window, oldest first.
     *
     * @param entityId   monitored entity
     * @param metricType metric type key
     * @param lookback   lookback window ending now
     * @return the series, empty when nothing is stored in the window
     */
    Series samplesWithin(String entityId, String metricType, Duration lookback);

    /**
     * Returns fixed-width bucket averages of one metric type for every entity that
     * reported it within the lookback window. Each sample timestamp is the bucket start.
     *
     * @param metricType    metric type key
     * @param lookbackHours lookback window in hours
     * @param bucketWidth   width of each bucket
     * @return bucketed series keyed by entity id, carrying display names
     */
    Map<String, Series> bucketedAverages(String metricType, int lookbackHours, Duration bucketWidth);

    /**
     * Returns the newest sample of one series.
     *
     * @return the newest sample, or {@code null} when the series is empty
     */
    Sample latestValue(String entityId, String metricType);

    /**
     * Returns every series of the given metric types with samples inside the lookback
     * window, in one batched read.
     *
     * @param metricTypes metric type keys to include
     * @param lookback    lookback window
     * @return one series per (entity, metric type), samples oldest first
     */
    List<Series> fleetSamples(Collection<String> metricTypes, Duration lookback);
}
