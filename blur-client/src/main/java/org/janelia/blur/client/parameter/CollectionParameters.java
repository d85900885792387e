package org.janelia.blur.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.blur.pipeline.AsyncTileCollector;

/**
 * Parameters for collecting filtered tiles from workers.
 */
public class CollectionParameters implements Serializable {

    @Parameter(
            names = "--collectionMode",
            description = "WAIT_ANY blocks until the next tile arrives, POLL checks for arrivals every poll interval")
    public AsyncTileCollector.Mode mode = AsyncTileCollector.Mode.WAIT_ANY;

    @Parameter(
            names = "--pollIntervalMillis",
            description = "Milliseconds to sleep between arrival checks in POLL mode")
    public Long pollIntervalMillis = AsyncTileCollector.DEFAULT_POLL_INTERVAL_MILLIS;

    @Parameter(
            names = "--collectTimeoutSeconds",
            description = "Fail the run if all tiles have not arrived within this many seconds.  " +
                          "Omit to wait indefinitely")
    public Integer timeoutSeconds;

    public long getTimeoutMillis() {
        return timeoutSeconds == null ? 0 : timeoutSeconds * 1000L;
    }

    public void validate()
            throws IllegalArgumentException {
        if ((pollIntervalMillis == null) || (pollIntervalMillis < 1)) {
            throw new IllegalArgumentException("--pollIntervalMillis must be positive");
        }
        if ((timeoutSeconds != null) && (timeoutSeconds < 1)) {
            throw new IllegalArgumentException("--collectTimeoutSeconds must be positive");
        }
    }
}
