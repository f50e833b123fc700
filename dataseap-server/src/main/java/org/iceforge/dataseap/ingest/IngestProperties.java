package org.iceforge.dataseap.ingest;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dataseap.ingest")
public class IngestProperties {

    /** Target database for event tables. Empty falls back to {@code dataseap.engine.database}. */
    private String database;

    /** Share of rows the engine may reject per load before the load fails. */
    private double maxFilterRatio = 0;

    /** Stream Load timeout for one event batch. */
    private int loadTimeoutSeconds = 300;

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public double getMaxFilterRatio() {
        return maxFilterRatio;
    }

    public void setMaxFilterRatio(double maxFilterRatio) {
        this.maxFilterRatio = maxFilterRatio;
    }

    public int getLoadTimeoutSeconds() {
        return loadTimeoutSeconds;
    }

    public void setLoadTimeoutSeconds(int loadTimeoutSeconds) {
        this.loadTimeoutSeconds = loadTimeoutSeconds;
    }
}
