package org.iceforge.dataseap.search;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for cross-table keyword search.
 */
@ConfigurationProperties(prefix = "dataseap.search")
public class SearchProperties {

    /** Rows fetched from each table before merging and paging. */
    private int perTableLimit = 1000;

    /** Snippets longer than this are cut and suffixed with "...". */
    private int snippetLength = 100;

    /** Tables queried concurrently; 1 keeps the per-table queries sequential. */
    private int parallelism = 1;

    /** Column the time-range filter applies to when a request names none. */
    private String defaultTimeField = "event_time";

    private int defaultPageSize = 10;

    private int maxPageSize = 100;

    public int getPerTableLimit() {
        return perTableLimit;
    }

    public void setPerTableLimit(int perTableLimit) {
        this.perTableLimit = perTableLimit;
    }

    public int getSnippetLength() {
        return snippetLength;
    }

    public void setSnippetLength(int snippetLength) {
        this.snippetLength = snippetLength;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public String getDefaultTimeField() {
        return defaultTimeField;
    }

    public void setDefaultTimeField(String defaultTimeField) {
        this.defaultTimeField = defaultTimeField;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }
}
