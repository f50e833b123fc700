package org.iceforge.dataseap.engine.load;

public enum LoadFormat {
    JSON("json"),
    CSV("csv");

    private final String wireName;

    LoadFormat(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
