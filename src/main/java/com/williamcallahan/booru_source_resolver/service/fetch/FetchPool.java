package com.williamcallahan.booru_source_resolver.service.fetch;

/**
 * Bulkheads of the fetch client, configured under resilience4j.bulkhead.instances.
 * The locator pool is used by the historical locator only.
 */
public enum FetchPool {
    API("api"),
    LOCATOR("locator");

    private final String bulkheadName;

    FetchPool(String bulkheadName) {
        this.bulkheadName = bulkheadName;
    }

    public String bulkheadName() {
        return bulkheadName;
    }
}
