package com.williamcallahan.booru_source_resolver.model.locator;

import java.time.LocalDate;

/**
 * One guessed historical storage URL: a day, a directory flag and a pair of hex shard coordinates.
 */
public record CandidateUrl(String url, LocalDate date, String flag, int shardA, int shardB) {

    public String shardPath() {
        return flag + "/" + Integer.toHexString(shardA) + "/" + Integer.toHexString(shardB);
    }
}
