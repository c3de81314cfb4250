/**
 * Decompressed media entries of a downloaded backup archive
 *
 * @author William Callahan
 */
package com.williamcallahan.booru_source_resolver.model.backup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class BackupArchive {

    private final String draftPostId;
    private final Map<String, byte[]> entries;

    public BackupArchive(String draftPostId, Map<String, byte[]> entries) {
        this.draftPostId = draftPostId;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public String getDraftPostId() {
        return draftPostId;
    }

    public List<String> entryNames() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Finds the first entry whose name starts with the given prefix
     */
    public Optional<Map.Entry<String, byte[]>> findByPrefix(String prefix) {
        return entries.entrySet().stream()
            .filter(entry -> entry.getKey().startsWith(prefix))
            .findFirst();
    }
}
