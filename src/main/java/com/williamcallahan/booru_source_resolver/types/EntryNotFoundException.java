package com.williamcallahan.booru_source_resolver.types;

import java.util.List;

/**
 * The backup archive was downloaded but holds no entry for the requested media.
 */
public class EntryNotFoundException extends SourceResolutionException {

    private final String baseEntryKey;
    private final List<String> availableEntries;

    public EntryNotFoundException(String baseEntryKey, List<String> availableEntries) {
        super("Could not find entry '" + baseEntryKey + "' in the backup archive (" + availableEntries.size() + " media entries)", true);
        this.baseEntryKey = baseEntryKey;
        this.availableEntries = List.copyOf(availableEntries);
    }

    public String getBaseEntryKey() {
        return baseEntryKey;
    }

    public List<String> getAvailableEntries() {
        return availableEntries;
    }
}
