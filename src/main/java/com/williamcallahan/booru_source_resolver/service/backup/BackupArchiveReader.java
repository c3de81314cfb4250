package com.williamcallahan.booru_source_resolver.service.backup;

import com.williamcallahan.booru_source_resolver.model.backup.BackupArchive;
import com.williamcallahan.booru_source_resolver.types.BackupFailedException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Decompresses a backup archive, keeping only its {@code media/} entries.
 */
@Component
public class BackupArchiveReader {

    static final String MEDIA_PREFIX = "media/";

    public BackupArchive read(String draftPostId, byte[] zipBytes) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(zipBytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory() && entry.getName().startsWith(MEDIA_PREFIX)) {
                    entries.put(entry.getName(), zip.readAllBytes());
                }
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new BackupFailedException("Unreadable backup archive: " + e.getMessage(), e);
        }
        if (entries.isEmpty()) {
            throw new BackupFailedException("Backup archive holds no media entries (" + zipBytes.length + " bytes)");
        }
        return new BackupArchive(draftPostId, entries);
    }
}
