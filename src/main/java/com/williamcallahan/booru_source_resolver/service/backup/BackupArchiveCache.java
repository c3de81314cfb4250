package com.williamcallahan.booru_source_resolver.service.backup;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.model.backup.BackupArchive;
import com.williamcallahan.booru_source_resolver.types.BackupFailedException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Shares one backup archive between all media of a root post for a short time.
 * Concurrent requests for the same post join the in-flight saga; failed sagas are not cached.
 */
@Component
public class BackupArchiveCache {

    private final AsyncCache<String, BackupArchive> archives;

    public BackupArchiveCache(ResolverConfigurationProperties properties) {
        this.archives = Caffeine.newBuilder()
            .maximumSize(properties.getBackup().getArchiveCacheMaxSize())
            .expireAfterWrite(properties.getBackup().getArchiveCacheTtl())
            .buildAsync();
    }

    /**
     * Joins or starts the archive load for a root post. Cancelling one subscriber leaves the
     * shared load running for the others.
     */
    public Mono<BackupArchive> get(String rootPostKey, Supplier<Mono<BackupArchive>> loader) {
        return Mono.fromFuture(() -> archives.get(rootPostKey, (key, executor) -> loader.get().toFuture()), true)
            .onErrorMap(CancellationException.class,
                e -> new BackupFailedException("Shared backup archive load for " + rootPostKey + " was cancelled", e));
    }

    public void invalidate(String rootPostKey) {
        archives.synchronous().invalidate(rootPostKey);
    }
}
