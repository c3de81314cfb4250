package com.williamcallahan.booru_source_resolver.service.backup;

import com.williamcallahan.booru_source_resolver.model.backup.BackupJob;
import com.williamcallahan.booru_source_resolver.model.source.BlogPostReference;
import reactor.core.publisher.Mono;

/**
 * Platform operations the backup saga drives. Implementations act on an intermediary account.
 */
public interface BackupPlatformClient {

    /**
     * Creates a draft repost of the referenced post on the intermediary account
     *
     * @return the draft post id
     */
    Mono<String> createDraftRepost(BlogPostReference post);

    Mono<BackupJob> requestBackup();

    Mono<BackupJob> pollBackup();

    Mono<Void> deletePost(String postId);

    boolean isEnabled();
}
