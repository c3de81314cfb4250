/**
 * Drives the draft-repost backup saga that exposes a post's original media
 *
 * @author William Callahan
 *
 * Features:
 * - Creates a draft repost on the intermediary account; failure means the source does not apply
 * - Requests a backup, which must start out pending
 * - Polls at a fixed interval until the archive is ready
 * - Deletes the draft exactly once on success, failure or cancellation, before the outcome is reported
 * - Downloads the archive, locates the requested media entry and probes it
 */
package com.williamcallahan.booru_source_resolver.service.backup;

import com.williamcallahan.booru_source_resolver.config.ResolverConfigurationProperties;
import com.williamcallahan.booru_source_resolver.model.backup.BackupArchive;
import com.williamcallahan.booru_source_resolver.model.backup.BackupJob;
import com.williamcallahan.booru_source_resolver.model.backup.BackupJobState;
import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.SourceImage;
import com.williamcallahan.booru_source_resolver.model.source.BlogPostReference;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.types.BackupFailedException;
import com.williamcallahan.booru_source_resolver.types.EntryNotFoundException;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import com.williamcallahan.booru_source_resolver.util.ResolutionLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;

@Service
@Slf4j
public class RemoteBackupOrchestrator {

    private final BackupPlatformClient platformClient;
    private final RateLimitedFetchClient fetchClient;
    private final BackupArchiveReader archiveReader;
    private final BackupArchiveCache archiveCache;
    private final ImageProbe imageProbe;
    private final Duration pollInterval;

    public RemoteBackupOrchestrator(BackupPlatformClient platformClient, RateLimitedFetchClient fetchClient,
                                    BackupArchiveReader archiveReader, BackupArchiveCache archiveCache,
                                    ImageProbe imageProbe, ResolverConfigurationProperties properties) {
        this.platformClient = platformClient;
        this.fetchClient = fetchClient;
        this.archiveReader = archiveReader;
        this.archiveCache = archiveCache;
        this.imageProbe = imageProbe;
        this.pollInterval = properties.getBackup().getPollInterval();
    }

    private record ReadyBackup(String draftPostId, String downloadLink) {
    }

    public boolean isEnabled() {
        return platformClient.isEnabled();
    }

    /**
     * Resolves one media item of a post through its backup archive
     *
     * @param post root post and media index
     * @param descriptor ground truth the located entry must match
     * @return the accepted image
     */
    public Mono<SourceImage> resolve(BlogPostReference post, OriginalFileDescriptor descriptor) {
        String cacheKey = post.getBlogName() + "/" + post.getPostId();
        return archiveCache.get(cacheKey, () -> acquireArchive(post))
            .map(archive -> {
                Map.Entry<String, byte[]> entry = locateEntry(archive, post.getMediaIndex());
                String filename = entry.getKey().substring(BackupArchiveReader.MEDIA_PREFIX.length());
                return imageProbe.accept(entry.getValue(), null, filename, descriptor);
            });
    }

    /**
     * Runs the saga and returns the decompressed archive. The draft is gone by the time anything is emitted.
     */
    public Mono<BackupArchive> acquireArchive(BlogPostReference post) {
        Mono<String> createDraft = platformClient.createDraftRepost(post)
            .onErrorMap(e -> !(e instanceof NotApplicableException),
                e -> new NotApplicableException("Could not create draft repost of " + post.getBlogName()
                    + "/" + post.getPostId() + ": " + e.getMessage(), e))
            .switchIfEmpty(Mono.error(() -> new NotApplicableException("Draft repost returned no post id")))
            .doOnNext(draftId -> ResolutionLogger.logBackupStep(log, "draft created", draftId));

        return Mono.usingWhen(
                createDraft,
                this::awaitBackup,
                this::deleteDraft,
                (draftId, error) -> deleteDraft(draftId),
                this::deleteDraft)
            .flatMap(ready -> fetchClient.getBytes(ready.downloadLink(), Map.of())
                .publishOn(Schedulers.boundedElastic())
                .map(zipBytes -> archiveReader.read(ready.draftPostId(), zipBytes)));
    }

    private Mono<ReadyBackup> awaitBackup(String draftId) {
        return platformClient.requestBackup()
            .switchIfEmpty(Mono.error(() -> new BackupFailedException("Backup request returned no job")))
            .flatMap(job -> job.getState() == BackupJobState.PENDING
                ? Mono.just(job)
                : Mono.error(new BackupFailedException("Backup request returned " + job.getState() + " instead of PENDING")))
            .doOnNext(job -> ResolutionLogger.logBackupStep(log, "backup requested", draftId))
            .then(pollUntilReady(draftId))
            .map(link -> new ReadyBackup(draftId, link));
    }

    private Mono<String> pollUntilReady(String draftId) {
        return Mono.defer(platformClient::pollBackup)
            .flatMap(this::readyLink)
            .repeatWhenEmpty(attempts -> attempts.delayElements(pollInterval))
            .doOnNext(link -> ResolutionLogger.logBackupStep(log, "backup ready", draftId));
    }

    private Mono<String> readyLink(BackupJob job) {
        if (job.getState() == BackupJobState.FAILED) {
            return Mono.error(new BackupFailedException("Backup job failed"));
        }
        return job.isReady() ? Mono.just(job.getDownloadLink()) : Mono.empty();
    }

    private Mono<Void> deleteDraft(String draftId) {
        return platformClient.deletePost(draftId)
            .doOnSuccess(ignored -> ResolutionLogger.logBackupStep(log, "draft deleted", draftId))
            .onErrorResume(e -> {
                log.error("Failed to delete draft post {}; it must be removed by hand: {}", draftId, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Finds the archive entry of one media item
     * An unsuffixed entry stands for index 0 and shifts every suffixed index down by one
     */
    Map.Entry<String, byte[]> locateEntry(BackupArchive archive, int mediaIndex) {
        String draftBase = BackupArchiveReader.MEDIA_PREFIX + archive.getDraftPostId();
        boolean hasUnsuffixed = archive.findByPrefix(draftBase + ".").isPresent();
        int entryIndex = mediaIndex - (hasUnsuffixed ? 1 : 0);
        String baseKey = entryIndex == -1 ? draftBase : draftBase + "_" + entryIndex;
        return archive.findByPrefix(baseKey + ".")
            .orElseThrow(() -> {
                log.warn("No archive entry for media index {} (looked for '{}.*'); entries: {}",
                    mediaIndex, baseKey, archive.entryNames());
                return new EntryNotFoundException(baseKey, archive.entryNames());
            });
    }
}
