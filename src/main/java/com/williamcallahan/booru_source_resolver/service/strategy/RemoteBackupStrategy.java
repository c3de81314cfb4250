package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.service.backup.RemoteBackupOrchestrator;
import reactor.core.publisher.Mono;

/**
 * Last resort: unlocks the original bytes through a platform backup of a draft repost.
 */
public class RemoteBackupStrategy implements AcquisitionStrategy {

    private final RemoteBackupOrchestrator orchestrator;
    private final boolean enabled;

    public RemoteBackupStrategy(RemoteBackupOrchestrator orchestrator, boolean enabled) {
        this.orchestrator = orchestrator;
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "remote-backup";
    }

    @Override
    public Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context) {
        if (!enabled || !orchestrator.isEnabled()) {
            return Mono.just(StrategyOutcome.notApplicable("backup client not configured"));
        }
        if (context.getBlogPost() == null) {
            return Mono.just(StrategyOutcome.notApplicable("no blog post reference"));
        }
        return orchestrator.resolve(context.getBlogPost(), descriptor)
            .map(StrategyOutcome::accepted);
    }
}
