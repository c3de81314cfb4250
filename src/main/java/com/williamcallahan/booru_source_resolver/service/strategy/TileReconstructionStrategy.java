package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.service.tile.TileReconstructor;
import reactor.core.publisher.Mono;

/**
 * Rebuilds the original from crop tiles of the stored canvas.
 */
public class TileReconstructionStrategy implements AcquisitionStrategy {

    private final TileReconstructor reconstructor;
    private final boolean enabled;

    public TileReconstructionStrategy(TileReconstructor reconstructor, boolean enabled) {
        this.reconstructor = reconstructor;
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "tile-reconstruction";
    }

    @Override
    public Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context) {
        if (!enabled) {
            return Mono.just(StrategyOutcome.notApplicable("tile reconstruction disabled"));
        }
        if (context.getViewerMedia() == null || !context.getViewerMedia().hasCropCommand()) {
            return Mono.just(StrategyOutcome.notApplicable("no crop command"));
        }
        return reconstructor.reconstruct(context.getViewerMedia(), descriptor, context.getRequestHeaders(), context.getFilename())
            .map(StrategyOutcome::accepted);
    }
}
