package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import reactor.core.publisher.Mono;

/**
 * One way of acquiring the original image of a source.
 * Recoverable failures are signalled as {@link com.williamcallahan.booru_source_resolver.types.SourceResolutionException}s.
 */
public interface AcquisitionStrategy {

    String name();

    Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context);
}
