package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.model.source.SourcePlatform;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.service.platform.DeviantArtStashClient;
import com.williamcallahan.booru_source_resolver.service.platform.StashedDeviation;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import com.williamcallahan.booru_source_resolver.util.CandidateGenerator;
import com.williamcallahan.booru_source_resolver.util.UrlUtils;
import reactor.core.publisher.Mono;

/**
 * Resubmits a non-downloadable deviation to Sta.sh, whose copy exposes a fullview at the
 * original size, and validates that fullview against the original file including its byte size.
 * Creates an item in the account's Sta.sh, so it runs after the strategies without side effects.
 */
public class StashResubmissionStrategy implements AcquisitionStrategy {

    private final DeviantArtStashClient stashClient;
    private final ImageProbe imageProbe;

    public StashResubmissionStrategy(DeviantArtStashClient stashClient, ImageProbe imageProbe) {
        this.stashClient = stashClient;
        this.imageProbe = imageProbe;
    }

    @Override
    public String name() {
        return "stash-resubmission";
    }

    @Override
    public Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context) {
        if (context.getPlatform() != SourcePlatform.DEVIANTART || context.getDeviationId() == null) {
            return Mono.just(StrategyOutcome.notApplicable("no deviation id"));
        }
        if (context.isDownloadable()) {
            return Mono.just(StrategyOutcome.notApplicable("deviation is downloadable"));
        }
        if (!stashClient.isEnabled()) {
            return Mono.just(StrategyOutcome.notApplicable("Sta.sh resubmission not configured"));
        }

        return stashClient.submit(context.getDeviationId())
            .flatMap(stashClient::fetchStashed)
            .flatMap(stashed -> {
                if (!stashed.fullviewIsOriginalSize()) {
                    return Mono.error(new NotApplicableException("Stash item " + stashed.itemId()
                        + " has no fullview at the original size " + stashed.originalFile()));
                }
                String url = CandidateGenerator.fullviewUrl(stashed.fullview());
                return imageProbe.fetchAndAccept(url, context.getRequestHeaders(), filename(context, stashed),
                    descriptor, context.getDeclaredRotation());
            })
            .map(StrategyOutcome::accepted);
    }

    private static String filename(SourceContext context, StashedDeviation stashed) {
        if (context.getFilename() != null) {
            return context.getFilename();
        }
        if (context.getViewerMedia() != null && context.getViewerMedia().getBaseUri() != null) {
            return UrlUtils.lastPathSegment(context.getViewerMedia().getBaseUri());
        }
        return UrlUtils.lastPathSegment(stashed.fullview().getBaseUri());
    }
}
