package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.model.source.ViewerMedia;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.util.CandidateGenerator;
import com.williamcallahan.booru_source_resolver.util.UrlUtils;
import reactor.core.publisher.Mono;

/**
 * Downloads the image the platform links directly, or its full-size viewer rendition,
 * when that rendition is known to have the original's dimensions.
 */
public class DirectUrlStrategy implements AcquisitionStrategy {

    private final ImageProbe imageProbe;

    public DirectUrlStrategy(ImageProbe imageProbe) {
        this.imageProbe = imageProbe;
    }

    @Override
    public String name() {
        return "direct-url";
    }

    @Override
    public Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context) {
        ViewerMedia media = context.getViewerMedia();
        boolean renditionIsOriginal = media == null || descriptor == null || !descriptor.hasDimensions()
            || descriptor.matchesDimensions(media.getWidth(), media.getHeight());
        if (!renditionIsOriginal) {
            return Mono.just(StrategyOutcome.notApplicable("viewer rendition is " + media.getWidth() + "x" + media.getHeight()
                + ", original is " + descriptor.getWidth() + "x" + descriptor.getHeight()));
        }

        String url = context.getDirectUrl();
        if (url == null && media != null && media.getBaseUri() != null) {
            url = CandidateGenerator.fullviewUrl(media);
        }
        if (url == null) {
            return Mono.just(StrategyOutcome.notApplicable("no direct image URL"));
        }

        String filename = context.getFilename() != null ? context.getFilename() : UrlUtils.lastPathSegment(url);
        return imageProbe.fetchAndAccept(url, context.getRequestHeaders(), filename, descriptor,
                context.getDeclaredRotation())
            .map(StrategyOutcome::accepted);
    }
}
