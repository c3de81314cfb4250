package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.MediaKeyRendition;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.service.platform.TumblrMediaClient;
import com.williamcallahan.booru_source_resolver.util.UrlUtils;
import reactor.core.publisher.Mono;

import java.util.function.BooleanSupplier;

/**
 * Requests the largest rendition of a keyed media item from the media host.
 *
 * <p>A JPG result is passed over when the original's type is unknown or not JPG and a backup
 * archive can still be made for the post, since the backup holds the uploaded file.
 */
public class MediaKeyUpscaleStrategy implements AcquisitionStrategy {

    private static final String JPG = "jpg";

    private final TumblrMediaClient mediaClient;
    private final ImageProbe imageProbe;
    private final BooleanSupplier backupAvailable;
    private final boolean enabled;

    public MediaKeyUpscaleStrategy(TumblrMediaClient mediaClient, ImageProbe imageProbe,
                                   BooleanSupplier backupAvailable, boolean enabled) {
        this.mediaClient = mediaClient;
        this.imageProbe = imageProbe;
        this.backupAvailable = backupAvailable;
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "media-key-upscale";
    }

    @Override
    public Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context) {
        if (!enabled) {
            return Mono.just(StrategyOutcome.notApplicable("media-key upscale disabled"));
        }
        MediaKeyRendition rendition = context.getMediaKeyRendition();
        if (rendition == null || !rendition.hasMediaKey() || rendition.getUrl() == null) {
            return Mono.just(StrategyOutcome.notApplicable("no keyed media rendition"));
        }

        return mediaClient.fetchLargestImageUrl(rendition.getUrl())
            .flatMap(imageUrl -> {
                String filename = context.getFilename() != null ? context.getFilename() : UrlUtils.lastPathSegment(imageUrl);
                return imageProbe.fetchAndAccept(imageUrl, context.getRequestHeaders(), filename, descriptor,
                    context.getDeclaredRotation());
            })
            .map(image -> {
                if (JPG.equals(image.getType()) && !originalIsJpg(descriptor)
                    && context.getBlogPost() != null && backupAvailable.getAsBoolean()) {
                    return StrategyOutcome.notApplicable("largest rendition is only a JPG, the backup archive may hold the upload");
                }
                return StrategyOutcome.accepted(image);
            });
    }

    private static boolean originalIsJpg(OriginalFileDescriptor descriptor) {
        return descriptor != null && JPG.equals(descriptor.getType());
    }
}
