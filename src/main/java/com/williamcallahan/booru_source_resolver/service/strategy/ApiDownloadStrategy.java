package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.service.platform.DeviantArtApiClient;
import com.williamcallahan.booru_source_resolver.types.ValidationException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Fetches the original through the platform's authenticated download API.
 */
public class ApiDownloadStrategy implements AcquisitionStrategy {

    private final DeviantArtApiClient apiClient;
    private final ImageProbe imageProbe;

    public ApiDownloadStrategy(DeviantArtApiClient apiClient, ImageProbe imageProbe) {
        this.apiClient = apiClient;
        this.imageProbe = imageProbe;
    }

    @Override
    public String name() {
        return "api-download";
    }

    @Override
    public Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context) {
        if (!context.isDownloadable() || context.getDownloadId() == null) {
            return Mono.just(StrategyOutcome.notApplicable("item is not downloadable"));
        }
        if (!apiClient.isEnabled()) {
            return Mono.just(StrategyOutcome.notApplicable("download API is not configured"));
        }
        return apiClient.fetchDownload(context.getDownloadId())
            .flatMap(download -> {
                if (descriptor != null && descriptor.hasDimensions()
                    && !descriptor.matchesDimensions(download.width(), download.height())) {
                    return Mono.error(new ValidationException("Download has different dimensions than original file: "
                        + download.width() + "x" + download.height()));
                }
                String filename = context.getFilename() != null ? context.getFilename() : download.filename();
                return imageProbe.fetchAndAccept(download.src(), Map.of(), filename, descriptor,
                    context.getDeclaredRotation());
            })
            .map(StrategyOutcome::accepted);
    }
}
