package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.service.locator.HistoricalLocator;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Searches the historical direct-storage layout for items published before the cutoff date.
 */
public class HistoricalLocatorStrategy implements AcquisitionStrategy {

    private final HistoricalLocator locator;
    private final LocalDate cutoffDate; // Null disables the date bound
    private final boolean enabled;

    public HistoricalLocatorStrategy(HistoricalLocator locator, LocalDate cutoffDate, boolean enabled) {
        this.locator = locator;
        this.cutoffDate = cutoffDate;
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "historical-locator";
    }

    @Override
    public Mono<StrategyOutcome> tryResolve(OriginalFileDescriptor descriptor, SourceContext context) {
        if (!enabled) {
            return Mono.just(StrategyOutcome.notApplicable("historical locator disabled"));
        }
        if (context.getHistoricalSeed() == null || context.getPublishDate() == null) {
            return Mono.just(StrategyOutcome.notApplicable("no storage seed or publish date"));
        }
        if (cutoffDate != null && context.getPublishDate().isAfter(cutoffDate)) {
            return Mono.just(StrategyOutcome.notApplicable("published " + context.getPublishDate() + ", after " + cutoffDate));
        }
        if (descriptor == null || descriptor.getType() == null || !descriptor.hasDimensions()) {
            return Mono.just(StrategyOutcome.notApplicable("a hit cannot be confirmed without type and dimensions"));
        }
        return locator.locate(context.getHistoricalSeed(), context.getPublishDate(), descriptor, context.getRequestHeaders())
            .map(image -> context.getFilename() != null ? image.withFilename(context.getFilename()) : image)
            .map(StrategyOutcome::accepted);
    }
}
