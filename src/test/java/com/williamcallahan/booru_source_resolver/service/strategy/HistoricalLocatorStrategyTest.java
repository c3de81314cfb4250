package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.ProbeResult;
import com.williamcallahan.booru_source_resolver.model.image.SourceImage;
import com.williamcallahan.booru_source_resolver.model.source.HistoricalSeed;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.service.locator.HistoricalLocator;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HistoricalLocatorStrategyTest {

    private static final LocalDate CUTOFF = LocalDate.of(2019, 3, 1);

    private final HistoricalLocator locator = mock(HistoricalLocator.class);
    private final HistoricalSeed seed = HistoricalSeed.builder().baseUrl("https://orig.example/storage").suffix(".png").build();
    private final OriginalFileDescriptor descriptor = OriginalFileDescriptor.of("png", 800, 600);

    @Test
    void tryResolve_itemsAfterCutoffAreNotApplicable() {
        HistoricalLocatorStrategy strategy = new HistoricalLocatorStrategy(locator, CUTOFF, true);
        SourceContext context = SourceContext.builder().historicalSeed(seed).publishDate(LocalDate.of(2020, 1, 1)).build();

        StepVerifier.create(strategy.tryResolve(descriptor, context))
            .assertNext(outcome -> assertThat(outcome.isAccepted()).isFalse())
            .verifyComplete();

        verify(locator, never()).locate(any(), any(), any(), any());
    }

    @Test
    void tryResolve_descriptorWithoutDimensionsIsNotApplicable() {
        HistoricalLocatorStrategy strategy = new HistoricalLocatorStrategy(locator, CUTOFF, true);
        SourceContext context = SourceContext.builder().historicalSeed(seed).publishDate(LocalDate.of(2015, 1, 1)).build();

        StepVerifier.create(strategy.tryResolve(OriginalFileDescriptor.unknown(), context))
            .assertNext(outcome -> assertThat(outcome.getReason()).contains("type and dimensions"))
            .verifyComplete();
    }

    @Test
    void tryResolve_hitKeepsCallerFilename() {
        HistoricalLocatorStrategy strategy = new HistoricalLocatorStrategy(locator, CUTOFF, true);
        SourceContext context = SourceContext.builder()
            .historicalSeed(seed)
            .publishDate(LocalDate.of(2015, 1, 1))
            .filename("night_sky_by_painter.png")
            .build();
        SourceImage located = SourceImage.of(new byte[]{1}, "https://orig.example/x.png", "x.png", new ProbeResult("png", 800, 600));
        when(locator.locate(any(), any(), any(), any())).thenReturn(Mono.just(located));

        StepVerifier.create(strategy.tryResolve(descriptor, context))
            .assertNext(outcome -> assertThat(outcome.getImage().getFilename()).isEqualTo("night_sky_by_painter.png"))
            .verifyComplete();
    }

    @Test
    void tryResolve_disabledIsNotApplicable() {
        HistoricalLocatorStrategy strategy = new HistoricalLocatorStrategy(locator, CUTOFF, false);

        StepVerifier.create(strategy.tryResolve(descriptor, SourceContext.builder().historicalSeed(seed).publishDate(LocalDate.of(2015, 1, 1)).build()))
            .assertNext(outcome -> assertThat(outcome.isAccepted()).isFalse())
            .verifyComplete();
    }
}
