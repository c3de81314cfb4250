package com.williamcallahan.booru_source_resolver.service;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.ProbeResult;
import com.williamcallahan.booru_source_resolver.model.image.SourceImage;
import com.williamcallahan.booru_source_resolver.model.image.TileSpec;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.model.source.SourcePlatform;
import com.williamcallahan.booru_source_resolver.service.strategy.AcquisitionStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.StrategyOutcome;
import com.williamcallahan.booru_source_resolver.types.AttemptStatus;
import com.williamcallahan.booru_source_resolver.types.BadChunkException;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import com.williamcallahan.booru_source_resolver.types.ResolutionAttempt;
import com.williamcallahan.booru_source_resolver.types.ResolutionExhaustedException;
import com.williamcallahan.booru_source_resolver.types.ValidationException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SourceResolutionServiceTest {

    private final OriginalFileDescriptor descriptor = OriginalFileDescriptor.of("png", 10, 10);
    private final SourceContext context = SourceContext.builder()
        .platform(SourcePlatform.DEVIANTART)
        .pageUrl("https://www.deviantart.com/painter/art/night-1")
        .build();
    private final SourceImage image = SourceImage.of(new byte[]{1}, "https://cdn.example/a.png", "a.png", new ProbeResult("png", 10, 10));

    private static AcquisitionStrategy strategy(String name, Mono<StrategyOutcome> outcome) {
        AcquisitionStrategy strategy = mock(AcquisitionStrategy.class);
        when(strategy.name()).thenReturn(name);
        when(strategy.tryResolve(any(), any())).thenReturn(outcome);
        return strategy;
    }

    @Test
    void resolveImage_firstAcceptedWinsAndLaterStrategiesAreSkipped() {
        AcquisitionStrategy first = strategy("first", Mono.just(StrategyOutcome.notApplicable("no hint")));
        AcquisitionStrategy second = strategy("second", Mono.just(StrategyOutcome.accepted(image)));
        AcquisitionStrategy third = strategy("third", Mono.just(StrategyOutcome.accepted(image)));

        StepVerifier.create(new SourceResolutionService(List.of(first, second, third)).resolveImage(descriptor, context))
            .expectNext(image)
            .verifyComplete();

        verify(third, never()).tryResolve(any(), any());
    }

    @Test
    void resolveImage_recoverableFailuresFallThrough() {
        AcquisitionStrategy fetchFails = strategy("fetch", Mono.error(new FetchException("HTTP 503", "u", 503)));
        AcquisitionStrategy validationFails = strategy("validation", Mono.error(new ValidationException("Unexpected image size")));
        AcquisitionStrategy accepts = strategy("accepts", Mono.just(StrategyOutcome.accepted(image)));

        StepVerifier.create(new SourceResolutionService(List.of(fetchFails, validationFails, accepts)).resolveImage(descriptor, context))
            .expectNext(image)
            .verifyComplete();
    }

    @Test
    void resolveImage_exhaustionCarriesOrderedAttempts() {
        AcquisitionStrategy notApplicable = strategy("direct", Mono.error(new NotApplicableException("rendition too small")));
        AcquisitionStrategy empty = strategy("api", Mono.empty());
        AcquisitionStrategy badChunk = strategy("tiles", Mono.error(new BadChunkException(new TileSpec(0, 0, 10, 10), "placeholder tile")));

        StepVerifier.create(new SourceResolutionService(List.of(notApplicable, empty, badChunk)).resolveImage(descriptor, context))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ResolutionExhaustedException.class);
                ResolutionExhaustedException exhausted = (ResolutionExhaustedException) error;
                assertThat(exhausted.getAttempts().stream().map(ResolutionAttempt::getStrategyName).collect(Collectors.toList()))
                    .containsExactly("direct", "api", "tiles");
                assertThat(exhausted.getAttempts().stream().map(ResolutionAttempt::getStatus).collect(Collectors.toList()))
                    .containsExactly(AttemptStatus.NOT_APPLICABLE, AttemptStatus.NOT_APPLICABLE, AttemptStatus.FAILURE_INTEGRITY);
                assertThat(exhausted.isRecoverable()).isFalse();
                assertThat(exhausted.getSuppressed()).hasSize(2);
                assertThat(exhausted.getMessage()).contains("DEVIANTART");
            })
            .verify();
    }

    @Test
    void resolveImage_programmingErrorsPropagate() {
        AcquisitionStrategy broken = strategy("broken", Mono.error(new IllegalStateException("bug")));
        AcquisitionStrategy accepts = strategy("accepts", Mono.just(StrategyOutcome.accepted(image)));

        StepVerifier.create(new SourceResolutionService(List.of(broken, accepts)).resolveImage(descriptor, context))
            .expectError(IllegalStateException.class)
            .verify();

        verify(accepts, never()).tryResolve(any(), any());
    }

    @Test
    void resolveImage_noStrategiesIsExhausted() {
        StepVerifier.create(new SourceResolutionService(List.of()).resolveImage(descriptor, context))
            .expectError(ResolutionExhaustedException.class)
            .verify();
    }
}
