/**
 * Entry point of the source resolution engine
 *
 * @author William Callahan
 *
 * Features:
 * - Tries acquisition strategies in priority order, one at a time
 * - Returns the first accepted image, which always matches the descriptor
 * - Demotes recoverable failures to "try the next strategy" and keeps them as attempt history
 * - Raises ResolutionExhaustedException only when every strategy failed or did not apply
 * - Programming errors propagate unchanged
 */
package com.williamcallahan.booru_source_resolver.service;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.SourceImage;
import com.williamcallahan.booru_source_resolver.model.source.SourceContext;
import com.williamcallahan.booru_source_resolver.service.strategy.AcquisitionStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.StrategyOutcome;
import com.williamcallahan.booru_source_resolver.types.AttemptStatus;
import com.williamcallahan.booru_source_resolver.types.ResolutionAttempt;
import com.williamcallahan.booru_source_resolver.types.ResolutionExhaustedException;
import com.williamcallahan.booru_source_resolver.util.ErrorHandlingUtils;
import com.williamcallahan.booru_source_resolver.util.ResolutionLogger;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
public class SourceResolutionService {

    private final List<AcquisitionStrategy> strategies;

    public SourceResolutionService(List<AcquisitionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<AcquisitionStrategy> getStrategies() {
        return strategies;
    }

    /**
     * Resolves the original image of a source
     *
     * @param descriptor caller-known ground truth; the accepted image matches it exactly
     * @param context per-call platform metadata
     * @return the accepted image, or ResolutionExhaustedException carrying every attempt
     */
    public Mono<SourceImage> resolveImage(OriginalFileDescriptor descriptor, SourceContext context) {
        List<ResolutionAttempt> attempts = Collections.synchronizedList(new ArrayList<>());
        String label = context.label();
        return Flux.fromIterable(strategies)
            .concatMap(strategy -> attempt(strategy, descriptor, context, label, attempts))
            .next()
            .switchIfEmpty(Mono.defer(() -> {
                ResolutionLogger.logExhausted(log, label, attempts.size());
                return Mono.error(new ResolutionExhaustedException(label, attempts));
            }));
    }

    /**
     * Blocking variant for callers outside a reactive pipeline
     */
    public SourceImage resolveImageBlocking(OriginalFileDescriptor descriptor, SourceContext context) {
        return resolveImage(descriptor, context).block();
    }

    private Mono<SourceImage> attempt(AcquisitionStrategy strategy, OriginalFileDescriptor descriptor,
                                      SourceContext context, String label, List<ResolutionAttempt> attempts) {
        String name = strategy.name();
        return Mono.defer(() -> {
                ResolutionLogger.logStrategyAttempt(log, name, label);
                return strategy.tryResolve(descriptor, context);
            })
            .defaultIfEmpty(StrategyOutcome.notApplicable("strategy produced no outcome"))
            .flatMap(outcome -> {
                if (outcome.isAccepted()) {
                    attempts.add(ResolutionAttempt.accepted(name, outcome.getImage().toString()));
                    ResolutionLogger.logStrategyAccepted(log, name, label, outcome.getImage().toString());
                    return Mono.just(outcome.getImage());
                }
                attempts.add(new ResolutionAttempt(name, AttemptStatus.NOT_APPLICABLE, outcome.getReason(), null));
                ResolutionLogger.logStrategyNotApplicable(log, name, label, outcome.getReason());
                return Mono.<SourceImage>empty();
            })
            .onErrorResume(ErrorHandlingUtils::isRecoverable, error -> {
                AttemptStatus status = ErrorHandlingUtils.toAttemptStatus(error);
                attempts.add(ResolutionAttempt.failed(name, status, error));
                if (status == AttemptStatus.NOT_APPLICABLE) {
                    ResolutionLogger.logStrategyNotApplicable(log, name, label, error.getMessage());
                } else {
                    ResolutionLogger.logStrategyFailure(log, name, label, error);
                }
                return Mono.empty();
            });
    }
}
