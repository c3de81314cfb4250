/**
 * Wires the acquisition strategies into the resolver in priority order
 * - Direct URL, API download, media-key upscale, historical locator, tile reconstruction,
 *   Sta.sh resubmission, remote backup
 * - Strategies that create content on the account run last
 * - Provides the clock used for token expiry and the locator's "today"
 *
 * @author William Callahan
 */
package com.williamcallahan.booru_source_resolver.config;

import com.williamcallahan.booru_source_resolver.service.SourceResolutionService;
import com.williamcallahan.booru_source_resolver.service.backup.RemoteBackupOrchestrator;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.service.locator.HistoricalLocator;
import com.williamcallahan.booru_source_resolver.service.platform.DeviantArtApiClient;
import com.williamcallahan.booru_source_resolver.service.platform.DeviantArtStashClient;
import com.williamcallahan.booru_source_resolver.service.platform.TumblrMediaClient;
import com.williamcallahan.booru_source_resolver.service.strategy.AcquisitionStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.ApiDownloadStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.DirectUrlStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.HistoricalLocatorStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.MediaKeyUpscaleStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.RemoteBackupStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.StashResubmissionStrategy;
import com.williamcallahan.booru_source_resolver.service.strategy.TileReconstructionStrategy;
import com.williamcallahan.booru_source_resolver.service.tile.TileReconstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class StrategyChainConfig {

    @Bean
    public Clock resolverClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SourceResolutionService sourceResolutionService(ResolverConfigurationProperties properties,
                                                           ImageProbe imageProbe,
                                                           DeviantArtApiClient deviantArtApiClient,
                                                           DeviantArtStashClient deviantArtStashClient,
                                                           TumblrMediaClient tumblrMediaClient,
                                                           HistoricalLocator historicalLocator,
                                                           TileReconstructor tileReconstructor,
                                                           RemoteBackupOrchestrator remoteBackupOrchestrator) {
        List<AcquisitionStrategy> strategies = List.of(
            new DirectUrlStrategy(imageProbe),
            new ApiDownloadStrategy(deviantArtApiClient, imageProbe),
            new MediaKeyUpscaleStrategy(tumblrMediaClient, imageProbe,
                () -> properties.getBackup().isEnabled() && remoteBackupOrchestrator.isEnabled(),
                properties.getTumblr().isUpscaleEnabled()),
            new HistoricalLocatorStrategy(historicalLocator,
                properties.getLocator().cutoffLocalDate(), properties.getLocator().isEnabled()),
            new TileReconstructionStrategy(tileReconstructor, properties.getTiles().isEnabled()),
            new StashResubmissionStrategy(deviantArtStashClient, imageProbe),
            new RemoteBackupStrategy(remoteBackupOrchestrator, properties.getBackup().isEnabled())
        );
        return new SourceResolutionService(strategies);
    }
}
