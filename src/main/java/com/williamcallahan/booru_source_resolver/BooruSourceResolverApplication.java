/**
 * Main application class for the booru source resolver
 *
 * @author William Callahan
 *
 * Features:
 * - Boots the resolution engine standalone without a web server
 * - Scrapers embedding the engine inject SourceResolutionService directly
 * - Logs the configured strategy chain at startup
 */

package com.williamcallahan.booru_source_resolver;

import com.williamcallahan.booru_source_resolver.service.SourceResolutionService;
import com.williamcallahan.booru_source_resolver.service.strategy.AcquisitionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.stream.Collectors;

@SpringBootApplication
public class BooruSourceResolverApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BooruSourceResolverApplication.class);

    private final SourceResolutionService sourceResolutionService;

    public BooruSourceResolverApplication(SourceResolutionService sourceResolutionService) {
        this.sourceResolutionService = sourceResolutionService;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(BooruSourceResolverApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Source resolution engine ready with strategies: {}", sourceResolutionService.getStrategies().stream()
            .map(AcquisitionStrategy::name)
            .collect(Collectors.joining(" -> ")));
    }
}
