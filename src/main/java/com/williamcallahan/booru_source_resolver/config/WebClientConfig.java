/**
 * Configuration for the WebClient instances used by the fetch layer
 * - Defines a redirect-following client for image and archive downloads
 * - Defines a non-redirecting client for redirect probes
 * - Sets up timeouts and in-memory buffer limits from resolver.fetch.*
 *
 * @author William Callahan
 */
package com.williamcallahan.booru_source_resolver.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    public static final String REDIRECTING_CLIENT = "redirectingWebClient";
    public static final String DIRECT_CLIENT = "directWebClient";

    private final ResolverConfigurationProperties.Fetch fetchProperties;

    public WebClientConfig(ResolverConfigurationProperties properties) {
        this.fetchProperties = properties.getFetch();
    }

    /**
     * Client that follows redirects, for downloading images and archives
     *
     * @return configured WebClient
     */
    @Bean
    @Qualifier(REDIRECTING_CLIENT)
    public WebClient redirectingWebClient() {
        return buildClient(true);
    }

    /**
     * Client that never follows redirects, so a 301 and its Location header reach the caller
     *
     * @return configured WebClient
     */
    @Bean
    @Qualifier(DIRECT_CLIENT)
    public WebClient directWebClient() {
        return buildClient(false);
    }

    private WebClient buildClient(boolean followRedirects) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, fetchProperties.getConnectTimeoutMillis())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(fetchProperties.getReadTimeoutSeconds(), TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(fetchProperties.getWriteTimeoutSeconds(), TimeUnit.SECONDS))
            )
            .responseTimeout(fetchProperties.getResponseTimeout())
            .followRedirect(followRedirects);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(fetchProperties.getMaxInMemorySizeMb() * 1024 * 1024)) // Backup archives can be large
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
