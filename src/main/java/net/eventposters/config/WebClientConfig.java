/**
 * Outbound HTTP for poster rendering and publishing
 * - Pexels search and original-resolution photo downloads
 * - First-use icon downloads for the datetime line
 * - Webhook posts carrying the finished poster
 */
package net.eventposters.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Provides the {@link WebClient.Builder} every outbound client builds from.
 * Socket timeouts follow the slowest configured call so the per-call Reactor
 * timeouts in the clients stay the effective bound.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);
    private static final String USER_AGENT = "event-posters/0.1 (+https://lu.ma/EXATEC-Alemania)";
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;
    // original Pexels photos are routinely above 10 MB
    private static final int MAX_PHOTO_BYTES = 32 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(PosterProperties posterProperties) {
        Duration socketTimeout = slowestCall(posterProperties);
        log.info("Outbound HTTP socket timeout set to {}", socketTimeout);

        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(socketTimeout.toMillis(), TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(socketTimeout.toMillis(), TimeUnit.MILLISECONDS))
            )
            .responseTimeout(socketTimeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_PHOTO_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    static Duration slowestCall(PosterProperties posterProperties) {
        Duration search = posterProperties.getSearch().getTimeout();
        Duration webhook = posterProperties.getWebhook().getTimeout();
        Duration icons = posterProperties.getAssets().getIconFetchTimeout();
        Duration slowest = search;
        if (webhook.compareTo(slowest) > 0) {
            slowest = webhook;
        }
        if (icons.compareTo(slowest) > 0) {
            slowest = icons;
        }
        return slowest;
    }
}
