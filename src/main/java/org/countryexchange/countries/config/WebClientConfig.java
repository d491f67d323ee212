package org.countryexchange.countries.config;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import reactor.netty.http.client.HttpClient;

/**
 * Shared {@link WebClient.Builder} for upstream calls. Clients clone it before customizing. The
 * per-call timeout configured on each source is the effective bound; the channel timeouts here only
 * cap a stalled connection.
 */
@Configuration
public class WebClientConfig {

  private static final int CHANNEL_TIMEOUT_SECONDS = 60;

  @Bean
  public WebClient.Builder webClientBuilder() {
    var httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .followRedirect(true)
            .responseTimeout(Duration.ofSeconds(CHANNEL_TIMEOUT_SECONDS))
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(
                            new ReadTimeoutHandler(CHANNEL_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                        .addHandlerLast(
                            new WriteTimeoutHandler(CHANNEL_TIMEOUT_SECONDS, TimeUnit.SECONDS)));

    // country directory payloads run to a few hundred KB
    var strategies =
        ExchangeStrategies.builder()
            .codecs(
                configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // 16MB
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .exchangeStrategies(strategies);
  }
}
