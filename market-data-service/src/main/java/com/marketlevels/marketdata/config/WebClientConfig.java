package com.marketlevels.marketdata.config;

import com.marketlevels.marketdata.client.MarketDataWebClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import com.fasterxml.jackson.databind.ObjectMapper;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${eodhd.base-url:https://eodhd.com}")
    private String baseUrl;

    @Value("${eodhd.api-token:}")
    private String apiToken;

    @Value("${eodhd.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${eodhd.response-timeout-seconds:15}")
    private int responseTimeoutSeconds;

    @Value("${eodhd.request-timeout-seconds:20}")
    private int requestTimeoutSeconds;

    @Bean
    public WebClient eodhdWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public MarketDataWebClient marketDataClient(WebClient eodhdWebClient, ObjectMapper objectMapper) {
        if (apiToken == null || apiToken.isBlank()) {
            log.warn("eodhd.api-token is not set; upstream calls will be rejected");
        }
        return new MarketDataWebClient(eodhdWebClient, objectMapper, apiToken,
            Duration.ofSeconds(requestTimeoutSeconds));
    }

    static String maskToken(String uri) {
        return uri.replaceAll("api_token=[^&]+", "api_token=***");
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(),
                maskToken(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }
}
