package com.example.jobscheduler.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for outbound calls.
 * <p>
 * One client talks to the task execution engine, the other delivers job results
 * to arbitrary webhook URLs owned by users.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Value("${job-scheduler.webhook.timeout-seconds:15}")
    private int webhookTimeout;

    /**
     * WebClient for the task execution engine
     */
    @Bean(name = "engineWebClient")
    public WebClient engineWebClient(WebClient.Builder builder, EngineProperties engineProperties) {
        return createWebClient(builder, engineProperties.getBaseUrl(), engineProperties.getTimeoutSeconds(), "Engine");
    }

    /**
     * WebClient for webhook delivery; URLs are absolute per job
     */
    @Bean(name = "webhookWebClient")
    public WebClient webhookWebClient(WebClient.Builder builder) {
        return createWebClient(builder, "", webhookTimeout, "Webhook");
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutSeconds, String serviceName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Service-Name", "agent-job-scheduler")
                .filter(logRequest(serviceName))
                .filter(logResponse(serviceName))
                .build();
    }

    /**
     * Log outgoing requests
     */
    private ExchangeFilterFunction logRequest(String serviceName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", serviceName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    /**
     * Log incoming responses, warning on error statuses
     */
    private ExchangeFilterFunction logResponse(String serviceName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", serviceName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", serviceName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
