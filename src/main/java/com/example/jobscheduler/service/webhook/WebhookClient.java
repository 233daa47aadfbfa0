package com.example.jobscheduler.service.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Delivers job results to user-owned webhook URLs.
 * <p>
 * Exactly one attempt per call, no retry. Transport failures (connection refused,
 * timeout, malformed URL) are reported as status {@link #TRANSPORT_FAILURE} and never
 * thrown. Non-2xx responses are returned as-is.
 */
@Slf4j
@Component
public class WebhookClient {

    public static final int TRANSPORT_FAILURE = 0;

    private static final Duration DELIVERY_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;

    public WebhookClient(@Qualifier("webhookWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * POST a JSON body to a URL
     *
     * @return the HTTP status code, or 0 if no response was received
     */
    public int post(String url, Object body) {
        try {
            var status = webClient.post()
                    .uri(url)
                    .bodyValue(body)
                    .exchangeToMono(response -> response.releaseBody()
                            .thenReturn(response.statusCode().value()))
                    .timeout(DELIVERY_TIMEOUT)
                    .block();

            if (status == null) {
                log.warn("Webhook {} produced no response", url);
                return TRANSPORT_FAILURE;
            }

            log.info("Webhook {} answered with status {}", url, status);
            return status;
        } catch (Exception e) {
            log.warn("Webhook delivery to {} failed: {}", url, e.getMessage());
            return TRANSPORT_FAILURE;
        }
    }
}
