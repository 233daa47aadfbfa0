package com.example.jobscheduler.service.engine;

import com.example.jobscheduler.config.EngineProperties;
import com.example.jobscheduler.exception.EngineInvocationException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Task execution engine backed by a remote agent gateway.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker so a failing gateway fails runs fast
 * - WebClient for the HTTP call, blocking on the sweep thread
 * <p>
 * No retry is applied: a failed invocation fails the run, and the job waits
 * for its next fire time.
 */
@Slf4j
@Component
public class HttpTaskExecutionEngine implements TaskExecutionEngine {

    private static final String INVOKE_PATH = "/v1/agent/invoke";

    private final WebClient webClient;
    private final EngineProperties engineProperties;

    public HttpTaskExecutionEngine(@Qualifier("engineWebClient") WebClient webClient, EngineProperties engineProperties) {
        this.webClient = webClient;
        this.engineProperties = engineProperties;
    }

    @Override
    @CircuitBreaker(name = "taskEngine", fallbackMethod = "invokeFallback")
    public EngineResult invoke(EngineRequest request) {
        log.debug("Invoking engine with {} tools and max {} steps", request.getTools().size(), request.getMaxSteps());

        var body = InvokeRequest.builder()
                .prompt(request.getPrompt())
                .system(request.getSystemInstruction())
                .owner(request.getOwnerEmail())
                .tools(request.getTools().stream().map(AgentTool::getName).toList())
                .maxSteps(request.getMaxSteps())
                .build();

        try {
            var result = webClient.post()
                    .uri(INVOKE_PATH)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(text -> Mono.error(
                                            new EngineInvocationException(response.statusCode().value(), text))))
                    .bodyToMono(EngineResult.class)
                    .timeout(Duration.ofSeconds(engineProperties.getTimeoutSeconds()))
                    .block();

            if (result == null || result.getText() == null) {
                throw new EngineInvocationException("Engine returned an empty result");
            }
            return result;
        } catch (EngineInvocationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Engine invocation failed: {}", e.getMessage());
            throw new EngineInvocationException("Engine invocation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fallback when the circuit breaker is open or the call failed
     */
    @SuppressWarnings("unused")
    private EngineResult invokeFallback(EngineRequest request, Exception e) {
        if (e instanceof EngineInvocationException engineException) {
            throw engineException;
        }
        log.warn("Circuit breaker open for task engine: {}", e.getMessage());
        throw new EngineInvocationException("Task engine temporarily unavailable (circuit breaker open)", e);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class InvokeRequest {
        private String prompt;
        private String system;
        private String owner;
        private List<String> tools;
        private int maxSteps;
    }
}
