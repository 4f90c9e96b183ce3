package com.example.emailscheduler.client;

import com.example.emailscheduler.client.ClientModels.ProcessingOutcome;
import com.example.emailscheduler.client.ClientModels.ProcessingRequest;
import com.example.emailscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Client for the email processing pipeline.
 * <p>
 * Not retried: a batch may already have been classified when a response is
 * lost, and the pipeline is not idempotent.
 */
@Slf4j
@Component
public class ProcessingPipelineClient implements EmailProcessingPipeline {

    private static final String SERVICE_NAME = "Processing Pipeline";

    private final WebClient webClient;

    public ProcessingPipelineClient(@Qualifier("processingPipelineWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @CircuitBreaker(name = "processingPipeline", fallbackMethod = "processEmailsFallback")
    public ProcessingOutcome processEmails(ProcessingRequest request) {
        log.info("Submitting {} emails of execution {} to the processing pipeline",
                request.getEmails().size(), request.getExecutionId());

        try {
            var outcome = webClient.post()
                    .uri("/api/v1/processing/batches")
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(ProcessingOutcome.class)
                    .block();
            if (outcome == null) {
                throw new ExternalServiceException(SERVICE_NAME, "Empty response", null);
            }
            return outcome;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to process emails of execution {}: {}", request.getExecutionId(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    @SuppressWarnings("unused")
    private ProcessingOutcome processEmailsFallback(ProcessingRequest request, Exception e) {
        if (e instanceof ExternalServiceException serviceException) {
            throw serviceException;
        }
        log.warn("Circuit breaker open for Processing Pipeline, execution: {}, error: {}", request.getExecutionId(), e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
