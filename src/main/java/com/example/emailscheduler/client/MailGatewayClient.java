package com.example.emailscheduler.client;

import com.example.emailscheduler.client.ClientModels.EmailMessage;
import com.example.emailscheduler.client.ClientModels.MailSession;
import com.example.emailscheduler.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Client for the Mail Gateway API.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff
 * - WebClient for HTTP calls, blocking on the calling executor thread
 */
@Slf4j
@Component
public class MailGatewayClient implements MailFetchClient {

    private static final String SERVICE_NAME = "Mail Gateway";

    private final WebClient webClient;

    public MailGatewayClient(@Qualifier("mailGatewayWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @CircuitBreaker(name = "mailGateway", fallbackMethod = "openSessionFallback")
    @Retry(name = "mailGateway")
    public MailSession openSession(String accountId) {
        log.debug("Opening mail session for account {}", accountId);

        try {
            return webClient.post()
                    .uri("/api/v1/accounts/{accountId}/sessions", accountId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(MailSession.class)
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to open mail session for account {}: {}", accountId, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    @Override
    @CircuitBreaker(name = "mailGateway", fallbackMethod = "fetchEmailsFallback")
    @Retry(name = "mailGateway")
    public List<EmailMessage> fetchEmailsInRange(MailSession session, Instant since, Instant before, int maxCount) {
        log.info("Fetching up to {} emails for account {} between {} and {}", maxCount, session.getAccountId(), since, before);

        try {
            var emails = webClient.get()
                    .uri(uri -> uri.path("/api/v1/sessions/{sessionId}/messages")
                            .queryParam("since", since.toString())
                            .queryParam("before", before.toString())
                            .queryParam("limit", maxCount)
                            .build(session.getSessionId()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(new ParameterizedTypeReference<List<EmailMessage>>() {
                    })
                    .block();
            return emails != null ? emails : List.of();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch emails for account {}: {}", session.getAccountId(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    @Override
    public void closeSession(MailSession session) {
        log.debug("Closing mail session {} for account {}", session.getSessionId(), session.getAccountId());

        try {
            webClient.delete()
                    .uri("/api/v1/sessions/{sessionId}", session.getSessionId())
                    .retrieve()
                    .toBodilessEntity()
                    .block();
        } catch (Exception e) {
            // the gateway expires abandoned sessions on its own
            log.warn("Failed to close mail session {}: {}", session.getSessionId(), e.getMessage());
        }
    }

    @SuppressWarnings("unused")
    private MailSession openSessionFallback(String accountId, Exception e) {
        if (e instanceof ExternalServiceException serviceException) {
            throw serviceException;
        }
        log.warn("Circuit breaker open for Mail Gateway, account: {}, error: {}", accountId, e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    @SuppressWarnings("unused")
    private List<EmailMessage> fetchEmailsFallback(MailSession session, Instant since, Instant before, int maxCount, Exception e) {
        if (e instanceof ExternalServiceException serviceException) {
            throw serviceException;
        }
        log.warn("Circuit breaker open for Mail Gateway, account: {}, error: {}", session.getAccountId(), e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
