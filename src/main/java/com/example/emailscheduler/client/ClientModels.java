package com.example.emailscheduler.client;

import com.example.emailscheduler.domain.enums.LlmFocus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request/Response DTOs for the mail gateway and processing pipeline clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Mail Gateway Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MailSession {
        private String sessionId;
        private String accountId;
        private Instant openedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmailMessage {
        private String id;
        private String accountId;
        private String sender;
        private String subject;
        private Instant receivedAt;
        private String bodyPreview;
    }

    // === Processing Pipeline Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProcessingRequest {
        private UUID scheduleId;
        private UUID executionId;
        private String accountId;
        private int batchSize;
        private Map<String, String> categoryPriorities;
        private Map<String, String> senderPriorities;
        private LlmFocus llmFocus;
        private List<EmailMessage> emails;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProcessingOutcome {
        private int processed;
        private int failed;
        private List<EmailResult> perEmailResults;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmailResult {
        private String emailId;
        private boolean success;
        private String category;
        private String priority;
        private String error;
    }
}
