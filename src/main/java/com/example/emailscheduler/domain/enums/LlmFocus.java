package com.example.emailscheduler.domain.enums;

/**
 * Analysis emphasis passed through to the processing pipeline.
 */
public enum LlmFocus {
    GENERAL,
    SENTIMENT,
    URGENCY
}
