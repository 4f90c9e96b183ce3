package com.example.emailscheduler.client;

import com.example.emailscheduler.client.ClientModels.ProcessingOutcome;
import com.example.emailscheduler.client.ClientModels.ProcessingRequest;

/**
 * Classification pipeline that processes a batch of fetched emails.
 */
public interface EmailProcessingPipeline {

    ProcessingOutcome processEmails(ProcessingRequest request);
}
