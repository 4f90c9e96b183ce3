package com.example.emailscheduler.client;

import com.example.emailscheduler.client.ClientModels.EmailMessage;
import com.example.emailscheduler.client.ClientModels.MailSession;

import java.time.Instant;
import java.util.List;

/**
 * Access to an account's mailbox.
 * Sessions are expensive to open and are shared through {@link MailSessionPool}.
 */
public interface MailFetchClient {

    MailSession openSession(String accountId);

    /**
     * Messages received in {@code [since, before)}, oldest first, at most {@code maxCount}.
     */
    List<EmailMessage> fetchEmailsInRange(MailSession session, Instant since, Instant before, int maxCount);

    void closeSession(MailSession session);
}
