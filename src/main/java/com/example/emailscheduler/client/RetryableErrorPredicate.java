package com.example.emailscheduler.client;

import com.example.emailscheduler.exception.ExternalServiceException;

import java.util.function.Predicate;

/**
 * Retry predicate for collaborator calls: client errors other than timeouts
 * and throttling are not retried.
 */
public class RetryableErrorPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExternalServiceException serviceException) {
            return serviceException.isRetryable();
        }
        return true;
    }
}
