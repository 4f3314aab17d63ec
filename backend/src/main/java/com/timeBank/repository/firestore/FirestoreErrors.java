package com.timeBank.repository.firestore;

import com.timeBank.exception.ServiceException;
import com.timeBank.exception.TimeBankException;

import java.util.concurrent.ExecutionException;

final class FirestoreErrors {

    private FirestoreErrors() {
    }

    /**
     * Errors raised inside a transaction body come back wrapped in the future's
     * ExecutionException; those are rethrown as-is, anything else is an upstream failure.
     */
    static RuntimeException unwrap(ExecutionException e, String message) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof TimeBankException timeBankException) {
                return timeBankException;
            }
            cause = cause.getCause();
        }
        return new ServiceException(message, e.getCause());
    }

    static ServiceException interrupted(String message, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new ServiceException(message + ": operation interrupted", e);
    }
}
