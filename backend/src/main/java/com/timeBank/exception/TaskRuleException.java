package com.timeBank.exception;

/**
 * A request that violates a task lifecycle precondition (bad duration, task not
 * open, missing photos, ...). Always a 400.
 */
public class TaskRuleException extends TimeBankException {

    public TaskRuleException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
