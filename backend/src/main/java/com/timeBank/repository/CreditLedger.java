package com.timeBank.repository;

/**
 * Moves time credits between two balances in a single atomic operation.
 */
public interface CreditLedger {

    /**
     * Debits {@code amount} from the sender and credits it to the receiver, recording
     * the transfer against the task.
     *
     * @throws com.timeBank.exception.TaskRuleException INSUFFICIENT_CREDITS when the sender
     *         balance is below {@code amount}, WRONG_STATUS when the task was already settled
     * @throws com.timeBank.exception.ResourceNotFoundException if either user is missing
     * @throws com.timeBank.exception.ServiceException on data store failure
     */
    void transfer(String taskId, String senderId, String receiverId, int amount);
}
