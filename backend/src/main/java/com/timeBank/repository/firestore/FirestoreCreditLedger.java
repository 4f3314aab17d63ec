package com.timeBank.repository.firestore;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.timeBank.exception.ErrorCode;
import com.timeBank.exception.ResourceNotFoundException;
import com.timeBank.exception.TaskRuleException;
import com.timeBank.mapper.UserDocumentMapper;
import com.timeBank.model.User;
import com.timeBank.repository.CreditLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Balance transfer as one Firestore transaction over both user documents plus a
 * "credit_transfers" entry keyed by task id. The entry makes a second transfer for
 * the same task fail instead of paying twice.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FirestoreCreditLedger implements CreditLedger {

    static final String COLLECTION_NAME = "credit_transfers";

    private final Firestore firestore;

    @Override
    public void transfer(String taskId, String senderId, String receiverId, int amount) {
        DocumentReference senderRef = firestore.collection(FirestoreUserRepository.COLLECTION_NAME).document(senderId);
        DocumentReference receiverRef = firestore.collection(FirestoreUserRepository.COLLECTION_NAME).document(receiverId);
        DocumentReference entryRef = firestore.collection(COLLECTION_NAME).document(taskId);
        try {
            firestore.runTransaction(transaction -> {
                DocumentSnapshot entry = transaction.get(entryRef).get();
                DocumentSnapshot sender = transaction.get(senderRef).get();
                DocumentSnapshot receiver = transaction.get(receiverRef).get();

                if (entry.exists()) {
                    throw new TaskRuleException(ErrorCode.WRONG_STATUS,
                            "Credits for task " + taskId + " were already transferred");
                }
                if (!sender.exists()) {
                    throw new ResourceNotFoundException("User", senderId);
                }
                if (!receiver.exists()) {
                    throw new ResourceNotFoundException("User", receiverId);
                }

                long senderBalance = balanceOf(sender);
                long receiverBalance = balanceOf(receiver);
                if (senderBalance < amount) {
                    throw new TaskRuleException(ErrorCode.INSUFFICIENT_CREDITS,
                            "Insufficient time credits: balance " + senderBalance + ", required " + amount);
                }

                transaction.update(senderRef, UserDocumentMapper.TIME_CREDITS, senderBalance - amount);
                transaction.update(receiverRef, UserDocumentMapper.TIME_CREDITS, receiverBalance + amount);

                Map<String, Object> record = new HashMap<>();
                record.put("task_id", taskId);
                record.put("sender_id", senderId);
                record.put("receiver_id", receiverId);
                record.put("amount", amount);
                record.put("transferred_at", Timestamp.now());
                transaction.create(entryRef, record);
                return null;
            }).get();
            log.info("Transferred {} credits from {} to {} for task {}", amount, senderId, receiverId, taskId);
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot transfer credits", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot transfer credits for task: " + taskId);
        }
    }

    private static long balanceOf(DocumentSnapshot user) {
        Long credits = user.getLong(UserDocumentMapper.TIME_CREDITS);
        return credits == null ? User.DEFAULT_TIME_CREDITS : credits;
    }
}
