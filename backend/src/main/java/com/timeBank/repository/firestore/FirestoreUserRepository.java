package com.timeBank.repository.firestore;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.timeBank.dto.UserUpdateDTO;
import com.timeBank.mapper.UserDocumentMapper;
import com.timeBank.model.User;
import com.timeBank.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

@Repository
@RequiredArgsConstructor
public class FirestoreUserRepository implements UserRepository {

    static final String COLLECTION_NAME = "users";

    private final Firestore firestore;

    @Override
    public Optional<User> findById(String userId) {
        try {
            DocumentSnapshot doc = firestore.collection(COLLECTION_NAME).document(userId).get().get();
            if (!doc.exists()) {
                return Optional.empty();
            }
            return Optional.of(UserDocumentMapper.decode(doc.getId(), doc.getData()));
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot get user information", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot get user information: " + userId);
        }
    }

    @Override
    public Optional<User> updateProfile(String userId, UserUpdateDTO update) {
        Map<String, Object> fields = UserDocumentMapper.encode(update);
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(userId);
        try {
            User updated = firestore.runTransaction(transaction -> {
                DocumentSnapshot doc = transaction.get(docRef).get();
                if (!doc.exists()) {
                    return null;
                }
                transaction.update(docRef, fields);
                Map<String, Object> merged = new HashMap<>(doc.getData());
                merged.putAll(fields);
                return UserDocumentMapper.decode(doc.getId(), merged);
            }).get();
            return Optional.ofNullable(updated);
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot update user profile", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot update user profile: " + userId);
        }
    }
}
