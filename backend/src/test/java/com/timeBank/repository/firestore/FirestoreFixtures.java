package com.timeBank.repository.firestore;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.Transaction;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/** Mocked Firestore snapshots and a transaction runner that executes the body inline. */
final class FirestoreFixtures {

    private FirestoreFixtures() {
    }

    static QueryDocumentSnapshot document(String id, Map<String, Object> data) {
        QueryDocumentSnapshot doc = mock(QueryDocumentSnapshot.class);
        lenient().when(doc.exists()).thenReturn(true);
        lenient().when(doc.getId()).thenReturn(id);
        lenient().when(doc.getData()).thenReturn(new HashMap<>(data));
        return doc;
    }

    static DocumentSnapshot missingDocument() {
        DocumentSnapshot doc = mock(DocumentSnapshot.class);
        lenient().when(doc.exists()).thenReturn(false);
        return doc;
    }

    static Map<String, Object> taskData(String status, String assignedTo, String location, String createdAt) {
        Map<String, Object> data = new HashMap<>();
        data.put("title", "Errand");
        data.put("duration", 30L);
        data.put("credits_offered", 10L);
        data.put("task_type", "offer");
        data.put("location", location);
        data.put("created_by", "alice");
        data.put("assigned_to", assignedTo);
        data.put("status", status);
        data.put("created_at", createdAt);
        return data;
    }

    static ApiFuture<DocumentSnapshot> read(DocumentSnapshot doc) {
        return ApiFutures.immediateFuture(doc);
    }

    static ApiFuture<QuerySnapshot> results(QueryDocumentSnapshot... docs) {
        QuerySnapshot snapshot = mock(QuerySnapshot.class);
        List<QueryDocumentSnapshot> documents = Arrays.asList(docs);
        lenient().when(snapshot.getDocuments()).thenReturn(documents);
        return ApiFutures.immediateFuture(snapshot);
    }

    /** Runs every transaction body against {@code transaction}; a thrown body fails the future. */
    static void runTransactionsInline(Firestore firestore, Transaction transaction) {
        when(firestore.runTransaction(any())).thenAnswer(invocation -> {
            Transaction.Function<?> body = invocation.getArgument(0);
            try {
                return ApiFutures.immediateFuture(body.updateCallback(transaction));
            } catch (Exception e) {
                return ApiFutures.immediateFailedFuture(e);
            }
        });
    }
}
