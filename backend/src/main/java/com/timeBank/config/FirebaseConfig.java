package com.timeBank.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.cloud.FirestoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Firebase Admin SDK wiring. Firestore holds users, tasks and the credit ledger;
 * Firebase Authentication verifies bearer tokens.
 */
@Slf4j
@Configuration
public class FirebaseConfig {

    @Value("${firebase.service-account:classpath:serviceAccountKey.json}")
    private String serviceAccountPath;

    @Value("${firebase.project-id:}")
    private String projectId;

    @Bean
    public FirebaseApp firebaseApp() throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            return FirebaseApp.getInstance();
        }

        FirebaseOptions.Builder options = FirebaseOptions.builder()
                .setCredentials(resolveCredentials());
        if (!projectId.isBlank()) {
            options.setProjectId(projectId);
        }

        FirebaseApp app = FirebaseApp.initializeApp(options.build());
        log.info("Firebase Admin SDK initialization completed (project={})", app.getOptions().getProjectId());
        return app;
    }

    @Bean
    public Firestore firestore(FirebaseApp firebaseApp) {
        return FirestoreClient.getFirestore(firebaseApp);
    }

    @Bean
    public FirebaseAuth firebaseAuth(FirebaseApp firebaseApp) {
        return FirebaseAuth.getInstance(firebaseApp);
    }

    private GoogleCredentials resolveCredentials() throws IOException {
        try (InputStream serviceAccount = resolveServiceAccount()) {
            if (serviceAccount != null) {
                return GoogleCredentials.fromStream(serviceAccount);
            }
        }
        log.warn("Service account {} not found, falling back to application default credentials",
                serviceAccountPath);
        return GoogleCredentials.getApplicationDefault();
    }

    private InputStream resolveServiceAccount() {
        if (serviceAccountPath.startsWith("file:")) {
            String filePath = serviceAccountPath.substring(5);
            try {
                return new FileInputStream(filePath);
            } catch (FileNotFoundException e) {
                log.warn("File not found: {}", filePath);
                return null;
            }
        } else if (serviceAccountPath.startsWith("classpath:")) {
            String resourceName = serviceAccountPath.substring(10);
            return getClass().getClassLoader().getResourceAsStream(resourceName);
        }
        return getClass().getClassLoader().getResourceAsStream("serviceAccountKey.json");
    }
}
