package com.listenpulse.ingestor.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listenpulse.ingestor.config.ObjectMappers;
import com.listenpulse.ingestor.model.Credential;
import com.listenpulse.ingestor.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Keeps the credential blob as a small JSON object in the {@link ObjectStore}.
 *
 * Path format:
 *   secrets/spotify_token
 */
public class ObjectStoreCredentialStore implements CredentialStore {

    private static final Logger logger = LoggerFactory.getLogger(ObjectStoreCredentialStore.class);

    public static final String DEFAULT_KEY = "secrets/spotify_token";

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final String key;

    public ObjectStoreCredentialStore(ObjectStore objectStore) {
        this(objectStore, DEFAULT_KEY);
    }

    public ObjectStoreCredentialStore(ObjectStore objectStore, String key) {
        this.objectStore = objectStore;
        this.key = key;
        this.objectMapper = ObjectMappers.create();
    }

    @Override
    public Optional<Credential> load() throws IOException {
        Optional<byte[]> content = objectStore.get(key);
        if (content.isEmpty()) {
            logger.info("No stored credentials at {}", objectStore.describe(key));
            return Optional.empty();
        }
        Credential credential = objectMapper.readValue(content.get(), Credential.class);
        logger.info("Loaded credentials from {} (expires at {})", objectStore.describe(key), credential.expiresAt());
        return Optional.of(credential);
    }

    @Override
    public void save(Credential credential) throws IOException {
        byte[] payload = objectMapper.writeValueAsBytes(credential);
        objectStore.put(key, payload, "application/json");
        logger.info("Saved credentials to {} (expires at {})", objectStore.describe(key), credential.expiresAt());
    }
}
