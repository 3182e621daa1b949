package com.listenpulse.ingestor.auth;

import com.listenpulse.ingestor.model.Credential;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable home of the OAuth token pair between executions. Writes replace the
 * whole record at once.
 */
public interface CredentialStore {

    Optional<Credential> load() throws IOException;

    void save(Credential credential) throws IOException;
}
