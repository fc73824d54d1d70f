package com.taskpilot.core.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskpilot.core.model.CheckpointLedger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Read-only access to a checkpoint file. Never runs crash recovery, so it is safe
 * to use against the ledger of a live orchestrator.
 */
public final class CheckpointFiles {

    private CheckpointFiles() {}

    public static ObjectMapper mapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the ledger, or empty if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static Optional<CheckpointLedger> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper().readValue(file.toFile(), CheckpointLedger.class));
    }
}
