package dumb.tactic;

import dumb.tactic.util.Json;
import dumb.tactic.util.Log;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends each {@link ProofStore.Step} as one JSON document per line.
 */
public class JsonProofStore implements ProofStore {
    private final Path file;
    private final BufferedWriter out;

    public JsonProofStore(Path file) {
        this.file = file;
        try {
            var dir = file.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            out = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to open proof store " + file, e);
        }
        Log.message("Recording proof steps to " + file);
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void record(Step step) {
        try {
            out.write(Json.str(step));
            out.newLine();
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to record step " + step.step() + " to " + file, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            out.close();
        } catch (IOException e) {
            Log.error("Error closing proof store " + file, e);
        }
    }
}
