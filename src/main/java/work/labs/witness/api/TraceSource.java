package work.labs.witness.api;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Where the raw trace text comes from (a file written by the backend run, or text in memory).
 */
public record TraceSource(Optional<Path> file, Optional<String> text) {
    public TraceSource {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(text, "text");
        if (file.isEmpty() == text.isEmpty()) {
            throw new IllegalArgumentException("Exactly one of file or text must be present.");
        }
    }

    public static TraceSource forFile(Path path) {
        return new TraceSource(Optional.of(path), Optional.empty());
    }

    public static TraceSource forText(String text) {
        return new TraceSource(Optional.empty(), Optional.of(text));
    }

    /**
     * Opens a fresh reader on every call so the trace can be read more than once.
     */
    public Supplier<Reader> opener() {
        if (text.isPresent()) {
            String content = text.get();
            return () -> new StringReader(content);
        }
        Path path = file.get();
        return () -> {
            try {
                return Files.newBufferedReader(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read trace: " + path, ex);
            }
        };
    }

    public String display() {
        return file.map(Path::toString).orElse("<text>");
    }
}
