package com.logicsim.store;

import org.tinylog.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps the last expression as the whole content of a UTF-8 text file.
 */
public class FileLastExpressionStore implements LastExpressionStore {
    public static final String DEFAULT_FILE_NAME = ".last_expr";

    private final Path file;

    public FileLastExpressionStore() {
        this(Path.of(DEFAULT_FILE_NAME));
    }

    public FileLastExpressionStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    @Override
    public Optional<String> load() throws IOException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8).strip();
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    @Override
    public void save(String expression) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, expression.strip(), StandardCharsets.UTF_8);
        Logger.debug("Saved last expression to {}", file);
    }
}
