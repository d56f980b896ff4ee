package com.logicsim.store;

import org.tinylog.Logger;

import java.io.IOException;
import java.util.Optional;

/**
 * Remembers the most recently used expression between runs.
 */
public interface LastExpressionStore {

    String DEFAULT_EXPRESSION = "(A AND B) OR (NOT C)";

    Optional<String> load() throws IOException;

    void save(String expression) throws IOException;

    /**
     * @return the stored expression, or {@link #DEFAULT_EXPRESSION} when nothing usable is stored
     */
    default String loadOrDefault() {
        try {
            return load().orElse(DEFAULT_EXPRESSION);
        } catch (IOException e) {
            Logger.warn(e, "Could not read the last expression, using the default");
            return DEFAULT_EXPRESSION;
        }
    }
}
