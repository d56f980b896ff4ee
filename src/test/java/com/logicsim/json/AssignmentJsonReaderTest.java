package com.logicsim.json;

import com.fasterxml.jackson.core.JsonParseException;
import com.logicsim.expr.Assignment;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AssignmentJsonReaderTest {
    private final AssignmentJsonReader reader = new AssignmentJsonReader();

    private ImmutableList<Assignment> read(String json) throws IOException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testSingleObject() throws IOException {
        ImmutableList<Assignment> assignments = read("{\"A\": true, \"B\": 0}");

        assertEquals(1, assignments.size());
        assertEquals(Assignment.of(Map.of("A", true, "B", false)), assignments.get(0));
    }

    @Test
    public void testArrayOfObjectsWithLowerCaseNames() throws IOException {
        ImmutableList<Assignment> assignments = read("[{\"a\": 1, \"b\": false}, {\"A\": false, \"B\": true}, {}]");

        assertEquals(3, assignments.size());
        assertEquals(Assignment.of(Map.of("A", true, "B", false)), assignments.get(0));
        assertEquals(Assignment.of(Map.of("A", false, "B", true)), assignments.get(1));
        assertEquals(Assignment.empty(), assignments.get(2));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"A\": 2}",
        "{\"A\": \"yes\"}",
        "{\"A\": null}",
        "[1, 2]",
        "\"A\"",
        ""
    })
    public void testInvalidInputIsRejected(String json) {
        assertThrows(JsonParseException.class, () -> read(json));
    }

    @Test
    public void testTruncatedInputIsRejected() {
        assertThrows(IOException.class, () -> read("[{\"A\": true}"));
    }
}
