package com.logicsim.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.logicsim.expr.Assignment;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.primitive.MutableObjectBooleanMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.ObjectBooleanMaps;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Reads variable assignments from JSON: either one object such as
 * {@code {"A": true, "B": 0}} or an array of such objects.
 * Values may be JSON booleans or the integers 0 and 1; names are upper-cased.
 */
public class AssignmentJsonReader {
    private final JsonFactory factory = new JsonFactory();

    public ImmutableList<Assignment> read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new JsonParseException(parser, "No assignments in input");
            }

            MutableList<Assignment> assignments = Lists.mutable.empty();
            switch (token) {
                case START_OBJECT -> assignments.add(readObject(parser));
                case START_ARRAY -> {
                    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                        if (token != JsonToken.START_OBJECT) {
                            throw new JsonParseException(parser, "Expected an assignment object but got " + token);
                        }
                        assignments.add(readObject(parser));
                    }
                }
                default -> throw new JsonParseException(parser, "Expected an object or an array but got " + token);
            }
            return assignments.toImmutable();
        }
    }

    private Assignment readObject(JsonParser parser) throws IOException {
        MutableObjectBooleanMap<String> values = ObjectBooleanMaps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String name = parser.currentName().toUpperCase(Locale.ROOT);
            values.put(name, readValue(parser, parser.nextToken(), name));
        }

        return new Assignment(values.toImmutable());
    }

    private boolean readValue(JsonParser parser, JsonToken token, String name) throws IOException {
        return switch (token) {
            case VALUE_TRUE -> true;
            case VALUE_FALSE -> false;
            case VALUE_NUMBER_INT -> {
                long value = parser.getLongValue();
                if (value != 0 && value != 1) {
                    throw new JsonParseException(parser, "Value of " + name + " must be 0 or 1, got " + value);
                }
                yield value == 1;
            }
            default -> throw new JsonParseException(parser, "Value of " + name + " must be a boolean, got " + token);
        };
    }
}
