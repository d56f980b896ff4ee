package com.logicsim.expr;

import org.eclipse.collections.api.map.primitive.ImmutableObjectBooleanMap;
import org.eclipse.collections.api.map.primitive.MutableObjectBooleanMap;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.impl.factory.SortedSets;
import org.eclipse.collections.impl.factory.primitive.ObjectBooleanMaps;

import java.util.Map;
import java.util.Objects;

/**
 * Values for the variables of an expression. Immutable.
 */
public record Assignment(ImmutableObjectBooleanMap<String> values) {

    public Assignment {
        Objects.requireNonNull(values, "values");
    }

    public static Assignment empty() {
        return new Assignment(ObjectBooleanMaps.immutable.empty());
    }

    public static Assignment of(Map<String, Boolean> values) {
        MutableObjectBooleanMap<String> map = ObjectBooleanMaps.mutable.empty();
        values.forEach((name, value) -> map.put(name, Objects.requireNonNull(value, name)));
        return new Assignment(map.toImmutable());
    }

    public Assignment with(String name, boolean value) {
        MutableObjectBooleanMap<String> map = ObjectBooleanMaps.mutable.empty();
        values.forEachKeyValue(map::put);
        map.put(name, value);
        return new Assignment(map.toImmutable());
    }

    /**
     * @throws UndefinedVariableException if {@code name} has no value
     */
    public boolean valueOf(String name) {
        if (!values.containsKey(name)) {
            throw new UndefinedVariableException(name);
        }
        return values.get(name);
    }

    public boolean covers(String name) {
        return values.containsKey(name);
    }

    public ImmutableSortedSet<String> variables() {
        return SortedSets.immutable.withAll(values.keysView());
    }

    @Override
    public String toString() {
        return variables()
                .collect(name -> name + "=" + (values.get(name) ? 1 : 0))
                .makeString("{", ", ", "}");
    }
}
