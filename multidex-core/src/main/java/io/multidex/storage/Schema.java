package io.multidex.storage;

import io.multidex.container.UniqueFieldMap;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declared fields of a storage. The defaults container is the template every
 * new record is copied from.
 */
final class Schema {
    private final UniqueFieldMap defaults = new UniqueFieldMap();
    private final Map<String, FieldDefinition<?>> definitions = new LinkedHashMap<>();

    <T> void declare(FieldDefinition<T> definition) {
        defaults.add(definition.name(), definition.type(), definition.defaultValue(), definition.copier(), null);
        definitions.put(definition.name(), definition);
    }

    boolean has(String name) {
        return name != null && definitions.containsKey(name);
    }

    /**
     * @return the definition, or null if the field is not declared
     */
    FieldDefinition<?> definition(String name) {
        return name == null ? null : definitions.get(name);
    }

    Collection<FieldDefinition<?>> definitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    UniqueFieldMap newRecordFields() {
        return defaults.copy();
    }

    int size() {
        return definitions.size();
    }
}
