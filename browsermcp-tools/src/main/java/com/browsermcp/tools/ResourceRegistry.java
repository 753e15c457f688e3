package com.browsermcp.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Readable resources advertised to protocol clients. The bridge currently ships none,
 * so {@code resources/list} answers an empty list and every read answers no contents.
 */
public final class ResourceRegistry {

    private final Map<String, Entry> resources;

    private record Entry(ResourceDefinition definition, Supplier<List<JsonNode>> reader) {
    }

    private ResourceRegistry(Map<String, Entry> resources) {
        this.resources = Collections.unmodifiableMap(resources);
    }

    public static ResourceRegistry empty() {
        return new ResourceRegistry(new LinkedHashMap<>());
    }

    public ResourceRegistry with(ResourceDefinition definition, Supplier<List<JsonNode>> reader) {
        Map<String, Entry> copy = new LinkedHashMap<>(resources);
        copy.put(definition.getUri(), new Entry(definition, reader));
        return new ResourceRegistry(copy);
    }

    public List<ResourceDefinition> definitions() {
        List<ResourceDefinition> defs = new ArrayList<>();
        resources.values().forEach(e -> defs.add(e.definition()));
        return defs;
    }

    /** Contents for {@code uri}, or empty when no resource has that uri. */
    public Optional<List<JsonNode>> read(String uri) {
        Entry entry = uri != null ? resources.get(uri) : null;
        return entry != null ? Optional.of(entry.reader().get()) : Optional.empty();
    }

    public int size() {
        return resources.size();
    }
}
