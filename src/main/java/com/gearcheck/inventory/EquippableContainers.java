package com.gearcheck.inventory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Container ids whose contents can be equipped, with their labels.
 * Only entries stored in one of these containers are compared when filtering is on.
 */
public final class EquippableContainers {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final Map<Integer, String> labels;

    private EquippableContainers(Map<Integer, String> labels) {
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * The eight wardrobes. Main inventory is left out because it mostly holds consumables.
     */
    public static EquippableContainers defaults() {
        Map<Integer, String> map = new LinkedHashMap<>();
        map.put(8, "wardrobe");
        map.put(10, "wardrobe2");
        map.put(11, "wardrobe3");
        map.put(12, "wardrobe4");
        map.put(13, "wardrobe5");
        map.put(14, "wardrobe6");
        map.put(15, "wardrobe7");
        map.put(16, "wardrobe8");
        return new EquippableContainers(map);
    }

    public static EquippableContainers of(Map<Integer, String> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("At least one equippable container is required");
        }
        return new EquippableContainers(labels);
    }

    /**
     * Reads a JSON object of {@code "id": "label"} pairs, e.g. {@code {"8": "wardrobe"}}.
     */
    public static EquippableContainers fromJson(Path path) throws IOException {
        Map<Integer, String> parsed = mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<Integer, String>>() {});
        return of(parsed);
    }

    public boolean contains(int containerId) {
        return labels.containsKey(containerId);
    }

    public String labelFor(int containerId) {
        return labels.get(containerId);
    }

    public Map<Integer, String> asMap() {
        return labels;
    }

    public int size() {
        return labels.size();
    }
}
