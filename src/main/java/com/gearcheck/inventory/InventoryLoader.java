package com.gearcheck.inventory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gearcheck.models.InventoryEntry;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads inventory rows from a CSV table with a header row.
 *
 * Columns: item_id, item_name, container_id, container_name (required);
 * augments, count, item_name_log (optional, default "", 1, "").
 */
public class InventoryLoader {

    public static final String COL_ITEM_ID = "item_id";
    public static final String COL_ITEM_NAME = "item_name";
    public static final String COL_CONTAINER_ID = "container_id";
    public static final String COL_CONTAINER_NAME = "container_name";
    public static final String COL_AUGMENTS = "augments";
    public static final String COL_COUNT = "count";
    public static final String COL_ITEM_NAME_LOG = "item_name_log";

    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper;
    private final EquippableContainers containers;

    public InventoryLoader(EquippableContainers containers) {
        this.containers = containers != null ? containers : EquippableContainers.defaults();
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public EquippableContainers getContainers() {
        return containers;
    }

    public List<InventoryEntry> load(Path csvPath) {
        return load(csvPath, true);
    }

    public List<InventoryEntry> load(Path csvPath, boolean equippableOnly) {
        try (BufferedReader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            reader.mark(1);
            if (reader.read() != BOM) {
                reader.reset();
            }
            return load(reader, equippableOnly);
        } catch (IOException e) {
            throw InventoryLoadException.unreadable("Cannot read inventory " + csvPath + ": " + e.getMessage(), e);
        }
    }

    public List<InventoryEntry> load(Reader source) {
        return load(source, true);
    }

    /**
     * Parses every row, then keeps those in an equippable container when {@code equippableOnly}
     * is set. Required fields are validated on all rows, filtered or not.
     */
    public List<InventoryEntry> load(Reader source, boolean equippableOnly) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<InventoryEntry> entries = new ArrayList<>();
        int rowNumber = 0;
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(source)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                rowNumber++;
                InventoryEntry entry = toEntry(row, rowNumber);
                if (equippableOnly && !containers.contains(entry.getContainerId())) {
                    continue;
                }
                entries.add(entry);
            }
        } catch (JsonProcessingException e) {
            throw InventoryLoadException.malformedRow(rowNumber + 1, e.getOriginalMessage());
        } catch (IOException e) {
            throw InventoryLoadException.unreadable("Cannot read inventory: " + e.getMessage(), e);
        }
        return entries;
    }

    private InventoryEntry toEntry(Map<String, String> row, int rowNumber) {
        int itemId = requireInt(row, COL_ITEM_ID, rowNumber);
        String itemName = require(row, COL_ITEM_NAME, rowNumber);
        if (itemName.isBlank()) {
            throw InventoryLoadException.malformedRow(rowNumber, "blank " + COL_ITEM_NAME);
        }
        int containerId = requireInt(row, COL_CONTAINER_ID, rowNumber);
        String containerName = require(row, COL_CONTAINER_NAME, rowNumber);

        String augments = optional(row, COL_AUGMENTS);
        String logName = optional(row, COL_ITEM_NAME_LOG);
        String countRaw = optional(row, COL_COUNT);
        int count = 1;
        if (!countRaw.isEmpty()) {
            count = parseInt(countRaw, COL_COUNT, rowNumber);
            if (count < 1) {
                throw InventoryLoadException.malformedRow(rowNumber, COL_COUNT + " must be at least 1, got " + count);
            }
        }
        return new InventoryEntry(itemId, itemName, logName, containerId, containerName, augments, count);
    }

    private static String require(Map<String, String> row, String column, int rowNumber) {
        String value = row.get(column);
        if (value == null) {
            throw InventoryLoadException.malformedRow(rowNumber, "missing " + column);
        }
        return value;
    }

    private static int requireInt(Map<String, String> row, String column, int rowNumber) {
        return parseInt(require(row, column, rowNumber), column, rowNumber);
    }

    private static int parseInt(String value, String column, int rowNumber) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw InventoryLoadException.malformedRow(rowNumber, column + " is not an integer: '" + value + "'");
        }
    }

    private static String optional(Map<String, String> row, String column) {
        String value = row.get(column);
        return value != null ? value.trim() : "";
    }
}
