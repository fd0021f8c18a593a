package com.gearcheck.models;

import com.gearcheck.matching.AugmentNormalizer;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One stack of an item in a storage container, as loaded from the inventory table.
 */
public final class InventoryEntry {
    private final int itemId;
    private final String name;
    private final String logName;
    private final int containerId;
    private final String containerName;
    private final String augmentText;
    private final int count;

    public InventoryEntry(int itemId, String name, String logName, int containerId,
                          String containerName, String augmentText, int count) {
        this.itemId = itemId;
        this.name = Objects.requireNonNull(name, "name");
        this.logName = logName != null ? logName : "";
        this.containerId = containerId;
        this.containerName = containerName != null ? containerName : "";
        this.augmentText = augmentText != null ? augmentText : "";
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1: " + count);
        }
        this.count = count;
    }

    public int getItemId() { return itemId; }

    public String getName() { return name; }

    public String getLogName() { return logName; }

    public int getContainerId() { return containerId; }

    public String getContainerName() { return containerName; }

    public String getAugmentText() { return augmentText; }

    public int getCount() { return count; }

    public boolean hasAugments() {
        return !augmentText.isEmpty();
    }

    public boolean hasLogName() {
        return !logName.isEmpty();
    }

    public String nameKey() {
        return name.toLowerCase(Locale.ROOT);
    }

    /** Lower-cased log name, or empty when the entry has none. */
    public String logNameKey() {
        return logName.toLowerCase(Locale.ROOT);
    }

    public Set<String> normalizedAugments() {
        return AugmentNormalizer.normalize(augmentText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InventoryEntry)) return false;
        InventoryEntry other = (InventoryEntry) o;
        return itemId == other.itemId
            && containerId == other.containerId
            && count == other.count
            && name.equals(other.name)
            && logName.equals(other.logName)
            && containerName.equals(other.containerName)
            && augmentText.equals(other.augmentText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId, containerId, augmentText);
    }

    @Override
    public String toString() {
        return name + " (" + containerName + ")" + (hasAugments() ? " [" + augmentText + "]" : "");
    }
}
