package com.gearcheck.models;

import com.gearcheck.matching.AugmentNormalizer;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * An item mention found in script text.
 * Two references are equal when their lower-cased names and raw augment text match.
 */
public final class Reference {
    private final String name;
    private final String augmentText;

    public Reference(String name, String augmentText) {
        this.name = Objects.requireNonNull(name, "name");
        this.augmentText = augmentText != null ? augmentText : "";
    }

    public static Reference of(String name) {
        return new Reference(name, "");
    }

    public String getName() {
        return name;
    }

    public String getAugmentText() {
        return augmentText;
    }

    public boolean hasAugments() {
        return !augmentText.isEmpty();
    }

    public String nameKey() {
        return name.toLowerCase(Locale.ROOT);
    }

    public Set<String> normalizedAugments() {
        return AugmentNormalizer.normalize(augmentText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference other = (Reference) o;
        return nameKey().equals(other.nameKey()) && augmentText.equals(other.augmentText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nameKey(), augmentText);
    }

    @Override
    public String toString() {
        return hasAugments() ? name + " {" + augmentText + "}" : name;
    }
}
