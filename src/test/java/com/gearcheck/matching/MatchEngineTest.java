package com.gearcheck.matching;

import com.gearcheck.inventory.EquippableContainers;
import com.gearcheck.inventory.InventoryLoader;
import com.gearcheck.models.InventoryEntry;
import com.gearcheck.models.Reference;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MatchEngineTest {

    private final MatchEngine engine = new MatchEngine();

    private static InventoryEntry entry(String name, String augments) {
        return new InventoryEntry(1, name, "", 8, "wardrobe", augments, 1);
    }

    @Test
    void unconditionalReferenceCoversAnyCopy() {
        Set<Reference> refs = Set.of(Reference.of("Hecatomb Cape"));
        assertTrue(engine.isCovered(entry("hecatomb cape", ""), refs));
        assertTrue(engine.isCovered(entry("HECATOMB CAPE", "STR+5; DEX+5"), refs));
        assertFalse(engine.isCovered(entry("Hecatomb Mantle", ""), refs));
    }

    @Test
    void augmentedReferenceRequiresSubset() {
        Set<Reference> refs = Set.of(new Reference("X", "Accuracy+5"));
        assertTrue(engine.isCovered(entry("X", "{\"Accuracy+5\",\"Store TP+3\"}"), refs));
        assertTrue(engine.isCovered(entry("X", "Accuracy+5"), refs));
        assertFalse(engine.isCovered(entry("X", "Store TP+3"), refs));
        assertFalse(engine.isCovered(entry("X", ""), refs));
    }

    @Test
    void augmentsCompareAsLiteralStrings() {
        Set<Reference> refs = Set.of(new Reference("X", "Accuracy+5"));
        assertFalse(engine.isCovered(entry("X", "Accuracy+6"), refs));
        assertTrue(engine.isCovered(entry("X", "Accuracy+3; Accuracy+5"), refs));
    }

    @Test
    void quotedSemicolonListCoversTableCopy() {
        Set<Reference> refs = Set.of(new Reference("X", "\"Mag. Acc.+20; Mag. Dmg.+10\""));
        assertTrue(engine.isCovered(entry("X", "Mag. Acc.+20; Mag. Dmg.+10"), refs));
        assertFalse(engine.isCovered(entry("X", "Mag. Acc.+20"), refs));
    }

    @Test
    void systemAugmentsDoNotBlockCoverage() {
        Set<Reference> refs = Set.of(new Reference("X", "'Accuracy+5'"));
        assertTrue(engine.isCovered(entry("X", "System: Augment Points: 350; Accuracy+5"), refs));
    }

    @Test
    void logNameIsSecondaryMatchTarget() {
        InventoryEntry crest = new InventoryEntry(1, "S. Kindred Crest", "Sacred Kindred's Crest", 8, "wardrobe", "", 1);
        assertTrue(engine.isCovered(crest, Set.of(Reference.of("Sacred Kindred's Crest"))));
        assertTrue(engine.isCovered(crest, Set.of(Reference.of("s. kindred crest"))));
        assertFalse(engine.isCovered(crest, Set.of(Reference.of("Kindred's Crest"))));
    }

    @Test
    void anyMatchingReferenceIsEnough() {
        Set<Reference> refs = Set.of(
            new Reference("X", "Path: B"),
            new Reference("X", "Path: A")
        );
        assertTrue(engine.isCovered(entry("X", "Path: A; HP+20"), refs));
    }

    @Test
    void noReferencesMeansNothingCovered() {
        assertFalse(engine.isCovered(entry("X", ""), Set.of()));
        List<InventoryEntry> entries = List.of(entry("A1", ""), entry("B1", ""));
        assertEquals(entries, engine.findOrphans(entries, Set.of()));
    }

    @Test
    void findOrphansKeepsInputOrder() {
        List<InventoryEntry> entries = List.of(
            entry("Zeta Ring", ""),
            entry("Aeneas", ""),
            entry("Alpha Ring", ""),
            new InventoryEntry(2, "S. Kindred Crest", "Sacred Kindred's Crest", 10, "wardrobe2", "", 1)
        );
        Set<Reference> refs = Set.of(Reference.of("Aeneas"), Reference.of("Sacred Kindred's Crest"));
        List<InventoryEntry> orphans = engine.findOrphans(entries, refs);
        assertEquals(List.of(entries.get(0), entries.get(2)), orphans);
    }

    @Test
    void scriptsAgainstInventoryEndToEnd() {
        String lua = "sets.engaged = {\n"
            + "    main=\"Aeneas\",\n"
            + "    sub={ name=\"Genbu's Shield\", augments={\"Path: A\"} },\n"
            + "}\n";
        String csv = "item_id,item_name,container_id,container_name,augments\n"
            + "20695,Aeneas,8,wardrobe,\n"
            + "12345,Genbu's Shield,10,wardrobe2,\"{\"\"Path: A\"\",\"\"HP+20\"\"}\"\n"
            + "12345,Genbu's Shield,11,wardrobe3,\"{\"\"HP+20\"\"}\"\n"
            + "4096,Fire Crystal,0,inventory,\n";

        Set<Reference> refs = new ReferenceExtractor().extractAll(List.of(lua));
        List<InventoryEntry> entries = new InventoryLoader(EquippableContainers.defaults())
            .load(new StringReader(csv), true);
        List<InventoryEntry> orphans = engine.findOrphans(entries, refs);

        assertEquals(3, entries.size());
        assertEquals(1, orphans.size());
        assertEquals("wardrobe3", orphans.get(0).getContainerName());
        assertEquals("{\"HP+20\"}", orphans.get(0).getAugmentText());
    }
}
