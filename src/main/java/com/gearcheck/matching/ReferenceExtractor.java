package com.gearcheck.matching;

import com.gearcheck.models.Reference;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds item references in equipment-swap script text.
 *
 * Recognized forms, matched in this order:
 *   1. { name = "Item", augments = { ... } }    -> Reference("Item", raw text inside augments braces)
 *   2. slot = "Item"   /   gear.Var = 'Item'     -> Reference("Item", "")
 *
 * Tokens consumed by a form-1 block are not revisited by form 2, and an assignment whose key is
 * "name" never counts as a standalone reference. Field keywords are case-insensitive.
 */
public class ReferenceExtractor {

    private static final Set<String> NON_ITEM_VALUES = Set.of(
        "none", "empty", "true", "false", "nil",
        "normal", "acc", "dt", "pdt", "mdt",
        "idle", "engaged", "defense", "offense",
        "physical", "magical", "hybrid"
    );

    private static final Set<String> SLOT_NAMES = Set.of(
        "main", "sub", "range", "ammo", "head", "neck",
        "ear1", "ear2", "left_ear", "right_ear",
        "body", "hands", "ring1", "ring2", "left_ring", "right_ring",
        "back", "waist", "legs", "feet"
    );

    public Set<Reference> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptySet();
        }
        List<ScriptToken> tokens = ScriptTokenizer.tokenize(text);
        Set<Reference> references = new LinkedHashSet<>();
        boolean[] consumed = new boolean[tokens.size()];

        for (int i = 0; i < tokens.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            BlockMatch block = matchAugmentedBlock(text, tokens, i);
            if (block == null) {
                continue;
            }
            for (int j = i; j < block.endIndex; j++) {
                consumed[j] = true;
            }
            if (isValidItemName(block.reference.getName())) {
                references.add(block.reference);
            }
        }

        for (int i = 0; i < tokens.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            Reference simple = matchAssignment(tokens, i);
            if (simple != null && isValidItemName(simple.getName())) {
                references.add(simple);
            }
        }
        return Collections.unmodifiableSet(references);
    }

    /**
     * Union of the references in every text. The input list is not modified.
     */
    public Set<Reference> extractAll(List<String> texts) {
        Set<Reference> all = new LinkedHashSet<>();
        if (texts == null) {
            return all;
        }
        for (String text : texts) {
            all.addAll(extract(text));
        }
        return Collections.unmodifiableSet(all);
    }

    /**
     * Matches {@code { name = "X", augments = { ... } }} starting at an opening brace.
     * An optional trailing comma before the closing brace is accepted.
     */
    BlockMatch matchAugmentedBlock(String text, List<ScriptToken> tokens, int index) {
        if (!typeAt(tokens, index, ScriptToken.Type.OPEN_BRACE)
            || !keywordAt(tokens, index + 1, "name")
            || !typeAt(tokens, index + 2, ScriptToken.Type.ASSIGN)
            || !typeAt(tokens, index + 3, ScriptToken.Type.STRING)
            || !typeAt(tokens, index + 4, ScriptToken.Type.COMMA)
            || !keywordAt(tokens, index + 5, "augments")
            || !typeAt(tokens, index + 6, ScriptToken.Type.ASSIGN)
            || !typeAt(tokens, index + 7, ScriptToken.Type.OPEN_BRACE)) {
            return null;
        }
        int listClose = -1;
        for (int j = index + 8; j < tokens.size(); j++) {
            ScriptToken token = tokens.get(j);
            if (token.is(ScriptToken.Type.OPEN_BRACE)) {
                return null;
            }
            if (token.is(ScriptToken.Type.CLOSE_BRACE)) {
                listClose = j;
                break;
            }
        }
        if (listClose < 0) {
            return null;
        }
        int blockClose = listClose + 1;
        if (typeAt(tokens, blockClose, ScriptToken.Type.COMMA)) {
            blockClose++;
        }
        if (!typeAt(tokens, blockClose, ScriptToken.Type.CLOSE_BRACE)) {
            return null;
        }
        String name = tokens.get(index + 3).getText().trim();
        String augments = text.substring(tokens.get(index + 7).getEnd(), tokens.get(listClose).getStart()).trim();
        return new BlockMatch(new Reference(name, augments), blockClose + 1);
    }

    /**
     * Matches {@code key = "X"} at an identifier. Returns null for non-assignments and for the
     * "name" key.
     */
    Reference matchAssignment(List<ScriptToken> tokens, int index) {
        if (!typeAt(tokens, index, ScriptToken.Type.IDENTIFIER)
            || !typeAt(tokens, index + 1, ScriptToken.Type.ASSIGN)
            || !typeAt(tokens, index + 2, ScriptToken.Type.STRING)) {
            return null;
        }
        if (tokens.get(index).isIdentifier("name")) {
            return null;
        }
        return Reference.of(tokens.get(index + 2).getText().trim());
    }

    public static boolean isValidItemName(String name) {
        if (name == null || name.length() < 2) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (NON_ITEM_VALUES.contains(lower)) {
            return false;
        }
        if (name.indexOf('(') >= 0 || name.indexOf(')') >= 0) {
            return false;
        }
        if (isAllDigits(name)) {
            return false;
        }
        return !SLOT_NAMES.contains(lower);
    }

    private static boolean isAllDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean typeAt(List<ScriptToken> tokens, int index, ScriptToken.Type type) {
        return index < tokens.size() && tokens.get(index).is(type);
    }

    private static boolean keywordAt(List<ScriptToken> tokens, int index, String keyword) {
        return index < tokens.size() && tokens.get(index).isIdentifier(keyword);
    }

    static final class BlockMatch {
        final Reference reference;
        final int endIndex;

        BlockMatch(Reference reference, int endIndex) {
            this.reference = reference;
            this.endIndex = endIndex;
        }
    }
}
