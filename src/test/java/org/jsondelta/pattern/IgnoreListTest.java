package org.jsondelta.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.jsondelta.engine.ComparisonResult;
import org.jsondelta.engine.DiffKind;
import org.jsondelta.engine.DiffRecord;
import org.jsondelta.engine.JsonDiffEngine;
import org.jsondelta.path.IdentityAddress;
import org.jsondelta.value.BsonJson;
import org.junit.jupiter.api.Test;

class IgnoreListTest {
    private static final ComparisonResult RESULT = new JsonDiffEngine().compare(
        BsonJson.parse("{\"items\": [{\"id\": \"a\", \"v\": 1}, {\"id\": \"b\", \"v\": 2}]}"),
        BsonJson.parse("{\"items\": [{\"id\": \"b\", \"v\": 3}, {\"id\": \"a\", \"v\": 1}, {\"id\": \"c\", \"v\": 9}]}"));

    private static DiffRecord diff(DiffKind kind) {
        return RESULT.diffs().stream().filter(diff -> diff.kind() == kind).findFirst().orElseThrow();
    }

    @Test
    void partitionsByPattern() {
        IgnoreList ignoreList = IgnoreList.of(List.of("items.*.v"));

        IgnoreList.Partition partition = ignoreList.partition(RESULT.diffs());

        assertEquals(List.of(diff(DiffKind.ADDED)), partition.kept());
        assertEquals(List.of(diff(DiffKind.CHANGED)), partition.ignored());
    }

    @Test
    void patternsAlsoMatchPositionAddresses() {
        IgnoreList ignoreList = IgnoreList.of(List.of("items[1].v"));

        assertTrue(ignoreList.isIgnored(diff(DiffKind.CHANGED)));
        assertFalse(ignoreList.isIgnored(diff(DiffKind.ADDED)));
    }

    @Test
    void exactAddressesHideOnlyThatNode() {
        IgnoreList ignoreList = new IgnoreList();
        ignoreList.ignore(IdentityAddress.parse("items[id=c]"));

        assertTrue(ignoreList.isIgnored(diff(DiffKind.ADDED)));
        assertFalse(ignoreList.isIgnored(IdentityAddress.parse("items[id=c].v")));
        assertEquals(1, ignoreList.ignoredAddresses().size());
    }

    @Test
    void subtreesCanBeIgnoredAndRestored() {
        IgnoreList ignoreList = new IgnoreList();
        IdentityAddress element = IdentityAddress.parse("items[id=b]");

        AddressPattern stored = ignoreList.ignoreSubtree(element);

        assertEquals("items[id=b]*", stored.text());
        assertTrue(ignoreList.isIgnored(diff(DiffKind.CHANGED)));
        assertTrue(ignoreList.restore(element));
        assertFalse(ignoreList.isIgnored(diff(DiffKind.CHANGED)));
        assertFalse(ignoreList.restore(element));
        assertTrue(ignoreList.isEmpty());
    }

    @Test
    void refusesToIgnoreTheRoot() {
        IgnoreList ignoreList = new IgnoreList();

        assertThrows(IllegalArgumentException.class, () -> ignoreList.ignoreSubtree(IdentityAddress.root()));
    }

    @Test
    void keepsPatternsUniqueAndInInsertionOrder() {
        IgnoreList ignoreList = IgnoreList.of(List.of("b", "a", "b"));

        assertEquals(List.of("b", "a"), ignoreList.patterns());
        assertTrue(ignoreList.removePattern("b"));
        assertFalse(ignoreList.removePattern("b"));

        ignoreList.ignore(IdentityAddress.parse("x"));
        ignoreList.clear();
        assertTrue(ignoreList.isEmpty());
    }

    @Test
    void rejectsInvalidPatternsUpFront() {
        assertThrows(IllegalArgumentException.class, () -> IgnoreList.of(List.of("items[")));
    }
}
