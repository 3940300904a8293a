package org.jsondelta.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.jsondelta.path.IdentityKey;
import org.jsondelta.value.BsonJson;
import org.jsondelta.value.JsonArray;
import org.junit.jupiter.api.Test;

class IdentityKeyDetectorTest {
    private final IdentityKeyDetector detector = new IdentityKeyDetector();

    private static JsonArray array(String json) {
        return (JsonArray) BsonJson.parse(json);
    }

    @Test
    void findsSimpleKeyPresentAndUniqueOnBothSides() {
        Optional<IdentityKey> key = detector.detect(
            array("[{\"id\": \"a\", \"v\": 1}, {\"id\": \"b\", \"v\": 2}]"),
            array("[{\"id\": \"b\", \"v\": 3}, {\"id\": \"a\", \"v\": 1}, {\"id\": \"c\", \"v\": 9}]"));

        assertEquals(Optional.of(IdentityKey.of("id")), key);
    }

    @Test
    void neverReportsANonUniqueFieldAlone() {
        JsonArray elements = array("[{\"a\": 1, \"b\": \"x\"}, {\"a\": 1, \"b\": \"y\"}]");

        assertEquals(Optional.of(IdentityKey.of("b")), detector.detect(elements, elements));
    }

    @Test
    void fallsBackToCompositeKeysWhenNoSingleFieldIsUnique() {
        JsonArray elements = array("""
            [{"sku": "x", "rev": 1, "qty": 5},
             {"sku": "x", "rev": 2, "qty": 5},
             {"sku": "y", "rev": 1, "qty": 5}]
            """);

        Optional<IdentityKey> key = detector.detect(elements, elements);

        assertEquals(Optional.of(IdentityKey.of("rev", "sku")), key);
        assertTrue(key.orElseThrow().isComposite());
    }

    @Test
    void usesTriplesOnlyWhenPairsAreNotEnough() {
        JsonArray elements = array("""
            [{"a": 1, "b": 1, "c": 1},
             {"a": 1, "b": 1, "c": 2},
             {"a": 1, "b": 2, "c": 1},
             {"a": 2, "b": 1, "c": 1}]
            """);

        assertEquals(Optional.of(IdentityKey.of("a", "b", "c")), detector.detect(elements, elements));

        IdentityKeyDetector pairsOnly = new IdentityKeyDetector(DetectorSettings.builder().maxCompositeSize(2).build());
        assertTrue(pairsOnly.detect(elements, elements).isEmpty());
    }

    @Test
    void skipsArraysThatAreNotAllObjects() {
        assertTrue(detector.detect(array("[1, 2, 3]"), array("[3, 2, 1]")).isEmpty());
        assertTrue(detector.detect(array("[{\"id\": 1}, [2]]"), array("[{\"id\": 1}, {\"id\": 2}]")).isEmpty());
    }

    @Test
    void skipsArraysSmallerThanTheMinimumOnBothSides() {
        assertTrue(detector.detect(array("[{\"id\": 1}]"), array("[{\"id\": 2}]")).isEmpty());
        assertEquals(
            Optional.of(IdentityKey.of("id")),
            detector.detect(array("[{\"id\": 1}]"), array("[{\"id\": 1}, {\"id\": 2}]")));
        assertTrue(detector.detect(null, null).isEmpty());
    }

    @Test
    void treatsMissingSideAsEmpty() {
        assertEquals(
            Optional.of(IdentityKey.of("id")),
            detector.detect(array("[{\"id\": 1}, {\"id\": 2}]"), null));
    }

    @Test
    void requiresOverlapBetweenSides() {
        JsonArray left = array("[{\"id\": 1}, {\"id\": 2}, {\"id\": 3}, {\"id\": 4}]");
        JsonArray right = array("[{\"id\": 5}, {\"id\": 6}, {\"id\": 7}, {\"id\": 8}]");

        assertTrue(detector.detect(left, right).isEmpty());

        IdentityKeyDetector lenient = new IdentityKeyDetector(DetectorSettings.builder().minOverlapRatio(0.0).build());
        assertEquals(Optional.of(IdentityKey.of("id")), lenient.detect(left, right));
    }

    @Test
    void requiresKeyOnEveryElementWithStringOrNumberValues() {
        JsonArray missing = array("[{\"id\": 1, \"n\": \"a\"}, {\"n\": \"b\"}]");
        assertEquals(Optional.of(IdentityKey.of("n")), detector.detect(missing, missing));

        JsonArray flags = array("[{\"on\": true}, {\"on\": false}]");
        assertTrue(detector.detect(flags, flags).isEmpty());
    }

    @Test
    void prefersFirstFieldByNameUnlessPreferredKeysSaySo() {
        JsonArray elements = array("[{\"uuid\": \"u1\", \"seq\": 1}, {\"uuid\": \"u2\", \"seq\": 2}]");

        assertEquals(Optional.of(IdentityKey.of("seq")), detector.detect(elements, elements));

        IdentityKeyDetector preferring = new IdentityKeyDetector(
            DetectorSettings.builder().preferredKeys(List.of("uuid", "id")).build());
        assertEquals(Optional.of(IdentityKey.of("uuid")), preferring.detect(elements, elements));
    }

    @Test
    void ordersCandidatesIndependentlyOfSideAndDeclarationOrder() {
        JsonArray declaredAb = array("[{\"a\": 1, \"b\": 1}, {\"a\": 2, \"b\": 2}]");
        JsonArray declaredBa = array("[{\"b\": 1, \"a\": 1}, {\"b\": 2, \"a\": 2}]");

        assertEquals(List.of("a", "b"), detector.candidateFields(declaredAb, declaredBa));
        assertEquals(List.of("a", "b"), detector.candidateFields(declaredBa, declaredAb));
        assertEquals(detector.detect(declaredAb, declaredBa), detector.detect(declaredBa, declaredAb));

        IdentityKeyDetector preferring = new IdentityKeyDetector(
            DetectorSettings.builder().preferredKeys(List.of("b")).build());
        assertEquals(List.of("b", "a"), preferring.candidateFields(declaredAb, declaredBa));
    }

    @Test
    void rejectsKeysWhoseValuesShareTheSameText() {
        JsonArray mixed = array("[{\"id\": 1}, {\"id\": \"1\"}]");
        assertTrue(detector.detect(mixed, mixed).isEmpty());

        JsonArray scaled = array("[{\"id\": 1, \"v\": \"n\"}, {\"id\": 1.0, \"v\": \"s\"}]");
        assertEquals(Optional.of(IdentityKey.of("v")), detector.detect(scaled, scaled));
    }

    @Test
    void ignoresFieldsHoldingContainers() {
        JsonArray elements = array("[{\"tags\": [1], \"name\": \"a\"}, {\"tags\": [2], \"name\": \"b\"}]");

        assertEquals(List.of("name"), detector.candidateFields(elements, elements));
    }

    @Test
    void settingsRejectOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> DetectorSettings.builder().minOverlapRatio(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> DetectorSettings.builder().minArraySize(0).build());
        assertThrows(
            IllegalArgumentException.class,
            () -> DetectorSettings.builder().maxCompositeSize(4).compositeCandidateLimit(3).build());
    }
}
