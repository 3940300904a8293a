package org.jsondelta.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.jsondelta.value.BsonJson;
import org.jsondelta.value.JsonValue;
import org.junit.jupiter.api.Test;

class IdentityKeyIndexTest {
    private static IdentityKeyInfo info(String array, IdentityKey key, boolean shared) {
        IdentityAddress identity = IdentityAddress.parse(array);
        return new IdentityKeyInfo(
            ScopedAddress.left(PositionAddress.parse(array.replaceAll("\\[[^\\]]*=[^\\]]*\\]", "[0]"))),
            identity,
            key,
            2,
            2,
            shared);
    }

    @Test
    void exactEntriesWinOverSharedPatternKeys() {
        IdentityKeyIndex index = IdentityKeyIndex.of(List.of(
            info("groups[0].members", IdentityKey.of("name"), true),
            info("groups[1].members", null, false)));

        assertEquals(Optional.of(IdentityKey.of("name")), index.keyFor(IdentityAddress.parse("groups[0].members")));
        assertTrue(index.keyFor(IdentityAddress.parse("groups[1].members")).isEmpty());
        assertEquals(Optional.of(IdentityKey.of("name")), index.keyFor(IdentityAddress.parse("groups[2].members")));
        assertTrue(index.keyFor(IdentityAddress.parse("teams[0].members")).isEmpty());
        assertEquals(1, index.keyedEntries().size());
    }

    @Test
    void unsharedKeysDoNotSpreadToOtherLocations() {
        IdentityKeyIndex index = IdentityKeyIndex.of(List.of(info("groups[0].members", IdentityKey.of("name"), false)));

        assertTrue(index.keyFor(IdentityAddress.parse("groups[2].members")).isEmpty());
        assertEquals(Optional.of(IdentityKey.of("name")), index.keyForPattern(ArrayPatternAddress.parse("groups[].members")));
    }

    @Test
    void patternKeyIsAbsentWhenLocationsDisagree() {
        IdentityKeyIndex index = IdentityKeyIndex.of(List.of(
            info("groups[0].members", IdentityKey.of("name"), false),
            info("groups[1].members", IdentityKey.of("email"), false)));

        assertTrue(index.keyForPattern(ArrayPatternAddress.parse("groups[].members")).isEmpty());
    }

    @Test
    void sharedKeysResolveArraysThatWereNeverRecorded() {
        JsonValue document = BsonJson.parse("""
            {"groups": [
              {"members": [{"name": "p"}, {"name": "q"}]},
              {"members": [{"name": "z"}, {"name": "p"}]}
            ]}
            """);
        List<IdentityKeyInfo> keys = List.of(info("groups[0].members", IdentityKey.of("name"), true));

        assertEquals(
            Optional.of(PositionAddress.parse("groups[1].members[0]")),
            IdentityPathResolver.toPosition(IdentityAddress.parse("groups[1].members[name=z]"), document, keys));
    }
}
