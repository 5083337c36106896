package ai.sensor.match;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.MatchBasis;

import static ai.sensor.TestEvidence.binary;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameMatcherTest {

    private final NameMatcher matcher = new NameMatcher();

    @Test
    void shouldPairByNameAndListUnmatchedOnBothSides() {
        final BinaryFeatureSet from = binary("b1", List.of(), "_main", "_old_helper", "_parse");
        final BinaryFeatureSet to = binary("b2", List.of(), "_parse", "_main", "_new_helper");

        final List<BinaryDiffPair> pairs = matcher.match(from, to);

        assertEquals(4, pairs.size());
        assertEquals("pair:_main->_main#1", pairs.get(0).pairId());
        assertEquals(MatchBasis.NAME, pairs.get(0).basis());
        assertFalse(pairs.get(1).matched());
        assertEquals("_old_helper", pairs.get(1).fromName());
        assertNull(pairs.get(1).toSymbolId());
        assertEquals("sym:_parse", pairs.get(2).toSymbolId());
        assertEquals("pair:-->_new_helper#1", pairs.get(3).pairId());
        assertNull(pairs.get(3).fromSymbolId());
    }

    @Test
    void shouldPairRepeatedNamesByOccurrence() {
        final BinaryFeatureSet from = binary("b1", List.of(), "_stub", "_stub", "_stub");
        final BinaryFeatureSet to = binary("b2", List.of(), "_stub", "_stub");

        final List<BinaryDiffPair> pairs = matcher.match(from, to);

        assertEquals(3, pairs.size());
        assertEquals("sym:_stub#2", pairs.get(1).fromSymbolId());
        assertEquals("sym:_stub#2", pairs.get(1).toSymbolId());
        assertFalse(pairs.get(2).matched());
        assertEquals("sym:_stub#3", pairs.get(2).fromSymbolId());
    }

    @Test
    void shouldAccountForEverySymbolExactlyOnce() {
        final BinaryFeatureSet from = binary("b1", List.of(), "a", "b", "b", "c");
        final BinaryFeatureSet to = binary("b2", List.of(), "b", "d", "a");

        final List<BinaryDiffPair> pairs = matcher.match(from, to);

        final long fromSides = pairs.stream().filter(p -> p.fromSymbolId() != null).count();
        final long toSides = pairs.stream().filter(p -> p.toSymbolId() != null).count();
        assertEquals(4, fromSides);
        assertEquals(3, toSides);
        assertEquals(pairs.size(), pairs.stream().map(BinaryDiffPair::pairId).distinct().count());
    }

    @Test
    void shouldReturnNothingForTwoEmptyImages() {
        assertTrue(matcher.match(binary("b1", List.of()), binary("b2", List.of())).isEmpty());
    }
}
