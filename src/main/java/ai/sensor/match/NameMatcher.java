package ai.sensor.match;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.sensor.model.BinaryDiffPair;
import ai.sensor.model.BinaryFeatureSet;
import ai.sensor.model.BinarySymbol;
import ai.sensor.model.Ids;
import ai.sensor.model.MatchBasis;

/**
 * Exact name equality. The k-th occurrence of a name on the from side pairs with the k-th on
 * the to side; surplus occurrences stay unmatched.
 * <p>
 * Output: every from symbol in order, then the to symbols nothing claimed, in order.
 */
public final class NameMatcher implements BinaryDiffMatcher {

    public static final String NAME = "name";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<BinaryDiffPair> match(BinaryFeatureSet from, BinaryFeatureSet to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");

        final Map<String, List<BinarySymbol>> toByName = new HashMap<>();
        for (BinarySymbol s : to.symbols()) {
            toByName.computeIfAbsent(s.name(), k -> new ArrayList<>()).add(s);
        }

        final List<BinaryDiffPair> out = new ArrayList<>();
        final Map<String, Integer> fromSeen = new HashMap<>();
        for (BinarySymbol s : from.symbols()) {
            final int occurrence = fromSeen.merge(s.name(), 1, Integer::sum);
            final List<BinarySymbol> candidates = toByName.getOrDefault(s.name(), List.of());
            if (occurrence <= candidates.size()) {
                final BinarySymbol t = candidates.get(occurrence - 1);
                out.add(new BinaryDiffPair(Ids.pairId(s.name(), t.name(), occurrence),
                        s.symbolId(), s.name(), t.symbolId(), t.name(), MatchBasis.NAME));
            } else {
                out.add(new BinaryDiffPair(Ids.pairId(s.name(), null, occurrence),
                        s.symbolId(), s.name(), null, null, MatchBasis.NONE));
            }
        }

        final Map<String, Integer> toSeen = new HashMap<>();
        for (BinarySymbol t : to.symbols()) {
            final int occurrence = toSeen.merge(t.name(), 1, Integer::sum);
            if (occurrence > fromSeen.getOrDefault(t.name(), 0)) {
                out.add(new BinaryDiffPair(Ids.pairId(null, t.name(), occurrence),
                        null, null, t.symbolId(), t.name(), MatchBasis.NONE));
            }
        }
        return out;
    }
}
