package ai.landlord.game;

import java.util.Collection;
import java.util.List;

/**
 * Classifies a set of cards into a {@link HandShape}.
 * <p>
 * Classification runs an ordered list of independent {@link ShapeMatcher}s and returns the
 * first match. The order matters only where families could overlap (the two jokers are a
 * {@link ShapeType#ROCKET}, never a pair); each matcher otherwise checks its own card count.
 * <p>
 * Classification is total and deterministic: every card set yields either a shape or
 * {@code null}, and suits never influence the result.
 */
public final class HandClassifier {

    private static final List<ShapeMatcher> MATCHERS = List.of(
            HandClassifier::matchRocket,
            HandClassifier::matchBomb,
            HandClassifier::matchSameRank,
            HandClassifier::matchTripleWithKicker,
            HandClassifier::matchStraight,
            HandClassifier::matchPairStraight,
            HandClassifier::matchAirplane,
            HandClassifier::matchFourWithTwo);

    private HandClassifier() {
    }

    /**
     * Classifies the given cards.
     *
     * @param cards the cards to classify
     * @return the shape, or {@code null} if the cards do not form a legal combination
     */
    public static HandShape classify(Collection<Card> cards) {
        if (cards == null || cards.isEmpty()) {
            return null;
        }
        CardCounts counts = CardCounts.of(cards);
        for (ShapeMatcher matcher : MATCHERS) {
            HandShape shape = matcher.match(counts);
            if (shape != null) {
                return shape;
            }
        }
        return null;
    }

    /**
     * Convenience check for a single legal combination.
     */
    public static boolean isValid(Collection<Card> cards) {
        return classify(cards) != null;
    }

    static HandShape matchRocket(CardCounts counts) {
        if (counts.size() == 2
                && counts.count(Rank.SMALL_JOKER.getValue()) == 1
                && counts.count(Rank.BIG_JOKER.getValue()) == 1) {
            return new HandShape(ShapeType.ROCKET, Rank.BIG_JOKER.getValue(), 2);
        }
        return null;
    }

    static HandShape matchBomb(CardCounts counts) {
        if (counts.size() == 4 && counts.distinctValues() == 1) {
            return new HandShape(ShapeType.BOMB, counts.values().get(0), 4);
        }
        return null;
    }

    static HandShape matchSameRank(CardCounts counts) {
        if (counts.distinctValues() != 1) {
            return null;
        }
        int value = counts.values().get(0);
        return switch (counts.size()) {
            case 1 -> new HandShape(ShapeType.SINGLE, value, 1);
            case 2 -> new HandShape(ShapeType.PAIR, value, 2);
            case 3 -> new HandShape(ShapeType.TRIPLE, value, 3);
            default -> null;
        };
    }

    static HandShape matchTripleWithKicker(CardCounts counts) {
        if (counts.distinctValues() != 2) {
            return null;
        }
        List<Integer> triples = counts.valuesWithCount(3);
        if (triples.size() != 1) {
            return null;
        }
        int triple = triples.get(0);
        if (counts.size() == 4) {
            return new HandShape(ShapeType.TRIPLE_WITH_SINGLE, triple, 4);
        }
        if (counts.size() == 5 && counts.valuesWithCount(2).size() == 1) {
            return new HandShape(ShapeType.TRIPLE_WITH_PAIR, triple, 5);
        }
        return null;
    }

    static HandShape matchStraight(CardCounts counts) {
        int n = counts.size();
        if (n < 5 || counts.distinctValues() != n) {
            return null;
        }
        List<Integer> values = counts.values();
        if (!CardCounts.isConsecutiveSequence(values)) {
            return null;
        }
        return new HandShape(ShapeType.STRAIGHT, values.get(values.size() - 1), n);
    }

    static HandShape matchPairStraight(CardCounts counts) {
        int n = counts.size();
        if (n < 6 || n % 2 != 0 || !counts.allCountsEqual(2) || counts.distinctValues() < 3) {
            return null;
        }
        List<Integer> values = counts.values();
        if (!CardCounts.isConsecutiveSequence(values)) {
            return null;
        }
        return new HandShape(ShapeType.PAIR_STRAIGHT, values.get(values.size() - 1), n);
    }

    /**
     * Airplane family: the longest run (at least two) of consecutive values held exactly three
     * times decides the triple count {@code t}; the remaining cards decide the variant.
     */
    static HandShape matchAirplane(CardCounts counts) {
        List<Integer> sequenceTriples = counts.valuesWithCount(3).stream()
                .filter(Rank::isSequenceValue)
                .toList();
        List<Integer> run = CardCounts.longestRun(sequenceTriples);
        if (run.size() < 2) {
            return null;
        }
        int t = run.size();
        int n = counts.size();
        int extra = n - 3 * t;
        int primary = run.get(t - 1);
        if (extra == 0) {
            return new HandShape(ShapeType.AIRPLANE, primary, n);
        }
        if (extra == t) {
            return new HandShape(ShapeType.AIRPLANE_WITH_SINGLES, primary, n);
        }
        if (extra == 2 * t) {
            for (int value : counts.values()) {
                if (!run.contains(value) && counts.count(value) != 2) {
                    return null;
                }
            }
            return new HandShape(ShapeType.AIRPLANE_WITH_PAIRS, primary, n);
        }
        return null;
    }

    static HandShape matchFourWithTwo(CardCounts counts) {
        List<Integer> quads = counts.valuesWithCount(4);
        if (quads.size() != 1) {
            return null;
        }
        int quad = quads.get(0);
        if (counts.size() == 6) {
            return new HandShape(ShapeType.FOUR_WITH_TWO_SINGLES, quad, 6);
        }
        if (counts.size() == 8 && counts.valuesWithCount(2).size() == 2) {
            return new HandShape(ShapeType.FOUR_WITH_TWO_PAIRS, quad, 8);
        }
        return null;
    }
}
