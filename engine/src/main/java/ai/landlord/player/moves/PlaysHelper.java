package ai.landlord.player.moves;

import ai.landlord.game.Card;
import ai.landlord.game.CardCounts;
import ai.landlord.game.HandClassifier;
import ai.landlord.game.HandShape;
import ai.landlord.game.Rank;
import ai.landlord.game.ShapeType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract base class for enumerating the legal plays of a hand.
 * <p>
 * Two implementations exist:
 * <ul>
 *   <li><b>LeadPlaysHelper:</b> opening a trick, every constructible shape is legal
 *   <li><b>FollowPlaysHelper:</b> following, only shapes that beat the play on the table
 * </ul>
 * <p>
 * The base class holds the shared generators. Each generator takes an exclusive lower bound on
 * the primary rank ({@code 0} when leading) and, for sequence shapes, an optional fixed length.
 * Kickers are chosen deterministically (lowest cards first) so that each core rank and length
 * yields at most one candidate per shape.
 * <p>
 * Every candidate is re-classified by {@link #finish(List, HandShape)} before it is returned;
 * candidates that do not classify, or do not beat the shape on the table, are dropped and
 * duplicates are removed.
 */
public abstract class PlaysHelper {
    /** Rank histogram of the hand being analysed. */
    protected CardCounts counts;

    /**
     * Computes the legal plays of {@code hand}.
     *
     * @param hand   the cards held; must not be null
     * @param toBeat the shape on the table, or {@code null} when leading
     * @return legal card sets in display order; empty means the only option is to pass
     */
    public abstract List<List<Card>> listLegalPlays(List<Card> hand, HandShape toBeat);

    protected void addSingles(List<List<Card>> out, int above) {
        for (int value : counts.values()) {
            if (value > above) {
                out.add(counts.take(value, 1));
            }
        }
    }

    /**
     * Adds one group of {@code size} same-rank cards for every rank holding at least that many.
     * Pairs and triples may be split from larger groups.
     */
    protected void addGroups(List<List<Card>> out, int size, int above) {
        for (int value : counts.valuesWithAtLeast(size)) {
            if (value > above) {
                out.add(counts.take(value, size));
            }
        }
    }

    protected void addTriplesWithSingle(List<List<Card>> out, int above) {
        for (int value : counts.valuesWithAtLeast(3)) {
            if (value <= above) {
                continue;
            }
            List<Card> kickers = singleKickers(List.of(value), 1);
            if (kickers != null) {
                out.add(concat(counts.take(value, 3), kickers));
            }
        }
    }

    protected void addTriplesWithPair(List<List<Card>> out, int above) {
        for (int value : counts.valuesWithAtLeast(3)) {
            if (value <= above) {
                continue;
            }
            List<Card> kickers = pairKickers(List.of(value), 1);
            if (kickers != null) {
                out.add(concat(counts.take(value, 3), kickers));
            }
        }
    }

    /**
     * Adds straights.
     *
     * @param length fixed length, or {@code 0} for every window of at least five ranks
     */
    protected void addStraights(List<List<Card>> out, int length, int above) {
        for (List<Integer> window : windows(counts.valuesWithAtLeast(1), 5, length, above)) {
            List<Card> cards = new ArrayList<>();
            for (int value : window) {
                cards.addAll(counts.take(value, 1));
            }
            out.add(cards);
        }
    }

    /**
     * Adds pair straights.
     *
     * @param pairs fixed number of pairs, or {@code 0} for every window of at least three pairs
     */
    protected void addPairStraights(List<List<Card>> out, int pairs, int above) {
        for (List<Integer> window : windows(counts.valuesWithAtLeast(2), 3, pairs, above)) {
            List<Card> cards = new ArrayList<>();
            for (int value : window) {
                cards.addAll(counts.take(value, 2));
            }
            out.add(cards);
        }
    }

    /**
     * Adds airplanes of the given kind (bare, with singles, with pairs).
     *
     * @param kind    one of the three airplane types
     * @param triples fixed number of triples, or {@code 0} for every window of at least two
     */
    protected void addAirplanes(List<List<Card>> out, ShapeType kind, int triples, int above) {
        for (List<Integer> window : windows(counts.valuesWithAtLeast(3), 2, triples, above)) {
            List<Card> core = new ArrayList<>();
            for (int value : window) {
                core.addAll(counts.take(value, 3));
            }
            List<Card> kickers = switch (kind) {
                case AIRPLANE -> List.of();
                case AIRPLANE_WITH_SINGLES -> singleKickers(window, window.size());
                case AIRPLANE_WITH_PAIRS -> pairKickers(window, window.size());
                default -> throw new IllegalArgumentException("Not an airplane: " + kind);
            };
            if (kickers != null) {
                out.add(concat(core, kickers));
            }
        }
    }

    /**
     * Adds four-with-two plays of the given kind for every four-of-a-kind.
     */
    protected void addFoursWithTwo(List<List<Card>> out, ShapeType kind, int above) {
        for (int value : counts.valuesWithCount(4)) {
            if (value <= above) {
                continue;
            }
            List<Card> kickers = kind == ShapeType.FOUR_WITH_TWO_PAIRS
                    ? pairKickers(List.of(value), 2)
                    : singleKickers(List.of(value), 2);
            if (kickers != null) {
                out.add(concat(counts.take(value, 4), kickers));
            }
        }
    }

    protected void addBombs(List<List<Card>> out, int above) {
        for (int value : counts.valuesWithCount(4)) {
            if (value > above) {
                out.add(counts.cards(value));
            }
        }
    }

    protected void addRocket(List<List<Card>> out) {
        int small = Rank.SMALL_JOKER.getValue();
        int big = Rank.BIG_JOKER.getValue();
        if (counts.count(small) == 1 && counts.count(big) == 1) {
            out.add(concat(counts.cards(small), counts.cards(big)));
        }
    }

    /**
     * Re-validates candidates through the classifier and removes duplicates.
     *
     * @param candidates generated card sets
     * @param toBeat     shape to beat, or {@code null} when leading
     * @return legal plays, each sorted in display order, in generation order
     */
    protected List<List<Card>> finish(List<List<Card>> candidates, HandShape toBeat) {
        Map<List<Card>, Boolean> unique = new LinkedHashMap<>();
        for (List<Card> candidate : candidates) {
            HandShape shape = HandClassifier.classify(candidate);
            if (shape == null || (toBeat != null && !shape.beats(toBeat))) {
                continue;
            }
            unique.putIfAbsent(List.copyOf(Card.sorted(candidate)), Boolean.TRUE);
        }
        return new ArrayList<>(unique.keySet());
    }

    /**
     * Picks {@code n} single kickers outside the core: the lowest card of each distinct rank
     * first, then any remaining cards from the lowest rank up. A rank next to a multi-rank core
     * contributes at most two kickers, since a third would extend the run of triples.
     *
     * @return the kickers, or {@code null} if the hand has too few cards outside the core
     */
    private List<Card> singleKickers(List<Integer> core, int n) {
        List<Card> kickers = new ArrayList<>();
        for (int value : counts.values()) {
            if (kickers.size() == n) {
                return kickers;
            }
            if (!core.contains(value)) {
                kickers.add(counts.cards(value).get(0));
            }
        }
        for (int value : counts.values()) {
            if (core.contains(value)) {
                continue;
            }
            List<Card> cards = counts.cards(value);
            int limit = extendsRun(core, value) ? Math.min(cards.size(), 2) : cards.size();
            for (int i = 1; i < limit && kickers.size() < n; i++) {
                kickers.add(cards.get(i));
            }
        }
        return kickers.size() == n ? kickers : null;
    }

    private static boolean extendsRun(List<Integer> core, int value) {
        if (core.size() < 2 || !Rank.isSequenceValue(value)) {
            return false;
        }
        return value == core.get(0) - 1 || value == core.get(core.size() - 1) + 1;
    }

    /**
     * Picks {@code n} pair kickers from the lowest ranks outside the core holding at least two.
     *
     * @return the kickers, or {@code null} if there are not enough pairs
     */
    private List<Card> pairKickers(List<Integer> core, int n) {
        List<Card> kickers = new ArrayList<>();
        int found = 0;
        for (int value : counts.valuesWithAtLeast(2)) {
            if (found == n) {
                break;
            }
            if (!core.contains(value)) {
                kickers.addAll(counts.take(value, 2));
                found++;
            }
        }
        return found == n ? kickers : null;
    }

    /**
     * Returns runs of consecutive sequence-range values drawn from {@code available}.
     *
     * @param available ascending values eligible for the run
     * @param minLength minimum run length when {@code length} is 0
     * @param length    fixed run length, or {@code 0} for every length from {@code minLength}
     * @param above     exclusive lower bound on the highest value of the run
     */
    private static List<List<Integer>> windows(List<Integer> available, int minLength, int length, int above) {
        List<Integer> values = new ArrayList<>();
        for (int value : available) {
            if (Rank.isSequenceValue(value)) {
                values.add(value);
            }
        }
        List<List<Integer>> out = new ArrayList<>();
        int from = length > 0 ? length : minLength;
        int to = length > 0 ? length : values.size();
        for (int len = from; len <= to; len++) {
            for (int start = 0; start + len <= values.size(); start++) {
                List<Integer> window = values.subList(start, start + len);
                if (CardCounts.isConsecutiveSequence(window) && window.get(len - 1) > above) {
                    out.add(new ArrayList<>(window));
                }
            }
        }
        return out;
    }

    private static List<Card> concat(List<Card> first, List<Card> second) {
        List<Card> out = new ArrayList<>(first);
        out.addAll(second);
        return out;
    }
}
