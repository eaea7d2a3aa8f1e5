package ai.landlord.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Rank histogram of a set of cards: for every rank value present, the cards of that value in
 * display order. Iteration is by ascending rank value.
 */
public final class CardCounts {
    private final NavigableMap<Integer, List<Card>> byValue;
    private final int size;

    private CardCounts(NavigableMap<Integer, List<Card>> byValue, int size) {
        this.byValue = byValue;
        this.size = size;
    }

    public static CardCounts of(Collection<Card> cards) {
        NavigableMap<Integer, List<Card>> byValue = new TreeMap<>();
        for (Card card : Card.sorted(cards)) {
            byValue.computeIfAbsent(card.getValue(), v -> new ArrayList<>()).add(card);
        }
        for (Map.Entry<Integer, List<Card>> entry : byValue.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }
        return new CardCounts(byValue, cards.size());
    }

    /** Total number of cards counted. */
    public int size() {
        return size;
    }

    /** Number of distinct rank values. */
    public int distinctValues() {
        return byValue.size();
    }

    public int count(int value) {
        List<Card> cards = byValue.get(value);
        return cards == null ? 0 : cards.size();
    }

    /**
     * Returns the cards of the given value in display order (empty if absent).
     */
    public List<Card> cards(int value) {
        return byValue.getOrDefault(value, List.of());
    }

    /**
     * Returns the lowest {@code n} cards of the given value.
     */
    public List<Card> take(int value, int n) {
        List<Card> cards = cards(value);
        if (cards.size() < n) {
            throw new IllegalArgumentException("Only " + cards.size() + " cards of value " + value);
        }
        return cards.subList(0, n);
    }

    /** Distinct values present, ascending. */
    public List<Integer> values() {
        return new ArrayList<>(byValue.keySet());
    }

    /** Values held exactly {@code count} times, ascending. */
    public List<Integer> valuesWithCount(int count) {
        List<Integer> out = new ArrayList<>();
        for (Map.Entry<Integer, List<Card>> entry : byValue.entrySet()) {
            if (entry.getValue().size() == count) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    /** Values held at least {@code count} times, ascending. */
    public List<Integer> valuesWithAtLeast(int count) {
        List<Integer> out = new ArrayList<>();
        for (Map.Entry<Integer, List<Card>> entry : byValue.entrySet()) {
            if (entry.getValue().size() >= count) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    /**
     * Checks whether every present value is held exactly {@code count} times.
     */
    public boolean allCountsEqual(int count) {
        for (List<Card> cards : byValue.values()) {
            if (cards.size() != count) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the given ascending values are consecutive and all lie in the sequence
     * range Three..Ace.
     */
    public static boolean isConsecutiveSequence(List<Integer> ascending) {
        for (int i = 0; i < ascending.size(); i++) {
            int value = ascending.get(i);
            if (!Rank.isSequenceValue(value)) {
                return false;
            }
            if (i > 0 && value != ascending.get(i - 1) + 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the longest run of consecutive values in the ascending list, earliest run on a
     * tie.
     */
    public static List<Integer> longestRun(List<Integer> ascending) {
        List<Integer> best = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        for (int value : ascending) {
            if (!current.isEmpty() && value != current.get(current.size() - 1) + 1) {
                if (current.size() > best.size()) {
                    best = current;
                }
                current = new ArrayList<>();
            }
            current.add(value);
        }
        if (current.size() > best.size()) {
            best = current;
        }
        return best;
    }
}
