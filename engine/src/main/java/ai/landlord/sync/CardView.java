package ai.landlord.sync;

import ai.landlord.game.Card;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of a card: {@code {id, suit, rank, value}}.
 */
public record CardView(String id, String suit, String rank, int value) {

    public static CardView of(Card card) {
        return new CardView(card.id(), card.getSuit().getSymbol(), card.getRank().getLabel(), card.getValue());
    }

    public static List<CardView> of(List<Card> cards) {
        List<CardView> views = new ArrayList<>();
        for (Card card : cards) {
            views.add(of(card));
        }
        return views;
    }

    /**
     * Resolves a list of views back to canonical cards.
     *
     * @throws IllegalArgumentException if an id does not name a card
     */
    public static List<Card> toCards(List<CardView> views) {
        List<Card> cards = new ArrayList<>();
        if (views == null) {
            return cards;
        }
        for (CardView view : views) {
            Card card = Card.fromId(view.id());
            if (card == null) {
                throw new IllegalArgumentException("Unknown card id: " + view.id());
            }
            cards.add(card);
        }
        return cards;
    }
}
