package ai.landlord.player;

import ai.landlord.game.Card;
import ai.landlord.game.Rank;
import ai.landlord.game.Seat;
import ai.landlord.game.TableFormatter;
import ai.landlord.game.TableState;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Human player that reads decisions from stdin (CLI).
 * <p>
 * Plays are typed as space separated cards. A token may name an exact card ({@code 10♠},
 * {@code SJ}) or just a rank ({@code 10}), in which case the lowest unused card of that rank in
 * the hand is taken. {@code pass} passes.
 */
@Component
@Profile("ai-human")
public class HumanPlayer implements Player {
    private final Scanner scanner = new Scanner(System.in);

    @Override
    public boolean decideBid(TableState state, Seat seat) {
        System.out.println(new TableFormatter(state, seat).format());
        System.out.print("Bid for landlord? (y | n): ");
        if (!scanner.hasNextLine()) {
            return false;
        }
        String input = scanner.nextLine().trim();
        return input.equalsIgnoreCase("y") || input.equalsIgnoreCase("bid");
    }

    @Override
    public List<Card> decidePlay(TableState state, Seat seat, String feedback) {
        System.out.println(new TableFormatter(state, seat).format());
        if (feedback != null && !feedback.isBlank()) {
            System.out.println(feedback);
        }
        while (true) {
            System.out.print(state.isLeading() ? "Enter cards to lead: " : "Enter cards to play (or pass): ");
            if (!scanner.hasNextLine()) {
                return null;
            }
            String input = scanner.nextLine().trim();
            if (input.equalsIgnoreCase("pass")) {
                return null;
            }
            List<Card> cards = parseSelection(input, state.hand(seat));
            if (cards != null) {
                return cards;
            }
            System.out.println("Could not read '" + input + "'. Use e.g. 3 3 or 10♠ J♥ Q♣ K♦ A♠.");
        }
    }

    /**
     * Resolves typed tokens against the hand.
     *
     * @return the selected cards, or {@code null} if a token names no available card
     */
    static List<Card> parseSelection(String input, List<Card> hand) {
        List<Card> available = new ArrayList<>(hand);
        List<Card> chosen = new ArrayList<>();
        if (input.isBlank()) {
            return null;
        }
        for (String token : input.split("\\s+")) {
            Card picked = null;
            Rank rank = Rank.fromLabel(token);
            if (rank != null) {
                for (Card card : available) {
                    if (card.getRank() == rank) {
                        picked = card;
                        break;
                    }
                }
            } else {
                try {
                    Card parsed = Card.parse(token);
                    picked = available.contains(parsed) ? parsed : null;
                } catch (IllegalArgumentException e) {
                    return null;
                }
            }
            if (picked == null) {
                return null;
            }
            available.remove(picked);
            chosen.add(picked);
        }
        return chosen;
    }
}
