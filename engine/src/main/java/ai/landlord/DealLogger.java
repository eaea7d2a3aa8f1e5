package ai.landlord;

import ai.landlord.game.Action;
import ai.landlord.game.Card;
import ai.landlord.game.TableEvent;
import ai.landlord.game.TableState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs describing every action of a deal.
 *
 * <p>Logs are routed to a separate file (deal.log) by {@code logback-spring.xml} so that
 * recorded deals can be replayed or analysed offline.</p>
 */
public class DealLogger {
    private static final Logger log = LoggerFactory.getLogger(DealLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.deals");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DealLogger() {
    }

    /**
     * Return true if deal logging is enabled via -Dlog.deals=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Emit one line describing the state before an accepted action, the action itself and the
     * events it produced. The line is prefixed with "DEAL_STEP " so it can be filtered out of
     * mixed logs.
     */
    public static void logStep(String tableId, int stepIndex, TableState before, Action action,
            List<TableEvent> events) {
        if (!ENABLED) {
            return;
        }
        try {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("type", "step");
            node.put("table", tableId);
            node.put("step_index", stepIndex);
            node.put("phase", before.phase().name());
            node.put("seat", action.seat().index());
            node.put("action", describe(action));
            ArrayNode hands = node.putArray("hands");
            for (List<Card> hand : before.hands()) {
                hands.add(cardArray(hand));
            }
            node.set("last_play", before.lastPlay() == null ? null : cardArray(before.lastPlay().cards()));
            node.put("bomb_multiplier", before.bombMultiplier());
            ArrayNode eventNames = node.putArray("events");
            for (TableEvent event : events) {
                eventNames.add(event.getClass().getSimpleName());
            }
            log.info("DEAL_STEP {}", MAPPER.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            log.debug("Failed to log deal step", e);
        }
    }

    /**
     * Emit one "DEAL_SUMMARY " line for a finished deal.
     */
    public static void logSummary(String tableId, TableState last, int steps, long durationNanos) {
        if (!ENABLED) {
            return;
        }
        try {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("type", "summary");
            node.put("table", tableId);
            node.put("steps", steps);
            node.put("redeals", last.redeals());
            node.put("landlord", last.landlord() == null ? -1 : last.landlord().index());
            node.put("bid", last.bidding().highestBid());
            node.put("bomb_multiplier", last.bombMultiplier());
            if (last.outcome() != null) {
                node.put("aborted", last.outcome().isAborted());
                node.put("winner", last.outcome().winner() == null ? -1 : last.outcome().winner().index());
                node.put("landlord_won", last.outcome().landlordWon());
                ArrayNode scores = node.putArray("scores");
                last.outcome().scores().forEach(scores::add);
            }
            node.put("duration_ms", durationNanos / 1_000_000L);
            log.info("DEAL_SUMMARY {}", MAPPER.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            log.debug("Failed to log deal summary", e);
        }
    }

    private static String describe(Action action) {
        if (action instanceof Action.Bid bid) {
            return bid.wantsToBid() ? "bid" : "decline";
        }
        if (action instanceof Action.Play play) {
            StringBuilder sb = new StringBuilder("play");
            for (Card card : play.cards()) {
                sb.append(' ').append(card.shortName());
            }
            return sb.toString();
        }
        if (action instanceof Action.Pass) {
            return "pass";
        }
        return "abort";
    }

    private static ArrayNode cardArray(List<Card> cards) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Card card : cards) {
            array.add(card.shortName());
        }
        return array;
    }
}
