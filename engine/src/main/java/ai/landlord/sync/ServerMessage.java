package ai.landlord.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * Messages sent by the server. Seats are always absolute seat indexes (0..2); a value of
 * {@code -1} means "no seat" (for example {@code nextBidder} once bidding is done). Other seats'
 * cards are only ever sent as counts.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerMessage.Waiting.class, name = "waiting"),
        @JsonSubTypes.Type(value = ServerMessage.GameStart.class, name = "game_start"),
        @JsonSubTypes.Type(value = ServerMessage.BidUpdate.class, name = "bid_update"),
        @JsonSubTypes.Type(value = ServerMessage.BidFinalized.class, name = "bid_finalized"),
        @JsonSubTypes.Type(value = ServerMessage.Redeal.class, name = "redeal"),
        @JsonSubTypes.Type(value = ServerMessage.PlayUpdate.class, name = "play_update"),
        @JsonSubTypes.Type(value = ServerMessage.PassUpdate.class, name = "pass_update"),
        @JsonSubTypes.Type(value = ServerMessage.GameOver.class, name = "game_over"),
        @JsonSubTypes.Type(value = ServerMessage.PlayerLeft.class, name = "player_left"),
        @JsonSubTypes.Type(value = ServerMessage.Hint.class, name = "hint"),
        @JsonSubTypes.Type(value = ServerMessage.ErrorMessage.class, name = "error")
})
public interface ServerMessage {

    /** Position in the matchmaking queue (1-based). */
    record Waiting(int position, int total) implements ServerMessage {
    }

    record GameStart(String tableId, List<CardView> myCards, List<CardView> reservedCards, int mySeat,
            int firstBidder, List<Integer> handSizes, List<String> playerNames) implements ServerMessage {
    }

    record BidUpdate(int seat, boolean wantsToBid, int highestBid, boolean done, int nextBidder)
            implements ServerMessage {
    }

    /**
     * @param myCards the landlord's full hand; absent for the other seats
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record BidFinalized(int landlordSeat, List<CardView> reservedCards, List<Integer> handSizes,
            List<CardView> myCards) implements ServerMessage {
    }

    record Redeal(List<CardView> myCards, List<CardView> reservedCards, int firstBidder, List<Integer> handSizes)
            implements ServerMessage {
    }

    record PlayUpdate(int seat, List<CardView> cards, String shapeType, int handSizeRemaining, int nextSeat,
            int bombMultiplier) implements ServerMessage {
    }

    record PassUpdate(int seat, int nextSeat, @JsonProperty("isNewTrick") boolean isNewTrick,
            int consecutivePasses) implements ServerMessage {
    }

    record GameOver(int winnerSeat, int landlordSeat, boolean landlordWon, List<CardView> finalCards,
            String finalShapeType, int bombMultiplier, List<Integer> scores) implements ServerMessage {
    }

    record PlayerLeft(int seat) implements ServerMessage {
    }

    /**
     * @param cardIds suggested play, empty when passing is the only option
     */
    record Hint(List<String> cardIds) implements ServerMessage {
    }

    record ErrorMessage(String reason, String message) implements ServerMessage {
    }
}
