package ai.landlord.sync;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * Messages sent by clients. The JSON {@code type} property selects the message.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientMessage.Join.class, name = "join"),
        @JsonSubTypes.Type(value = ClientMessage.Leave.class, name = "leave"),
        @JsonSubTypes.Type(value = ClientMessage.Practice.class, name = "practice"),
        @JsonSubTypes.Type(value = ClientMessage.Bid.class, name = "bid"),
        @JsonSubTypes.Type(value = ClientMessage.Play.class, name = "play"),
        @JsonSubTypes.Type(value = ClientMessage.Pass.class, name = "pass"),
        @JsonSubTypes.Type(value = ClientMessage.Hint.class, name = "hint")
})
public interface ClientMessage {

    /** Enter the matchmaking queue. */
    record Join(String nickname) implements ClientMessage {
    }

    /** Leave the matchmaking queue. */
    record Leave() implements ClientMessage {
    }

    /** Start a table against two AI opponents. */
    record Practice(String nickname) implements ClientMessage {
    }

    record Bid(boolean wantsToBid) implements ClientMessage {
    }

    record Play(List<String> cardIds) implements ClientMessage {
    }

    record Pass() implements ClientMessage {
    }

    /** Ask for a suggested play. */
    record Hint() implements ClientMessage {
    }
}
