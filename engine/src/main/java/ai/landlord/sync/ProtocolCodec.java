package ai.landlord.sync;

import ai.landlord.game.IllegalActionException;
import ai.landlord.game.RejectReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON encoding of the table protocol.
 * <p>
 * Decoding failures surface as {@link IllegalActionException} with
 * {@link RejectReason#MALFORMED_MESSAGE} so callers can answer them like any other rejected
 * action.
 */
public class ProtocolCodec {
    private final ObjectMapper mapper;

    public ProtocolCodec() {
        this(new ObjectMapper());
    }

    public ProtocolCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public String encode(ServerMessage message) {
        return write(message, ServerMessage.class);
    }

    public String encode(ClientMessage message) {
        return write(message, ClientMessage.class);
    }

    public ClientMessage decodeClient(String json) {
        return read(json, ClientMessage.class);
    }

    public ServerMessage decodeServer(String json) {
        return read(json, ServerMessage.class);
    }

    private String write(Object message, Class<?> baseType) {
        try {
            return mapper.writerFor(baseType).writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new IllegalActionException(RejectReason.MALFORMED_MESSAGE, "Empty message");
        }
        try {
            T message = mapper.readValue(json, type);
            if (message == null) {
                throw new IllegalActionException(RejectReason.MALFORMED_MESSAGE, "Empty message");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new IllegalActionException(RejectReason.MALFORMED_MESSAGE,
                    "Malformed message: " + e.getOriginalMessage());
        }
    }
}
