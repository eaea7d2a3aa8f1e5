package ai.landlord.game;

import java.util.List;
import java.util.Objects;

/**
 * Result of applying an accepted action: the new state and the events it produced, in order.
 */
public record Transition(TableState state, List<TableEvent> events) {
    public Transition {
        Objects.requireNonNull(state, "state");
        events = List.copyOf(events);
    }
}
