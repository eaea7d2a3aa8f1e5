package ai.landlord.sync;

import static org.junit.jupiter.api.Assertions.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

/**
 * In-memory {@link ClientChannel} that records everything sent to it.
 */
final class RecordingChannel implements ClientChannel {
    private static final long TIMEOUT_MILLIS = 10_000;

    private final String id;
    private final List<ServerMessage> messages = new CopyOnWriteArrayList<>();
    private volatile Class<? extends ServerMessage> failOn;

    RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(ServerMessage message) {
        if (failOn != null && failOn.isInstance(message)) {
            throw new IllegalStateException("connection broken");
        }
        messages.add(message);
    }

    /**
     * Makes every later send of the given message type throw.
     */
    void failOn(Class<? extends ServerMessage> type) {
        this.failOn = type;
    }

    List<ServerMessage> messages() {
        return messages;
    }

    <T extends ServerMessage> List<T> messages(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (ServerMessage message : messages) {
            if (type.isInstance(message)) {
                out.add(type.cast(message));
            }
        }
        return out;
    }

    <T extends ServerMessage> T awaitFirst(Class<T> type) throws InterruptedException {
        await(() -> !messages(type).isEmpty());
        return messages(type).get(0);
    }

    static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within " + TIMEOUT_MILLIS + " ms");
            }
            Thread.sleep(10);
        }
    }
}
