package ai.landlord.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link TableState} for the console from one seat's point of view.
 * <p>
 * Opponents are shown as card counts only; the viewer's own hand is listed in full. Cell widths
 * account for ANSI colour escape sequences so red cards do not break the alignment.
 */
public class TableFormatter {
    /** Default cell width (in characters) used when content is narrower than this value. */
    private static final int CELL_WIDTH = 10;

    private final TableState state;
    private final Seat viewer;

    public TableFormatter(TableState state, Seat viewer) {
        this.state = state;
        this.viewer = viewer;
    }

    /**
     * Renders the seats row, the play on the table and the viewer's hand.
     *
     * @return a multi-line string
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        List<String> labels = new ArrayList<>();
        List<String> contents = new ArrayList<>();
        for (RelativeSeat relative : RelativeSeat.values()) {
            Seat seat = relative.toAbsolute(viewer);
            String label = relative.name() + (seat.equals(state.landlord()) ? " *" : "");
            labels.add(seat.equals(state.currentSeat()) && !state.isFinished() ? "> " + label : label);
            contents.add(state.hand(seat).size() + " cards");
        }
        String border = buildBorder(labels.size(), CELL_WIDTH);
        sb.append("-".repeat(border.length())).append('\n');
        sb.append(border).append('\n')
                .append(buildRow(labels, CELL_WIDTH)).append('\n')
                .append(buildRow(contents, CELL_WIDTH)).append('\n')
                .append(border).append('\n');
        sb.append("PHASE: ").append(state.phase())
                .append("   MULTIPLIER: x").append(state.bombMultiplier()).append('\n');
        PlayRecord lastPlay = state.lastPlay();
        if (lastPlay == null) {
            sb.append("ON TABLE: -- (lead)").append('\n');
        } else {
            sb.append("ON TABLE: ").append(joinCards(lastPlay.cards()))
                    .append("  [").append(lastPlay.shape().type().getDisplayName()).append(" by ")
                    .append(lastPlay.seat().relativeTo(viewer)).append("]\n");
        }
        sb.append("YOUR HAND: ").append(joinCards(state.hand(viewer)));
        return sb.toString();
    }

    /**
     * Joins cards with single spaces, keeping their colours.
     */
    public static String joinCards(List<Card> cards) {
        List<String> names = new ArrayList<>();
        for (Card card : cards) {
            names.add(card.toString());
        }
        return String.join(" ", names);
    }

    private String buildBorder(int count, int cellWidth) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < count; i++) {
            line.append("+").append("-".repeat(cellWidth + 2)).append("+");
            if (i < count - 1) {
                line.append("  ");
            }
        }
        return line.toString();
    }

    private String buildRow(List<String> cells, int cellWidth) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            line.append("| ").append(padCell(cells.get(i), cellWidth)).append(" |");
            if (i < cells.size() - 1) {
                line.append("  ");
            }
        }
        return line.toString();
    }

    private String padCell(String value, int width) {
        int visible = visibleLength(value);
        if (visible >= width) {
            return value;
        }
        int total = width - visible;
        int left = total / 2;
        return " ".repeat(left) + value + " ".repeat(total - left);
    }

    private int visibleLength(String value) {
        return value.replaceAll("\\u001B\\[[;\\d]*m", "").length();
    }
}
