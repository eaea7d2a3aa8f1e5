package ai.landlord.sync;

import ai.landlord.game.Card;
import ai.landlord.game.Phase;
import ai.landlord.game.RelativeSeat;
import ai.landlord.game.Seat;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client's replica of one table, rebuilt only from the server messages it receives.
 * <p>
 * Seats arrive as absolute indexes and are stored relative to the local player, so the view can
 * be rendered as "me / left / right" without any further arithmetic.
 */
public class ClientTableView {
    private static final Logger log = LoggerFactory.getLogger(ClientTableView.class);

    private String tableId;
    private Seat mySeat;
    private final List<Card> myCards = new ArrayList<>();
    private final List<Card> reservedCards = new ArrayList<>();
    private final Map<RelativeSeat, Integer> handSizes = new EnumMap<>(RelativeSeat.class);
    private final Map<RelativeSeat, String> playerNames = new EnumMap<>(RelativeSeat.class);
    private Phase phase;
    private RelativeSeat landlord;
    private RelativeSeat currentSeat;
    private RelativeSeat lastPlaySeat;
    private List<Card> lastPlay = List.of();
    private String lastPlayType;
    private int highestBid;
    private int bombMultiplier = 1;
    private RelativeSeat winner;
    private Boolean landlordWon;
    private final Map<RelativeSeat, Integer> scores = new EnumMap<>(RelativeSeat.class);
    private boolean tableClosed;
    private String lastError;
    private List<Card> hint;

    /**
     * Applies one server message. Messages that arrive before {@code game_start} (other than
     * lobby and error messages) are ignored.
     */
    public void apply(ServerMessage message) {
        if (message instanceof ServerMessage.GameStart start) {
            onGameStart(start);
            return;
        }
        if (message instanceof ServerMessage.ErrorMessage error) {
            lastError = error.reason() + ": " + error.message();
            return;
        }
        if (mySeat == null) {
            if (log.isDebugEnabled()) {
                log.debug("Ignoring {} before game start", message.getClass().getSimpleName());
            }
            return;
        }
        if (message instanceof ServerMessage.BidUpdate bid) {
            highestBid = bid.highestBid();
            currentSeat = bid.done() ? null : relative(bid.nextBidder());
        } else if (message instanceof ServerMessage.BidFinalized finalized) {
            landlord = relative(finalized.landlordSeat());
            setHandSizes(finalized.handSizes());
            if (finalized.myCards() != null) {
                replace(myCards, CardView.toCards(finalized.myCards()));
            }
            replace(reservedCards, CardView.toCards(finalized.reservedCards()));
            phase = Phase.PLAYING;
            currentSeat = landlord;
        } else if (message instanceof ServerMessage.Redeal redeal) {
            replace(myCards, CardView.toCards(redeal.myCards()));
            replace(reservedCards, CardView.toCards(redeal.reservedCards()));
            setHandSizes(redeal.handSizes());
            currentSeat = relative(redeal.firstBidder());
            highestBid = 0;
            landlord = null;
        } else if (message instanceof ServerMessage.PlayUpdate play) {
            RelativeSeat seat = relative(play.seat());
            List<Card> cards = CardView.toCards(play.cards());
            if (seat == RelativeSeat.SELF) {
                myCards.removeAll(cards);
            }
            handSizes.put(seat, play.handSizeRemaining());
            lastPlay = List.copyOf(cards);
            lastPlaySeat = seat;
            lastPlayType = play.shapeType();
            bombMultiplier = play.bombMultiplier();
            currentSeat = relative(play.nextSeat());
            hint = null;
        } else if (message instanceof ServerMessage.PassUpdate pass) {
            if (pass.isNewTrick()) {
                lastPlay = List.of();
                lastPlaySeat = null;
                lastPlayType = null;
            }
            currentSeat = relative(pass.nextSeat());
            hint = null;
        } else if (message instanceof ServerMessage.GameOver over) {
            phase = Phase.FINISHED;
            winner = relative(over.winnerSeat());
            landlord = relative(over.landlordSeat());
            landlordWon = over.landlordWon();
            bombMultiplier = over.bombMultiplier();
            for (int i = 0; i < over.scores().size(); i++) {
                scores.put(relative(i), over.scores().get(i));
            }
            currentSeat = null;
        } else if (message instanceof ServerMessage.PlayerLeft left) {
            log.info("Seat {} left table {}", left.seat(), tableId);
            phase = Phase.FINISHED;
            currentSeat = null;
            tableClosed = true;
        } else if (message instanceof ServerMessage.Hint suggestion) {
            hint = new ArrayList<>();
            for (String id : suggestion.cardIds()) {
                Card card = Card.fromId(id);
                if (card != null) {
                    hint.add(card);
                }
            }
        }
    }

    private void onGameStart(ServerMessage.GameStart start) {
        tableId = start.tableId();
        mySeat = Seat.of(start.mySeat());
        replace(myCards, CardView.toCards(start.myCards()));
        replace(reservedCards, CardView.toCards(start.reservedCards()));
        setHandSizes(start.handSizes());
        playerNames.clear();
        for (int i = 0; i < start.playerNames().size(); i++) {
            playerNames.put(relative(i), start.playerNames().get(i));
        }
        phase = Phase.BIDDING;
        currentSeat = relative(start.firstBidder());
        landlord = null;
        lastPlay = List.of();
        lastPlaySeat = null;
        lastPlayType = null;
        highestBid = 0;
        bombMultiplier = 1;
        winner = null;
        landlordWon = null;
        scores.clear();
        tableClosed = false;
        lastError = null;
        hint = null;
    }

    private RelativeSeat relative(int absolute) {
        if (absolute < 0) {
            return null;
        }
        return Seat.of(absolute).relativeTo(mySeat);
    }

    private void setHandSizes(List<Integer> sizes) {
        for (int i = 0; i < sizes.size(); i++) {
            handSizes.put(relative(i), sizes.get(i));
        }
    }

    private static void replace(List<Card> target, List<Card> cards) {
        target.clear();
        target.addAll(Card.sorted(cards));
    }

    public String getTableId() {
        return tableId;
    }

    public Seat getMySeat() {
        return mySeat;
    }

    public List<Card> getMyCards() {
        return List.copyOf(myCards);
    }

    public List<Card> getReservedCards() {
        return List.copyOf(reservedCards);
    }

    public int handSize(RelativeSeat seat) {
        return handSizes.getOrDefault(seat, 0);
    }

    public String playerName(RelativeSeat seat) {
        return playerNames.get(seat);
    }

    public Phase getPhase() {
        return phase;
    }

    public RelativeSeat getLandlord() {
        return landlord;
    }

    public RelativeSeat getCurrentSeat() {
        return currentSeat;
    }

    public boolean isMyTurn() {
        return currentSeat == RelativeSeat.SELF;
    }

    public RelativeSeat getLastPlaySeat() {
        return lastPlaySeat;
    }

    public List<Card> getLastPlay() {
        return lastPlay;
    }

    public String getLastPlayType() {
        return lastPlayType;
    }

    public int getHighestBid() {
        return highestBid;
    }

    public int getBombMultiplier() {
        return bombMultiplier;
    }

    public RelativeSeat getWinner() {
        return winner;
    }

    public Boolean getLandlordWon() {
        return landlordWon;
    }

    public int score(RelativeSeat seat) {
        return scores.getOrDefault(seat, 0);
    }

    public boolean isTableClosed() {
        return tableClosed;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Most recent hint, or {@code null} if none is pending.
     */
    public List<Card> getHint() {
        return hint == null ? null : List.copyOf(hint);
    }
}
