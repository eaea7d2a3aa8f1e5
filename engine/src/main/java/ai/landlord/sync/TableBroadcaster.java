package ai.landlord.sync;

import ai.landlord.game.Card;
import ai.landlord.game.Seat;
import ai.landlord.game.TableEvent;
import ai.landlord.game.TableState;
import ai.landlord.game.Transition;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replicates engine events to the remote seats of one table.
 * <p>
 * Each event becomes either one message for every seat or, where private information is
 * involved, a message built per seat from that seat's own hand. Another seat's cards are never
 * put into a message; opponents only ever see hand sizes.
 */
public class TableBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(TableBroadcaster.class);

    private final String tableId;
    private final List<TableSeat> seats;
    private final boolean[] departed = new boolean[Seat.COUNT];

    public TableBroadcaster(String tableId, List<TableSeat> seats) {
        this.tableId = tableId;
        this.seats = List.copyOf(seats);
    }

    /**
     * Stops sending to a seat whose client has gone away.
     */
    public void markDeparted(Seat seat) {
        departed[seat.index()] = true;
    }

    public void gameStarted(TableState state) {
        List<String> names = new ArrayList<>();
        for (TableSeat seat : seats) {
            names.add(seat.nickname());
        }
        List<CardView> reserved = CardView.of(state.reservedCards());
        sendEach(seat -> new ServerMessage.GameStart(tableId, CardView.of(state.hand(seat)), reserved, seat.index(),
                state.bidding().firstBidder().index(), state.handSizes(), names));
    }

    /**
     * Sends the messages for every event of an accepted transition.
     */
    public void publish(Transition transition) {
        TableState state = transition.state();
        for (TableEvent event : transition.events()) {
            if (event instanceof TableEvent.BidPlaced bid) {
                sendAll(new ServerMessage.BidUpdate(bid.seat().index(), bid.wantsToBid(), bid.highestBid(),
                        bid.done(), indexOf(bid.nextBidder())));
            } else if (event instanceof TableEvent.LandlordAssigned assigned) {
                Seat landlord = assigned.landlord();
                List<CardView> reserved = CardView.of(assigned.reserved());
                sendEach(seat -> new ServerMessage.BidFinalized(landlord.index(), reserved, state.handSizes(),
                        seat.equals(landlord) ? CardView.of(state.hand(seat)) : null));
            } else if (event instanceof TableEvent.Redealt redealt) {
                List<CardView> reserved = CardView.of(state.reservedCards());
                sendEach(seat -> new ServerMessage.Redeal(CardView.of(state.hand(seat)), reserved,
                        redealt.firstBidder().index(), state.handSizes()));
            } else if (event instanceof TableEvent.CardsPlayed played) {
                sendAll(new ServerMessage.PlayUpdate(played.seat().index(), CardView.of(played.cards()),
                        played.shape().type().getWireName(), played.handSizeRemaining(),
                        indexOf(played.nextSeat()), played.bombMultiplier()));
            } else if (event instanceof TableEvent.Passed passed) {
                sendAll(new ServerMessage.PassUpdate(passed.seat().index(), passed.nextSeat().index(),
                        passed.newTrick(), passed.consecutivePasses()));
            } else if (event instanceof TableEvent.DealFinished finished) {
                sendAll(new ServerMessage.GameOver(finished.winner().index(), finished.landlord().index(),
                        finished.landlordWon(), CardView.of(finished.finalCards()),
                        finished.finalShape().type().getWireName(), finished.bombMultiplier(), finished.scores()));
            } else if (event instanceof TableEvent.DealAborted aborted) {
                markDeparted(aborted.seat());
                sendAll(new ServerMessage.PlayerLeft(aborted.seat().index()));
            } else {
                log.warn("No replication for event {}", event);
            }
        }
    }

    /**
     * Sends a message to one seat only.
     */
    public void sendTo(Seat seat, ServerMessage message) {
        TableSeat target = seats.get(seat.index());
        if (target.isRemote() && !departed[seat.index()]) {
            deliver(target, message);
        }
    }

    private void sendAll(ServerMessage message) {
        for (TableSeat seat : seats) {
            sendTo(seat.seat(), message);
        }
    }

    private void sendEach(Function<Seat, ServerMessage> perSeat) {
        for (TableSeat seat : seats) {
            if (seat.isRemote() && !departed[seat.seat().index()]) {
                deliver(seat, perSeat.apply(seat.seat()));
            }
        }
    }

    /**
     * A failing channel must not keep the message from the other seats.
     */
    private void deliver(TableSeat target, ServerMessage message) {
        try {
            target.channel().send(message);
        } catch (RuntimeException e) {
            log.warn("Table {}: could not send {} to seat {}", tableId, message.getClass().getSimpleName(),
                    target.seat(), e);
        }
    }

    private static int indexOf(Seat seat) {
        return seat == null ? -1 : seat.index();
    }

    static List<String> ids(List<Card> cards) {
        List<String> ids = new ArrayList<>();
        for (Card card : cards) {
            ids.add(card.id());
        }
        return ids;
    }
}
