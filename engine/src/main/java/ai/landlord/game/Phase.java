package ai.landlord.game;

/**
 * Phases of a single deal.
 */
public enum Phase {
    /** Seats take turns deciding whether to bid for the landlord role. */
    BIDDING,
    /** The landlord leads and tricks are played until a hand is empty. */
    PLAYING,
    /** A seat emptied its hand, or the table was aborted. */
    FINISHED
}
