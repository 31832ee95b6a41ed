package com.memoryscramble;

import java.util.List;

/**
 * Turn state of one player.
 *
 * A player is in exactly one of these states:
 * - IDLE: nothing held, nothing left to clean up
 * - HOLDING_FIRST: one card picked this turn, waiting for the second
 * - MATCHED: last turn ended in a match; the pair is removed on the next flip
 * - MISMATCHED: last turn ended in a mismatch (or a failed second pick); those
 *   cards turn face-down on the next flip if nobody took them meanwhile
 *
 * Abstraction Function:
 * AF(state, cards) = a player who holds cards.get(0) as first pick when state is
 *   HOLDING_FIRST, or who owes cleanup of every position in cards when state is
 *   MATCHED or MISMATCHED.
 *
 * Rep Invariant:
 * - state == IDLE  iff  cards is empty
 * - state == HOLDING_FIRST  implies  cards.size() == 1
 * - state == MATCHED  implies  cards.size() == 2
 *
 * Thread Safety:
 * Confined to the Board that created it; only used under the Board's monitor.
 */
final class PlayerSession {

    enum TurnState { IDLE, HOLDING_FIRST, MATCHED, MISMATCHED }

    private final String player;
    private TurnState state = TurnState.IDLE;
    private List<Position> cards = List.of();

    PlayerSession(String player) {
        this.player = player;
    }

    String player() {
        return player;
    }

    TurnState state() {
        return state;
    }

    /**
     * @return the first pick of the current turn
     * @throws IllegalStateException if the player holds no first pick
     */
    Position first() {
        if (state != TurnState.HOLDING_FIRST) {
            throw new IllegalStateException(player + " holds no first card");
        }
        return cards.get(0);
    }

    /**
     * @return positions owed cleanup from the previous turn; empty unless MATCHED or MISMATCHED
     */
    List<Position> pending() {
        return state == TurnState.MATCHED || state == TurnState.MISMATCHED ? cards : List.of();
    }

    void holdFirst(Position first) {
        set(TurnState.HOLDING_FIRST, List.of(first));
    }

    void matched(Position first, Position second) {
        set(TurnState.MATCHED, List.of(first, second));
    }

    void mismatched(List<Position> positions) {
        set(TurnState.MISMATCHED, List.copyOf(positions));
    }

    void idle() {
        set(TurnState.IDLE, List.of());
    }

    private void set(TurnState newState, List<Position> newCards) {
        this.state = newState;
        this.cards = newCards;
    }

    @Override
    public String toString() {
        return player + ":" + state + cards;
    }
}
