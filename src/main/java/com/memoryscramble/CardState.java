package com.memoryscramble;

/**
 * Enumeration representing what a position on the board shows right now.
 *
 * A card can be in one of four states:
 * - NONE: No card exists at this position (removed after matching)
 * - FACE_DOWN: Card exists but is not visible to any player
 * - FACE_UP_CONTROLLED: Card is visible and controlled by a specific player
 * - FACE_UP_UNCONTROLLED: Card is visible but not controlled by any player
 *
 * Abstraction Function:
 * AF(state) = the visibility and control status of the card at one position,
 *   derived from the cell's content, face-up flag and controller.
 *
 * Thread Safety:
 * This enum is immutable and thread-safe.
 */
public enum CardState {
    /**
     * No card at this position; it was removed after a match.
     */
    NONE,

    /**
     * Card exists and is face-down.
     */
    FACE_DOWN,

    /**
     * Card is face-up and controlled by a player.
     * The controlling player is available from {@link Board#controllerOf(int, int)}.
     */
    FACE_UP_CONTROLLED,

    /**
     * Card is face-up and nobody controls it. Any player may take it as a first pick.
     */
    FACE_UP_UNCONTROLLED;

    static CardState of(Cell cell) {
        if (cell.isRemoved()) {
            return NONE;
        }
        if (!cell.isFaceUp()) {
            return FACE_DOWN;
        }
        return cell.controller() != null ? FACE_UP_CONTROLLED : FACE_UP_UNCONTROLLED;
    }
}
