package com.memoryscramble;

/**
 * Reasons a flip is rejected by the game rules.
 */
public enum FlipError {
    /** Row or column outside the board. */
    INVALID_COORDINATES,
    /** The card at the target position has been removed. */
    NO_CARD_AT_POSITION,
    /** Second pick on a card another player controls. Never waits. */
    CARD_ALREADY_CONTROLLED,
    /** First pick on a card that is still controlled by another player after waiting. */
    CARD_CONTROLLED_BY_OTHER,
    /** A player tried to pick a third card in one turn. */
    PROTOCOL_VIOLATION
}
