package com.memoryscramble;

/**
 * One mutable position of the board: the card on it, whether it is face-up, and
 * which player controls it.
 *
 * Rep Invariant (checked by {@link Board#checkRep()}):
 * - content == null  implies  !faceUp
 * - content == null  implies  controller == null
 * - controller != null  implies  content != null and faceUp
 *
 * Thread Safety:
 * Not thread-safe on its own. Every cell is confined to its Board and only
 * touched while holding the Board's monitor.
 */
final class Cell {
    private String content;
    private boolean faceUp;
    private String controller;

    Cell(String content) {
        this.content = content;
    }

    String content() {
        return content;
    }

    boolean isRemoved() {
        return content == null;
    }

    boolean isFaceUp() {
        return faceUp;
    }

    String controller() {
        return controller;
    }

    boolean isControlledByOther(String player) {
        return controller != null && !controller.equals(player);
    }

    void setController(String player) {
        this.controller = player;
    }

    void turnFaceUp() {
        faceUp = true;
    }

    void turnFaceDown() {
        faceUp = false;
    }

    void replaceContent(String newContent) {
        this.content = newContent;
    }

    /**
     * Takes the card off the board for good. Control is cleared by the caller
     * through {@link CardControl}, which also wakes the waiters.
     */
    void remove() {
        content = null;
        faceUp = false;
    }
}
