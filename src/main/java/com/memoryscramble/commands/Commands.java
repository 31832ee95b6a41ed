package com.memoryscramble.commands;

import com.memoryscramble.Board;
import com.memoryscramble.FlipException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Commands module for the Memory Scramble game.
 *
 * This module is the application-level interface in front of the Board ADT. It
 * validates player IDs, calls the Board, and formats every result as the
 * player's view of the board, or as a single "ERROR: ..." line when a game rule
 * rejects the request.
 *
 * Representation Invariant:
 * - board != null
 *
 * Abstraction Function:
 * AF(board) = a command processor that executes game operations on the shared
 *             board instance and returns results as formatted strings
 *
 * Safety from Rep Exposure:
 * - The board field is private and final
 * - Methods only return immutable Strings
 *
 * Thread Safety:
 * Thread-safe because board mutations happen in Board (which is synchronized),
 * and no mutable state is maintained in this class. watch() and map() block the
 * calling thread only, never the board.
 */
public class Commands {
    private static final Logger LOG = LoggerFactory.getLogger(Commands.class);

    private static final Pattern PLAYER_ID = Pattern.compile("^\\w+$");

    /** The shared game board instance. */
    private final Board board;

    /**
     * Constructs a Commands instance wrapping the given board.
     *
     * @param board the game board to execute commands on
     * @throws IllegalArgumentException if board is null
     */
    public Commands(Board board) {
        if (board == null) {
            throw new IllegalArgumentException("Board cannot be null");
        }
        this.board = board;
    }

    /**
     * Returns the current board state visible to the given player.
     *
     * Player's controlled cards show as "my ", other face-up cards as "up ",
     * face-down as "down", and removed as "none".
     *
     * @param player the player ID requesting the board state
     * @return the board state visible to this player, or "ERROR: ..." for a bad player ID
     */
    public String look(String player) {
        if (!isValidPlayer(player)) {
            return invalidPlayer(player);
        }
        return board.look(player);
    }

    /**
     * Flips a card for the given player, then returns what the player sees.
     *
     * Cleanup of the player's previous turn and the wait for a card held by
     * another player both happen inside {@link Board#flip(String, int, int)}.
     *
     * Blocking Behavior:
     * May block while another player controls the card the player picks first.
     *
     * @param player the player ID making the move
     * @param row the row index of the card to flip
     * @param col the column index of the card to flip
     * @return the updated board state, or "ERROR: ..." if the flip was rejected
     */
    public String flip(String player, int row, int col) {
        if (!isValidPlayer(player)) {
            return invalidPlayer(player);
        }
        try {
            board.flip(player, row, col);
            return board.look(player);
        } catch (FlipException e) {
            LOG.debug("Flip by {} at {},{} rejected: {} ({})", player, row, col, e.getMessage(), e.error());
            return "ERROR: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "ERROR: Interrupted while waiting";
        }
    }

    /**
     * Replaces every card by f(card), then returns what the player sees.
     *
     * @param player the player ID requesting the change
     * @param f replacement function for card values
     * @return the updated board state, or "ERROR: ..." if the request failed
     */
    public String map(String player, Function<String, String> f) {
        if (!isValidPlayer(player)) {
            return invalidPlayer(player);
        }
        try {
            board.transform(f);
            return board.look(player);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "ERROR: Interrupted while waiting";
        } catch (RuntimeException e) {
            LOG.warn("Map requested by {} failed", player, e);
            return "ERROR: " + e.getMessage();
        }
    }

    /**
     * Waits for the next visible change of the board, then returns what the player sees.
     *
     * @param player player ID watching for updates
     * @return new board state for this player
     */
    public String watch(String player) {
        if (!isValidPlayer(player)) {
            return invalidPlayer(player);
        }
        try {
            board.watch();
            return board.look(player);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "ERROR: Interrupted while waiting";
        }
    }

    private static boolean isValidPlayer(String player) {
        return player != null && PLAYER_ID.matcher(player).matches();
    }

    private static String invalidPlayer(String player) {
        return "ERROR: Invalid player ID '" + player + "'";
    }
}
