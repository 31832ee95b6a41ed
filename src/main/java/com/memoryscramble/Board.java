package com.memoryscramble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Mutable Board ADT for the Memory Scramble game.
 *
 * THREAD SAFETY ARGUMENT
 * ======================
 *
 * This class is thread-safe using the MONITOR PATTERN with per-card wait queues.
 *
 * What Threads Exist:
 * - Any number of player threads calling flip(), look(), transform() and watch()
 * - Threads of the transform executor computing new card values
 *
 * What Data Is Accessed:
 * - Mutable shared data: grid[][] (content, face-up, controller of each cell),
 *   the wait queues in control, and the sessions map
 * - Immutable data: rows, cols, the first-pick timeout and transform executor (final fields)
 *
 * Thread Safety Strategy:
 *
 * 1. SYNCHRONIZATION (Monitor Pattern):
 *    - Every method reading or writing the grid, the queues or the sessions is
 *      synchronized on this Board
 *    - A flip runs from start to end without interleaving, except at the one
 *      suspension point below
 *
 * 2. FIFO WAITING (wait/notifyAll with tickets):
 *    - A first pick on a card controlled by another player enqueues a ticket in
 *      CardControl and waits on this monitor, releasing it
 *    - Each release marks exactly one ticket, oldest first; only that thread
 *      leaves its wait loop, so waiters are served in arrival order
 *    - After waking, the flip re-reads the card, which may have been removed
 *    - Until the woken thread is back, the card stays promised to it and no
 *      other flip can take it
 *
 * 3. NO DEADLOCK:
 *    - A second pick never waits: contention fails with CARD_ALREADY_CONTROLLED,
 *      so no player ever waits while holding a card
 *    - watch() waits on a future owned by ChangeNotifier and never holds this monitor
 *    - transform() computes new values outside the monitor and only takes it to
 *      write each result back
 *
 * 4. IMMUTABILITY:
 *    - rows and cols are final and never change after construction
 *
 * Rep Invariant (checked by checkRep() on entry and exit of every public operation):
 * - rows > 0, cols > 0, grid is rows x cols
 * - removed card  implies  face-down and uncontrolled
 * - controlled card  implies  present and face-up
 *
 * Abstraction Function:
 * AF(grid, sessions) = a rows x cols Memory Scramble board where position (r,c)
 *   holds grid[r][c].content (or no card when null), shown face-up iff
 *   grid[r][c].faceUp, and claimed by player grid[r][c].controller; each player
 *   p is in the turn described by sessions.get(p), or idle if absent.
 *
 * Safety from Rep Exposure:
 * - All fields are private; cells, sessions and queues never leave this class
 *   and its package helpers
 * - Queries return Strings, enums and booleans
 *
 * A Board configured with a positive transform parallelism owns a thread pool;
 * {@link #close()} shuts it down.
 */
public class Board implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Board.class);

    private final int rows;
    private final int cols;
    private final Cell[][] grid;
    private final CardControl control;
    private final Map<String, PlayerSession> sessions = new HashMap<>();
    private final ChangeNotifier notifier = new ChangeNotifier();
    private final long firstPickTimeoutMillis;
    private final Executor transformExecutor;
    private final ExecutorService ownedExecutor;

    /**
     * Constructs a Board with given dimensions and card layout, using the
     * configured {@link BoardSettings}.
     *
     * @see #Board(int, int, List, BoardSettings)
     */
    public Board(int rows, int cols, List<String> cards) {
        this(rows, cols, cards, BoardSettings.load());
    }

    /**
     * Constructs a Board with given dimensions and card layout.
     *
     * Precondition:
     * - rows > 0 and cols > 0
     * - cards.size() == rows * cols
     * - cards do not contain null or empty elements
     *
     * Postcondition:
     * - Board is initialized with all cards face-down
     * - No player controls any card
     *
     * @param rows the number of rows (must be positive)
     * @param cols the number of columns (must be positive)
     * @param cards the card layout in row-major order (left to right, top to bottom)
     * @param settings wait and transform settings
     * @throws IllegalArgumentException if rows or cols is non-positive
     * @throws IllegalArgumentException if cards.size() != rows * cols or a card is empty
     */
    public Board(int rows, int cols, List<String> cards, BoardSettings settings) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Rows and cols must be positive");
        }
        if (cards.size() != (long) rows * cols) {
            throw new IllegalArgumentException("Cards count must equal rows * cols");
        }

        this.rows = rows;
        this.cols = cols;
        this.grid = new Cell[rows][cols];
        this.control = new CardControl(this);
        this.firstPickTimeoutMillis = settings.firstPickTimeout().toMillis();
        if (settings.transformParallelism() > 0) {
            this.ownedExecutor = Executors.newFixedThreadPool(settings.transformParallelism(), new TransformThreadFactory());
            this.transformExecutor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.transformExecutor = ForkJoinPool.commonPool();
        }

        int idx = 0;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                String card = cards.get(idx++);
                if (card == null || card.isEmpty()) {
                    throw new IllegalArgumentException("Card at " + i + "," + j + " must not be empty");
                }
                grid[i][j] = new Cell(card);
            }
        }
        checkRep();
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return cols;
    }

    /**
     * Returns the card at the specified position.
     *
     * @return card identifier, or null if the card was removed
     * @throws IndexOutOfBoundsException if the position is off the board
     */
    public synchronized String getCard(int row, int col) {
        checkRep();
        return cellAt(row, col).content();
    }

    /**
     * @throws IndexOutOfBoundsException if the position is off the board
     */
    public synchronized CardState getState(int row, int col) {
        checkRep();
        return CardState.of(cellAt(row, col));
    }

    /**
     * @throws IndexOutOfBoundsException if the position is off the board
     */
    public synchronized boolean isFaceUp(int row, int col) {
        checkRep();
        return cellAt(row, col).isFaceUp();
    }

    /**
     * Returns the player ID controlling the card at this position, or null.
     *
     * @throws IndexOutOfBoundsException if the position is off the board
     */
    public synchronized String controllerOf(int row, int col) {
        checkRep();
        return cellAt(row, col).controller();
    }

    /**
     * Checks if a player has a first card waiting for a second flip.
     *
     * @param playerId the player ID to check
     * @return true if the player's next flip is a second pick
     */
    public synchronized boolean hasFirstCard(String playerId) {
        checkRep();
        PlayerSession session = sessions.get(playerId);
        return session != null && session.state() == PlayerSession.TurnState.HOLDING_FIRST;
    }

    /**
     * Flips a card at position (row, col) for the given player.
     *
     * Order of work:
     * 1. Coordinates are checked; nothing changes if they are off the board.
     * 2. If the player holds no card, the previous turn is finished: a matched
     *    pair is removed, mismatched cards nobody took meanwhile turn face-down.
     * 3. A first pick on a card another player controls waits, in FIFO order
     *    with other waiters on that card, until the card is released.
     * 4. First pick: the card turns face-up and the player controls it.
     * 5. Second pick: never waits. On success both cards are compared; a match
     *    stays controlled until the player's next flip, a mismatch is released.
     *
     * Precondition:
     * - playerId is a non-empty string
     *
     * Postcondition:
     * - Rep invariant is maintained
     * - Watchers are notified of every visible change
     *
     * @param playerId the player ID
     * @param row the row index (0-based)
     * @param col the column index (0-based)
     * @throws FlipException if a game rule rejects the flip; see {@link FlipError}
     * @throws InterruptedException if interrupted while waiting for a card
     * @throws IllegalArgumentException if playerId is null or empty
     */
    public synchronized void flip(String playerId, int row, int col) throws FlipException, InterruptedException {
        if (playerId == null || playerId.isEmpty()) {
            throw new IllegalArgumentException("Player ID must not be empty");
        }
        checkRep();
        try {
            if (!inBounds(row, col)) {
                throw new FlipException(FlipError.INVALID_COORDINATES,
                        "Invalid position (" + row + "," + col + ")");
            }
            Position target = new Position(row, col);
            PlayerSession session = sessions.computeIfAbsent(playerId, PlayerSession::new);

            boolean waited = false;
            if (session.state() != PlayerSession.TurnState.HOLDING_FIRST) {
                finishPreviousTurn(session);
                waited = waitIfControlledByOther(session, target);
            }

            try {
                switch (session.state()) {
                    case IDLE:
                        flipFirst(session, target);
                        break;
                    case HOLDING_FIRST:
                        flipSecond(session, target);
                        break;
                    default:
                        throw new FlipException(FlipError.PROTOCOL_VIOLATION,
                                "Player " + playerId + " cannot flip a third card without finishing the turn");
                }
            } finally {
                if (waited) {
                    // a woken waiter that did not take the card hands its turn on
                    control.passOn(target, cellAt(target));
                }
            }
        } finally {
            checkRep();
        }
    }

    /**
     * Rules 3-A and 3-B: settles the outcome of the player's previous turn.
     * Does nothing if the player has nothing left to clean up.
     */
    private void finishPreviousTurn(PlayerSession session) {
        switch (session.state()) {
            case MATCHED:
                boolean removed = false;
                List<Position> pair = session.pending();
                for (Position pos : pair) {
                    Cell cell = cellAt(pos);
                    if (!cell.isRemoved()) {
                        cell.remove();
                        control.releaseRemoved(pos, cell);
                        removed = true;
                    }
                }
                session.idle();
                if (removed) {
                    LOG.debug("{} removed matched pair {}", session.player(), pair);
                    notifier.fire();
                }
                break;
            case MISMATCHED:
                boolean flippedDown = false;
                for (Position pos : session.pending()) {
                    Cell cell = cellAt(pos);
                    if (!cell.isRemoved() && cell.isFaceUp() && cell.controller() == null) {
                        cell.turnFaceDown();
                        flippedDown = true;
                    }
                }
                session.idle();
                if (flippedDown) {
                    notifier.fire();
                }
                break;
            default:
                break;
        }
    }

    /**
     * Rule 1-D: blocks a first pick while another player controls the card or
     * the card is promised to a woken waiter.
     *
     * @return true if the flip waited
     */
    private boolean waitIfControlledByOther(PlayerSession session, Position target)
            throws FlipException, InterruptedException {
        Cell cell = cellAt(target);
        boolean held = cell.isFaceUp() && cell.isControlledByOther(session.player());
        if (!held && !control.isPromised(target)) {
            return false;
        }
        LOG.debug("{} waiting for {} held by {}", session.player(), target,
                held ? cell.controller() : "a woken waiter");
        if (!control.awaitRelease(target, session.player(), firstPickTimeoutMillis)) {
            throw new FlipException(FlipError.CARD_CONTROLLED_BY_OTHER,
                    "Card at " + target + " is still controlled by another player");
        }
        return true;
    }

    private void flipFirst(PlayerSession session, Position target) throws FlipException {
        Cell cell = cellAt(target);
        if (cell.isRemoved()) {
            throw new FlipException(FlipError.NO_CARD_AT_POSITION, "No card at position " + target);
        }
        if (!control.tryAcquire(target, cell, session.player())) {
            throw new FlipException(FlipError.CARD_CONTROLLED_BY_OTHER,
                    "Card at " + target + " is controlled by another player");
        }
        boolean wasFaceDown = !cell.isFaceUp();
        cell.turnFaceUp();
        session.holdFirst(target);
        if (wasFaceDown) {
            notifier.fire();
        }
    }

    private void flipSecond(PlayerSession session, Position target) throws FlipException {
        String player = session.player();
        Position first = session.first();
        if (target.equals(first)) {
            return;
        }

        Cell cell = cellAt(target);
        // Rule 2-A
        if (cell.isRemoved()) {
            giveUpFirst(session, first);
            throw new FlipException(FlipError.NO_CARD_AT_POSITION, "No card at position " + target);
        }
        // Rule 2-B: never wait for a second card
        boolean wasFaceDown = !cell.isFaceUp();
        if (!control.tryAcquire(target, cell, player)) {
            giveUpFirst(session, first);
            throw new FlipException(FlipError.CARD_ALREADY_CONTROLLED,
                    "Card at " + target + " is already controlled by another player");
        }

        // Rule 2-C
        cell.turnFaceUp();
        if (wasFaceDown) {
            notifier.fire();
        }

        Cell firstCell = cellAt(first);
        if (cell.content().equals(firstCell.content())) {
            // Rule 2-D
            session.matched(first, target);
            LOG.debug("{} matched {} at {} and {}", player, cell.content(), first, target);
        } else {
            // Rule 2-E
            control.release(first, firstCell);
            control.release(target, cell);
            session.mismatched(List.of(first, target));
        }
    }

    private void giveUpFirst(PlayerSession session, Position first) {
        control.release(first, cellAt(first));
        session.mismatched(List.of(first));
    }

    /**
     * Blocks until the next visible change of the board: a card turning
     * face-up or face-down, being removed, or changing value. A change of
     * control alone does not count.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void watch() throws InterruptedException {
        await(watchAsync());
    }

    /**
     * Registers for the next visible change without blocking.
     *
     * The future may be completed by a thread that holds this Board's monitor;
     * attach dependent actions with the async variants of CompletableFuture.
     *
     * @return a future completed by the next visible change
     */
    public CompletableFuture<Void> watchAsync() {
        return notifier.register();
    }

    /**
     * Replaces every card on the board by f(card), computing the new values
     * concurrently on the board's transform executor.
     *
     * Flips may run while f computes. A card removed before its new value is
     * ready stays removed. Watchers are notified once all values are written.
     *
     * @param f the replacement function; must not return null or empty
     * @throws InterruptedException if interrupted while waiting for f
     * @throws RuntimeException thrown by f; NullPointerException or
     *         IllegalArgumentException if f returned null or an empty card
     */
    public void transform(Function<String, String> f) throws InterruptedException {
        Objects.requireNonNull(f, "f");
        await(transformAsync(card -> CompletableFuture.supplyAsync(() -> f.apply(card), transformExecutor)));
    }

    /**
     * Like {@link #transform(Function)}, but with an asynchronous function.
     *
     * If f throws for a card, the returned future fails with that exception
     * once the other cards have been written; watchers are still notified.
     *
     * @param f returns a stage completed with the new value of a card
     * @return a future completed when every new value has been written
     */
    public CompletableFuture<Void> transformAsync(Function<String, ? extends CompletionStage<String>> f) {
        Objects.requireNonNull(f, "f");
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (Map.Entry<Position, String> live : liveCards().entrySet()) {
            Position pos = live.getKey();
            tasks.add(CompletableFuture.completedFuture(live.getValue())
                    .thenCompose(f)
                    .thenAccept(newCard -> replaceIfPresent(pos, newCard)));
        }
        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
                .whenComplete((ignored, failure) -> notifier.fire());
    }

    private synchronized Map<Position, String> liveCards() {
        checkRep();
        Map<Position, String> live = new LinkedHashMap<>();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                if (!grid[i][j].isRemoved()) {
                    live.put(new Position(i, j), grid[i][j].content());
                }
            }
        }
        return live;
    }

    private synchronized void replaceIfPresent(Position pos, String newCard) {
        Objects.requireNonNull(newCard, "Transform produced no card for " + pos);
        if (newCard.isEmpty()) {
            throw new IllegalArgumentException("Transform produced an empty card for " + pos);
        }
        Cell cell = cellAt(pos);
        if (!cell.isRemoved()) {
            cell.replaceContent(newCard);
        }
        checkRep();
    }

    /**
     * Returns the board state visible to a player.
     *
     * Format:
     * - First line: "ROWSxCOLS"
     * - Following lines: one card state per line (row-major order)
     * - States: "none", "down", "up CARD", "my CARD"
     *
     * Example output for 2x2 board:
     * 2x2
     * my 🦄
     * down
     * up 🌈
     * none
     *
     * @param playerId the player ID (used to distinguish "my" vs "up" cards)
     * @return string representation of board state
     */
    public synchronized String look(String playerId) {
        checkRep();
        StringBuilder sb = new StringBuilder();
        sb.append(rows).append("x").append(cols).append("\n");

        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                Cell cell = grid[i][j];
                if (cell.isRemoved()) {
                    sb.append("none");
                } else if (!cell.isFaceUp()) {
                    sb.append("down");
                } else if (playerId != null && playerId.equals(cell.controller())) {
                    sb.append("my ").append(cell.content());
                } else {
                    sb.append("up ").append(cell.content());
                }
                sb.append("\n");
            }
        }
        return sb.toString();
    }

    /**
     * @return number of players waiting for the card at (row, col)
     */
    synchronized int waitingAt(int row, int col) {
        return control.queueLength(new Position(row, col));
    }

    /**
     * @return number of callers currently blocked in watch()
     */
    int watcherCount() {
        return notifier.watcherCount();
    }

    /**
     * Checks representation invariants.
     *
     * Unlike {@code assert}, runs whether or not assertions are enabled.
     *
     * @throws InvariantViolation if a cell is inconsistent
     */
    synchronized void checkRep() {
        check(rows > 0 && cols > 0, "Invalid dimensions " + rows + "x" + cols);
        check(grid.length == rows, "Grid rows mismatch");
        for (int i = 0; i < rows; i++) {
            check(grid[i].length == cols, "Grid cols mismatch at row " + i);
            for (int j = 0; j < cols; j++) {
                Cell cell = grid[i][j];
                if (cell.isRemoved()) {
                    check(!cell.isFaceUp(), "Card at " + i + "," + j + " is removed but face-up");
                    check(cell.controller() == null,
                            "Card at " + i + "," + j + " is removed but controlled by " + cell.controller());
                } else if (cell.controller() != null) {
                    check(cell.isFaceUp(),
                            "Card at " + i + "," + j + " is face-down but controlled by " + cell.controller());
                }
            }
        }
    }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                Cell cell = grid[i][j];
                String state = cell.isRemoved() ? "none" : cell.isFaceUp() ? "up" : "down";
                sb.append(cell.isRemoved() ? "none" : cell.content()).append("(").append(state).append(") ");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Shuts down the transform thread pool this Board owns, if any. The game
     * itself stays playable; a later transform on a closed Board fails with
     * RejectedExecutionException.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
            LOG.debug("Transform pool of {}x{} board shut down", rows, cols);
        }
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new InvariantViolation(message);
        }
    }

    private boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    private Cell cellAt(Position pos) {
        return grid[pos.row()][pos.col()];
    }

    private Cell cellAt(int row, int col) {
        if (!inBounds(row, col)) {
            throw new IndexOutOfBoundsException("Invalid position (" + row + "," + col + ")");
        }
        return grid[row][col];
    }

    private static void await(CompletableFuture<Void> future) throws InterruptedException {
        try {
            future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static final class TransformThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "board-transform-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
