package com.memoryscramble;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Tests of the board with several player threads: waiting for controlled
 * cards, fail-fast second picks, watchers and concurrent transforms.
 *
 * Board layout used unless stated otherwise:
 * A A
 * B B
 */
class BoardConcurrencyTest {

    private static final BoardSettings UNBOUNDED = new BoardSettings(Duration.ZERO, 0);

    private ExecutorService pool;
    private Board board;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        board = new Board(2, 2, List.of("A", "A", "B", "B"), UNBOUNDED);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private Future<Void> flipLater(String player, int row, int col) {
        return pool.submit(() -> {
            board.flip(player, row, col);
            return null;
        });
    }

    private void awaitWaiters(int row, int col, int count) {
        await().atMost(5, TimeUnit.SECONDS).until(() -> board.waitingAt(row, col) == count);
    }

    private static FlipError failureOf(Future<?> flip) throws Exception {
        try {
            flip.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(FlipException.class);
            return ((FlipException) e.getCause()).error();
        }
        return fail("flip was expected to fail");
    }

    private static long liveTransformThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.isAlive() && t.getName().startsWith("board-transform-"))
                .count();
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void matchedPairIsRemovedOnTheNextFlip() throws Exception {
        board.flip("p1", 0, 0);
        board.flip("p1", 0, 1);
        assertThat(board.look("p1")).isEqualTo("2x2\nmy A\nmy A\ndown\ndown\n");

        board.flip("p1", 1, 0);
        assertThat(board.look("p1")).isEqualTo("2x2\nnone\nnone\nmy B\ndown\n");
    }

    @Test
    void mismatchedPairTurnsDownBeforeTheNextPick() throws Exception {
        board.flip("p1", 0, 0);
        board.flip("p1", 1, 0);
        assertThat(board.look("p1")).isEqualTo("2x2\nup A\ndown\nup B\ndown\n");

        board.flip("p1", 1, 1);
        assertThat(board.look("p1")).isEqualTo("2x2\ndown\ndown\ndown\nmy B\n");
    }

    @Test
    void firstPickWaitsUntilTheCardIsReleased() throws Exception {
        board.flip("p1", 0, 0);
        Future<Void> p2 = flipLater("p2", 0, 0);
        awaitWaiters(0, 0, 1);
        assertThat(p2).isNotDone();

        board.flip("p1", 1, 0);

        p2.get(5, TimeUnit.SECONDS);
        assertThat(board.controllerOf(0, 0)).isEqualTo("p2");
        assertThat(board.look("p2")).startsWith("2x2\nmy A\n");
    }

    @Test
    void waiterFailsWhenTheCardIsRemovedMeanwhile() throws Exception {
        board.flip("p1", 0, 0);
        Future<Void> p2 = flipLater("p2", 0, 0);
        awaitWaiters(0, 0, 1);

        board.flip("p1", 0, 1);
        assertThat(p2).isNotDone();

        board.flip("p1", 1, 0);
        assertThat(failureOf(p2)).isEqualTo(FlipError.NO_CARD_AT_POSITION);
        assertThat(board.getState(0, 0)).isEqualTo(CardState.NONE);
    }

    @Test
    void removalWakesEveryWaiter() throws Exception {
        board.flip("p1", 0, 0);
        Future<Void> p2 = flipLater("p2", 0, 0);
        awaitWaiters(0, 0, 1);
        Future<Void> p3 = flipLater("p3", 0, 0);
        awaitWaiters(0, 0, 2);

        board.flip("p1", 0, 1);
        board.flip("p1", 1, 0);

        assertThat(failureOf(p2)).isEqualTo(FlipError.NO_CARD_AT_POSITION);
        assertThat(failureOf(p3)).isEqualTo(FlipError.NO_CARD_AT_POSITION);
        assertThat(board.waitingAt(0, 0)).isZero();
    }

    @Test
    void waitersAreServedInArrivalOrder() throws Exception {
        board.flip("p1", 0, 0);
        Future<Void> p2 = flipLater("p2", 0, 0);
        awaitWaiters(0, 0, 1);
        Future<Void> p3 = flipLater("p3", 0, 0);
        awaitWaiters(0, 0, 2);

        board.flip("p1", 1, 0);

        p2.get(5, TimeUnit.SECONDS);
        assertThat(board.controllerOf(0, 0)).isEqualTo("p2");
        assertThat(board.waitingAt(0, 0)).isEqualTo(1);
        assertThat(p3).isNotDone();

        board.flip("p2", 1, 1);

        p3.get(5, TimeUnit.SECONDS);
        assertThat(board.controllerOf(0, 0)).isEqualTo("p3");
        assertThat(board.waitingAt(0, 0)).isZero();
    }

    @Test
    void secondPickOnControlledCardFailsWithoutWaiting() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            board.flip("p1", 0, 0);
            board.flip("p2", 1, 0);

            assertThatThrownBy(() -> board.flip("p1", 1, 0))
                    .isInstanceOf(FlipException.class)
                    .extracting(e -> ((FlipException) e).error())
                    .isEqualTo(FlipError.CARD_ALREADY_CONTROLLED);
        });

        assertThat(board.controllerOf(0, 0)).isNull();
        assertThat(board.isFaceUp(0, 0)).isTrue();
        assertThat(board.hasFirstCard("p1")).isFalse();
        assertThat(board.controllerOf(1, 0)).isEqualTo("p2");
        assertThat(board.waitingAt(1, 0)).isZero();
    }

    @Test
    void releasedFirstPickWakesItsWaiter() throws Exception {
        board.flip("p1", 0, 0);
        board.flip("p2", 1, 0);
        Future<Void> p3 = flipLater("p3", 0, 0);
        awaitWaiters(0, 0, 1);

        assertThatThrownBy(() -> board.flip("p1", 1, 0)).isInstanceOf(FlipException.class);

        p3.get(5, TimeUnit.SECONDS);
        assertThat(board.controllerOf(0, 0)).isEqualTo("p3");
    }

    @Test
    void boundedWaitGivesUp() throws Exception {
        board = new Board(2, 2, List.of("A", "A", "B", "B"), new BoardSettings(Duration.ofMillis(100), 0));
        board.flip("p1", 0, 0);

        Future<Void> p2 = flipLater("p2", 0, 0);
        assertThat(failureOf(p2)).isEqualTo(FlipError.CARD_CONTROLLED_BY_OTHER);
        assertThat(board.waitingAt(0, 0)).isZero();
        assertThat(board.controllerOf(0, 0)).isEqualTo("p1");
    }

    @Test
    void interruptedWaiterLeavesTheQueue() throws Exception {
        board.flip("p1", 0, 0);
        Future<Void> p2 = flipLater("p2", 0, 0);
        awaitWaiters(0, 0, 1);

        p2.cancel(true);

        awaitWaiters(0, 0, 0);
        board.flip("p1", 1, 0);
        assertThat(board.controllerOf(0, 0)).isNull();
    }

    @Test
    void releasedCardGoesToItsWaiterBeforeANewcomer() throws Exception {
        board = new Board(2, 2, List.of("A", "A", "B", "B"), new BoardSettings(Duration.ofMillis(200), 0));
        board.flip("p1", 0, 0);
        Future<Void> p2 = flipLater("p2", 0, 0);
        awaitWaiters(0, 0, 1);

        synchronized (board) {
            // the mismatch releases (0,0); p2 cannot get back in while this block holds the board
            board.flip("p1", 1, 0);
            assertThat(board.controllerOf(0, 0)).isNull();

            board.flip("p3", 1, 1);
            assertThatThrownBy(() -> board.flip("p3", 0, 0))
                    .isInstanceOf(FlipException.class)
                    .extracting(e -> ((FlipException) e).error())
                    .isEqualTo(FlipError.CARD_ALREADY_CONTROLLED);

            // a newcomer's first pick queues behind p2 and gives up once p2 has the card
            assertThatThrownBy(() -> board.flip("p4", 0, 0))
                    .isInstanceOf(FlipException.class)
                    .extracting(e -> ((FlipException) e).error())
                    .isEqualTo(FlipError.CARD_CONTROLLED_BY_OTHER);
        }

        p2.get(5, TimeUnit.SECONDS);
        assertThat(board.controllerOf(0, 0)).isEqualTo("p2");
        assertThat(board.waitingAt(0, 0)).isZero();
    }

    @Test
    void wokenWaiterThatFailsPassesTheCardToTheNextWaiter() throws Exception {
        board.flip("p2", 1, 1);
        Future<Void> waiting = flipLater("p1", 1, 1);
        awaitWaiters(1, 1, 1);
        Future<Void> p3 = flipLater("p3", 1, 1);
        awaitWaiters(1, 1, 2);

        board.flip("p1", 0, 0);
        board.flip("p1", 0, 1);
        assertThatThrownBy(() -> board.flip("p2", 0, 0)).isInstanceOf(FlipException.class);

        assertThat(failureOf(waiting)).isEqualTo(FlipError.PROTOCOL_VIOLATION);
        p3.get(5, TimeUnit.SECONDS);
        assertThat(board.controllerOf(1, 1)).isEqualTo("p3");
    }

    @Test
    void thirdPickWhileWaitingIsAProtocolViolation() throws Exception {
        board.flip("p2", 1, 1);
        Future<Void> waiting = flipLater("p1", 1, 1);
        awaitWaiters(1, 1, 1);

        // p1 completes a whole turn through another request while the first one waits
        board.flip("p1", 0, 0);
        board.flip("p1", 0, 1);

        // p2's second pick hits p1's matched card, so p2 lets go of (1,1)
        assertThatThrownBy(() -> board.flip("p2", 0, 0)).isInstanceOf(FlipException.class);

        assertThat(failureOf(waiting)).isEqualTo(FlipError.PROTOCOL_VIOLATION);
        assertThat(board.controllerOf(0, 0)).isEqualTo("p1");
    }

    @Test
    void watcherSeesCardTurningFaceUp() throws Exception {
        CompletableFuture<Void> change = board.watchAsync();
        assertThat(change).isNotDone();

        board.flip("p1", 0, 0);

        assertThat(change).isDone();
    }

    @Test
    void watcherIgnoresChangeOfControlAlone() throws Exception {
        board.flip("p1", 0, 0);
        board.flip("p1", 1, 0);

        CompletableFuture<Void> change = board.watchAsync();
        board.flip("p2", 0, 0);
        assertThat(board.controllerOf(0, 0)).isEqualTo("p2");
        assertThat(change).isNotDone();

        board.flip("p2", 1, 1);
        assertThat(change).isDone();
    }

    @Test
    void watcherRegisteredAfterAChangeWaitsForTheNextOne() throws Exception {
        CompletableFuture<Void> first = board.watchAsync();
        board.flip("p1", 0, 0);
        CompletableFuture<Void> second = board.watchAsync();

        assertThat(first).isDone();
        assertThat(second).isNotDone();

        board.flip("p1", 1, 0);
        assertThat(second).isDone();
    }

    @Test
    void blockingWatchReturnsAfterAFlip() throws Exception {
        Future<Void> watcher = pool.submit(() -> {
            board.watch();
            return null;
        });
        await().atMost(5, TimeUnit.SECONDS).until(() -> board.watcherCount() == 1);
        assertThat(watcher).isNotDone();

        board.flip("p1", 1, 1);

        watcher.get(5, TimeUnit.SECONDS);
    }

    @Test
    void transformReplacesEveryLiveCard() throws Exception {
        board.flip("p1", 0, 0);
        board.flip("p1", 0, 1);
        board.flip("p1", 1, 0);
        CompletableFuture<Void> change = board.watchAsync();

        board.transform(card -> card.toLowerCase());

        assertThat(change).isDone();
        assertThat(board.look("p1")).isEqualTo("2x2\nnone\nnone\nmy b\ndown\n");
    }

    @Test
    void transformDoesNotResurrectCardsRemovedMeanwhile() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        CompletableFuture<Void> transform = board.transformAsync(card -> CompletableFuture.supplyAsync(() -> {
            awaitUninterruptibly(gate);
            return card + "!";
        }, pool));

        // flips go ahead while the transform is computing
        board.flip("p1", 0, 0);
        board.flip("p1", 0, 1);
        board.flip("p1", 1, 0);
        gate.countDown();
        transform.get(5, TimeUnit.SECONDS);

        assertThat(board.getCard(0, 0)).isNull();
        assertThat(board.getCard(0, 1)).isNull();
        assertThat(board.getCard(1, 0)).isEqualTo("B!");
        assertThat(board.getCard(1, 1)).isEqualTo("B!");
        board.checkRep();
    }

    @Test
    void transformRejectsMissingResult() {
        assertThatThrownBy(() -> board.transform(card -> null)).isInstanceOf(NullPointerException.class);
        board.checkRep();
    }

    @Test
    void transformThatThrowsStillNotifiesWatchers() {
        CompletableFuture<Void> change = board.watchAsync();

        CompletableFuture<Void> transform = board.transformAsync(card -> {
            if (card.equals("B")) {
                throw new IllegalStateException("cannot map " + card);
            }
            return CompletableFuture.completedFuture(card + "!");
        });

        assertThat(transform).isCompletedExceptionally();
        assertThat(change).isDone();
        assertThat(board.getCard(0, 0)).isEqualTo("A!");
        assertThat(board.getCard(1, 1)).isEqualTo("B");
        board.checkRep();
    }

    @Test
    void transformOnDedicatedPool() throws Exception {
        try (Board pooled = new Board(2, 2, List.of("A", "A", "B", "B"), new BoardSettings(Duration.ZERO, 2))) {
            pooled.transform(card -> card + card);

            assertThat(pooled.getCard(0, 0)).isEqualTo("AA");
            assertThat(pooled.getCard(1, 1)).isEqualTo("BB");
        }
    }

    @Test
    void closeStopsTheTransformThreads() throws Exception {
        long before = liveTransformThreads();
        List<Board> boards = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Board pooled = new Board(2, 2, List.of("A", "A", "B", "B"), new BoardSettings(Duration.ZERO, 2));
            pooled.transform(card -> card + "x");
            boards.add(pooled);
        }
        assertThat(liveTransformThreads()).isGreaterThan(before);

        boards.forEach(Board::close);

        await().atMost(5, TimeUnit.SECONDS).until(() -> liveTransformThreads() <= before);
        Board closed = boards.get(0);
        assertThatThrownBy(() -> closed.transform(card -> card)).isInstanceOf(RejectedExecutionException.class);
        assertThat(closed.getCard(0, 0)).isEqualTo("Ax");
    }
}
