package com.memoryscramble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Assigns control of cards to players and keeps a FIFO queue of the players
 * waiting for each card.
 *
 * Waiting uses the monitor of the owning Board: a waiter enqueues a ticket and
 * calls {@code wait()} on the Board until a release marks its ticket. Because
 * the Board wakes every thread with {@code notifyAll()} but only the marked
 * ticket may proceed, waiters are served strictly in arrival order.
 *
 * A woken ticket keeps the card promised to its player until that thread is
 * back in the monitor, so a player who never queued cannot take the card first.
 *
 * Rep Invariant:
 * - no queue in the map is empty
 * - every ticket in a queue is not yet woken
 * - a promised ticket is woken and in no queue
 *
 * Thread Safety:
 * Every method must be called while holding the Board's monitor.
 */
final class CardControl {
    private static final Logger LOG = LoggerFactory.getLogger(CardControl.class);

    private final Object monitor;
    private final Map<Position, Deque<Waiter>> queues = new HashMap<>();
    private final Map<Position, Waiter> promised = new HashMap<>();

    CardControl(Object monitor) {
        this.monitor = monitor;
    }

    /**
     * Gives control of the card to the player if nobody else controls it and it
     * is not promised to a woken waiter. Never blocks.
     *
     * @return true if the player now controls the card
     */
    boolean tryAcquire(Position pos, Cell cell, String player) {
        if (cell.isControlledByOther(player) || isPromised(pos)) {
            return false;
        }
        cell.setController(player);
        return true;
    }

    /**
     * Clears control of the card and wakes the longest-waiting player, if any.
     * The woken player is not given the card; it must check the card again.
     */
    void release(Position pos, Cell cell) {
        cell.setController(null);
        wakeNext(pos);
    }

    /**
     * @return true if a woken waiter has not yet come back for the card
     */
    boolean isPromised(Position pos) {
        return promised.containsKey(pos);
    }

    /**
     * Wakes the next waiter if the card is present, free and promised to nobody.
     * Used when a woken waiter leaves without taking the card.
     */
    void passOn(Position pos, Cell cell) {
        if (!cell.isRemoved() && cell.controller() == null && !isPromised(pos)) {
            wakeNext(pos);
        }
    }

    /**
     * Clears control of a card that has just been removed and wakes every player
     * waiting for it. No later release of this position can happen.
     */
    void releaseRemoved(Position pos, Cell cell) {
        cell.setController(null);
        promised.remove(pos);
        Deque<Waiter> queue = queues.remove(pos);
        if (queue == null) {
            return;
        }
        for (Waiter waiter : queue) {
            waiter.woken = true;
        }
        LOG.debug("Card {} removed, woke {} waiting player(s)", pos, queue.size());
        monitor.notifyAll();
    }

    /**
     * Suspends the caller until a release of this position reaches its ticket.
     *
     * Precondition:
     * - caller holds the Board's monitor
     *
     * @param pos the card to wait for
     * @param player the waiting player
     * @param timeoutMillis maximum time to wait; 0 or less waits without bound
     * @return true if woken by a release, false if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting; the ticket is
     *         withdrawn, and a wake-up that already reached it goes to the next waiter
     */
    boolean awaitRelease(Position pos, String player, long timeoutMillis) throws InterruptedException {
        Waiter waiter = new Waiter(player);
        queues.computeIfAbsent(pos, k -> new ArrayDeque<>()).addLast(waiter);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        try {
            while (!waiter.woken) {
                if (timeoutMillis <= 0) {
                    monitor.wait();
                } else {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        LOG.debug("{} gave up waiting for {} after {} ms", player, pos, timeoutMillis);
                        return false;
                    }
                    TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
                }
            }
            return true;
        } catch (InterruptedException e) {
            if (waiter.woken && promised.remove(pos, waiter)) {
                wakeNext(pos);
            }
            throw e;
        } finally {
            if (waiter.woken) {
                promised.remove(pos, waiter);
            } else {
                withdraw(pos, waiter);
            }
        }
    }

    /**
     * @return number of players waiting for the card at this position
     */
    int queueLength(Position pos) {
        Deque<Waiter> queue = queues.get(pos);
        return queue == null ? 0 : queue.size();
    }

    private void wakeNext(Position pos) {
        Deque<Waiter> queue = queues.get(pos);
        if (queue == null) {
            return;
        }
        Waiter next = queue.pollFirst();
        if (queue.isEmpty()) {
            queues.remove(pos);
        }
        if (next != null) {
            next.woken = true;
            promised.put(pos, next);
            LOG.debug("Card {} released, waking {}", pos, next.player);
            monitor.notifyAll();
        }
    }

    private void withdraw(Position pos, Waiter waiter) {
        Deque<Waiter> queue = queues.get(pos);
        if (queue != null) {
            queue.remove(waiter);
            if (queue.isEmpty()) {
                queues.remove(pos);
            }
        }
    }

    /**
     * One suspended player. Identity equality, so equal players waiting twice
     * on the same card stay distinct.
     */
    private static final class Waiter {
        private final String player;
        private boolean woken;

        Waiter(String player) {
            this.player = player;
        }
    }
}
