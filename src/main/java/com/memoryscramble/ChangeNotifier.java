package com.memoryscramble;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Broadcasts "the board changed" to every watcher registered before the change.
 *
 * Each watcher is a future completed by the next {@link #fire()}. Firing takes
 * a snapshot of the registered watchers and clears the set atomically; watchers
 * registering after that wait for the following change.
 *
 * Thread Safety:
 * Guarded by its own monitor, never by the Board's, so a watcher blocked on its
 * future never holds the Board. The Board may call {@link #fire()} while holding
 * its monitor; the lock order is always Board then notifier.
 */
final class ChangeNotifier {
    private final List<CompletableFuture<Void>> watchers = new ArrayList<>();

    /**
     * @return a future completed by the next change
     */
    synchronized CompletableFuture<Void> register() {
        CompletableFuture<Void> watcher = new CompletableFuture<>();
        watchers.add(watcher);
        return watcher;
    }

    /**
     * Wakes every watcher registered so far.
     */
    void fire() {
        List<CompletableFuture<Void>> snapshot;
        synchronized (this) {
            if (watchers.isEmpty()) {
                return;
            }
            snapshot = new ArrayList<>(watchers);
            watchers.clear();
        }
        for (CompletableFuture<Void> watcher : snapshot) {
            watcher.complete(null);
        }
    }

    synchronized int watcherCount() {
        return watchers.size();
    }
}
