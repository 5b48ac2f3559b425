package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.domain.Transcript;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded, insertion-ordered transcript log with O(1) removal by id.
 *
 * <p>Entries live in an arena of slots; an id→slot index locates them. Removal leaves a tombstone
 * which is reclaimed by compaction once tombstones outnumber live entries. When more than
 * {@code maxSize} entries are live, the oldest are evicted (FIFO).
 *
 * <p>Not thread-safe; the transcript engine guards it with its mutex.
 */
final class TranscriptLog {

    private final int maxSize;
    private final ArrayList<Transcript> slots = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private int head;
    private int live;

    TranscriptLog(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.maxSize = maxSize;
    }

    int maxSize() {
        return maxSize;
    }

    int size() {
        return live;
    }

    /**
     * Appends an entry and evicts the oldest live entries beyond {@code maxSize}.
     *
     * @return evicted entries, oldest first
     */
    List<Transcript> append(Transcript t) {
        if (index.containsKey(t.id())) {
            throw new IllegalArgumentException("Duplicate transcript id " + t.id());
        }
        slots.add(t);
        index.put(t.id(), slots.size() - 1);
        live++;
        List<Transcript> evicted = new ArrayList<>(1);
        while (live > maxSize) {
            evicted.add(removeOldest());
        }
        maybeCompact();
        return evicted;
    }

    /**
     * Removes an entry by id.
     *
     * @return the removed entry, or empty if absent
     */
    Optional<Transcript> remove(String id) {
        Integer slot = index.remove(id);
        if (slot == null) {
            return Optional.empty();
        }
        Transcript removed = slots.set(slot, null);
        live--;
        maybeCompact();
        return Optional.ofNullable(removed);
    }

    Optional<Transcript> get(String id) {
        Integer slot = index.get(id);
        return slot == null ? Optional.empty() : Optional.ofNullable(slots.get(slot));
    }

    /** Up to {@code n} most recent entries, newest first. */
    List<Transcript> recentNewestFirst(int n) {
        List<Transcript> out = new ArrayList<>(Math.min(Math.max(n, 0), live));
        for (int i = slots.size() - 1; i >= head && out.size() < n; i--) {
            Transcript t = slots.get(i);
            if (t != null) {
                out.add(t);
            }
        }
        return out;
    }

    /** Newest live entry from {@code streamId}, however far back it sits. */
    Optional<Transcript> latestFrom(StreamId streamId) {
        for (int i = slots.size() - 1; i >= head; i--) {
            Transcript t = slots.get(i);
            if (t != null && t.streamId() == streamId) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** Up to {@code n} most recent entries in log order (oldest first). */
    List<Transcript> recent(int n) {
        List<Transcript> newestFirst = recentNewestFirst(n);
        List<Transcript> out = new ArrayList<>(newestFirst.size());
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            out.add(newestFirst.get(i));
        }
        return out;
    }

    /** All live entries in log order. */
    List<Transcript> snapshot() {
        List<Transcript> out = new ArrayList<>(live);
        for (int i = head; i < slots.size(); i++) {
            Transcript t = slots.get(i);
            if (t != null) {
                out.add(t);
            }
        }
        return out;
    }

    void clear() {
        slots.clear();
        index.clear();
        head = 0;
        live = 0;
    }

    private Transcript removeOldest() {
        while (slots.get(head) == null) {
            head++;
        }
        Transcript oldest = slots.set(head, null);
        index.remove(oldest.id());
        head++;
        live--;
        return oldest;
    }

    private void maybeCompact() {
        int garbage = slots.size() - live;
        if (garbage <= 32 || garbage <= live) {
            return;
        }
        List<Transcript> kept = snapshot();
        slots.clear();
        index.clear();
        head = 0;
        for (Transcript t : kept) {
            slots.add(t);
            index.put(t.id(), slots.size() - 1);
        }
    }
}
