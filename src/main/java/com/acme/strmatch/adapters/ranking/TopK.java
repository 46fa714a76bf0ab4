package com.acme.strmatch.adapters.ranking;

import com.acme.strmatch.domain.model.MatchResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Bounded retention of the {@code k} best match results seen during a scan.
 * Ordering is {@code clr} descending, then scan index ascending, so the
 * result does not depend on the order in which shards are merged.
 * Not thread-safe; each scan shard owns its own instance.
 */
public class TopK {

    /** Best first. */
    static final Comparator<Item> BEST_FIRST = Comparator
            .comparingDouble((Item i) -> -i.result.clr())
            .thenComparingInt(i -> i.scanIndex);

    private final int k;
    private final PriorityQueue<Item> pq;

    public TopK(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        this.k = k;
        this.pq = new PriorityQueue<>(k + 1, BEST_FIRST.reversed()); // head is the current worst
    }

    public void add(int scanIndex, MatchResult result) {
        Item item = new Item(scanIndex, result);
        if (pq.size() < k) {
            pq.add(item);
        } else if (BEST_FIRST.compare(item, pq.peek()) < 0) {
            pq.poll();
            pq.add(item);
        }
    }

    public boolean isFull() {
        return pq.size() >= k;
    }

    public int size() {
        return pq.size();
    }

    public void mergeFrom(TopK other) {
        for (Item item : other.pq) {
            add(item.scanIndex, item.result);
        }
    }

    public List<MatchResult> toListSortedDesc() {
        List<Item> items = new ArrayList<>(pq);
        items.sort(BEST_FIRST);
        List<MatchResult> out = new ArrayList<>(items.size());
        for (Item i : items) {
            out.add(i.result);
        }
        return out;
    }

    static final class Item {
        final int scanIndex;
        final MatchResult result;

        Item(int scanIndex, MatchResult result) {
            this.scanIndex = scanIndex;
            this.result = result;
        }
    }
}
