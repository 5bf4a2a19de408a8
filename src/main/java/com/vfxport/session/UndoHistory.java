package com.vfxport.session;

import com.vfxport.models.UndoSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded stack of snapshots. Pushing beyond the limit evicts the oldest entry.
 */
public class UndoHistory {

    private final int limit;
    private final Deque<UndoSnapshot> stack = new ArrayDeque<>();

    public UndoHistory(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be at least 1");
        }
        this.limit = limit;
    }

    public synchronized void push(UndoSnapshot snapshot) {
        stack.push(snapshot);
        while (stack.size() > limit) {
            stack.removeLast();
        }
    }

    public synchronized Optional<UndoSnapshot> pop() {
        return Optional.ofNullable(stack.poll());
    }

    public synchronized Optional<UndoSnapshot> peek() {
        return Optional.ofNullable(stack.peek());
    }

    public synchronized int size() {
        return stack.size();
    }

    public int getLimit() {
        return limit;
    }

    public synchronized boolean isEmpty() {
        return stack.isEmpty();
    }

    public synchronized void clear() {
        stack.clear();
    }

    /** Newest first. */
    public synchronized List<UndoSnapshot> entries() {
        List<UndoSnapshot> list = new ArrayList<>(stack.size());
        Iterator<UndoSnapshot> it = stack.iterator();
        while (it.hasNext()) {
            list.add(it.next());
        }
        return list;
    }
}
