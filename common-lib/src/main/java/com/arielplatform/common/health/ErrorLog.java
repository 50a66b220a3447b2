package com.arielplatform.common.health;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity ring buffer of {@link ErrorRecord}s; appending to a full log
 * evicts the oldest record.
 */
public class ErrorLog {

    private final int capacity;
    private final Deque<ErrorRecord> records;

    public ErrorLog(int capacity) {
        this.capacity = capacity;
        this.records  = new ArrayDeque<>(capacity);
    }

    public void append(ErrorRecord record) {
        if (records.size() == capacity) {
            records.pollFirst();
        }
        records.addLast(record);
    }

    /** Oldest first. */
    public List<ErrorRecord> records() {
        return new ArrayList<>(records);
    }

    public long unhealedCount() {
        return records.stream().filter(r -> !r.healed()).count();
    }

    /** Marks every still-unhealed record whose id is in {@code ids}; returns how many changed. */
    public int markHealed(Collection<Long> ids) {
        int marked = 0;
        for (ErrorRecord r : records) {
            if (!r.healed() && ids.contains(r.id())) {
                r.markHealed();
                marked++;
            }
        }
        return marked;
    }

    public int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }
}
