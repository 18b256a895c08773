package com.arth.workq.broker.dispatch;

import java.util.List;
import java.util.function.Predicate;

/**
 * Rotating cursor over a candidate list. The cursor survives between calls, so a
 * candidate that was just served is tried last next time.
 */
public class RoundRobinSelector<T> {

    private int cursor = 0;

    /**
     * @return the first eligible candidate at or after the cursor, or null if none is eligible
     */
    public T next(List<T> candidates, Predicate<T> eligible) {
        int size = candidates.size();
        for (int i = 0; i < size; i++) {
            int index = Math.floorMod(cursor + i, size);
            T candidate = candidates.get(index);
            if (eligible.test(candidate)) {
                cursor = (index + 1) % size;
                return candidate;
            }
        }
        return null;
    }

    int getCursor() {
        return cursor;
    }
}
