package com.humasol.followup.domain.followup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class MergeUpdates {

    /**
     * Reconciles owned items with a list of partial updates keyed by a natural identifier.
     *
     * <p>Each existing item whose key matches a pending update is merged with that update and
     * kept, in its original order. Each update is consumed at most once. Updates left over
     * afterwards are constructed as new items and appended. Existing items without a matching
     * update are dropped from the result.
     */
    public static <T, U, K> List<T> mergeByKey(
            List<T> existing,
            List<U> updates,
            Function<T, K> existingKey,
            Function<U, K> updateKey,
            BiConsumer<T, U> merger,
            Function<U, T> constructor) {
        var pending = new ArrayList<>(updates);
        var merged = new ArrayList<T>(updates.size());

        for (var item : existing) {
            var key = existingKey.apply(item);
            for (var it = pending.iterator(); it.hasNext(); ) {
                var update = it.next();
                if (Objects.equals(key, updateKey.apply(update))) {
                    merger.accept(item, update);
                    merged.add(item);
                    it.remove();
                    break;
                }
            }
        }

        for (var update : pending) {
            merged.add(constructor.apply(update));
        }
        return merged;
    }
}
