package com.birdopedia.util;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Group-by-key counting with a "most frequent, then alphabetical" pick.
 * Species, camera and lens aggregates on a trip all go through here.
 */
public final class Tally {

    /**
     * Case-insensitive alphabetical order with a case-sensitive fallback so that
     * "robin" and "Robin" still compare deterministically.
     */
    public static final Comparator<String> ALPHABETICAL =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    public static final class Entry {
        private final String value;
        private final long count;

        private Entry(String value, long count) {
            this.value = value;
            this.count = count;
        }

        public String getValue() {
            return value;
        }

        public long getCount() {
            return count;
        }

        @Override
        public String toString() {
            return value + " (" + count + ")";
        }
    }

    private Tally() {
    }

    /**
     * Counts occurrences of each non-null key, keeping first-seen order.
     */
    public static <T> Map<String, Long> countBy(List<T> items, Function<T, String> key) {
        return items.stream()
                .map(key)
                .filter(v -> v != null)
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
    }

    /**
     * Most frequent key among {@code items}, ties broken alphabetically. Keys rejected by
     * {@code accept} are left out of the tally entirely.
     */
    public static <T> Optional<Entry> top(List<T> items, Function<T, String> key, Predicate<String> accept) {
        return countBy(items, key).entrySet().stream()
                .filter(e -> accept.test(e.getKey()))
                .map(e -> new Entry(e.getKey(), e.getValue()))
                .min(Comparator.comparingLong(Entry::getCount).reversed()
                        .thenComparing(Entry::getValue, ALPHABETICAL));
    }

    public static <T> Optional<Entry> top(List<T> items, Function<T, String> key) {
        return top(items, key, v -> true);
    }
}
