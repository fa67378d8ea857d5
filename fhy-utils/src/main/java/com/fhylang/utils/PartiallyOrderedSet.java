package com.fhylang.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A finite set with a strict partial order over its elements.
 *
 * <p>The transitive closure is maintained eagerly: every {@link #addOrder} records all
 * relations it implies, so {@link #isLessThan} is a set lookup. An ordering that would
 * create a cycle is rejected with {@link PosetOrderViolation} before anything changes.</p>
 *
 * <p>Iteration yields the elements in a linear extension of the order; unrelated elements
 * keep their insertion order. Not thread-safe.</p>
 *
 * @param <T> element type; elements are compared with {@code equals}/{@code hashCode}
 */
public class PartiallyOrderedSet<T> implements Iterable<T> {

    // element -> all elements strictly greater / strictly less than it
    private final Map<T, Set<T>> greater = new LinkedHashMap<T, Set<T>>();
    private final Map<T, Set<T>> less = new LinkedHashMap<T, Set<T>>();

    /**
     * Adds an element with no relations. Adding an existing element has no effect.
     */
    public void addElement(T element) {
        Objects.requireNonNull(element, "element");
        if (!greater.containsKey(element)) {
            greater.put(element, new LinkedHashSet<T>());
            less.put(element, new LinkedHashSet<T>());
        }
    }

    /**
     * Records {@code lower < upper} together with everything it implies transitively.
     *
     * @throws IllegalArgumentException if either element was never added
     * @throws PosetOrderViolation      if {@code lower} equals {@code upper} or
     *                                  {@code upper < lower} already holds
     */
    public void addOrder(T lower, T upper) {
        requireElement(lower);
        requireElement(upper);
        if (lower.equals(upper)) {
            throw new PosetOrderViolation("Cannot order an element before itself: " + lower, lower, upper);
        }
        if (greater.get(upper).contains(lower)) {
            throw new PosetOrderViolation(
                    "Ordering " + lower + " < " + upper + " contradicts existing " + upper + " < " + lower,
                    lower, upper);
        }

        List<T> below = new ArrayList<T>(less.get(lower));
        below.add(lower);
        List<T> above = new ArrayList<T>(greater.get(upper));
        above.add(upper);
        for (T x : below) {
            Set<T> greaterThanX = greater.get(x);
            for (T y : above) {
                if (greaterThanX.add(y)) {
                    less.get(y).add(x);
                }
            }
        }
    }

    /**
     * Whether {@code a < b}. Unrelated elements are neither less nor greater.
     *
     * @throws IllegalArgumentException if either element was never added
     */
    public boolean isLessThan(T a, T b) {
        requireElement(a);
        requireElement(b);
        return greater.get(a).contains(b);
    }

    /**
     * Whether {@code a > b}.
     *
     * @throws IllegalArgumentException if either element was never added
     */
    public boolean isGreaterThan(T a, T b) {
        return isLessThan(b, a);
    }

    public boolean contains(T element) {
        return element != null && greater.containsKey(element);
    }

    public int size() {
        return greater.size();
    }

    public boolean isEmpty() {
        return greater.isEmpty();
    }

    /**
     * Elements ordered so that each one comes after everything less than it.
     */
    public List<T> toOrderedList() {
        List<T> ordered = new ArrayList<T>(greater.size());
        Set<T> emitted = new LinkedHashSet<T>();
        List<T> pending = new ArrayList<T>(greater.keySet());
        while (!pending.isEmpty()) {
            Iterator<T> it = pending.iterator();
            while (it.hasNext()) {
                T candidate = it.next();
                if (emitted.containsAll(less.get(candidate))) {
                    it.remove();
                    emitted.add(candidate);
                    ordered.add(candidate);
                    break;
                }
            }
        }
        return ordered;
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableList(toOrderedList()).iterator();
    }

    @Override
    public String toString() {
        return "PartiallyOrderedSet" + toOrderedList();
    }

    private void requireElement(T element) {
        Objects.requireNonNull(element, "element");
        if (!greater.containsKey(element)) {
            throw new IllegalArgumentException("Not an element of this poset: " + element);
        }
    }
}
