package io.github.eutro.livevars.core.util;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * An immutable set that remembers insertion order.
 * <p>
 * Iteration order is deterministic so that printed results are reproducible, but
 * {@link #equals(Object)} ignores it, like any other {@link Set}. Use
 * {@link #sameOrder(OrderedSet)} to compare the order as well.
 * <p>
 * Every operation returns a new set; receivers and arguments are never modified.
 *
 * @param <E> The type of elements.
 */
public final class OrderedSet<E> extends AbstractSet<E> {
    private static final OrderedSet<?> EMPTY = new OrderedSet<>(new LinkedHashSet<>());

    private final LinkedHashSet<E> elements;

    private OrderedSet(LinkedHashSet<E> elements) {
        this.elements = elements;
    }

    /**
     * Get the empty set.
     *
     * @param <E> The type of elements.
     * @return The empty set.
     */
    @SuppressWarnings("unchecked")
    public static <E> OrderedSet<E> empty() {
        return (OrderedSet<E>) EMPTY;
    }

    /**
     * Create a set of the given elements, in order, dropping repeats.
     *
     * @param elements The elements.
     * @param <E>      The type of elements.
     * @return The set.
     */
    @SafeVarargs
    public static <E> OrderedSet<E> of(E... elements) {
        return copyOf(Arrays.asList(elements));
    }

    /**
     * Create a set of the given elements, in iteration order, dropping repeats.
     *
     * @param elements The elements.
     * @param <E>      The type of elements.
     * @return The set.
     */
    public static <E> OrderedSet<E> copyOf(Iterable<? extends E> elements) {
        if (elements instanceof OrderedSet) {
            @SuppressWarnings("unchecked")
            OrderedSet<E> set = (OrderedSet<E>) elements;
            return set;
        }
        LinkedHashSet<E> copy = new LinkedHashSet<>();
        for (E e : elements) {
            copy.add(Objects.requireNonNull(e, "null element"));
        }
        return copy.isEmpty() ? empty() : new OrderedSet<>(copy);
    }

    /**
     * The union of this and {@code other}: the elements of this in order,
     * followed by the elements of {@code other} not already present.
     *
     * @param other The other set.
     * @return The union.
     */
    public OrderedSet<E> union(Collection<? extends E> other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return copyOf(other);
        LinkedHashSet<E> copy = new LinkedHashSet<>(elements);
        if (!copy.addAll(other)) return this;
        return new OrderedSet<>(copy);
    }

    /**
     * This set without any element of {@code other}, order otherwise preserved.
     *
     * @param other The elements to remove.
     * @return The difference.
     */
    public OrderedSet<E> minus(Collection<?> other) {
        if (other.isEmpty() || isEmpty()) return this;
        LinkedHashSet<E> copy = new LinkedHashSet<>(elements);
        if (!copy.removeAll(other)) return this;
        return copy.isEmpty() ? empty() : new OrderedSet<>(copy);
    }

    /**
     * Whether this set has the same elements as {@code other}, in the same order.
     *
     * @param other The other set.
     * @return Whether the two iterate identically.
     */
    public boolean sameOrder(OrderedSet<?> other) {
        if (size() != other.size()) return false;
        Iterator<?> it = other.iterator();
        for (E e : elements) {
            if (!e.equals(it.next())) return false;
        }
        return true;
    }

    /**
     * Copy this set to a list, in order.
     *
     * @return The new list.
     */
    public List<E> toList() {
        return new ArrayList<>(elements);
    }

    @Override
    public boolean contains(Object o) {
        return elements.contains(o);
    }

    @Override
    public boolean containsAll(@NotNull Collection<?> c) {
        return elements.containsAll(c);
    }

    @Override
    public @NotNull Iterator<E> iterator() {
        return Collections.unmodifiableSet(elements).iterator();
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (E e : elements) {
            sj.add(String.valueOf(e));
        }
        return sj.toString();
    }
}
