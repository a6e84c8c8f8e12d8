package io.github.eutro.livevars.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value (of type {@code T}) can be stored
 * in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, so the order of two exts may differ between
 * runs if they are created from different threads.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext with the given name.
     * <p>
     * {@code type} only has to be a superclass of the real ext type, since
     * generic types have no class object of their own. It is kept for debugging.
     *
     * @param type A superclass of the type of the ext.
     * @param name The name of the ext.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the class this ext was {@link #create(Class, String) created} with.
     *
     * @return The type of this ext.
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
