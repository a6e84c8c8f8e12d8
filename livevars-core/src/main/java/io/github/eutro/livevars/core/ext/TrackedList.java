package io.github.eutro.livevars.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A list view that reports every element entering or leaving it.
 * <p>
 * The IR uses this to keep ownership exts ({@link CommonExts#OWNING_BLOCK},
 * {@link CommonExts#OWNING_FUNCTION}) up to date however a list is edited.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    /**
     * Construct a tracked list over a backing list. Elements already
     * in the backing list are not reported.
     *
     * @param viewed The backing list.
     */
    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called before an element is added.
     *
     * @param elt The element.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called after an element is removed.
     *
     * @param elt The element.
     */
    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        for (E e : viewed) {
            onRemoved(e);
        }
        viewed.clear();
    }

    @Override
    public @NotNull ListIterator<E> listIterator(int index) {
        ListIterator<E> li = viewed.listIterator(index);
        return new ListIterator<E>() {
            E last;

            @Override
            public boolean hasNext() {
                return li.hasNext();
            }

            @Override
            public E next() {
                return last = li.next();
            }

            @Override
            public boolean hasPrevious() {
                return li.hasPrevious();
            }

            @Override
            public E previous() {
                return last = li.previous();
            }

            @Override
            public int nextIndex() {
                return li.nextIndex();
            }

            @Override
            public int previousIndex() {
                return li.previousIndex();
            }

            @Override
            public void remove() {
                li.remove();
                onRemoved(last);
                last = null;
            }

            @Override
            public void set(E e) {
                li.set(e);
                onRemoved(last);
                onAdded(e);
                last = e;
            }

            @Override
            public void add(E e) {
                onAdded(e);
                li.add(e);
            }
        };
    }
}
