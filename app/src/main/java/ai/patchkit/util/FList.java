package ai.patchkit.util;

import static java.util.Objects.requireNonNull;

import java.util.AbstractList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;

/** A persistent singly-linked list; {@link #prepend} shares the existing list instead of copying it. */
public final class FList<E> extends AbstractList<E> {
    private static final FList<?> EMPTY_LIST = new FList<>(null, null, 0);

    private final @Nullable E head;

    /** Remaining elements; {@code null} only for the empty list */
    private final @Nullable FList<E> tail;

    private final int size;

    private FList(@Nullable E head, @Nullable FList<E> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <E> FList<E> emptyList() {
        return (FList<E>) EMPTY_LIST;
    }

    public FList<E> prepend(E elem) {
        return new FList<>(elem, this, size + 1);
    }

    @Override
    public E get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index = " + index + ", size = " + size);
        }
        FList<E> current = this;
        while (index > 0) {
            current = requireNonNull(current.tail);
            index--;
        }
        return requireNonNull(current.head);
    }

    /** Elements in the order they were prepended, oldest first. */
    public FList<E> reversed() {
        FList<E> result = emptyList();
        for (E e : this) {
            result = result.prepend(e);
        }
        return result;
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<>() {
            private FList<E> list = FList.this;

            @Override
            public boolean hasNext() {
                return list.size > 0;
            }

            @Override
            public E next() {
                if (list.size == 0) {
                    throw new NoSuchElementException();
                }
                E res = requireNonNull(list.head);
                list = requireNonNull(list.tail);
                return res;
            }
        };
    }

    @Override
    public int size() {
        return size;
    }
}
