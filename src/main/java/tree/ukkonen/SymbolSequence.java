package tree.ukkonen;

import java.util.Arrays;

/**
 * Append-only symbol storage owned by a suffix tree. Symbols are opaque ints; the only
 * mutation is {@link #append(int)}, one call per construction phase.
 */
final class SymbolSequence {
    private int[] data;
    private int size = 0;

    SymbolSequence(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.data = new int[capacity];
    }

    int append(int symbol) {
        ensureCapacity(size + 1);
        data[size] = symbol;
        return size++;
    }

    int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index: " + index + ", size: " + size);
        }
        return data[index];
    }

    int size() {
        return size;
    }

    int[] copyRange(int from, int toInclusive) {
        if (toInclusive < from) {
            return new int[0];
        }
        return Arrays.copyOfRange(data, from, toInclusive + 1);
    }

    int[] toArray() {
        return Arrays.copyOf(data, size);
    }

    /** Shrink the backing array to the exact logical size. */
    void shrinkToFit() {
        if (data.length != size && size > 0) {
            data = Arrays.copyOf(data, size);
        }
    }

    private void ensureCapacity(int capacity) {
        if (capacity <= data.length) return;
        int newCapacity = data.length << 1;
        while (newCapacity < capacity) newCapacity <<= 1;
        data = Arrays.copyOf(data, newCapacity);
    }
}
