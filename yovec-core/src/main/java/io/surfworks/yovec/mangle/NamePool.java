package io.surfworks.yovec.mangle;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Infinite, lazily generated sequence of short lowercase names.
 *
 * <p>All one-letter names come first, then all two-letter names, and so on. Within a
 * length the names count down in base 26: {@code z, y, ..., a, zz, zy, ..., aa, zzz, ...}.
 * Excluded names are skipped. A fresh pool always restarts from {@code z}.
 */
public final class NamePool implements Iterator<String> {

    private static final int RADIX = 26;
    // 26^13 still fits in a long
    private static final int MAX_LENGTH = 13;

    private final Set<String> excluded;
    private int length = 1;
    private long counter = RADIX - 1;

    public NamePool() {
        this(Set.of());
    }

    public NamePool(Set<String> excluded) {
        this.excluded = Set.copyOf(excluded);
    }

    @Override
    public boolean hasNext() {
        return length <= MAX_LENGTH;
    }

    @Override
    public String next() {
        while (hasNext()) {
            String name = render(counter, length);
            advance();
            if (!excluded.contains(name)) {
                return name;
            }
        }
        throw new NoSuchElementException("name pool exhausted");
    }

    private void advance() {
        if (counter > 0) {
            counter--;
            return;
        }
        length++;
        counter = power(length) - 1;
    }

    private static String render(long value, int width) {
        char[] chars = new char[width];
        long rest = value;
        for (int i = width - 1; i >= 0; i--) {
            chars[i] = (char) ('a' + (rest % RADIX));
            rest /= RADIX;
        }
        return new String(chars);
    }

    private static long power(int exponent) {
        long result = 1;
        for (int i = 0; i < exponent && i < MAX_LENGTH; i++) {
            result *= RADIX;
        }
        return result;
    }
}
