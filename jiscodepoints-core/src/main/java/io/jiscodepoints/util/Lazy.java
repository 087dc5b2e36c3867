package io.jiscodepoints.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One-time initialization cell.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>The initializer runs at most once, on the first call to {@link #get()}.</li>
 *   <li>Threads racing on the first call block until the single initialization
 *       completes and then all observe the same instance.</li>
 *   <li>If the initializer throws, nothing is cached and the next call retries.</li>
 *   <li>The initializer must not return {@code null}.</li>
 * </ul>
 * Intended for immutable values; the cell itself never hands out anything but
 * the completed result.
 */
public final class Lazy<T> implements Supplier<T> {

    private final Object lock = new Object();
    private Supplier<? extends T> initializer;
    private volatile T value;

    private Lazy(Supplier<? extends T> initializer) {
        this.initializer = Objects.requireNonNull(initializer, "initializer");
    }

    public static <T> Lazy<T> of(Supplier<? extends T> initializer) {
        return new Lazy<>(initializer);
    }

    @Override
    public T get() {
        var result = value;
        if (result != null) {
            return result;
        }
        synchronized (lock) {
            result = value;
            if (result == null) {
                result = Objects.requireNonNull(initializer.get(), "initializer returned null");
                value = result;
                // release the supplier and whatever it captured
                initializer = null;
            }
            return result;
        }
    }

    public boolean isInitialized() {
        return value != null;
    }

    @Override
    public String toString() {
        var current = value;
        return current != null ? "Lazy[" + current + "]" : "Lazy[<uninitialized>]";
    }
}
