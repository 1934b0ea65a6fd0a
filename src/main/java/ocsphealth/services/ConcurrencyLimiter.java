package ocsphealth.services;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * Non-blocking pool of permits. Waiters are served in arrival order and a permit is given back when the guarded work
 * completes, fails or is cancelled.
 */
public class ConcurrencyLimiter {

    private static final int WAITING = 0;
    private static final int GRANTED = 1;
    private static final int CANCELLED = 2;

    private final String name;
    private final int capacity;
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int available;

    public ConcurrencyLimiter(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Limiter %s needs a capacity of at least 1".formatted(name));
        }
        this.name = name;
        this.capacity = capacity;
        this.available = capacity;
    }

    public <T> Mono<T> withPermit(Mono<T> work) {
        return Mono.usingWhen(acquire(),
            permit -> work,
            Permit::releasing,
            (permit, e) -> permit.releasing(),
            Permit::releasing
        );
    }

    Mono<Permit> acquire() {
        return Mono.create(sink -> {
            final Waiter waiter = new Waiter(sink);
            sink.onCancel(waiter::cancel);

            final boolean immediate;
            synchronized (this) {
                if (available > 0) {
                    available--;
                    immediate = true;
                } else {
                    waiters.addLast(waiter);
                    immediate = false;
                }
            }
            if (immediate && !waiter.grant()) {
                release();
            }
        });
    }

    private void release() {
        while (true) {
            final Waiter next;
            synchronized (this) {
                next = waiters.pollFirst();
                if (next == null) {
                    available++;
                    return;
                }
            }
            // hand the permit straight to the next waiter, skipping those that gave up
            if (next.grant()) {
                return;
            }
        }
    }

    public synchronized int available() {
        return available;
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "ConcurrencyLimiter[name=%s, capacity=%d]".formatted(name, capacity);
    }

    private class Waiter {

        private final MonoSink<Permit> sink;
        private final AtomicInteger state = new AtomicInteger(WAITING);
        private final Permit permit = new Permit();

        Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }

        boolean grant() {
            if (state.compareAndSet(WAITING, GRANTED)) {
                sink.success(permit);
                return true;
            }
            return false;
        }

        void cancel() {
            if (state.compareAndSet(WAITING, CANCELLED)) {
                synchronized (ConcurrencyLimiter.this) {
                    waiters.remove(this);
                }
            } else if (state.get() == GRANTED) {
                // granted while the subscriber was going away
                permit.release();
            }
        }
    }

    class Permit {

        private final AtomicBoolean released = new AtomicBoolean();

        void release() {
            if (released.compareAndSet(false, true)) {
                ConcurrencyLimiter.this.release();
            }
        }

        Mono<Void> releasing() {
            return Mono.fromRunnable(this::release);
        }
    }
}
