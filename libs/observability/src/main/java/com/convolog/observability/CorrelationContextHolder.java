package com.convolog.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys (correlationId, causationId, userId, requestId) are
 * populated so every log statement on this thread includes them. When cleared, they are removed.
 * <p>
 * Worker threads (the projector, scheduled sweeps) do not inherit the caller's context; use
 * {@link #runWithContext(CorrelationContext, Runnable)} or
 * {@link #callWithContext(CorrelationContext, Supplier)} to bind one for a unit of work.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Binds the context to the current thread and mirrors it into the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Context bound to the current thread, if any. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs the given work with the context bound, then restores the previous context (or clears
     * if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        callWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Like {@link #runWithContext(CorrelationContext, Runnable)} but returns the supplier's result.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> supplier) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        ctx.mdcEntries().forEach((key, value) -> {
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        });
    }

    private static void clearMdc() {
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }
}
