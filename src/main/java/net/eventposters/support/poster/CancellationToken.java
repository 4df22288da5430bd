package net.eventposters.support.poster;

import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Shared flag a caller flips to abandon in-flight renders.
 *
 * <p>Reactive fetches subscribe to {@link #whenCancelled()} and stop as soon as it emits.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> signal = Sinks.one();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Token that is never cancelled, for single renders.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }
}
