package net.eventposters.application.poster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.eventposters.config.PosterProperties;
import net.eventposters.domain.poster.EventRecord;
import net.eventposters.domain.poster.PosterVariant;
import net.eventposters.domain.poster.RenderedPoster;
import net.eventposters.domain.poster.VariantRequest;
import net.eventposters.exception.PosterRenderException;
import net.eventposters.support.poster.CancellationToken;
import net.eventposters.support.poster.PosterAssembler;
import org.springframework.stereotype.Service;

/**
 * Renders a batch of poster variants that differ only in their background.
 *
 * <p>Each variant renders on its own worker of a fixed pool sized to the batch. Results
 * land in slots indexed by request position, so the returned list follows request
 * order whatever order the renders finish in. Cancelling the token stops in-flight
 * background fetches and discards every result.
 */
@Service
@Slf4j
public class PosterVariantService {

    private final PosterAssembler posterAssembler;
    private final VariantQueryPlanner queryPlanner;
    private final int batchSize;
    private final ExecutorService batchExecutor;

    public PosterVariantService(PosterAssembler posterAssembler,
                                VariantQueryPlanner queryPlanner,
                                PosterProperties posterProperties) {
        this.posterAssembler = posterAssembler;
        this.queryPlanner = queryPlanner;
        this.batchSize = posterProperties.getBatchSize();
        AtomicInteger batchCounter = new AtomicInteger();
        this.batchExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("poster-batch-" + batchCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs {@link #renderVariants(EventRecord, CancellationToken)} off the calling thread.
     * The future fails with {@link CancellationException} once {@code token} is cancelled.
     */
    public CompletableFuture<List<PosterVariant>> submitVariants(EventRecord event, CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> renderVariants(event, token), batchExecutor);
    }

    public List<PosterVariant> renderVariants(EventRecord event) {
        return renderVariants(event, CancellationToken.create());
    }

    /**
     * @throws CancellationException when {@code token} is cancelled before the batch completes
     */
    public List<PosterVariant> renderVariants(EventRecord event, CancellationToken token) {
        List<VariantRequest> requests = queryPlanner.plan(event, batchSize);
        PosterVariant[] slots = new PosterVariant[requests.size()];
        ExecutorService pool = newPool(requests.size());
        try {
            List<Future<?>> futures = new ArrayList<>(requests.size());
            for (VariantRequest request : requests) {
                futures.add(pool.submit(() -> {
                    if (token.isCancelled()) {
                        return;
                    }
                    EventRecord variantEvent = event.withBackground(request.query(), request.page());
                    RenderedPoster poster = posterAssembler.render(variantEvent, token);
                    slots[request.index()] = new PosterVariant(request, poster);
                    log.debug("Variant {} rendered for '{}' page {}", request.index(), request.query(), request.page());
                }));
            }
            for (Future<?> future : futures) {
                await(future, token);
            }
        } finally {
            pool.shutdownNow();
        }
        if (token.isCancelled()) {
            log.info("Variant batch cancelled; discarding {} slot(s)", slots.length);
            throw new CancellationException("Variant batch cancelled");
        }
        return List.copyOf(Arrays.asList(slots));
    }

    private void await(Future<?> future, CancellationToken token) {
        try {
            future.get();
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new PosterRenderException("Interrupted while rendering variants", interruptedException);
        } catch (ExecutionException executionException) {
            token.cancel();
            Throwable cause = executionException.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new PosterRenderException("Variant rendering failed", cause);
        }
    }

    @PreDestroy
    void shutdown() {
        batchExecutor.shutdownNow();
    }

    private static ExecutorService newPool(int size) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("poster-variant-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
