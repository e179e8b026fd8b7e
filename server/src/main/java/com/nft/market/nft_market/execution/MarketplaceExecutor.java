package com.nft.market.nft_market.execution;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.springframework.context.ApplicationEventPublisher;

import com.nft.market.nft_market.event.MarketplaceEvent;
import com.nft.market.nft_market.exception.MarketplaceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs marketplace requests one at a time on a single thread.
 *
 * Each request gets its own {@link UnitOfWork}: on success its events are
 * published; on failure its mutations are rolled back, except for error codes
 * that retain state (listing drift), which commit before the failure is
 * rethrown. A request submitted from inside a running request (the ledger
 * callback re-entering the marketplace) joins the running unit instead of
 * queueing behind it.
 */
@Slf4j
public class MarketplaceExecutor implements AutoCloseable {

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "marketplace-executor");
        thread.setDaemon(true);
        return thread;
    });

    private final ApplicationEventPublisher eventPublisher;

    public MarketplaceExecutor(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public <T> T execute(String requestName, Supplier<T> request) {
        if (UnitOfWork.current().isPresent()) {
            return request.get();
        }

        Future<T> future = executor.submit(() -> runInUnitOfWork(requestName, request));
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Request failed: " + requestName, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + requestName, e);
        }
    }

    public void run(String requestName, Runnable request) {
        execute(requestName, () -> {
            request.run();
            return null;
        });
    }

    private <T> T runInUnitOfWork(String requestName, Supplier<T> request) {
        UnitOfWork unit = UnitOfWork.begin(requestName);
        T result;
        try {
            result = request.get();
        } catch (MarketplaceException e) {
            if (e.getErrorCode().isStateRetained()) {
                log.debug("Request {} failed with {}, keeping its changes", requestName, e.getErrorCode());
                publish(unit.commit());
            } else {
                log.debug("Request {} failed with {}, rolling back", requestName, e.getErrorCode());
                unit.rollback();
            }
            throw e;
        } catch (RuntimeException | Error e) {
            log.warn("Request {} aborted: {}", requestName, e.toString());
            unit.rollback();
            throw e;
        }
        publish(unit.commit());
        return result;
    }

    private void publish(List<MarketplaceEvent> events) {
        for (MarketplaceEvent event : events) {
            try {
                eventPublisher.publishEvent(event);
            } catch (RuntimeException e) {
                // the request is already committed; a broken listener must not undo it
                log.error("Event listener failed for {}: {}", event.getType(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
