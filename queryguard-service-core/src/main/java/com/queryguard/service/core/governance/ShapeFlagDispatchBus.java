package com.queryguard.service.core.governance;

import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-handler asynchronous dispatch using a dedicated single-thread worker and deque. A slow or
 * failing handler never blocks the publisher or the other handlers.
 */
@Component
@Slf4j
public class ShapeFlagDispatchBus implements AutoCloseable {

    private final List<ShapeFlagHandler> handlers;
    private final Map<ShapeFlagHandler, Worker> workers = new ConcurrentHashMap<>();

    public ShapeFlagDispatchBus(List<ShapeFlagHandler> handlers) {
        this.handlers = List.copyOf(handlers);
        log.info("Shape flag dispatch bus ready handlers={}", this.handlers.size());
    }

    public void dispatch(ShapeFlaggedEvent event) {
        if (event == null) return;
        for (ShapeFlagHandler handler : handlers) {
            workers.computeIfAbsent(handler, Worker::new).offer(event);
        }
    }

    /** Blocks until every queued event has been handled or the timeout elapses. */
    public boolean awaitIdle(long timeout, TimeUnit unit) {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (workers.values().stream().anyMatch(Worker::busy)) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    @Override
    @PreDestroy
    public void close() {
        workers.values().forEach(Worker::shutdown);
        workers.clear();
    }

    private static final class Worker implements Runnable {
        private final ShapeFlagHandler handler;
        private final LinkedBlockingDeque<ShapeFlaggedEvent> queue = new LinkedBlockingDeque<>();
        private final AtomicBoolean running = new AtomicBoolean(true);
        private final AtomicInteger pending = new AtomicInteger();
        private final Thread thread;

        Worker(ShapeFlagHandler handler) {
            this.handler = handler;
            this.thread = new Thread(this, "queryguard-flag-worker-" + handler.getClass().getSimpleName());
            this.thread.setDaemon(true);
            this.thread.start();
        }

        void offer(ShapeFlaggedEvent event) {
            pending.incrementAndGet();
            queue.offer(event);
        }

        boolean busy() {
            return pending.get() > 0;
        }

        void shutdown() {
            running.set(false);
            thread.interrupt();
        }

        @Override
        public void run() {
            while (running.get()) {
                ShapeFlaggedEvent event = null;
                try {
                    event = queue.poll(250, TimeUnit.MILLISECONDS);
                    if (event != null) handler.handle(event);
                } catch (InterruptedException ie) {
                    // shutdown
                    Thread.currentThread().interrupt();
                    return;
                } catch (RuntimeException ex) {
                    log.warn(
                            "Shape flag handler {} failed for shape {}",
                            handler.getClass().getName(),
                            event != null ? event.shapeKey() : "<none>",
                            ex);
                } finally {
                    if (event != null) {
                        pending.decrementAndGet();
                    }
                }
            }
        }
    }
}
