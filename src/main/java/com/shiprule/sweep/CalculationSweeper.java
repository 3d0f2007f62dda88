package com.shiprule.sweep;

import com.shiprule.exception.NoActiveProfilesException;
import com.shiprule.service.OrderRepository;
import com.shiprule.service.ShippingCalculationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically calculates orders that have no stored shipping calculation.
 * <p>
 * Passes run on a single daemon thread with a fixed delay between them. Manual passes wait for a running one.
 * A failing order is logged and counted and does not stop the pass.
 */
public class CalculationSweeper {

    private static final Logger log = LoggerFactory.getLogger(CalculationSweeper.class);

    private static final long TERMINATION_TIMEOUT_SECONDS = 10;

    private final OrderRepository orderRepository;
    private final ShippingCalculationService calculationService;
    private final Duration initialDelay;
    private final Duration interval;

    private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();
    private final AtomicLong passCount = new AtomicLong();

    public CalculationSweeper(OrderRepository orderRepository,
                              ShippingCalculationService calculationService,
                              Duration initialDelay,
                              Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive: " + interval);
        }
        this.orderRepository = orderRepository;
        this.calculationService = calculationService;
        this.initialDelay = initialDelay != null && !initialDelay.isNegative() ? initialDelay : Duration.ZERO;
        this.interval = interval;
    }

    /**
     * Start periodic passes. Calling start on a running sweeper does nothing.
     */
    public void start() {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "shipping-sweeper");
            t.setDaemon(true);
            return t;
        });
        if (!scheduler.compareAndSet(null, executor)) {
            executor.shutdown();
            log.debug("CalculationSweeper already running");
            return;
        }

        executor.scheduleWithFixedDelay(this::runScheduled,
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("CalculationSweeper started: initial delay {}s, interval {}s",
                initialDelay.toSeconds(), interval.toSeconds());
    }

    /**
     * Stop periodic passes and wait for a running pass to finish.
     */
    public void stop() {
        ScheduledExecutorService executor = scheduler.getAndSet(null);
        if (executor == null) {
            return;
        }

        log.info("Stopping CalculationSweeper");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("CalculationSweeper did not finish within {}s, interrupting", TERMINATION_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return scheduler.get() != null;
    }

    /**
     * Get the number of completed passes.
     */
    public long getPassCount() {
        return passCount.get();
    }

    /**
     * Run one pass now on the calling thread. Waits for a scheduled pass in progress.
     *
     * @return Counts of the pass
     */
    public synchronized SweepReport runOnce() {
        List<String> pending = orderRepository.findOrdersWithoutCalculation();
        if (pending.isEmpty()) {
            passCount.incrementAndGet();
            return SweepReport.empty();
        }

        int calculated = 0;
        int failed = 0;
        for (String orderId : pending) {
            try {
                calculationService.calculate(orderId);
                calculated++;
            } catch (NoActiveProfilesException e) {
                log.warn("Sweep stopped: {}", e.getMessage());
                break;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Sweep failed to calculate order {}: {}", orderId, e.getMessage());
            }
        }

        passCount.incrementAndGet();
        SweepReport report = new SweepReport(pending.size(), calculated, failed);
        log.info("Sweep pass finished: {} examined, {} calculated, {} failed",
                report.examined(), report.calculated(), report.failed());
        return report;
    }

    private void runScheduled() {
        // An exception escaping here would cancel all later passes
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Sweep pass failed", e);
        }
    }
}
