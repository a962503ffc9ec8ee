package mta.eda.receipts.service.scheduler;

import mta.eda.receipts.exception.SchedulingException;
import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.receipt.GenerateOptions;
import mta.eda.receipts.model.schedule.RunState;
import mta.eda.receipts.model.schedule.Schedule;
import mta.eda.receipts.model.schedule.ScheduleEntry;
import mta.eda.receipts.model.schedule.TimingConfig;
import mta.eda.receipts.model.status.Activity;
import mta.eda.receipts.model.status.ProgressUpdate;
import mta.eda.receipts.model.status.Status;
import mta.eda.receipts.model.status.StatusEvent;
import mta.eda.receipts.service.status.StatusSink;
import mta.eda.receipts.service.util.RunStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * DeliveryScheduler
 * Turns a list of orders into a time-ordered plan and produces one receipt per order.
 * <p>
 * Execution model:
 * - Orders run strictly one after another on a single thread owned by the run,
 *   {@code maxConcurrent} only shapes the delay batches
 * - Before each order the run waits until the order's delay has elapsed since start
 * - A failed receipt is retried after {@code delayBetweenOrders}, up to {@code retryAttempts} times
 * - An order that still fails aborts the rest of the run with EXHAUSTED_RETRIES
 * - stop() wakes any pending wait immediately; no further receipt is requested
 * <p>
 * Progress subscribers are called synchronously, in order, on the thread that made the change,
 * while the scheduler lock is held. Only the active run writes status; a run that was stopped
 * or replaced by a newer one stays silent.
 */
public class DeliveryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryScheduler.class);

    // Orders that need a manual retry end up in failed-receipts.log
    private static final Logger failedReceiptsLogger = LoggerFactory.getLogger("FAILED_RECEIPTS_LOGGER");

    private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();

    private final ReceiptGenerator receiptGenerator;
    private final StatusSink statusSink;
    private final TimingConfig defaultTiming;
    private final GenerateOptions generateOptions;
    private final List<Consumer<Status>> progressSubscribers = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private RunState state = RunState.IDLE;
    private Schedule schedule;
    private TimingConfig timing;
    private Run activeRun;
    private CompletableFuture<Void> outcome;

    public DeliveryScheduler(ReceiptGenerator receiptGenerator, StatusSink statusSink,
                             TimingConfig defaultTiming, GenerateOptions generateOptions) {
        if (receiptGenerator == null) {
            throw new IllegalArgumentException("A receipt generator is required");
        }
        if (statusSink == null) {
            throw new IllegalArgumentException("A status sink is required");
        }
        this.receiptGenerator = receiptGenerator;
        this.statusSink = statusSink;
        this.defaultTiming = defaultTiming != null ? defaultTiming : TimingConfig.defaults();
        this.generateOptions = generateOptions != null ? generateOptions : GenerateOptions.defaults();
    }

    public Schedule schedule(List<Order> orders) {
        return schedule(orders, defaultTiming);
    }

    /**
     * Validates the orders, computes every delay and resets the progress counters.
     *
     * @throws SchedulingException INVALID_INPUT for an empty list, an order without id or bad timing;
     *                             INVALID_STATE while a run is in progress
     */
    public Schedule schedule(List<Order> orders, TimingConfig timingConfig) {
        validateOrders(orders);
        TimingConfig rules = timingConfig != null ? timingConfig : defaultTiming;
        validateTiming(rules, orders.size());

        Schedule planned = DelayCalculator.plan(orders, rules);
        synchronized (lock) {
            if (!RunStateMachine.isValidTransition(state, RunState.SCHEDULED)) {
                throw SchedulingException.invalidState("Cannot schedule while the scheduler is " + state);
            }
            this.schedule = planned;
            this.timing = rules;
            this.state = RunState.SCHEDULED;
            emit(StatusEvent.progress(ProgressUpdate.counters(planned.total(), 0, 0)));
        }

        logger.info("Scheduled {} orders: delayBetweenOrders={}ms, maxConcurrent={}, retryAttempts={}, lastDelay={}ms",
                planned.total(), rules.delayBetweenOrders(), rules.maxConcurrent(), rules.retryAttempts(),
                planned.delays().stream().mapToLong(Long::longValue).max().orElse(0));
        return planned;
    }

    /**
     * Starts the scheduled run on its own thread.
     *
     * @return completes when the run ends; completes exceptionally with a
     *         {@link SchedulingException} (EXHAUSTED_RETRIES) when an order failed every attempt.
     *         While a run is active the same future is returned.
     * @throws SchedulingException INVALID_STATE when nothing is scheduled
     */
    public CompletableFuture<Void> start() {
        Run run;
        List<ScheduleEntry> entries;
        TimingConfig rules;
        CompletableFuture<Void> result;
        synchronized (lock) {
            if (state == RunState.RUNNING) {
                return outcome;
            }
            if (!RunStateMachine.isValidTransition(state, RunState.RUNNING)) {
                throw SchedulingException.invalidState(state.isTerminal()
                        ? "Last run ended " + state + ", schedule again before starting"
                        : "Nothing scheduled, scheduler is " + state);
            }
            run = new Run();
            entries = schedule.entries();
            rules = timing;
            result = new CompletableFuture<>();
            activeRun = run;
            outcome = result;
            state = RunState.RUNNING;
            emit(StatusEvent.progress(ProgressUpdate.processing(true)),
                    StatusEvent.activity(Activity.info("Download scheduler started")));
        }

        logger.info("Delivery run {} started with {} orders", run.id, entries.size());
        run.executor.execute(() -> runToEnd(run, entries, rules, result));
        return result;
    }

    /**
     * Cancels the active run. Safe to call at any time, repeated calls do nothing.
     */
    public void stop() {
        Run run;
        synchronized (lock) {
            if (state != RunState.RUNNING || activeRun == null) {
                return;
            }
            run = activeRun;
            state = RunState.CANCELLED;
            run.cancel();
            emit(StatusEvent.progress(ProgressUpdate.processing(false)));
        }
        logger.info("Stop requested for delivery run {}", run.id);
    }

    /**
     * @return a handle that removes the callback; calling it again does nothing
     */
    public Runnable onProgress(Consumer<Status> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("Progress callback is required");
        }
        progressSubscribers.add(callback);
        return () -> progressSubscribers.remove(callback);
    }

    public RunState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public Schedule getSchedule() {
        synchronized (lock) {
            return schedule;
        }
    }

    private void runToEnd(Run run, List<ScheduleEntry> entries, TimingConfig rules, CompletableFuture<Void> result) {
        try {
            execute(run, entries, rules);
            finish(run, run.isCancelled() ? RunState.CANCELLED : RunState.COMPLETED);
            result.complete(null);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(run, RunState.CANCELLED);
            result.complete(null);

        } catch (RuntimeException e) {
            finish(run, RunState.FAILED);
            result.completeExceptionally(e);
        }
    }

    private void execute(Run run, List<ScheduleEntry> entries, TimingConfig rules) throws InterruptedException {
        List<ScheduleEntry> ordered = new ArrayList<>(entries);
        // List.sort is stable, equal delays keep input order
        ordered.sort(Comparator.comparingLong(ScheduleEntry::delay));

        long startedAt = System.nanoTime();
        for (ScheduleEntry entry : ordered) {
            if (run.isCancelled()) {
                return;
            }
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            long wait = entry.delay() - elapsed;
            if (wait > 0 && run.awaitCancel(wait)) {
                return;
            }
            if (run.isCancelled()) {
                return;
            }
            deliver(run, entry.order(), rules, ordered.size());
        }
    }

    private void deliver(Run run, Order order, TimingConfig rules, int total) throws InterruptedException {
        int attempts = 0;
        while (true) {
            if (run.isCancelled()) {
                return;
            }
            attempts++;
            try {
                receiptGenerator.generate(order, generateOptions);
                run.completed++;
                logger.info("Receipt produced for orderId={} (attempt {})", order.id(), attempts);
                if (!publish(run,
                        StatusEvent.progress(ProgressUpdate.counters(total, run.completed, run.failed)),
                        StatusEvent.activity(Activity.success("Downloaded order " + order.id())))) {
                    logger.info("Receipt for orderId={} arrived after stop, not reported", order.id());
                }
                return;

            } catch (RuntimeException e) {
                if (run.isCancelled()) {
                    logger.info("Receipt for orderId={} failed after stop was requested, not retrying", order.id());
                    return;
                }
                if (attempts > rules.retryAttempts()) {
                    run.failed++;
                    logger.error("Receipt for orderId={} failed after {} attempts: {}", order.id(), attempts, e.getMessage(), e);
                    failedReceiptsLogger.info("FAILED_RECEIPT | OrderId: {} | Attempts: {} | Method: {} | Reason: {}",
                            order.id(), attempts, generateOptions.method().wireName(), e.getMessage());
                    if (!publish(run,
                            StatusEvent.progress(ProgressUpdate.counters(total, run.completed, run.failed)),
                            StatusEvent.activity(Activity.error("Failed to download order " + order.id())))) {
                        return;
                    }
                    throw SchedulingException.exhaustedRetries(order.id(), total, attempts, e);
                }
                logger.warn("Receipt attempt {}/{} failed for orderId={}: {}. Retrying in {}ms",
                        attempts, rules.retryAttempts() + 1, order.id(), e.getMessage(), rules.delayBetweenOrders());
                if (run.awaitCancel(rules.delayBetweenOrders())) {
                    return;
                }
            }
        }
    }

    private void finish(Run run, RunState endState) {
        synchronized (lock) {
            // stop() already moved a cancelled run to CANCELLED and reported it
            if (activeRun == run) {
                if (state == RunState.RUNNING) {
                    state = endState;
                }
                activeRun = null;
                if (!run.isCancelled()) {
                    emit(StatusEvent.progress(ProgressUpdate.processing(false)));
                }
            }
        }
        logger.info("Delivery run {} ended: {} (completed={}, failed={})", run.id, endState, run.completed, run.failed);
        run.executor.shutdown();
    }

    /**
     * Reports events of {@code run} unless it was stopped or a newer run took over.
     *
     * @return false if the events were dropped
     */
    private boolean publish(Run run, StatusEvent... events) {
        synchronized (lock) {
            if (activeRun != run || run.isCancelled()) {
                return false;
            }
            emit(events);
            return true;
        }
    }

    // Caller holds the lock
    private void emit(StatusEvent... events) {
        for (StatusEvent event : events) {
            statusSink.update(event);
        }
        notifyProgress();
    }

    private void notifyProgress() {
        Status status = statusSink.getStatus();
        for (Consumer<Status> subscriber : progressSubscribers) {
            try {
                subscriber.accept(status);
            } catch (RuntimeException e) {
                logger.error("Progress callback failed: {}", e.getMessage(), e);
            }
        }
    }

    private static void validateOrders(List<Order> orders) {
        if (orders == null || orders.isEmpty()) {
            throw SchedulingException.invalidInput("Orders must be a non-empty list", 0);
        }
        for (Order order : orders) {
            if (order == null || order.id() == null || order.id().isBlank()) {
                throw SchedulingException.invalidInput("Each order must have a non-empty id", orders.size());
            }
        }
    }

    private static void validateTiming(TimingConfig rules, int ordersCount) {
        if (rules.delayBetweenOrders() < 0 || rules.initialDelay() < 0 || rules.minimumDelay() < 0) {
            throw SchedulingException.invalidInput("Delays must be zero or positive", ordersCount);
        }
        if (rules.maxConcurrent() < 1) {
            throw SchedulingException.invalidInput("maxConcurrent must be at least 1", ordersCount);
        }
        if (rules.retryAttempts() < 0) {
            throw SchedulingException.invalidInput("retryAttempts must be zero or positive", ordersCount);
        }
    }

    /**
     * State owned by one run: its thread, cancellation signal and counters.
     * Counters are only touched by the run's own thread.
     */
    private static final class Run {

        private final int id = RUN_SEQUENCE.incrementAndGet();
        private final CountDownLatch cancelled = new CountDownLatch(1);
        private final ExecutorService executor = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "delivery-run-" + id);
            thread.setDaemon(true);
            return thread;
        });
        private int completed;
        private int failed;

        void cancel() {
            cancelled.countDown();
        }

        boolean isCancelled() {
            return cancelled.getCount() == 0;
        }

        /**
         * @return true if the run was cancelled before {@code millis} passed
         */
        boolean awaitCancel(long millis) throws InterruptedException {
            return cancelled.await(millis, TimeUnit.MILLISECONDS);
        }
    }
}
