package groundcontrol.coordinator.scheduler;

import groundcontrol.coordinator.config.CoordinatorConfig;
import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskResult;
import groundcontrol.coordinator.model.TaskStatus;
import groundcontrol.coordinator.repository.StoreException;
import groundcontrol.coordinator.service.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs every task of a run to a terminal state, honouring dependencies and a
 * fixed bound on simultaneously running tasks.
 *
 * <p>The queue keeps no scheduling state of its own. Each cycle it asks the
 * store for ready tasks, marks them QUEUED, launches them (at most
 * {@code maxParallel} at a time, slots taken in listing order) and waits for
 * the whole batch before asking again. When nothing is ready and nothing is
 * in flight the loop ends; tasks still PENDING at that point can never become
 * ready and are left out of the returned outcomes.
 *
 * <p>Executor failures and exceptions are recorded as FAILED tasks. Store
 * failures abort the loop and propagate to the caller.
 */
public class TaskQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final StateStore store;
    private final int maxParallel;
    private final Duration pollInterval;
    private final Semaphore slots;
    private final ExecutorService workers;

    public TaskQueue(StateStore store, CoordinatorConfig config) {
        this(store, config.maxParallel(), config.pollInterval());
    }

    public TaskQueue(StateStore store, int maxParallel, Duration pollInterval) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be positive");
        }
        this.store = store;
        this.maxParallel = maxParallel;
        this.pollInterval = pollInterval;
        this.slots = new Semaphore(maxParallel, true);

        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxParallel, r -> {
            Thread t = new Thread(r, "gc-queue-" + pool + "-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public int maxParallel() {
        return maxParallel;
    }

    /**
     * Execute all pending tasks of a run, respecting dependencies.
     *
     * @param runId    the run to drive
     * @param executor performs the work of a single task
     * @return one outcome per task that was attempted, in completion order
     * @throws StoreException if the store fails; the run is left as last written
     */
    public List<TaskResult> executeAll(String runId, TaskExecutor executor) {
        Map<String, TaskResult> results = Collections.synchronizedMap(new LinkedHashMap<>());
        int batchNo = 0;

        while (true) {
            List<Task> ready = store.readyTasks(runId);

            if (ready.isEmpty()) {
                List<Task> all = store.listTasks(runId);
                if (ReadinessQuery.hasInFlight(all)) {
                    // another in-flight task may still unblock work
                    pause();
                    continue;
                }
                reportStarved(runId, all);
                break;
            }

            // Commit QUEUED for the whole batch before anything starts.
            // A task made terminal since the read (e.g. SKIPPED) is refused and left out.
            List<Task> batch = new ArrayList<>();
            for (Task task : ready) {
                if (store.setTaskStatus(task.id(), TaskStatus.QUEUED)) {
                    batch.add(task);
                } else {
                    log.info("Task {} already terminal, not queued", task.id());
                }
            }
            if (batch.isEmpty()) {
                continue;
            }

            batchNo++;
            log.info("Run {} batch {}: {} task(s) queued (max parallel {})",
                    runId, batchNo, batch.size(), maxParallel);

            runBatch(batch, executor, results);
        }

        synchronized (results) {
            List<TaskResult> outcomes = new ArrayList<>(results.values());
            log.info("Run {} finished after {} batch(es): {} task(s) attempted", runId, batchNo, outcomes.size());
            return outcomes;
        }
    }

    private void runBatch(List<Task> batch, TaskExecutor executor, Map<String, TaskResult> results) {
        AtomicReference<RuntimeException> storeFault = new AtomicReference<>();
        Map<Task, Future<?>> launched = new LinkedHashMap<>();

        try {
            for (Task task : batch) {
                acquireSlot();
                if (storeFault.get() != null) {
                    slots.release();
                    break;
                }
                launched.put(task, workers.submit(() -> runSingle(task, executor, results, storeFault)));
            }
        } finally {
            awaitAll(launched, results, storeFault);
        }

        RuntimeException fault = storeFault.get();
        if (fault != null) {
            throw fault;
        }
    }

    private void runSingle(Task task, TaskExecutor executor, Map<String, TaskResult> results,
            AtomicReference<RuntimeException> storeFault) {
        try {
            if (!store.setTaskStatus(task.id(), TaskStatus.RUNNING)) {
                log.info("Task {} became terminal before it started, not running it", task.id());
                return;
            }
            log.info("Running task {}: {}", task.id(), task.title());

            TaskResult result = invoke(task, executor);
            record(task, result, results);
        } catch (RuntimeException e) {
            log.error("Store failure while running task {}", task.id(), e);
            storeFault.compareAndSet(null, e);
        } finally {
            slots.release();
        }
    }

    /**
     * Commit the terminal status, then keep the outcome. Outcomes refused by
     * the terminal guard are not reported.
     */
    private void record(Task task, TaskResult result, Map<String, TaskResult> results) {
        boolean written;
        if (result.success()) {
            written = store.setTaskStatus(task.id(), TaskStatus.COMPLETED, result.output());
        } else {
            written = store.setTaskStatus(task.id(), TaskStatus.FAILED, result.error());
        }
        if (!written) {
            log.warn("Task {} was made terminal while running, outcome dropped", task.id());
            return;
        }
        results.put(task.id(), result);
        if (result.success()) {
            log.info("Completed task {}: {}", task.id(), task.title());
        } else {
            log.warn("Failed task {}: {}: {}", task.id(), task.title(), result.error());
        }
    }

    private TaskResult invoke(Task task, TaskExecutor executor) {
        try {
            TaskResult result = executor.execute(task);
            if (result == null) {
                return TaskResult.failure(task.id(), "Executor returned no result");
            }
            if (!task.id().equals(result.taskId())) {
                return new TaskResult(task.id(), result.success(), result.output(), result.error());
            }
            return result;
        } catch (StoreException | VirtualMachineError e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskResult.failure(task.id(), "Interrupted");
        } catch (Throwable e) {
            log.warn("Error in task {}: {}", task.id(), e.toString());
            return TaskResult.failure(task.id(), describe(e));
        }
    }

    private void acquireSlot() {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a concurrency slot", e);
        }
    }

    private void awaitAll(Map<Task, Future<?>> launched, Map<String, TaskResult> results,
            AtomicReference<RuntimeException> storeFault) {
        boolean interrupted = false;
        for (Map.Entry<Task, Future<?>> entry : launched.entrySet()) {
            while (true) {
                try {
                    entry.getValue().get();
                    break;
                } catch (InterruptedException e) {
                    // the batch must drain before the loop can go on
                    interrupted = true;
                } catch (ExecutionException e) {
                    failAbandoned(entry.getKey(), e.getCause(), results, storeFault);
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for batch to finish");
        }
    }

    /**
     * A worker died without recording an outcome; fail its task so it never stays in flight.
     */
    private void failAbandoned(Task task, Throwable cause, Map<String, TaskResult> results,
            AtomicReference<RuntimeException> storeFault) {
        log.error("Task worker for {} terminated abnormally", task.id(), cause);
        if (storeFault.get() != null) {
            return;
        }
        try {
            TaskResult failure = TaskResult.failure(task.id(), describe(cause));
            if (store.setTaskStatus(task.id(), TaskStatus.FAILED, failure.error())) {
                results.put(task.id(), failure);
            }
        } catch (RuntimeException e) {
            log.error("Store failure while failing task {}", task.id(), e);
            storeFault.compareAndSet(null, e);
        }
    }

    private void pause() {
        try {
            TimeUnit.MILLISECONDS.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for in-flight tasks", e);
        }
    }

    private void reportStarved(String runId, List<Task> all) {
        List<String> stuck = all.stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .map(Task::id)
                .toList();
        if (!stuck.isEmpty()) {
            log.warn("Run {}: {} task(s) left PENDING with unsatisfiable dependencies: {}",
                    runId, stuck.size(), stuck);
        }
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    /**
     * Stop the worker pool.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Task queue workers forcefully stopped");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
