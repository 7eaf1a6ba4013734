package com.hivemind.core.registry;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskSpec;
import com.hivemind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every submitted task and the pending queue.
 * <p>
 * The queue preserves submission order; the registry never reorders it. Only a
 * critical-task retry goes to the front via {@link #requeueFront(Task)}.
 * Not thread-safe on its own: the orchestrator serializes calls under its state lock.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong(0);
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final LinkedList<Task> queue = new LinkedList<>();

    public TaskRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates a PENDING task from {@code spec} and appends it to the queue.
     *
     * @return the created (live) task
     */
    public Task submit(TaskSpec spec) {
        String id = String.format("task-%06d", sequence.incrementAndGet());
        Task task = new Task(id, spec, clock.instant());
        tasks.put(id, task);
        queue.addLast(task);
        log.info("Submitted task {} [{}] priority={} complexity={} requires={}",
                id, spec.type(), spec.priority().wireName(), spec.complexity(), spec.requiredCapabilities());
        return task;
    }

    public Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /** Live, read-only view of all tasks in submission order. */
    public Collection<Task> list() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    /** Live tasks currently waiting, front first. */
    public List<Task> pending() {
        return new ArrayList<>(queue);
    }

    public boolean dequeue(Task task) {
        return queue.remove(task);
    }

    /** Puts a task that was reset to PENDING ahead of everything already waiting. */
    public void requeueFront(Task task) {
        if (task.status() != TaskStatus.PENDING) {
            throw new IllegalStateException("Only pending tasks can be requeued, " + task.id()
                    + " is " + task.status().wireName());
        }
        queue.remove(task);
        queue.addFirst(task);
        log.info("Requeued task {} at front of queue (retry {})", task.id(), task.retryCount());
    }

    public int size() {
        return tasks.size();
    }

    public int queueLength() {
        return queue.size();
    }

    public long countByStatus(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).count();
    }
}
