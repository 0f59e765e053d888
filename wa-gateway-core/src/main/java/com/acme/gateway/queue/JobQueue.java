package com.acme.gateway.queue;

import com.acme.gateway.events.EventNames;
import com.acme.gateway.spi.EventSink;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process priority queue with bounded retries and a dead-letter set.
 *
 * <p>Selection takes the highest-priority pending job whose not-before instant has passed, FIFO by
 * enqueue order within a priority. Selection, the PROCESSING transition and the attempt increment
 * happen under one lock, so a job is never handed to two workers. A claim needs one of {@code
 * concurrency} execution slots, and the slot is only returned when the handler thread has finished,
 * so a handler that outlives its timeout still counts against the bound and its job is not retried
 * until that attempt has ended. Idle workers wait on the lock's condition.
 *
 * <p>Failed attempts are retried after {@code retryDelay * 2^(attempts-1)}; once {@code
 * maxAttempts} is reached the job moves to the dead-letter set, from which an operator can retry
 * it.
 */
public class JobQueue<P extends JobPayload> {
  private static final Logger LOG = LoggerFactory.getLogger(JobQueue.class);

  private static final Comparator<Job<?>> SELECTION_ORDER =
      Comparator.<Job<?>>comparingInt(j -> -j.getPriority().weight())
          .thenComparingLong(Job::getSequence);

  private final QueueConfig config;
  private final JobHandler<P> handler;
  private final EventSink events;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition jobAvailable = lock.newCondition();
  private final Map<String, Job<P>> jobs = new LinkedHashMap<>();
  private final TreeSet<Job<P>> pending = new TreeSet<>(SELECTION_ORDER);
  private final Map<String, Job<P>> deadLetters = new LinkedHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Semaphore slots;
  private volatile ExecutorService handlerExecutor;

  private ExecutorService workers;
  private volatile boolean running;

  public JobQueue(QueueConfig config, JobHandler<P> handler, EventSink events, Clock clock) {
    this.config = config;
    this.handler = handler;
    this.events = events;
    this.clock = clock;
    this.slots = new Semaphore(config.getConcurrency());
    this.handlerExecutor = newHandlerExecutor();
  }

  public String getName() {
    return config.getName();
  }

  public QueueConfig getConfig() {
    return config;
  }

  public String enqueue(P payload, JobPriority priority) {
    return enqueue(payload, priority, config.getMaxAttempts());
  }

  /** Add a job in PENDING state and wake one idle worker. */
  public String enqueue(P payload, JobPriority priority, int maxAttempts) {
    String id = UUID.randomUUID().toString();
    Job<P> job =
        new Job<>(
            id,
            payload,
            priority == null ? JobPriority.NORMAL : priority,
            maxAttempts,
            clock.instant(),
            sequence.incrementAndGet());
    lock.lock();
    try {
      jobs.put(id, job);
      pending.add(job);
      jobAvailable.signal();
    } finally {
      lock.unlock();
    }
    LOG.debug(
        "Job added to queue queue={} jobId={} type={} priority={}",
        getName(),
        id,
        job.getType(),
        job.getPriority());
    return id;
  }

  /** Start {@code concurrency} worker threads. Calling start on a running queue is a no-op. */
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    if (handlerExecutor.isShutdown()) {
      handlerExecutor = newHandlerExecutor();
    }
    workers = Executors.newFixedThreadPool(config.getConcurrency(), named("worker"));
    for (int i = 0; i < config.getConcurrency(); i++) {
      workers.execute(this::workLoop);
    }
    LOG.info("Queue worker started queue={} config={}", getName(), config);
  }

  /** Stop workers according to the configured {@link ShutdownPolicy}. */
  public synchronized void stop() {
    boolean wasRunning = running;
    running = false;
    lock.lock();
    try {
      jobAvailable.signalAll();
    } finally {
      lock.unlock();
    }
    if (workers != null) {
      shutdown(workers);
      workers = null;
    }
    shutdown(handlerExecutor);
    if (wasRunning) {
      LOG.info(
          "Queue worker stopped queue={} policy={} abandonedPending={}",
          getName(),
          config.getShutdownPolicy(),
          getStats().pending());
    }
  }

  private void shutdown(ExecutorService executor) {
    if (config.getShutdownPolicy() == ShutdownPolicy.ABANDON) {
      executor.shutdownNow();
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(config.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("Queue {} did not drain within {}, interrupting", getName(), config.getShutdownGrace());
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  public boolean isRunning() {
    return running;
  }

  private void workLoop() {
    while (running) {
      try {
        slots.acquire();
        Optional<Job<P>> next;
        try {
          next = awaitNext();
        } catch (InterruptedException e) {
          slots.release();
          throw e;
        }
        if (next.isPresent()) {
          execute(next.get());
        } else {
          slots.release();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  private Optional<Job<P>> awaitNext() throws InterruptedException {
    lock.lock();
    try {
      Optional<Job<P>> job = claimNextLocked();
      if (job.isEmpty() && running) {
        jobAvailable.await(config.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
      }
      return job;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Claim the next eligible job and wait for its attempt to finish, timed out or not.
   *
   * @return false when no job was eligible
   */
  public boolean processNext() {
    slots.acquireUninterruptibly();
    Optional<Job<P>> job;
    lock.lock();
    try {
      job = claimNextLocked();
    } finally {
      lock.unlock();
    }
    if (job.isEmpty()) {
      slots.release();
      return false;
    }
    try {
      execute(job.get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return true;
  }

  /** Run eligible jobs on the calling thread until none is left; returns how many ran. */
  public int drain() {
    int processed = 0;
    while (processNext()) {
      processed++;
    }
    return processed;
  }

  private Optional<Job<P>> claimNextLocked() {
    Instant now = clock.instant();
    for (Job<P> candidate : pending) {
      if (candidate.isEligible(now)) {
        pending.remove(candidate);
        candidate.markProcessing(now);
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  /** Runs one attempt while holding a slot; the attempt returns the slot when it ends. */
  private void execute(Job<P> job) throws InterruptedException {
    Attempt attempt = new Attempt(job);
    try {
      handlerExecutor.execute(attempt);
    } catch (RejectedExecutionException e) {
      slots.release();
      onFailure(job, e);
      return;
    }
    attempt.awaitEnd();
  }

  /**
   * One handler invocation. Whichever of the handler and the timeout settles first decides the
   * outcome; the job is only re-queued or completed from the handler thread, after the handler
   * returned.
   */
  private final class Attempt implements Runnable {
    private final Job<P> job;
    private final AtomicBoolean settled = new AtomicBoolean();
    private final CountDownLatch ended = new CountDownLatch(1);
    private Thread runner;

    Attempt(Job<P> job) {
      this.job = job;
    }

    @Override
    public void run() {
      synchronized (this) {
        runner = Thread.currentThread();
      }
      try {
        Object result = null;
        Exception failure = null;
        try {
          result = handler.handle(job);
        } catch (Exception e) {
          failure = e;
        } catch (Error e) {
          failure = new IllegalStateException(e);
        }
        if (!settled.compareAndSet(false, true)) {
          failure = new TimeoutException("Handler timed out after " + config.getHandlerTimeout());
        }
        if (failure == null) {
          onSuccess(job, result);
        } else {
          onFailure(job, failure);
        }
      } finally {
        synchronized (this) {
          runner = null;
          Thread.interrupted();
        }
        slots.release();
        ended.countDown();
      }
    }

    void awaitEnd() throws InterruptedException {
      if (ended.await(config.getHandlerTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        return;
      }
      if (settled.compareAndSet(false, true)) {
        LOG.warn(
            "Job handler timed out queue={} jobId={} timeout={}",
            getName(),
            job.getId(),
            config.getHandlerTimeout());
        synchronized (this) {
          Thread t = runner;
          if (t != null) {
            t.interrupt();
          }
        }
      }
      ended.await();
    }
  }

  private void onSuccess(Job<P> job, Object result) {
    lock.lock();
    try {
      job.markCompleted(clock.instant(), result);
    } finally {
      lock.unlock();
    }
    LOG.debug(
        "Job completed queue={} jobId={} attempts={}", getName(), job.getId(), job.getAttempts());
    events.emit(
        EventNames.JOB_COMPLETED,
        Map.of("queue", getName(), "jobId", job.getId(), "type", job.getType()));
  }

  private void onFailure(Job<P> job, Exception e) {
    String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    boolean dead;
    Duration delay = null;
    lock.lock();
    try {
      dead = job.getAttempts() >= job.getMaxAttempts();
      if (dead) {
        job.markDead(error);
        jobs.remove(job.getId());
        deadLetters.put(job.getId(), job);
      } else {
        delay = config.backoffFor(job.getAttempts());
        job.markRetry(error, clock.instant().plus(delay));
        pending.add(job);
        jobAvailable.signal();
      }
    } finally {
      lock.unlock();
    }

    if (dead) {
      LOG.warn(
          "Job moved to dead letter queue queue={} jobId={} attempts={} error={}",
          getName(),
          job.getId(),
          job.getAttempts(),
          error);
      Map<String, Object> payload = new HashMap<>();
      payload.put("queue", getName());
      payload.put("jobId", job.getId());
      payload.put("type", job.getType());
      payload.put("error", error);
      events.emit(EventNames.JOB_DEAD, payload);
    } else {
      LOG.debug(
          "Job will retry queue={} jobId={} attempts={} nextRetry={}",
          getName(),
          job.getId(),
          job.getAttempts(),
          delay);
    }
  }

  public QueueStats getStats() {
    lock.lock();
    try {
      int pendingCount = 0;
      int processing = 0;
      int completed = 0;
      for (Job<P> job : jobs.values()) {
        switch (job.getStatus()) {
          case PENDING -> pendingCount++;
          case PROCESSING -> processing++;
          case COMPLETED -> completed++;
          case DEAD -> {
            // dead jobs live in deadLetters only
          }
        }
      }
      return new QueueStats(getName(), pendingCount, processing, completed, deadLetters.size());
    } finally {
      lock.unlock();
    }
  }

  public Optional<Job<P>> getJob(String id) {
    lock.lock();
    try {
      Job<P> job = jobs.containsKey(id) ? jobs.get(id) : deadLetters.get(id);
      return Optional.ofNullable(job).map(Job::copy);
    } finally {
      lock.unlock();
    }
  }

  public List<Job<P>> getDeadLetterJobs() {
    lock.lock();
    try {
      List<Job<P>> copies = new ArrayList<>();
      deadLetters.values().forEach(j -> copies.add(j.copy()));
      return copies;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Move a dead job back to PENDING with its attempt counter reset; it is eligible immediately.
   *
   * @return false when no dead job has this id
   */
  public boolean retryDeadLetter(String jobId) {
    lock.lock();
    try {
      Job<P> job = deadLetters.remove(jobId);
      if (job == null) {
        return false;
      }
      job.resetForRetry(clock.instant());
      jobs.put(jobId, job);
      pending.add(job);
      jobAvailable.signal();
    } finally {
      lock.unlock();
    }
    LOG.info("Dead letter job retried queue={} jobId={}", getName(), jobId);
    return true;
  }

  /** Remove completed jobs from the active set; returns how many were removed. */
  public int clearCompleted() {
    lock.lock();
    try {
      int before = jobs.size();
      jobs.values().removeIf(j -> j.getStatus() == JobStatus.COMPLETED);
      return before - jobs.size();
    } finally {
      lock.unlock();
    }
  }

  private ExecutorService newHandlerExecutor() {
    return Executors.newCachedThreadPool(named("handler"));
  }

  private ThreadFactory named(String role) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "queue-" + config.getName() + "-" + role + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
