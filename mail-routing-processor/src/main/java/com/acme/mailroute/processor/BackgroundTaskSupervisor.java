package com.acme.mailroute.processor;

import com.acme.mailroute.config.IngestionConfig;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the executor for asynchronous classification and keeps a registry of in-flight jobs so
 * they can be drained at shutdown. Finished jobs remove themselves; failures are logged and never
 * rethrown.
 */
@Slf4j
@Singleton
public class BackgroundTaskSupervisor {

  private final ExecutorService executor;
  private final Map<UUID, BackgroundJob> jobs = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  public BackgroundTaskSupervisor(IngestionConfig config) {
    this.executor = Executors.newFixedThreadPool(config.getWorkerThreads(), threadFactory());
  }

  /**
   * @throws IllegalStateException after {@link #shutdown()}
   */
  public BackgroundJob spawn(String name, Runnable work) {
    if (closed.get()) {
      throw new IllegalStateException("Supervisor is shut down, rejected job " + name);
    }
    UUID id = UUID.randomUUID();
    CompletableFuture<Void> future = CompletableFuture.runAsync(() -> run(name, work), executor);
    BackgroundJob job = new BackgroundJob(id, name, Instant.now(), future);
    jobs.put(id, job);
    // registered after put, so an already finished job still removes itself
    future.whenComplete((ignored, error) -> jobs.remove(id));
    log.debug("Spawned background job {} ({})", name, id);
    return job;
  }

  private static void run(String name, Runnable work) {
    try {
      work.run();
    } catch (RuntimeException e) {
      log.error("Background job {} failed: {}", name, e.getMessage(), e);
    }
  }

  public int outstanding() {
    return (int) jobs.values().stream().filter(j -> !j.isDone()).count();
  }

  public boolean isRunning(String name) {
    return jobs.values().stream().anyMatch(j -> !j.isDone() && j.name().equals(name));
  }

  /**
   * Waits for every outstanding job, including jobs spawned while waiting.
   *
   * @return false if jobs were still running when the timeout elapsed
   */
  public boolean drain(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      List<CompletableFuture<Void>> pending =
          jobs.values().stream()
              .map(BackgroundJob::future)
              .filter(f -> !f.isDone())
              .toList();
      if (pending.isEmpty()) {
        return true;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        log.warn("Drain timed out with {} jobs outstanding", pending.size());
        return false;
      }
      try {
        CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
            .get(remaining, TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        log.warn("Drain timed out with {} jobs outstanding", outstanding());
        return false;
      } catch (ExecutionException e) {
        log.debug("Drained job completed exceptionally: {}", e.getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
  }

  /** Stops accepting work and cancels whatever is still running. */
  @PreDestroy
  public void shutdown() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    int cancelled = 0;
    for (BackgroundJob job : jobs.values()) {
      if (job.future().cancel(true)) {
        cancelled++;
      }
    }
    executor.shutdownNow();
    log.info("Background supervisor shut down, {} jobs cancelled", cancelled);
  }

  private static ThreadFactory threadFactory() {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "mail-routing-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
