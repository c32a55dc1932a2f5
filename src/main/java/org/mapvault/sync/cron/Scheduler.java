/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for the periodic sync trigger, drains, reconciliation passes and
 * backoff wake-ups of one engine.
 */
public final class Scheduler implements ThreadFactory {

  private static final long MILLIS_IN_A_MINUTE = 60_000L;

  private static final Logger logger = LoggerFactory.getLogger(
      Scheduler.class);

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private final String name;

  private final long gracePeriodMinutes;

  private int currentThreadNo = 0;

  private final ScheduledExecutorService scheduler;

  /**
   * Create a scheduler.
   *
   * @param name Prefix of thread names.
   * @param poolSize Number of threads.
   * @param gracePeriodMinutes Time granted to running tasks on shutdown.
   */
  public Scheduler(String name, int poolSize, long gracePeriodMinutes) {
    this.name = name;
    this.gracePeriodMinutes = gracePeriodMinutes;
    this.scheduler = Executors.newScheduledThreadPool(poolSize, this);
  }

  /**
   * Run the given task every {@code period} minutes, aligned so that runs
   * happen {@code offset} minutes after multiples of the period.
   */
  public ScheduledFuture<?> schedulePeriodic(Runnable task, int offset,
      int period) {
    long periodMillis = period * MILLIS_IN_A_MINUTE;
    long initialDelayMillis = computeInitialDelayMillis(
        System.currentTimeMillis(), offset * MILLIS_IN_A_MINUTE, periodMillis);

    /* Run after initialDelay delay and then every period min. */
    logger.info("Periodic {} will first run in {} and then every {} "
        + "minutes.", task.getClass().getSimpleName(),
        initialDelayMillis < MILLIS_IN_A_MINUTE ? "under 1 minute"
        : (initialDelayMillis / MILLIS_IN_A_MINUTE) + " minute(s)", period);
    return this.scheduler.scheduleAtFixedRate(task, initialDelayMillis,
        periodMillis, TimeUnit.MILLISECONDS);
  }

  protected static long computeInitialDelayMillis(long currentMillis,
      long offsetMillis, long periodMillis) {
    return (periodMillis - (currentMillis % periodMillis) + offsetMillis)
        % periodMillis;
  }

  /** Run a task once, as soon as possible. */
  public void execute(Runnable task) {
    this.scheduler.execute(task);
  }

  /** Run a task once and return its result as a future. */
  public <T> Future<T> submit(Callable<T> task) {
    return this.scheduler.submit(task);
  }

  /** Run a task once after the given delay. */
  public ScheduledFuture<?> schedule(Runnable task, long delayMillis) {
    return this.scheduler.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
  }

  public boolean isShutdown() {
    return this.scheduler.isShutdown();
  }

  /**
   * Try to shutdown smoothly, i.e., wait for running tasks to terminate.
   */
  public void shutdownScheduler() {
    try {
      logger.info("Waiting at most {} minutes for termination "
          + "of running tasks ... ", gracePeriodMinutes);
      scheduler.shutdown();
      if (scheduler.awaitTermination(gracePeriodMinutes, TimeUnit.MINUTES)) {
        logger.info("Shutdown of all scheduled tasks completed "
            + "successfully.");
      } else {
        List<Runnable> notTerminated = scheduler.shutdownNow();
        logger.warn("Forced shutdown of {} task(s).", notTerminated.size());
      }
    } catch (InterruptedException ie) {
      List<Runnable> notTerminated = scheduler.shutdownNow();
      logger.error("Regular shutdown failed for: " + notTerminated);
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public synchronized Thread newThread(Runnable runner) {
    return namedDaemon(runner, name + "-Scheduled-Thread-"
        + ++currentThreadNo);
  }

  /**
   * Return a factory for pools owned by other components, creating daemon
   * threads named {@code <name>-<role>-Thread-<n>}.
   */
  public ThreadFactory threadFactory(String role) {
    AtomicInteger threadNo = new AtomicInteger();
    return runner -> namedDaemon(runner, name + "-" + role + "-Thread-"
        + threadNo.incrementAndGet());
  }

  private Thread namedDaemon(Runnable runner, String threadName) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName(threadName);
    logger.debug("New Thread created: " + newThread.getName());
    return newThread;
  }
}
