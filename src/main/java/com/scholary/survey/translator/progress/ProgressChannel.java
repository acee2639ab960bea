package com.scholary.survey.translator.progress;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live progress of one job.
 *
 * <p>Every publish bumps a version and signals waiting readers, so a stream wakes up on change
 * instead of polling.
 */
final class ProgressChannel {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  private ProgressSnapshot current;
  private long version;

  ProgressChannel(ProgressSnapshot initial) {
    this.current = initial;
  }

  void publish(ProgressSnapshot snapshot) {
    lock.lock();
    try {
      current = snapshot;
      version++;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  Observation observe() {
    lock.lock();
    try {
      return new Observation(version, current);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Wait until the version moves past {@code seenVersion} or the timeout elapses.
   *
   * @return the latest observation, unchanged if the wait timed out
   */
  Observation awaitChange(long seenVersion, Duration timeout) throws InterruptedException {
    lock.lock();
    try {
      long nanos = timeout.toNanos();
      while (version == seenVersion && nanos > 0) {
        nanos = changed.awaitNanos(nanos);
      }
      return new Observation(version, current);
    } finally {
      lock.unlock();
    }
  }

  record Observation(long version, ProgressSnapshot snapshot) {}
}
