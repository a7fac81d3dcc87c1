package com.gentoro.twinsync.retry;

/** Blocking pause between attempts; swapped for a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
