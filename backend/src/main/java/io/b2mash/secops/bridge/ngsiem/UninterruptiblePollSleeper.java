package io.b2mash.secops.bridge.ngsiem;

import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Sleeps for the full duration even if the thread is interrupted; the interrupt flag is restored
 * afterwards.
 */
@Component
class UninterruptiblePollSleeper implements PollSleeper {

  @Override
  public void sleep(Duration duration) {
    boolean interrupted = false;
    long deadline = System.nanoTime() + duration.toNanos();
    try {
      long remaining = duration.toNanos();
      while (remaining > 0) {
        try {
          Thread.sleep(remaining / 1_000_000L, (int) (remaining % 1_000_000L));
          remaining = 0;
        } catch (InterruptedException e) {
          interrupted = true;
          remaining = deadline - System.nanoTime();
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
