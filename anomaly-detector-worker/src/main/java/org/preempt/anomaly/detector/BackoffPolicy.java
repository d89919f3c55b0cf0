package org.preempt.anomaly.detector;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with jitter. The base delay starts at {@code initial}, doubles after every
 * call to {@link #nextDelay()} up to {@code max}, and returns to {@code initial} on {@link
 * #reset()}. The returned delay is the base delay scaled by a random factor in {@code [1 - jitter,
 * 1 + jitter]}, never more than {@code max}.
 */
public class BackoffPolicy {
  static final double DEFAULT_JITTER = 0.2;

  private final Duration initial;
  private final Duration max;
  private final double jitter;
  private final Random random;
  private Duration current;

  public BackoffPolicy(Duration initial, Duration max) {
    this(initial, max, DEFAULT_JITTER, new Random());
  }

  BackoffPolicy(Duration initial, Duration max, double jitter, Random random) {
    Preconditions.checkArgument(
        !initial.isNegative() && !initial.isZero(), "initial backoff must be positive");
    Preconditions.checkArgument(max.compareTo(initial) >= 0, "max backoff must be >= initial");
    Preconditions.checkArgument(jitter >= 0 && jitter < 1, "jitter must be in [0, 1)");
    this.initial = initial;
    this.max = max;
    this.jitter = jitter;
    this.random = random;
    this.current = initial;
  }

  public Duration nextDelay() {
    double factor = 1 + jitter * (2 * random.nextDouble() - 1);
    long delayMillis = Math.min(max.toMillis(), Math.round(current.toMillis() * factor));
    Duration doubled = current.multipliedBy(2);
    current = doubled.compareTo(max) > 0 ? max : doubled;
    return Duration.ofMillis(delayMillis);
  }

  public void reset() {
    current = initial;
  }

  Duration getCurrent() {
    return current;
  }
}
