package com.mindthread.backend.snippet.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Deadline and cancellation signal shared by every store call of one thread build. Store adapters
 * check it before issuing a query and bound the query by {@link #remaining()}.
 */
public final class QueryDeadline {

  private static final Instant UNBOUNDED = Instant.MAX;
  private static final Duration FOREVER = Duration.ofSeconds(Long.MAX_VALUE);

  private final Clock clock;
  private final Instant expiresAt;
  private volatile boolean cancelled;

  private QueryDeadline(Clock clock, Instant expiresAt) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.expiresAt = expiresAt;
  }

  public static QueryDeadline none() {
    return new QueryDeadline(Clock.systemUTC(), UNBOUNDED);
  }

  public static QueryDeadline after(Duration timeout) {
    return after(timeout, Clock.systemUTC());
  }

  public static QueryDeadline after(Duration timeout, Clock clock) {
    Objects.requireNonNull(timeout, "timeout");
    return new QueryDeadline(clock, clock.instant().plus(timeout));
  }

  public boolean isBounded() {
    return !UNBOUNDED.equals(expiresAt);
  }

  public void cancel() {
    cancelled = true;
  }

  public boolean isExpired() {
    return cancelled || (isBounded() && !clock.instant().isBefore(expiresAt));
  }

  /** Time left before expiry; {@link Duration#ZERO} once expired or cancelled. */
  public Duration remaining() {
    if (cancelled) {
      return Duration.ZERO;
    }
    if (!isBounded()) {
      return FOREVER;
    }
    Duration left = Duration.between(clock.instant(), expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public void checkActive(String operation) {
    if (cancelled) {
      throw new QueryDeadlineExceededException(operation + " cancelled");
    }
    if (isExpired()) {
      throw new QueryDeadlineExceededException(operation + " exceeded its deadline");
    }
  }
}
