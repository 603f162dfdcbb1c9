/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.opensearch.docql.plan.prepared.Prepared;

/** A cached prepared plan and its usage statistics. */
@Getter
public class CacheEntry {

  @Setter(AccessLevel.PACKAGE)
  private volatile Prepared prepared;

  @Getter(AccessLevel.NONE)
  private final AtomicInteger uses = new AtomicInteger();

  private volatile Instant lastUse;

  @Getter(AccessLevel.NONE)
  private final AtomicLong serviceTime = new AtomicLong();

  @Getter(AccessLevel.NONE)
  private final AtomicLong minServiceTime = new AtomicLong(Long.MAX_VALUE);

  @Getter(AccessLevel.NONE)
  private final AtomicLong maxServiceTime = new AtomicLong();

  @Getter(AccessLevel.NONE)
  private final AtomicLong requestTime = new AtomicLong();

  @Getter(AccessLevel.NONE)
  private final AtomicLong minRequestTime = new AtomicLong(Long.MAX_VALUE);

  @Getter(AccessLevel.NONE)
  private final AtomicLong maxRequestTime = new AtomicLong();

  /** Set once the version stamps of the plan have been recorded by a full verification. */
  @Getter(AccessLevel.PACKAGE)
  @Setter(AccessLevel.PACKAGE)
  private volatile boolean populated;

  @Getter(AccessLevel.PACKAGE)
  private final ReentrantLock lock = new ReentrantLock();

  CacheEntry(Prepared prepared, boolean populated) {
    this.prepared = prepared;
    this.populated = populated;
  }

  void recordUse(Instant when) {
    uses.incrementAndGet();
    lastUse = when;
  }

  void recordTimes(Duration request, Duration service) {
    long serviceNanos = service.toNanos();
    serviceTime.addAndGet(serviceNanos);
    minServiceTime.accumulateAndGet(serviceNanos, Math::min);
    maxServiceTime.accumulateAndGet(serviceNanos, Math::max);
    long requestNanos = request.toNanos();
    requestTime.addAndGet(requestNanos);
    minRequestTime.accumulateAndGet(requestNanos, Math::min);
    maxRequestTime.accumulateAndGet(requestNanos, Math::max);
  }

  public int getUses() {
    return uses.get();
  }

  public Duration getServiceTime() {
    return Duration.ofNanos(serviceTime.get());
  }

  /** Shortest service time recorded, zero before the first execution. */
  public Duration getMinServiceTime() {
    long min = minServiceTime.get();
    return min == Long.MAX_VALUE ? Duration.ZERO : Duration.ofNanos(min);
  }

  public Duration getMaxServiceTime() {
    return Duration.ofNanos(maxServiceTime.get());
  }

  public Duration getRequestTime() {
    return Duration.ofNanos(requestTime.get());
  }

  /** Shortest request time recorded, zero before the first execution. */
  public Duration getMinRequestTime() {
    long min = minRequestTime.get();
    return min == Long.MAX_VALUE ? Duration.ZERO : Duration.ofNanos(min);
  }

  public Duration getMaxRequestTime() {
    return Duration.ofNanos(maxRequestTime.get());
  }
}
