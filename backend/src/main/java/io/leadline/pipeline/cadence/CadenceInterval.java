package io.leadline.pipeline.cadence;

/**
 * Wait before the next system-paced attempt, in business days.
 *
 * @param attempt the attempt number this interval applies to (1-based; ignored for the overflow
 *     interval)
 * @param minDays minimum business days before the next attempt; used for scheduling
 * @param maxDays maximum business days before the next attempt
 * @param channel suggested channel for the attempt
 */
public record CadenceInterval(int attempt, int minDays, int maxDays, ContactChannel channel) {}
