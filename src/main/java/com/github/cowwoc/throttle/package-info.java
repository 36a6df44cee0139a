/**
 * Throttles the throughput of byte streams to a configured {@link com.github.cowwoc.throttle.Rate}.
 * <p>
 * A {@link com.github.cowwoc.throttle.Bucket} meters transfers against a quota that is refilled in one lump
 * at the end of every interval. Streams created by a {@link com.github.cowwoc.throttle.Group} share a single
 * bucket. {@link com.github.cowwoc.throttle.HandlerCache} scopes buckets to dynamic keys, such as client
 * addresses, and evicts keys that go idle.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link com.github.cowwoc.throttle.Bucket}).
 */
package com.github.cowwoc.throttle;
