/**
 * <h1>Locking policy</h1>
 * <p>
 * Each {@link com.github.cowwoc.throttle.Bucket} guards its state with a single
 * {@link java.util.concurrent.locks.ReentrantReadWriteLock}. Readers hold the read lock only long enough to
 * copy the fields they need into a local snapshot. Writers acquire the write lock and re-validate the
 * snapshot before mutating anything; if the state moved on in the meantime the writer discards its work and
 * starts over.
 * <p>
 * Threads that wait for the next drain sleep on a {@code Condition} of the write lock so that rate updates
 * can wake them early.
 * <p>
 * Unless otherwise stated, public methods are responsible for acquiring locks on behalf of non-public
 * methods that they invoke.
 */
package com.github.cowwoc.throttle.internal;
