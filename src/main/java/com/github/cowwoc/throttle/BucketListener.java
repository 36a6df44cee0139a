package com.github.cowwoc.throttle;

import java.time.Instant;

/**
 * Listens for bucket events.
 * <p>
 * Listeners are invoked without holding the bucket's lock.
 */
public interface BucketListener
{
	/**
	 * Invoked before a thread sleeps waiting for the bucket to drain.
	 *
	 * @param bucket the bucket the thread is waiting on
	 * @param wakeAt the time at which the thread will wake up, unless it is signalled earlier
	 * @throws InterruptedException if the wait should be aborted
	 */
	default void beforeSleep(Bucket bucket, Instant wakeAt) throws InterruptedException
	{
	}
}
