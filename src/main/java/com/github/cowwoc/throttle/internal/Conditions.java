package com.github.cowwoc.throttle.internal;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;

/**
 * Condition helper functions.
 */
public final class Conditions
{
	/**
	 * Prevent construction.
	 */
	private Conditions()
	{
	}

	/**
	 * Waits until a condition is signalled or a point in time is reached, whichever comes first. The caller
	 * must hold the lock associated with {@code condition} and must re-check its state after this method
	 * returns, since the thread may also wake up spuriously.
	 *
	 * @param condition the condition
	 * @param wakeAt    the time at which to stop waiting
	 * @return false if {@code wakeAt} was reached, else true
	 * @throws NullPointerException if any of the arguments are null
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 */
	public static boolean awaitUntil(Condition condition, Instant wakeAt) throws InterruptedException
	{
		Duration timeLeft = Duration.between(Instant.now(), wakeAt);
		if (timeLeft.isNegative() || timeLeft.isZero())
			return false;
		long nanos;
		try
		{
			nanos = timeLeft.toNanos();
		}
		catch (ArithmeticException e)
		{
			// Durations longer than ~292 years
			return condition.await(timeLeft.toSeconds(), TimeUnit.SECONDS);
		}
		return condition.awaitNanos(nanos) > 0;
	}
}
