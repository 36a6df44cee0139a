package com.github.cowwoc.throttle;

import com.github.cowwoc.requirements.annotation.CheckReturnValue;
import com.github.cowwoc.throttle.internal.CloseableLock;
import com.github.cowwoc.throttle.internal.Conditions;
import com.github.cowwoc.throttle.internal.ReadWriteLockAsResource;
import com.github.cowwoc.throttle.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * Meters the consumption of tokens against a {@link Rate}.
 * <p>
 * Up to {@link Rate#getCapacity() capacity} tokens may be consumed per {@link Rate#getInterval() interval}.
 * Once an interval has elapsed since the last drain, the next caller drains the bucket, making the entire
 * capacity available again. Refills happen in one lump at interval boundaries; there is no gradual refill.
 * <p>
 * Consumption order is not guaranteed to be fair.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Bucket
{
	private final ReadWriteLockAsResource lock;
	/**
	 * Signalled when the rate changes or the bucket drains.
	 */
	private final Condition stateUpdated;
	private final List<BucketListener> listeners;
	private final Logger log = LoggerFactory.getLogger(Bucket.class);
	Rate rate;
	/**
	 * The number of tokens consumed since the last drain.
	 */
	long consumed;
	Instant lastDrainAt = Instant.EPOCH;

	/**
	 * Builds a new bucket.
	 *
	 * @return a Bucket builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new bucket.
	 *
	 * @param rate      the rate of consumption
	 * @param listeners the event listeners associated with this bucket
	 * @throws NullPointerException if any of the arguments are null
	 */
	private Bucket(Rate rate, List<BucketListener> listeners)
	{
		if (REQUIREMENTS.assertionsAreEnabled())
		{
			REQUIREMENTS.requireThat(rate, "rate").isNotNull();
			REQUIREMENTS.requireThat(listeners, "listeners").isNotNull();
		}
		this.lock = new ReadWriteLockAsResource();
		this.stateUpdated = lock.newCondition();
		this.rate = rate;
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Consumes up to {@code tokens} tokens, blocking until at least one token is available.
	 *
	 * @param tokens the maximum number of tokens to consume
	 * @return the number of tokens consumed, between {@code 1} and {@code tokens} (inclusive)
	 * @throws IllegalArgumentException if {@code tokens} is negative or zero
	 * @throws InterruptedException     if the thread is interrupted while waiting for tokens
	 */
	public long acquire(long tokens) throws InterruptedException
	{
		REQUIREMENTS.requireThat(tokens, "tokens").isPositive();
		return acquire(tokens, Instant.MAX);
	}

	/**
	 * Consumes up to {@code tokens} tokens, blocking until at least one token is available or
	 * {@code timeout} elapses.
	 *
	 * @param tokens  the maximum number of tokens to consume
	 * @param timeout the maximum amount of time to wait
	 * @return the number of tokens consumed, between {@code 0} and {@code tokens} (inclusive). {@code 0} if
	 * the timeout elapsed before any token became available.
	 * @throws NullPointerException     if {@code timeout} is null
	 * @throws IllegalArgumentException if {@code tokens} is negative or zero. If {@code timeout} is negative.
	 * @throws InterruptedException     if the thread is interrupted while waiting for tokens
	 */
	@CheckReturnValue
	public long tryAcquire(long tokens, Duration timeout) throws InterruptedException
	{
		REQUIREMENTS.requireThat(tokens, "tokens").isPositive();
		REQUIREMENTS.requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		return acquire(tokens, plus(Instant.now(), timeout));
	}

	/**
	 * @param tokens   the maximum number of tokens to consume
	 * @param deadline the time at which to give up waiting
	 * @return the number of tokens consumed
	 * @throws InterruptedException if the thread is interrupted while waiting for tokens
	 */
	private long acquire(long tokens, Instant deadline) throws InterruptedException
	{
		drain(false, deadline, lock.read(State::new));
		while (true)
		{
			State state = lock.read(State::new);
			if (state.rate.isUnlimited())
				return tokens;
			long capacity = state.rate.getCapacity();
			if (state.consumed >= capacity)
			{
				if (!drain(true, deadline, state))
					return 0;
				continue;
			}
			long granted = Math.min(tokens, capacity - state.consumed);
			try (CloseableLock ignored = lock.writeLock())
			{
				// Lost the race against another consumer or a rate change
				if (consumed != state.consumed || rate != state.rate)
					continue;
				consumed += granted;
			}
			return granted;
		}
	}

	/**
	 * Drains the bucket if an interval has elapsed since the last drain.
	 * <p>
	 * A blocking drain sleeps until the end of the current interval. It returns early if another thread
	 * drains the bucket or the rate changes.
	 *
	 * @param blocking true if the thread should wait for the end of the current interval
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	public void drain(boolean blocking) throws InterruptedException
	{
		drain(blocking, Instant.MAX, lock.read(State::new));
	}

	/**
	 * @param blocking true if the thread should wait for the end of the current interval
	 * @param deadline the time at which to give up waiting
	 * @param initial  the state that the caller last observed
	 * @return true if the bucket was drained or its state changed since {@code initial}; false if
	 * the bucket was not drained and {@code blocking} is false or {@code deadline} was reached
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	private boolean drain(boolean blocking, Instant deadline, State initial) throws InterruptedException
	{
		while (true)
		{
			State state = lock.read(State::new);
			if (state.rate.isUnlimited())
				return true;
			if (!state.lastDrainAt.equals(initial.lastDrainAt) || state.rate != initial.rate)
				return true;
			Instant drainAt = plus(state.lastDrainAt, state.rate.getInterval());
			Instant now = Instant.now();
			if (!now.isBefore(drainAt))
			{
				try (CloseableLock ignored = lock.writeLock())
				{
					if (state.isCurrent())
					{
						consumed = 0;
						lastDrainAt = now;
						stateUpdated.signalAll();
						log.debug("Drained at {}", now);
					}
				}
				return true;
			}
			if (!blocking || !now.isBefore(deadline))
				return false;
			Instant wakeAt;
			if (drainAt.isBefore(deadline))
				wakeAt = drainAt;
			else
				wakeAt = deadline;
			for (BucketListener listener : listeners)
				listener.beforeSleep(this, wakeAt);
			if (log.isDebugEnabled())
				log.debug("Sleeping {}. State before sleep: {}", Duration.between(now, wakeAt), this);
			try (CloseableLock ignored = lock.writeLock())
			{
				if (state.isCurrent())
					Conditions.awaitUntil(stateUpdated, wakeAt);
			}
		}
	}

	/**
	 * Returns {@code instant + duration}, saturating at {@link Instant#MAX}.
	 *
	 * @param instant  a point in time
	 * @param duration a non-negative duration
	 * @return the sum
	 */
	private static Instant plus(Instant instant, Duration duration)
	{
		try
		{
			return instant.plus(duration);
		}
		catch (DateTimeException | ArithmeticException e)
		{
			return Instant.MAX;
		}
	}

	/**
	 * Returns the rate of consumption.
	 *
	 * @return the rate of consumption
	 */
	public Rate getRate()
	{
		return lock.read(() -> rate);
	}

	/**
	 * Changes the rate of consumption. The number of consumed tokens is preserved, but is reduced to the new
	 * capacity if it exceeds it. Threads waiting for the bucket to drain re-evaluate the new rate
	 * immediately.
	 *
	 * @param rate the rate of consumption
	 * @throws NullPointerException if {@code rate} is null
	 */
	public void setRate(Rate rate)
	{
		REQUIREMENTS.requireThat(rate, "rate").isNotNull();
		try (CloseableLock ignored = lock.writeLock())
		{
			this.rate = rate;
			if (!rate.isUnlimited() && consumed > rate.getCapacity())
				consumed = rate.getCapacity();
			stateUpdated.signalAll();
		}
		log.debug("Rate changed to {}", rate);
	}

	/**
	 * Returns the number of tokens consumed since the last drain.
	 *
	 * @return the number of tokens consumed since the last drain
	 */
	public long getConsumed()
	{
		return lock.read(() -> consumed);
	}

	/**
	 * Returns the last time the bucket was drained.
	 *
	 * @return {@link Instant#EPOCH} if the bucket was never drained
	 */
	public Instant getLastDrainAt()
	{
		return lock.read(() -> lastDrainAt);
	}

	/**
	 * Returns the event listeners associated with this bucket.
	 *
	 * @return an unmodifiable list
	 */
	public List<BucketListener> getListeners()
	{
		return listeners;
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.readLock())
		{
			return new ToStringBuilder(Bucket.class).
				add("rate", rate).
				add("consumed", consumed).
				add("lastDrainAt", lastDrainAt).
				toString();
		}
	}

	/**
	 * A snapshot of the bucket's state.
	 */
	private final class State
	{
		final Rate rate;
		final long consumed;
		final Instant lastDrainAt;

		/**
		 * Copies the bucket's state. The caller must hold a lock.
		 */
		State()
		{
			this.rate = Bucket.this.rate;
			this.consumed = Bucket.this.consumed;
			this.lastDrainAt = Bucket.this.lastDrainAt;
		}

		/**
		 * Indicates if the bucket has not drained nor changed its rate since the snapshot was taken. The
		 * caller must hold the write lock.
		 *
		 * @return true if the snapshot is still current
		 */
		boolean isCurrent()
		{
			assert (lock.isWriteLockedByCurrentThread());
			return Bucket.this.rate == rate && Bucket.this.lastDrainAt.equals(lastDrainAt);
		}
	}

	/**
	 * Builds a bucket.
	 */
	public static final class Builder
	{
		private Rate rate = Rate.UNLIMITED;
		private final List<BucketListener> listeners = new ArrayList<>();

		/**
		 * Use {@link Bucket#builder()}.
		 */
		Builder()
		{
		}

		/**
		 * Returns the rate of consumption.
		 *
		 * @return {@link Rate#UNLIMITED} by default
		 */
		@CheckReturnValue
		public Rate rate()
		{
			return rate;
		}

		/**
		 * Sets the rate of consumption.
		 *
		 * @param rate the rate of consumption
		 * @return this
		 * @throws NullPointerException if {@code rate} is null
		 */
		@CheckReturnValue
		public Builder rate(Rate rate)
		{
			REQUIREMENTS.requireThat(rate, "rate").isNotNull();
			this.rate = rate;
			return this;
		}

		/**
		 * Returns the event listeners associated with the bucket.
		 *
		 * @return the event listeners
		 */
		public List<BucketListener> listeners()
		{
			return listeners;
		}

		/**
		 * Adds an event listener to the bucket.
		 *
		 * @param listener a listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		public Builder addListener(BucketListener listener)
		{
			REQUIREMENTS.requireThat(listener, "listener").isNotNull();
			listeners.add(listener);
			return this;
		}

		/**
		 * Builds a new bucket.
		 *
		 * @return a new bucket
		 */
		@CheckReturnValue
		public Bucket build()
		{
			return new Bucket(rate, listeners);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("rate", rate).
				add("listeners", listeners).
				toString();
		}
	}
}
