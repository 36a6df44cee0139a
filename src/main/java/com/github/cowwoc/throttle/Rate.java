package com.github.cowwoc.throttle;

import com.github.cowwoc.throttle.internal.ToStringBuilder;

import java.time.Duration;
import java.util.Objects;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * The number of tokens that may be consumed per interval, or no limit at all.
 * <p>
 * <b>Thread safety</b>: This class is immutable.
 */
public final class Rate
{
	/**
	 * Disables throttling.
	 */
	public static final Rate UNLIMITED = new Rate(null, 0);

	/**
	 * {@code null} if unlimited.
	 */
	private final Duration interval;
	private final long capacity;

	/**
	 * Returns a rate of {@code capacity} tokens every {@code interval}.
	 *
	 * @param interval the refill period
	 * @param capacity the maximum number of tokens that may be consumed per {@code interval}
	 * @return a limited rate
	 * @throws NullPointerException     if {@code interval} is null
	 * @throws IllegalArgumentException if {@code interval} or {@code capacity} are negative or zero
	 */
	public static Rate of(Duration interval, long capacity)
	{
		REQUIREMENTS.requireThat(interval, "interval").isGreaterThan(Duration.ZERO);
		REQUIREMENTS.requireThat(capacity, "capacity").isPositive();
		return new Rate(interval, capacity);
	}

	/**
	 * Returns a rate of {@code capacity} tokens per second.
	 *
	 * @param capacity the maximum number of tokens that may be consumed per second
	 * @return a limited rate
	 * @throws IllegalArgumentException if {@code capacity} is negative or zero
	 */
	public static Rate perSecond(long capacity)
	{
		return of(Duration.ofSeconds(1), capacity);
	}

	/**
	 * Returns a rate of {@code capacity} tokens per minute.
	 *
	 * @param capacity the maximum number of tokens that may be consumed per minute
	 * @return a limited rate
	 * @throws IllegalArgumentException if {@code capacity} is negative or zero
	 */
	public static Rate perMinute(long capacity)
	{
		return of(Duration.ofMinutes(1), capacity);
	}

	/**
	 * @param interval the refill period ({@code null} if unlimited)
	 * @param capacity the maximum number of tokens that may be consumed per {@code interval}
	 */
	private Rate(Duration interval, long capacity)
	{
		this.interval = interval;
		this.capacity = capacity;
	}

	/**
	 * Indicates if this rate disables throttling.
	 *
	 * @return true if this rate disables throttling
	 */
	public boolean isUnlimited()
	{
		return interval == null;
	}

	/**
	 * Returns the refill period.
	 *
	 * @return the refill period
	 * @throws IllegalStateException if the rate is unlimited
	 */
	public Duration getInterval()
	{
		if (isUnlimited())
			throw new IllegalStateException("An unlimited rate has no interval");
		return interval;
	}

	/**
	 * Returns the maximum number of tokens that may be consumed per {@link #getInterval() interval}.
	 *
	 * @return the maximum number of tokens that may be consumed per interval
	 * @throws IllegalStateException if the rate is unlimited
	 */
	public long getCapacity()
	{
		if (isUnlimited())
			throw new IllegalStateException("An unlimited rate has no capacity");
		return capacity;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(interval, capacity);
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof Rate other))
			return false;
		return capacity == other.capacity && Objects.equals(interval, other.interval);
	}

	@Override
	public String toString()
	{
		if (isUnlimited())
			return "Rate.UNLIMITED";
		return new ToStringBuilder(Rate.class).
			add("interval", interval).
			add("capacity", capacity).
			toString();
	}
}
