package com.github.cowwoc.throttle;

import com.google.common.math.LongMath;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * Rates of data transfer, where each token represents one byte.
 */
public final class DataRate
{
	/**
	 * The number of bytes in a kilobit (1024 bits).
	 */
	public static final long KILOBIT = 1024 / 8;
	/**
	 * The number of bytes in a megabit (1024 kilobits).
	 */
	public static final long MEGABIT = KILOBIT * 1024;
	/**
	 * The number of bytes in a gigabit (1024 megabits).
	 */
	public static final long GIGABIT = MEGABIT * 1024;

	/**
	 * Prevent construction.
	 */
	private DataRate()
	{
	}

	/**
	 * Returns a rate of {@code bytes} per second.
	 *
	 * @param bytes the number of bytes that may be transferred per second
	 * @return a limited rate
	 * @throws IllegalArgumentException if {@code bytes} is negative or zero
	 */
	public static Rate bytesPerSecond(long bytes)
	{
		return Rate.perSecond(bytes);
	}

	/**
	 * Returns a rate of {@code kilobits} per second.
	 *
	 * @param kilobits the number of kilobits that may be transferred per second
	 * @return a limited rate
	 * @throws IllegalArgumentException if {@code kilobits} is negative or zero
	 * @throws ArithmeticException      if the number of bytes overflows a {@code long}
	 */
	public static Rate kilobitsPerSecond(long kilobits)
	{
		return perSecond(kilobits, "kilobits", KILOBIT);
	}

	/**
	 * Returns a rate of {@code megabits} per second.
	 *
	 * @param megabits the number of megabits that may be transferred per second
	 * @return a limited rate
	 * @throws IllegalArgumentException if {@code megabits} is negative or zero
	 * @throws ArithmeticException      if the number of bytes overflows a {@code long}
	 */
	public static Rate megabitsPerSecond(long megabits)
	{
		return perSecond(megabits, "megabits", MEGABIT);
	}

	/**
	 * Returns a rate of {@code gigabits} per second.
	 *
	 * @param gigabits the number of gigabits that may be transferred per second
	 * @return a limited rate
	 * @throws IllegalArgumentException if {@code gigabits} is negative or zero
	 * @throws ArithmeticException      if the number of bytes overflows a {@code long}
	 */
	public static Rate gigabitsPerSecond(long gigabits)
	{
		return perSecond(gigabits, "gigabits", GIGABIT);
	}

	private static Rate perSecond(long amount, String name, long bytesPerUnit)
	{
		REQUIREMENTS.requireThat(amount, name).isPositive();
		return Rate.perSecond(LongMath.checkedMultiply(amount, bytesPerUnit));
	}
}
