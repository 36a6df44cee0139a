package com.github.cowwoc.throttle;

import org.testng.annotations.Test;

import java.time.Duration;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

public final class DataRateTest
{
	@Test
	public void units()
	{
		REQUIREMENTS.requireThat(DataRate.KILOBIT, "DataRate.KILOBIT").isEqualTo(128L);
		REQUIREMENTS.requireThat(DataRate.MEGABIT, "DataRate.MEGABIT").isEqualTo(128L * 1024);
		REQUIREMENTS.requireThat(DataRate.GIGABIT, "DataRate.GIGABIT").isEqualTo(128L * 1024 * 1024);
	}

	@Test
	public void conversions()
	{
		REQUIREMENTS.requireThat(DataRate.bytesPerSecond(10), "DataRate.bytesPerSecond(10)").
			isEqualTo(Rate.of(Duration.ofSeconds(1), 10));
		REQUIREMENTS.requireThat(DataRate.kilobitsPerSecond(3).getCapacity(), "kilobitsPerSecond(3)").
			isEqualTo(3 * DataRate.KILOBIT);
		REQUIREMENTS.requireThat(DataRate.megabitsPerSecond(2).getCapacity(), "megabitsPerSecond(2)").
			isEqualTo(2 * DataRate.MEGABIT);
		Rate gigabits = DataRate.gigabitsPerSecond(1);
		REQUIREMENTS.requireThat(gigabits.getCapacity(), "gigabits.getCapacity()").isEqualTo(DataRate.GIGABIT);
		REQUIREMENTS.requireThat(gigabits.getInterval(), "gigabits.getInterval()").
			isEqualTo(Duration.ofSeconds(1));
	}

	@Test(expectedExceptions = ArithmeticException.class)
	public void overflow()
	{
		DataRate.gigabitsPerSecond(Long.MAX_VALUE);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void zeroKilobits()
	{
		DataRate.kilobitsPerSecond(0);
	}
}
