package com.github.cowwoc.throttle;

import org.testng.annotations.Test;

import java.time.Duration;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

public final class RateTest
{
	@Test(expectedExceptions = IllegalArgumentException.class)
	public void zeroInterval()
	{
		Rate.of(Duration.ZERO, 10);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void negativeInterval()
	{
		Rate.of(Duration.ofSeconds(-1), 10);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void zeroCapacity()
	{
		Rate.of(Duration.ofSeconds(1), 0);
	}

	@Test(expectedExceptions = NullPointerException.class)
	public void nullInterval()
	{
		Rate.of(null, 10);
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void unlimitedHasNoCapacity()
	{
		Rate.UNLIMITED.getCapacity();
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void unlimitedHasNoInterval()
	{
		Rate.UNLIMITED.getInterval();
	}

	@Test
	public void perSecond()
	{
		Rate rate = Rate.perSecond(5);
		REQUIREMENTS.requireThat(rate.isUnlimited(), "rate.isUnlimited()").isFalse();
		REQUIREMENTS.requireThat(rate.getInterval(), "rate.getInterval()").isEqualTo(Duration.ofSeconds(1));
		REQUIREMENTS.requireThat(rate.getCapacity(), "rate.getCapacity()").isEqualTo(5L);
		REQUIREMENTS.requireThat(rate, "rate").isEqualTo(Rate.of(Duration.ofSeconds(1), 5));
		REQUIREMENTS.requireThat(Rate.perMinute(5), "Rate.perMinute(5)").isNotEqualTo(rate, "rate");
	}

	@Test
	public void unlimitedIsNotEqualToLimited()
	{
		REQUIREMENTS.requireThat(Rate.UNLIMITED.isUnlimited(), "Rate.UNLIMITED.isUnlimited()").isTrue();
		REQUIREMENTS.requireThat(Rate.UNLIMITED, "Rate.UNLIMITED").isNotEqualTo(Rate.perSecond(1));
	}
}
