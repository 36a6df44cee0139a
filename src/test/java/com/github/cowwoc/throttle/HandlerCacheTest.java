package com.github.cowwoc.throttle;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

public final class HandlerCacheTest
{
	@Test
	public void distinctKeys()
	{
		AtomicInteger created = new AtomicInteger();
		try (HandlerCache<Group> cache = HandlerCache.<Group>builder().
			factory(key ->
			{
				created.incrementAndGet();
				return new Group(Rate.perSecond(10));
			}).
			build())
		{
			Group first = cache.get("a");
			Group second = cache.get("b");
			REQUIREMENTS.requireThat(first, "first").isNotSameObjectAs(second, "second");
			REQUIREMENTS.requireThat(cache.get("a"), "cache.get(\"a\")").isSameObjectAs(first, "first");
			REQUIREMENTS.requireThat(created.get(), "created").isEqualTo(2);
			REQUIREMENTS.requireThat(cache.size(), "cache.size()").isEqualTo(2);
		}
	}

	@Test
	public void evictIdleKeys() throws InterruptedException
	{
		try (HandlerCache<Group> cache = HandlerCache.<Group>builder().
			factory(key -> new Group(Rate.perSecond(10))).
			expiry(Duration.ofMillis(200)).
			build())
		{
			Group a = cache.get("a");
			Group b = cache.get("b");

			// Refreshing "a" restarts its timer
			Thread.sleep(100);
			REQUIREMENTS.requireThat(cache.get("a"), "cache.get(\"a\")").isSameObjectAs(a, "a");

			Thread.sleep(150);
			REQUIREMENTS.requireThat(cache.contains("a"), "cache.contains(\"a\")").isTrue();
			REQUIREMENTS.requireThat(cache.contains("b"), "cache.contains(\"b\")").isFalse();

			// Evicted keys start over with a new handler
			REQUIREMENTS.requireThat(cache.get("b"), "cache.get(\"b\")").isNotSameObjectAs(b, "b");
		}
	}

	@Test
	public void zeroExpiryNeverEvicts() throws InterruptedException
	{
		try (HandlerCache<Group> cache = HandlerCache.<Group>builder().
			factory(key -> new Group(Rate.perSecond(10))).
			expiry(Duration.ZERO).
			build())
		{
			cache.get("a");
			Thread.sleep(100);
			REQUIREMENTS.requireThat(cache.contains("a"), "cache.contains(\"a\")").isTrue();
		}
	}

	@Test
	public void closeEvictsKeys()
	{
		ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
		try
		{
			HandlerCache<Group> cache = HandlerCache.<Group>builder().
				factory(key -> new Group(Rate.perSecond(10))).
				expiry(Duration.ofMinutes(1)).
				scheduler(scheduler).
				build();
			cache.get("a");
			cache.close();
			REQUIREMENTS.requireThat(cache.size(), "cache.size()").isZero();
			// The caller owns the scheduler
			REQUIREMENTS.requireThat(scheduler.isShutdown(), "scheduler.isShutdown()").isFalse();
		}
		finally
		{
			scheduler.shutdownNow();
		}
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void getAfterClose()
	{
		HandlerCache<Group> cache = HandlerCache.<Group>builder().
			factory(key -> new Group(Rate.perSecond(10))).
			build();
		cache.close();
		cache.get("a");
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void negativeExpiry()
	{
		HandlerCache.<Group>builder().expiry(Duration.ofSeconds(-1));
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void missingFactory()
	{
		HandlerCache.<Group>builder().build();
	}

	@Test(expectedExceptions = NullPointerException.class)
	public void factoryReturnsNull()
	{
		try (HandlerCache<Group> cache = HandlerCache.<Group>builder().
			factory(key -> null).
			build())
		{
			cache.get("a");
		}
	}
}
