package com.github.cowwoc.throttle;

import com.github.cowwoc.requirements.annotation.CheckReturnValue;
import com.github.cowwoc.throttle.internal.CloseableLock;
import com.github.cowwoc.throttle.internal.ReadWriteLockAsResource;
import com.github.cowwoc.throttle.internal.ToStringBuilder;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * Maps keys to handlers, creating handlers on demand and evicting keys that have not been requested for a
 * period of time.
 * <p>
 * Each lookup restarts the key's expiration timer. Once a key expires, the next lookup creates a new
 * handler, so any state held by the old handler (such as a consumed quota) is lost.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 *
 * @param <H> the type of handlers
 */
public final class HandlerCache<H> implements AutoCloseable
{
	private final Function<String, H> factory;
	private final Duration expiry;
	private final ScheduledExecutorService scheduler;
	private final boolean ownsScheduler;
	private final ReadWriteLockAsResource lock = new ReadWriteLockAsResource();
	private final Map<String, Entry<H>> entries = new HashMap<>();
	private boolean closed;
	private final Logger log = LoggerFactory.getLogger(HandlerCache.class);

	/**
	 * Builds a new cache.
	 *
	 * @param <H> the type of handlers
	 * @return a HandlerCache builder
	 */
	public static <H> Builder<H> builder()
	{
		return new Builder<>();
	}

	/**
	 * Creates a new cache.
	 *
	 * @param factory       creates the handler of a key
	 * @param expiry        the amount of time after which an unused key is evicted ({@code Duration.ZERO}
	 *                      if keys never expire)
	 * @param scheduler     runs eviction tasks
	 * @param ownsScheduler true if {@link #close()} should shut down {@code scheduler}
	 * @throws NullPointerException if any of the arguments are null
	 */
	private HandlerCache(Function<String, H> factory, Duration expiry, ScheduledExecutorService scheduler,
	                     boolean ownsScheduler)
	{
		if (REQUIREMENTS.assertionsAreEnabled())
		{
			REQUIREMENTS.requireThat(factory, "factory").isNotNull();
			REQUIREMENTS.requireThat(expiry, "expiry").isGreaterThanOrEqualTo(Duration.ZERO);
			REQUIREMENTS.requireThat(scheduler, "scheduler").isNotNull();
		}
		this.factory = factory;
		this.expiry = expiry;
		this.scheduler = scheduler;
		this.ownsScheduler = ownsScheduler;
	}

	/**
	 * Returns the handler of a key, creating it if necessary, and restarts the key's expiration timer.
	 * <p>
	 * The factory is invoked while holding the cache's lock, so it must not access the cache.
	 *
	 * @param key a key
	 * @return the handler of the key
	 * @throws NullPointerException  if {@code key} is null or the factory returns null
	 * @throws IllegalStateException if the cache is closed
	 */
	public H get(String key)
	{
		REQUIREMENTS.requireThat(key, "key").isNotNull();
		try (CloseableLock ignored = lock.writeLock())
		{
			if (closed)
				throw new IllegalStateException("The cache is closed");
			Entry<H> entry = entries.get(key);
			if (entry == null)
			{
				H handler = factory.apply(key);
				REQUIREMENTS.requireThat(handler, "handler").isNotNull();
				entry = new Entry<>(handler);
				entries.put(key, entry);
				log.debug("Created handler for \"{}\"", key);
			}
			else if (entry.reaper != null)
				entry.reaper.cancel(false);
			if (!expiry.isZero())
			{
				++entry.generation;
				Entry<H> scheduledEntry = entry;
				long generation = entry.generation;
				entry.reaper = scheduler.schedule(() -> reap(key, scheduledEntry, generation), toNanos(expiry),
					TimeUnit.NANOSECONDS);
			}
			return entry.handler;
		}
	}

	/**
	 * Evicts a key unless it was requested after the eviction was scheduled.
	 *
	 * @param key        the key
	 * @param entry      the entry that was scheduled for eviction
	 * @param generation the value of {@code entry.generation} when the eviction was scheduled
	 */
	private void reap(String key, Entry<H> entry, long generation)
	{
		try (CloseableLock ignored = lock.writeLock())
		{
			if (entries.get(key) != entry || entry.generation != generation)
				return;
			entries.remove(key);
		}
		log.debug("Evicted \"{}\"", key);
	}

	/**
	 * @param duration a non-negative duration
	 * @return the number of nanoseconds in {@code duration}, saturating at {@code Long.MAX_VALUE}
	 */
	private static long toNanos(Duration duration)
	{
		try
		{
			return duration.toNanos();
		}
		catch (ArithmeticException e)
		{
			return Long.MAX_VALUE;
		}
	}

	/**
	 * Returns the number of cached keys.
	 *
	 * @return the number of cached keys
	 */
	public int size()
	{
		return lock.read(entries::size);
	}

	/**
	 * Indicates if a key is cached.
	 *
	 * @param key a key
	 * @return true if the key is cached
	 * @throws NullPointerException if {@code key} is null
	 */
	public boolean contains(String key)
	{
		REQUIREMENTS.requireThat(key, "key").isNotNull();
		return lock.read(() -> entries.containsKey(key));
	}

	/**
	 * Returns the amount of time after which an unused key is evicted.
	 *
	 * @return {@code Duration.ZERO} if keys never expire
	 */
	public Duration getExpiry()
	{
		return expiry;
	}

	/**
	 * Evicts all keys and cancels pending evictions. If the cache created its scheduler, the scheduler is
	 * shut down.
	 */
	@Override
	public void close()
	{
		try (CloseableLock ignored = lock.writeLock())
		{
			if (closed)
				return;
			closed = true;
			for (Entry<H> entry : entries.values())
				if (entry.reaper != null)
					entry.reaper.cancel(false);
			entries.clear();
		}
		if (ownsScheduler)
			scheduler.shutdownNow();
		log.debug("Closed");
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.readLock())
		{
			return new ToStringBuilder(HandlerCache.class).
				add("keys", entries.keySet()).
				add("expiry", expiry).
				add("closed", closed).
				toString();
		}
	}

	/**
	 * A cached handler.
	 *
	 * @param <H> the type of the handler
	 */
	private static final class Entry<H>
	{
		final H handler;
		/**
		 * Incremented every time the eviction is rescheduled.
		 */
		long generation;
		/**
		 * {@code null} if the key never expires.
		 */
		ScheduledFuture<?> reaper;

		/**
		 * @param handler the handler
		 */
		Entry(H handler)
		{
			this.handler = handler;
		}
	}

	/**
	 * Builds a handler cache.
	 *
	 * @param <H> the type of handlers
	 */
	public static final class Builder<H>
	{
		private Function<String, H> factory;
		private Duration expiry = Duration.ZERO;
		private ScheduledExecutorService scheduler;

		/**
		 * Use {@link HandlerCache#builder()}.
		 */
		Builder()
		{
		}

		/**
		 * Sets the function that creates the handler of a key.
		 *
		 * @param factory creates the handler of a key
		 * @return this
		 * @throws NullPointerException if {@code factory} is null
		 */
		@CheckReturnValue
		public Builder<H> factory(Function<String, H> factory)
		{
			REQUIREMENTS.requireThat(factory, "factory").isNotNull();
			this.factory = factory;
			return this;
		}

		/**
		 * Sets the amount of time after which an unused key is evicted. {@code Duration.ZERO} disables
		 * eviction, in which case callers must ensure that the number of keys remains small.
		 *
		 * @param expiry the expiration delay
		 * @return this
		 * @throws NullPointerException     if {@code expiry} is null
		 * @throws IllegalArgumentException if {@code expiry} is negative
		 */
		@CheckReturnValue
		public Builder<H> expiry(Duration expiry)
		{
			REQUIREMENTS.requireThat(expiry, "expiry").isGreaterThanOrEqualTo(Duration.ZERO);
			this.expiry = expiry;
			return this;
		}

		/**
		 * Sets the executor that evicts expired keys. The caller retains ownership of the executor. By
		 * default, the cache creates a single daemon thread and shuts it down when it is closed.
		 *
		 * @param scheduler the executor that evicts expired keys
		 * @return this
		 * @throws NullPointerException if {@code scheduler} is null
		 */
		@CheckReturnValue
		public Builder<H> scheduler(ScheduledExecutorService scheduler)
		{
			REQUIREMENTS.requireThat(scheduler, "scheduler").isNotNull();
			this.scheduler = scheduler;
			return this;
		}

		/**
		 * Builds a new cache.
		 *
		 * @return a new cache
		 * @throws IllegalStateException if the factory was not set
		 */
		@CheckReturnValue
		public HandlerCache<H> build()
		{
			if (factory == null)
				throw new IllegalStateException("factory must be set");
			if (scheduler != null)
				return new HandlerCache<>(factory, expiry, scheduler, false);
			ThreadFactory threadFactory = new ThreadFactoryBuilder().
				setNameFormat("HandlerCache-reaper-%d").
				setDaemon(true).
				build();
			ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory);
			executor.setRemoveOnCancelPolicy(true);
			return new HandlerCache<>(factory, expiry, executor, true);
		}
	}
}
