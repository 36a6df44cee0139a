package com.github.cowwoc.throttle.http;

import com.github.cowwoc.requirements.annotation.CheckReturnValue;
import com.github.cowwoc.throttle.HandlerCache;
import com.github.cowwoc.throttle.internal.ToStringBuilder;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * Dispatches each HTTP exchange to a handler selected by a key derived from the request.
 * <p>
 * Handlers are created on demand and forgotten once their key has not been seen for a period of time.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class KeyedHandler implements HttpHandler, AutoCloseable
{
	private final Function<HttpExchange, String> classifier;
	private final HandlerCache<HttpHandler> cache;
	private final Logger log = LoggerFactory.getLogger(KeyedHandler.class);

	/**
	 * Builds a new handler.
	 *
	 * @return a KeyedHandler builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * @param classifier maps an exchange to a key
	 * @param cache      the handler of each key
	 */
	private KeyedHandler(Function<HttpExchange, String> classifier, HandlerCache<HttpHandler> cache)
	{
		this.classifier = classifier;
		this.cache = cache;
	}

	@Override
	public void handle(HttpExchange exchange) throws IOException
	{
		String key = classifier.apply(exchange);
		REQUIREMENTS.requireThat(key, "key").isNotNull();
		log.debug("Dispatching {} {} to \"{}\"", exchange.getRequestMethod(), exchange.getRequestURI(), key);
		cache.get(key).handle(exchange);
	}

	/**
	 * Returns the handler of each key.
	 *
	 * @return the handler of each key
	 */
	public HandlerCache<HttpHandler> getCache()
	{
		return cache;
	}

	/**
	 * Forgets all handlers and stops evicting keys.
	 */
	@Override
	public void close()
	{
		cache.close();
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(KeyedHandler.class).
			add("cache", cache).
			toString();
	}

	/**
	 * Builds a keyed handler.
	 */
	public static final class Builder
	{
		private Function<HttpExchange, String> classifier = RequestClassifiers::byClientAddress;
		private final HandlerCache.Builder<HttpHandler> cache = HandlerCache.builder();

		/**
		 * Use {@link KeyedHandler#builder()}.
		 */
		Builder()
		{
		}

		/**
		 * Sets the function that maps an exchange to a key. By default, exchanges are classified by
		 * {@link RequestClassifiers#byClientAddress(HttpExchange) client address}.
		 *
		 * @param classifier maps an exchange to a key
		 * @return this
		 * @throws NullPointerException if {@code classifier} is null
		 */
		@CheckReturnValue
		public Builder classifier(Function<HttpExchange, String> classifier)
		{
			REQUIREMENTS.requireThat(classifier, "classifier").isNotNull();
			this.classifier = classifier;
			return this;
		}

		/**
		 * Sets the function that creates the handler of a key.
		 *
		 * @param factory creates the handler of a key
		 * @return this
		 * @throws NullPointerException if {@code factory} is null
		 */
		@CheckReturnValue
		public Builder factory(Function<String, HttpHandler> factory)
		{
			cache.factory(factory);
			return this;
		}

		/**
		 * Sets the amount of time after which an unused key is forgotten. {@code Duration.ZERO} (the default)
		 * disables expiration, in which case the classifier must produce a small number of distinct keys.
		 *
		 * @param expiry the expiration delay
		 * @return this
		 * @throws NullPointerException     if {@code expiry} is null
		 * @throws IllegalArgumentException if {@code expiry} is negative
		 */
		@CheckReturnValue
		public Builder expiry(Duration expiry)
		{
			cache.expiry(expiry);
			return this;
		}

		/**
		 * Sets the executor that evicts expired keys. The caller retains ownership of the executor.
		 *
		 * @param scheduler the executor that evicts expired keys
		 * @return this
		 * @throws NullPointerException if {@code scheduler} is null
		 */
		@CheckReturnValue
		public Builder scheduler(ScheduledExecutorService scheduler)
		{
			cache.scheduler(scheduler);
			return this;
		}

		/**
		 * Builds a new handler.
		 *
		 * @return a new handler
		 * @throws IllegalStateException if the factory was not set
		 */
		@CheckReturnValue
		public KeyedHandler build()
		{
			return new KeyedHandler(classifier, cache.build());
		}
	}
}
