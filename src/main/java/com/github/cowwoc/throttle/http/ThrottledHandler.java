package com.github.cowwoc.throttle.http;

import com.github.cowwoc.throttle.Group;
import com.github.cowwoc.throttle.Rate;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;
import java.time.Duration;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * An HTTP handler whose response bodies are throttled.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe if the delegate is thread-safe.
 */
public final class ThrottledHandler implements HttpHandler
{
	/**
	 * The amount of time after which an idle client address is forgotten by
	 * {@link #perClientAddress(HttpHandler, Rate)}.
	 */
	public static final Duration CLIENT_EXPIRY = Duration.ofHours(1);
	private final HttpHandler delegate;
	private final ThrottleFilter filter;

	/**
	 * Returns a handler that gives every exchange its own quota.
	 *
	 * @param delegate the handler that generates responses
	 * @param rate     the maximum rate of each response body
	 * @return a new handler
	 * @throws NullPointerException if any of the arguments are null
	 */
	public static ThrottledHandler perExchange(HttpHandler delegate, Rate rate)
	{
		return new ThrottledHandler(delegate, ThrottleFilter.perExchange(rate));
	}

	/**
	 * Returns a handler whose exchanges all draw from the quota of a group.
	 *
	 * @param delegate the handler that generates responses
	 * @param group    the group shared by all response bodies
	 * @return a new handler
	 * @throws NullPointerException if any of the arguments are null
	 */
	public static ThrottledHandler shared(HttpHandler delegate, Group group)
	{
		return new ThrottledHandler(delegate, ThrottleFilter.shared(group));
	}

	/**
	 * Returns a handler that gives every client address its own quota. The exchanges of a client share one
	 * {@link Group}. Addresses are identified by {@link RequestClassifiers#byClientAddress(HttpExchange)}
	 * and forgotten after {@link #CLIENT_EXPIRY} of inactivity.
	 *
	 * @param delegate the handler that generates responses
	 * @param rate     the maximum rate of each client
	 * @return a new handler
	 * @throws NullPointerException if any of the arguments are null
	 */
	public static KeyedHandler perClientAddress(HttpHandler delegate, Rate rate)
	{
		REQUIREMENTS.requireThat(delegate, "delegate").isNotNull();
		REQUIREMENTS.requireThat(rate, "rate").isNotNull();
		return KeyedHandler.builder().
			classifier(RequestClassifiers::byClientAddress).
			factory(key -> shared(delegate, new Group(rate))).
			expiry(CLIENT_EXPIRY).
			build();
	}

	/**
	 * @param delegate the handler that generates responses
	 * @param filter   throttles the response body
	 * @throws NullPointerException if any of the arguments are null
	 */
	private ThrottledHandler(HttpHandler delegate, ThrottleFilter filter)
	{
		REQUIREMENTS.requireThat(delegate, "delegate").isNotNull();
		this.delegate = delegate;
		this.filter = filter;
	}

	@Override
	public void handle(HttpExchange exchange) throws IOException
	{
		filter.throttle(exchange);
		delegate.handle(exchange);
	}
}
