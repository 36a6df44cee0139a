package com.github.cowwoc.throttle.http;

import com.github.cowwoc.throttle.Group;
import com.github.cowwoc.throttle.Rate;
import com.github.cowwoc.throttle.ThrottledOutputStream;
import com.github.cowwoc.throttle.internal.ToStringBuilder;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.util.function.Function;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * Throttles the response bodies of the exchanges that pass through it.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class ThrottleFilter extends Filter
{
	private final Function<OutputStream, ThrottledOutputStream> wrapper;
	private final String description;

	/**
	 * Returns a filter that gives every exchange its own quota.
	 *
	 * @param rate the maximum rate of each response body
	 * @return a new filter
	 * @throws NullPointerException if {@code rate} is null
	 */
	public static ThrottleFilter perExchange(Rate rate)
	{
		REQUIREMENTS.requireThat(rate, "rate").isNotNull();
		return new ThrottleFilter(out -> new ThrottledOutputStream(out, rate),
			"Throttles each response body to " + rate);
	}

	/**
	 * Returns a filter that draws every exchange from the quota of a group.
	 *
	 * @param group the group shared by all response bodies
	 * @return a new filter
	 * @throws NullPointerException if {@code group} is null
	 */
	public static ThrottleFilter shared(Group group)
	{
		REQUIREMENTS.requireThat(group, "group").isNotNull();
		return new ThrottleFilter(group::newOutputStream, "Throttles response bodies using a shared group");
	}

	/**
	 * @param wrapper     wraps the response body
	 * @param description a description of the filter
	 */
	private ThrottleFilter(Function<OutputStream, ThrottledOutputStream> wrapper, String description)
	{
		this.wrapper = wrapper;
		this.description = description;
	}

	/**
	 * Replaces the response body of an exchange with a throttled stream.
	 *
	 * @param exchange an HTTP exchange
	 * @throws NullPointerException if {@code exchange} is null
	 */
	void throttle(HttpExchange exchange)
	{
		exchange.setStreams(null, wrapper.apply(exchange.getResponseBody()));
	}

	@Override
	public void doFilter(HttpExchange exchange, Chain chain) throws IOException
	{
		throttle(exchange);
		chain.doFilter(exchange);
	}

	@Override
	public String description()
	{
		return description;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(ThrottleFilter.class).
			add("description", description).
			toString();
	}
}
