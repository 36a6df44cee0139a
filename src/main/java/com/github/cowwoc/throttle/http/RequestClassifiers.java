package com.github.cowwoc.throttle.http;

import com.google.common.base.Splitter;
import com.google.common.net.HttpHeaders;
import com.sun.net.httpserver.HttpExchange;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Functions that map HTTP requests to keys, for use with {@link KeyedHandler}.
 */
public final class RequestClassifiers
{
	private static final Splitter COMMA = Splitter.on(',').trimResults();

	/**
	 * Prevent construction.
	 */
	private RequestClassifiers()
	{
	}

	/**
	 * Returns a best-effort guess of the address of the client that originated a request. The order of
	 * precedence is:
	 * <ol>
	 *   <li>The first entry of the {@code X-Forwarded-For} header.</li>
	 *   <li>The IP address of the remote end of the connection.</li>
	 *   <li>The host string of the remote end of the connection, if its address is unresolved.</li>
	 * </ol>
	 *
	 * @param exchange an HTTP exchange
	 * @return the address of the client ({@code ""} if unknown)
	 * @throws NullPointerException if {@code exchange} is null
	 */
	public static String byClientAddress(HttpExchange exchange)
	{
		String forwardedFor = exchange.getRequestHeaders().getFirst(HttpHeaders.X_FORWARDED_FOR);
		if (forwardedFor != null && !forwardedFor.isEmpty())
			return COMMA.split(forwardedFor).iterator().next();

		InetSocketAddress remoteAddress = exchange.getRemoteAddress();
		if (remoteAddress == null)
			return "";
		InetAddress address = remoteAddress.getAddress();
		if (address != null)
			return address.getHostAddress();
		return remoteAddress.getHostString();
	}

	/**
	 * Returns the path of a request.
	 *
	 * @param exchange an HTTP exchange
	 * @return the decoded path of the request URI ({@code ""} if the URI has no path)
	 * @throws NullPointerException if {@code exchange} is null
	 */
	public static String byPath(HttpExchange exchange)
	{
		String path = exchange.getRequestURI().getPath();
		if (path == null)
			return "";
		return path;
	}
}
