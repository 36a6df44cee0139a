/**
 * Throttles HTTP response bodies served by {@link com.sun.net.httpserver.HttpServer}.
 */
package com.github.cowwoc.throttle.http;
