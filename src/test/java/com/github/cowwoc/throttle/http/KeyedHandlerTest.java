package com.github.cowwoc.throttle.http;

import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

public final class KeyedHandlerTest
{
	@Test
	public void dispatchByKey() throws IOException, InterruptedException
	{
		AtomicInteger created = new AtomicInteger();
		try (LocalServer server = new LocalServer();
		     KeyedHandler handler = KeyedHandler.builder().
			     classifier(RequestClassifiers::byPath).
			     factory(key -> LocalServer.respondWith(key + "#" + created.incrementAndGet())).
			     build())
		{
			server.handle("/", handler);

			REQUIREMENTS.requireThat(get(server, "/a"), "get(\"/a\")").isEqualTo("/a#1");
			REQUIREMENTS.requireThat(get(server, "/b"), "get(\"/b\")").isEqualTo("/b#2");
			REQUIREMENTS.requireThat(get(server, "/a"), "get(\"/a\")").isEqualTo("/a#1");
			REQUIREMENTS.requireThat(handler.getCache().size(), "handler.getCache().size()").isEqualTo(2);
		}
	}

	@Test
	public void expiredKeysAreRecreated() throws IOException, InterruptedException
	{
		AtomicInteger created = new AtomicInteger();
		try (LocalServer server = new LocalServer();
		     KeyedHandler handler = KeyedHandler.builder().
			     classifier(RequestClassifiers::byPath).
			     factory(key -> LocalServer.respondWith(key + "#" + created.incrementAndGet())).
			     expiry(Duration.ofMillis(100)).
			     build())
		{
			server.handle("/", handler);

			REQUIREMENTS.requireThat(get(server, "/a"), "get(\"/a\")").isEqualTo("/a#1");
			Thread.sleep(300);
			REQUIREMENTS.requireThat(handler.getCache().contains("/a"), "handler.getCache().contains(\"/a\")").
				isFalse();
			REQUIREMENTS.requireThat(get(server, "/a"), "get(\"/a\")").isEqualTo("/a#2");
		}
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void missingFactory()
	{
		KeyedHandler.builder().build();
	}

	private static String get(LocalServer server, String path) throws IOException, InterruptedException
	{
		return new String(server.send(server.request(path).build()), StandardCharsets.UTF_8);
	}
}
