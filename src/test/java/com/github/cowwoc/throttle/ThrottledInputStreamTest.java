package com.github.cowwoc.throttle;

import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

public final class ThrottledInputStreamTest
{
	@Test
	public void read() throws IOException
	{
		byte[] data = new byte[512];
		ThreadLocalRandom.current().nextBytes(data);
		byte[] out = new byte[512];
		try (InputStream in = new ThrottledInputStream(new ByteArrayInputStream(data),
			Rate.of(Duration.ofMillis(100), 128)))
		{
			// 128 bytes up front, then three drains
			Instant start = Instant.now();
			int count = in.read(out);
			REQUIREMENTS.requireThat(Duration.between(start, Instant.now()), "elapsed").
				isGreaterThanOrEqualTo(Duration.ofMillis(300));
			REQUIREMENTS.requireThat(count, "count").isEqualTo(512);
			REQUIREMENTS.requireThat(Arrays.equals(out, data), "outMatches").isTrue();
		}
	}

	@Test
	public void endOfStream() throws IOException
	{
		try (InputStream in = new ThrottledInputStream(new ByteArrayInputStream(new byte[0]),
			Rate.perSecond(10)))
		{
			REQUIREMENTS.requireThat(in.read(new byte[4]), "in.read()").isEqualTo(-1);
			REQUIREMENTS.requireThat(in.read(), "in.read()").isEqualTo(-1);
		}
	}

	@Test
	public void shortSource() throws IOException
	{
		byte[] data = {1, 2, 3};
		try (InputStream in = new ThrottledInputStream(new ByteArrayInputStream(data), Rate.perSecond(100)))
		{
			byte[] out = new byte[10];
			REQUIREMENTS.requireThat(in.read(out), "in.read()").isEqualTo(3);
			REQUIREMENTS.requireThat(in.read(out), "in.read()").isEqualTo(-1);
		}
	}

	@Test
	public void emptyRead() throws IOException
	{
		try (InputStream in = new ThrottledInputStream(new ByteArrayInputStream(new byte[1]),
			Rate.perSecond(1)))
		{
			REQUIREMENTS.requireThat(in.read(new byte[1], 0, 0), "in.read()").isZero();
		}
	}

	@Test
	public void setRate() throws IOException
	{
		try (ThrottledInputStream in = new ThrottledInputStream(new ByteArrayInputStream(new byte[0]),
			Rate.UNLIMITED))
		{
			Rate rate = Rate.of(Duration.ofSeconds(1), 1);
			in.setRate(rate);
			REQUIREMENTS.requireThat(in.getRate(), "in.getRate()").isEqualTo(rate);
		}
	}

	@Test
	public void interrupt() throws IOException
	{
		try (InputStream in = new ThrottledInputStream(new ByteArrayInputStream(new byte[10]),
			Rate.perMinute(1)))
		{
			REQUIREMENTS.requireThat(in.read(), "in.read()").isZero();
			Thread.currentThread().interrupt();
			try
			{
				in.read();
				throw new AssertionError("Expected InterruptedIOException");
			}
			catch (InterruptedIOException e)
			{
				REQUIREMENTS.requireThat(e.getCause(), "e.getCause()").isInstanceOf(InterruptedException.class);
			}
			REQUIREMENTS.requireThat(Thread.interrupted(), "Thread.interrupted()").isTrue();
		}
	}
}
