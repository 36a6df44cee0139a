package com.github.cowwoc.throttle;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.Objects;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * An input stream whose throughput is limited by a {@link Bucket}, one token per byte.
 * <p>
 * A read returns once the buffer is full, the underlying stream returns fewer bytes than were requested
 * from it, or the end of the stream is reached.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe.
 */
public final class ThrottledInputStream extends FilterInputStream
{
	private final Bucket bucket;

	/**
	 * Creates a stream with its own quota.
	 *
	 * @param in   the stream to read from
	 * @param rate the maximum read rate
	 * @throws NullPointerException if any of the arguments are null
	 */
	public ThrottledInputStream(InputStream in, Rate rate)
	{
		this(in, Bucket.builder().rate(rate).build());
	}

	/**
	 * Creates a stream that draws from an existing quota.
	 *
	 * @param in     the stream to read from
	 * @param bucket the bucket to draw tokens from
	 * @throws NullPointerException if any of the arguments are null
	 */
	ThrottledInputStream(InputStream in, Bucket bucket)
	{
		super(in);
		REQUIREMENTS.requireThat(in, "in").isNotNull();
		REQUIREMENTS.requireThat(bucket, "bucket").isNotNull();
		this.bucket = bucket;
	}

	@Override
	public int read() throws IOException
	{
		acquire(1);
		return in.read();
	}

	@Override
	public int read(byte[] b, int off, int len) throws IOException
	{
		Objects.checkFromIndexSize(off, len, b.length);
		if (len == 0)
			return 0;
		int total = 0;
		while (total < len)
		{
			int granted = (int) acquire(len - total);
			int count = in.read(b, off + total, granted);
			if (count == -1)
				break;
			total += count;
			if (count < granted)
				break;
		}
		if (total == 0)
			return -1;
		return total;
	}

	@Override
	public long skip(long n) throws IOException
	{
		if (n <= 0)
			return 0;
		return in.skip(acquire(n));
	}

	/**
	 * Blocks until tokens are available.
	 *
	 * @param tokens the maximum number of tokens to consume
	 * @return the number of tokens consumed
	 * @throws InterruptedIOException if the thread is interrupted while waiting
	 */
	private long acquire(long tokens) throws InterruptedIOException
	{
		try
		{
			return bucket.acquire(tokens);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			InterruptedIOException exception = new InterruptedIOException("Interrupted while waiting for " +
				"tokens");
			exception.initCause(e);
			throw exception;
		}
	}

	/**
	 * Returns the maximum read rate.
	 *
	 * @return the maximum read rate
	 */
	public Rate getRate()
	{
		return bucket.getRate();
	}

	/**
	 * Changes the maximum read rate. If the stream belongs to a {@link Group}, the rate of the entire group
	 * changes.
	 *
	 * @param rate the maximum read rate
	 * @throws NullPointerException if {@code rate} is null
	 */
	public void setRate(Rate rate)
	{
		bucket.setRate(rate);
	}

	/**
	 * Returns the bucket that the stream draws tokens from.
	 *
	 * @return the bucket
	 */
	public Bucket getBucket()
	{
		return bucket;
	}
}
