package com.github.cowwoc.throttle;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Objects;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * An output stream whose throughput is limited by a {@link Bucket}, one token per byte.
 * <p>
 * A write blocks until all bytes are written.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe.
 */
public final class ThrottledOutputStream extends FilterOutputStream
{
	private final Bucket bucket;

	/**
	 * Creates a stream with its own quota.
	 *
	 * @param out  the stream to write to
	 * @param rate the maximum write rate
	 * @throws NullPointerException if any of the arguments are null
	 */
	public ThrottledOutputStream(OutputStream out, Rate rate)
	{
		this(out, Bucket.builder().rate(rate).build());
	}

	/**
	 * Creates a stream that draws from an existing quota.
	 *
	 * @param out    the stream to write to
	 * @param bucket the bucket to draw tokens from
	 * @throws NullPointerException if any of the arguments are null
	 */
	ThrottledOutputStream(OutputStream out, Bucket bucket)
	{
		super(out);
		REQUIREMENTS.requireThat(out, "out").isNotNull();
		REQUIREMENTS.requireThat(bucket, "bucket").isNotNull();
		this.bucket = bucket;
	}

	@Override
	public void write(int b) throws IOException
	{
		acquire(1);
		out.write(b);
	}

	@Override
	public void write(byte[] b, int off, int len) throws IOException
	{
		Objects.checkFromIndexSize(off, len, b.length);
		int written = 0;
		while (written < len)
		{
			int granted = (int) acquire(len - written);
			out.write(b, off + written, granted);
			written += granted;
		}
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
	 * Returns the maximum write rate.
	 *
	 * @return the maximum write rate
	 */
	public Rate getRate()
	{
		return bucket.getRate();
	}

	/**
	 * Changes the maximum write rate. If the stream belongs to a {@link Group}, the rate of the entire group
	 * changes.
	 *
	 * @param rate the maximum write rate
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
