package com.github.cowwoc.throttle;

import com.github.cowwoc.requirements.annotation.CheckReturnValue;
import com.github.cowwoc.throttle.internal.ToStringBuilder;

import java.io.InputStream;
import java.io.OutputStream;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * Throttles any number of streams against a single shared quota.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Group
{
	private final Bucket bucket;

	/**
	 * Creates a new group.
	 *
	 * @param rate the combined rate of all streams in the group
	 * @throws NullPointerException if {@code rate} is null
	 */
	public Group(Rate rate)
	{
		this.bucket = Bucket.builder().rate(rate).build();
	}

	/**
	 * Returns a stream that reads from {@code in}, drawing from the group's quota.
	 *
	 * @param in the stream to read from
	 * @return a throttled stream
	 * @throws NullPointerException if {@code in} is null
	 */
	@CheckReturnValue
	public ThrottledInputStream newInputStream(InputStream in)
	{
		return new ThrottledInputStream(in, bucket);
	}

	/**
	 * Returns a stream that writes to {@code out}, drawing from the group's quota.
	 *
	 * @param out the stream to write to
	 * @return a throttled stream
	 * @throws NullPointerException if {@code out} is null
	 */
	@CheckReturnValue
	public ThrottledOutputStream newOutputStream(OutputStream out)
	{
		return new ThrottledOutputStream(out, bucket);
	}

	/**
	 * Returns the combined rate of all streams in the group.
	 *
	 * @return the rate
	 */
	public Rate getRate()
	{
		return bucket.getRate();
	}

	/**
	 * Changes the combined rate of all streams in the group, including existing ones.
	 *
	 * @param rate the new rate
	 * @throws NullPointerException if {@code rate} is null
	 */
	public void setRate(Rate rate)
	{
		REQUIREMENTS.requireThat(rate, "rate").isNotNull();
		bucket.setRate(rate);
	}

	/**
	 * Returns the bucket shared by the group's streams.
	 *
	 * @return the bucket
	 */
	public Bucket getBucket()
	{
		return bucket;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Group.class).
			add("bucket", bucket).
			toString();
	}
}
