package com.github.cowwoc.throttle.internal;

/**
 * A held lock that is released by {@link #close()}, for use with try-with-resources.
 */
public interface CloseableLock extends AutoCloseable
{
	/**
	 * Releases the lock. Unlike {@link AutoCloseable#close()}, this method does not throw checked exceptions.
	 */
	@Override
	void close();
}
