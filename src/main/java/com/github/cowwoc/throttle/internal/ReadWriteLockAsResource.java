package com.github.cowwoc.throttle.internal;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Exposes a {@code ReentrantReadWriteLock} as try-with-resources friendly locks.
 */
public final class ReadWriteLockAsResource
{
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	/**
	 * Creates a new lock.
	 */
	public ReadWriteLockAsResource()
	{
	}

	/**
	 * Acquires the shared lock.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock readLock()
	{
		ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
		readLock.lock();
		return readLock::unlock;
	}

	/**
	 * Copies state while holding the shared lock. The returned value must not reference mutable state
	 * because the lock is released before the method returns.
	 *
	 * @param <V>    the type of the snapshot
	 * @param reader reads the state
	 * @return the value returned by {@code reader}
	 * @throws NullPointerException if {@code reader} is null
	 */
	public <V> V read(Supplier<V> reader)
	{
		try (CloseableLock ignored = readLock())
		{
			return reader.get();
		}
	}

	/**
	 * Acquires the exclusive lock.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock writeLock()
	{
		ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
		writeLock.lock();
		return writeLock::unlock;
	}

	/**
	 * Returns a new condition bound to the exclusive lock. Threads must hold {@link #writeLock()} while
	 * awaiting or signalling it.
	 *
	 * @return a new condition
	 */
	public Condition newCondition()
	{
		return lock.writeLock().newCondition();
	}

	/**
	 * Indicates if the current thread holds the exclusive lock.
	 *
	 * @return true if the current thread holds the exclusive lock
	 */
	public boolean isWriteLockedByCurrentThread()
	{
		return lock.isWriteLockedByCurrentThread();
	}
}
