package com.github.cowwoc.throttle.internal;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;

/**
 * The requirements shared by the library's precondition checks.
 */
public final class Requirements
{
	/**
	 * Verifies preconditions using the default configuration.
	 */
	public static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();

	/**
	 * Prevent construction.
	 */
	private Requirements()
	{
	}
}
