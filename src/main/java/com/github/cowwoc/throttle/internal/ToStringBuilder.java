package com.github.cowwoc.throttle.internal;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.StringJoiner;

import static com.github.cowwoc.throttle.internal.Requirements.REQUIREMENTS;

/**
 * Standardizes the format of toString() return values.
 */
public final class ToStringBuilder
{
	private final String name;
	private final List<Entry<String, String>> properties = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param type the type of object being processed
	 * @throws NullPointerException if {@code type} is null
	 */
	public ToStringBuilder(Class<?> type)
	{
		REQUIREMENTS.requireThat(type, "type").isNotNull();
		StringJoiner joiner = new StringJoiner(".");
		List<String> names = new ArrayList<>();
		for (Class<?> current = type; current != null; current = current.getEnclosingClass())
			names.add(0, current.getSimpleName());
		names.forEach(joiner::add);
		this.name = joiner.toString();
	}

	/**
	 * Adds a property.
	 *
	 * @param name  the name of the property
	 * @param value the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Object value)
	{
		REQUIREMENTS.requireThat(name, "name").isNotBlank();
		properties.add(new SimpleImmutableEntry<>(name, String.valueOf(value)));
		return this;
	}

	@Override
	public String toString()
	{
		int maxKeyLength = 0;
		for (Entry<String, String> entry : properties)
			maxKeyLength = Math.max(maxKeyLength, entry.getKey().length());

		StringJoiner output = new StringJoiner(",\n\t", name + "\n{\n\t", "\n}");
		for (Entry<String, String> entry : properties)
		{
			String key = entry.getKey();
			String padding = " ".repeat(maxKeyLength - key.length());
			output.add(key + padding + ": " + entry.getValue().replace("\n", "\n\t"));
		}
		return output.toString();
	}
}
