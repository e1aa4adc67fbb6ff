/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.resultant;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.time.ZoneId;

import static java.util.Objects.requireNonNull;

/**
 * Contract for coercing a raw column value to a logical {@link ColumnType}.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withTimeZone(ZoneId)} (builder)</li>
 * </ul>
 * <p>
 * How to acquire an instance:
 * <pre>{@code  // With out-of-the-box defaults
 * ValueConverter defaultConverter = ValueConverter.withDefaultConfiguration();
 *
 * // Customized
 * ValueConverter custom = ValueConverter.withTimeZone(ZoneId.of("UTC")).build();}</pre> Or, implement your own: <pre>{@code  ValueConverter myImpl = (value, columnType) -> {
 *   if (value == null || columnType == null)
 *     return value;
 *   // Coerce value to columnType here
 *   return value;
 * };}</pre>
 * Implementations must return {@code null} and {@link Boolean#FALSE} unchanged for every type, and must return the
 * value unchanged when no type is given.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValueConverter {
	/**
	 * Converts {@code value} to the representation for {@code columnType}.
	 *
	 * @param value      the raw value, may be {@code null}
	 * @param columnType the logical type to convert to, or {@code null} if the type is unknown
	 * @return the converted value
	 */
	@Nullable
	Object convert(@Nullable Object value,
								 @Nullable ColumnType columnType);

	/**
	 * Acquires a builder for a concrete implementation of this interface, specifying the time zone used to interpret
	 * {@link ColumnType#DATE} and {@link ColumnType#DATETIME} values which carry no zone or offset.
	 *
	 * @param timeZone the time zone for zoneless date/time values
	 * @return a {@code Builder} for a concrete implementation
	 */
	@NonNull
	static Builder withTimeZone(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		return new Builder().timeZone(timeZone);
	}

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ValueConverter withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Builder used to construct a standard implementation of {@link ValueConverter}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@NonNull
		ZoneId timeZone;

		private Builder() {
			this.timeZone = ZoneId.systemDefault();
		}

		/**
		 * Specifies the time zone used to interpret zoneless date/time values.
		 *
		 * @param timeZone the time zone for zoneless date/time values
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder timeZone(@NonNull ZoneId timeZone) {
			requireNonNull(timeZone);
			this.timeZone = timeZone;
			return this;
		}

		/**
		 * Constructs a default {@code ValueConverter} instance.
		 * <p>
		 * The constructed instance is thread-safe.
		 *
		 * @return a {@code ValueConverter} instance
		 */
		@NonNull
		public ValueConverter build() {
			return new DefaultValueConverter(this);
		}
	}
}
