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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single column value read by {@link Result#fetchScalar()}.
 * <p>
 * Distinguishes a row whose column is {@code NULL} (an instance with an empty {@link #getValue()}) from the end of
 * the result (no instance at all).
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnValue {
	@NonNull
	private final String columnName;
	@Nullable
	private final Object value;

	private ColumnValue(@NonNull String columnName,
											@Nullable Object value) {
		this.columnName = requireNonNull(columnName);
		this.value = value;
	}

	@NonNull
	public static ColumnValue of(@NonNull String columnName,
															 @Nullable Object value) {
		return new ColumnValue(columnName, value);
	}

	@Override
	public String toString() {
		return format("%s{columnName=%s, value=%s}", getClass().getSimpleName(), getColumnName(), this.value);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnValue))
			return false;

		ColumnValue columnValue = (ColumnValue) object;

		return Objects.equals(getColumnName(), columnValue.getColumnName())
				&& Objects.equals(getValue(), columnValue.getValue());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumnName(), getValue());
	}

	@NonNull
	public String getColumnName() {
		return this.columnName;
	}

	/**
	 * @return the (converted) value, or empty if the column is {@code NULL}
	 */
	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}
}
