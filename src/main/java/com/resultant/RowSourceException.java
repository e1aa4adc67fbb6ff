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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.stream.Collectors.joining;

/**
 * Thrown when a {@link RowSource} fails to read rows or metadata.
 * <p>
 * If the {@code cause} of this exception is a {@link SQLException}, the {@link #getErrorCode()} and {@link #getSqlState()}
 * accessors are shorthand for retrieving the corresponding {@link SQLException} values.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class RowSourceException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;

	/**
	 * Creates a {@code RowSourceException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public RowSourceException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code RowSourceException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public RowSourceException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code RowSourceException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public RowSourceException(@Nullable String message,
														@Nullable Throwable cause) {
		super(message, cause);

		Integer errorCode = null;
		String sqlState = null;

		if (cause instanceof SQLException sqlException) {
			errorCode = sqlException.getErrorCode();
			sqlState = sqlException.getSQLState();
		}

		this.errorCode = errorCode;
		this.sqlState = sqlState;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(3);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(joining(", ")));
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}
}
