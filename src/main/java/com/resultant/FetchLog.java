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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Diagnostics for one bulk fetch operation on a {@link Result}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class FetchLog {
	@NonNull
	private final Operation operation;
	@Nullable
	private final String arguments;
	@NonNull
	private final Integer rowsFetched;
	@NonNull
	private final Duration duration;
	@Nullable
	private final Exception exception;

	/**
	 * Creates a {@code FetchLog} for the given {@code builder}.
	 *
	 * @param builder the builder used to construct this {@code FetchLog}
	 */
	private FetchLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.operation = requireNonNull(builder.operation);
		this.arguments = builder.arguments;
		this.rowsFetched = builder.rowsFetched == null ? 0 : builder.rowsFetched;
		this.duration = builder.duration == null ? Duration.ZERO : builder.duration;
		this.exception = builder.exception;
	}

	/**
	 * Creates a {@link FetchLog} builder for the given {@code operation}.
	 *
	 * @param operation the bulk operation that was performed
	 * @return a {@link FetchLog} builder
	 */
	@NonNull
	public static Builder withOperation(@NonNull Operation operation) {
		requireNonNull(operation);
		return new Builder(operation);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		components.add(format("operation=%s", getOperation()));

		String arguments = getArguments().orElse(null);

		if (arguments != null)
			components.add(format("arguments=%s", arguments));

		components.add(format("rowsFetched=%s", getRowsFetched()));
		components.add(format("duration=%s", getDuration()));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof FetchLog))
			return false;

		FetchLog fetchLog = (FetchLog) object;

		return Objects.equals(getOperation(), fetchLog.getOperation())
				&& Objects.equals(getArguments(), fetchLog.getArguments())
				&& Objects.equals(getRowsFetched(), fetchLog.getRowsFetched())
				&& Objects.equals(getDuration(), fetchLog.getDuration())
				&& Objects.equals(getException(), fetchLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getOperation(), getArguments(), getRowsFetched(), getDuration(), getException());
	}

	@NonNull
	public Operation getOperation() {
		return this.operation;
	}

	/**
	 * The descriptor or column names the operation was invoked with.
	 *
	 * @return the operation's arguments, if any
	 */
	@NonNull
	public Optional<String> getArguments() {
		return Optional.ofNullable(this.arguments);
	}

	/**
	 * How many rows were pulled from the {@link RowSource} by this operation?
	 *
	 * @return the number of rows fetched
	 */
	@NonNull
	public Integer getRowsFetched() {
		return this.rowsFetched;
	}

	/**
	 * How long did it take to rewind, fetch and materialize the result?
	 *
	 * @return how long the operation took
	 */
	@NonNull
	public Duration getDuration() {
		return this.duration;
	}

	/**
	 * The exception that caused the operation to fail.
	 *
	 * @return the exception, if the operation failed
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Bulk operations reported to a {@link FetchLogger}.
	 */
	public enum Operation {
		/**
		 * {@link Result#fetchAllRows()}
		 */
		ALL_ROWS,
		/**
		 * {@link Result#fetchPairs(String, String)}
		 */
		PAIRS,
		/**
		 * {@link Result#fetchValues(String)}
		 */
		VALUES,
		/**
		 * {@link Result#fetchAssocTree(String)} and {@link Result#fetchAssocList(String)}
		 */
		ASSOC_TREE
	}

	/**
	 * Builder used to construct instances of {@link FetchLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Operation operation;
		@Nullable
		private String arguments;
		@Nullable
		private Integer rowsFetched;
		@Nullable
		private Duration duration;
		@Nullable
		private Exception exception;

		private Builder(@NonNull Operation operation) {
			this.operation = requireNonNull(operation);
		}

		@NonNull
		public Builder arguments(@Nullable String arguments) {
			this.arguments = arguments;
			return this;
		}

		@NonNull
		public Builder rowsFetched(@Nullable Integer rowsFetched) {
			this.rowsFetched = rowsFetched;
			return this;
		}

		@NonNull
		public Builder duration(@Nullable Duration duration) {
			this.duration = duration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		/**
		 * Constructs a {@code FetchLog} instance.
		 *
		 * @return a {@code FetchLog} instance
		 */
		@NonNull
		public FetchLog build() {
			return new FetchLog(this);
		}
	}
}
