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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link RowSource} over rows already held in memory.
 * <p>
 * Supports seeking. Unless column metadata is supplied explicitly, columns are described from the first row, with
 * a {@link ColumnType} inferred from each value's Java type.
 * <p>
 * Column order follows each row map's iteration order, so rows should be ordered maps such as {@link LinkedHashMap}:
 * <pre>{@code
 * Map<String, Object> alice = new LinkedHashMap<>();
 * alice.put("id", 1);
 * alice.put("name", "Alice");
 *
 * RowSource rowSource = InMemoryRowSource.withRows(List.of(alice)).build();}</pre>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class InMemoryRowSource implements RowSource {
	@NonNull
	private final List<Map<String, Object>> rows;
	@Nullable
	private final List<ColumnMetadata> columns;
	private int position;
	private boolean released;

	protected InMemoryRowSource(@NonNull Builder builder) {
		requireNonNull(builder);

		List<Map<String, Object>> rows = new ArrayList<>(builder.rows.size());

		for (Map<String, Object> row : builder.rows)
			rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(row))));

		this.rows = Collections.unmodifiableList(rows);
		this.columns = builder.columns == null ? null : List.copyOf(builder.columns);
	}

	/**
	 * Provides an {@link InMemoryRowSource} builder for the given rows.
	 * <p>
	 * Rows are copied.
	 *
	 * @param rows the rows to serve, in order
	 * @return an {@link InMemoryRowSource} builder
	 */
	@NonNull
	public static Builder withRows(@NonNull List<? extends Map<String, ?>> rows) {
		requireNonNull(rows);
		return new Builder(rows);
	}

	@NonNull
	@Override
	public Boolean seek(@NonNull Integer position) {
		requireNonNull(position);

		if (position < 0 || position >= getRows().size())
			return false;

		this.position = position;
		return true;
	}

	@NonNull
	@Override
	public Integer rowCount() {
		return getRows().size();
	}

	@NonNull
	@Override
	public Optional<Map<String, Object>> fetchNext() {
		if (this.released)
			throw new IllegalStateException("Row source has been released");

		if (this.position >= getRows().size())
			return Optional.empty();

		return Optional.of(new LinkedHashMap<>(getRows().get(this.position++)));
	}

	@Override
	public void release() {
		this.released = true;
	}

	@NonNull
	@Override
	public List<ColumnMetadata> discoverColumns() {
		if (this.columns != null)
			return this.columns;

		if (getRows().isEmpty())
			return List.of();

		List<ColumnMetadata> columns = new ArrayList<>();

		for (Entry<String, Object> entry : getRows().get(0).entrySet()) {
			Object value = entry.getValue();

			columns.add(ColumnMetadata.withName(entry.getKey())
					.nativeType(value == null ? null : value.getClass().getSimpleName())
					.columnType(value == null ? null : columnTypeForValue(value).orElse(null))
					.build());
		}

		return Collections.unmodifiableList(columns);
	}

	/**
	 * Infers a logical type from a value's Java type.
	 *
	 * @param value the value to inspect
	 * @return the logical type, or empty if there is no natural counterpart
	 */
	@NonNull
	protected Optional<ColumnType> columnTypeForValue(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof CharSequence)
			return Optional.of(ColumnType.TEXT);
		if (value instanceof byte[])
			return Optional.of(ColumnType.BINARY);
		if (value instanceof Boolean)
			return Optional.of(ColumnType.BOOL);
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte || value instanceof BigInteger)
			return Optional.of(ColumnType.INTEGER);
		if (value instanceof Double || value instanceof Float || value instanceof BigDecimal)
			return Optional.of(ColumnType.FLOAT);
		if (value instanceof LocalDate || value instanceof java.sql.Date)
			return Optional.of(ColumnType.DATE);
		if (value instanceof LocalDateTime || value instanceof java.util.Date || value instanceof Instant
				|| value instanceof OffsetDateTime || value instanceof ZonedDateTime)
			return Optional.of(ColumnType.DATETIME);

		return Optional.empty();
	}

	@NonNull
	public Boolean isReleased() {
		return this.released;
	}

	@NonNull
	protected List<Map<String, Object>> getRows() {
		return this.rows;
	}

	@Override
	public String toString() {
		return format("%s{rows=%d, position=%d}", getClass().getSimpleName(), getRows().size(), this.position);
	}

	/**
	 * Builder used to construct instances of {@link InMemoryRowSource}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final List<Map<String, Object>> rows;
		@Nullable
		private List<ColumnMetadata> columns;

		@SuppressWarnings("unchecked")
		private Builder(@NonNull List<? extends Map<String, ?>> rows) {
			requireNonNull(rows);
			this.rows = (List<Map<String, Object>>) rows;
		}

		/**
		 * Describes the columns explicitly instead of inferring them from the first row.
		 *
		 * @param columns column metadata, in column order
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder columns(@Nullable List<ColumnMetadata> columns) {
			this.columns = columns;
			return this;
		}

		@NonNull
		public InMemoryRowSource build() {
			return new InMemoryRowSource(this);
		}
	}
}
