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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * A set of rows produced by a {@link RowSource}, with type conversion and bulk reshaping.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (Result result = Result.withRowSource(JdbcRowSource.withResultSet(resultSet).build()).build()) {
 *   result.setConversion("id", ColumnType.INTEGER);
 *
 *   // One row at a time
 *   Optional<Map<String, Object>> row = result.fetchRow();
 *
 *   // Everything at once
 *   List<Object> rows = result.fetchAllRows();
 *   Map<Object, Object> namesById = result.fetchPairs("id", "name");
 *   Map<Object, Object> employeesByDepartment = result.fetchAssocTree("department,*");
 * }}</pre>
 * <p>
 * A {@code Result} owns a single cursor into its {@link RowSource}. Every fetch operation, including iteration via
 * {@link #iterator()} and {@link #stream()}, advances that same cursor, so interleaving them affects what each sees.
 * Bulk operations first try to rewind to the start; if the row source cannot seek, they proceed over whatever rows
 * remain.
 * <p>
 * Instances are intended for use by a single thread. Call {@link #release()} (or use try-with-resources) when done.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class Result implements Iterable<Map<String, Object>>, AutoCloseable {
	@NonNull
	private final RowSource rowSource;
	@NonNull
	private final ValueConverter valueConverter;
	@NonNull
	private final FetchLogger fetchLogger;
	@NonNull
	private final Map<String, ColumnType> conversions;
	@NonNull
	private final Logger logger;

	@Nullable
	private Map<String, ColumnMetadata> columnMetadataByName;
	private int position;
	private boolean released;

	protected Result(@NonNull Builder builder) {
		requireNonNull(builder);

		this.rowSource = requireNonNull(builder.rowSource);
		this.valueConverter = builder.valueConverter == null ? ValueConverter.withDefaultConfiguration() : builder.valueConverter;
		this.fetchLogger = builder.fetchLogger == null ? (fetchLog) -> {} : builder.fetchLogger;
		this.conversions = new LinkedHashMap<>();
		this.logger = Logger.getLogger(getClass().getName());

		if (builder.conversions != null)
			setConversions(builder.conversions);
	}

	/**
	 * Provides a {@link Result} builder for the given {@link RowSource}.
	 *
	 * @param rowSource the source of rows for the {@link Result}
	 * @return a {@link Result} builder
	 */
	@NonNull
	public static Builder withRowSource(@NonNull RowSource rowSource) {
		requireNonNull(rowSource);
		return new Builder(rowSource);
	}

	/**
	 * Fetches the row at the current position, applies type conversion, and advances the cursor.
	 *
	 * @return the row, or empty if there are no more rows
	 */
	@NonNull
	public Optional<Map<String, Object>> fetchRow() {
		ensureNotReleased();

		Map<String, Object> rawRow = getRowSource().fetchNext().orElse(null);

		if (rawRow == null)
			return Optional.empty();

		++this.position;

		Map<String, Object> row = new LinkedHashMap<>(rawRow);

		if (this.conversions.size() > 0)
			row.replaceAll((column, value) -> {
				ColumnType columnType = this.conversions.get(column);
				return columnType == null ? value : getValueConverter().convert(value, columnType);
			});

		return Optional.of(row);
	}

	/**
	 * Like {@link #fetchRow()}, but only reads the first column.
	 * <p>
	 * Useful for single-value queries like {@code SELECT COUNT(*) FROM employee}.
	 *
	 * @return the first column of the next row, or empty if there are no more rows (or the row has no columns)
	 */
	@NonNull
	public Optional<ColumnValue> fetchScalar() {
		ensureNotReleased();

		Map<String, Object> rawRow = getRowSource().fetchNext().orElse(null);

		if (rawRow == null)
			return Optional.empty();

		++this.position;

		Iterator<Entry<String, Object>> entries = rawRow.entrySet().iterator();

		if (!entries.hasNext())
			return Optional.empty();

		Entry<String, Object> entry = entries.next();
		ColumnType columnType = this.conversions.get(entry.getKey());
		Object value = columnType == null ? entry.getValue() : getValueConverter().convert(entry.getValue(), columnType);

		return Optional.of(ColumnValue.of(entry.getKey(), value));
	}

	/**
	 * Fetches all rows, from the first.
	 * <p>
	 * If rows have exactly one column, the result is a flat list of that column's values. Otherwise it is a list of
	 * rows ({@code Map<String, Object>}).
	 *
	 * @return all rows, or an empty list if there are none
	 */
	@NonNull
	public List<Object> fetchAllRows() {
		return performBulkFetch(FetchLog.Operation.ALL_ROWS, null, (bulkFetch) -> {
			List<Object> rows = new ArrayList<>();
			Map<String, Object> row = bulkFetch.next();

			if (row == null)
				return rows;

			if (row.size() == 1) {
				String column = row.keySet().iterator().next();

				do {
					rows.add(row.get(column));
				} while ((row = bulkFetch.next()) != null);
			} else {
				do {
					rows.add(row);
				} while ((row = bulkFetch.next()) != null);
			}

			return rows;
		});
	}

	/**
	 * Fetches all rows as key-value pairs, using the first column as key and the second as value.
	 *
	 * @return a map of key-value pairs, or an empty map if there are no rows
	 * @throws IllegalArgumentException if rows have fewer than two columns
	 */
	@NonNull
	public Map<Object, Object> fetchPairs() {
		return fetchPairs(null, null);
	}

	/**
	 * Fetches all rows as key-value pairs.
	 * <ul>
	 *   <li>If neither column is given, the first two columns are used, as with {@link #fetchPairs()}.</li>
	 *   <li>If only {@code valueColumn} is given, keys are 0-based row indices; see also {@link #fetchValues(String)}.</li>
	 *   <li>If both are given, a later row with the same key replaces the earlier pair.</li>
	 * </ul>
	 *
	 * @param keyColumn   the column whose values become keys, or {@code null}
	 * @param valueColumn the column whose values become values, or {@code null}
	 * @return a map of key-value pairs, or an empty map if there are no rows
	 * @throws IllegalArgumentException if {@code keyColumn} is given without {@code valueColumn}, if a named column
	 *                                  does not exist, or if columns are auto-detected and rows have fewer than two
	 */
	@NonNull
	public Map<Object, Object> fetchPairs(@Nullable String keyColumn,
																				@Nullable String valueColumn) {
		if (keyColumn != null && valueColumn == null)
			throw new IllegalArgumentException(format("Either none or both columns must be specified (key column '%s' was given without a value column)", keyColumn));

		String arguments = keyColumn == null && valueColumn == null ? null : format("key=%s, value=%s", keyColumn, valueColumn);

		return performBulkFetch(FetchLog.Operation.PAIRS, arguments, (bulkFetch) -> {
			Map<Object, Object> pairs = new LinkedHashMap<>();
			Map<String, Object> row = bulkFetch.next();

			if (row == null)
				return pairs;

			String resolvedKeyColumn = keyColumn;
			String resolvedValueColumn = valueColumn;

			if (resolvedValueColumn == null) {
				if (row.size() < 2)
					throw new IllegalArgumentException(format("Result must have at least two columns to fetch pairs, but has %d", row.size()));

				Iterator<String> columns = row.keySet().iterator();
				resolvedKeyColumn = columns.next();
				resolvedValueColumn = columns.next();
			} else {
				if (!row.containsKey(resolvedValueColumn))
					throw new IllegalArgumentException(format("Unknown value column '%s'", resolvedValueColumn));

				if (resolvedKeyColumn == null) {
					int index = 0;

					do {
						pairs.put(index++, row.get(resolvedValueColumn));
					} while ((row = bulkFetch.next()) != null);

					return pairs;
				}

				if (!row.containsKey(resolvedKeyColumn))
					throw new IllegalArgumentException(format("Unknown key column '%s'", resolvedKeyColumn));
			}

			do {
				Object key = row.get(resolvedKeyColumn);
				// Last write wins and takes the last position
				pairs.remove(key);
				pairs.put(key, row.get(resolvedValueColumn));
			} while ((row = bulkFetch.next()) != null);

			return pairs;
		});
	}

	/**
	 * Fetches a single column's values from all rows, in fetch order.
	 *
	 * @param valueColumn the column to read
	 * @return the column's values, or an empty list if there are no rows
	 * @throws IllegalArgumentException if {@code valueColumn} does not exist
	 */
	@NonNull
	public List<Object> fetchValues(@NonNull String valueColumn) {
		requireNonNull(valueColumn);

		return performBulkFetch(FetchLog.Operation.VALUES, valueColumn, (bulkFetch) -> {
			List<Object> values = new ArrayList<>();
			Map<String, Object> row = bulkFetch.next();

			if (row == null)
				return values;

			if (!row.containsKey(valueColumn))
				throw new IllegalArgumentException(format("Unknown value column '%s'", valueColumn));

			do {
				values.add(row.get(valueColumn));
			} while ((row = bulkFetch.next()) != null);

			return values;
		});
	}

	/**
	 * Fetches all rows into a tree shaped by an associative descriptor.
	 * <p>
	 * For example, given rows {@code (cat=a, n=1), (cat=a, n=2), (cat=b, n=3)}, the descriptor {@code "cat,*"} produces
	 * {@code {a=[{cat=a, n=1}, {cat=a, n=2}], b=[{cat=b, n=3}]}}. See {@link AssociativeDescriptor} for the syntax.
	 * <p>
	 * A single-column descriptor such as {@code "id"} maps each key to its row; a later row with the same key
	 * replaces the earlier one.
	 *
	 * @param descriptor comma-separated associative descriptor, which must not start with
	 *                   {@value AssociativeDescriptor#WILDCARD_TOKEN}
	 * @return the tree, or an empty map if there are no rows
	 * @throws IllegalArgumentException if the descriptor names a column that does not exist, or starts with
	 *                                  {@value AssociativeDescriptor#WILDCARD_TOKEN} (use {@link #fetchAssocList(String)})
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public Map<Object, Object> fetchAssocTree(@NonNull String descriptor) {
		requireNonNull(descriptor);

		AssociativeDescriptor associativeDescriptor = AssociativeDescriptor.parse(descriptor);

		if (associativeDescriptor.startsWithWildcard())
			throw new IllegalArgumentException(format("Associative descriptor '%s' starts with '%s' and builds a list; use fetchAssocList instead",
					descriptor, AssociativeDescriptor.WILDCARD_TOKEN));

		Object root = fetchAssociativeTree(associativeDescriptor);
		return root == null ? new LinkedHashMap<>() : (Map<Object, Object>) root;
	}

	/**
	 * Like {@link #fetchAssocTree(String)}, for descriptors whose first level is indexed.
	 *
	 * @param descriptor comma-separated associative descriptor, which must start with
	 *                   {@value AssociativeDescriptor#WILDCARD_TOKEN}
	 * @return the tree, or an empty list if there are no rows
	 * @throws IllegalArgumentException if the descriptor names a column that does not exist, or does not start with
	 *                                  {@value AssociativeDescriptor#WILDCARD_TOKEN}
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public List<Object> fetchAssocList(@NonNull String descriptor) {
		requireNonNull(descriptor);

		AssociativeDescriptor associativeDescriptor = AssociativeDescriptor.parse(descriptor);

		if (!associativeDescriptor.startsWithWildcard())
			throw new IllegalArgumentException(format("Associative descriptor '%s' does not start with '%s'; use fetchAssocTree instead",
					descriptor, AssociativeDescriptor.WILDCARD_TOKEN));

		Object root = fetchAssociativeTree(associativeDescriptor);
		return root == null ? new ArrayList<>() : (List<Object>) root;
	}

	@Nullable
	protected Object fetchAssociativeTree(@NonNull AssociativeDescriptor associativeDescriptor) {
		requireNonNull(associativeDescriptor);

		return performBulkFetch(FetchLog.Operation.ASSOC_TREE, associativeDescriptor.getDescriptor(), (bulkFetch) -> {
			Map<String, Object> row = bulkFetch.next();

			if (row == null)
				return null;

			associativeDescriptor.validate(row.keySet());

			AssociativeTreeBuilder associativeTreeBuilder = new AssociativeTreeBuilder(associativeDescriptor);

			do {
				associativeTreeBuilder.add(row);
			} while ((row = bulkFetch.next()) != null);

			return associativeTreeBuilder.getRoot();
		});
	}

	/**
	 * Moves the cursor to the given 0-based position without fetching a row.
	 *
	 * @param position the 0-based position to move to
	 * @return {@code true} on success, {@code false} if the row source could not seek there
	 */
	@NonNull
	public Boolean seek(@NonNull Integer position) {
		requireNonNull(position);
		ensureNotReleased();

		Boolean seeked = getRowSource().seek(position);

		if (seeked)
			this.position = position;

		return seeked;
	}

	/**
	 * Best-effort seek: failures are logged and reported as {@code false} rather than thrown.
	 */
	@NonNull
	Boolean trySeek(@NonNull Integer position) {
		requireNonNull(position);
		ensureNotReleased();

		Boolean seeked;

		try {
			seeked = getRowSource().seek(position);
		} catch (RuntimeException e) {
			getLogger().log(Level.FINE, format("Unable to seek to row %d, continuing from row %d", position, getPosition()), e);
			return false;
		}

		if (seeked)
			this.position = position;
		else
			getLogger().fine(format("Unable to seek to row %d, continuing from row %d", position, getPosition()));

		return seeked;
	}

	/**
	 * The number of rows in this result, as reported by the {@link RowSource}.
	 *
	 * @return the number of rows
	 */
	@NonNull
	public Integer rowCount() {
		ensureNotReleased();
		return getRowSource().rowCount();
	}

	/**
	 * Assigns a logical type to a single column; fetched values of that column are converted accordingly.
	 *
	 * @param column     the column name
	 * @param columnType the type to convert to, or {@code null} to stop converting this column
	 */
	public void setConversion(@NonNull String column,
														@Nullable ColumnType columnType) {
		requireNonNull(column);

		if (columnType == null)
			this.conversions.remove(column);
		else
			this.conversions.put(column, columnType);
	}

	/**
	 * Replaces the whole conversion table.
	 *
	 * @param conversions logical types by column name
	 */
	public void setConversions(@NonNull Map<String, ColumnType> conversions) {
		requireNonNull(conversions);

		Map<String, ColumnType> replacement = new LinkedHashMap<>(conversions.size());

		for (Entry<String, ColumnType> entry : conversions.entrySet())
			if (entry.getValue() != null)
				replacement.put(requireNonNull(entry.getKey()), entry.getValue());

		this.conversions.clear();
		this.conversions.putAll(replacement);
	}

	/**
	 * Assigns logical types to every column whose {@link ColumnMetadata} carries one.
	 * <p>
	 * Triggers column discovery if it has not happened yet. Existing conversions for other columns are kept.
	 */
	public void detectConversions() {
		for (ColumnMetadata columnMetadata : getColumnMetadataByName().values())
			columnMetadata.getColumnType().ifPresent(columnType -> this.conversions.put(columnMetadata.getName(), columnType));
	}

	@NonNull
	public Optional<ColumnType> getConversion(@NonNull String column) {
		requireNonNull(column);
		return Optional.ofNullable(this.conversions.get(column));
	}

	/**
	 * @return a snapshot of the conversion table
	 */
	@NonNull
	public Map<String, ColumnType> getConversions() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(this.conversions));
	}

	/**
	 * The names of this result's columns, in column order.
	 *
	 * @return column names
	 */
	@NonNull
	public List<String> fieldNames() {
		return List.copyOf(getColumnMetadataByName().keySet());
	}

	@NonNull
	public Optional<ColumnMetadata> fieldMeta(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getColumnMetadataByName().get(name));
	}

	/**
	 * Iterates over the remaining rows, starting from the first.
	 *
	 * @return a forward-only iterator
	 * @see #iterator(Integer, Integer)
	 */
	@NonNull
	@Override
	public ResultIterator iterator() {
		return iterator(null, null);
	}

	/**
	 * Iterates over at most {@code limit} rows, starting at {@code offset}.
	 * <p>
	 * The iterator shares this result's cursor: it seeks to {@code offset} when first used and advances the cursor
	 * with every row. It cannot be restarted.
	 *
	 * @param offset the 0-based row to start at, or {@code null} for the first row
	 * @param limit  the maximum number of rows to return, or {@code null} for no limit
	 * @return a forward-only iterator
	 */
	@NonNull
	public ResultIterator iterator(@Nullable Integer offset,
																 @Nullable Integer limit) {
		return new ResultIterator(this, offset, limit);
	}

	/**
	 * Provides the rows of {@link #iterator()} as a sequential {@link Stream}.
	 *
	 * @return a stream of rows
	 */
	@NonNull
	public Stream<Map<String, Object>> stream() {
		return stream(null, null);
	}

	/**
	 * Provides the rows of {@link #iterator(Integer, Integer)} as a sequential {@link Stream}.
	 *
	 * @param offset the 0-based row to start at, or {@code null} for the first row
	 * @param limit  the maximum number of rows to return, or {@code null} for no limit
	 * @return a stream of rows
	 */
	@NonNull
	public Stream<Map<String, Object>> stream(@Nullable Integer offset,
																						@Nullable Integer limit) {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(offset, limit), Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	/**
	 * Frees the underlying {@link RowSource}.
	 * <p>
	 * Safe to call more than once; only the first call reaches the row source. Failures are logged, not thrown.
	 */
	public void release() {
		if (this.released)
			return;

		this.released = true;

		try {
			getRowSource().release();
		} catch (Exception e) {
			getLogger().log(Level.WARNING, "Unable to release row source", e);
		}
	}

	/**
	 * Equivalent to {@link #release()}, for use with try-with-resources.
	 */
	@Override
	public void close() {
		release();
	}

	@NonNull
	public Boolean isReleased() {
		return this.released;
	}

	/**
	 * The number of rows fetched since the last successful seek (or since creation).
	 *
	 * @return the 0-based cursor position
	 */
	@NonNull
	public Integer getPosition() {
		return this.position;
	}

	@NonNull
	public RowSource getRowSource() {
		return this.rowSource;
	}

	@Override
	public String toString() {
		return format("%s{rowSource=%s, position=%d, released=%s}", getClass().getSimpleName(), getRowSource(), getPosition(), isReleased());
	}

	protected <T> T performBulkFetch(FetchLog.@NonNull Operation operation,
																	 @Nullable String arguments,
																	 @NonNull BulkFetchOperation<T> bulkFetchOperation) {
		requireNonNull(operation);
		requireNonNull(bulkFetchOperation);

		ensureNotReleased();

		long startTime = nanoTime();
		BulkFetch bulkFetch = new BulkFetch(this);
		RuntimeException exception = null;

		try {
			trySeek(0);
			return bulkFetchOperation.perform(bulkFetch);
		} catch (RuntimeException e) {
			exception = e;
			throw e;
		} finally {
			FetchLog fetchLog = FetchLog.withOperation(operation)
					.arguments(arguments)
					.rowsFetched(bulkFetch.getRowsFetched())
					.duration(Duration.ofNanos(nanoTime() - startTime))
					.exception(exception)
					.build();

			try {
				getFetchLogger().log(fetchLog);
			} catch (RuntimeException loggerFailure) {
				if (exception == null)
					throw loggerFailure;

				exception.addSuppressed(loggerFailure);
			}
		}
	}

	@NonNull
	protected Map<String, ColumnMetadata> getColumnMetadataByName() {
		if (this.columnMetadataByName == null) {
			ensureNotReleased();

			Map<String, ColumnMetadata> columnMetadataByName = new LinkedHashMap<>();

			for (ColumnMetadata columnMetadata : getRowSource().discoverColumns())
				columnMetadataByName.putIfAbsent(columnMetadata.getName(), columnMetadata);

			this.columnMetadataByName = Collections.unmodifiableMap(columnMetadataByName);
		}

		return this.columnMetadataByName;
	}

	protected void ensureNotReleased() {
		if (this.released)
			throw new IllegalStateException("This result has already been released");
	}

	@NonNull
	protected ValueConverter getValueConverter() {
		return this.valueConverter;
	}

	@NonNull
	protected FetchLogger getFetchLogger() {
		return this.fetchLogger;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@FunctionalInterface
	protected interface BulkFetchOperation<T> {
		T perform(@NonNull BulkFetch bulkFetch);
	}

	/**
	 * Pulls rows for a single bulk operation and counts them.
	 */
	@NotThreadSafe
	protected static final class BulkFetch {
		@NonNull
		private final Result result;
		private int rowsFetched;

		private BulkFetch(@NonNull Result result) {
			this.result = requireNonNull(result);
		}

		@Nullable
		public Map<String, Object> next() {
			Map<String, Object> row = this.result.fetchRow().orElse(null);

			if (row != null)
				++this.rowsFetched;

			return row;
		}

		@NonNull
		public Integer getRowsFetched() {
			return this.rowsFetched;
		}
	}

	/**
	 * Builder used to construct instances of {@link Result}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final RowSource rowSource;
		@Nullable
		private ValueConverter valueConverter;
		@Nullable
		private Map<String, ColumnType> conversions;
		@Nullable
		private FetchLogger fetchLogger;

		private Builder(@NonNull RowSource rowSource) {
			this.rowSource = requireNonNull(rowSource);
		}

		@NonNull
		public Builder valueConverter(@Nullable ValueConverter valueConverter) {
			this.valueConverter = valueConverter;
			return this;
		}

		/**
		 * Specifies the initial conversion table.
		 *
		 * @param conversions logical types by column name
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder conversions(@Nullable Map<String, ColumnType> conversions) {
			this.conversions = conversions;
			return this;
		}

		@NonNull
		public Builder fetchLogger(@Nullable FetchLogger fetchLogger) {
			this.fetchLogger = fetchLogger;
			return this;
		}

		@NonNull
		public Result build() {
			return new Result(this);
		}
	}
}
