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
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link RowSource} backed by an already-executed JDBC {@link ResultSet}.
 * <p>
 * Rows are keyed by column label. Seeking and row counting need a scrollable result set
 * ({@link ResultSet#TYPE_SCROLL_INSENSITIVE} or {@link ResultSet#TYPE_SCROLL_SENSITIVE}); on a forward-only result set
 * {@link #seek(Integer)} returns {@code false} and {@link #rowCount()} throws.
 * <p>
 * Example usage:
 * <pre>{@code
 * PreparedStatement preparedStatement = connection.prepareStatement("SELECT * FROM employee",
 *   ResultSet.TYPE_SCROLL_INSENSITIVE, ResultSet.CONCUR_READ_ONLY);
 *
 * RowSource rowSource = JdbcRowSource.withResultSet(preparedStatement.executeQuery())
 *   .closeStatement(true)
 *   .build();}</pre>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class JdbcRowSource implements RowSource {
	@NonNull
	private final ResultSet resultSet;
	@NonNull
	private final Boolean closeStatement;
	@Nullable
	private ResultSetMetaData resultSetMetaData;
	@Nullable
	private Integer rowCount;
	private boolean exhausted;

	protected JdbcRowSource(@NonNull Builder builder) {
		requireNonNull(builder);

		this.resultSet = requireNonNull(builder.resultSet);
		this.closeStatement = builder.closeStatement == null ? false : builder.closeStatement;
	}

	/**
	 * Provides a {@link JdbcRowSource} builder for the given {@link ResultSet}.
	 *
	 * @param resultSet an open result set, positioned before its first row
	 * @return a {@link JdbcRowSource} builder
	 */
	@NonNull
	public static Builder withResultSet(@NonNull ResultSet resultSet) {
		requireNonNull(resultSet);
		return new Builder(resultSet);
	}

	@NonNull
	@Override
	public Boolean seek(@NonNull Integer position) {
		requireNonNull(position);

		if (position < 0 || !isScrollable())
			return false;

		if (position >= rowCount())
			return false;

		try {
			// Leave the cursor just before the target row, so the next fetch reads it
			if (position == 0)
				getResultSet().beforeFirst();
			else if (!getResultSet().absolute(position))
				return false;
		} catch (SQLException e) {
			throw new RowSourceException(format("Unable to seek to row %d", position), e);
		}

		this.exhausted = false;
		return true;
	}

	@NonNull
	@Override
	public Integer rowCount() {
		if (this.rowCount != null)
			return this.rowCount;

		if (!isScrollable())
			throw new RowSourceException("Row count is not available for a forward-only result set");

		try {
			ResultSet resultSet = getResultSet();
			boolean beforeFirst = resultSet.isBeforeFirst();
			boolean afterLast = resultSet.isAfterLast();
			int currentRow = resultSet.getRow();

			int rowCount = resultSet.last() ? resultSet.getRow() : 0;

			if (afterLast)
				resultSet.afterLast();
			else if (beforeFirst || currentRow == 0)
				resultSet.beforeFirst();
			else
				resultSet.absolute(currentRow);

			this.rowCount = rowCount;
			return rowCount;
		} catch (SQLException e) {
			throw new RowSourceException("Unable to determine row count", e);
		}
	}

	@NonNull
	@Override
	public Optional<Map<String, Object>> fetchNext() {
		if (this.exhausted)
			return Optional.empty();

		try {
			if (!getResultSet().next()) {
				this.exhausted = true;
				return Optional.empty();
			}

			ResultSetMetaData resultSetMetaData = getResultSetMetaData();
			int columnCount = resultSetMetaData.getColumnCount();
			Map<String, Object> row = new LinkedHashMap<>(columnCount);

			for (int i = 1; i <= columnCount; ++i)
				row.put(resultSetMetaData.getColumnLabel(i), readValue(i, resultSetMetaData.getColumnType(i)));

			return Optional.of(row);
		} catch (SQLException e) {
			throw new RowSourceException("Unable to fetch row", e);
		}
	}

	@Override
	public void release() throws SQLException {
		SQLException failure = null;
		Statement statement = null;

		try {
			if (getCloseStatement())
				statement = getResultSet().getStatement();
		} catch (SQLException e) {
			failure = e;
		}

		try {
			getResultSet().close();
		} catch (SQLException e) {
			failure = addSuppressed(failure, e);
		}

		if (statement != null) {
			try {
				statement.close();
			} catch (SQLException e) {
				failure = addSuppressed(failure, e);
			}
		}

		if (failure != null)
			throw failure;
	}

	@NonNull
	@Override
	public List<ColumnMetadata> discoverColumns() {
		try {
			ResultSetMetaData resultSetMetaData = getResultSetMetaData();
			int columnCount = resultSetMetaData.getColumnCount();
			List<ColumnMetadata> columns = new ArrayList<>(columnCount);

			for (int i = 1; i <= columnCount; ++i) {
				String table = resultSetMetaData.getTableName(i);
				int nullable = resultSetMetaData.isNullable(i);

				columns.add(ColumnMetadata.withName(resultSetMetaData.getColumnLabel(i))
						.nativeType(resultSetMetaData.getColumnTypeName(i))
						.columnType(columnTypeForJdbcType(resultSetMetaData.getColumnType(i), resultSetMetaData.isAutoIncrement(i)).orElse(null))
						.table(table == null || table.isEmpty() ? null : table)
						.nullable(nullable == ResultSetMetaData.columnNullableUnknown ? null : nullable == ResultSetMetaData.columnNullable)
						.build());
			}

			return Collections.unmodifiableList(columns);
		} catch (SQLException e) {
			throw new RowSourceException("Unable to read column metadata", e);
		}
	}

	/**
	 * Maps a {@link Types} constant to a logical type.
	 *
	 * @param jdbcType      the {@link Types} constant
	 * @param autoIncrement whether the column is auto-incrementing
	 * @return the logical type, or empty if there is no natural counterpart (e.g. {@link Types#TIME})
	 */
	@NonNull
	protected Optional<ColumnType> columnTypeForJdbcType(int jdbcType,
																											boolean autoIncrement) {
		switch (jdbcType) {
			case Types.CHAR:
			case Types.VARCHAR:
			case Types.LONGVARCHAR:
			case Types.NCHAR:
			case Types.NVARCHAR:
			case Types.LONGNVARCHAR:
			case Types.CLOB:
			case Types.NCLOB:
				return Optional.of(ColumnType.TEXT);
			case Types.BINARY:
			case Types.VARBINARY:
			case Types.LONGVARBINARY:
			case Types.BLOB:
				return Optional.of(ColumnType.BINARY);
			case Types.BOOLEAN:
			case Types.BIT:
				return Optional.of(ColumnType.BOOL);
			case Types.TINYINT:
			case Types.SMALLINT:
			case Types.INTEGER:
			case Types.BIGINT:
				return Optional.of(autoIncrement ? ColumnType.COUNTER : ColumnType.INTEGER);
			case Types.REAL:
			case Types.FLOAT:
			case Types.DOUBLE:
			case Types.NUMERIC:
			case Types.DECIMAL:
				return Optional.of(ColumnType.FLOAT);
			case Types.DATE:
				return Optional.of(ColumnType.DATE);
			case Types.TIMESTAMP:
			case Types.TIMESTAMP_WITH_TIMEZONE:
				return Optional.of(ColumnType.DATETIME);
			default:
				return Optional.empty();
		}
	}

	@Nullable
	protected Object readValue(int columnIndex,
														 int jdbcType) throws SQLException {
		ResultSet resultSet = getResultSet();

		switch (jdbcType) {
			case Types.DATE: {
				java.sql.Date date = resultSet.getDate(columnIndex);
				return date == null ? null : date.toLocalDate();
			}
			case Types.TIMESTAMP: {
				java.sql.Timestamp timestamp = resultSet.getTimestamp(columnIndex);
				return timestamp == null ? null : timestamp.toLocalDateTime();
			}
			case Types.CLOB:
			case Types.NCLOB: {
				Clob clob = resultSet.getClob(columnIndex);
				return clob == null ? null : clob.getSubString(1, (int) clob.length());
			}
			case Types.BLOB: {
				Blob blob = resultSet.getBlob(columnIndex);
				return blob == null ? null : blob.getBytes(1, (int) blob.length());
			}
			default:
				return resultSet.getObject(columnIndex);
		}
	}

	@NonNull
	protected Boolean isScrollable() {
		try {
			return getResultSet().getType() != ResultSet.TYPE_FORWARD_ONLY;
		} catch (SQLException e) {
			throw new RowSourceException("Unable to determine result set type", e);
		}
	}

	@NonNull
	protected ResultSetMetaData getResultSetMetaData() throws SQLException {
		if (this.resultSetMetaData == null)
			this.resultSetMetaData = getResultSet().getMetaData();

		return this.resultSetMetaData;
	}

	@NonNull
	public ResultSet getResultSet() {
		return this.resultSet;
	}

	@NonNull
	protected Boolean getCloseStatement() {
		return this.closeStatement;
	}

	@NonNull
	private static SQLException addSuppressed(@Nullable SQLException existing,
																						@NonNull SQLException additional) {
		if (existing == null)
			return additional;

		existing.addSuppressed(additional);
		return existing;
	}

	/**
	 * Builder used to construct instances of {@link JdbcRowSource}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final ResultSet resultSet;
		@Nullable
		private Boolean closeStatement;

		private Builder(@NonNull ResultSet resultSet) {
			this.resultSet = requireNonNull(resultSet);
		}

		/**
		 * Specifies whether releasing the row source also closes the {@link Statement} that produced the result set.
		 *
		 * @param closeStatement {@code true} to close the statement too; defaults to {@code false}
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder closeStatement(@Nullable Boolean closeStatement) {
			this.closeStatement = closeStatement;
			return this;
		}

		@NonNull
		public JdbcRowSource build() {
			return new JdbcRowSource(this);
		}
	}
}
