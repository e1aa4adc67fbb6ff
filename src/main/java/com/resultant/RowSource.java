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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contract for a cursor-like source of rows, typically produced by executing a query.
 * <p>
 * A {@link Result} consumes exactly one {@code RowSource} and never assumes anything about how rows are stored or
 * decoded. Implementations are provided for JDBC ({@link JdbcRowSource}) and for rows already held in memory
 * ({@link InMemoryRowSource}); implement this interface to plug in any other driver.
 * <p>
 * Implementations are intended for use by a single thread.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public interface RowSource {
	/**
	 * Moves the cursor to the given 0-based position without fetching a row.
	 *
	 * @param position the 0-based position to move to
	 * @return {@code true} on success, {@code false} if the position is out of range or seeking is unsupported
	 */
	@NonNull
	Boolean seek(@NonNull Integer position);

	/**
	 * The number of rows in this source.
	 *
	 * @return the number of rows
	 */
	@NonNull
	Integer rowCount();

	/**
	 * Fetches the row at the current position and advances the cursor.
	 * <p>
	 * Each call returns a new map, ordered by column, whose values may be {@code null}.
	 *
	 * @return the next row, or empty if there are no more rows
	 */
	@NonNull
	Optional<Map<String, Object>> fetchNext();

	/**
	 * Frees any resources held by this source.
	 * <p>
	 * {@link Result} guarantees this is invoked at most once.
	 *
	 * @throws Exception if cleanup fails
	 */
	void release() throws Exception;

	/**
	 * Describes the columns of this source, in column order.
	 *
	 * @return column metadata
	 */
	@NonNull
	List<ColumnMetadata> discoverColumns();
}
