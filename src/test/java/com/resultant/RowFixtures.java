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

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Row-building helpers shared by tests.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class RowFixtures {
	private RowFixtures() {
		// Non-instantiable
	}

	/**
	 * Builds an ordered row from alternating column names and values.
	 */
	@Nonnull
	static Map<String, Object> row(@Nonnull Object... columnsAndValues) {
		requireNonNull(columnsAndValues);

		if (columnsAndValues.length % 2 != 0)
			throw new IllegalArgumentException(format("Expected column/value pairs but got %d arguments", columnsAndValues.length));

		Map<String, Object> row = new LinkedHashMap<>();

		for (int i = 0; i < columnsAndValues.length; i += 2)
			row.put((String) columnsAndValues[i], columnsAndValues[i + 1]);

		return row;
	}

	@Nonnull
	@SafeVarargs
	static Result resultOf(@Nonnull Map<String, Object>... rows) {
		requireNonNull(rows);
		return Result.withRowSource(InMemoryRowSource.withRows(List.of(rows)).build()).build();
	}

	/**
	 * Row source which serves rows in order but cannot seek, like a forward-only cursor.
	 */
	@NotThreadSafe
	static class ForwardOnlyRowSource implements RowSource {
		@Nonnull
		private final InMemoryRowSource delegate;
		private final boolean throwOnSeek;

		ForwardOnlyRowSource(@Nonnull List<Map<String, Object>> rows,
												 boolean throwOnSeek) {
			requireNonNull(rows);
			this.delegate = InMemoryRowSource.withRows(rows).build();
			this.throwOnSeek = throwOnSeek;
		}

		@Override
		public Boolean seek(Integer position) {
			if (this.throwOnSeek)
				throw new RowSourceException("Seeking is not supported");

			return false;
		}

		@Override
		public Integer rowCount() {
			throw new RowSourceException("Row count is not supported");
		}

		@Override
		public Optional<Map<String, Object>> fetchNext() {
			return this.delegate.fetchNext();
		}

		@Override
		public void release() {
			this.delegate.release();
		}

		@Override
		public List<ColumnMetadata> discoverColumns() {
			return this.delegate.discoverColumns();
		}
	}
}
