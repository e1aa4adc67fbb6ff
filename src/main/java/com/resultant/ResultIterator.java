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
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Forward-only iterator over the rows of a {@link Result}, bounded by an optional offset and limit.
 * <p>
 * Obtain instances via {@link Result#iterator(Integer, Integer)}. The iterator moves the result's own cursor, so
 * calling {@link Result#fetchRow()} between steps skips rows for the iterator (and vice versa).
 * <p>
 * On first use the iterator seeks to its offset. If the row source cannot seek, it skips {@code offset} rows from
 * wherever the cursor currently is.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class ResultIterator implements Iterator<Map<String, Object>> {
	@NonNull
	private final Result result;
	@NonNull
	private final Integer offset;
	@Nullable
	private final Integer limit;

	private boolean started;
	private boolean nextEvaluated;
	@Nullable
	private Map<String, Object> nextRow;
	private int rowsReturned;

	ResultIterator(@NonNull Result result,
								 @Nullable Integer offset,
								 @Nullable Integer limit) {
		requireNonNull(result);

		if (offset != null && offset < 0)
			throw new IllegalArgumentException(format("Offset must be >= 0 but was %d", offset));

		if (limit != null && limit < 0)
			throw new IllegalArgumentException(format("Limit must be >= 0 but was %d", limit));

		this.result = result;
		this.offset = offset == null ? 0 : offset;
		this.limit = limit;
	}

	@Override
	public boolean hasNext() {
		if (!this.started) {
			this.started = true;

			if (!this.result.trySeek(this.offset))
				for (int i = 0; i < this.offset; ++i)
					if (this.result.fetchRow().isEmpty())
						break;
		}

		if (this.limit != null && this.rowsReturned >= this.limit)
			return false;

		if (!this.nextEvaluated) {
			this.nextRow = this.result.fetchRow().orElse(null);
			this.nextEvaluated = true;
		}

		return this.nextRow != null;
	}

	@Override
	@NonNull
	public Map<String, Object> next() {
		if (!hasNext())
			throw new NoSuchElementException();

		Map<String, Object> row = requireNonNull(this.nextRow);

		this.nextEvaluated = false;
		this.nextRow = null;
		++this.rowsReturned;

		return row;
	}

	/**
	 * The index of the most recently returned row, relative to the offset.
	 *
	 * @return the 0-based index of the last row returned by {@link #next()}, or {@code -1} if none has been returned
	 */
	@NonNull
	public Integer getIndex() {
		return this.rowsReturned - 1;
	}

	@NonNull
	public Integer getOffset() {
		return this.offset;
	}

	@NonNull
	public Optional<Integer> getLimit() {
		return Optional.ofNullable(this.limit);
	}
}
