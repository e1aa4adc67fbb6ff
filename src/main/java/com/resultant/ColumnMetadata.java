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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Describes a single column as reported by {@link RowSource#discoverColumns()}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnMetadata {
	@NonNull
	private final String name;
	@Nullable
	private final String nativeType;
	@Nullable
	private final ColumnType columnType;
	@Nullable
	private final String table;
	@Nullable
	private final Boolean nullable;

	private ColumnMetadata(@NonNull Builder builder) {
		requireNonNull(builder);

		this.name = requireNonNull(builder.name);
		this.nativeType = builder.nativeType;
		this.columnType = builder.columnType;
		this.table = builder.table;
		this.nullable = builder.nullable;
	}

	/**
	 * Provides a {@link ColumnMetadata} builder for the given column {@code name}.
	 *
	 * @param name the column name, as it appears in fetched rows
	 * @return a {@link ColumnMetadata} builder
	 */
	@NonNull
	public static Builder withName(@NonNull String name) {
		requireNonNull(name);
		return new Builder(name);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		components.add(format("name=%s", getName()));

		if (getNativeType().isPresent())
			components.add(format("nativeType=%s", getNativeType().get()));
		if (getColumnType().isPresent())
			components.add(format("columnType=%s", getColumnType().get()));
		if (getTable().isPresent())
			components.add(format("table=%s", getTable().get()));
		if (getNullable().isPresent())
			components.add(format("nullable=%s", getNullable().get()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnMetadata))
			return false;

		ColumnMetadata columnMetadata = (ColumnMetadata) object;

		return Objects.equals(getName(), columnMetadata.getName())
				&& Objects.equals(getNativeType(), columnMetadata.getNativeType())
				&& Objects.equals(getColumnType(), columnMetadata.getColumnType())
				&& Objects.equals(getTable(), columnMetadata.getTable())
				&& Objects.equals(getNullable(), columnMetadata.getNullable());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getNativeType(), getColumnType(), getTable(), getNullable());
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * The type name reported by the row source, e.g. {@code VARCHAR}.
	 *
	 * @return the native type name, if available
	 */
	@NonNull
	public Optional<String> getNativeType() {
		return Optional.ofNullable(this.nativeType);
	}

	/**
	 * The logical type the row source assigns to this column, used by {@link Result#detectConversions()}.
	 *
	 * @return the logical type, or empty if the native type has no logical counterpart
	 */
	@NonNull
	public Optional<ColumnType> getColumnType() {
		return Optional.ofNullable(this.columnType);
	}

	@NonNull
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}

	@NonNull
	public Optional<Boolean> getNullable() {
		return Optional.ofNullable(this.nullable);
	}

	/**
	 * Builder used to construct instances of {@link ColumnMetadata}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String name;
		@Nullable
		private String nativeType;
		@Nullable
		private ColumnType columnType;
		@Nullable
		private String table;
		@Nullable
		private Boolean nullable;

		private Builder(@NonNull String name) {
			this.name = requireNonNull(name);
		}

		@NonNull
		public Builder nativeType(@Nullable String nativeType) {
			this.nativeType = nativeType;
			return this;
		}

		@NonNull
		public Builder columnType(@Nullable ColumnType columnType) {
			this.columnType = columnType;
			return this;
		}

		@NonNull
		public Builder table(@Nullable String table) {
			this.table = table;
			return this;
		}

		@NonNull
		public Builder nullable(@Nullable Boolean nullable) {
			this.nullable = nullable;
			return this;
		}

		@NonNull
		public ColumnMetadata build() {
			return new ColumnMetadata(this);
		}
	}
}
