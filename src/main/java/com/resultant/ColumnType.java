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

/**
 * Logical column types used to drive value conversion on fetch.
 * <p>
 * These are independent of whatever native types the underlying {@link RowSource} reports.
 *
 * @see ValueConverter
 * @see Result#setConversion(String, ColumnType)
 * @since 1.0.0
 */
public enum ColumnType {
	/**
	 * Character data, converted to {@link String}.
	 */
	TEXT,
	/**
	 * Binary data. {@code byte[]} values pass through, anything else is converted to {@link String}.
	 */
	BINARY,
	/**
	 * Converted to {@link Boolean}.
	 */
	BOOL,
	/**
	 * Converted to {@link Long}.
	 */
	INTEGER,
	/**
	 * Converted to {@link Double}.
	 */
	FLOAT,
	/**
	 * Auto-incrementing integer column, converted to {@link Long}.
	 */
	COUNTER,
	/**
	 * Converted to epoch seconds ({@link Long}).
	 */
	DATE,
	/**
	 * Converted to epoch seconds ({@link Long}).
	 */
	DATETIME
}
