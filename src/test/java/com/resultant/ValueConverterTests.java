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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ValueConverterTests {
	private final ValueConverter valueConverter = ValueConverter.withTimeZone(ZoneOffset.UTC).build();

	@Test
	public void testPassthrough() {
		Assertions.assertNull(this.valueConverter.convert(null, ColumnType.INTEGER));
		Assertions.assertEquals(Boolean.FALSE, this.valueConverter.convert(false, ColumnType.TEXT), "False is never converted");
		Assertions.assertEquals(Boolean.FALSE, this.valueConverter.convert(false, ColumnType.DATE));
		Assertions.assertEquals("abc", this.valueConverter.convert("abc", null));
	}

	@Test
	public void testInteger() {
		Assertions.assertEquals(5L, this.valueConverter.convert("5", ColumnType.INTEGER));
		Assertions.assertEquals(12L, this.valueConverter.convert(" 12 apples", ColumnType.INTEGER));
		Assertions.assertEquals(-3L, this.valueConverter.convert("-3.9", ColumnType.INTEGER));
		Assertions.assertEquals(1000L, this.valueConverter.convert("1e3", ColumnType.INTEGER));
		Assertions.assertEquals(0L, this.valueConverter.convert("apples", ColumnType.INTEGER));
		Assertions.assertEquals(7L, this.valueConverter.convert(7, ColumnType.COUNTER));
		Assertions.assertEquals(1L, this.valueConverter.convert(true, ColumnType.INTEGER));
		Assertions.assertEquals(Long.MAX_VALUE, this.valueConverter.convert("99999999999999999999", ColumnType.INTEGER));
	}

	@Test
	public void testFloat() {
		Assertions.assertEquals(1.5D, this.valueConverter.convert("1.5", ColumnType.FLOAT));
		Assertions.assertEquals(0.25D, this.valueConverter.convert(".25kg", ColumnType.FLOAT));
		Assertions.assertEquals(0D, this.valueConverter.convert("n/a", ColumnType.FLOAT));
		Assertions.assertEquals(2D, this.valueConverter.convert(2, ColumnType.FLOAT));
		Assertions.assertEquals(10.75D, this.valueConverter.convert(new BigDecimal("10.75"), ColumnType.FLOAT));
	}

	@Test
	public void testBool() {
		Assertions.assertEquals(false, this.valueConverter.convert("0", ColumnType.BOOL));
		Assertions.assertEquals(false, this.valueConverter.convert("", ColumnType.BOOL));
		Assertions.assertEquals(true, this.valueConverter.convert("no", ColumnType.BOOL), "Only empty and \"0\" strings are false");
		Assertions.assertEquals(true, this.valueConverter.convert("0.0", ColumnType.BOOL));
		Assertions.assertEquals(false, this.valueConverter.convert(0, ColumnType.BOOL));
		Assertions.assertEquals(true, this.valueConverter.convert(-2, ColumnType.BOOL));
		Assertions.assertEquals(true, this.valueConverter.convert(true, ColumnType.BOOL));
	}

	@Test
	public void testText() {
		Assertions.assertEquals("1", this.valueConverter.convert(true, ColumnType.TEXT));
		Assertions.assertEquals("42", this.valueConverter.convert(42, ColumnType.TEXT));
		Assertions.assertEquals("5", this.valueConverter.convert(5.0D, ColumnType.TEXT));
		Assertions.assertEquals("2.5", this.valueConverter.convert(2.5D, ColumnType.TEXT));
		Assertions.assertEquals("1.50", this.valueConverter.convert(new BigDecimal("1.50"), ColumnType.TEXT));
		Assertions.assertEquals("héllo", this.valueConverter.convert("héllo".getBytes(StandardCharsets.UTF_8), ColumnType.TEXT));
	}

	@Test
	public void testBinary() {
		byte[] bytes = new byte[]{1, 2, 3};

		Assertions.assertSame(bytes, this.valueConverter.convert(bytes, ColumnType.BINARY));
		Assertions.assertEquals("abc", this.valueConverter.convert("abc", ColumnType.BINARY));
	}

	@Test
	public void testDateText() {
		Assertions.assertEquals(86400L, this.valueConverter.convert("1970-01-02", ColumnType.DATE));
		Assertions.assertEquals(60L, this.valueConverter.convert("1970-01-01 00:01:00", ColumnType.DATETIME));
		Assertions.assertEquals(61L, this.valueConverter.convert("1970-01-01T00:01:01", ColumnType.DATETIME));
		Assertions.assertEquals(10L, this.valueConverter.convert("1970-01-01T00:00:10Z", ColumnType.DATETIME));
		Assertions.assertEquals(-3600L, this.valueConverter.convert("1970-01-01T00:00:00+01:00", ColumnType.DATETIME));
		Assertions.assertEquals(123L, this.valueConverter.convert("@123", ColumnType.DATETIME));
		Assertions.assertEquals(1579046400L, this.valueConverter.convert("2020-01-15", ColumnType.DATE));
	}

	@Test
	public void testUnparseableDateIsNull() {
		Assertions.assertNull(this.valueConverter.convert("not a date", ColumnType.DATE));
		Assertions.assertNull(this.valueConverter.convert("2020-13-45", ColumnType.DATE));
		Assertions.assertNull(this.valueConverter.convert("@soon", ColumnType.DATETIME));
	}

	@Test
	public void testDateObjects() {
		Assertions.assertEquals(86400L, this.valueConverter.convert(LocalDate.of(1970, 1, 2), ColumnType.DATE));
		Assertions.assertEquals(90L, this.valueConverter.convert(LocalDateTime.of(1970, 1, 1, 0, 1, 30), ColumnType.DATETIME));
		Assertions.assertEquals(42L, this.valueConverter.convert(Instant.ofEpochSecond(42), ColumnType.DATETIME));
		Assertions.assertEquals(-2L, this.valueConverter.convert(new Date(-1500L), ColumnType.DATETIME));
		Assertions.assertEquals(86400L, this.valueConverter.convert(java.sql.Date.valueOf("1970-01-02"), ColumnType.DATE));
		Assertions.assertEquals(1234L, this.valueConverter.convert(1234, ColumnType.DATETIME), "Numbers are taken as epoch seconds");
	}

	@Test
	public void testTimeZone() {
		ValueConverter plusTwo = ValueConverter.withTimeZone(ZoneOffset.ofHours(2)).build();

		Assertions.assertEquals(-7200L, plusTwo.convert(LocalDate.of(1970, 1, 1), ColumnType.DATE));
		Assertions.assertEquals(-7200L, plusTwo.convert("1970-01-01 00:00:00", ColumnType.DATETIME));
		Assertions.assertEquals(0L, plusTwo.convert("1970-01-01T00:00:00Z", ColumnType.DATETIME), "Explicit offsets win over the time zone");
	}
}
