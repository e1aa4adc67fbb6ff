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

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard implementation of {@link ValueConverter}.
 * <p>
 * Conversions are lenient: numeric types read the leading numeric portion of text ({@code "12abc"} is {@code 12},
 * {@code "abc"} is {@code 0}), and date types accept ISO-like text only on a best-effort basis.
 * Text which cannot be read as a date converts to {@code null}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultValueConverter implements ValueConverter {
	@NonNull
	private static final Pattern NUMERIC_PREFIX_PATTERN = Pattern.compile("^\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final Logger logger;

	DefaultValueConverter(@NonNull Builder builder) {
		requireNonNull(builder);

		this.timeZone = requireNonNull(builder.timeZone);
		this.logger = Logger.getLogger(getClass().getName());
	}

	@Nullable
	@Override
	public Object convert(@Nullable Object value,
												@Nullable ColumnType columnType) {
		if (value == null || Boolean.FALSE.equals(value) || columnType == null)
			return value;

		switch (columnType) {
			case TEXT:
				return toText(value);
			case BINARY:
				return value instanceof byte[] ? value : toText(value);
			case BOOL:
				return toBoolean(value);
			case INTEGER:
			case COUNTER:
				return toLong(value);
			case FLOAT:
				return toDouble(value);
			case DATE:
			case DATETIME:
				return toEpochSeconds(value);
			default:
				return value;
		}
	}

	@NonNull
	protected String toText(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof String)
			return (String) value;

		if (value instanceof Boolean)
			return ((Boolean) value) ? "1" : "";

		if (value instanceof byte[])
			return new String((byte[]) value, StandardCharsets.UTF_8);

		if (value instanceof BigDecimal)
			return ((BigDecimal) value).toPlainString();

		if (value instanceof Double || value instanceof Float) {
			double number = ((Number) value).doubleValue();

			// Integral values render without a fraction
			if (!Double.isInfinite(number) && number == Math.rint(number) && Math.abs(number) < 1e15)
				return String.valueOf((long) number);

			return String.valueOf(number);
		}

		return value.toString();
	}

	@NonNull
	protected Boolean toBoolean(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Boolean)
			return (Boolean) value;

		if (value instanceof BigDecimal)
			return ((BigDecimal) value).signum() != 0;

		if (value instanceof BigInteger)
			return ((BigInteger) value).signum() != 0;

		if (value instanceof Number)
			return ((Number) value).doubleValue() != 0;

		String text = value instanceof byte[] ? new String((byte[]) value, StandardCharsets.UTF_8) : value.toString();
		return !(text.isEmpty() || "0".equals(text));
	}

	@NonNull
	protected Long toLong(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Long)
			return (Long) value;

		if (value instanceof Number)
			return ((Number) value).longValue();

		if (value instanceof Boolean)
			return ((Boolean) value) ? 1L : 0L;

		String numericPrefix = numericPrefix(toText(value));

		if (numericPrefix == null)
			return 0L;

		if (isIntegral(numericPrefix)) {
			try {
				return Long.parseLong(numericPrefix);
			} catch (NumberFormatException e) {
				// Out of range for a long; saturate like a double-to-long cast does
				return (long) Double.parseDouble(numericPrefix);
			}
		}

		return (long) Double.parseDouble(numericPrefix);
	}

	@NonNull
	protected Double toDouble(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Double)
			return (Double) value;

		if (value instanceof Number)
			return ((Number) value).doubleValue();

		if (value instanceof Boolean)
			return ((Boolean) value) ? 1D : 0D;

		String numericPrefix = numericPrefix(toText(value));
		return numericPrefix == null ? 0D : Double.parseDouble(numericPrefix);
	}

	/**
	 * Converts a date/time value to epoch seconds.
	 * <p>
	 * Text parsing is loose and is not a validation step: anything outside the ISO-like forms
	 * {@code yyyy-MM-dd}, {@code yyyy-MM-dd HH:mm[:ss[.fraction]]} (with {@code ' '} or {@code 'T'} separator and
	 * optional offset or zone) and {@code @<epochSeconds>} yields {@code null}.
	 *
	 * @param value the value to convert
	 * @return epoch seconds, or {@code null} if {@code value} could not be interpreted
	 */
	@Nullable
	protected Long toEpochSeconds(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Number)
			return ((Number) value).longValue();
		if (value instanceof java.sql.Date)
			return ((java.sql.Date) value).toLocalDate().atStartOfDay(getTimeZone()).toEpochSecond();
		if (value instanceof Date)
			return Math.floorDiv(((Date) value).getTime(), 1000L);
		if (value instanceof Instant)
			return ((Instant) value).getEpochSecond();
		if (value instanceof OffsetDateTime)
			return ((OffsetDateTime) value).toEpochSecond();
		if (value instanceof ZonedDateTime)
			return ((ZonedDateTime) value).toEpochSecond();
		if (value instanceof LocalDateTime)
			return ((LocalDateTime) value).atZone(getTimeZone()).toEpochSecond();
		if (value instanceof LocalDate)
			return ((LocalDate) value).atStartOfDay(getTimeZone()).toEpochSecond();

		return parseEpochSeconds(toText(value));
	}

	@Nullable
	protected Long parseEpochSeconds(@NonNull String text) {
		requireNonNull(text);

		String normalized = text.trim();

		if (normalized.startsWith("@")) {
			try {
				return Long.parseLong(normalized.substring(1));
			} catch (NumberFormatException e) {
				getLogger().log(Level.FINE, format("Unable to read '%s' as epoch seconds", text), e);
				return null;
			}
		}

		// Accept "2020-01-31 10:15:30" as well as "2020-01-31T10:15:30"
		if (normalized.length() > 10 && normalized.charAt(10) == ' ')
			normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11).trim();

		DateTimeParseException failure;

		try {
			TemporalAccessor temporalAccessor = DateTimeFormatter.ISO_DATE_TIME.parseBest(normalized, ZonedDateTime::from, LocalDateTime::from);

			if (temporalAccessor instanceof ZonedDateTime zonedDateTime)
				return zonedDateTime.toEpochSecond();

			return ((LocalDateTime) temporalAccessor).atZone(getTimeZone()).toEpochSecond();
		} catch (DateTimeParseException e) {
			failure = e;
		}

		try {
			return LocalDate.parse(normalized).atStartOfDay(getTimeZone()).toEpochSecond();
		} catch (DateTimeParseException e) {
			failure.addSuppressed(e);
		}

		getLogger().log(Level.FINE, format("Unable to read '%s' as a date", text), failure);
		return null;
	}

	@Nullable
	protected String numericPrefix(@NonNull String text) {
		requireNonNull(text);

		Matcher matcher = NUMERIC_PREFIX_PATTERN.matcher(text);
		return matcher.find() ? matcher.group().trim() : null;
	}

	@NonNull
	protected Boolean isIntegral(@NonNull String numericText) {
		requireNonNull(numericText);
		return numericText.indexOf('.') < 0 && numericText.indexOf('e') < 0 && numericText.indexOf('E') < 0;
	}

	@NonNull
	protected ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
