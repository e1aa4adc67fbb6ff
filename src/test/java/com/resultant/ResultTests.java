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

import com.resultant.RowFixtures.ForwardOnlyRowSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.resultant.RowFixtures.resultOf;
import static com.resultant.RowFixtures.row;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class ResultTests {
	@Test
	public void testFetchRow() {
		Result result = resultOf(row("id", 1, "name", "Alice"), row("id", 2, "name", "Bob"));

		Assertions.assertEquals(Optional.of(row("id", 1, "name", "Alice")), result.fetchRow());
		Assertions.assertEquals(1, result.getPosition());
		Assertions.assertEquals(Optional.of(row("id", 2, "name", "Bob")), result.fetchRow());
		Assertions.assertTrue(result.fetchRow().isEmpty(), "Expected no more rows");
		Assertions.assertTrue(result.fetchRow().isEmpty(), "Exhaustion should be sticky");
		Assertions.assertEquals(2, result.getPosition());
	}

	@Test
	public void testFetchRowPreservesColumnOrder() {
		Result result = resultOf(row("z", 1, "a", 2, "m", 3));
		Map<String, Object> row = result.fetchRow().orElseThrow();

		Assertions.assertEquals(List.of("z", "a", "m"), new ArrayList<>(row.keySet()));
	}

	@Test
	public void testFetchScalar() {
		Result result = resultOf(row("employee_count", 3, "ignored", "x"), row("employee_count", null, "ignored", "y"));

		ColumnValue first = result.fetchScalar().orElseThrow();
		Assertions.assertEquals("employee_count", first.getColumnName());
		Assertions.assertEquals(Optional.of(3), first.getValue());

		// A NULL column is distinct from having no row at all
		ColumnValue second = result.fetchScalar().orElseThrow();
		Assertions.assertTrue(second.getValue().isEmpty(), "Expected NULL value");

		Assertions.assertTrue(result.fetchScalar().isEmpty(), "Expected no more rows");
	}

	@Test
	public void testFetchScalarAppliesConversion() {
		Result result = resultOf(row("total", "42"));
		result.setConversion("total", ColumnType.INTEGER);

		Assertions.assertEquals(Optional.of(42L), result.fetchScalar().orElseThrow().getValue());
	}

	@Test
	public void testFetchAllRows() {
		Result result = resultOf(row("id", 1, "name", "Alice"), row("id", 2, "name", "Bob"));

		Assertions.assertEquals(List.of(row("id", 1, "name", "Alice"), row("id", 2, "name", "Bob")), result.fetchAllRows());
	}

	@Test
	public void testFetchAllRowsSingleColumnFlattens() {
		Result result = resultOf(row("id", 1), row("id", 2), row("id", 3));

		Assertions.assertEquals(List.of(1, 2, 3), result.fetchAllRows());
	}

	@Test
	public void testFetchAllRowsEmpty() {
		Result result = resultOf();

		Assertions.assertEquals(List.of(), result.fetchAllRows());
		Assertions.assertEquals(Map.of(), result.fetchPairs());
		Assertions.assertEquals(List.of(), result.fetchValues("anything"));
	}

	@Test
	public void testFetchAllRowsRewinds() {
		Result result = resultOf(row("id", 1), row("id", 2), row("id", 3));

		result.fetchRow();
		result.fetchRow();

		Assertions.assertEquals(List.of(1, 2, 3), result.fetchAllRows());
		Assertions.assertEquals(List.of(1, 2, 3), result.fetchAllRows(), "Repeated bulk fetches should see every row");
	}

	@Test
	public void testFetchAllRowsWithoutSeekContinuesFromCursor() {
		List<Map<String, Object>> rows = List.of(row("id", 1), row("id", 2), row("id", 3));

		for (boolean throwOnSeek : new boolean[]{false, true}) {
			Result result = Result.withRowSource(new ForwardOnlyRowSource(rows, throwOnSeek)).build();
			result.fetchRow();

			Assertions.assertEquals(List.of(2, 3), result.fetchAllRows());
		}
	}

	@Test
	public void testFetchPairsAutoDetected() {
		Result result = resultOf(row("id", 1, "name", "Alice", "extra", true), row("id", 2, "name", "Bob", "extra", false));

		Assertions.assertEquals(Map.of(1, "Alice", 2, "Bob"), result.fetchPairs());
	}

	@Test
	public void testFetchPairsLastWriteWins() {
		Result result = resultOf(row("id", 1, "name", "Alice"), row("id", 2, "name", "Bob"), row("id", 1, "name", "Carol"));
		Map<Object, Object> pairs = result.fetchPairs("id", "name");

		Assertions.assertEquals(Map.of(1, "Carol", 2, "Bob"), pairs);
		Assertions.assertEquals(List.of(2, 1), new ArrayList<>(pairs.keySet()), "Overwritten key should move to the end");
	}

	@Test
	public void testFetchPairsValueColumnOnly() {
		Result result = resultOf(row("id", 7, "name", "Alice"), row("id", 9, "name", "Bob"));

		Assertions.assertEquals(Map.of(0, "Alice", 1, "Bob"), result.fetchPairs(null, "name"));
	}

	@Test
	public void testFetchPairsErrors() {
		Result singleColumn = resultOf(row("id", 1));
		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, singleColumn::fetchPairs);
		Assertions.assertTrue(e.getMessage().contains("at least two columns"), e.getMessage());

		Result result = resultOf(row("id", 1, "name", "Alice"));

		Assertions.assertThrows(IllegalArgumentException.class, () -> result.fetchPairs("id", null));
		Assertions.assertEquals(0, result.getPosition(), "Argument validation should happen before any row is read");

		e = Assertions.assertThrows(IllegalArgumentException.class, () -> result.fetchPairs("id", "missing"));
		Assertions.assertTrue(e.getMessage().contains("missing"), e.getMessage());

		e = Assertions.assertThrows(IllegalArgumentException.class, () -> result.fetchPairs("missing", "name"));
		Assertions.assertTrue(e.getMessage().contains("missing"), e.getMessage());
	}

	@Test
	public void testFetchValues() {
		Result result = resultOf(row("id", 1, "name", "Alice"), row("id", 2, "name", null), row("id", 3, "name", "Alice"));

		Assertions.assertEquals(Arrays.asList("Alice", null, "Alice"), result.fetchValues("name"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> result.fetchValues("missing"));
	}

	@Test
	public void testConversions() {
		Result result = resultOf(row("id", "5", "active", "0", "price", "1.5 USD", "label", 12));

		result.setConversion("id", ColumnType.INTEGER);
		result.setConversion("active", ColumnType.BOOL);
		result.setConversion("price", ColumnType.FLOAT);

		Assertions.assertEquals(row("id", 5L, "active", false, "price", 1.5D, "label", 12), result.fetchRow().orElseThrow());
		Assertions.assertEquals(Optional.of(ColumnType.INTEGER), result.getConversion("id"));
		Assertions.assertTrue(result.getConversion("label").isEmpty());

		result.setConversion("id", null);
		Assertions.assertTrue(result.getConversion("id").isEmpty(), "Null type should remove the conversion");
		Assertions.assertEquals(List.of("active", "price"), new ArrayList<>(result.getConversions().keySet()));
	}

	@Test
	public void testSetConversionsReplacesTable() {
		Result result = Result.withRowSource(InMemoryRowSource.withRows(List.of(row("id", "5", "name", "Alice"))).build())
				.conversions(Map.of("name", ColumnType.BOOL))
				.build();

		result.setConversions(Map.of("id", ColumnType.INTEGER));

		Assertions.assertEquals(Map.of("id", ColumnType.INTEGER), result.getConversions());
		Assertions.assertEquals(row("id", 5L, "name", "Alice"), result.fetchRow().orElseThrow());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> result.getConversions().put("name", ColumnType.TEXT));
	}

	@Test
	public void testDetectConversions() {
		Result result = resultOf(row("id", 1, "name", "Alice", "notes", null));
		result.setConversion("extra", ColumnType.TEXT);
		result.detectConversions();

		Assertions.assertEquals(Optional.of(ColumnType.INTEGER), result.getConversion("id"));
		Assertions.assertEquals(Optional.of(ColumnType.TEXT), result.getConversion("name"));
		Assertions.assertTrue(result.getConversion("notes").isEmpty(), "Columns without a known type are left alone");
		Assertions.assertEquals(Optional.of(ColumnType.TEXT), result.getConversion("extra"), "Existing conversions are kept");

		Assertions.assertEquals(1L, result.fetchRow().orElseThrow().get("id"));
	}

	@Test
	public void testColumnMetadataIsDiscoveredOnce() {
		AtomicInteger discoveries = new AtomicInteger();
		List<Map<String, Object>> rows = List.of(row("id", 1, "name", "Alice"));
		RowSource rowSource = new ForwardOnlyRowSource(rows, false) {
			@Override
			public List<ColumnMetadata> discoverColumns() {
				discoveries.incrementAndGet();
				return super.discoverColumns();
			}
		};

		Result result = Result.withRowSource(rowSource).build();

		Assertions.assertEquals(0, discoveries.get(), "Discovery should be lazy");
		Assertions.assertEquals(List.of("id", "name"), result.fieldNames());
		Assertions.assertEquals(Optional.of(ColumnType.TEXT), result.fieldMeta("name").flatMap(ColumnMetadata::getColumnType));
		Assertions.assertTrue(result.fieldMeta("missing").isEmpty());
		Assertions.assertEquals(1, discoveries.get());
	}

	@Test
	public void testExplicitColumnMetadata() {
		RowSource rowSource = InMemoryRowSource.withRows(List.of(row("hired", "2020-01-15")))
				.columns(List.of(ColumnMetadata.withName("hired").nativeType("date").columnType(ColumnType.DATE).nullable(false).build()))
				.build();

		Result result = Result.withRowSource(rowSource).build();
		ColumnMetadata hired = result.fieldMeta("hired").orElseThrow();

		Assertions.assertEquals(Optional.of("date"), hired.getNativeType());
		Assertions.assertEquals(Optional.of(false), hired.getNullable());
		Assertions.assertTrue(hired.getTable().isEmpty());
	}

	@Test
	public void testRelease() {
		InMemoryRowSource rowSource = InMemoryRowSource.withRows(List.of(row("id", 1))).build();
		Result result = Result.withRowSource(rowSource).build();

		result.release();
		result.release();

		Assertions.assertTrue(result.isReleased());
		Assertions.assertTrue(rowSource.isReleased());
		Assertions.assertThrows(IllegalStateException.class, result::fetchRow);
		Assertions.assertThrows(IllegalStateException.class, result::fetchAllRows);
		Assertions.assertThrows(IllegalStateException.class, () -> result.seek(0));
	}

	@Test
	public void testReleaseFailureIsNotThrown() {
		AtomicInteger releases = new AtomicInteger();
		RowSource rowSource = new ForwardOnlyRowSource(List.of(row("id", 1)), false) {
			@Override
			public void release() {
				releases.incrementAndGet();
				throw new RowSourceException("Unable to close");
			}
		};

		try (Result result = Result.withRowSource(rowSource).build()) {
			Assertions.assertEquals(Optional.of(row("id", 1)), result.fetchRow());
			result.release();
		}

		Assertions.assertEquals(1, releases.get(), "Row source should only be released once");
	}

	@Test
	public void testSeek() {
		Result result = resultOf(row("id", 1), row("id", 2), row("id", 3));

		Assertions.assertTrue(result.seek(2));
		Assertions.assertEquals(2, result.getPosition());
		Assertions.assertEquals(Optional.of(row("id", 3)), result.fetchRow());
		Assertions.assertFalse(result.seek(3));
		Assertions.assertFalse(result.seek(-1));
		Assertions.assertEquals(3, result.rowCount());
	}

	@Test
	public void testFetchLogger() {
		List<FetchLog> fetchLogs = new ArrayList<>();
		Result result = Result.withRowSource(InMemoryRowSource.withRows(List.of(row("id", 1), row("id", 2))).build())
				.fetchLogger(fetchLogs::add)
				.build();

		result.fetchAllRows();
		result.fetchPairs(null, "id");
		result.fetchRow();

		Assertions.assertEquals(2, fetchLogs.size(), "Only bulk fetches are logged");

		FetchLog allRows = fetchLogs.get(0);
		Assertions.assertEquals(FetchLog.Operation.ALL_ROWS, allRows.getOperation());
		Assertions.assertEquals(2, allRows.getRowsFetched());
		Assertions.assertTrue(allRows.getArguments().isEmpty());
		Assertions.assertTrue(allRows.getException().isEmpty());

		FetchLog pairs = fetchLogs.get(1);
		Assertions.assertEquals(FetchLog.Operation.PAIRS, pairs.getOperation());
		Assertions.assertEquals(Optional.of("key=null, value=id"), pairs.getArguments());
	}

	@Test
	public void testFetchLoggerSeesFailure() {
		List<FetchLog> fetchLogs = new ArrayList<>();
		Result result = Result.withRowSource(InMemoryRowSource.withRows(List.of(row("id", 1))).build())
				.fetchLogger(fetchLogs::add)
				.build();

		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> result.fetchValues("missing"));

		Assertions.assertEquals(1, fetchLogs.size());
		Assertions.assertEquals(Optional.of(e), fetchLogs.get(0).getException());
		Assertions.assertEquals(1, fetchLogs.get(0).getRowsFetched());
	}

	@Test
	public void testFetchLoggerExceptionSuppressedWhenOperationFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		Result result = Result.withRowSource(InMemoryRowSource.withRows(List.of(row("id", 1))).build())
				.fetchLogger((fetchLog) -> {
					throw loggerFailure;
				})
				.build();

		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> result.fetchAssocTree("missing"));

		Assertions.assertTrue(Arrays.asList(e.getSuppressed()).contains(loggerFailure), "Expected fetch logger failure to be suppressed");

		RuntimeException thrown = Assertions.assertThrows(RuntimeException.class, result::fetchAllRows);
		Assertions.assertSame(loggerFailure, thrown, "Logger failure should surface when the fetch itself succeeds");
	}

	@Test
	public void testDefaultFetchLoggerFormat() {
		DefaultFetchLogger fetchLogger = new DefaultFetchLogger();
		FetchLog fetchLog = FetchLog.withOperation(FetchLog.Operation.ASSOC_TREE)
				.arguments("cat,*")
				.rowsFetched(1)
				.exception(new RowSourceException("Unable to fetch row", new IllegalStateException("cursor closed")))
				.build();

		String formatted = fetchLogger.formatFetchLog(fetchLog);

		Assertions.assertTrue(formatted.startsWith("ASSOC_TREE (cat,*): 1 row in "), formatted);
		Assertions.assertTrue(formatted.contains("Failed due to java.lang.IllegalStateException: cursor closed"), formatted);

		// Should not throw regardless of logger configuration
		fetchLogger.log(fetchLog);
	}
}
