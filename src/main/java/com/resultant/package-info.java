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

/**
 * Resultant is a small result-set layer which sits between a cursor-like {@link com.resultant.RowSource} and
 * application code.
 * <p>
 * It steps through rows, converts column values to declared logical types, and reshapes flat rows into lists,
 * key-value maps and nested associative trees without hand-written loops.
 *
 * <pre>
 * // Wrap an executed JDBC query
 * Result result = Result.withRowSource(JdbcRowSource.withResultSet(resultSet).build()).build();
 *
 * // Type conversion
 * result.setConversion("salary", ColumnType.FLOAT);
 * result.detectConversions();
 *
 * // Single rows and values
 * Optional&lt;Map&lt;String, Object&gt;&gt; row = result.fetchRow();
 * Optional&lt;ColumnValue&gt; count = result.fetchScalar();
 *
 * // Bulk reshaping
 * List&lt;Object&gt; rows = result.fetchAllRows();
 * Map&lt;Object, Object&gt; namesById = result.fetchPairs("id", "name");
 * Map&lt;Object, Object&gt; employeesByDepartment = result.fetchAssocTree("department,*");
 * Map&lt;Object, Object&gt; ordersByCustomer = result.fetchAssocTree("customer_id,#,order_id");
 *
 * // Release the row source
 * result.release();</pre>
 *
 * @since 1.0.0
 */
package com.resultant;
