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

package com.sprocket;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The materialized content of one result set: its {@link Column}s and its {@link Row}s, both in driver order.
 * <p>
 * Every row has exactly as many values as the table has columns.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Table implements Iterable<Row> {
	@NonNull
	private static final Table EMPTY_TABLE;

	static {
		EMPTY_TABLE = new Table(List.of(), List.of());
	}

	@NonNull
	private final List<Column> columns;
	@NonNull
	private final List<Row> rows;

	private Table(@NonNull List<Column> columns,
								@NonNull List<Row> rows) {
		this.columns = columns;
		this.rows = rows;
	}

	/**
	 * Creates a table.
	 *
	 * @param columns the result set columns
	 * @param rows    the result set rows
	 * @return a table
	 * @throws IllegalArgumentException if any row does not belong to {@code columns}, or a column's index is not its
	 *                                  position
	 */
	@NonNull
	public static Table of(@NonNull List<Column> columns,
												 @NonNull List<Row> rows) {
		requireNonNull(columns);
		requireNonNull(rows);

		List<Column> columnsCopy = List.copyOf(columns);
		Row.checkColumnIndices(columnsCopy);

		for (int i = 0; i < rows.size(); ++i) {
			Row row = rows.get(i);

			if (!row.getColumns().equals(columnsCopy))
				throw new IllegalArgumentException(format("Row %d has columns %s but the table has columns %s",
						i, row.getColumns(), columnsCopy));
		}

		return new Table(columnsCopy, List.copyOf(rows));
	}

	@NonNull
	static Table ofTrusted(@NonNull List<Column> columns,
												 @NonNull List<Row> rows) {
		return new Table(columns, rows);
	}

	/**
	 * A table with no columns and no rows, used when a call produces no result set.
	 *
	 * @return the empty table
	 */
	@NonNull
	public static Table empty() {
		return EMPTY_TABLE;
	}

	@Override
	@NonNull
	public Iterator<Row> iterator() {
		return getRows().iterator();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Table))
			return false;

		Table table = (Table) object;

		return Objects.equals(getColumns(), table.getColumns())
				&& Objects.equals(getRows(), table.getRows());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumns(), getRows());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columns=%s, rowCount=%d}", getClass().getSimpleName(), getColumns(), size());
	}

	/**
	 * The number of rows.
	 *
	 * @return the row count
	 */
	public int size() {
		return this.rows.size();
	}

	public boolean isEmpty() {
		return this.rows.isEmpty();
	}

	@NonNull
	public Row get(int rowIndex) {
		return this.rows.get(rowIndex);
	}

	@NonNull
	public List<Column> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<Row> getRows() {
		return this.rows;
	}
}
