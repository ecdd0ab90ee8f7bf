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
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One row of a result set: an ordered, immutable sequence of {@link DbValue}s, one per {@link Column}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Row {
	@NonNull
	private final List<Column> columns;
	@NonNull
	private final List<DbValue> values;

	private Row(@NonNull List<Column> columns,
							@NonNull List<DbValue> values) {
		this.columns = columns;
		this.values = values;
	}

	/**
	 * Creates a row.
	 *
	 * @param columns the columns of the result set this row belongs to
	 * @param values  one value per column, in column order
	 * @return a row
	 * @throws IllegalArgumentException if the number of values does not match the number of columns, or a column's index
	 *                                  is not its position
	 */
	@NonNull
	public static Row of(@NonNull List<Column> columns,
											 @NonNull List<DbValue> values) {
		requireNonNull(columns);
		requireNonNull(values);

		if (columns.size() != values.size())
			throw new IllegalArgumentException(format("Row has %d values but its result set has %d columns",
					values.size(), columns.size()));

		checkColumnIndices(columns);

		return new Row(List.copyOf(columns), List.copyOf(values));
	}

	/**
	 * Verifies that each column's index is its position in {@code columns}.
	 *
	 * @param columns the columns to check
	 * @throws IllegalArgumentException if a column is out of place
	 */
	static void checkColumnIndices(@NonNull List<Column> columns) {
		requireNonNull(columns);

		for (int i = 0; i < columns.size(); ++i)
			if (columns.get(i).getIndex() != i)
				throw new IllegalArgumentException(format("Column '%s' has index %d but is at position %d",
						columns.get(i).getLabel(), columns.get(i).getIndex(), i));
	}

	// Used while reading a result set, where the column list is already immutable and shared by all rows
	@NonNull
	static Row ofTrusted(@NonNull List<Column> columns,
											 @NonNull List<DbValue> values) {
		return new Row(columns, values);
	}

	/**
	 * Finds the position of a column by label: an exact match wins, otherwise the first case-insensitive match.
	 *
	 * @param columns the columns to search
	 * @param label   the label to look for
	 * @return the zero-based column index, if found
	 */
	@NonNull
	static OptionalInt indexOfLabel(@NonNull List<Column> columns,
																	@NonNull String label) {
		requireNonNull(columns);
		requireNonNull(label);

		for (Column column : columns)
			if (column.getLabel().equals(label))
				return OptionalInt.of(column.getIndex());

		String normalizedLabel = label.toLowerCase(Locale.ROOT);

		for (Column column : columns)
			if (column.getLabel().toLowerCase(Locale.ROOT).equals(normalizedLabel))
				return OptionalInt.of(column.getIndex());

		return OptionalInt.empty();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Row))
			return false;

		Row row = (Row) object;

		return Objects.equals(getColumns(), row.getColumns())
				&& Objects.equals(getValues(), row.getValues());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumns(), getValues());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s%s", getClass().getSimpleName(), getValues());
	}

	/**
	 * The number of values in this row, equal to the number of columns of its result set.
	 *
	 * @return the column count
	 */
	public int size() {
		return this.values.size();
	}

	/**
	 * Gets the value at the given zero-based column position.
	 *
	 * @param index the column position
	 * @return the value
	 * @throws IndexOutOfBoundsException if there is no such column
	 */
	@NonNull
	public DbValue get(int index) {
		return this.values.get(index);
	}

	/**
	 * Gets the value of the column with the given label.
	 *
	 * @param label the column label, matched exactly first and case-insensitively second
	 * @return the value, or empty if no column has that label
	 */
	@NonNull
	public Optional<DbValue> get(@NonNull String label) {
		requireNonNull(label);

		OptionalInt index = indexOfLabel(getColumns(), label);
		return index.isPresent() ? Optional.of(get(index.getAsInt())) : Optional.empty();
	}

	/**
	 * Gets the value at the given zero-based column position, coerced to {@code type} by the default
	 * {@link ValueConverter}.
	 *
	 * @param index the column position
	 * @param type  the desired type
	 * @param <T>   the desired type
	 * @return the coerced value, or empty for SQL {@code NULL}
	 * @throws TypeMismatchException if the value cannot be coerced
	 */
	@NonNull
	public <T> Optional<T> get(int index,
														 @NonNull Class<T> type) {
		requireNonNull(type);
		return ValueConverter.withDefaultConfiguration().convert(get(index), type);
	}

	@NonNull
	public List<Column> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<DbValue> getValues() {
		return this.values;
	}
}
