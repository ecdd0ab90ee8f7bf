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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Statically declared description of how a {@link Row} populates a record of type {@code T}.
 * <p>
 * A mapping is a zero-argument factory plus an ordered list of fields, each naming a column (by label or by zero-based
 * position), the Java type its value is coerced to, and the setter that receives it.  No reflection is involved.
 * <pre>{@code  RecordMapping<User> userMapping = RecordMapping.forType(User.class, User::new)
 *   .column("user_id", Long.class, User::setId)
 *   .column("name", String.class, User::setName)
 *   .column(2, Locale.class, User::setLocale)
 *   .build();}</pre>
 * Column labels are matched exactly first, then case-insensitively.  They are resolved to positions once per result set
 * and the resulting plan is applied to each of its rows.
 * <p>
 * SQL {@code NULL} is passed to the setter as {@code null}, except for fields declared with a primitive type (e.g.
 * {@code int.class}), whose setter is skipped so the field keeps the value the factory gave it.
 * <p>
 * Instances are immutable and thread-safe, provided the factory and setters are.
 *
 * @param <T> the record type
 * @since 1.0.0
 */
@ThreadSafe
public final class RecordMapping<T> {
	@NonNull
	private final Class<T> recordType;
	@NonNull
	private final Supplier<T> factory;
	@NonNull
	private final List<FieldMapping<T, ?>> fieldMappings;

	private RecordMapping(@NonNull Builder<T> builder) {
		requireNonNull(builder);

		this.recordType = builder.recordType;
		this.factory = builder.factory;
		this.fieldMappings = List.copyOf(builder.fieldMappings);
	}

	/**
	 * Starts a mapping for the given record type.
	 *
	 * @param recordType the record type, used in error messages
	 * @param factory    creates a new record with every field at its default
	 * @param <T>        the record type
	 * @return a builder for declaring the mapped columns
	 */
	@NonNull
	public static <T> Builder<T> forType(@NonNull Class<T> recordType,
																			 @NonNull Supplier<T> factory) {
		requireNonNull(recordType);
		requireNonNull(factory);

		return new Builder<>(recordType, factory);
	}

	/**
	 * Receives a coerced column value.
	 *
	 * @param <T> the record type
	 * @param <V> the field type
	 */
	@FunctionalInterface
	public interface FieldSetter<T, V> {
		void set(@NonNull T record,
						 @Nullable V value);
	}

	/**
	 * Creates a fresh record with no columns applied.
	 *
	 * @return a new record instance
	 * @throws DatabaseException if the factory returns {@code null}
	 */
	@NonNull
	public T newInstance() {
		T record = this.factory.get();

		if (record == null)
			throw new DatabaseException(format("Record factory for %s returned null", getRecordType().getName()));

		return record;
	}

	/**
	 * Maps a single row using the default {@link ValueConverter}.
	 *
	 * @param row the row to map
	 * @return a new, populated record
	 * @throws RowMappingException if a mapped column is missing or a value cannot be coerced
	 */
	@NonNull
	public T map(@NonNull Row row) {
		requireNonNull(row);
		return map(row, ValueConverter.withDefaultConfiguration());
	}

	/**
	 * Maps a single row.
	 *
	 * @param row            the row to map
	 * @param valueConverter coerces column values to field types
	 * @return a new, populated record
	 * @throws RowMappingException if a mapped column is missing or a value cannot be coerced
	 */
	@NonNull
	public T map(@NonNull Row row,
							 @NonNull ValueConverter valueConverter) {
		requireNonNull(row);
		requireNonNull(valueConverter);

		return plan(row.getColumns(), valueConverter).map(row, 0);
	}

	/**
	 * Maps every row of a table, in order.
	 *
	 * @param table          the rows to map
	 * @param valueConverter coerces column values to field types
	 * @return one new record per row
	 * @throws RowMappingException if any row fails to map
	 */
	@NonNull
	public List<T> mapAll(@NonNull Table table,
												@NonNull ValueConverter valueConverter) {
		requireNonNull(table);
		requireNonNull(valueConverter);

		if (table.isEmpty())
			return List.of();

		RowPlan<T> rowPlan = plan(table.getColumns(), valueConverter);
		List<T> records = new ArrayList<>(table.size());

		for (int i = 0; i < table.size(); ++i)
			records.add(rowPlan.map(table.get(i), i));

		return records;
	}

	/**
	 * Resolves every declared column against the given result set columns.
	 */
	@NonNull
	RowPlan<T> plan(@NonNull List<Column> columns,
									@NonNull ValueConverter valueConverter) {
		requireNonNull(columns);
		requireNonNull(valueConverter);

		int[] columnIndices = new int[this.fieldMappings.size()];

		for (int i = 0; i < this.fieldMappings.size(); ++i) {
			FieldMapping<T, ?> fieldMapping = this.fieldMappings.get(i);

			if (fieldMapping.label != null) {
				OptionalInt columnIndex = Row.indexOfLabel(columns, fieldMapping.label);

				if (columnIndex.isEmpty())
					throw new RowMappingException(format("Result set has no column '%s' required by %s; available columns are %s",
							fieldMapping.label, getRecordType().getName(), columnLabels(columns)),
							getRecordType(), fieldMapping.describeColumn(), -1, null);

				columnIndices[i] = columnIndex.getAsInt();
			} else {
				if (fieldMapping.index >= columns.size())
					throw new RowMappingException(format("Result set has %d columns but %s maps column position %d",
							columns.size(), getRecordType().getName(), fieldMapping.index),
							getRecordType(), fieldMapping.describeColumn(), -1, null);

				columnIndices[i] = fieldMapping.index;
			}
		}

		return new RowPlan<>(this, columnIndices, valueConverter);
	}

	@NonNull
	private static List<String> columnLabels(@NonNull List<Column> columns) {
		List<String> labels = new ArrayList<>(columns.size());

		for (Column column : columns)
			labels.add(column.getLabel());

		return labels;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> columns = new ArrayList<>(this.fieldMappings.size());

		for (FieldMapping<T, ?> fieldMapping : this.fieldMappings)
			columns.add(format("%s->%s", fieldMapping.describeColumn(), fieldMapping.valueType.getSimpleName()));

		return format("%s{recordType=%s, columns=%s}", getClass().getSimpleName(), getRecordType().getName(), columns);
	}

	@NonNull
	public Class<T> getRecordType() {
		return this.recordType;
	}

	/**
	 * A mapping whose column labels have been resolved to positions for one particular result set.
	 */
	@ThreadSafe
	static final class RowPlan<T> {
		@NonNull
		private final RecordMapping<T> recordMapping;
		private final int @NonNull [] columnIndices;
		@NonNull
		private final ValueConverter valueConverter;

		private RowPlan(@NonNull RecordMapping<T> recordMapping,
										int @NonNull [] columnIndices,
										@NonNull ValueConverter valueConverter) {
			this.recordMapping = recordMapping;
			this.columnIndices = columnIndices;
			this.valueConverter = valueConverter;
		}

		@NonNull
		T map(@NonNull Row row,
					int rowIndex) {
			requireNonNull(row);

			T record = this.recordMapping.newInstance();
			List<FieldMapping<T, ?>> fieldMappings = this.recordMapping.fieldMappings;

			for (int i = 0; i < fieldMappings.size(); ++i) {
				FieldMapping<T, ?> fieldMapping = fieldMappings.get(i);
				DbValue value = row.get(this.columnIndices[i]);

				try {
					fieldMapping.apply(record, value, this.valueConverter);
				} catch (TypeMismatchException e) {
					throw new RowMappingException(format("Unable to map column %s of row %d to %s: %s",
							fieldMapping.describeColumn(), rowIndex, this.recordMapping.getRecordType().getName(), e.getMessage()),
							this.recordMapping.getRecordType(), fieldMapping.describeColumn(), rowIndex, e);
				} catch (RuntimeException e) {
					throw new RowMappingException(format("Unable to apply column %s of row %d to %s: %s",
							fieldMapping.describeColumn(), rowIndex, this.recordMapping.getRecordType().getName(), e),
							this.recordMapping.getRecordType(), fieldMapping.describeColumn(), rowIndex, e);
				}
			}

			return record;
		}
	}

	@ThreadSafe
	private static final class FieldMapping<T, V> {
		@Nullable
		private final String label;
		private final int index;
		@NonNull
		private final Class<V> valueType;
		@NonNull
		private final FieldSetter<T, V> fieldSetter;

		private FieldMapping(@Nullable String label,
												 int index,
												 @NonNull Class<V> valueType,
												 @NonNull FieldSetter<T, V> fieldSetter) {
			this.label = label;
			this.index = index;
			this.valueType = requireNonNull(valueType);
			this.fieldSetter = requireNonNull(fieldSetter);
		}

		private void apply(@NonNull T record,
											 @NonNull DbValue value,
											 @NonNull ValueConverter valueConverter) {
			V convertedValue = valueConverter.convert(value, this.valueType).orElse(null);

			// A primitive-typed setter cannot take null, so NULL leaves the field as the factory set it
			if (convertedValue == null && this.valueType.isPrimitive())
				return;

			this.fieldSetter.set(record, convertedValue);
		}

		@NonNull
		private String describeColumn() {
			return this.label == null ? format("#%d", this.index) : format("'%s'", this.label);
		}
	}

	/**
	 * Builder used to construct instances of {@link RecordMapping}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @param <T> the record type
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder<T> {
		@NonNull
		private final Class<T> recordType;
		@NonNull
		private final Supplier<T> factory;
		@NonNull
		private final List<FieldMapping<T, ?>> fieldMappings;

		private Builder(@NonNull Class<T> recordType,
										@NonNull Supplier<T> factory) {
			this.recordType = requireNonNull(recordType);
			this.factory = requireNonNull(factory);
			this.fieldMappings = new ArrayList<>();
		}

		/**
		 * Maps the column with the given label.
		 *
		 * @param label       the column label
		 * @param valueType   the type the column value is coerced to
		 * @param fieldSetter receives the coerced value
		 * @param <V>         the field type
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public <V> Builder<T> column(@NonNull String label,
																 @NonNull Class<V> valueType,
																 @NonNull FieldSetter<T, V> fieldSetter) {
			requireNonNull(label);
			requireNonNull(valueType);
			requireNonNull(fieldSetter);

			if (label.isBlank())
				throw new IllegalArgumentException("Column label must not be blank");

			this.fieldMappings.add(new FieldMapping<>(label, -1, valueType, fieldSetter));
			return this;
		}

		/**
		 * Maps the column at the given zero-based position.
		 *
		 * @param index       the column position
		 * @param valueType   the type the column value is coerced to
		 * @param fieldSetter receives the coerced value
		 * @param <V>         the field type
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public <V> Builder<T> column(int index,
																 @NonNull Class<V> valueType,
																 @NonNull FieldSetter<T, V> fieldSetter) {
			requireNonNull(valueType);
			requireNonNull(fieldSetter);

			if (index < 0)
				throw new IllegalArgumentException("Column position must be >= 0");

			this.fieldMappings.add(new FieldMapping<>(null, index, valueType, fieldSetter));
			return this;
		}

		@NonNull
		public RecordMapping<T> build() {
			return new RecordMapping<>(this);
		}
	}
}
