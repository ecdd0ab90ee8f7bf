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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Materializes JDBC result sets into {@link Table}s of {@link DbValue}s.
 * <p>
 * How each column is read is decided once per result set from its JDBC type, then applied to every row.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class ResultSetReader {
	private ResultSetReader() {
		// Non-instantiable
	}

	@FunctionalInterface
	private interface ColumnReader {
		@NonNull
		DbValue read(@NonNull ResultSet resultSet,
								 int columnIndex) throws SQLException;
	}

	/**
	 * Reads the remaining rows of {@code resultSet}.  The result set is not closed.
	 */
	@NonNull
	static Table readTable(@NonNull ResultSet resultSet) throws SQLException {
		return readTable(resultSet, Integer.MAX_VALUE);
	}

	/**
	 * Reads at most {@code maximumRows} rows of {@code resultSet}.  The result set is not closed.
	 */
	@NonNull
	static Table readTable(@NonNull ResultSet resultSet,
												 int maximumRows) throws SQLException {
		requireNonNull(resultSet);

		List<Column> columns = readColumns(resultSet.getMetaData());
		ColumnReader[] columnReaders = new ColumnReader[columns.size()];

		for (int i = 0; i < columns.size(); ++i)
			columnReaders[i] = columnReaderFor(columns.get(i));

		List<Row> rows = new ArrayList<>();

		while (rows.size() < maximumRows && resultSet.next()) {
			List<DbValue> values = new ArrayList<>(columns.size());

			// JDBC columns are 1-based
			for (int i = 0; i < columnReaders.length; ++i)
				values.add(columnReaders[i].read(resultSet, i + 1));

			rows.add(Row.ofTrusted(columns, Collections.unmodifiableList(values)));
		}

		return Table.ofTrusted(columns, Collections.unmodifiableList(rows));
	}

	@NonNull
	static List<Column> readColumns(@NonNull ResultSetMetaData resultSetMetaData) throws SQLException {
		requireNonNull(resultSetMetaData);

		int columnCount = resultSetMetaData.getColumnCount();
		List<Column> columns = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i) {
			String label = resultSetMetaData.getColumnLabel(i);

			if (label == null || label.isEmpty())
				label = resultSetMetaData.getColumnName(i);

			columns.add(new Column(i - 1, label == null ? "" : label, resultSetMetaData.getColumnType(i),
					resultSetMetaData.getColumnTypeName(i)));
		}

		return List.copyOf(columns);
	}

	@NonNull
	private static ColumnReader columnReaderFor(@NonNull Column column) {
		requireNonNull(column);

		int sqlType = column.getSqlType();
		String typeName = column.getTypeName().orElse("").toUpperCase(Locale.ROOT);

		// Some drivers report plain TIMESTAMP for zoned columns, so also check the type name
		if (sqlType == Types.TIMESTAMP_WITH_TIMEZONE || typeName.contains("WITH TIME ZONE") || typeName.contains("TIMESTAMPTZ"))
			return sqlType == Types.TIME || sqlType == Types.TIME_WITH_TIMEZONE ? ResultSetReader::readObject : ResultSetReader::readOffsetDateTime;

		switch (sqlType) {
			case Types.TIMESTAMP:
				return ResultSetReader::readLocalDateTime;
			case Types.DATE:
				return ResultSetReader::readLocalDate;
			case Types.TIME:
				return ResultSetReader::readLocalTime;
			case Types.CLOB:
			case Types.NCLOB:
				return ResultSetReader::readClob;
			case Types.BLOB:
				return ResultSetReader::readBlob;
			default:
				return ResultSetReader::readObject;
		}
	}

	@NonNull
	private static DbValue readObject(@NonNull ResultSet resultSet,
																		int columnIndex) throws SQLException {
		return DbValue.of(resultSet.getObject(columnIndex));
	}

	@NonNull
	private static DbValue readLocalDateTime(@NonNull ResultSet resultSet,
																					 int columnIndex) throws SQLException {
		LocalDateTime localDateTime = tryGet(resultSet, columnIndex, LocalDateTime.class);
		return localDateTime == null ? readObject(resultSet, columnIndex) : DbValue.ofTimestamp(localDateTime);
	}

	@NonNull
	private static DbValue readLocalDate(@NonNull ResultSet resultSet,
																			 int columnIndex) throws SQLException {
		LocalDate localDate = tryGet(resultSet, columnIndex, LocalDate.class);
		return localDate == null ? readObject(resultSet, columnIndex) : DbValue.ofDate(localDate);
	}

	@NonNull
	private static DbValue readLocalTime(@NonNull ResultSet resultSet,
																			 int columnIndex) throws SQLException {
		LocalTime localTime = tryGet(resultSet, columnIndex, LocalTime.class);
		return localTime == null ? readObject(resultSet, columnIndex) : DbValue.ofTime(localTime);
	}

	@NonNull
	private static DbValue readOffsetDateTime(@NonNull ResultSet resultSet,
																						int columnIndex) throws SQLException {
		OffsetDateTime offsetDateTime = tryGet(resultSet, columnIndex, OffsetDateTime.class);
		return offsetDateTime == null ? readObject(resultSet, columnIndex) : DbValue.ofTimestampWithOffset(offsetDateTime);
	}

	@NonNull
	private static DbValue readClob(@NonNull ResultSet resultSet,
																	int columnIndex) throws SQLException {
		Object value = resultSet.getObject(columnIndex);

		if (value instanceof Clob clob) {
			try {
				return DbValue.ofText(clob.getSubString(1, lobLength(clob.length(), columnIndex)));
			} finally {
				clob.free();
			}
		}

		return DbValue.of(value);
	}

	@NonNull
	private static DbValue readBlob(@NonNull ResultSet resultSet,
																	int columnIndex) throws SQLException {
		Object value = resultSet.getObject(columnIndex);

		if (value instanceof Blob blob) {
			try {
				return DbValue.ofBytes(blob.getBytes(1, lobLength(blob.length(), columnIndex)));
			} finally {
				blob.free();
			}
		}

		return DbValue.of(value);
	}

	// A LOB is materialized into a single String or byte[], which cannot exceed Integer.MAX_VALUE elements
	private static int lobLength(long length,
															 int columnIndex) {
		try {
			return Math.toIntExact(length);
		} catch (ArithmeticException e) {
			throw new DatabaseException(format("Value of column %d is too large to read (%d characters or bytes)", columnIndex, length), e);
		}
	}

	/**
	 * Tries JDBC 4.2 {@code getObject(int, Class)}.
	 *
	 * @return the value, or {@code null} if it is SQL {@code NULL} or the driver cannot read it as {@code type}
	 */
	@Nullable
	private static <T> T tryGet(@NonNull ResultSet resultSet,
															int columnIndex,
															@NonNull Class<T> type) throws SQLException {
		try {
			return resultSet.getObject(columnIndex, type);
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return null;
		}
	}
}
