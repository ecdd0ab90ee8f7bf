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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes one column of a result set, as reported by {@link java.sql.ResultSetMetaData}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Column {
	private final int index;
	@NonNull
	private final String label;
	private final int sqlType;
	@Nullable
	private final String typeName;

	/**
	 * Creates a column descriptor.
	 *
	 * @param index    zero-based position of the column in its row
	 * @param label    the column label (alias if one was given, else the column name)
	 * @param sqlType  the {@link java.sql.Types} code reported by the driver
	 * @param typeName the database-specific type name, if known
	 */
	public Column(int index,
								@NonNull String label,
								int sqlType,
								@Nullable String typeName) {
		requireNonNull(label);

		if (index < 0)
			throw new IllegalArgumentException("Column index must be >= 0");

		this.index = index;
		this.label = label;
		this.sqlType = sqlType;
		this.typeName = typeName;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Column))
			return false;

		Column column = (Column) object;

		return getIndex() == column.getIndex()
				&& getSqlType() == column.getSqlType()
				&& Objects.equals(getLabel(), column.getLabel())
				&& Objects.equals(getTypeName(), column.getTypeName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getIndex(), getLabel(), getSqlType(), getTypeName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{index=%d, label=%s, sqlType=%d, typeName=%s}", getClass().getSimpleName(),
				getIndex(), getLabel(), getSqlType(), getTypeName().orElse(null));
	}

	public int getIndex() {
		return this.index;
	}

	@NonNull
	public String getLabel() {
		return this.label;
	}

	public int getSqlType() {
		return this.sqlType;
	}

	@NonNull
	public Optional<String> getTypeName() {
		return Optional.ofNullable(this.typeName);
	}
}
