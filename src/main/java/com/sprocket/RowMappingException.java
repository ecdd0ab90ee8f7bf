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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link Row} cannot populate a record through its {@link RecordMapping}, either because a mapped
 * column is missing from the result set or because a value cannot be coerced to the field type.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class RowMappingException extends DatabaseException {
	@NonNull
	private final Class<?> recordType;
	@NonNull
	private final String mappedColumn;
	private final int rowIndex;

	/**
	 * Creates a {@code RowMappingException}.
	 *
	 * @param message      a message describing this exception
	 * @param recordType   the record type being populated
	 * @param mappedColumn the offending column, as declared in the mapping (a label or a position)
	 * @param rowIndex     zero-based index of the row being mapped, or {@code -1} if the failure is not row-specific
	 * @param cause        the underlying failure, if any
	 */
	public RowMappingException(@NonNull String message,
														 @NonNull Class<?> recordType,
														 @NonNull String mappedColumn,
														 int rowIndex,
														 @Nullable Throwable cause) {
		super(requireNonNull(message), cause);

		this.recordType = requireNonNull(recordType);
		this.mappedColumn = requireNonNull(mappedColumn);
		this.rowIndex = rowIndex;
	}

	@NonNull
	public Class<?> getRecordType() {
		return this.recordType;
	}

	/**
	 * @return the offending column as declared in the mapping, e.g. {@code 'email'} or {@code #2}
	 */
	@NonNull
	public String getMappedColumn() {
		return this.mappedColumn;
	}

	/**
	 * @return zero-based index of the offending row, or {@code -1} if the failure happened before any row was mapped
	 */
	public int getRowIndex() {
		return this.rowIndex;
	}
}
