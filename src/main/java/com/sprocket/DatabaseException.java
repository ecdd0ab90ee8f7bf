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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when calling a stored procedure through a {@link Database} fails.
 * <p>
 * The driver's exception is always kept as the {@code cause}.  If it is a {@link SQLException}, {@link #getErrorCode()}
 * and {@link #getSqlState()} are shorthand for its vendor code and SQLSTATE.  For PostgreSQL, the server's structured
 * error fields (detail, hint, routine, where, ...) are exposed as well, which is where PL/pgSQL {@code RAISE}
 * diagnostics end up.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final String procedureName;
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final String dbmsMessage;
	@Nullable
	private final String detail;
	@Nullable
	private final String hint;
	@Nullable
	private final String routine;
	@Nullable
	private final String where;
	@Nullable
	private final String schema;
	@Nullable
	private final String table;
	@Nullable
	private final String column;
	@Nullable
	private final String constraint;
	@Nullable
	private final String severity;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		this(message, cause, null);
	}

	/**
	 * Creates a {@code DatabaseException} for a failed call to the given stored procedure.
	 *
	 * @param message       a message describing this exception
	 * @param cause         the cause of this exception
	 * @param procedureName the stored procedure that was being called
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause,
													 @Nullable String procedureName) {
		super(message, cause);

		Integer errorCode = null;
		String sqlState = null;
		String dbmsMessage = null;
		String detail = null;
		String hint = null;
		String routine = null;
		String where = null;
		String schema = null;
		String table = null;
		String column = null;
		String constraint = null;
		String severity = null;

		if (cause != null) {
			// Postgres carries structured server diagnostics; the driver is optional at runtime
			if ("org.postgresql.util.PSQLException".equals(cause.getClass().getName())) {
				org.postgresql.util.PSQLException psqlException = (org.postgresql.util.PSQLException) cause;
				org.postgresql.util.ServerErrorMessage serverErrorMessage = psqlException.getServerErrorMessage();

				errorCode = psqlException.getErrorCode();
				sqlState = psqlException.getSQLState();

				if (serverErrorMessage != null) {
					dbmsMessage = serverErrorMessage.getMessage();
					detail = serverErrorMessage.getDetail();
					hint = serverErrorMessage.getHint();
					routine = serverErrorMessage.getRoutine();
					where = serverErrorMessage.getWhere();
					schema = serverErrorMessage.getSchema();
					table = serverErrorMessage.getTable();
					column = serverErrorMessage.getColumn();
					constraint = serverErrorMessage.getConstraint();
					severity = serverErrorMessage.getSeverity();
				}
			} else if (cause instanceof SQLException sqlException) {
				errorCode = sqlException.getErrorCode();
				sqlState = sqlException.getSQLState();
			} else if (cause instanceof DatabaseException databaseException) {
				errorCode = databaseException.getErrorCode().orElse(null);
				sqlState = databaseException.getSqlState().orElse(null);
				procedureName = procedureName == null ? databaseException.getProcedureName().orElse(null) : procedureName;
			}
		}

		this.procedureName = procedureName;
		this.errorCode = errorCode;
		this.sqlState = sqlState;
		this.dbmsMessage = dbmsMessage;
		this.detail = detail;
		this.hint = hint;
		this.routine = routine;
		this.where = where;
		this.schema = schema;
		this.table = table;
		this.column = column;
		this.constraint = constraint;
		this.severity = severity;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(14);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		getProcedureName().ifPresent(value -> components.add(format("procedureName=%s", value)));
		getErrorCode().ifPresent(value -> components.add(format("errorCode=%s", value)));
		getSqlState().ifPresent(value -> components.add(format("sqlState=%s", value)));
		getDbmsMessage().ifPresent(value -> components.add(format("dbmsMessage=%s", value)));
		getDetail().ifPresent(value -> components.add(format("detail=%s", value)));
		getHint().ifPresent(value -> components.add(format("hint=%s", value)));
		getRoutine().ifPresent(value -> components.add(format("routine=%s", value)));
		getWhere().ifPresent(value -> components.add(format("where=%s", value)));
		getSchema().ifPresent(value -> components.add(format("schema=%s", value)));
		getTable().ifPresent(value -> components.add(format("table=%s", value)));
		getColumn().ifPresent(value -> components.add(format("column=%s", value)));
		getConstraint().ifPresent(value -> components.add(format("constraint=%s", value)));
		getSeverity().ifPresent(value -> components.add(format("severity=%s", value)));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * @return the stored procedure being called when this exception occurred, if known
	 */
	@NonNull
	public Optional<String> getProcedureName() {
		return Optional.ofNullable(this.procedureName);
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	@NonNull
	public Optional<String> getDbmsMessage() {
		return Optional.ofNullable(this.dbmsMessage);
	}

	@NonNull
	public Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	@NonNull
	public Optional<String> getHint() {
		return Optional.ofNullable(this.hint);
	}

	/**
	 * @return the server-side routine that raised the error, if reported
	 */
	@NonNull
	public Optional<String> getRoutine() {
		return Optional.ofNullable(this.routine);
	}

	/**
	 * @return the server-side call stack ("where" context) of the error, if reported
	 */
	@NonNull
	public Optional<String> getWhere() {
		return Optional.ofNullable(this.where);
	}

	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	@NonNull
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}

	@NonNull
	public Optional<String> getColumn() {
		return Optional.ofNullable(this.column);
	}

	@NonNull
	public Optional<String> getConstraint() {
		return Optional.ofNullable(this.constraint);
	}

	@NonNull
	public Optional<String> getSeverity() {
		return Optional.ofNullable(this.severity);
	}
}
