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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A stored procedure invocation: an identifier for logging, the procedure name and the number of parameters.
 * <p>
 * The JDBC text is always a call escape, {@code {call name(?, ?)}}; the procedure name is never treated as SQL.
 * Names may be schema-qualified ({@code billing.close_month}) and each part may be quoted with double quotes,
 * backticks or square brackets. Unquoted parts may start with a digit but may not consist only of digits.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ProcedureCall {
	@NonNull
	private static final Pattern NAME_PART_PATTERN;
	@NonNull
	private static final Pattern PROCEDURE_NAME_PATTERN;

	static {
		// Unquoted parts may start with a digit (MySQL allows it) but may not be all digits
		String part = "(?:(?!\\p{N}+(?![\\p{L}\\p{N}_$#@]))[\\p{L}\\p{N}_][\\p{L}\\p{N}_$#@]*|\"(?:[^\"]|\"\")+\"|`[^`]+`|\\[[^\\]]+\\])";
		NAME_PART_PATTERN = Pattern.compile(part);
		PROCEDURE_NAME_PATTERN = Pattern.compile(format("%s(?:\\.%s){0,2}", part, part));
	}

	@NonNull
	private final Object id;
	@NonNull
	private final String procedureName;
	private final int parameterCount;
	@NonNull
	private final String sql;

	private ProcedureCall(@NonNull Object id,
												@NonNull String procedureName,
												int parameterCount) {
		this.id = id;
		this.procedureName = procedureName;
		this.parameterCount = parameterCount;
		this.sql = buildSql(procedureName, parameterCount);
	}

	/**
	 * Factory method for providing {@link ProcedureCall} instances.
	 *
	 * @param id             the call's identifier
	 * @param procedureName  the stored procedure to call
	 * @param parameterCount how many parameters will be bound
	 * @return a procedure call
	 * @throws IllegalArgumentException if {@code procedureName} is not a valid procedure identifier
	 */
	@NonNull
	public static ProcedureCall of(@NonNull Object id,
																 @NonNull String procedureName,
																 int parameterCount) {
		requireNonNull(id);
		requireNonNull(procedureName);

		if (!isValidProcedureName(procedureName))
			throw new IllegalArgumentException(format("'%s' is not a valid stored procedure name", procedureName));

		if (parameterCount < 0)
			throw new IllegalArgumentException("Parameter count must be >= 0");

		return new ProcedureCall(id, procedureName, parameterCount);
	}

	/**
	 * Is {@code procedureName} an optionally qualified, optionally quoted identifier?
	 *
	 * @param procedureName the name to check
	 * @return {@code true} if the name can be placed in a call escape
	 */
	public static boolean isValidProcedureName(@NonNull String procedureName) {
		requireNonNull(procedureName);
		return PROCEDURE_NAME_PATTERN.matcher(procedureName).matches();
	}

	/**
	 * Splits the procedure name into its catalog, schema and procedure parts, as written (quotes included).
	 *
	 * @return one to three name parts, the procedure itself last
	 */
	@NonNull
	List<String> getNameParts() {
		List<String> nameParts = new ArrayList<>(3);
		Matcher matcher = NAME_PART_PATTERN.matcher(getProcedureName());

		while (matcher.find())
			nameParts.add(matcher.group());

		return nameParts;
	}

	@NonNull
	private static String buildSql(@NonNull String procedureName,
																 int parameterCount) {
		StringBuilder sql = new StringBuilder(procedureName.length() + 10 + parameterCount * 3);
		sql.append("{call ").append(procedureName).append('(');

		for (int i = 0; i < parameterCount; ++i) {
			if (i > 0)
				sql.append(", ");
			sql.append('?');
		}

		return sql.append(")}").toString();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getProcedureName(), getParameterCount());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ProcedureCall))
			return false;

		ProcedureCall procedureCall = (ProcedureCall) object;

		return Objects.equals(procedureCall.getId(), getId())
				&& Objects.equals(procedureCall.getProcedureName(), getProcedureName())
				&& procedureCall.getParameterCount() == getParameterCount();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, sql=%s}", getClass().getSimpleName(), getId(), getSql());
	}

	@NonNull
	public Object getId() {
		return this.id;
	}

	@NonNull
	public String getProcedureName() {
		return this.procedureName;
	}

	public int getParameterCount() {
		return this.parameterCount;
	}

	/**
	 * The JDBC call escape sent to the driver.
	 *
	 * @return the JDBC text for this call
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}
}
