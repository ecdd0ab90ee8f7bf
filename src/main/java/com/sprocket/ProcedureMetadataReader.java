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
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Matches call parameters to a stored procedure's declared parameters by name, using
 * {@link DatabaseMetaData#getProcedureColumns(String, String, String, String)}.
 * <p>
 * When every supplied parameter name identifies a distinct declared parameter of exactly one procedure, the
 * parameters are bound in declaration order, so callers may supply them in any order.  Otherwise, including when the
 * driver does not describe procedure columns, they are bound in the order supplied.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class ProcedureMetadataReader {
	private ProcedureMetadataReader() {
		// Non-instantiable
	}

	/**
	 * Orders {@code parameters} the way the procedure declares them.
	 *
	 * @param connection    the connection the call will run on
	 * @param procedureCall the call being made
	 * @param parameters    parameters in the order the caller supplied them
	 * @return the parameters in binding order
	 * @throws SQLException if the driver fails while reading procedure metadata
	 */
	@NonNull
	static List<ProcedureParameter> orderParameters(@NonNull Connection connection,
																									@NonNull ProcedureCall procedureCall,
																									@NonNull List<ProcedureParameter> parameters) throws SQLException {
		requireNonNull(connection);
		requireNonNull(procedureCall);
		requireNonNull(parameters);

		if (parameters.size() < 2)
			return parameters;

		DatabaseMetaData databaseMetaData = connection.getMetaData();

		if (databaseMetaData == null)
			return parameters;

		Map<String, Map<String, Integer>> ordinalsByRoutine;

		try {
			ordinalsByRoutine = readDeclaredParameters(databaseMetaData, procedureCall);
		} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
			return parameters;
		}

		Map<String, Integer> matchedOrdinals = null;

		for (Map<String, Integer> ordinalsByName : ordinalsByRoutine.values()) {
			if (!matchesEveryParameter(ordinalsByName, parameters))
				continue;

			// Overloads that accept the same names are ambiguous
			if (matchedOrdinals != null)
				return parameters;

			matchedOrdinals = ordinalsByName;
		}

		if (matchedOrdinals == null)
			return parameters;

		Map<String, Integer> ordinalsByName = matchedOrdinals;
		List<ProcedureParameter> orderedParameters = new ArrayList<>(parameters);
		orderedParameters.sort(Comparator.comparingInt(parameter -> ordinalsByName.get(normalizeParameterName(parameter.getName()))));

		return List.copyOf(orderedParameters);
	}

	/**
	 * @return declared parameter ordinals keyed by normalized name, for each routine matching the call's name
	 */
	@NonNull
	private static Map<String, Map<String, Integer>> readDeclaredParameters(@NonNull DatabaseMetaData databaseMetaData,
																																					@NonNull ProcedureCall procedureCall) throws SQLException {
		List<String> nameParts = procedureCall.getNameParts();
		String procedureName = toIdentifier(databaseMetaData, nameParts.get(nameParts.size() - 1));
		String schema = nameParts.size() >= 2 ? toIdentifier(databaseMetaData, nameParts.get(nameParts.size() - 2)) : null;
		String catalog = nameParts.size() == 3 ? toIdentifier(databaseMetaData, nameParts.get(0)) : null;
		String searchStringEscape = databaseMetaData.getSearchStringEscape();

		Map<String, Map<String, Integer>> ordinalsByRoutine = new LinkedHashMap<>();

		try (ResultSet resultSet = databaseMetaData.getProcedureColumns(catalog, toSearchPattern(schema, searchStringEscape),
				toSearchPattern(procedureName, searchStringEscape), "%")) {
			ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
			boolean ordinalPositionAvailable = hasColumn(resultSetMetaData, "ORDINAL_POSITION");
			boolean specificNameAvailable = hasColumn(resultSetMetaData, "SPECIFIC_NAME");
			int rowNumber = 0;

			while (resultSet.next()) {
				++rowNumber;

				// Search patterns may match more than the requested name
				if (!procedureName.equalsIgnoreCase(resultSet.getString("PROCEDURE_NAME")))
					continue;

				short columnType = resultSet.getShort("COLUMN_TYPE");

				if (columnType != DatabaseMetaData.procedureColumnIn
						&& columnType != DatabaseMetaData.procedureColumnInOut
						&& columnType != DatabaseMetaData.procedureColumnOut)
					continue;

				String columnName = resultSet.getString("COLUMN_NAME");

				if (columnName == null)
					continue;

				String routine = format("%s.%s.%s", resultSet.getString("PROCEDURE_CAT"), resultSet.getString("PROCEDURE_SCHEM"),
						specificNameAvailable ? resultSet.getString("SPECIFIC_NAME") : procedureName);
				int ordinal = ordinalPositionAvailable ? resultSet.getInt("ORDINAL_POSITION") : rowNumber;

				ordinalsByRoutine.computeIfAbsent(routine, ignored -> new HashMap<>())
						.putIfAbsent(normalizeParameterName(columnName), ordinal);
			}
		}

		return ordinalsByRoutine;
	}

	private static boolean matchesEveryParameter(@NonNull Map<String, Integer> ordinalsByName,
																							 @NonNull List<ProcedureParameter> parameters) {
		List<String> matchedNames = new ArrayList<>(parameters.size());

		for (ProcedureParameter parameter : parameters) {
			String name = normalizeParameterName(parameter.getName());

			if (!ordinalsByName.containsKey(name) || matchedNames.contains(name))
				return false;

			matchedNames.add(name);
		}

		return true;
	}

	/**
	 * Parameter names are compared case-insensitively and without a leading {@code @} or {@code :} marker.
	 */
	@NonNull
	static String normalizeParameterName(@NonNull String parameterName) {
		requireNonNull(parameterName);

		String name = parameterName.trim();

		if (name.startsWith("@") || name.startsWith(":"))
			name = name.substring(1);

		return name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Converts a name part as written in the call to the form the database stores it in.
	 */
	@NonNull
	static String toIdentifier(@NonNull DatabaseMetaData databaseMetaData,
														 @NonNull String namePart) throws SQLException {
		requireNonNull(databaseMetaData);
		requireNonNull(namePart);

		char first = namePart.charAt(0);

		if (first == '"')
			return namePart.substring(1, namePart.length() - 1).replace("\"\"", "\"");

		if (first == '`' || first == '[')
			return namePart.substring(1, namePart.length() - 1);

		if (databaseMetaData.storesUpperCaseIdentifiers())
			return namePart.toUpperCase(Locale.ROOT);

		if (databaseMetaData.storesLowerCaseIdentifiers())
			return namePart.toLowerCase(Locale.ROOT);

		return namePart;
	}

	@Nullable
	private static String toSearchPattern(@Nullable String identifier,
																				@Nullable String searchStringEscape) {
		if (identifier == null || searchStringEscape == null || searchStringEscape.isEmpty())
			return identifier;

		return identifier.replace(searchStringEscape, searchStringEscape + searchStringEscape)
				.replace("_", searchStringEscape + "_")
				.replace("%", searchStringEscape + "%");
	}

	private static boolean hasColumn(@NonNull ResultSetMetaData resultSetMetaData,
																	 @NonNull String columnLabel) throws SQLException {
		for (int i = 1; i <= resultSetMetaData.getColumnCount(); ++i)
			if (columnLabel.equalsIgnoreCase(resultSetMetaData.getColumnLabel(i)))
				return true;

		return false;
	}
}
