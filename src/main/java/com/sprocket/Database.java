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
import javax.sql.DataSource;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main class for calling stored procedures.
 * <p>
 * Every operation acquires its own connection, issues exactly one {@code {call ...}} and releases the statement and
 * connection before returning, whether or not the call succeeded.
 * <pre>{@code  Database database = Database.withConnectionString("jdbc:postgresql://localhost/app?user=app").build();
 *
 * long updated = database.execute("sp_update_counter");
 * int count = database.getScalar("sp_count_items", int.class);
 * Table users = database.getTable("sp_list_users", database.inputParameter("active", true));}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Database {
	/**
	 * Upper bound on the results consumed from a single call, for drivers that never report the end of results.
	 */
	private static final int MAXIMUM_CONSUMED_RESULTS = 65_536;

	@NonNull
	private final ConnectionProvider connectionProvider;
	@NonNull
	private final CallLogger callLogger;
	@NonNull
	private final ValueConverter valueConverter;
	@NonNull
	private final ParameterBinder parameterBinder;
	@NonNull
	private final AtomicLong defaultIdGenerator;
	@NonNull
	private final Logger logger;

	@NonNull
	private volatile DatabaseOperationSupportStatus largeUpdateCountSupported;

	protected Database(@NonNull Builder builder) {
		requireNonNull(builder);

		this.connectionProvider = requireNonNull(builder.connectionProvider);
		this.callLogger = builder.callLogger == null ? (callLog) -> {} : builder.callLogger;
		this.valueConverter = builder.valueConverter == null ? ValueConverter.withDefaultConfiguration() : builder.valueConverter;
		this.parameterBinder = builder.parameterBinder == null ? ParameterBinder.withDefaultConfiguration() : builder.parameterBinder;
		this.defaultIdGenerator = new AtomicLong();
		this.logger = Logger.getLogger(getClass().getName());
		this.largeUpdateCountSupported = DatabaseOperationSupportStatus.UNKNOWN;
	}

	/**
	 * Provides a {@link Database} builder for the given JDBC URL.
	 * <p>
	 * Connections are opened through {@link DriverManager}, one per call, so the URL should carry whatever credentials
	 * and schema the driver needs.
	 *
	 * @param jdbcUrl the JDBC URL, e.g. {@code jdbc:mysql://localhost:3306/app?user=app&password=secret}
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withConnectionString(@NonNull String jdbcUrl) {
		requireNonNull(jdbcUrl);

		if (jdbcUrl.isBlank())
			throw new IllegalArgumentException("JDBC URL must not be blank");

		return new Builder(() -> DriverManager.getConnection(jdbcUrl));
	}

	/**
	 * Provides a {@link Database} builder for the given {@link DataSource}.
	 *
	 * @param dataSource data source used to create the {@link Database} builder
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(dataSource::getConnection);
	}

	/**
	 * Creates an {@link ParameterDirection#INPUT} parameter.
	 *
	 * @param name  the parameter name
	 * @param value the value to bind, may be {@code null}
	 * @return an input parameter
	 */
	@NonNull
	public ProcedureParameter inputParameter(@NonNull String name,
																					 @Nullable Object value) {
		return ProcedureParameter.input(name, value);
	}

	/**
	 * Creates an {@link ParameterDirection#INPUT_OUTPUT} parameter.
	 *
	 * @param name  the parameter name
	 * @param value the value to bind, may be {@code null}
	 * @return an input/output parameter
	 */
	@NonNull
	public ProcedureParameter inputOutputParameter(@NonNull String name,
																								 @Nullable Object value) {
		return ProcedureParameter.inputOutput(name, value);
	}

	/**
	 * Creates an {@link ParameterDirection#INPUT_OUTPUT} parameter registered with an explicit SQL type.
	 *
	 * @param name    the parameter name
	 * @param value   the value to bind, may be {@code null}
	 * @param sqlType a {@link java.sql.Types} code
	 * @return an input/output parameter
	 */
	@NonNull
	public ProcedureParameter inputOutputParameter(@NonNull String name,
																								 @Nullable Object value,
																								 int sqlType) {
		return ProcedureParameter.inputOutput(name, value, sqlType);
	}

	/**
	 * Creates an {@link ParameterDirection#OUTPUT} parameter.
	 *
	 * @param name the parameter name
	 * @return an output parameter
	 */
	@NonNull
	public ProcedureParameter outputParameter(@NonNull String name) {
		return ProcedureParameter.output(name);
	}

	/**
	 * Creates an {@link ParameterDirection#OUTPUT} parameter registered with an explicit SQL type.
	 *
	 * @param name    the parameter name
	 * @param sqlType a {@link java.sql.Types} code
	 * @return an output parameter
	 */
	@NonNull
	public ProcedureParameter outputParameter(@NonNull String name,
																						int sqlType) {
		return ProcedureParameter.output(name, sqlType);
	}

	/**
	 * Calls a stored procedure for its side effects.
	 * <p>
	 * Result sets the procedure produces are closed unread.
	 *
	 * @param procedureName the stored procedure to call
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @return the number of rows affected, summed over every update count the driver reports; 0 if it reports none
	 */
	public long execute(@NonNull String procedureName,
											ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		return performCall(procedureName, parameters, null, 0, 0, (tables, updateCount) -> updateCount);
	}

	/**
	 * Calls a stored procedure and returns the first column of the first row of its first result set.
	 * <p>
	 * With no result set, no row or SQL {@code NULL}, returns the default for {@code type}: zero for numeric types
	 * (primitive or boxed), {@code false}, {@code '\0'}, and {@code null} for everything else.
	 *
	 * @param procedureName the stored procedure to call
	 * @param type          the type to coerce the value to
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @param <T>           the type to be returned
	 * @return the scalar value, or the type's default
	 * @throws TypeMismatchException if the value cannot be coerced to {@code type}
	 */
	@Nullable
	public <T> T getScalar(@NonNull String procedureName,
												 @NonNull Class<T> type,
												 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(type);

		return findScalar(procedureName, type, parameters).orElseGet(() -> DefaultValues.defaultValueFor(type));
	}

	/**
	 * Calls a stored procedure and returns the first column of the first row of its first result set, if there is one.
	 *
	 * @param procedureName the stored procedure to call
	 * @param type          the type to coerce the value to
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @param <T>           the type to be returned
	 * @return the scalar value, empty if there is no result set, no row or SQL {@code NULL}
	 * @throws TypeMismatchException if the value cannot be coerced to {@code type}
	 */
	@NonNull
	public <T> Optional<T> findScalar(@NonNull String procedureName,
																		@NonNull Class<T> type,
																		ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(type);

		Optional<T> scalar = performCall(procedureName, parameters, type, 1, 1, (tables, updateCount) -> {
			if (tables.isEmpty() || tables.get(0).isEmpty() || tables.get(0).getColumns().isEmpty())
				return Optional.empty();

			return getValueConverter().convert(tables.get(0).get(0).get(0), type);
		});

		return scalar == null ? Optional.empty() : scalar;
	}

	/**
	 * Calls a stored procedure and materializes its first result set.
	 *
	 * @param procedureName the stored procedure to call
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @return the first result set, or an empty table with no columns if the procedure produced none
	 */
	@NonNull
	public Table getTable(@NonNull String procedureName,
												ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);

		Table table = performCall(procedureName, parameters, Table.class, 1, Integer.MAX_VALUE,
				(tables, updateCount) -> tables.isEmpty() ? Table.empty() : tables.get(0));

		return table == null ? Table.empty() : table;
	}

	/**
	 * Calls a stored procedure and maps each row of its first result set to a record.
	 *
	 * @param procedureName the stored procedure to call
	 * @param recordMapping how a row populates a record
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @param <T>           the record type
	 * @return one record per row, in row order; empty if the procedure produced no result set
	 * @throws RowMappingException if a row cannot be mapped
	 */
	@NonNull
	public <T> List<T> getTable(@NonNull String procedureName,
															@NonNull RecordMapping<T> recordMapping,
															ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(recordMapping);

		List<T> records = performCall(procedureName, parameters, recordMapping.getRecordType(), 1, Integer.MAX_VALUE,
				(tables, updateCount) -> tables.isEmpty() ? List.of() : recordMapping.mapAll(tables.get(0), getValueConverter()));

		return records == null ? List.of() : records;
	}

	/**
	 * Calls a stored procedure and maps the first row of its first result set to a record.
	 *
	 * @param procedureName the stored procedure to call
	 * @param recordMapping how a row populates a record
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @param <T>           the record type
	 * @return the mapped record, or a freshly constructed one if there is no row
	 * @throws RowMappingException if the row cannot be mapped
	 */
	@NonNull
	public <T> T getRecord(@NonNull String procedureName,
												 @NonNull RecordMapping<T> recordMapping,
												 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(recordMapping);

		return findRecord(procedureName, recordMapping, parameters).orElseGet(recordMapping::newInstance);
	}

	/**
	 * Calls a stored procedure and maps the first row of its first result set to a record, if there is a row.
	 *
	 * @param procedureName the stored procedure to call
	 * @param recordMapping how a row populates a record
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @param <T>           the record type
	 * @return the mapped record, empty if there is no row
	 * @throws RowMappingException if the row cannot be mapped
	 */
	@NonNull
	public <T> Optional<T> findRecord(@NonNull String procedureName,
																		@NonNull RecordMapping<T> recordMapping,
																		ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(recordMapping);

		Optional<T> record = performCall(procedureName, parameters, recordMapping.getRecordType(), 1, 1, (tables, updateCount) -> {
			if (tables.isEmpty() || tables.get(0).isEmpty())
				return Optional.empty();

			return Optional.of(recordMapping.map(tables.get(0).get(0), getValueConverter()));
		});

		return record == null ? Optional.empty() : record;
	}

	/**
	 * Calls a stored procedure and materializes every result set it produces.
	 *
	 * @param procedureName the stored procedure to call
	 * @param parameters    parameters, matched to declared parameters by name when possible, otherwise bound in order
	 * @return the result sets in the order the procedure produced them; empty if it produced none
	 */
	@NonNull
	public List<Table> getData(@NonNull String procedureName,
														 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);

		List<Table> tables = performCall(procedureName, parameters, Table.class, Integer.MAX_VALUE, Integer.MAX_VALUE,
				(materializedTables, updateCount) -> List.copyOf(materializedTables));

		return tables == null ? List.of() : tables;
	}

	/**
	 * Provides a view of this database whose operations run on {@code executor}.
	 *
	 * @param executor runs each call
	 * @return an asynchronous view of this database
	 */
	@NonNull
	public AsyncDatabase async(@NonNull Executor executor) {
		requireNonNull(executor);
		return new AsyncDatabase(this, executor);
	}

	@Nullable
	private <R> R performCall(@NonNull String procedureName,
														ProcedureParameter @Nullable [] parameters,
														@Nullable Class<?> resultType,
														int maximumResultSets,
														int maximumRows,
														@NonNull CallResultsMapper<R> callResultsMapper) {
		requireNonNull(procedureName);
		requireNonNull(callResultsMapper);

		List<ProcedureParameter> parametersAsList = parametersAsList(parameters);
		ProcedureCall procedureCall = ProcedureCall.of(generateId(), procedureName, parametersAsList.size());
		CallContext callContext = CallContext.with(procedureCall)
				.parameters(parametersAsList)
				.resultType(resultType)
				.build();

		ResultHolder<R> resultHolder = new ResultHolder<>();

		performCallOperation(callContext, (CallableStatement callableStatement, List<ProcedureParameter> boundParameters) -> {
			long startTime = nanoTime();
			boolean resultSetAvailable = callableStatement.execute();
			Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);

			startTime = nanoTime();

			List<Table> tables = new ArrayList<>(Math.min(maximumResultSets, 4));
			long updateCount = consumeResults(callableStatement, resultSetAvailable, maximumResultSets, maximumRows, tables);

			readOutputParameters(callContext, callableStatement, boundParameters);
			resultHolder.value = callResultsMapper.map(tables, updateCount);

			Duration resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
			return new DatabaseOperationResult(executionDuration, resultSetMappingDuration, tables.size());
		});

		return resultHolder.value;
	}

	@NonNull
	private static List<ProcedureParameter> parametersAsList(ProcedureParameter @Nullable [] parameters) {
		if (parameters == null)
			return List.of();

		for (int i = 0; i < parameters.length; ++i)
			if (parameters[i] == null)
				throw new NullPointerException(format("Parameter at index %d is null", i));

		return List.copyOf(Arrays.asList(parameters));
	}

	/**
	 * Walks every result of an executed call.  The first {@code maximumResultSets} result sets are materialized into
	 * {@code tables}; any others are closed unread.
	 *
	 * @return the sum of the update counts the driver reported
	 */
	protected long consumeResults(@NonNull CallableStatement callableStatement,
																boolean resultSetAvailable,
																int maximumResultSets,
																int maximumRows,
																@NonNull List<Table> tables) throws SQLException {
		requireNonNull(callableStatement);
		requireNonNull(tables);

		long totalUpdateCount = 0;
		boolean resultSet = resultSetAvailable;

		for (int consumedResults = 0; consumedResults < MAXIMUM_CONSUMED_RESULTS; ++consumedResults) {
			if (resultSet) {
				try (ResultSet currentResultSet = callableStatement.getResultSet()) {
					if (currentResultSet != null && tables.size() < maximumResultSets)
						tables.add(ResultSetReader.readTable(currentResultSet, maximumRows));
				}
			} else {
				long updateCount = getUpdateCount(callableStatement);

				if (updateCount == -1)
					return totalUpdateCount;

				// Some drivers report SUCCESS_NO_INFO (-2) for statements inside a procedure
				if (updateCount > 0)
					totalUpdateCount += updateCount;
			}

			resultSet = callableStatement.getMoreResults();
		}

		getLogger().log(WARNING, format("Stopped reading results after %d; the driver did not report the end of results",
				MAXIMUM_CONSUMED_RESULTS));

		return totalUpdateCount;
	}

	/**
	 * Determines the order in which the call's parameters are bound.  By default they follow the procedure's declared
	 * parameter order when the driver can describe it and every parameter name matches; otherwise the order supplied.
	 *
	 * @param connection  the connection the call will run on
	 * @param callContext the call being made
	 * @return the parameters in binding order
	 * @throws SQLException if procedure metadata cannot be read
	 */
	@NonNull
	protected List<ProcedureParameter> orderParameters(@NonNull Connection connection,
																										 @NonNull CallContext callContext) throws SQLException {
		requireNonNull(connection);
		requireNonNull(callContext);

		return ProcedureMetadataReader.orderParameters(connection, callContext.getProcedureCall(), callContext.getParameters());
	}

	protected void readOutputParameters(@NonNull CallContext callContext,
																			@NonNull CallableStatement callableStatement,
																			@NonNull List<ProcedureParameter> parameters) throws SQLException {
		requireNonNull(callContext);
		requireNonNull(callableStatement);
		requireNonNull(parameters);

		for (int i = 0; i < parameters.size(); ++i) {
			ProcedureParameter parameter = parameters.get(i);

			if (parameter.getDirection().isOutput())
				parameter.setOutputValue(getParameterBinder().readOutputParameter(callContext, callableStatement, i + 1, parameter));
		}
	}

	protected long getUpdateCount(@NonNull CallableStatement callableStatement) throws SQLException {
		requireNonNull(callableStatement);

		DatabaseOperationSupportStatus largeUpdateCountSupported = getLargeUpdateCountSupported();

		// Use the appropriate "large" value if we know it.
		// If we don't know it, detect it and store it.
		if (largeUpdateCountSupported == DatabaseOperationSupportStatus.YES)
			return callableStatement.getLargeUpdateCount();

		if (largeUpdateCountSupported == DatabaseOperationSupportStatus.NO)
			return callableStatement.getUpdateCount();

		// If the driver doesn't support getLargeUpdateCount, then UnsupportedOperationException is thrown.
		try {
			long updateCount = callableStatement.getLargeUpdateCount();
			setLargeUpdateCountSupported(DatabaseOperationSupportStatus.YES);
			return updateCount;
		} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
			setLargeUpdateCountSupported(DatabaseOperationSupportStatus.NO);
			return callableStatement.getUpdateCount();
		}
	}

	protected void performCallOperation(@NonNull CallContext callContext,
																			@NonNull CallOperation callOperation) {
		requireNonNull(callContext);
		requireNonNull(callOperation);

		long startTime = nanoTime();
		Duration connectionAcquisitionDuration = null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultSetMappingDuration = null;
		Integer resultSetCount = null;
		Exception exception = null;
		Throwable thrown = null;
		Connection connection = null;
		String procedureName = callContext.getProcedureCall().getProcedureName();

		try {
			connection = acquireConnection();
			connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			List<ProcedureParameter> boundParameters = orderParameters(connection, callContext);

			try (CallableStatement callableStatement = connection.prepareCall(callContext.getProcedureCall().getSql())) {
				// JDBC parameters are 1-based
				for (int i = 0; i < boundParameters.size(); ++i)
					getParameterBinder().bindParameter(callContext, callableStatement, i + 1, boundParameters.get(i));

				preparationDuration = Duration.ofNanos(nanoTime() - startTime);

				DatabaseOperationResult databaseOperationResult = callOperation.perform(callableStatement, boundParameters);
				executionDuration = databaseOperationResult.getExecutionDuration().orElse(null);
				resultSetMappingDuration = databaseOperationResult.getResultSetMappingDuration().orElse(null);
				resultSetCount = databaseOperationResult.getResultSetCount();
			}
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} catch (Exception e) {
			exception = e;
			DatabaseException wrapped = new DatabaseException(format("Unable to call stored procedure %s", procedureName), e, procedureName);
			thrown = wrapped;
			throw wrapped;
		} finally {
			Throwable cleanupFailure = null;

			if (connection != null) {
				try {
					closeConnection(connection);
				} catch (Throwable cleanupException) {
					cleanupFailure = cleanupException;
				}
			}

			CallLog callLog = CallLog.withCallContext(callContext)
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.resultSetMappingDuration(resultSetMappingDuration)
					.resultSetCount(resultSetCount)
					.exception(exception)
					.build();

			try {
				getCallLogger().log(callLog);
			} catch (Throwable cleanupException) {
				if (cleanupFailure == null)
					cleanupFailure = cleanupException;
				else
					cleanupFailure.addSuppressed(cleanupException);
			}

			if (cleanupFailure != null) {
				if (thrown != null) {
					thrown.addSuppressed(cleanupFailure);
				} else if (cleanupFailure instanceof RuntimeException) {
					throw (RuntimeException) cleanupFailure;
				} else if (cleanupFailure instanceof Error) {
					throw (Error) cleanupFailure;
				} else {
					throw new RuntimeException(cleanupFailure);
				}
			}
		}
	}

	@NonNull
	protected Connection acquireConnection() {
		try {
			Connection connection = getConnectionProvider().getConnection();

			if (connection == null)
				throw new SQLException("Connection source returned no connection");

			return connection;
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	protected void closeConnection(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			connection.close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	@NonNull
	protected ConnectionProvider getConnectionProvider() {
		return this.connectionProvider;
	}

	@NonNull
	protected CallLogger getCallLogger() {
		return this.callLogger;
	}

	@NonNull
	protected ValueConverter getValueConverter() {
		return this.valueConverter;
	}

	@NonNull
	protected ParameterBinder getParameterBinder() {
		return this.parameterBinder;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected DatabaseOperationSupportStatus getLargeUpdateCountSupported() {
		return this.largeUpdateCountSupported;
	}

	protected void setLargeUpdateCountSupported(@NonNull DatabaseOperationSupportStatus largeUpdateCountSupported) {
		requireNonNull(largeUpdateCountSupported);
		this.largeUpdateCountSupported = largeUpdateCountSupported;
	}

	@NonNull
	protected Object generateId() {
		// "Unique" keys
		return format("com.sprocket.%s", this.defaultIdGenerator.incrementAndGet());
	}

	@FunctionalInterface
	protected interface ConnectionProvider {
		@NonNull
		Connection getConnection() throws SQLException;
	}

	@FunctionalInterface
	protected interface CallOperation {
		@NonNull
		DatabaseOperationResult perform(@NonNull CallableStatement callableStatement,
																		@NonNull List<ProcedureParameter> boundParameters) throws Exception;
	}

	@FunctionalInterface
	private interface CallResultsMapper<R> {
		@Nullable
		R map(@NonNull List<Table> tables,
					long updateCount);
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final ConnectionProvider connectionProvider;
		@Nullable
		private CallLogger callLogger;
		@Nullable
		private ValueConverter valueConverter;
		@Nullable
		private ParameterBinder parameterBinder;

		private Builder(@NonNull ConnectionProvider connectionProvider) {
			this.connectionProvider = requireNonNull(connectionProvider);
		}

		@NonNull
		public Builder callLogger(@Nullable CallLogger callLogger) {
			this.callLogger = callLogger;
			return this;
		}

		@NonNull
		public Builder valueConverter(@Nullable ValueConverter valueConverter) {
			this.valueConverter = valueConverter;
			return this;
		}

		@NonNull
		public Builder parameterBinder(@Nullable ParameterBinder parameterBinder) {
			this.parameterBinder = parameterBinder;
			return this;
		}

		@NonNull
		public Database build() {
			return new Database(this);
		}
	}

	@ThreadSafe
	static class DatabaseOperationResult {
		@Nullable
		private final Duration executionDuration;
		@Nullable
		private final Duration resultSetMappingDuration;
		private final int resultSetCount;

		public DatabaseOperationResult(@Nullable Duration executionDuration,
																	 @Nullable Duration resultSetMappingDuration,
																	 int resultSetCount) {
			this.executionDuration = executionDuration;
			this.resultSetMappingDuration = resultSetMappingDuration;
			this.resultSetCount = resultSetCount;
		}

		@NonNull
		public Optional<Duration> getExecutionDuration() {
			return Optional.ofNullable(this.executionDuration);
		}

		@NonNull
		public Optional<Duration> getResultSetMappingDuration() {
			return Optional.ofNullable(this.resultSetMappingDuration);
		}

		public int getResultSetCount() {
			return this.resultSetCount;
		}
	}

	@NotThreadSafe
	static class ResultHolder<T> {
		T value;
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}
}
