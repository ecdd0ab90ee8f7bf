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
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link CallLogger} which logs via <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.logging/java/util/logging/package-summary.html">java.util.logging</a>.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultCallLogger implements CallLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.sprocket.CALL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new call logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultCallLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new call logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultCallLogger(@NonNull String loggerName,
													 @NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull CallLog callLog) {
		requireNonNull(callLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatCallLog(callLog));
	}

	@NonNull
	protected String formatCallLog(@NonNull CallLog callLog) {
		requireNonNull(callLog);

		List<String> timingEntries = new ArrayList<>(4);

		if (callLog.getConnectionAcquisitionDuration().isPresent())
			timingEntries.add(format("%s acquiring connection", callLog.getConnectionAcquisitionDuration().get()));

		if (callLog.getPreparationDuration().isPresent())
			timingEntries.add(format("%s preparing call", callLog.getPreparationDuration().get()));

		if (callLog.getExecutionDuration().isPresent())
			timingEntries.add(format("%s executing call", callLog.getExecutionDuration().get()));

		if (callLog.getResultSetMappingDuration().isPresent())
			timingEntries.add(format("%s processing %s", callLog.getResultSetMappingDuration().get(),
					callLog.getResultSetCount().orElse(0) == 1 ? "1 resultset" : format("%d resultsets", callLog.getResultSetCount().orElse(0))));

		String parameterLine = null;
		List<ProcedureParameter> parameters = callLog.getCallContext().getParameters();

		if (parameters.size() > 0) {
			parameterLine = format("Parameters: %s", parameters.stream()
					.map(parameter -> format("%s %s=%s", parameter.getDirection(), parameter.getName(), formatValue(parameter.getValue().orElse(null))))
					.collect(joining(", ")));
		}

		List<String> lines = new ArrayList<>(4);

		lines.add(callLog.getCallContext().getProcedureCall().getSql());

		if (parameterLine != null)
			lines.add(parameterLine);

		if (timingEntries.size() > 0)
			lines.add(timingEntries.stream().collect(joining(", ")));

		Throwable exception = callLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception.toString()));
		}

		return lines.stream().collect(joining("\n"));
	}

	@NonNull
	protected String formatValue(Object value) {
		if (value == null)
			return "null";

		if (value instanceof Number || value instanceof Boolean)
			return format("%s", value);

		if (value instanceof byte[])
			return format("[byte array of length %d]", ((byte[]) value).length);

		return format("'%s'", ellipsize(value.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
