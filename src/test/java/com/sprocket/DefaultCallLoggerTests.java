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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * @since 1.0.0
 */
public class DefaultCallLoggerTests {
	@Test
	public void testFormatsSqlParametersAndTimings() {
		CallContext callContext = CallContext.with(ProcedureCall.of("test", "sp_save_user", 3))
				.parameters(ProcedureParameter.input("name", "Alice"),
						ProcedureParameter.input("photo", new byte[]{1, 2, 3}),
						ProcedureParameter.output("id"))
				.build();

		CallLog callLog = CallLog.withCallContext(callContext)
				.connectionAcquisitionDuration(Duration.ofMillis(2))
				.executionDuration(Duration.ofMillis(5))
				.build();

		String formatted = new DefaultCallLogger().formatCallLog(callLog);
		String[] lines = formatted.split("\n");

		Assertions.assertEquals("{call sp_save_user(?, ?, ?)}", lines[0], "First line should be the call");
		Assertions.assertEquals("Parameters: INPUT name='Alice', INPUT photo=[byte array of length 3], OUTPUT id=null", lines[1],
				"Wrong parameter line");
		Assertions.assertEquals("PT0.002S acquiring connection, PT0.005S executing call", lines[2], "Wrong timing line");
		Assertions.assertEquals(Duration.ofMillis(7), callLog.getTotalDuration(), "Total should sum the durations");
	}

	@Test
	public void testEllipsizesLongValues() {
		String longValue = "x".repeat(150);
		CallContext callContext = CallContext.with(ProcedureCall.of("test", "sp_note", 1))
				.parameters(ProcedureParameter.input("note", longValue))
				.build();

		String formatted = new DefaultCallLogger().formatCallLog(CallLog.withCallContext(callContext).build());

		Assertions.assertTrue(formatted.contains("'" + "x".repeat(100) + "...'"), "Expected value to be ellipsized");
		Assertions.assertFalse(formatted.contains(longValue), "Full value should not be logged");
	}

	@Test
	public void testReportsUnderlyingFailure() {
		CallContext callContext = CallContext.with(ProcedureCall.of("test", "sp_fail", 0)).build();
		CallLog callLog = CallLog.withCallContext(callContext)
				.exception(new DatabaseException("Unable to call stored procedure sp_fail", new SQLException("boom")))
				.build();

		String formatted = new DefaultCallLogger().formatCallLog(callLog);

		Assertions.assertTrue(formatted.endsWith("Failed due to java.sql.SQLException: boom"), "Expected the driver error");
	}

	@Test
	public void testLogsThroughJavaUtilLogging() {
		List<LogRecord> logRecords = new ArrayList<>();
		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord record) {
				logRecords.add(record);
			}

			@Override
			public void flush() {}

			@Override
			public void close() {}
		};

		Logger logger = Logger.getLogger(DefaultCallLogger.DEFAULT_LOGGER_NAME);
		Level originalLevel = logger.getLevel();
		logger.setLevel(Level.FINE);
		logger.addHandler(handler);

		try {
			CallContext callContext = CallContext.with(ProcedureCall.of("test", "sp_ping", 0)).build();
			new DefaultCallLogger().log(CallLog.withCallContext(callContext).build());
		} finally {
			logger.removeHandler(handler);
			logger.setLevel(originalLevel);
		}

		Assertions.assertEquals(1, logRecords.size(), "Expected one log record");
		Assertions.assertEquals(Level.FINE, logRecords.get(0).getLevel(), "Wrong level");
		Assertions.assertEquals("{call sp_ping()}", logRecords.get(0).getMessage(), "Wrong message");
	}
}
