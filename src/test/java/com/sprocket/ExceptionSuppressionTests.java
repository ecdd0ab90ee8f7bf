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

import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class ExceptionSuppressionTests {
	@Test
	public void testCallLoggerExceptionSuppressedWhenCallFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		CallLogger callLogger = (callLog) -> {
			throw loggerFailure;
		};

		Database database = Database.withDataSource(createInMemoryDataSource("logger_suppressed"))
				.callLogger(callLogger)
				.build();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> database.execute("sp_missing"));

		Assertions.assertTrue(
				Arrays.stream(e.getSuppressed()).anyMatch(suppressed -> "logger failed".equals(suppressed.getMessage())),
				"Expected call logger failure to be suppressed");
	}

	@Test
	public void testCallLoggerExceptionThrownWhenCallSucceeds() throws SQLException {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		DataSource dataSource = createInMemoryDataSource("logger_thrown");

		try (Connection connection = dataSource.getConnection();
				 Statement statement = connection.createStatement()) {
			statement.execute("CREATE PROCEDURE sp_noop() BEGIN ATOMIC DECLARE x INT; SET x = 1; END");
		}

		Database database = Database.withDataSource(dataSource)
				.callLogger((callLog) -> {
					throw loggerFailure;
				})
				.build();

		RuntimeException e = Assertions.assertThrows(RuntimeException.class, () -> database.execute("sp_noop"));

		Assertions.assertSame(loggerFailure, e, "Expected the call logger failure to be thrown");
	}

	@Test
	public void testPrimaryFailureIsNotReplacedByLoggerFailure() {
		Database database = Database.withDataSource(createInMemoryDataSource("logger_primary"))
				.callLogger((callLog) -> {
					throw new IllegalStateException("logger failed");
				})
				.build();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> database.getTable("sp_missing"));

		Assertions.assertEquals("sp_missing", e.getProcedureName().orElse(null), "The call failure should be primary");
		Assertions.assertTrue(e.getCause() instanceof SQLException, "Expected the driver error as cause");
	}

	@NonNull
	private DataSource createInMemoryDataSource(@NonNull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}
}
