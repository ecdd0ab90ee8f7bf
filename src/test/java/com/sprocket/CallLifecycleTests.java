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
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.Optional;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Driver-level behavior that an embedded database cannot be made to exhibit on demand.
 *
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
public class CallLifecycleTests {
	@Mock
	private DataSource dataSource;
	@Mock
	private Connection connection;
	@Mock
	private CallableStatement callableStatement;
	@Mock
	private ResultSet resultSet;

	@Test
	public void testExecuteReturnsDriverReportedUpdateCount() throws SQLException {
		stubCall("{call sp_update_counter()}");
		when(this.callableStatement.execute()).thenReturn(false);
		when(this.callableStatement.getLargeUpdateCount()).thenReturn(3L, -1L);
		when(this.callableStatement.getMoreResults()).thenReturn(false);

		long updateCount = createDatabase().execute("sp_update_counter");

		Assertions.assertEquals(3L, updateCount, "Expected the driver-reported update count");
		verify(this.callableStatement).close();
		verify(this.connection).close();
	}

	@Test
	public void testExecuteSumsUpdateCounts() throws SQLException {
		stubCall("{call billing.sp_close_month(?)}");
		when(this.callableStatement.execute()).thenReturn(false);
		when(this.callableStatement.getLargeUpdateCount()).thenReturn(2L, -2L, 3L, -1L);
		when(this.callableStatement.getMoreResults()).thenReturn(false);

		Database database = createDatabase();
		long updateCount = database.execute("billing.sp_close_month", database.inputParameter("month", 6));

		Assertions.assertEquals(5L, updateCount, "Expected update counts to be summed, ignoring SUCCESS_NO_INFO");
		verify(this.callableStatement).setObject(1, 6);
	}

	@Test
	public void testExecuteFallsBackToIntUpdateCount() throws SQLException {
		stubCall("{call sp_update_counter()}");
		when(this.callableStatement.execute()).thenReturn(false);
		when(this.callableStatement.getLargeUpdateCount()).thenThrow(new UnsupportedOperationException("getLargeUpdateCount not implemented"));
		when(this.callableStatement.getUpdateCount()).thenReturn(4, -1);
		when(this.callableStatement.getMoreResults()).thenReturn(false);

		Database database = createDatabase();

		Assertions.assertEquals(4L, database.execute("sp_update_counter"), "Expected the int update count");
		Assertions.assertEquals(Database.DatabaseOperationSupportStatus.NO, database.getLargeUpdateCountSupported(),
				"Large update count support should be remembered as unavailable");
	}

	@Test
	public void testExecuteClosesResultSetsUnread() throws SQLException {
		stubCall("{call sp_report()}");
		when(this.callableStatement.execute()).thenReturn(true);
		when(this.callableStatement.getResultSet()).thenReturn(this.resultSet);
		when(this.callableStatement.getMoreResults()).thenReturn(false);
		when(this.callableStatement.getLargeUpdateCount()).thenReturn(-1L);

		Assertions.assertEquals(0L, createDatabase().execute("sp_report"), "No update counts should mean 0");
		verify(this.resultSet).close();
		verify(this.resultSet, never()).next();
	}

	@Test
	public void testOutputParameterIsRegisteredAndRead() throws SQLException {
		stubCall("{call sp_next_id(?)}");
		when(this.callableStatement.execute()).thenReturn(false);
		when(this.callableStatement.getLargeUpdateCount()).thenReturn(-1L);
		when(this.callableStatement.getObject(1)).thenReturn(7);

		Database database = createDatabase();
		ProcedureParameter nextId = database.outputParameter("next_id", Types.INTEGER);
		database.execute("sp_next_id", nextId);

		verify(this.callableStatement).registerOutParameter(1, Types.INTEGER);
		Assertions.assertEquals(Optional.of(DbValue.ofInteger(7)), nextId.getOutputValue(), "Wrong output value");
	}

	@Test
	public void testParametersBoundInDeclarationOrder() throws SQLException {
		DatabaseMetaData databaseMetaData = mock(DatabaseMetaData.class);
		ResultSet procedureColumns = mock(ResultSet.class);
		ResultSetMetaData procedureColumnsMetaData = mock(ResultSetMetaData.class);

		stubCall("{call sp_add(?, ?, ?)}");
		when(this.connection.getMetaData()).thenReturn(databaseMetaData);
		when(databaseMetaData.getSearchStringEscape()).thenReturn("\\");
		when(databaseMetaData.storesLowerCaseIdentifiers()).thenReturn(true);
		when(databaseMetaData.getProcedureColumns(null, null, "sp\\_add", "%")).thenReturn(procedureColumns);
		when(procedureColumns.getMetaData()).thenReturn(procedureColumnsMetaData);
		when(procedureColumnsMetaData.getColumnCount()).thenReturn(2);
		when(procedureColumnsMetaData.getColumnLabel(1)).thenReturn("ORDINAL_POSITION");
		when(procedureColumnsMetaData.getColumnLabel(2)).thenReturn("SPECIFIC_NAME");
		when(procedureColumns.next()).thenReturn(true, true, true, false);
		when(procedureColumns.getString("PROCEDURE_NAME")).thenReturn("sp_add");
		when(procedureColumns.getString("PROCEDURE_CAT")).thenReturn("shop");
		when(procedureColumns.getString("PROCEDURE_SCHEM")).thenReturn(null);
		when(procedureColumns.getString("SPECIFIC_NAME")).thenReturn("sp_add");
		when(procedureColumns.getShort("COLUMN_TYPE")).thenReturn(
				(short) DatabaseMetaData.procedureColumnIn, (short) DatabaseMetaData.procedureColumnIn, (short) DatabaseMetaData.procedureColumnOut);
		when(procedureColumns.getString("COLUMN_NAME")).thenReturn("a", "b", "total");
		when(procedureColumns.getInt("ORDINAL_POSITION")).thenReturn(1, 2, 3);
		when(this.callableStatement.execute()).thenReturn(false);
		when(this.callableStatement.getLargeUpdateCount()).thenReturn(-1L);
		when(this.callableStatement.getObject(3)).thenReturn(5);

		Database database = createDatabase();
		ProcedureParameter total = database.outputParameter("total", Types.INTEGER);
		database.execute("sp_add", total, database.inputParameter("B", 3), database.inputParameter("@a", 2));

		InOrder inOrder = inOrder(this.callableStatement);
		inOrder.verify(this.callableStatement).setObject(1, 2);
		inOrder.verify(this.callableStatement).setObject(2, 3);
		inOrder.verify(this.callableStatement).registerOutParameter(3, Types.INTEGER);
		Assertions.assertEquals(Optional.of(DbValue.ofInteger(5)), total.getOutputValue(), "Output should be read from its declared position");
		verify(procedureColumns).close();
	}

	@Test
	public void testStatementAndConnectionClosedOnFailure() throws SQLException {
		stubCall("{call sp_update_counter()}");
		when(this.callableStatement.execute()).thenThrow(new SQLException("Deadlock found", "40001", 1213));

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> createDatabase().execute("sp_update_counter"));

		Assertions.assertEquals(Optional.of("sp_update_counter"), e.getProcedureName(), "Wrong procedure name");
		Assertions.assertEquals(Optional.of("40001"), e.getSqlState(), "Wrong SQLSTATE");
		Assertions.assertEquals(Optional.of(1213), e.getErrorCode(), "Wrong vendor error code");
		verify(this.callableStatement).close();
		verify(this.connection).close();
	}

	@Test
	public void testCloseFailureSuppressedWhenCallFails() throws SQLException {
		stubCall("{call sp_update_counter()}");
		when(this.callableStatement.execute()).thenThrow(new SQLException("Deadlock found", "40001"));
		doThrow(new SQLException("Connection reset")).when(this.connection).close();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> createDatabase().execute("sp_update_counter"));

		Assertions.assertEquals(Optional.of("40001"), e.getSqlState(), "The call failure should be the primary exception");
		Assertions.assertTrue(Arrays.stream(e.getSuppressed())
						.anyMatch(suppressed -> "Unable to close database connection".equals(suppressed.getMessage())),
				"Expected the close failure to be suppressed");
	}

	@Test
	public void testCloseFailureThrownWhenCallSucceeds() throws SQLException {
		stubCall("{call sp_update_counter()}");
		when(this.callableStatement.execute()).thenReturn(false);
		when(this.callableStatement.getLargeUpdateCount()).thenReturn(-1L);
		doThrow(new SQLException("Connection reset")).when(this.connection).close();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> createDatabase().execute("sp_update_counter"));

		Assertions.assertEquals("Unable to close database connection", e.getMessage(), "Expected the close failure");
	}

	@Test
	public void testConnectionFailure() throws SQLException {
		when(this.dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> createDatabase().execute("sp_update_counter"));

		Assertions.assertEquals("Unable to acquire database connection", e.getMessage(), "Wrong message");
		Assertions.assertEquals(Optional.of("08001"), e.getSqlState(), "Wrong SQLSTATE");
		verifyNoInteractions(this.connection);
	}

	@Test
	public void testInvalidProcedureNameRejectedBeforeConnecting() {
		Database database = createDatabase();

		Assertions.assertThrows(IllegalArgumentException.class, () -> database.execute("sp_x; DROP TABLE account"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> database.getTable("SELECT * FROM account"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> database.getData(" "));

		verifyNoInteractions(this.dataSource);
	}

	@Test
	public void testNullParameterRejectedBeforeConnecting() {
		Database database = createDatabase();

		Assertions.assertThrows(NullPointerException.class, () -> database.execute("sp_x", database.inputParameter("a", 1), null));

		verifyNoInteractions(this.dataSource);
	}

	private void stubCall(String sql) throws SQLException {
		when(this.dataSource.getConnection()).thenReturn(this.connection);
		when(this.connection.prepareCall(sql)).thenReturn(this.callableStatement);
	}

	private Database createDatabase() {
		return Database.withDataSource(this.dataSource).build();
	}
}
