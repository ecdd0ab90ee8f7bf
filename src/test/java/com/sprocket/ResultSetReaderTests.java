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
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
public class ResultSetReaderTests {
	@Mock
	private ResultSet resultSet;
	@Mock
	private ResultSetMetaData resultSetMetaData;

	@Test
	public void testReadsClobAsText() throws SQLException {
		Clob clob = mock(Clob.class);

		stubSingleColumn("notes", Types.CLOB, "CLOB");
		when(this.resultSet.next()).thenReturn(true, false);
		when(this.resultSet.getObject(1)).thenReturn(clob);
		when(clob.length()).thenReturn(5L);
		when(clob.getSubString(1, 5)).thenReturn("hello");

		Table table = ResultSetReader.readTable(this.resultSet);

		Assertions.assertEquals(1, table.size(), "Expected one row");
		Assertions.assertEquals(DbValue.ofText("hello"), table.get(0).get(0), "Wrong CLOB value");
		verify(clob).free();
	}

	@Test
	public void testOversizedBlobFails() throws SQLException {
		Blob blob = mock(Blob.class);

		stubSingleColumn("payload", Types.BLOB, "BLOB");
		when(this.resultSet.next()).thenReturn(true);
		when(this.resultSet.getObject(1)).thenReturn(blob);
		when(blob.length()).thenReturn(Integer.MAX_VALUE + 1L);

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> ResultSetReader.readTable(this.resultSet));

		Assertions.assertTrue(e.getCause() instanceof ArithmeticException, "Expected the overflow as cause");
		verify(blob, never()).getBytes(anyLong(), anyInt());
		verify(blob).free();
	}

	private void stubSingleColumn(String label,
																int sqlType,
																String typeName) throws SQLException {
		when(this.resultSet.getMetaData()).thenReturn(this.resultSetMetaData);
		when(this.resultSetMetaData.getColumnCount()).thenReturn(1);
		when(this.resultSetMetaData.getColumnLabel(1)).thenReturn(label);
		when(this.resultSetMetaData.getColumnType(1)).thenReturn(sqlType);
		when(this.resultSetMetaData.getColumnTypeName(1)).thenReturn(typeName);
	}
}
