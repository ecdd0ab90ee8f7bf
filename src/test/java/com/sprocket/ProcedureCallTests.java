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

import java.util.List;

/**
 * @since 1.0.0
 */
public class ProcedureCallTests {
	@Test
	public void testBuildsCallEscape() {
		Assertions.assertEquals("{call sp_update_counter()}", ProcedureCall.of(1, "sp_update_counter", 0).getSql(),
				"Wrong SQL for no parameters");
		Assertions.assertEquals("{call billing.sp_close_month(?, ?, ?)}", ProcedureCall.of(1, "billing.sp_close_month", 3).getSql(),
				"Wrong SQL for three parameters");
	}

	@Test
	public void testAcceptsQualifiedAndQuotedNames() {
		for (String procedureName : List.of("sp_list_users", "dbo.sp_list_users", "shop.dbo.sp_list_users", "\"Monthly Report\"",
				"[dbo].[Monthly Report]", "`monthly-report`", "pkg_orders.place_order$v2", "übersicht", "3d_render", "shop.2024_close"))
			Assertions.assertTrue(ProcedureCall.isValidProcedureName(procedureName), procedureName + " should be accepted");
	}

	@Test
	public void testRejectsAnythingThatIsNotAnIdentifier() {
		for (String procedureName : List.of("", " ", "sp_x; DROP TABLE account", "sp_x()", "sp x", "123", "shop.42", "42.sp_x", "a.b.c.d", "sp_x--",
				"\"unterminated", "sp_x.", ".sp_x"))
			Assertions.assertFalse(ProcedureCall.isValidProcedureName(procedureName), procedureName + " should be rejected");
	}

	@Test
	public void testSplitsNameParts() {
		Assertions.assertEquals(List.of("shop", "\"Monthly.Report\""), ProcedureCall.of(1, "shop.\"Monthly.Report\"", 0).getNameParts(),
				"Dots inside quotes should not split the name");
		Assertions.assertEquals(List.of("3d_render"), ProcedureCall.of(1, "3d_render", 0).getNameParts(), "Wrong name parts");
	}

	@Test
	public void testInvalidNameThrows() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> ProcedureCall.of(1, "sp_x; DROP TABLE account", 0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ProcedureCall.of(1, "sp_x", -1));
	}
}
