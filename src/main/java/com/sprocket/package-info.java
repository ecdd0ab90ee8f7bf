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

/**
 * Sprocket calls stored procedures over JDBC and turns what they return into {@link com.sprocket.Table}s or
 * caller-defined records.
 *
 * <pre>
 * // Minimal setup, uses defaults
 * Database database = Database.withConnectionString("jdbc:mysql://localhost:3306/shop?user=shop").build();
 *
 * // Side effects
 * long updated = database.execute("sp_update_counter");
 *
 * // Scalars, tables and every result set
 * int itemCount = database.getScalar("sp_count_items", int.class);
 * Table users = database.getTable("sp_list_users", database.inputParameter("active", true));
 * List&lt;Table&gt; report = database.getData("sp_monthly_report", database.inputParameter("month", 6));
 *
 * // Records
 * RecordMapping&lt;User&gt; userMapping = RecordMapping.forType(User.class, User::new)
 *   .column("id", long.class, User::setId)
 *   .column("name", String.class, User::setName)
 *   .build();
 *
 * List&lt;User&gt; activeUsers = database.getTable("sp_list_users", userMapping, database.inputParameter("active", true));
 * Optional&lt;User&gt; user = database.findRecord("sp_get_user", userMapping, database.inputParameter("id", 42));
 *
 * // Output parameters
 * ProcedureParameter total = database.outputParameter("total", Types.INTEGER);
 * database.execute("sp_add", database.inputParameter("a", 1), database.inputParameter("b", 2), total);
 * Optional&lt;Integer&gt; sum = total.getOutputValue(Integer.class);</pre>
 *
 * @since 1.0.0
 */
package com.sprocket;
