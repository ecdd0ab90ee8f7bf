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

/**
 * Direction of a {@link ProcedureParameter}, i.e. whether its value flows into the stored procedure, out of it, or both.
 *
 * @since 1.0.0
 */
public enum ParameterDirection {
	/**
	 * The value is sent to the stored procedure.
	 */
	INPUT,
	/**
	 * The value is written by the stored procedure and read back after the call.
	 */
	OUTPUT,
	/**
	 * The value is sent to the stored procedure, which may overwrite it.
	 */
	INPUT_OUTPUT;

	/**
	 * Does this direction send a value to the database?
	 *
	 * @return {@code true} for {@link #INPUT} and {@link #INPUT_OUTPUT}
	 */
	public boolean isInput() {
		return this == INPUT || this == INPUT_OUTPUT;
	}

	/**
	 * Does this direction receive a value from the database?
	 *
	 * @return {@code true} for {@link #OUTPUT} and {@link #INPUT_OUTPUT}
	 */
	public boolean isOutput() {
		return this == OUTPUT || this == INPUT_OUTPUT;
	}
}
