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

/**
 * Contract for handling {@link CallLog} diagnostics emitted once per stored procedure call.
 * <p>
 * Implementations should be thread-safe.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface CallLogger {
	/**
	 * Performs a logging operation on the given {@code callLog}.
	 * <p>
	 * Implementors might choose to no-op, write to a logging framework, flag slow procedures, and so on.  An exception
	 * thrown here is attached to a failing call as suppressed, or thrown in place of the result of a successful one.
	 *
	 * @param callLog the event to log
	 */
	void log(@NonNull CallLog callLog);
}
