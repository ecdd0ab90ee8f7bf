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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static java.util.Objects.requireNonNull;

/**
 * Asynchronous view of a {@link Database}, acquired via {@link Database#async(Executor)}.
 * <p>
 * Each operation runs the corresponding {@link Database} operation on the executor.  A failed call completes the
 * returned future exceptionally with the same exception {@link Database} would have thrown.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class AsyncDatabase {
	@NonNull
	private final Database database;
	@NonNull
	private final Executor executor;

	AsyncDatabase(@NonNull Database database,
								@NonNull Executor executor) {
		this.database = requireNonNull(database);
		this.executor = requireNonNull(executor);
	}

	/**
	 * @see Database#execute(String, ProcedureParameter...)
	 */
	@NonNull
	public CompletableFuture<Long> execute(@NonNull String procedureName,
																				 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		return CompletableFuture.supplyAsync(() -> getDatabase().execute(procedureName, parameters), getExecutor());
	}

	/**
	 * @see Database#getScalar(String, Class, ProcedureParameter...)
	 */
	@NonNull
	public <T> CompletableFuture<T> getScalar(@NonNull String procedureName,
																						@NonNull Class<T> type,
																						ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(type);

		return CompletableFuture.supplyAsync(() -> getDatabase().getScalar(procedureName, type, parameters), getExecutor());
	}

	/**
	 * @see Database#findScalar(String, Class, ProcedureParameter...)
	 */
	@NonNull
	public <T> CompletableFuture<Optional<T>> findScalar(@NonNull String procedureName,
																											 @NonNull Class<T> type,
																											 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(type);

		return CompletableFuture.supplyAsync(() -> getDatabase().findScalar(procedureName, type, parameters), getExecutor());
	}

	/**
	 * @see Database#getTable(String, ProcedureParameter...)
	 */
	@NonNull
	public CompletableFuture<Table> getTable(@NonNull String procedureName,
																					 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		return CompletableFuture.supplyAsync(() -> getDatabase().getTable(procedureName, parameters), getExecutor());
	}

	/**
	 * @see Database#getTable(String, RecordMapping, ProcedureParameter...)
	 */
	@NonNull
	public <T> CompletableFuture<List<T>> getTable(@NonNull String procedureName,
																								 @NonNull RecordMapping<T> recordMapping,
																								 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(recordMapping);

		return CompletableFuture.supplyAsync(() -> getDatabase().getTable(procedureName, recordMapping, parameters), getExecutor());
	}

	/**
	 * @see Database#getRecord(String, RecordMapping, ProcedureParameter...)
	 */
	@NonNull
	public <T> CompletableFuture<T> getRecord(@NonNull String procedureName,
																						@NonNull RecordMapping<T> recordMapping,
																						ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(recordMapping);

		return CompletableFuture.supplyAsync(() -> getDatabase().getRecord(procedureName, recordMapping, parameters), getExecutor());
	}

	/**
	 * @see Database#findRecord(String, RecordMapping, ProcedureParameter...)
	 */
	@NonNull
	public <T> CompletableFuture<Optional<T>> findRecord(@NonNull String procedureName,
																											 @NonNull RecordMapping<T> recordMapping,
																											 ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		requireNonNull(recordMapping);

		return CompletableFuture.supplyAsync(() -> getDatabase().findRecord(procedureName, recordMapping, parameters), getExecutor());
	}

	/**
	 * @see Database#getData(String, ProcedureParameter...)
	 */
	@NonNull
	public CompletableFuture<List<Table>> getData(@NonNull String procedureName,
																								ProcedureParameter @Nullable ... parameters) {
		requireNonNull(procedureName);
		return CompletableFuture.supplyAsync(() -> getDatabase().getData(procedureName, parameters), getExecutor());
	}

	@NonNull
	public Database getDatabase() {
		return this.database;
	}

	@NonNull
	public Executor getExecutor() {
		return this.executor;
	}
}
