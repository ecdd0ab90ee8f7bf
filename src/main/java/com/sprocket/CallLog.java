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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one stored procedure call, handed to a {@link CallLogger} once the call has finished.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CallLog {
	@NonNull
	private final CallContext callContext;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultSetMappingDuration;
	@Nullable
	private final Integer resultSetCount;
	@Nullable
	private final Exception exception;

	private CallLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.callContext = requireNonNull(builder.callContext);
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultSetMappingDuration = builder.resultSetMappingDuration;
		this.resultSetCount = builder.resultSetCount;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.connectionAcquisitionDuration != null)
			totalDuration = totalDuration.plus(this.connectionAcquisitionDuration);

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultSetMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultSetMappingDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link CallLog} builder for the given {@code callContext}.
	 *
	 * @param callContext the call being logged
	 * @return a {@link CallLog} builder
	 */
	@NonNull
	public static Builder withCallContext(@NonNull CallContext callContext) {
		requireNonNull(callContext);
		return new Builder(callContext);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("callContext=%s", getCallContext()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		getConnectionAcquisitionDuration().ifPresent(duration -> components.add(format("connectionAcquisitionDuration=%s", duration)));
		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultSetMappingDuration().ifPresent(duration -> components.add(format("resultSetMappingDuration=%s", duration)));
		getResultSetCount().ifPresent(count -> components.add(format("resultSetCount=%s", count)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof CallLog))
			return false;

		CallLog callLog = (CallLog) object;

		return Objects.equals(getCallContext(), callLog.getCallContext())
				&& Objects.equals(getConnectionAcquisitionDuration(), callLog.getConnectionAcquisitionDuration())
				&& Objects.equals(getPreparationDuration(), callLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), callLog.getExecutionDuration())
				&& Objects.equals(getResultSetMappingDuration(), callLog.getResultSetMappingDuration())
				&& Objects.equals(getResultSetCount(), callLog.getResultSetCount())
				&& Objects.equals(getException(), callLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCallContext(), getConnectionAcquisitionDuration(), getPreparationDuration(),
				getExecutionDuration(), getResultSetMappingDuration(), getResultSetCount(), getException());
	}

	/**
	 * How long did it take to acquire a {@link java.sql.Connection}?
	 *
	 * @return how long it took to acquire a {@link java.sql.Connection}, if available
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * How long did it take to prepare the {@link java.sql.CallableStatement} and bind its parameters?
	 *
	 * @return how long preparation and binding took, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	/**
	 * How long did the database take to run the stored procedure?
	 *
	 * @return how long execution took, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to read result sets and output parameters?
	 *
	 * @return how long result processing took, if available
	 */
	@NonNull
	public Optional<Duration> getResultSetMappingDuration() {
		return Optional.ofNullable(this.resultSetMappingDuration);
	}

	/**
	 * How long did the call take in total?
	 * <p>
	 * This is the sum of the acquisition, preparation, execution and result processing durations.
	 *
	 * @return how long the call took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public CallContext getCallContext() {
		return this.callContext;
	}

	/**
	 * How many result sets were materialized?
	 *
	 * @return the number of result sets read, if the call got that far
	 */
	@NonNull
	public Optional<Integer> getResultSetCount() {
		return Optional.ofNullable(this.resultSetCount);
	}

	/**
	 * The exception that made the call fail.
	 *
	 * @return the failure, if the call failed
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link CallLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final CallContext callContext;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
		@Nullable
		private Integer resultSetCount;
		@Nullable
		private Exception exception;

		private Builder(@NonNull CallContext callContext) {
			this.callContext = requireNonNull(callContext);
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultSetMappingDuration(@Nullable Duration resultSetMappingDuration) {
			this.resultSetMappingDuration = resultSetMappingDuration;
			return this;
		}

		@NonNull
		public Builder resultSetCount(@Nullable Integer resultSetCount) {
			this.resultSetCount = resultSetCount;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public CallLog build() {
			return new CallLog(this);
		}
	}
}
