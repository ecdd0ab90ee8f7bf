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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that describes one stored procedure call: what is called, with which parameters, and what the caller expects
 * back.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CallContext {
	@NonNull
	private final ProcedureCall procedureCall;
	@NonNull
	private final List<ProcedureParameter> parameters;
	@Nullable
	private final Class<?> resultType;

	private CallContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.procedureCall = builder.procedureCall;
		this.parameters = builder.parameters == null ? List.of() : List.copyOf(builder.parameters);
		this.resultType = builder.resultType;
	}

	@NonNull
	public static Builder with(@NonNull ProcedureCall procedureCall) {
		requireNonNull(procedureCall);
		return new Builder(procedureCall);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getProcedureCall(), getParameters(), getResultType());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof CallContext))
			return false;

		CallContext callContext = (CallContext) object;

		return Objects.equals(callContext.getProcedureCall(), getProcedureCall())
				&& Objects.equals(callContext.getParameters(), getParameters())
				&& Objects.equals(callContext.getResultType(), getResultType());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(3);

		components.add(format("procedureCall=%s", getProcedureCall()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		Class<?> resultType = getResultType().orElse(null);

		if (resultType != null)
			components.add(format("resultType=%s", resultType.getName()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public ProcedureCall getProcedureCall() {
		return this.procedureCall;
	}

	/**
	 * The parameters of the call, in binding order.
	 *
	 * @return the call parameters
	 */
	@NonNull
	public List<ProcedureParameter> getParameters() {
		return this.parameters;
	}

	/**
	 * The type the caller asked results to be coerced or mapped to, for scalar and record calls.
	 *
	 * @return the requested result type, if any
	 */
	@NonNull
	public Optional<Class<?>> getResultType() {
		return Optional.ofNullable(this.resultType);
	}

	/**
	 * Builder used to construct instances of {@link CallContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final ProcedureCall procedureCall;
		@Nullable
		private List<ProcedureParameter> parameters;
		@Nullable
		private Class<?> resultType;

		private Builder(@NonNull ProcedureCall procedureCall) {
			this.procedureCall = requireNonNull(procedureCall);
		}

		@NonNull
		public Builder parameters(@Nullable List<ProcedureParameter> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder parameters(ProcedureParameter @Nullable ... parameters) {
			this.parameters = parameters == null ? null : Arrays.asList(parameters);
			return this;
		}

		@NonNull
		public Builder resultType(@Nullable Class<?> resultType) {
			this.resultType = resultType;
			return this;
		}

		@NonNull
		public CallContext build() {
			return new CallContext(this);
		}
	}
}
