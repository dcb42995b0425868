package io.github.memimage.core;

/*-
 * #%L
 * memimage
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a domain operation, either a value or the {@link DomainException} that rejected it. Serves callers
 * that prefer to handle rule violations as values instead of catching them.
 * @param <T> type of successful value
 */
public final class DomainResult<T> {
    private final T value;
    private final DomainException failure;

    private DomainResult(T value, DomainException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> DomainResult<T> success(T value) {
        return new DomainResult<>(value, null);
    }

    public static <T> DomainResult<T> failure(DomainException failure) {
        return new DomainResult<>(null, Objects.requireNonNull(failure, "Failure cannot be null"));
    }

    /**
     * Execute the block, capturing a rule violation as failed result. Other exceptions are not domain outcomes and
     * propagate to the caller.
     * @param block operation to execute
     * @param <T> type of result
     * @return successful result with value returned by block, or failed result with exception it threw
     */
    public static <T> DomainResult<T> domainCatch(Supplier<? extends T> block) {
        try {
            return success(block.get());
        } catch (DomainException e) {
            return failure(e);
        }
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Return the value of successful result.
     * @return the value
     * @throws DomainException the captured failure, when this result is not successful
     */
    public T get() {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    public Optional<DomainException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public <U> DomainResult<U> map(Function<? super T, ? extends U> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return success(mapper.apply(value));
    }

    public T orElse(T other) {
        return failure == null ? value : other;
    }

    public DomainResult<T> onFailure(Consumer<? super DomainException> handler) {
        if (failure != null) {
            handler.accept(failure);
        }
        return this;
    }

    @Override
    public String toString() {
        return failure == null ? "DomainResult{value=" + value + '}' : "DomainResult{failure=" + failure.getMessage() + '}';
    }
}
