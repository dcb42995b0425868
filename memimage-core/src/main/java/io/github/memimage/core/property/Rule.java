package io.github.memimage.core.property;

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

import io.github.memimage.core.DomainException;
import io.github.memimage.core.Violation;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Single coded check of a property value. The validation must be a pure function of the value; the error message
 * may embed the rejected value.
 * @param <P> type of property value
 */
public final class Rule<P> {
    private final int code;
    private final Predicate<? super P> validation;
    private final Function<? super P, String> errorMessage;

    private Rule(int code, Predicate<? super P> validation, Function<? super P, String> errorMessage) {
        this.code = code;
        this.validation = Objects.requireNonNull(validation, "Validation cannot be null");
        this.errorMessage = Objects.requireNonNull(errorMessage, "Error message cannot be null");
    }

    /**
     * Create a rule.
     * @param code stable code identifying the rule
     * @param validation predicate that holds for valid values
     * @param errorMessage message describing the rejected value
     * @param <P> type of property value
     * @return new rule
     */
    public static <P> Rule<P> of(int code, Predicate<? super P> validation, Function<? super P, String> errorMessage) {
        return new Rule<>(code, validation, errorMessage);
    }

    public int getCode() {
        return code;
    }

    /**
     * Check the value, returning normally when it is valid.
     * @param value value to check
     * @throws DomainException with this rule's code when validation fails
     */
    public void apply(P value) {
        if (!validation.test(value)) {
            throw new DomainException(violation(value));
        }
    }

    public Optional<Violation> check(P value) {
        return validation.test(value) ? Optional.empty() : Optional.of(violation(value));
    }

    private Violation violation(P value) {
        return Violation.of(code, errorMessage.apply(value));
    }

    @Override
    public String toString() {
        return "Rule{code=" + code + '}';
    }
}
