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

/**
 * Exception raised when a value violates a rule of a domain property. The exception is unchecked, the caller is
 * expected to supply a corrected value rather than to recover.
 * <p>The message has form {@code 01000: Bank name cannot be blank}, {@link #getCode()} and {@link #getDescription()}
 * give access to its parts.</p>
 * @see DomainResult#domainCatch(java.util.function.Supplier)
 */
public class DomainException extends RuntimeException {
    private final Violation violation;

    public DomainException(Violation violation) {
        this(violation, null);
    }

    public DomainException(Violation violation, Throwable cause) {
        super(format(violation), cause);
        this.violation = violation;
    }

    public static DomainException of(int code, String message) {
        return new DomainException(Violation.of(code, message));
    }

    private static String format(Violation violation) {
        Objects.requireNonNull(violation, "Violation cannot be null");
        return String.format("%05d: %s", violation.code(), violation.message());
    }

    public int getCode() {
        return violation.code();
    }

    /**
     * The message of the violated rule, without the code prefix.
     * @return rule's message
     */
    public String getDescription() {
        return violation.message();
    }

    public Violation getViolation() {
        return violation;
    }
}
