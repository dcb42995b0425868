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
import io.github.memimage.core.DomainResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Validated property of an entity. Every value written to it, including the initial one, is normalized first and
 * then checked against all rules in order of their registration. First failing rule rejects the value and the
 * property keeps its previous value.
 * <p>Normalizer and rules are configured once via {@link Builder} and cannot change afterwards.</p>
 * <pre>
 * Scalar&lt;String&gt; name = Scalar.builder(initialName)
 *         .normalizeWith(Strings::normalizeSpace)
 *         .rule(1000, Strings.nonEmpty(), n -&gt; "Name cannot be blank")
 *         .build();
 * </pre>
 * <p>Not thread safe, as any other part of an entity.</p>
 * @param <P> type of property value
 */
public final class Scalar<P> {
    private final UnaryOperator<P> normalizer;
    private final List<Rule<P>> rules;
    private P value;

    private Scalar(UnaryOperator<P> normalizer, List<Rule<P>> rules, P value) {
        this.normalizer = normalizer;
        this.rules = rules;
        this.value = value;
    }

    /**
     * Start configuring a property.
     * @param initialValue value the property will hold after it is built, before normalization
     * @param <P> type of property value
     * @return new builder
     */
    public static <P> Builder<P> builder(P initialValue) {
        return new Builder<>(Objects.requireNonNull(initialValue, "Initial value cannot be null"));
    }

    /**
     * Configure and build property in single step.
     * @param initialValue value the property will hold, before normalization
     * @param configure callback that registers normalizer and rules on passed builder
     * @param <P> type of property value
     * @return the property
     * @throws DomainException when normalized initial value breaks any of the rules
     */
    public static <P> Scalar<P> create(P initialValue, Consumer<? super Builder<P>> configure) {
        Builder<P> builder = builder(initialValue);
        configure.accept(builder);
        return builder.build();
    }

    public P get() {
        return value;
    }

    /**
     * Write new value.
     * @param newValue value to store, before normalization
     * @throws DomainException when normalized value breaks any of the rules. The stored value doesn't change then.
     */
    public void set(P newValue) {
        this.value = accept(newValue);
    }

    /**
     * Write new value and return the one it replaced.
     * @param newValue value to store, before normalization
     * @return previous value
     * @throws DomainException when normalized value breaks any of the rules. The stored value doesn't change then.
     */
    public P getAndSet(P newValue) {
        P accepted = accept(newValue);
        P previous = value;
        this.value = accepted;
        return previous;
    }

    /**
     * Like {@link #getAndSet(Object)}, but reports the rule violation as failed result.
     * @param newValue value to store, before normalization
     * @return previous value, or the violation
     */
    public DomainResult<P> trySet(P newValue) {
        return DomainResult.domainCatch(() -> getAndSet(newValue));
    }

    public List<Rule<P>> getRules() {
        return rules;
    }

    private P accept(P candidate) {
        return validate(rules, normalize(normalizer, candidate));
    }

    private static <P> P normalize(UnaryOperator<P> normalizer, P candidate) {
        Objects.requireNonNull(candidate, "Value cannot be null");
        return Objects.requireNonNull(normalizer.apply(candidate), "Normalizer returned null");
    }

    private static <P> P validate(List<Rule<P>> rules, P normalized) {
        for (Rule<P> rule : rules) {
            rule.apply(normalized);
        }
        return normalized;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    /**
     * One-shot configuration of a property. After {@link #build()} was called the builder rejects any further use.
     * @param <P> type of property value
     */
    public static final class Builder<P> {
        private final P initialValue;
        private final List<Rule<P>> rules = new ArrayList<>();
        private UnaryOperator<P> normalizer = UnaryOperator.identity();
        private boolean built;

        private Builder(P initialValue) {
            this.initialValue = initialValue;
        }

        /**
         * Set normalizer applied to every value before validation. When called multiple times, last call wins.
         * @param normalizer idempotent transformation of the value
         * @return this builder
         */
        public Builder<P> normalizeWith(UnaryOperator<P> normalizer) {
            checkNotBuilt();
            this.normalizer = Objects.requireNonNull(normalizer, "Normalizer cannot be null");
            return this;
        }

        /**
         * Append a rule. Rules are evaluated in order they were added, so cheaper and more general rules should
         * come first (e. g. non-empty before length check).
         * @param code stable code of the rule
         * @param validation predicate that holds for valid values
         * @param errorMessage message describing the rejected value
         * @return this builder
         */
        public Builder<P> rule(int code, Predicate<? super P> validation, Function<? super P, String> errorMessage) {
            checkNotBuilt();
            rules.add(Rule.of(code, validation, errorMessage));
            return this;
        }

        /**
         * Normalize and validate the initial value and create the property.
         * @return the property holding normalized initial value
         * @throws DomainException when normalized initial value breaks any of the rules
         */
        public Scalar<P> build() {
            checkNotBuilt();
            built = true;
            List<Rule<P>> fixedRules = Collections.unmodifiableList(new ArrayList<>(rules));
            P value = validate(fixedRules, normalize(normalizer, initialValue));
            return new Scalar<>(normalizer, fixedRules, value);
        }

        private void checkNotBuilt() {
            if (built) {
                throw new IllegalStateException("Property was already built");
            }
        }
    }
}
