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
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ScalarTest {

    private static Scalar.Builder<String> name(String initial) {
        return Scalar.builder(initial)
                .normalizeWith(Strings::normalizeSpace)
                .rule(1000, Strings.nonEmpty(), n -> "Name cannot be blank")
                .rule(1001, Strings.lengthRange(4, 32), n -> "Invalid name length " + n.length());
    }

    private static int rejectionCode(Runnable action) {
        try {
            action.run();
        } catch (DomainException e) {
            return e.getCode();
        }
        throw new AssertionError("Expected value to be rejected");
    }

    @Test
    public void build_stores_normalized_initial_value() {
        assertEquals("Monopoly Bank", name("Monopoly Bank").build().get());
        assertEquals("ACME Bank", name("\tACME\t \tBank ").build().get());
    }

    @Test
    public void build_fails_with_code_of_failing_rule() {
        assertEquals(1000, rejectionCode(() -> name("\t \t").build()));
        assertEquals(1001, rejectionCode(() -> name("bit").build()));
        assertEquals(1001, rejectionCode(() -> name("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa").build()));
    }

    @Test
    public void create_runs_configuration_callback() {
        Scalar<String> scalar = Scalar.create(" x  y ", b -> b
                .normalizeWith(Strings::normalizeSpace)
                .rule(1, Strings.nonEmpty(), s -> "empty"));
        assertEquals("x y", scalar.get());
        assertEquals(1, scalar.getRules().size());

        assertEquals(7, rejectionCode(() -> Scalar.<String>create("  ",
            b -> b.normalizeWith(String::trim).rule(7, Strings.nonEmpty(), s -> "empty"))));
    }

    @Test
    public void without_normalizer_value_is_stored_as_is() {
        Scalar<Integer> scalar = Scalar.builder(5).rule(1, i -> i >= 0, i -> "negative").build();
        assertEquals(Integer.valueOf(5), scalar.get());
        scalar.set(0);
        assertEquals(Integer.valueOf(0), scalar.get());
    }

    @Test
    public void successful_write_stores_normalized_value() {
        Scalar<String> scalar = name("Monopoly Bank").build();
        scalar.set("  new \t valid   name ");
        assertEquals("new valid name", scalar.get());
    }

    @Test
    public void failed_write_keeps_previous_value() {
        Scalar<String> scalar = name("Monopoly Bank").build();
        assertEquals(1000, rejectionCode(() -> scalar.set(" ")));
        assertEquals("Monopoly Bank", scalar.get());
        assertEquals(1001, rejectionCode(() -> scalar.set("abc")));
        assertEquals("Monopoly Bank", scalar.get());
    }

    @Test
    public void get_and_set_returns_previous_value() {
        Scalar<String> scalar = name("Monopoly Bank").build();
        assertEquals("Monopoly Bank", scalar.getAndSet("ACME  Bank"));
        assertEquals("ACME Bank", scalar.get());
    }

    @Test
    public void try_set_reports_violation_as_value() {
        Scalar<String> scalar = name("Monopoly Bank").build();
        DomainResult<String> failed = scalar.trySet("");
        assertFalse(failed.isSuccess());
        assertEquals(1000, failed.getFailure().get().getCode());
        assertEquals("Monopoly Bank", scalar.get());

        DomainResult<String> replaced = scalar.trySet("ACME Bank");
        assertTrue(replaced.isSuccess());
        assertEquals("Monopoly Bank", replaced.get());
        assertEquals("ACME Bank", scalar.get());
    }

    @Test
    public void first_registered_rule_wins() {
        Scalar<String> scalar = Scalar.builder("ok")
                .rule(1, s -> !s.startsWith("x"), s -> "starts with x")
                .rule(2, s -> s.length() < 3, s -> "too long")
                .build();
        assertEquals(1, rejectionCode(() -> scalar.set("xxxx")));
        assertEquals(2, rejectionCode(() -> scalar.set("yyyy")));
    }

    @Test
    public void rules_after_first_failure_are_not_evaluated() {
        List<Integer> evaluated = new ArrayList<>();
        Scalar<String> scalar = Scalar.builder("valid")
                .rule(1, s -> { evaluated.add(1); return !s.isEmpty(); }, s -> "empty")
                .rule(2, s -> { evaluated.add(2); return true; }, s -> "never")
                .build();
        assertEquals(Arrays.asList(1, 2), evaluated);

        evaluated.clear();
        assertEquals(1, rejectionCode(() -> scalar.set("")));
        assertEquals(Collections.singletonList(1), evaluated);
    }

    @Test
    public void normalizer_runs_once_before_rules() {
        AtomicInteger normalizations = new AtomicInteger();
        List<String> seen = new ArrayList<>();
        Scalar<String> scalar = Scalar.builder(" Value ")
                .normalizeWith(s -> {
                    normalizations.incrementAndGet();
                    return s.trim().toLowerCase();
                })
                .rule(1, s -> seen.add(s), s -> "unreachable")
                .build();
        assertEquals(1, normalizations.get());
        scalar.set("  OTHER");
        assertEquals(2, normalizations.get());
        assertEquals(Arrays.asList("value", "other"), seen);
    }

    @Test
    public void last_normalizer_wins() {
        Scalar<String> scalar = Scalar.builder(" Mixed ")
                .normalizeWith(String::toUpperCase)
                .normalizeWith(String::trim)
                .build();
        assertEquals("Mixed", scalar.get());
    }

    @Test
    public void read_does_not_validate() {
        AtomicInteger validations = new AtomicInteger();
        Scalar<String> scalar = Scalar.builder("value")
                .rule(1, s -> validations.incrementAndGet() > 0, s -> "never")
                .build();
        scalar.get();
        scalar.get();
        assertEquals(1, validations.get());
    }

    @Test(expected = IllegalStateException.class)
    public void builder_cannot_build_twice() {
        Scalar.Builder<String> builder = name("Monopoly Bank");
        builder.build();
        builder.build();
    }

    @Test(expected = IllegalStateException.class)
    public void builder_rejects_rules_after_build() {
        Scalar.Builder<String> builder = name("Monopoly Bank");
        builder.build();
        builder.rule(9, s -> true, s -> "");
    }

    @Test(expected = IllegalStateException.class)
    public void builder_rejects_normalizer_after_build() {
        Scalar.Builder<String> builder = name("Monopoly Bank");
        builder.build();
        builder.normalizeWith(String::trim);
    }

    @Test(expected = IllegalStateException.class)
    public void failed_build_consumes_builder() {
        Scalar.Builder<String> builder = name("");
        assertEquals(1000, rejectionCode(builder::build));
        builder.build();
    }

    @Test
    public void rules_cannot_be_changed_after_build() {
        Scalar<String> scalar = name("Monopoly Bank").build();
        try {
            scalar.getRules().add(Rule.of(5, s -> false, s -> ""));
            fail("Rules should be read only");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        assertEquals(2, scalar.getRules().size());
        assertEquals(1000, scalar.getRules().get(0).getCode());
        assertEquals(1001, scalar.getRules().get(1).getCode());
    }

    @Test(expected = NullPointerException.class)
    public void null_initial_value_is_rejected() {
        Scalar.builder(null);
    }

    @Test
    public void null_write_keeps_previous_value() {
        Scalar<String> scalar = name("Monopoly Bank").build();
        try {
            scalar.set(null);
            fail("Null should be rejected");
        } catch (NullPointerException e) {
            // expected
        }
        assertEquals("Monopoly Bank", scalar.get());
    }

    @Test(expected = NullPointerException.class)
    public void build_fails_when_normalizer_returns_null() {
        Scalar.builder("value").normalizeWith(s -> null).build();
    }

    @Test
    public void write_fails_when_normalizer_returns_null() {
        Scalar<String> scalar = Scalar.builder("value")
                .normalizeWith(s -> s.equals("drop") ? null : s)
                .build();
        try {
            scalar.set("drop");
            fail("Null from normalizer should be rejected");
        } catch (NullPointerException e) {
            assertEquals("Normalizer returned null", e.getMessage());
        }
        assertEquals("value", scalar.get());
    }
}
