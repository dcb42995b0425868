/**
 * Validated properties of in-memory entities.
 *
 * <p>A {@link io.github.memimage.core.property.Scalar} holds a single value of an entity. It is configured with
 * a normalizer and an ordered list of {@linkplain io.github.memimage.core.property.Rule rules}. Each write, and the
 * construction itself:</p>
 * <ol>
 *     <li>normalizes the value exactly once,</li>
 *     <li>runs rules in their registration order against the normalized value, stopping at first failure,</li>
 *     <li>stores the normalized value when all rules pass.</li>
 * </ol>
 * <p>A failed rule throws {@link io.github.memimage.core.DomainException} carrying the rule's code. The code is
 * meant for programmatic handling and localization, the message is free text. Reads never validate, the stored
 * value satisfies the rules at all times.</p>
 *
 * <p>{@link io.github.memimage.core.property.Strings} provides the usual normalizer and rules of text properties.</p>
 */
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
