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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A domain object kept in memory. It has an identifier drawn from an {@link IdAllocator} and holds its state in
 * validated properties ({@link io.github.memimage.core.property.Scalar}).
 * <p>Entities do not synchronize. All calls that change an entity are expected to come from a single writer.</p>
 * <p>Subclasses expose changes of their properties via intention revealing methods (e. g. {@code renameTo}) rather
 * than plain setters, so that invariants spanning multiple entities can be added at a single place.</p>
 */
public abstract class Entity {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final long id;

    /**
     * Constructor for subclasses, drawing identifier from {@linkplain IdAllocator#processWide() process-wide allocator}.
     */
    protected Entity() {
        this(IdAllocator.processWide());
    }

    protected Entity(IdAllocator ids) {
        Objects.requireNonNull(ids, "Id allocator cannot be null");
        this.id = ids.next();
        logger.trace("Allocated id {}", id);
    }

    public final long getId() {
        return id;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + '}';
    }
}
