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

/**
 * Monotonic source of entity identifiers, starting at 1. Identifiers are unique only within the allocator's
 * lifetime, nothing is persisted across restarts.
 * <p><strong>Not thread safe.</strong> Allocation is plain increment, callers must serialize entity creation, usually
 * by running all mutations on a single writer thread.</p>
 */
public final class IdAllocator {
    private static final IdAllocator PROCESS_WIDE = new IdAllocator();

    private long lastId;

    public IdAllocator() {
        this(0);
    }

    /**
     * Create allocator continuing after given identifier.
     * @param lastId last identifier already in use, next allocated id will be {@code lastId + 1}
     */
    public IdAllocator(long lastId) {
        if (lastId < 0) {
            throw new IllegalArgumentException("Last id cannot be negative: " + lastId);
        }
        this.lastId = lastId;
    }

    /**
     * The allocator shared by all entities created without explicit allocator.
     * @return process-wide allocator
     */
    public static IdAllocator processWide() {
        return PROCESS_WIDE;
    }

    public long next() {
        return ++lastId;
    }

    public long lastAllocated() {
        return lastId;
    }
}
