package me.golemcore.warranty.domain.instruction;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.warranty.domain.model.InstructionDocument;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Read-through cache of parsed instruction documents keyed by step identifier.
 *
 * <p>
 * Lifecycle: each key is populated at most once, on its first successful load,
 * and kept for the lifetime of the owning process. Failed loads are not cached,
 * so a later lookup retries the loader. Nothing is evicted; {@link #clear()}
 * exists for tests and explicit reloads between runs.
 */
public class InstructionCache {

    private final Map<String, InstructionDocument> entries = new ConcurrentHashMap<>();

    /**
     * Returns the cached document for {@code key}, invoking {@code loader} if the
     * key is absent. Concurrent callers for the same key block until the single
     * loader invocation finishes.
     */
    public InstructionDocument getOrLoad(String key, Function<String, InstructionDocument> loader) {
        return entries.computeIfAbsent(key, loader);
    }

    public Optional<InstructionDocument> peek(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
