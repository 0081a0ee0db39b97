/*
 * package-info.java
 *
 * This source file is part of the Hyperchunk open source project
 *
 * Copyright 2026 the Hyperchunk project authors
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
 */

/**
 * A generic cache whose entries are built, refreshed and released through pluggable hooks.
 *
 * <p>
 * {@link org.hyperchunk.cache.KeyedCache} holds the table and drives the lifecycle. A
 * {@link org.hyperchunk.cache.CacheHooks} implementation says how a query maps to a key, how an entry is
 * created or brought up to date, and what must be released when the cache is invalidated. Entries are never
 * evicted one at a time.
 * </p>
 */
package org.hyperchunk.cache;
