package io.github.goodees.cqrs.core.middleware.command;

/*-
 * #%L
 * cqrs-core
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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lock within single process.
 */
public class LocalLock implements Lock {
    private final Set<String> locked = ConcurrentHashMap.newKeySet();

    @Override
    public boolean tryLock(String key) {
        return locked.add(key);
    }

    @Override
    public void unlock(String key) {
        if (!locked.remove(key)) {
            throw new IllegalStateException("Resource " + key + " is not locked");
        }
    }
}
