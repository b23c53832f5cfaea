package io.github.goodees.cqrs.core.id;

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

import java.util.Objects;

/**
 * Process-wide identifier provider. Select the provider at startup, before any identifiers are created; the
 * default is {@link UuidIdProvider}.
 */
public final class Ids {
    private static volatile IdProvider provider = new UuidIdProvider();

    private Ids() {
    }

    public static void use(IdProvider idProvider) {
        provider = Objects.requireNonNull(idProvider, "Id provider must be specified");
    }

    public static IdProvider provider() {
        return provider;
    }

    public static ID newId() {
        return provider.newId();
    }

    public static ID emptyId() {
        return provider.emptyId();
    }

    public static ID parse(String value) {
        return provider.parse(value);
    }
}
