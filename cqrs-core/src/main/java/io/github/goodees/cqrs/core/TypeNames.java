package io.github.goodees.cqrs.core;

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

/**
 * Derivation of type names from class names.
 */
public final class TypeNames {
    private TypeNames() {

    }

    /**
     * Default type name of a payload class. Strips prefix {@code Immutable} and suffix {@code Data}.
     * @param clazz the payload class
     * @return Simple name. ImmutableItemAddedData becomes ItemAdded.
     */
    public static String defaultTypeName(Class<?> clazz) {
        return fromSimpleClassnameStripping(clazz.getSimpleName(), "Immutable", "Data");
    }

    public static String fromClassStripping(Class<?> clazz, String stripPrefix, String stripSuffix) {
        return fromSimpleClassnameStripping(clazz.getSimpleName(), stripPrefix, stripSuffix);
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) ? simpleClassName.length() - suffix.length()
                : simpleClassName.length();
        if (end <= start) {
            return simpleClassName;
        }
        return simpleClassName.substring(start, end);
    }
}
