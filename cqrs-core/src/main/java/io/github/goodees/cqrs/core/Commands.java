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

import io.github.goodees.cqrs.core.id.ID;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.Map;

/**
 * Command utilities.
 */
public final class Commands {
    private Commands() {
    }

    /**
     * Check that all fields of the command are set.
     * <p>A field is missing when it is null, an empty string, collection, map or array, an empty {@link ID}, or
     * an array containing a missing element. Primitive fields are never missing. Static and transient fields, and
     * fields annotated with {@link OptionalField} are not checked.</p>
     * @param command the command to check
     * @throws CommandException with fault {@code MISSING_FIELD} naming first missing field
     */
    public static void checkCommand(Command command) throws CommandException {
        Class<?> clazz = command.getClass();
        while (clazz != null && clazz != Object.class) {
            for (Field field : clazz.getDeclaredFields()) {
                if (isChecked(field) && isMissing(read(field, command))) {
                    throw CommandException.missingField(command, field.getName());
                }
            }
            clazz = clazz.getSuperclass();
        }
    }

    private static boolean isChecked(Field field) {
        int modifiers = field.getModifiers();
        return !field.isSynthetic()
                && !Modifier.isStatic(modifiers)
                && !Modifier.isTransient(modifiers)
                && !field.getType().isPrimitive()
                && !field.isAnnotationPresent(OptionalField.class);
    }

    private static Object read(Field field, Command command) {
        try {
            field.setAccessible(true);
            return field.get(command);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new IllegalStateException("Cannot read field " + field.getName() + " of "
                    + command.getClass().getName(), e);
        }
    }

    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof ID) {
            return ((ID) value).isEmpty();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            if (length == 0) {
                return true;
            }
            if (!value.getClass().getComponentType().isPrimitive()) {
                for (int i = 0; i < length; i++) {
                    if (isMissing(Array.get(value, i))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
