package io.github.goodees.cqrs.core.repo;

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

/**
 * Failure of a read model repository.
 */
public class RepoException extends Exception {
    private final Fault fault;
    private final String namespace;

    public enum Fault {
        ENTITY_NOT_FOUND, MISSING_ENTITY_ID, INCORRECT_ENTITY_VERSION, SAVE_FAILED
    }

    protected RepoException(Fault fault, String namespace, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.namespace = namespace;
    }

    public Fault getFault() {
        return fault;
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isNotFound() {
        return fault == Fault.ENTITY_NOT_FOUND;
    }

    public static RepoException notFound(String namespace, ID id) {
        return new RepoException(Fault.ENTITY_NOT_FOUND, namespace, "could not find entity " + id, null);
    }

    public static RepoException missingId(String namespace) {
        return new RepoException(Fault.MISSING_ENTITY_ID, namespace, "missing entity ID", null);
    }

    public static RepoException incorrectVersion(String namespace, ID id, int minVersion, int version) {
        return new RepoException(Fault.INCORRECT_ENTITY_VERSION, namespace, "entity " + id + " has version "
                + version + ", expected at least " + minVersion, null);
    }

    public static RepoException saveFailed(String namespace, ID id, Throwable cause) {
        return new RepoException(Fault.SAVE_FAILED, namespace, "could not save entity " + id + ": "
                + cause.getMessage(), cause);
    }
}
