package io.github.goodees.cqrs.core.bus;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Standard event matchers. Custom matchers are plain lambdas.
 */
public final class EventMatchers {
    private static final EventMatcher MATCH_ALL = event -> true;

    private EventMatchers() {
    }

    public static EventMatcher matchAll() {
        return MATCH_ALL;
    }

    /**
     * Match events of any of given types.
     * @param eventTypes the event types
     * @return new matcher
     */
    public static EventMatcher matchEvents(String... eventTypes) {
        Set<String> types = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(eventTypes)));
        return event -> types.contains(event.eventType());
    }

    /**
     * Match events of aggregates of any of given types.
     * @param aggregateTypes the aggregate types
     * @return new matcher
     */
    public static EventMatcher matchAggregates(String... aggregateTypes) {
        Set<String> types = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(aggregateTypes)));
        return event -> types.contains(event.aggregateType());
    }

    /**
     * Match events matched by at least one of the matchers.
     * @param matchers the matchers
     * @return new matcher
     */
    public static EventMatcher matchAny(EventMatcher... matchers) {
        List<EventMatcher> list = Collections.unmodifiableList(Arrays.asList(matchers.clone()));
        return event -> {
            for (EventMatcher matcher : list) {
                if (matcher.match(event)) {
                    return true;
                }
            }
            return false;
        };
    }
}
