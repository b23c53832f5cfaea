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

import io.github.goodees.cqrs.core.Context;
import io.github.goodees.cqrs.core.Event;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Delivery queues shared by event buses, one queue per handler type.
 * <p>Every event published by any bus of the group is put into every queue. Handlers of one type, registered on
 * different buses of the group, consume the same queue, so each event is delivered to exactly one of them. Queues
 * are unbounded, publishing never blocks.</p>
 */
public class EventBusGroup {
    private final String name;
    private final Map<String, Topic> topics = new HashMap<>();

    public EventBusGroup(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    synchronized BlockingQueue<Delivery> join(String handlerType) {
        Topic topic = topics.computeIfAbsent(handlerType, k -> new Topic());
        topic.members++;
        return topic.queue;
    }

    synchronized void leave(String handlerType) {
        Topic topic = topics.get(handlerType);
        if (topic != null && --topic.members == 0) {
            topics.remove(handlerType);
        }
    }

    synchronized void publish(Context ctx, Event event) {
        Delivery delivery = new Delivery(ctx, event);
        for (Topic topic : topics.values()) {
            topic.queue.add(delivery);
        }
    }

    synchronized int members(String handlerType) {
        Topic topic = topics.get(handlerType);
        return topic == null ? 0 : topic.members;
    }

    @Override
    public String toString() {
        return "EventBusGroup[" + name + "]";
    }

    static final class Delivery {
        final Context ctx;
        final Event event;

        Delivery(Context ctx, Event event) {
            this.ctx = ctx;
            this.event = event;
        }
    }

    private static final class Topic {
        final BlockingQueue<Delivery> queue = new LinkedBlockingQueue<>();
        int members;
    }
}
