package io.tick4j.core;

import io.tick4j.JobHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature job handlers by name, in declaration order.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlersByName;

    public JobHandlerRegistry(List<JobHandler> handlers) {
        Map<String, JobHandler> byName = new LinkedHashMap<>();
        for (JobHandler handler : handlers) {
            if (byName.putIfAbsent(handler.name(), handler) != null) {
                throw new IllegalStateException("Duplicate JobHandler name: " + handler.name());
            }
        }
        this.handlersByName = byName;
    }

    public List<JobHandler> handlers() {
        return List.copyOf(handlersByName.values());
    }

    public JobHandler getRequired(String name) {
        JobHandler handler = handlersByName.get(name);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for name: " + name);
        }
        return handler;
    }
}
