package com.loopclaw.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(Tool tool) {
        lock.writeLock().lock();
        try {
            if (tools.containsKey(tool.name())) {
                throw new IllegalArgumentException("Duplicate tool: " + tool.name());
            }
            tools.put(tool.name(), tool);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered tool: {}", tool.name());
    }

    public boolean unregister(String name) {
        lock.writeLock().lock();
        try {
            return tools.remove(name) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Tool get(String name) {
        lock.readLock().lock();
        try {
            return tools.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public List<Tool> listTools() {
        lock.readLock().lock();
        try {
            return List.copyOf(tools.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> names() {
        lock.readLock().lock();
        try {
            return List.copyOf(tools.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ToolDefinition> definitions() {
        var defs = new ArrayList<ToolDefinition>();
        for (var t : listTools()) defs.add(t.toolDefinition());
        return defs;
    }

    public List<Tool> getSafeTools() {
        return listTools().stream().filter(t -> !t.isDangerous()).toList();
    }

    public List<Tool> getDangerousTools() {
        return listTools().stream().filter(Tool::isDangerous).toList();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return tools.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            tools.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
