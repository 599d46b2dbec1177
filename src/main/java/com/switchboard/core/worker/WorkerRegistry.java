package com.switchboard.core.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link WorkerDirectory} with three layers.
 * <p>
 * Resolution order by name: custom, then override, then built-in. Every {@link Worker}
 * bean in the application context is registered as built-in.
 */
@Component
public class WorkerRegistry implements WorkerDirectory {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<String, Worker> builtin = new ConcurrentHashMap<>();
    private final Map<String, Worker> overrides = new ConcurrentHashMap<>();
    private final Map<String, Worker> custom = new ConcurrentHashMap<>();

    public WorkerRegistry() {
    }

    @Autowired
    public WorkerRegistry(ObjectProvider<Worker> workers) {
        workers.orderedStream().forEach(this::registerBuiltin);
    }

    public void registerBuiltin(Worker worker) {
        log.debug("Registering built-in worker: {}", worker.name());
        builtin.put(worker.name(), worker);
    }

    public void registerOverride(Worker worker) {
        if (!builtin.containsKey(worker.name())) {
            log.warn("Override registered for '{}' but no built-in worker with that name exists", worker.name());
        }
        log.info("Worker override registered: {}", worker.name());
        overrides.put(worker.name(), worker);
    }

    public void registerCustom(Worker worker) {
        log.info("Custom worker registered: {}", worker.name());
        custom.put(worker.name(), worker);
    }

    public boolean removeCustom(String name) {
        return custom.remove(name) != null;
    }

    /** Drops an override so the built-in worker of that name is visible again. */
    public boolean removeOverride(String name) {
        return overrides.remove(name) != null;
    }

    @Override
    public Worker get(String name) {
        if (name != null) {
            Worker worker = custom.get(name);
            if (worker == null) worker = overrides.get(name);
            if (worker == null) worker = builtin.get(name);
            if (worker != null) return worker;
        }
        throw new WorkerNotFoundException(name, listNames());
    }

    public boolean contains(String name) {
        return custom.containsKey(name) || overrides.containsKey(name) || builtin.containsKey(name);
    }

    @Override
    public List<Worker> findByCapability(String capability) {
        var results = new ArrayList<Worker>();
        Set<String> seen = new HashSet<>();
        for (var layer : List.of(custom, overrides, builtin)) {
            for (var worker : sorted(layer)) {
                if (worker.capabilities().contains(capability) && seen.add(worker.name())) {
                    results.add(worker);
                }
            }
        }
        return results;
    }

    /**
     * Asks every resolved worker to score the task and returns the highest scorer,
     * provided its score is positive.
     */
    @Override
    public Optional<Worker> findBestMatch(String taskText) {
        Worker best = null;
        double bestScore = 0.0;
        for (var worker : listAll()) {
            double score = worker.canHandle(taskText);
            if (score > bestScore) {
                best = worker;
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("Best match for '{}': {} (score {})", taskText, best.name(), bestScore);
        }
        return Optional.ofNullable(best);
    }

    /** All resolved workers, one per name, built-ins replaced by overrides and custom workers. */
    public List<Worker> listAll() {
        var resolved = new LinkedHashMap<String, Worker>();
        sorted(builtin).forEach(w -> resolved.put(w.name(), w));
        sorted(overrides).forEach(w -> resolved.put(w.name(), w));
        sorted(custom).forEach(w -> resolved.put(w.name(), w));
        return List.copyOf(resolved.values());
    }

    @Override
    public List<String> listNames() {
        return listAll().stream().map(Worker::name).toList();
    }

    /** Layer a name resolves from: "custom", "override" or "builtin". */
    public String sourceOf(String name) {
        if (custom.containsKey(name)) return "custom";
        if (overrides.containsKey(name)) return "override";
        if (builtin.containsKey(name)) return "builtin";
        throw new WorkerNotFoundException(name, listNames());
    }

    public int size() {
        return listAll().size();
    }

    private static List<Worker> sorted(Map<String, Worker> layer) {
        return layer.values().stream().sorted(Comparator.comparing(Worker::name)).toList();
    }
}
