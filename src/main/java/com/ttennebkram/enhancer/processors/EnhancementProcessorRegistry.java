package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.processing.UnsupportedAlgorithmException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Registry for EnhancementProcessor implementations.
 * Auto-discovers processors at runtime via classpath scanning.
 * Processors must be annotated with @EnhancementProcessorInfo to be discovered.
 *
 * Usage:
 *   EnhancementProcessor processor = EnhancementProcessorRegistry.createProcessor("ToneMapDrago", props);
 *   Mat output = processor.process(input);
 */
public class EnhancementProcessorRegistry {

    private static final Logger LOG = Logger.getLogger(EnhancementProcessorRegistry.class.getName());

    // Map from algorithm id to processor class
    private static final Map<String, Class<? extends EnhancementProcessor>> processorClasses = new HashMap<>();

    // Map from algorithm id to annotation metadata
    private static final Map<String, EnhancementProcessorInfo> processorInfos = new HashMap<>();

    private static boolean initialized = false;

    private EnhancementProcessorRegistry() {
    }

    /**
     * Initialize the registry by scanning for processor classes.
     * Safe to call multiple times - only initializes once.
     */
    public static synchronized void initialize() {
        if (initialized) return;

        for (Class<? extends EnhancementProcessor> processorClass : EnhancementProcessorScanner.findProcessorClasses()) {
            EnhancementProcessorInfo info = processorClass.getAnnotation(EnhancementProcessorInfo.class);
            if (info == null) continue;

            Class<? extends EnhancementProcessor> existing = processorClasses.put(info.algorithm(), processorClass);
            if (existing != null && existing != processorClass) {
                LOG.warning("Algorithm " + info.algorithm() + " is declared by both "
                    + existing.getName() + " and " + processorClass.getName());
            }
            processorInfos.put(info.algorithm(), info);
        }

        LOG.fine("Registered enhancement processors: " + processorClasses.keySet());
        initialized = true;
    }

    /**
     * Check if a processor exists for the given algorithm id.
     */
    public static synchronized boolean hasProcessor(String algorithmId) {
        initialize();
        return processorClasses.containsKey(algorithmId);
    }

    /**
     * Create a new processor with default parameters.
     *
     * @throws UnsupportedAlgorithmException if no processor is registered for the id
     */
    public static EnhancementProcessor createProcessor(String algorithmId) throws UnsupportedAlgorithmException {
        return createProcessor(algorithmId, null);
    }

    /**
     * Create a new processor and load its parameters from JSON.
     * A null properties object keeps the processor defaults.
     *
     * @throws UnsupportedAlgorithmException if no processor is registered for the id
     */
    public static EnhancementProcessor createProcessor(String algorithmId, JsonObject properties)
            throws UnsupportedAlgorithmException {
        Class<? extends EnhancementProcessor> processorClass;
        synchronized (EnhancementProcessorRegistry.class) {
            initialize();
            processorClass = processorClasses.get(algorithmId);
        }
        if (processorClass == null) {
            throw new UnsupportedAlgorithmException(algorithmId);
        }

        EnhancementProcessor processor;
        try {
            processor = processorClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create processor for " + algorithmId, e);
        }
        if (properties != null) {
            processor.deserializeProperties(properties);
        }
        return processor;
    }

    /**
     * Get the display name for an algorithm id, or the id itself if none was declared.
     */
    public static synchronized String getDisplayName(String algorithmId) {
        initialize();
        EnhancementProcessorInfo info = processorInfos.get(algorithmId);
        if (info == null || info.displayName().isEmpty()) {
            return algorithmId;
        }
        return info.displayName();
    }

    /**
     * Get all registered algorithm ids.
     */
    public static synchronized Set<String> getRegisteredAlgorithms() {
        initialize();
        return Collections.unmodifiableSet(processorClasses.keySet());
    }
}
