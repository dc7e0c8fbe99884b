package com.ttennebkram.enhancer.processors;

import java.io.File;
import java.lang.reflect.Modifier;
import java.net.URI;
import java.net.URL;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans the classpath at runtime to discover all EnhancementProcessor classes
 * annotated with @EnhancementProcessorInfo.
 * Works from both filesystem (IDE/tests) and JAR (production).
 */
public class EnhancementProcessorScanner {

    private static final Logger LOG = Logger.getLogger(EnhancementProcessorScanner.class.getName());

    private static final String PROCESSORS_PACKAGE = EnhancementProcessorScanner.class.getPackage().getName();

    private EnhancementProcessorScanner() {
    }

    /**
     * Find all concrete processor classes annotated with @EnhancementProcessorInfo.
     *
     * @return set of discovered processor classes
     */
    public static Set<Class<? extends EnhancementProcessor>> findProcessorClasses() {
        Set<Class<? extends EnhancementProcessor>> processorClasses = new LinkedHashSet<>();
        String path = PROCESSORS_PACKAGE.replace('.', '/');
        ClassLoader classLoader = EnhancementProcessorScanner.class.getClassLoader();

        try {
            Enumeration<URL> resources = classLoader.getResources(path);
            while (resources.hasMoreElements()) {
                URL resource = resources.nextElement();
                String protocol = resource.getProtocol();

                if ("file".equals(protocol)) {
                    scanDirectory(new File(resource.toURI()), PROCESSORS_PACKAGE, classLoader, processorClasses);
                } else if ("jar".equals(protocol)) {
                    scanJar(resource, path, classLoader, processorClasses);
                }
            }
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Error scanning for enhancement processors", e);
        }

        return processorClasses;
    }

    private static void scanDirectory(File directory, String packageName, ClassLoader classLoader,
                                      Set<Class<? extends EnhancementProcessor>> result) {
        if (!directory.exists()) return;

        File[] files = directory.listFiles();
        if (files == null) return;

        for (File file : files) {
            if (file.isDirectory()) {
                scanDirectory(file, packageName + "." + file.getName(), classLoader, result);
            } else if (file.getName().endsWith("Processor.class")) {
                // Only check files ending with "Processor.class" for efficiency
                String className = packageName + "." + file.getName().replace(".class", "");
                tryLoadProcessorClass(className, classLoader, result);
            }
        }
    }

    private static void scanJar(URL jarUrl, String packagePath, ClassLoader classLoader,
                                Set<Class<? extends EnhancementProcessor>> result) {
        try {
            // Extract JAR path from URL like "jar:file:/path/to.jar!/com/..."
            String urlPath = jarUrl.getPath();
            int bangIndex = urlPath.indexOf('!');
            if (bangIndex < 0) return;

            String jarPath = urlPath.substring(0, bangIndex);
            if (jarPath.startsWith("file:")) {
                jarPath = new URI(jarPath).getPath();
            }

            try (JarFile jarFile = new JarFile(jarPath)) {
                Enumeration<JarEntry> entries = jarFile.entries();
                while (entries.hasMoreElements()) {
                    String name = entries.nextElement().getName();
                    if (name.startsWith(packagePath) && name.endsWith("Processor.class")) {
                        String className = name.replace('/', '.').replace(".class", "");
                        tryLoadProcessorClass(className, classLoader, result);
                    }
                }
            }
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Error scanning JAR for enhancement processors: " + jarUrl, e);
        }
    }

    private static void tryLoadProcessorClass(String className, ClassLoader classLoader,
                                              Set<Class<? extends EnhancementProcessor>> result) {
        try {
            Class<?> clazz = Class.forName(className, false, classLoader);

            if (!EnhancementProcessor.class.isAssignableFrom(clazz)) return;
            if (Modifier.isAbstract(clazz.getModifiers()) || clazz.isInterface()) return;
            if (!clazz.isAnnotationPresent(EnhancementProcessorInfo.class)) return;

            @SuppressWarnings("unchecked")
            Class<? extends EnhancementProcessor> processorClass = (Class<? extends EnhancementProcessor>) clazz;
            result.add(processorClass);
        } catch (ClassNotFoundException | NoClassDefFoundError e) {
            LOG.log(Level.FINE, "Skipping unloadable class " + className, e);
        }
    }
}
