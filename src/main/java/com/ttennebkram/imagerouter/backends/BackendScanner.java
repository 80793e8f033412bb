package com.ttennebkram.imagerouter.backends;

import java.io.File;
import java.lang.reflect.Modifier;
import java.net.URI;
import java.net.URL;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans the classpath at runtime to discover all backend classes annotated with @BackendInfo.
 * Works from both filesystem (IDE/development) and JAR (production).
 */
public class BackendScanner {

    private static final Logger LOG = Logger.getLogger(BackendScanner.class.getName());

    public static final String BACKENDS_PACKAGE = "com.ttennebkram.imagerouter.backends";

    /**
     * Find all concrete backend classes annotated with @BackendInfo,
     * ordered by priority and then name so installation order is stable.
     *
     * @return discovered backend classes
     */
    public static List<Class<? extends ImageBackend>> findBackendClasses() {
        return findBackendClasses(BACKENDS_PACKAGE);
    }

    static List<Class<? extends ImageBackend>> findBackendClasses(String packageName) {
        Set<Class<? extends ImageBackend>> backendClasses = new LinkedHashSet<>();
        String path = packageName.replace('.', '/');
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = BackendScanner.class.getClassLoader();
        }

        try {
            Enumeration<URL> resources = classLoader.getResources(path);
            while (resources.hasMoreElements()) {
                URL resource = resources.nextElement();
                String protocol = resource.getProtocol();

                if ("file".equals(protocol)) {
                    scanDirectory(new File(resource.toURI()), packageName, backendClasses);
                } else if ("jar".equals(protocol)) {
                    scanJar(resource, path, backendClasses);
                }
            }
        } catch (Exception e) {
            throw new IllegalStateException("Error scanning for backend classes in " + packageName, e);
        }

        List<Class<? extends ImageBackend>> sorted = new ArrayList<>(backendClasses);
        sorted.sort(Comparator
            .comparingInt((Class<? extends ImageBackend> c) -> c.getAnnotation(BackendInfo.class).priority())
            .thenComparing(c -> c.getAnnotation(BackendInfo.class).name()));
        return sorted;
    }

    /**
     * Scan a directory for backend classes.
     */
    private static void scanDirectory(File directory, String packageName,
                                      Set<Class<? extends ImageBackend>> result) {
        if (!directory.exists()) return;

        File[] files = directory.listFiles();
        if (files == null) return;

        for (File file : files) {
            if (file.isDirectory()) {
                scanDirectory(file, packageName + "." + file.getName(), result);
            } else if (file.getName().endsWith("Backend.class")) {
                // Only check files ending with "Backend.class" for efficiency
                String className = packageName + "." + file.getName().replace(".class", "");
                tryLoadBackendClass(className, result);
            }
        }
    }

    /**
     * Scan a JAR file for backend classes.
     */
    private static void scanJar(URL jarUrl, String packagePath,
                                Set<Class<? extends ImageBackend>> result) throws Exception {
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
                if (name.startsWith(packagePath) && name.endsWith("Backend.class")) {
                    String className = name.replace('/', '.').replace(".class", "");
                    tryLoadBackendClass(className, result);
                }
            }
        }
    }

    /**
     * Try to load a class and add it to the result if it's a valid backend class.
     */
    private static void tryLoadBackendClass(String className,
                                            Set<Class<? extends ImageBackend>> result) {
        try {
            Class<?> clazz = Class.forName(className);

            if (!ImageBackend.class.isAssignableFrom(clazz)) return;
            if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) return;
            if (!clazz.isAnnotationPresent(BackendInfo.class)) return;

            @SuppressWarnings("unchecked")
            Class<? extends ImageBackend> backendClass = (Class<? extends ImageBackend>) clazz;
            result.add(backendClass);

        } catch (ClassNotFoundException | LinkageError e) {
            // A backend whose library is missing from the classpath is simply not offered
            LOG.log(Level.WARNING, "Skipping backend class " + className + ": " + e);
        }
    }
}
