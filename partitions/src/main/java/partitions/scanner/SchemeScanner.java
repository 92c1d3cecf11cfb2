package partitions.scanner;

import partitions.annotations.PartitionScheme;
import partitions.scheme.SchemeExtension;
import partitions.scheme.SchemeRegistry;
import partitions.scheme.UserPartitionScheme;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scans packages for classes annotated with {@link PartitionScheme}.
 *
 * <p>This scanner uses the Reflections library. Each discovered class becomes
 * a {@link SchemeExtension} whose factory calls the class's
 * {@code (SchemeExtension)} constructor, or its no-arg constructor when there
 * is none.
 *
 * <h2>Usage:</h2>
 * <pre>
 * // Scan one package with the default classloader
 * SchemeRegistry registry = SchemeScanner.scan(List.of("com.example.schemes"), null);
 * </pre>
 *
 * @see PartitionScheme
 * @see SchemeRegistry
 */
public final class SchemeScanner {

    private static final Logger log = LoggerFactory.getLogger(SchemeScanner.class);

    private SchemeScanner() {}

    /**
     * Scans the given packages and registers every annotated scheme.
     *
     * @param packages package prefixes to scan
     * @param classLoader the classloader to scan, or null for the default
     * @return a registry holding the discovered schemes
     * @throws IllegalStateException if a class is not a valid scheme, or two classes share a name
     */
    public static SchemeRegistry scan(Collection<String> packages, ClassLoader classLoader) {
        SchemeRegistry registry = new SchemeRegistry();
        if (packages.isEmpty()) {
            return registry;
        }

        ClassLoader loader = classLoader != null ? classLoader : SchemeScanner.class.getClassLoader();

        Set<URL> urls = new LinkedHashSet<>();
        FilterBuilder filter = new FilterBuilder();
        for (String pkg : packages) {
            urls.addAll(ClasspathHelper.forPackage(pkg, loader));
            filter.includePackage(pkg);
        }
        if (urls.isEmpty()) {
            log.debug("No classpath entries contain packages {}", packages);
            return registry;
        }

        ConfigurationBuilder config = new ConfigurationBuilder()
                .setUrls(urls)
                .filterInputsBy(filter)
                .addClassLoaders(loader)
                .addScanners(Scanners.TypesAnnotated);

        Reflections reflections = new Reflections(config);
        List<Class<?>> classes = reflections.getTypesAnnotatedWith(PartitionScheme.class, true).stream()
                .sorted(Comparator.comparing(Class::getName))
                .toList();

        for (Class<?> type : classes) {
            String name = type.getAnnotation(PartitionScheme.class).value();
            registry.register(name, factoryFor(type));
            log.debug("Discovered scheme '{}' in {}", name, type.getName());
        }
        return registry;
    }

    /**
     * Builds a factory for an annotated scheme class.
     *
     * @param type the class annotated with {@code @PartitionScheme}
     * @return a factory instantiating the class
     * @throws IllegalStateException if the class is not a concrete scheme with a usable constructor
     */
    static SchemeExtension.Factory factoryFor(Class<?> type) {
        if (!UserPartitionScheme.class.isAssignableFrom(type)) {
            throw new IllegalStateException(
                    "@PartitionScheme must implement UserPartitionScheme: " + type.getName());
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalStateException(
                    "@PartitionScheme must be a concrete class: " + type.getName());
        }

        Constructor<?> withExtension = constructor(type, SchemeExtension.class);
        if (withExtension != null) {
            return extension -> newInstance(withExtension, extension);
        }
        Constructor<?> noArg = constructor(type);
        if (noArg != null) {
            return extension -> newInstance(noArg);
        }
        throw new IllegalStateException(
                type.getName() + " must have a (SchemeExtension) or no-arg constructor");
    }

    private static Constructor<?> constructor(Class<?> type, Class<?>... parameterTypes) {
        for (Constructor<?> ctor : type.getDeclaredConstructors()) {
            if (Arrays.equals(ctor.getParameterTypes(), parameterTypes)) {
                ctor.setAccessible(true);
                return ctor;
            }
        }
        return null;
    }

    private static UserPartitionScheme newInstance(Constructor<?> ctor, Object... args) {
        try {
            return (UserPartitionScheme) ctor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException(
                    "Failed to instantiate " + ctor.getDeclaringClass().getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(
                    "Failed to instantiate " + ctor.getDeclaringClass().getName(), e);
        }
    }
}
