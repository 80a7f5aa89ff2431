package slate.client.collect;

import slate.core.exception.CollectionException;
import slate.core.util.Logger;
import slate.core.util.ObjectChecker;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves command-line targets into test classes.
 *
 * A target is either a directory of compiled classes laid out in their package structure, in which case every
 * {@code .class} file whose name matches the matcher is loaded, or the binary name of a single class. Directory targets
 * and any extra classpath entries are added to the class loader the classes are loaded with. Closing the finder closes
 * the class loader it created for them, so it must stay open until the loaded classes are no longer used.
 */
public final class TestClassFinder implements Closeable {
    public static final String DEFAULT_MATCHER = ".*Test\\.class";
    private static final Logger LOGGER = Logger.forClass(TestClassFinder.class);
    private final Pattern matcher;
    private final ClassLoader classLoader;
    private final URLClassLoader ownedClassLoader;
    private final List<String> targets;

    private TestClassFinder(Pattern matcher, ClassLoader classLoader, URLClassLoader ownedClassLoader, List<String> targets) {
        this.matcher = matcher;
        this.classLoader = classLoader;
        this.ownedClassLoader = ownedClassLoader;
        this.targets = targets;
    }

    /**
     * Creates a finder over the given targets.
     *
     * @param targets The directories and class names to collect from.
     * @param classpath Additional jars or class directories the test classes depend on.
     * @param matcher The regular expression class file names in directory targets must match.
     * @param parent The parent of the class loader test classes are loaded with.
     * @return the finder.
     * @throws CollectionException If the matcher or a classpath entry is malformed.
     */
    public static TestClassFinder forTargets(List<String> targets, List<String> classpath, String matcher, ClassLoader parent) throws CollectionException {
        ObjectChecker.assertNonNull(targets, classpath, matcher, parent);
        ObjectChecker.assertNoNullElements(targets);
        ObjectChecker.assertNoNullElements(classpath);

        Pattern pattern;
        try {
            pattern = Pattern.compile(matcher);
        } catch (PatternSyntaxException e) {
            throw new CollectionException("Invalid test class matcher: " + matcher, e);
        }

        List<URL> urls = new ArrayList<>();
        try {
            for (String target : targets) {
                File file = new File(target);
                if (file.isDirectory()) {
                    urls.add(file.toURI().toURL());
                }
            }
            for (String entry : classpath) {
                urls.add(new File(entry).toURI().toURL());
            }
        } catch (MalformedURLException e) {
            throw new CollectionException("Invalid classpath entry: " + e.getMessage(), e);
        }

        if (urls.isEmpty()) {
            return new TestClassFinder(pattern, parent, null, new ArrayList<>(targets));
        }
        URLClassLoader classLoader = new URLClassLoader(urls.toArray(new URL[0]), parent);
        return new TestClassFinder(pattern, classLoader, classLoader, new ArrayList<>(targets));
    }

    /**
     * Loads the test classes of all targets, in target order. Classes found in a directory are ordered by binary name.
     *
     * @return the test classes.
     * @throws CollectionException If a directory cannot be read or a class cannot be loaded.
     */
    public List<Class<?>> findClasses() throws CollectionException {
        List<Class<?>> classes = new ArrayList<>();
        for (String target : this.targets) {
            File file = new File(target);
            if (file.isDirectory()) {
                for (String className : findClassNames(file.toPath())) {
                    classes.add(load(className));
                }
            } else {
                classes.add(load(target));
            }
        }
        return classes;
    }

    public ClassLoader getClassLoader() {
        return this.classLoader;
    }

    private List<String> findClassNames(Path baseDir) throws CollectionException {
        try (Stream<Path> files = Files.walk(baseDir)) {
            List<String> names = files
                    .filter(Files::isRegularFile)
                    .filter(path -> this.matcher.matcher(path.getFileName().toString()).matches())
                    .map(path -> toBinaryName(baseDir, path))
                    .sorted()
                    .collect(Collectors.toList());
            LOGGER.log("Found " + names.size() + " test classes in " + baseDir);
            return names;
        } catch (IOException e) {
            throw new CollectionException("Failed to scan test directory: " + baseDir, e);
        }
    }

    private static String toBinaryName(Path baseDir, Path classFile) {
        String relative = baseDir.relativize(classFile).toString().replace(File.separatorChar, '/');
        String withSuffixStripped = relative.endsWith(".class") ? relative.substring(0, relative.length() - ".class".length()) : relative;
        return withSuffixStripped.replace('/', '.');
    }

    private Class<?> load(String className) throws CollectionException {
        LOGGER.log("Loading test class: " + className);
        try {
            return Class.forName(className, true, this.classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new CollectionException("Failed to load test class: " + className, e);
        }
    }

    @Override
    public void close() throws IOException {
        if (this.ownedClassLoader != null) {
            this.ownedClassLoader.close();
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { targets: " + this.targets + ", matcher: " + this.matcher + " }";
    }
}
