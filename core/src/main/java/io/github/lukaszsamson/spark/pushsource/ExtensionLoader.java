package io.github.lukaszsamson.spark.pushsource;

/**
 * Loads user-supplied implementation classes named in connector options,
 * such as a custom {@link MessageParser}.
 *
 * <p>The class must implement the expected interface and have a public
 * no-arg constructor.
 */
public final class ExtensionLoader {

    private ExtensionLoader() {}

    /**
     * Resolve {@code className} and check it implements {@code expectedType}.
     *
     * @throws IllegalArgumentException if the class is missing or of the wrong type
     */
    public static <T> Class<? extends T> resolve(String className, Class<T> expectedType,
                                                 String optionName) {
        Class<?> clazz = findClass(className, optionName);
        if (!expectedType.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException(
                    "Class specified by '" + optionName + "' (" + className +
                            ") does not implement " + expectedType.getName());
        }
        return clazz.asSubclass(expectedType);
    }

    /**
     * Resolve and instantiate {@code className}.
     *
     * @throws IllegalArgumentException if the class cannot be loaded, is of the
     *         wrong type, or cannot be instantiated
     */
    public static <T> T load(String className, Class<T> expectedType, String optionName) {
        Class<? extends T> clazz = resolve(className, expectedType, optionName);
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                    "Class specified by '" + optionName + "' (" + className +
                            ") must have a public no-arg constructor", e);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException(
                    "Failed to instantiate class specified by '" + optionName +
                            "': " + className, e);
        }
    }

    private static Class<?> findClass(String className, String optionName) {
        ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
        ClassLoader ownLoader = ExtensionLoader.class.getClassLoader();
        ClassNotFoundException notFound = null;
        for (ClassLoader loader : new ClassLoader[]{contextLoader, ownLoader}) {
            if (loader == null) {
                continue;
            }
            try {
                return Class.forName(className, true, loader);
            } catch (ClassNotFoundException e) {
                if (notFound == null) {
                    notFound = e;
                }
            }
        }
        throw new IllegalArgumentException(
                "Class specified by '" + optionName + "' not found: " + className, notFound);
    }
}
