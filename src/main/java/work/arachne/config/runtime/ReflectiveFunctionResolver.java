package work.arachne.config.runtime;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Optional;
import java.util.function.UnaryOperator;
import work.arachne.config.error.UnresolvedFunctionException;
import work.arachne.config.store.ConfigGraph;

/**
 * Resolves {@code pkg.Class#method} (or {@code pkg.Class/method}) to a public static method taking
 * and returning a {@link ConfigGraph}. The class is loaded, and initialized, on resolution.
 */
public final class ReflectiveFunctionResolver implements FunctionResolver {
    private final ClassLoader classLoader;

    public ReflectiveFunctionResolver() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ReflectiveFunctionResolver(ClassLoader classLoader) {
        this.classLoader = classLoader == null ? ReflectiveFunctionResolver.class.getClassLoader() : classLoader;
    }

    @Override
    public Optional<UnaryOperator<ConfigGraph>> find(String reference) {
        try {
            return Optional.of(resolve(reference));
        } catch (UnresolvedFunctionException ex) {
            return Optional.empty();
        }
    }

    @Override
    public UnaryOperator<ConfigGraph> resolve(String reference) {
        int split = reference.indexOf('#');
        if (split < 0) {
            split = reference.lastIndexOf('/');
        }
        if (split <= 0 || split == reference.length() - 1) {
            throw new UnresolvedFunctionException(reference, "The reference does not name a class and a method", null);
        }
        String className = reference.substring(0, split);
        String methodName = reference.substring(split + 1);
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError ex) {
            throw new UnresolvedFunctionException(reference, "Class " + className + " could not be loaded", ex);
        }
        Method method = findMethod(type, methodName)
            .orElseThrow(() -> new UnresolvedFunctionException(reference,
                "Class " + className + " has no public static method " + methodName + "(ConfigGraph)", null));
        return graph -> invoke(method, graph, reference);
    }

    private static Optional<Method> findMethod(Class<?> type, String name) {
        for (Method method : type.getMethods()) {
            if (!method.getName().equals(name) || !Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            Class<?>[] params = method.getParameterTypes();
            if (params.length == 1
                && params[0].isAssignableFrom(ConfigGraph.class)
                && ConfigGraph.class.isAssignableFrom(method.getReturnType())) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    private static ConfigGraph invoke(Method method, ConfigGraph graph, String reference) {
        try {
            return (ConfigGraph) method.invoke(null, graph);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Initializer function " + reference + " failed", cause);
        } catch (IllegalAccessException ex) {
            throw new UnresolvedFunctionException(reference, "The method is not accessible", ex);
        }
    }
}
