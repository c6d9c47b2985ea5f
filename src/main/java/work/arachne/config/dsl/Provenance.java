package work.arachne.config.dsl;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Records which DSL form is contributing to the configuration in context. Provenance is pushed for
 * the dynamic extent of a DSL invocation on the calling thread; nested invocations stack.
 *
 * @param function qualified name of the DSL form
 * @param arguments the arguments exactly as supplied
 * @param stackFilter selects the stack frames that originate from user scripts
 */
public record Provenance(String function, List<Object> arguments, Predicate<StackTraceElement> stackFilter) {
    private static final ThreadLocal<Deque<Provenance>> STACK = ThreadLocal.withInitial(ArrayDeque::new);

    public Provenance {
        Objects.requireNonNull(function, "function");
        arguments = arguments == null ? List.of() : Collections.unmodifiableList(arguments);
        stackFilter = stackFilter == null ? ScriptFrames::isScriptFrame : stackFilter;
    }

    public static <T> T with(Provenance provenance, Supplier<T> body) {
        Deque<Provenance> stack = STACK.get();
        stack.push(provenance);
        try {
            return body.get();
        } finally {
            stack.pop();
            if (stack.isEmpty()) {
                STACK.remove();
            }
        }
    }

    public static Optional<Provenance> current() {
        return Optional.ofNullable(STACK.get().peek());
    }

    public static Optional<String> currentFunctionName() {
        return current().map(Provenance::function);
    }

    public List<StackTraceElement> scriptFrames(StackTraceElement[] trace) {
        return ScriptFrames.filter(trace, stackFilter);
    }
}
