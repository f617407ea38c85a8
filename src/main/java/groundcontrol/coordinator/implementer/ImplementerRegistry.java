package groundcontrol.coordinator.implementer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to implementer lookup. Instances are shared across tasks.
 */
public class ImplementerRegistry {

    private final Map<String, Implementer> implementers = new ConcurrentHashMap<>();

    public static ImplementerRegistry defaults(Duration timeout) {
        ImplementerRegistry registry = new ImplementerRegistry();
        registry.register(new ClaudeCodeImplementer(timeout));
        registry.register(new CursorCliImplementer(timeout));
        return registry;
    }

    public ImplementerRegistry register(Implementer implementer) {
        implementers.put(implementer.name(), implementer);
        return this;
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under {@code name}
     */
    public Implementer get(String name) {
        Implementer implementer = name != null ? implementers.get(name) : null;
        if (implementer == null) {
            throw new IllegalArgumentException(
                    "Unknown implementer: " + name + ". Available: " + names());
        }
        return implementer;
    }

    public List<String> names() {
        return implementers.keySet().stream().sorted().toList();
    }
}
