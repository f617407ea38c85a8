package groundcontrol.coordinator.agent;

import groundcontrol.coordinator.implementer.Implementer;
import groundcontrol.coordinator.implementer.ImplementerResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Records prompts and answers from a function.
 */
public class StubImplementer implements Implementer {

    private final String name;
    private final Function<String, ImplementerResult> behaviour;
    private final List<String> prompts = new CopyOnWriteArrayList<>();

    public StubImplementer(String name, Function<String, ImplementerResult> behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    public static StubImplementer succeeding(String name) {
        return new StubImplementer(name, prompt -> ImplementerResult.ok("ok"));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ImplementerResult execute(String prompt, String projectPath, Map<String, Object> context) {
        prompts.add(prompt);
        return behaviour.apply(prompt);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public List<String> prompts() {
        return prompts;
    }
}
