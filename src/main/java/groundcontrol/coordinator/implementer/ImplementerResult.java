package groundcontrol.coordinator.implementer;

import java.util.List;

public record ImplementerResult(boolean success, String output, String error, List<String> filesChanged) {

    public ImplementerResult {
        output = output != null ? output : "";
        filesChanged = filesChanged != null ? List.copyOf(filesChanged) : List.of();
    }

    public static ImplementerResult ok(String output) {
        return new ImplementerResult(true, output, null, null);
    }

    public static ImplementerResult fail(String error) {
        return new ImplementerResult(false, "", error, null);
    }

    public static ImplementerResult fail(String output, String error) {
        return new ImplementerResult(false, output, error, null);
    }
}
