package groundcontrol.coordinator.model;

public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR
}
