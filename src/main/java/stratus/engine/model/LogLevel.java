package stratus.engine.model;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
