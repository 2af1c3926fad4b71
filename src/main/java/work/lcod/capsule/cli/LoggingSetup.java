package work.lcod.capsule.cli;

import org.slf4j.LoggerFactory;
import work.lcod.capsule.api.LogLevel;

final class LoggingSetup {
    private LoggingSetup() {}

    static void apply(LogLevel level) {
        var root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(level.logbackLevel());
        }
    }
}
