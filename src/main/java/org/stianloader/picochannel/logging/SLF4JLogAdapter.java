package org.stianloader.picochannel.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SLF4JLogAdapter extends LoggingAdapter {

    @Override
    public void log(@NotNull Level level, @NotNull Class<?> clazz, @NotNull String message, Object @NotNull... args) {
        Logger logger = LoggerFactory.getLogger(clazz);
        switch (level) {
        case DEBUG:
            logger.debug(message, args);
            break;
        case INFO:
            logger.info(message, args);
            break;
        case WARN:
            logger.warn(message, args);
            break;
        case ERROR:
            logger.error(message, args);
            break;
        default:
            throw new IllegalArgumentException("Unknown level: " + level);
        }
    }
}
