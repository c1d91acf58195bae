package org.stianloader.picochannel.logging;

import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    private static java.util.logging.Level toJUL(@NotNull Level level) {
        switch (level) {
        case DEBUG:
            return java.util.logging.Level.FINE;
        case INFO:
            return java.util.logging.Level.INFO;
        case WARN:
            return java.util.logging.Level.WARNING;
        case ERROR:
            return java.util.logging.Level.SEVERE;
        default:
            throw new IllegalArgumentException("Unknown level: " + level);
        }
    }

    @Override
    public void log(@NotNull Level level, @NotNull Class<?> clazz, @NotNull String message, Object @NotNull... args) {
        Logger.getLogger(clazz.getName()).log(JULLogAdapter.toJUL(level), () -> {
            return LoggingAdapter.format(message, args);
        });
    }
}
