package org.stianloader.picochannel.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Logging facade of picochannel.
 *
 * <p>picochannel does not want to force a logging framework onto the applications embedding it.
 * Thus all log output goes through the current {@link #getDefaultLogger() default logger}, which
 * forwards to SLF4J if {@code org.slf4j.LoggerFactory} can be found on the classpath and to
 * {@link java.util.logging.Logger JUL} otherwise. Applications with other needs may install their
 * own adapter through {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a matching placeholder
 * are appended to the message. If the last argument is a {@link Throwable} its stacktrace is
 * part of the output.
 */
public abstract class LoggingAdapter {

    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR;
    }

    @NotNull
    private static volatile LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        LoggingAdapter.currentInstance = instance;
    }

    @NotNull
    @Contract(pure = true)
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    /**
     * Substitutes the "{}" placeholders of a message. Only needed by sinks that do not
     * understand placeholders on their own.
     *
     * @param message The message pattern
     * @param args The arguments to insert
     * @return The formatted message
     */
    @NotNull
    @Contract(pure = true)
    protected static String format(@NotNull String message, Object @NotNull... args) {
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int cursor = 0;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            boolean trailingThrowable = i == (args.length - 1) && arg instanceof Throwable;
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder != -1 && !trailingThrowable) {
                builder.append(message, cursor, placeholder).append(Objects.toString(arg));
                cursor = placeholder + 2;
                continue;
            }
            builder.append(message, cursor, message.length());
            cursor = message.length();
            if (trailingThrowable) {
                StringWriter sw = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(arg));
            }
        }
        builder.append(message, cursor, message.length());
        return builder.toString();
    }

    public final void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.DEBUG, clazz, message, args);
    }

    public final void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.ERROR, clazz, message, args);
    }

    public final void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.INFO, clazz, message, args);
    }

    public final void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.log(Level.WARN, clazz, message, args);
    }

    public abstract void log(@NotNull Level level, @NotNull Class<?> clazz, @NotNull String message, Object @NotNull... args);
}
