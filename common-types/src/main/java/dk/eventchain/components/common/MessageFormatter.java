package dk.eventchain.components.common;

import static dk.eventchain.components.common.FailFast.requireNonNull;

/**
 * Message and template formatting used for exception messages and SQL statement templates
 */
public final class MessageFormatter {
    private MessageFormatter() {
    }

    /**
     * Format a message using SLF4J's anonymous <code>{}</code> placeholders, e.g.
     * <code>msg("Expected version {} but got {}", 2, 3)</code>.<br>
     * Unlike log statements a trailing {@link Throwable} argument is formatted like any other argument
     *
     * @param message   the message with <code>{}</code> placeholders
     * @param arguments the arguments that replace the placeholders in order
     * @return the formatted message
     */
    public static String msg(String message, Object... arguments) {
        requireNonNull(message, "No message provided");
        return org.slf4j.helpers.MessageFormatter.arrayFormat(message, arguments, null).getMessage();
    }

    /**
     * Replace named placeholders of the form <code>{:name}</code> with the value of the matching {@link NamedArgumentBinding}, e.g.
     * <code>bind("SELECT * FROM {:tableName}", arg("tableName", "stored_events"))</code>
     *
     * @param template the template
     * @param bindings the named arguments
     * @return the resolved template
     */
    public static String bind(String template, NamedArgumentBinding... bindings) {
        requireNonNull(template, "No template provided");
        requireNonNull(bindings, "No bindings provided");
        var result = template;
        for (var binding : bindings) {
            result = result.replace("{:" + binding.name + "}", String.valueOf(binding.value));
        }
        return result;
    }

    public static final class NamedArgumentBinding {
        public final String name;
        public final Object value;

        private NamedArgumentBinding(String name, Object value) {
            this.name = requireNonNull(name, "No name provided");
            this.value = value;
        }

        public static NamedArgumentBinding arg(String name, Object value) {
            return new NamedArgumentBinding(name, value);
        }

        @Override
        public String toString() {
            return name + "=" + value;
        }
    }
}
