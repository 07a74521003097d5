package dk.eventchain.components.common.functional;

/**
 * {@link java.util.function.Consumer} variant whose {@link #accept(Object)} may throw a checked {@link Exception}
 *
 * @param <T> the argument type
 */
@FunctionalInterface
public interface CheckedConsumer<T> {
    void accept(T argument) throws Exception;
}
