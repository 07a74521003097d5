package dk.eventchain.components.aggregates;

import java.lang.reflect.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Calls the {@link EventHandler} annotated method, declared on the aggregate class or any of its super classes, whose single parameter type
 * is the most specific match for the payload type.<br>
 * The handler methods are resolved once per aggregate class
 */
final class EventHandlerInvoker {
    private static final ConcurrentMap<Class<?>, List<Method>> HANDLERS_PER_TYPE = new ConcurrentHashMap<>();

    private final Object       invokeMethodsOn;
    private final List<Method> handlers;

    EventHandlerInvoker(Object invokeMethodsOn) {
        this.invokeMethodsOn = requireNonNull(invokeMethodsOn, "No invokeMethodsOn provided");
        this.handlers = HANDLERS_PER_TYPE.computeIfAbsent(invokeMethodsOn.getClass(), EventHandlerInvoker::resolveHandlers);
    }

    private static List<Method> resolveHandlers(Class<?> type) {
        var handlers = new ArrayList<Method>();
        for (var current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (var method : current.getDeclaredMethods()) {
                if (!method.isAnnotationPresent(EventHandler.class)) {
                    continue;
                }
                if (method.getParameterCount() != 1) {
                    throw new AggregateException(msg("@{} method '{}' in '{}' must have exactly one parameter, but has {}",
                                                     EventHandler.class.getSimpleName(),
                                                     method.getName(),
                                                     current.getName(),
                                                     method.getParameterCount()));
                }
                method.setAccessible(true);
                handlers.add(method);
            }
        }
        return List.copyOf(handlers);
    }

    /**
     * Invoke the best matching handler with the payload
     *
     * @param payload          the event payload
     * @param noMatchingMethod called with the payload if no handler accepts the payload type
     */
    void invoke(Object payload, Consumer<Object> noMatchingMethod) {
        requireNonNull(payload, "No payload provided");
        requireNonNull(noMatchingMethod, "No noMatchingMethod consumer provided");
        var handler = mostSpecificHandlerFor(payload.getClass());
        if (handler.isEmpty()) {
            noMatchingMethod.accept(payload);
            return;
        }
        try {
            handler.get().invoke(invokeMethodsOn, payload);
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new AggregateException(msg("@{} method '{}' failed to handle '{}'",
                                             EventHandler.class.getSimpleName(),
                                             handler.get().getName(),
                                             payload.getClass().getName()),
                                         cause);
        } catch (IllegalAccessException e) {
            throw new AggregateException(msg("Failed to call @{} method '{}'", EventHandler.class.getSimpleName(), handler.get().getName()), e);
        }
    }

    private Optional<Method> mostSpecificHandlerFor(Class<?> payloadType) {
        Method bestMatch = null;
        for (var handler : handlers) {
            var parameterType = handler.getParameterTypes()[0];
            if (!parameterType.isAssignableFrom(payloadType)) {
                continue;
            }
            if (bestMatch == null || bestMatch.getParameterTypes()[0].isAssignableFrom(parameterType)) {
                bestMatch = handler;
            }
        }
        return Optional.ofNullable(bestMatch);
    }
}
