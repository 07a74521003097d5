package dk.eventchain.components.aggregates;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called with the payload of every event that is triggered on, or rehydrated into, an {@link AggregateRoot} instance.<br>
 * The method must take a single argument, the payload type it handles
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}