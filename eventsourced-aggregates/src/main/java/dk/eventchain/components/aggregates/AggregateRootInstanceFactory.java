package dk.eventchain.components.aggregates;

import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.*;

import static dk.eventchain.components.common.FailFast.requireNonNull;
import static dk.eventchain.components.common.MessageFormatter.msg;

/**
 * Factory that helps the {@link AggregateRepository} to create an empty instance of a given {@link Aggregate}, which is then rehydrated.
 *
 * @see #defaultConstructorFactory()
 * @see DefaultConstructorAggregateRootInstanceFactory
 * @see #objenesisAggregateRootFactory()
 * @see ObjenesisAggregateRootInstanceFactory
 */
public interface AggregateRootInstanceFactory {
    /**
     * An {@link AggregateRootInstanceFactory} that calls the default no-arguments constructor on the concrete {@link Aggregate} type
     */
    DefaultConstructorAggregateRootInstanceFactory DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY = new DefaultConstructorAggregateRootInstanceFactory();
    /**
     * An {@link AggregateRootInstanceFactory} that uses {@link Objenesis} to create a new instance of the {@link Aggregate}<br>
     * <b>Please note: Objenesis doesn't initialize fields nor call any constructors</b>, so your {@link Aggregate} design needs to take
     * this into consideration.<br>
     * All concrete aggregates that extends {@link AggregateRoot} have been prepared to be initialized by {@link Objenesis}
     */
    AggregateRootInstanceFactory                   OBJENESIS_AGGREGATE_ROOT_FACTORY           = new ObjenesisAggregateRootInstanceFactory();

    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType);

    /**
     * @return #DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY
     */
    static AggregateRootInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY;
    }

    /**
     * @return #OBJENESIS_AGGREGATE_ROOT_FACTORY
     */
    static AggregateRootInstanceFactory objenesisAggregateRootFactory() {
        return OBJENESIS_AGGREGATE_ROOT_FACTORY;
    }

    /**
     * Calls the default no-arguments constructor (of any visibility) on the concrete {@link Aggregate} type
     */
    class DefaultConstructorAggregateRootInstanceFactory implements AggregateRootInstanceFactory {
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateType, "You must provide an aggregateType");
            try {
                var constructor = aggregateType.getDeclaredConstructor();
                constructor.setAccessible(true);
                return constructor.newInstance();
            } catch (NoSuchMethodException e) {
                throw new AggregateException(msg("Aggregate type '{}' doesn't have a default constructor", aggregateType.getName()), e);
            } catch (InvocationTargetException e) {
                throw new AggregateException(msg("The default constructor of '{}' failed", aggregateType.getName()), e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new AggregateException(msg("Failed to create an instance of '{}'", aggregateType.getName()), e);
            }
        }
    }

    /**
     * Uses {@link Objenesis} to create instances without calling a constructor. The instantiator is cached per aggregate type
     */
    class ObjenesisAggregateRootInstanceFactory implements AggregateRootInstanceFactory {
        private final Objenesis                                      objenesis       = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

        @SuppressWarnings("unchecked")
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateType, "You must provide an aggregateType");
            return (AGGREGATE) instantiatorMap.computeIfAbsent(aggregateType,
                                                               objenesis::getInstantiatorOf)
                                              .newInstance();
        }
    }
}
