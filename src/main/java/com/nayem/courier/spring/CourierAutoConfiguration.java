package com.nayem.courier.spring;

import com.nayem.courier.core.CommandBus;
import com.nayem.courier.core.DefaultCommandBus;
import com.nayem.courier.core.DefaultQueryBus;
import com.nayem.courier.core.DispatchMetrics;
import com.nayem.courier.core.QueryBus;
import com.nayem.courier.core.RequestDispatcher;
import com.nayem.courier.core.RequestHandler;
import com.nayem.courier.core.RequestKind;
import com.nayem.courier.core.RetrySchedulers;
import com.nayem.courier.handler.HandlerRegistry;
import com.nayem.courier.handler.HandlerResolver;
import com.nayem.courier.handler.InMemoryHandlerRegistry;
import com.nayem.courier.retry.BackoffCalculator;
import com.nayem.courier.retry.LoggingRetryListener;
import com.nayem.courier.retry.RetryListener;
import com.nayem.courier.retry.RetryPredicate;
import com.nayem.courier.retry.RetrySettings;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Registers the command and query buses together with their handlers, retry
 * settings and retry scheduler. Every bean can be replaced by declaring one of
 * the same type.
 */
@AutoConfiguration
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CourierAutoConfiguration.class);

    /**
     * Registers every {@link RequestHandler} bean. Request and result types are
     * read from the bean definition first, so handlers declared as lambdas by a
     * {@code @Bean} method with a generic return type are supported.
     */
    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry courierHandlerRegistry(ConfigurableListableBeanFactory beanFactory) {
        InMemoryHandlerRegistry registry = new InMemoryHandlerRegistry();
        for (String name : beanFactory.getBeanNamesForType(RequestHandler.class)) {
            RequestHandler<?, ?> handler = beanFactory.getBean(name, RequestHandler.class);
            registerHandler(registry, handler, declaredType(beanFactory, name));
        }
        log.info("Courier registered {} handlers for {} request types", registry.size(),
                registry.registeredKeys().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrySettings courierRetrySettings(CourierProperties properties) {
        return properties.getRetry().toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffCalculator courierBackoffCalculator() {
        return new BackoffCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPredicate courierRetryPredicate() {
        return RetryPredicate.always();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryListener courierRetryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchMetrics courierDispatchMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new DispatchMetrics(registryProvider.getIfAvailable());
    }

    @Bean(name = "courierRetryScheduler", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "courierRetryScheduler")
    public ScheduledExecutorService courierRetryScheduler(CourierProperties properties) {
        CourierProperties.Scheduler scheduler = properties.getScheduler();
        log.debug("Starting Courier retry scheduler with {} threads", scheduler.getPoolSize());
        return RetrySchedulers.newScheduler(scheduler.getPoolSize(), scheduler.getThreadNamePrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandBus courierCommandBus(HandlerRegistry registry, RetrySettings settings,
            RetryPredicate retryPredicate, BackoffCalculator backoffCalculator, RetryListener retryListener,
            DispatchMetrics metrics,
            @Qualifier("courierRetryScheduler") ScheduledExecutorService courierRetryScheduler) {
        return new DefaultCommandBus(dispatcher(RequestKind.COMMAND, registry, settings, retryPredicate,
                backoffCalculator, retryListener, metrics, courierRetryScheduler));
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBus courierQueryBus(HandlerRegistry registry, RetrySettings settings,
            RetryPredicate retryPredicate, BackoffCalculator backoffCalculator, RetryListener retryListener,
            DispatchMetrics metrics,
            @Qualifier("courierRetryScheduler") ScheduledExecutorService courierRetryScheduler) {
        return new DefaultQueryBus(dispatcher(RequestKind.QUERY, registry, settings, retryPredicate,
                backoffCalculator, retryListener, metrics, courierRetryScheduler));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void registerHandler(InMemoryHandlerRegistry registry, RequestHandler<?, ?> handler,
            ResolvableType declaredType) {
        Class<?> userClass = ClassUtils.getUserClass(handler);
        boolean registered = false;
        for (RequestKind kind : RequestKind.values()) {
            Class<?> handlerInterface = InMemoryHandlerRegistry.handlerInterface(kind);
            if (!handlerInterface.isInstance(handler)) {
                continue;
            }
            ResolvableType generics = declaredType.as(handlerInterface);
            Class<?> requestType = generics.resolveGeneric(0);
            Class<?> resultType = generics.resolveGeneric(1);
            if (requestType != null && resultType != null && !generics.hasUnresolvableGenerics()) {
                registry.register(kind, (Class) requestType, (Class) resultType, (RequestHandler) handler);
            } else {
                registry.registerHandler(kind, handler, userClass);
            }
            registered = true;
        }
        if (!registered) {
            registry.registerHandler(handler, userClass);
        }
    }

    private static ResolvableType declaredType(ConfigurableListableBeanFactory beanFactory, String name) {
        if (beanFactory.containsBeanDefinition(name)) {
            return beanFactory.getMergedBeanDefinition(name).getResolvableType();
        }
        return ResolvableType.NONE;
    }

    private static RequestDispatcher dispatcher(RequestKind kind, HandlerRegistry registry, RetrySettings settings,
            RetryPredicate retryPredicate, BackoffCalculator backoffCalculator, RetryListener retryListener,
            DispatchMetrics metrics, ScheduledExecutorService scheduler) {
        return RequestDispatcher.builder()
                .kind(kind)
                .resolver(new HandlerResolver(registry))
                .settings(settings)
                .retryPredicate(retryPredicate)
                .backoffCalculator(backoffCalculator)
                .retryListener(retryListener)
                .metrics(metrics)
                .scheduler(scheduler)
                .build();
    }
}
