package com.nayem.courier.handler;

import com.nayem.courier.core.Command;
import com.nayem.courier.core.CommandHandler;
import com.nayem.courier.core.Query;
import com.nayem.courier.core.QueryHandler;
import com.nayem.courier.core.Request;
import com.nayem.courier.core.RequestHandler;
import com.nayem.courier.core.RequestKind;
import com.nayem.courier.error.InvocationContractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handler registry backed by a map from {@link HandlerKey} to invocation closures.
 * <p>
 * Handlers are normally registered once at startup. Registering several handlers
 * under the same key is allowed; resolution then fails for that key.
 * </p>
 */
public class InMemoryHandlerRegistry implements HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryHandlerRegistry.class);

    private final Map<HandlerKey, List<HandlerInvocation<?>>> handlers = new ConcurrentHashMap<>();

    public <C extends Command<R>, R> InMemoryHandlerRegistry registerCommandHandler(Class<C> commandType,
            Class<R> resultType, RequestHandler<? super C, R> handler) {
        return register(RequestKind.COMMAND, commandType, resultType, handler);
    }

    public <Q extends Query<R>, R> InMemoryHandlerRegistry registerQueryHandler(Class<Q> queryType,
            Class<R> resultType, RequestHandler<? super Q, R> handler) {
        return register(RequestKind.QUERY, queryType, resultType, handler);
    }

    /**
     * Registers a handler whose command and result types are read from the
     * generic declaration of its class. Lambdas must use
     * {@link #registerCommandHandler(Class, Class, RequestHandler)} instead.
     */
    public InMemoryHandlerRegistry registerCommandHandler(CommandHandler<?, ?> handler) {
        return registerResolved(RequestKind.COMMAND, CommandHandler.class, handler, handler.getClass());
    }

    /**
     * Registers a handler whose query and result types are read from the generic
     * declaration of its class.
     */
    public InMemoryHandlerRegistry registerQueryHandler(QueryHandler<?, ?> handler) {
        return registerResolved(RequestKind.QUERY, QueryHandler.class, handler, handler.getClass());
    }

    /**
     * Registers a handler under the kinds it implements. The declared class is
     * used for type resolution, which allows proxies to be registered with the
     * class of their target.
     *
     * @throws IllegalArgumentException if the handler is neither a
     *                                  {@link CommandHandler} nor a {@link QueryHandler}
     */
    public InMemoryHandlerRegistry registerHandler(RequestHandler<?, ?> handler, Class<?> declaredClass) {
        boolean registered = false;
        for (RequestKind kind : RequestKind.values()) {
            if (handlerInterface(kind).isInstance(handler)) {
                registerHandler(kind, handler, declaredClass);
                registered = true;
            }
        }
        if (!registered) {
            throw new IllegalArgumentException(declaredClass.getName() + " must implement "
                    + CommandHandler.class.getSimpleName() + " or " + QueryHandler.class.getSimpleName());
        }
        return this;
    }

    /**
     * Registers a handler under one kind, reading the request and result types from
     * the generic declaration of {@code declaredClass}.
     *
     * @throws IllegalArgumentException if the handler does not implement the handler
     *                                  interface of that kind, or its types cannot be resolved
     */
    public InMemoryHandlerRegistry registerHandler(RequestKind kind, RequestHandler<?, ?> handler,
            Class<?> declaredClass) {
        Class<?> handlerInterface = handlerInterface(kind);
        if (!handlerInterface.isInstance(handler)) {
            throw new IllegalArgumentException(declaredClass.getName() + " must implement "
                    + handlerInterface.getSimpleName());
        }
        return registerResolved(kind, handlerInterface, handler, declaredClass);
    }

    /**
     * @return {@link CommandHandler} or {@link QueryHandler}
     */
    public static Class<?> handlerInterface(RequestKind kind) {
        return kind == RequestKind.COMMAND ? CommandHandler.class : QueryHandler.class;
    }

    public <Q extends Request<R>, R> InMemoryHandlerRegistry register(RequestKind kind, Class<Q> requestType,
            Class<R> resultType, RequestHandler<? super Q, R> handler) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        if (!kind.getRequestInterface().isAssignableFrom(requestType)) {
            throw new IllegalArgumentException(requestType.getName() + " is not a "
                    + kind.getDisplayName().toLowerCase(Locale.ROOT));
        }

        HandlerKey key = new HandlerKey(kind, requestType, resultType);
        HandlerInvocation<R> invocation = (request, cancellationToken) -> {
            if (!requestType.isInstance(request)) {
                throw new InvocationContractException("The handler " + handler.getClass().getName()
                        + " cannot handle requests of type '" + request.getClass().getName() + "'.");
            }
            return handler.handle(requestType.cast(request), cancellationToken);
        };
        handlers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(invocation);
        log.debug("Registered {} for {}", handler.getClass().getName(), key);
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> List<HandlerInvocation<R>> lookupAll(RequestKind kind, Class<?> requestType, Class<R> resultType) {
        List<HandlerInvocation<?>> found = handlers.get(new HandlerKey(kind, requestType, resultType));
        if (found == null) {
            return List.of();
        }
        List<HandlerInvocation<R>> result = new ArrayList<>(found.size());
        for (HandlerInvocation<?> invocation : found) {
            result.add((HandlerInvocation<R>) invocation);
        }
        return result;
    }

    /**
     * @return the keys that have at least one handler
     */
    public List<HandlerKey> registeredKeys() {
        return List.copyOf(handlers.keySet());
    }

    public int size() {
        return handlers.values().stream().mapToInt(List::size).sum();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private InMemoryHandlerRegistry registerResolved(RequestKind kind, Class<?> handlerInterface,
            RequestHandler<?, ?> handler, Class<?> declaredClass) {
        Class<?>[] types = RequestTypes.typeArguments(declaredClass, handlerInterface);
        if (types == null || types[0] == Object.class) {
            throw new IllegalArgumentException("Cannot resolve the " + kind.getDisplayName().toLowerCase(Locale.ROOT)
                    + " type handled by " + declaredClass.getName()
                    + "; register it with explicit request and result types");
        }
        return register(kind, (Class) types[0], (Class) types[1], (RequestHandler) handler);
    }
}
