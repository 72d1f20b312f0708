package com.nayem.courier.handler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nayem.courier.core.Request;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves the type arguments that requests and handlers declare on the
 * interfaces they implement.
 * <p>
 * Type arguments left as unbound type variables resolve to {@link Object}.
 * </p>
 */
public final class RequestTypes {

    private static final Cache<Class<?>, Class<?>> RESULT_TYPES = Caffeine.newBuilder()
            .weakKeys()
            .build();

    private RequestTypes() {
    }

    /**
     * @return the {@code R} of {@link Request Request&lt;R&gt;} declared by the request class
     */
    public static Class<?> resultType(Class<?> requestType) {
        return RESULT_TYPES.get(requestType, type -> {
            Class<?>[] arguments = typeArguments(type, Request.class);
            if (arguments == null) {
                throw new IllegalArgumentException(type.getName() + " does not implement " + Request.class.getName());
            }
            return arguments[0];
        });
    }

    /**
     * Resolves the type arguments of a generic interface or superclass as declared
     * by {@code type}.
     *
     * @return the resolved arguments, or null when {@code type} is not a subtype of {@code target}
     */
    public static Class<?>[] typeArguments(Class<?> type, Class<?> target) {
        Type[] resolved = resolve(type, target, Map.of());
        if (resolved == null) {
            return null;
        }
        Class<?>[] classes = new Class<?>[resolved.length];
        for (int i = 0; i < resolved.length; i++) {
            classes[i] = toClass(resolved[i]);
        }
        return classes;
    }

    private static Type[] resolve(Type type, Class<?> target, Map<TypeVariable<?>, Type> bindings) {
        Class<?> raw;
        Map<TypeVariable<?>, Type> local = new HashMap<>();
        if (type instanceof ParameterizedType pt) {
            raw = (Class<?>) pt.getRawType();
            TypeVariable<?>[] parameters = raw.getTypeParameters();
            Type[] arguments = pt.getActualTypeArguments();
            for (int i = 0; i < parameters.length; i++) {
                local.put(parameters[i], substitute(arguments[i], bindings));
            }
        } else if (type instanceof Class<?> c) {
            raw = c;
        } else {
            return null;
        }

        if (raw == target) {
            TypeVariable<?>[] parameters = raw.getTypeParameters();
            Type[] resolved = new Type[parameters.length];
            for (int i = 0; i < parameters.length; i++) {
                resolved[i] = local.getOrDefault(parameters[i], Object.class);
            }
            return resolved;
        }

        for (Type genericInterface : raw.getGenericInterfaces()) {
            Type[] resolved = resolve(genericInterface, target, local);
            if (resolved != null) {
                return resolved;
            }
        }
        Type superclass = raw.getGenericSuperclass();
        return superclass == null ? null : resolve(superclass, target, local);
    }

    private static Type substitute(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable<?> variable) {
            return bindings.getOrDefault(variable, Object.class);
        }
        return type;
    }

    private static Class<?> toClass(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType pt) {
            return (Class<?>) pt.getRawType();
        }
        if (type instanceof GenericArrayType array) {
            return toClass(array.getGenericComponentType()).arrayType();
        }
        return Object.class;
    }
}
