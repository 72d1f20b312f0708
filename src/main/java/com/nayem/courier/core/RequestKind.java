package com.nayem.courier.core;

/**
 * The two families of requests. Both are dispatched the same way.
 */
public enum RequestKind {
    COMMAND("Command", Command.class),
    QUERY("Query", Query.class);

    private final String displayName;
    private final Class<?> requestInterface;

    RequestKind(String displayName, Class<?> requestInterface) {
        this.displayName = displayName;
        this.requestInterface = requestInterface;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return {@link Command} or {@link Query}
     */
    public Class<?> getRequestInterface() {
        return requestInterface;
    }
}
