// file: server/src/main/java/io/tasksync/server/ListenAddress.java
package io.tasksync.server;

/** One {@code host:port} the HTTP server binds to. */
public record ListenAddress(String host, int port) {

    public ListenAddress {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("listen host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("listen port out of range: " + port);
        }
    }

    /**
     * Parse {@code host:port}. IPv6 hosts are written in brackets, e.g. {@code [::1]:8080};
     * the brackets are stripped.
     */
    public static ListenAddress parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("listen address must not be null");
        }
        String s = text.trim();
        int colon = s.lastIndexOf(':');
        if (colon <= 0 || colon == s.length() - 1) {
            throw new IllegalArgumentException("listen address must be host:port, got '" + text + "'");
        }
        String host = s.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(s.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in listen address '" + text + "'", e);
        }
        return new ListenAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
