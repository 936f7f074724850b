package com.ospicorp.recordsapi.config;

/**
 * Host and port parsed from an {@code ADDR} value such as {@code :8080},
 * {@code 127.0.0.1:9000} or {@code [::1]:8080}. A {@code null} host binds every interface.
 */
public record ListenAddress(String host, int port) {

  public static ListenAddress parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("ADDR must not be empty");
    }
    String trimmed = value.trim();
    int colon = trimmed.lastIndexOf(':');
    if (colon < 0) {
      throw new IllegalArgumentException("ADDR must be in host:port form: " + trimmed);
    }

    String host = trimmed.substring(0, colon);
    if (host.startsWith("[") && host.endsWith("]")) {
      host = host.substring(1, host.length() - 1);
    } else if (host.indexOf(':') >= 0) {
      throw new IllegalArgumentException("IPv6 hosts in ADDR must be bracketed: " + trimmed);
    }

    int port;
    try {
      port = Integer.parseInt(trimmed.substring(colon + 1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid port in ADDR: " + trimmed, ex);
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Port out of range in ADDR: " + trimmed);
    }
    return new ListenAddress(host.isEmpty() ? null : host, port);
  }

  @Override
  public String toString() {
    return (host == null ? "" : host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
  }
}
