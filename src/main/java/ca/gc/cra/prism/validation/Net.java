package ca.gc.cra.prism.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Network endpoint validation utilities for PRISM.
 *
 * @since 0.1.0
 */
public final class Net {
  private Net() {
    // Utility
  }

  /**
   * Parses an absolute {@code http} or {@code https} URL that names a host.
   *
   * @param name logical parameter name used in diagnostics
   * @param raw candidate URL text
   * @return parsed URI
   * @throws IllegalArgumentException if the URL is malformed, relative, uses another scheme, or lacks a host
   */
  public static URI validateHttpUrl(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null) {
      throw new IllegalArgumentException(name + " must use http or https scheme");
    }
    String normalized = scheme.toLowerCase(Locale.ROOT);
    if (!normalized.equals("http") && !normalized.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https scheme");
    }
    String host = bareHost(uri);
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException(name + " must include a host");
    }
    port(uri);
    return uri;
  }

  /**
   * Returns the host of {@code uri} without IPv6 literal brackets.
   *
   * <p>{@link URI#getHost()} is {@code null} for names that are not RFC 2396 host names, such as container service
   * names with underscores ({@code prom_server}). Those are taken from the raw authority instead, minus any user
   * info and port.</p>
   *
   * @param uri parsed URI
   * @return bare host, or {@code null} when the URI has none
   */
  public static String bareHost(URI uri) {
    String host = uri.getHost();
    if (host == null) {
      host = authorityHost(uri.getRawAuthority());
    }
    if (host != null && host.length() > 1 && host.startsWith("[") && host.endsWith("]")) {
      return host.substring(1, host.length() - 1);
    }
    return host;
  }

  /**
   * Returns the port of {@code uri}, reading the raw authority when the URI did not parse as server-based.
   *
   * @param uri parsed URI
   * @return port, or {@code -1} when none is given
   * @throws IllegalArgumentException if the authority carries a non-numeric or out-of-range port
   */
  public static int port(URI uri) {
    if (uri.getHost() != null) {
      return uri.getPort();
    }
    String authority = withoutUserInfo(uri.getRawAuthority());
    if (authority == null) {
      return -1;
    }
    int colon = authority.lastIndexOf(':');
    if (colon < 0 || colon < authority.lastIndexOf(']')) {
      return -1;
    }
    String digits = authority.substring(colon + 1);
    if (digits.isEmpty()) {
      return -1;
    }
    return Numbers.parseIntInRange("port", digits, 1, 65_535);
  }

  private static String authorityHost(String rawAuthority) {
    String authority = withoutUserInfo(rawAuthority);
    if (authority == null || authority.isEmpty()) {
      return null;
    }
    if (authority.startsWith("[")) {
      int close = authority.indexOf(']');
      return close < 0 ? null : authority.substring(0, close + 1);
    }
    int colon = authority.lastIndexOf(':');
    return colon < 0 ? authority : authority.substring(0, colon);
  }

  private static String withoutUserInfo(String rawAuthority) {
    if (rawAuthority == null) {
      return null;
    }
    return rawAuthority.substring(rawAuthority.lastIndexOf('@') + 1);
  }
}
