package com.steadycrawl.crawl.util;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import javax.net.ssl.SSLException;

public final class ReasonCodeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String CONNECTION_REFUSED = "CONNECTION_REFUSED";
  public static final String NETWORK_ERROR = "NETWORK_ERROR";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_407_PROXY_AUTH = "HTTP_407_PROXY_AUTH";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";
  public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 407) {
      return HTTP_407_PROXY_AUTH;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  public static String fromIoException(IOException error) {
    if (error == null) {
      return UNKNOWN;
    }
    if (error instanceof HttpTimeoutException) {
      return TIMEOUT;
    }
    if (error instanceof UnknownHostException) {
      return DNS_FAILURE;
    }
    if (error instanceof SSLException) {
      return TLS_FAILURE;
    }
    if (error instanceof ConnectException) {
      return CONNECTION_REFUSED;
    }
    String lower = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    if (lower.contains("timed out") || lower.contains("timeout")) {
      return TIMEOUT;
    }
    if (lower.contains("name or service not known") || lower.contains("no such host")) {
      return DNS_FAILURE;
    }
    if (lower.contains("ssl") || lower.contains("handshake")) {
      return TLS_FAILURE;
    }
    return NETWORK_ERROR;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, CONNECTION_REFUSED, NETWORK_ERROR, HTTP_429_RATE_LIMIT, HTTP_5XX ->
          true;
      default -> false;
    };
  }

  /**
   * True for failures that point at the egress proxy rather than the target.
   */
  public static boolean isProxyFailure(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, HTTP_407_PROXY_AUTH -> true;
      default -> false;
    };
  }
}
