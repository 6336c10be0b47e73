package com.quasar.common.trace;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String TRACE_ID_KEY = "trace_id";
  public static final String REQUEST_ID_KEY = "request_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** MDC の trace_id、なければ request_id、どちらもなければ新規採番。 */
  public static String currentOrNew() {
    final String traceId = MDC.get(TRACE_ID_KEY);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String requestId = MDC.get(REQUEST_ID_KEY);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return newTraceId();
  }
}
