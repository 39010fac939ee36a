/*
 * どこで: Timeclock Web 層
 * 何を: API 呼び出しの間だけリクエストキーを MDC に設定する
 * なぜ: リクエストスレッドの打刻ログをキオスクのリクエストと突き合わせるため
 */
package com.example.timeclock.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.AsyncHandlerInterceptor;

@Component
public class RequestMdcInterceptor implements AsyncHandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String KIOSK_ID_HEADER = "X-Kiosk-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", resolveRequestId(request));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "kiosk_id", request.getHeader(KIOSK_ID_HEADER));
    put(keys, "client_ip", request.getRemoteAddr());
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    clear(request);
  }

  // 打刻リクエストはワーカースレッドで完了するため、サーブレットスレッドの MDC はここで解放する
  @Override
  public void afterConcurrentHandlingStarted(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    clear(request);
  }

  private void clear(HttpServletRequest request) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys)) {
      return;
    }
    rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
