/*
 * どこで: Timeclock ゲートウェイ層
 * 何を: 勤怠サービスへの打刻送信と写真送信を 1 回ずつ行う
 * なぜ: 再送はコーディネータと同期ワーカーの責務なので、ここでは失敗の分類だけを行うため
 */
package com.example.timeclock.gateway;

import com.example.timeclock.config.AttendanceServiceProperties;
import com.example.timeclock.model.PunchDirection;
import com.example.timeclock.model.PunchExceptionCode;
import com.example.timeclock.model.PunchResult;
import com.example.timeclock.model.SystemErrorCode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.w3c.dom.Document;

@Service
public class PunchGateway {

  static final String OPERATION_RECORD_SWIPE = "RecordSwipeSummary";
  static final String OPERATION_RECORD_SWIPE_OVERRIDE = "RecordSwipeSummaryDepartmentOverride";
  static final String OPERATION_SAVE_IMAGE = "SaveImage";

  private static final Logger logger = LoggerFactory.getLogger(PunchGateway.class);
  private static final MediaType TEXT_XML_UTF8 = MediaType.parseMediaType("text/xml; charset=utf-8");

  private final RestClient attendanceRestClient;
  private final AttendanceServiceProperties properties;
  private final AttendanceSoapMessages messages;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public PunchGateway(
      RestClient attendanceRestClient,
      AttendanceServiceProperties properties,
      AttendanceSoapMessages messages) {
    this.attendanceRestClient = attendanceRestClient;
    this.properties = properties;
    this.messages = messages;
  }

  public PunchResult submitPunch(
      String rawEmployeeId, Instant punchTimestamp, Integer departmentOverride) {
    final String operation =
        departmentOverride == null ? OPERATION_RECORD_SWIPE : OPERATION_RECORD_SWIPE_OVERRIDE;
    final String swipeInput =
        AttendanceSoapMessages.swipeInput(rawEmployeeId, punchTimestamp, departmentOverride);
    logger.info(
        "punch send employeeId={} punchTimestamp={} operation={}",
        rawEmployeeId,
        punchTimestamp,
        operation);
    final Document response =
        call(
            properties.summaryPath(),
            operation,
            messages.recordSwipeEnvelope(operation, swipeInput));
    final PunchResult result = toPunchResult(response, rawEmployeeId);
    logger.info(
        "punch accepted employeeId={} lastName={} firstName={} direction={} weeklyHours={}",
        rawEmployeeId,
        result.lastName(),
        result.firstName(),
        result.direction(),
        result.weeklyHours());
    return result;
  }

  public void uploadPhoto(String imageEmployeeId, byte[] photoBytes, Instant punchTimestamp) {
    if (photoBytes == null || photoBytes.length == 0) {
      throw new IllegalArgumentException("photoBytes are required");
    }
    final String fileName = AttendanceSoapMessages.photoFileName(imageEmployeeId, punchTimestamp);
    final Document response =
        call(
            properties.checkinPath(),
            OPERATION_SAVE_IMAGE,
            messages.saveImageEnvelope(fileName, photoBytes));
    failOnSystemError(response);
    final Optional<String> saved = AttendanceSoapMessages.text(response, "SaveImageResult");
    if (saved.isEmpty() && !AttendanceSoapMessages.hasElement(response, "SaveImageResponse")) {
      throw new PunchGatewayException(
          PunchGatewayException.Reason.INVALID_RESPONSE, "SaveImage response is missing");
    }
    if (saved.isPresent() && !Boolean.parseBoolean(saved.get())) {
      throw new PunchGatewayException(
          PunchGatewayException.Reason.SERVICE_FAULT, "photo was refused fileName=" + fileName);
    }
    logger.info("photo uploaded fileName={} bytes={}", fileName, photoBytes.length);
  }

  private Document call(String path, String operation, String envelope) {
    try {
      final String body =
          attendanceRestClient
              .post()
              .uri(path)
              .contentType(TEXT_XML_UTF8)
              .header("SOAPAction", messages.soapAction(operation))
              .body(envelope)
              .retrieve()
              .body(String.class);
      return messages.parse(body);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (PunchGatewayException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("attendance {} response handling failed", operation, ex);
      throw new PunchGatewayException(
          PunchGatewayException.Reason.INVALID_RESPONSE,
          "attendance " + operation + " response handling failed",
          ex);
    }
  }

  private PunchResult toPunchResult(Document response, String rawEmployeeId) {
    failOnSystemError(response);
    if (!AttendanceSoapMessages.hasElement(response, "RecordSwipeReturnInfo")) {
      throw new PunchGatewayException(
          PunchGatewayException.Reason.INVALID_RESPONSE, "RecordSwipeReturnInfo is missing");
    }
    final String success =
        AttendanceSoapMessages.text(response, "PunchSuccess")
            .orElseThrow(
                () ->
                    new PunchGatewayException(
                        PunchGatewayException.Reason.INVALID_RESPONSE, "PunchSuccess is missing"));
    final int exception = parseInt(AttendanceSoapMessages.text(response, "PunchException"));
    if (!Boolean.parseBoolean(success) || exception != 0) {
      final PunchExceptionCode code = PunchExceptionCode.fromCode(exception);
      logger.info("punch exception employeeId={} exception={}", rawEmployeeId, exception);
      if (code == PunchExceptionCode.NOT_AUTHORIZED) {
        logger.warn(
            "not authorized employeeId={}; the id may be unknown or lack permissions",
            rawEmployeeId);
      }
      throw new PunchGatewayException(
          PunchGatewayException.Reason.SERVICE_FAULT, code.message(), code.code(), null);
    }
    return new PunchResult(
        AttendanceSoapMessages.text(response, "FirstName").orElse(null),
        AttendanceSoapMessages.text(response, "LastName").orElse(null),
        PunchDirection.fromWire(AttendanceSoapMessages.text(response, "PunchType").orElse(null)),
        parseHours(AttendanceSoapMessages.text(response, "CurrentWeeklyHours")));
  }

  private void failOnSystemError(Document response) {
    final int systemError = parseInt(AttendanceSoapMessages.text(response, "SystemErrorCode"));
    if (systemError == 0) {
      return;
    }
    final String message =
        SystemErrorCode.fromCode(systemError)
            .map(SystemErrorCode::message)
            .orElse("Attendance system error " + systemError);
    logger.error("attendance system error code={} message={}", systemError, message);
    throw new PunchGatewayException(
        PunchGatewayException.Reason.SERVICE_FAULT, message, systemError, null);
  }

  private PunchGatewayException mapResponseException(
      String operation, RestClientResponseException ex) {
    logger.warn(
        "attendance {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    // 到達不能やサーバ障害は接続の問題として扱い、業務的な拒否にはしない
    return new PunchGatewayException(
        PunchGatewayException.Reason.NETWORK,
        "attendance " + operation + " failed with http status " + ex.getStatusCode().value(),
        ex);
  }

  private PunchGatewayException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("attendance {} timed out", operation);
      return new PunchGatewayException(
          PunchGatewayException.Reason.TIMEOUT, "attendance " + operation + " timeout", ex);
    }
    logger.warn("attendance {} connection failed: {}", operation, ex.getMessage());
    return new PunchGatewayException(
        PunchGatewayException.Reason.NETWORK, "attendance " + operation + " connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static int parseInt(Optional<String> value) {
    if (value.isEmpty()) {
      return 0;
    }
    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException ex) {
      throw new PunchGatewayException(
          PunchGatewayException.Reason.INVALID_RESPONSE, "not a number: " + value.get(), ex);
    }
  }

  private static BigDecimal parseHours(Optional<String> value) {
    if (value.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(value.get());
    } catch (NumberFormatException ex) {
      logger.debug("weekly hours not numeric value={}", value.get());
      return null;
    }
  }
}
