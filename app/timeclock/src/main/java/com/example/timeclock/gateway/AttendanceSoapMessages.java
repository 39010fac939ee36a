/*
 * どこで: Timeclock ゲートウェイ層
 * 何を: SOAP 1.1 エンベロープの組み立てと応答値の読み出しを行う
 * なぜ: 勤怠サービスは固定の SOAP 契約しか受け付けないため
 */
package com.example.timeclock.gateway;

import com.example.timeclock.config.AttendanceServiceProperties;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

@Component
@RequiredArgsConstructor
public class AttendanceSoapMessages {

  public static final String SWIPE_SEPARATOR = "|*|";
  private static final String SOAP_ENV_NS = "http://schemas.xmlsoap.org/soap/envelope/";
  private static final DateTimeFormatter SWIPE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter PHOTO_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final AttendanceServiceProperties properties;

  /** 接頭辞を含め、読み取った ID をそのまま送信する。 */
  public static String swipeInput(
      String rawEmployeeId, Instant punchTimestamp, Integer departmentOverride) {
    final StringBuilder swipe =
        new StringBuilder(rawEmployeeId)
            .append(SWIPE_SEPARATOR)
            .append(SWIPE_TIMESTAMP.format(punchTimestamp.truncatedTo(ChronoUnit.SECONDS)));
    if (departmentOverride != null) {
      swipe.append(SWIPE_SEPARATOR).append(departmentOverride);
    }
    return swipe.toString();
  }

  public static String photoFileName(String imageEmployeeId, Instant punchTimestamp) {
    return imageEmployeeId + "_" + PHOTO_TIMESTAMP.format(punchTimestamp) + ".jpg";
  }

  public String soapAction(String operation) {
    return "\"" + properties.namespace() + operation + "\"";
  }

  public String recordSwipeEnvelope(String operation, String swipeInput) {
    return envelope(
        "<" + operation + " xmlns=\"" + properties.namespace() + "\">"
            + element("swipeInput", swipeInput)
            + "</" + operation + ">");
  }

  public String saveImageEnvelope(String fileName, byte[] photoBytes) {
    return envelope(
        "<SaveImage xmlns=\"" + properties.namespace() + "\">"
            + element("fileName", fileName)
            + element("data", Base64.getEncoder().encodeToString(photoBytes))
            + element("dir", properties.clientId())
            + "</SaveImage>");
  }

  public Document parse(String body) {
    if (body == null || body.isBlank()) {
      throw new PunchGatewayException(
          PunchGatewayException.Reason.INVALID_RESPONSE, "attendance response body is empty");
    }
    try {
      final Document document =
          newDocumentBuilder().parse(new InputSource(new StringReader(body)));
      if (document.getElementsByTagNameNS(SOAP_ENV_NS, "Fault").getLength() > 0) {
        throw new PunchGatewayException(
            PunchGatewayException.Reason.NETWORK,
            "attendance service returned a SOAP fault: " + text(document, "faultstring").orElse(""));
      }
      return document;
    } catch (SAXException | IOException | ParserConfigurationException ex) {
      throw new PunchGatewayException(
          PunchGatewayException.Reason.INVALID_RESPONSE, "attendance response is not valid XML", ex);
    }
  }

  public static Optional<String> text(Document document, String localName) {
    final NodeList nodes = document.getElementsByTagNameNS("*", localName);
    if (nodes.getLength() == 0) {
      return Optional.empty();
    }
    final String value = nodes.item(0).getTextContent();
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  public static boolean hasElement(Document document, String localName) {
    return document.getElementsByTagNameNS("*", localName).getLength() > 0;
  }

  private String envelope(String body) {
    return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
        + "<soap:Envelope xmlns:soap=\"" + SOAP_ENV_NS + "\">"
        + "<soap:Header>"
        + "<UserCredentials xmlns=\"" + properties.namespace() + "\">"
        + element("UserName", properties.username())
        + element("PWD", properties.password())
        + "</UserCredentials>"
        + "</soap:Header>"
        + "<soap:Body>" + body + "</soap:Body>"
        + "</soap:Envelope>";
  }

  private static String element(String name, String value) {
    final String escaped =
        HtmlUtils.htmlEscape(value == null ? "" : value, StandardCharsets.UTF_8.name());
    return "<" + name + ">" + escaped + "</" + name + ">";
  }

  private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    // 勤怠応答では DTD と外部エンティティを受け付けない
    factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
    return factory.newDocumentBuilder();
  }
}
