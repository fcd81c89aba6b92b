package org.tanzu.ruckusmcp.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Base class for every error raised by the RUCKUS One client.
 *
 * Each error carries its {@link ErrorKind}, the HTTP status code when one was
 * received, and the detail payload extracted from the response body (a text
 * node for plain-text bodies, the structured JSON otherwise).
 *
 * When no explicit message is supplied the message falls back to the detail,
 * and then to a template naming the status code.
 */
public abstract class RuckusOneException extends RuntimeException {

    private final ErrorKind kind;
    private final Integer statusCode;
    private final JsonNode detail;

    protected RuckusOneException(ErrorKind kind, Integer statusCode, JsonNode detail,
                                 String message, String fallbackLabel, Throwable cause) {
        super(resolveMessage(message, detail, fallbackLabel, statusCode), cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public ErrorKind getKind() { return kind; }

    /** HTTP status code, or null when the failure happened before a response arrived. */
    public Integer getStatusCode() { return statusCode; }

    public JsonNode getDetail() { return detail; }

    /**
     * Returns the detail as display text: unquoted for text nodes, compact JSON otherwise.
     */
    public String getDetailText() {
        return detailText(detail);
    }

    static String detailText(JsonNode detail) {
        if (detail == null || detail.isNull() || detail.isMissingNode()) {
            return null;
        }
        return detail.isValueNode() ? detail.asText() : detail.toString();
    }

    private static String resolveMessage(String message, JsonNode detail, String fallbackLabel, Integer statusCode) {
        if (message != null && !message.isBlank()) {
            return message;
        }
        String text = detailText(detail);
        if (text != null && !text.isBlank()) {
            return text;
        }
        return statusCode != null ? fallbackLabel + " (status " + statusCode + ")" : fallbackLabel;
    }
}
