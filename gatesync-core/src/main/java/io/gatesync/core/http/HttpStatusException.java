package io.gatesync.core.http;

public final class HttpStatusException extends TransportException {
    private final int status;
    private final String body;

    public HttpStatusException(String method, String url, int status, String body) {
        super(method + " " + url + " returned HTTP " + status + bodySuffix(body), isRetriableStatus(status));
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    static boolean isRetriableStatus(int status) {
        return status == 429 || status >= 500;
    }

    private static String bodySuffix(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed);
    }
}
