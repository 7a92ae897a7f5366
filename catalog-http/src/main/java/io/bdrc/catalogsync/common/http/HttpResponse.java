package io.bdrc.catalogsync.common.http;

import java.net.HttpURLConnection;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.ToString;

@AllArgsConstructor
@ToString
public class HttpResponse {
    public final int statusCode;
    public final String statusText;
    public final Map<String, String> headers;
    public final String body;

    public boolean isSuccess() {
        return statusCode >= HttpURLConnection.HTTP_OK && statusCode < HttpURLConnection.HTTP_MULT_CHOICE;
    }

    public boolean isNotFound() {
        return statusCode == HttpURLConnection.HTTP_NOT_FOUND;
    }

    /**
     * Throttling and server-side failures; the request may succeed if sent again.
     */
    public boolean isRetryable() {
        return statusCode == 429 || statusCode >= HttpURLConnection.HTTP_INTERNAL_ERROR;
    }
}
