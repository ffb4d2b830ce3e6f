package com.example.rabbitwatch.notification;

import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * JSON-over-HTTP POST shared by the Slack and webhook channels.
 * 5xx, 429 and I/O errors (timeouts included) are transient; any other
 * non-2xx status is terminal.
 */
@Slf4j
abstract class HttpChannelTransport<P> implements ChannelTransport<P> {

    static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;

    protected HttpChannelTransport(OkHttpClient httpClient, int timeoutSeconds) {
        this.httpClient = httpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    protected HttpReply post(String url, String json, Map<String, String> headers)
            throws TransientDeliveryException, TerminalDeliveryException {
        Request.Builder builder;
        try {
            builder = new Request.Builder().url(url).post(RequestBody.create(json, JSON));
        } catch (IllegalArgumentException e) {
            throw new TerminalDeliveryException("Invalid endpoint URL", e);
        }
        headers.forEach(builder::header);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            int code = response.code();
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (response.isSuccessful()) {
                return new HttpReply(code, text);
            }
            if (code >= 500 || code == 429) {
                throw new TransientDeliveryException("HTTP " + code, code);
            }
            throw new TerminalDeliveryException("HTTP " + code + (text.isBlank() ? "" : ": " + abbreviate(text)), code);
        } catch (IOException e) {
            throw new TransientDeliveryException("Network error: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    record HttpReply(int statusCode, String body) {
    }
}
