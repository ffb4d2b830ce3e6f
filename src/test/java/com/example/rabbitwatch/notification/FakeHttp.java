package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertCategory;
import com.example.rabbitwatch.domain.AlertDetails;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.AlertSource;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * OkHttp client whose interceptor answers from a script of canned replies
 * and records every request, so transports run without sockets.
 */
final class FakeHttp implements Interceptor {

    private final Deque<Object> replies = new ArrayDeque<>();
    final List<Request> requests = new ArrayList<>();
    final List<String> bodies = new ArrayList<>();

    FakeHttp reply(int code, String body) {
        replies.add(new int[]{code});
        replies.add(body);
        return this;
    }

    FakeHttp fail(IOException error) {
        replies.add(error);
        return this;
    }

    OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(request);
        Buffer buffer = new Buffer();
        if (request.body() != null) {
            request.body().writeTo(buffer);
        }
        bodies.add(buffer.readUtf8());

        Object next = replies.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted reply for " + request.url());
        }
        if (next instanceof IOException error) {
            throw error;
        }
        int code = ((int[]) next)[0];
        String body = (String) replies.poll();
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("scripted")
                .body(ResponseBody.create(body, MediaType.get("text/plain")))
                .build();
    }

    static Alert alert(String id, AlertSeverity severity, String vhost) {
        return Alert.builder()
                .id(id)
                .serverId("srv-1")
                .serverName("prod")
                .severity(severity)
                .category(vhost != null ? AlertCategory.QUEUE : AlertCategory.MEMORY)
                .title("Alert " + id)
                .description("Description of " + id)
                .details(new AlertDetails(42L, 40.0, "Do something", List.of(id)))
                .source(vhost != null ? AlertSource.queue(id) : AlertSource.node(id))
                .vhost(vhost)
                .timestamp(Instant.parse("2026-03-01T12:00:00Z"))
                .build();
    }
}
