package com.initialone.jgiv.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * In-memory OkHttp interceptor for client tests. Never touches the network:
 * responses (or failures) are queued up front and every request is captured.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final Deque<Planned> planned = new ArrayDeque<>();
    private final Deque<CapturedRequest> captured = new ArrayDeque<>();

    public void enqueueJson(int code, String body) {
        planned.add(new Planned(code, body == null ? "" : body, null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, "", failure));
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return captured.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request)));

        Planned p = planned.poll();
        if (p == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (p.failure != null) throw p.failure;

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(p.code)
                .message("mock")
                .body(ResponseBody.create(p.body, MediaType.parse("application/json")))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) return "";
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private static final class Planned {
        final int code;
        final String body;
        final IOException failure;

        Planned(int code, String body, IOException failure) {
            this.code = code;
            this.body = body;
            this.failure = failure;
        }
    }

    public static final class CapturedRequest {
        private final Request request;
        private final String body;

        private CapturedRequest(Request request, String body) {
            this.request = request;
            this.body = body;
        }

        public String method() {
            return request.method();
        }

        public String url() {
            return request.url().toString();
        }

        public String header(String name) {
            return request.header(name);
        }

        public String body() {
            return body;
        }
    }
}
