package me.golemcore.chatbridge.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Scripted OkHttp interceptor. Responses and transport failures are served in
 * the order they were queued; every request is recorded with its body.
 */
public final class StubHttpEngine implements Interceptor {

    private final Deque<Scripted> script = new ArrayDeque<>();
    private final List<Recorded> recorded = new ArrayList<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder()
                .addInterceptor(this)
                .retryOnConnectionFailure(false)
                .build();
    }

    public synchronized void enqueueJson(int code, String json) {
        script.add(new Scripted(code, json.getBytes(StandardCharsets.UTF_8), "application/json", null));
    }

    public synchronized void enqueueText(int code, String body, String contentType) {
        script.add(new Scripted(code, body.getBytes(StandardCharsets.UTF_8), contentType, null));
    }

    public synchronized void enqueueBytes(int code, byte[] body, String contentType) {
        script.add(new Scripted(code, body, contentType, null));
    }

    public synchronized void enqueueFailure(IOException failure) {
        script.add(new Scripted(0, new byte[0], null, failure));
    }

    public synchronized int getRequestCount() {
        return recorded.size();
    }

    public synchronized Recorded lastRequest() {
        return recorded.isEmpty() ? null : recorded.get(recorded.size() - 1);
    }

    public synchronized List<Recorded> requests() {
        return List.copyOf(recorded);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        Scripted next;
        synchronized (this) {
            recorded.add(new Recorded(request, bodyOf(request)));
            next = script.poll();
        }
        if (next == null) {
            throw new IOException("Nothing scripted for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        MediaType mediaType = next.contentType() != null ? MediaType.parse(next.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("stub")
                .body(ResponseBody.create(next.body(), mediaType))
                .build();
    }

    private static String bodyOf(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Scripted(int code, byte[] body, String contentType, IOException failure) {
    }

    /**
     * A request seen by the engine.
     */
    public record Recorded(Request request, String body) {

        public String url() {
            return request.url().toString();
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
