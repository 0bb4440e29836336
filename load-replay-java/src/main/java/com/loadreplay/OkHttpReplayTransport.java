package com.loadreplay;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.*;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Sends replayed requests to {@code http://host:port/} with OkHttp's asynchronous calls.
 *
 * All requests share one client and its connection pool. There is no read or call
 * timeout: a request runs until it completes or the replay cancels it.
 */
public class OkHttpReplayTransport implements ReplayTransport {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
    private static final Gson GSON = new Gson();

    private final OkHttpClient client;
    private final HttpUrl baseUrl;

    public OkHttpReplayTransport(ReplayConfig config) {
        // OkHttp queues calls beyond 64 in flight (5 per host) by default
        int limit = config.getMaxOutstanding() > 0 ? config.getMaxOutstanding() : Integer.MAX_VALUE;
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(limit);
        dispatcher.setMaxRequestsPerHost(limit);

        this.client = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.SECONDS)
                .writeTimeout(0, TimeUnit.SECONDS)
                .callTimeout(0, TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(200, 5, TimeUnit.MINUTES))
                .dispatcher(dispatcher)
                .build();

        this.baseUrl = new HttpUrl.Builder()
                .scheme("http")
                .host(config.getHost())
                .port(config.getPort())
                .build();
    }

    HttpUrl urlFor(String path) {
        HttpUrl url = baseUrl.resolve(path.startsWith("/") ? path : "/" + path);
        if (url == null) {
            throw new IllegalArgumentException("Cannot build a URL for path: " + path);
        }
        return url;
    }

    private Request buildRequest(RequestEvent event) {
        String method = event.getMethod().toUpperCase();
        RequestBody body = null;
        if (!method.equals("GET") && !method.equals("HEAD")) {
            JsonElement json = event.getBody();
            body = RequestBody.create(json != null ? GSON.toJson(json) : "", JSON_MEDIA_TYPE);
        }
        return new Request.Builder()
                .url(urlFor(event.getPath()))
                .addHeader("Accept", "application/json")
                .method(method, body)
                .build();
    }

    @Override
    public CompletableFuture<ReplayResponse> send(RequestEvent event) {
        Request request = buildRequest(event);
        CompletableFuture<ReplayResponse> future = new CompletableFuture<>();
        long start = System.nanoTime();

        Call call = client.newCall(request);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody responseBody = response.body()) {
                    String text = responseBody != null ? responseBody.string() : "";
                    JsonElement json = text.isBlank() ? null : JsonParser.parseString(text);
                    long latencyMs = (System.nanoTime() - start) / 1_000_000;
                    future.complete(new ReplayResponse(response.code(), json, event.getPath(), latencyMs));
                } catch (IOException e) {
                    future.completeExceptionally(e);
                } catch (JsonParseException e) {
                    future.completeExceptionally(
                            new IOException("Malformed response body (HTTP " + response.code() + ")", e));
                }
            }
        });

        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        return future;
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
