package org.publicip.lookup.http;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Sends requests with {@link HttpClient#send} on the calling thread. The returned future is always completed
 * by the time {@link #send(HttpRequest)} returns.
 */
public class BlockingHttpTransport implements HttpTransport {
    private final HttpClient _client;

    public BlockingHttpTransport(@NotNull HttpClient client) {
        _client = client;
    }

    @Override
    public CompletableFuture<HttpResponse<String>> send(@NotNull HttpRequest request) {
        try {
            return CompletableFuture.completedFuture(_client.send(request, HttpResponse.BodyHandlers.ofString()));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(e);
        }
    }
}
