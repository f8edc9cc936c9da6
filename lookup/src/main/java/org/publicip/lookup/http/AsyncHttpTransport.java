package org.publicip.lookup.http;

import org.jetbrains.annotations.NotNull;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Sends requests with {@link HttpClient#sendAsync}, never blocking the caller.
 */
public class AsyncHttpTransport implements HttpTransport {
    private final HttpClient _client;

    public AsyncHttpTransport(@NotNull HttpClient client) {
        _client = client;
    }

    @Override
    public CompletableFuture<HttpResponse<String>> send(@NotNull HttpRequest request) {
        return _client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
    }
}
