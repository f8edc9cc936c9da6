package org.publicip.lookup.http;

import org.jetbrains.annotations.NotNull;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Issues HTTP requests on behalf of the lookup service. This is the only place where lookups touch the network.
 */
public interface HttpTransport {
    /**
     * Sends a request and reads the body as a string.
     *
     * @param request the request
     * @return a future completed with the response, or failed with the I/O error
     */
    CompletableFuture<HttpResponse<String>> send(@NotNull HttpRequest request);

    /**
     * Creates a transport with a fresh HTTP client.
     *
     * @param connectTimeout the connect timeout of the client
     * @param blocking       if true, requests block the calling thread
     * @return the transport
     */
    static HttpTransport create(@NotNull Duration connectTimeout, boolean blocking) {
        var client = newClient(connectTimeout);
        return blocking ? new BlockingHttpTransport(client) : new AsyncHttpTransport(client);
    }

    /**
     * Creates the HTTP client used by the transports.
     *
     * @param connectTimeout the connect timeout
     * @return the client
     */
    static HttpClient newClient(@NotNull Duration connectTimeout) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }
}
