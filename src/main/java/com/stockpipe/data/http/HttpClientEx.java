package com.stockpipe.data.http;

import com.stockpipe.core.PipelineException;
import com.stockpipe.core.TransientFetchException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Thin GET client. Timeouts, I/O errors, 429 and 5xx become {@link TransientFetchException};
 * any other non-2xx status is a permanent {@link PipelineException}.
 */
public class HttpClientEx {
    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, int timeoutSeconds) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("User-Agent", "stockpipe/1.0")
                .build();
        String shown = maskSecrets(url);
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientFetchException("timeout", "HTTP timeout for " + shown, e);
        } catch (IOException e) {
            throw new TransientFetchException("io", "HTTP io error for " + shown + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("HTTP interrupted for " + shown, e);
        }
        int code = resp.statusCode();
        if (code >= 200 && code < 300) {
            return resp.body();
        }
        if (code == 429) {
            throw new TransientFetchException("rate_limit", "HTTP 429 for " + shown);
        }
        if (code >= 500) {
            throw new TransientFetchException("server_error", "HTTP " + code + " for " + shown);
        }
        throw new PipelineException("HTTP " + code + " for " + shown);
    }

    public static String maskSecrets(String url) {
        if (url == null) {
            return "";
        }
        return url.replaceAll("(?i)((?:token|apikey|api_key)=)[^&]+", "$1***");
    }
}
