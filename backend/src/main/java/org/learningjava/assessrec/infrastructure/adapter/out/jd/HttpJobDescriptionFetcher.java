package org.learningjava.assessrec.infrastructure.adapter.out.jd;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.learningjava.assessrec.application.port.JobDescriptionPort;
import org.learningjava.assessrec.domain.error.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Fetches a job-description page with OkHttp and reduces it to plain text with jsoup.
 * One blocking call per request, bounded by the configured timeout; no retries.
 */
public class HttpJobDescriptionFetcher implements JobDescriptionPort {

    private static final Logger log = LoggerFactory.getLogger(HttpJobDescriptionFetcher.class);

    private final OkHttpClient http;
    private final String userAgent;

    public HttpJobDescriptionFetcher(Duration timeout, String userAgent) {
        this.http = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .followRedirects(true)
                .build();
        this.userAgent = userAgent;
    }

    @Override
    public String fetchText(String url) {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new FetchException(url, "Not an http(s) URL: " + url);
        }

        Request req = new Request.Builder()
                .url(parsed)
                .header("User-Agent", userAgent)
                .get()
                .build();

        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                log.error("Failed to fetch JD from {}: HTTP {}", url, resp.code());
                throw new FetchException(url, "Fetching " + url + " failed: HTTP " + resp.code());
            }
            ResponseBody body = resp.body();
            String html = body != null ? body.string() : "";
            String text = extractText(html, parsed.toString());
            if (text.isEmpty()) {
                throw new FetchException(url, "No text content at " + url);
            }
            log.info("Fetched JD from {} ({} chars)", url, text.length());
            return text;
        } catch (IOException e) {
            log.error("Failed to fetch JD from {}: {}", url, e.toString());
            throw new FetchException(url, "Fetching " + url + " failed: " + e.getMessage(), e);
        }
    }

    /** Visible text of the page: script and style removed, whitespace collapsed. */
    static String extractText(String html, String baseUri) {
        Document doc = Jsoup.parse(html, baseUri);
        doc.select("script, style, noscript").remove();
        return doc.text()
                .replace('\u00A0', ' ')
                .replaceAll("\\s+", " ")
                .trim();
    }
}
