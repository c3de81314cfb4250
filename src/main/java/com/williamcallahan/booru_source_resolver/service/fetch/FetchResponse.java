package com.williamcallahan.booru_source_resolver.service.fetch;

import lombok.Value;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

/**
 * Status, headers and fully buffered body of a response. Error statuses are responses too.
 */
@Value
public class FetchResponse {

    int status;
    HttpHeaders headers;
    byte[] body;

    public String header(String name) {
        return headers != null ? headers.getFirst(name) : null;
    }

    public String location() {
        return header(HttpHeaders.LOCATION);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        return body != null ? new String(body, StandardCharsets.UTF_8) : "";
    }

    @Override
    public String toString() {
        return "FetchResponse{" + status + ", " + (body != null ? body.length : 0) + " bytes}";
    }
}
