package com.example.pipelinesync.client.target;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.springframework.http.HttpMethod;

import java.util.Map;

@Getter
@Builder
public class TargetRequest {

    private final HttpMethod method;

    /** Path relative to the Target base URL, already expanded. */
    private final String path;

    @Singular
    private final Map<String, String> queryParams;

    /** JSON body, {@code null} for none. */
    private final Object body;

    @Override
    public String toString() {
        return method + " " + path;
    }
}
