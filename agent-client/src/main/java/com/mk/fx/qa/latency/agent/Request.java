package com.mk.fx.qa.latency.agent;

import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Request {
    private HttpMethod method;
    private String path;
    private Map<String, String> headers;
    private Map<String, String> query;
    private Object body;

    /** Overrides the client's request timeout, e.g. for long polls. */
    private Duration timeout;
}
