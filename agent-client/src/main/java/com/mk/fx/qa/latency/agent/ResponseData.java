package com.mk.fx.qa.latency.agent;

import java.util.Map;
import lombok.Data;

@Data
public class ResponseData {
    private int statusCode;
    private Map<String, String> headers;
    private String body;
    private long responseTimeMs;

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
