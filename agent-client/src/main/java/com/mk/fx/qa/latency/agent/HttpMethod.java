package com.mk.fx.qa.latency.agent;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE
}
