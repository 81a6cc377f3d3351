package com.formproxy.upstream;

public class UpstreamFetchException extends RuntimeException {
    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
