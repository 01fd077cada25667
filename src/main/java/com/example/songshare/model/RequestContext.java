package com.example.songshare.model;

import lombok.Builder;
import lombok.Value;

/**
 * Client details captured with each view or download event.
 */
@Value
@Builder
public class RequestContext {

    String ipAddress;
    String userAgent;
    String referer;

    public static RequestContext empty() {
        return RequestContext.builder().build();
    }
}
