package com.twlb.loadbalancer.dispatch;

import lombok.Value;

/**
 * HTTP answer of a node to a forwarded request.
 */
@Value
public class NodeResponse {
    int httpStatus;
    String body;
}
