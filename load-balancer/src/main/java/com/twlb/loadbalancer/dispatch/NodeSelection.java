package com.twlb.loadbalancer.dispatch;

import com.twlb.loadbalancer.trust.RoutingMode;
import lombok.Value;

/**
 * Node chosen for one request and the mode that chose it.
 */
@Value
public class NodeSelection {
    String nodeId;
    RoutingMode mode;
}
