package com.coagent.workflow.integration.models.node;

import java.util.Set;

/**
 * Node that knows the names of the nodes it can route to. The registry uses it to reject
 * definitions whose successors are not declared.
 */
public interface ICoAgentRoutingNode extends ICoAgentNode {

    Set<String> getSuccessors();
}
