package com.example.flowbridge.builder;

/**
 * An open end of the graph under construction: the node the next statement attaches to, the most recent
 * agent on this path, and the branch label the attaching edge must carry.
 */
record Tail(String nodeId, String lastAgentId, String pendingBranchLabel) {

    static Tail of(String nodeId, String lastAgentId) {
        return new Tail(nodeId, lastAgentId, null);
    }

    static Tail labelled(String nodeId, String lastAgentId, String label) {
        return new Tail(nodeId, lastAgentId, label);
    }
}
