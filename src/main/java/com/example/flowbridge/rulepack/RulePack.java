package com.example.flowbridge.rulepack;

import com.example.flowbridge.agentspec.Flow;
import com.example.flowbridge.ir.IrFlow;

/**
 * The four conversions for one version of the workflow SDK idiom.
 */
public interface RulePack {

    /** SDK version this pack understands, e.g. {@code 0.3.3}. */
    String version();

    /** Script source to a validated IR graph. */
    IrFlow parse(String source, boolean strict);

    Flow toAgentSpec(IrFlow ir, boolean strict);

    IrFlow toIr(Flow flow, boolean strict);

    /** IR graph to script source; identical input gives identical text. */
    String generate(IrFlow ir);
}
