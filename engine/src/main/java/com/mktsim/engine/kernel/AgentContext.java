package com.mktsim.engine.kernel;

import com.mktsim.engine.agent.Oracle;

import java.util.Random;

/**
 * What an agent is told when the kernel starts: its id, the run's time window,
 * its own seeded random source and, if configured, the price oracle.
 */
public final class AgentContext {

    public final int agentId;
    public final long startTime;
    public final long endTime;
    public final Random random;
    public final Oracle oracle;   // may be null

    AgentContext(int agentId, long startTime, long endTime, Random random, Oracle oracle) {
        this.agentId = agentId;
        this.startTime = startTime;
        this.endTime = endTime;
        this.random = random;
        this.oracle = oracle;
    }
}
