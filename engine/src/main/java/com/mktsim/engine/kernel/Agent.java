package com.mktsim.engine.kernel;

import java.util.List;

/**
 * A simulation participant. Agents see the world only through delivered
 * events and act only by returning {@link AgentAction}s; the kernel applies
 * them after the handler returns.
 */
public interface Agent {

    int id();

    /** Called once before the first event is delivered. Usually returns a first wake-up. */
    default List<AgentAction> onStart(AgentContext ctx) {
        return List.of();
    }

    /**
     * Called once per delivered event.
     * @param payload a {@link Wakeup}, an {@link AgentMessage} or a
     *                {@link com.mktsim.protocol.Notification}
     */
    List<AgentAction> onEvent(long currentTime, Object payload);

    /** Called once when the kernel stops. */
    default void onStop(long currentTime) {
    }
}
