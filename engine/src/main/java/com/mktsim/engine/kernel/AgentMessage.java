package com.mktsim.engine.kernel;

/** Payload of a message sent by one agent to another. */
public record AgentMessage(int senderId, Object body) {
}
