package io.agentrelay.observability;

@FunctionalInterface
public interface QueueEventListener {
    void onEvent(QueueEvent event);
}
