package io.agentrelay.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of {@link QueueEvent}s to registered listeners.
 *
 * <p>A listener that throws is logged and skipped; the remaining listeners still run and
 * the publishing queue operation is never affected.
 */
public final class QueueEvents implements QueueEventListener {
    private static final Logger LOG = LoggerFactory.getLogger(QueueEvents.class);

    private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();

    public void add(QueueEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void remove(QueueEventListener listener) {
        listeners.remove(listener);
    }

    public int size() {
        return listeners.size();
    }

    @Override
    public void onEvent(QueueEvent event) {
        LOG.debug("event {} task={} agent={}", event.type(), event.taskId(), event.agentType());
        for (QueueEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Listener {} rejected event {}: {}", listener.getClass().getName(), event.type(), e.getMessage(), e);
            }
        }
    }
}
