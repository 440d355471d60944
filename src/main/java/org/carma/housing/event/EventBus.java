package org.carma.housing.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Delivers the events of one simulation run to listeners and keeps them as the run's journal.
 *
 * Listeners register for one concrete event record; delivery is synchronous,
 * on the publishing thread, in registration order.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<? extends Event>, List<Consumer<Event>>> listeners = new ConcurrentHashMap<>();
    private final List<Event> journal = new CopyOnWriteArrayList<>();
    private final boolean journaling;

    public EventBus() {
        this(true);
    }

    /**
     * @param journaling whether published events are kept for {@link #getHistory(Class)}
     */
    public EventBus(boolean journaling) {
        this.journaling = journaling;
    }

    public <T extends Event> void subscribe(Class<T> eventType, Consumer<? super T> listener) {
        listeners.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>())
            .add(event -> listener.accept(eventType.cast(event)));
    }

    /**
     * Journal the event and hand it to the listeners of its type. A listener that
     * throws is logged and skipped; the turn that published the event goes on.
     */
    public void publish(Event event) {
        if (journaling) {
            journal.add(event);
        }
        for (Consumer<Event> listener : listeners.getOrDefault(event.getClass(), List.of())) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener for {} failed", event.eventType(), e);
            }
        }
    }

    /**
     * Journaled events of the given type in publication order.
     * {@code Event.class} returns the whole journal.
     */
    public <T extends Event> List<T> getHistory(Class<T> eventType) {
        return journal.stream()
            .filter(eventType::isInstance)
            .map(eventType::cast)
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
