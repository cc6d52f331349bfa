package com.botscript.runtime.event;

import com.botscript.runtime.error.ValidationError;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.runtime.store.StoreValues;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Per-instance listener registry with local and cross-instance delivery.
 * <p>
 * Emitting never runs listeners on the caller's stack: the bus takes a
 * snapshot of the matching subscriptions and posts one dispatch task to the
 * target instance's queue. Within an instance, local and broadcast events are
 * dispatched in the order they were posted. Listeners registered after the
 * snapshot are not invoked by that dispatch; subscriptions removed before their
 * turn are skipped. A listener that throws is logged and the remaining ones
 * still run.
 * <p>
 * Broadcast payloads cross instance boundaries, so they are validated like
 * store values and every receiving instance gets its own copy.
 */
@Slf4j
public class EventBus {

    private final Map<String, InstanceSubscribers> byInstance = new ConcurrentHashMap<>();
    private final AtomicLong ordinals = new AtomicLong();

    private static final class InstanceSubscribers {
        final Instance instance;
        final Map<String, List<Subscription>> byName = new ConcurrentHashMap<>();

        InstanceSubscribers(Instance instance) {
            this.instance = instance;
        }

        List<Subscription> get(String name) {
            return byName.getOrDefault(name, List.of());
        }
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Append a listener for {@code eventName} in the context's instance.
     * Listeners of one context fire in registration order.
     */
    public Subscription on(ScriptContext context, String eventName, EventListener listener) {
        if (eventName == null || eventName.isEmpty()) {
            throw new ValidationError("event name must not be empty");
        }
        if (listener == null) {
            throw new ValidationError("listener must not be null");
        }
        Instance instance = context.getInstance();
        Subscription sub = new Subscription(eventName, context, ordinals.incrementAndGet(), listener);
        if (context.isDestroyed()) {
            sub.deactivate();
            log.warn("Ignoring subscription to '{}' from unloaded script {}", eventName, context.getId());
            return sub;
        }
        byInstance.computeIfAbsent(instance.getId(), id -> new InstanceSubscribers(instance))
                .byName.computeIfAbsent(eventName, n -> new CopyOnWriteArrayList<>())
                .add(sub);
        if (context.isDestroyed()) {
            removeContext(context);
        }
        return sub;
    }

    /** Deactivate and drop every subscription of the context. */
    public void removeContext(ScriptContext context) {
        InstanceSubscribers subs = byInstance.get(context.getInstance().getId());
        if (subs == null) {
            return;
        }
        int removed = 0;
        for (List<Subscription> list : subs.byName.values()) {
            for (Subscription sub : list) {
                if (sub.getContext() == context) {
                    sub.deactivate();
                    removed++;
                }
            }
            list.removeIf(s -> s.getContext() == context);
        }
        if (removed > 0) {
            log.debug("Removed {} subscriptions of {}", removed, context.getId());
        }
    }

    /** Forget an instance entirely; used when it is destroyed. */
    public void removeInstance(Instance instance) {
        InstanceSubscribers subs = byInstance.remove(instance.getId());
        if (subs != null) {
            subs.byName.values().forEach(list -> list.forEach(Subscription::deactivate));
        }
    }

    public int subscriberCount(Instance instance, String eventName) {
        InstanceSubscribers subs = byInstance.get(instance.getId());
        return subs == null ? 0 : subs.get(eventName).size();
    }

    // =========================================================================
    // Delivery
    // =========================================================================

    /** Local event emitted by a script. */
    public void emit(ScriptContext origin, String eventName, Object payload) {
        post(origin.getInstance(), new ScriptEvent(eventName, payload, origin, DeliveryMode.LOCAL), null, null);
    }

    /** Local event raised by the host or a backend. */
    public void emit(Instance instance, String eventName, Object payload) {
        post(instance, new ScriptEvent(eventName, payload, null, DeliveryMode.LOCAL), null, null);
    }

    /**
     * Local event for the listeners of one context only. {@code guard} runs on
     * the instance queue right before dispatch and suppresses it when false.
     */
    public void emitTo(ScriptContext target, String eventName, Object payload, BooleanSupplier guard) {
        post(target.getInstance(), new ScriptEvent(eventName, payload, null, DeliveryMode.LOCAL), target, guard);
    }

    /**
     * Deliver to every running instance with at least one subscriber for
     * {@code eventName}, the origin's instance included, exactly once per
     * subscriber.
     *
     * @param origin emitting context, or null for host events
     * @return number of instances the event was posted to
     * @throws ValidationError if the payload is not serializable
     */
    public int broadcast(ScriptContext origin, String eventName, Object payload) {
        JsonNode tree = StoreValues.toTree(payload);
        int targets = 0;
        for (InstanceSubscribers subs : byInstance.values()) {
            if (!subs.instance.isRunning() || subs.get(eventName).isEmpty()) {
                continue;
            }
            ScriptEvent event = new ScriptEvent(eventName, StoreValues.toJava(tree), origin, DeliveryMode.BROADCAST);
            if (post(subs.instance, event, null, null)) {
                targets++;
            }
        }
        return targets;
    }

    /**
     * Run the context's listeners for {@code eventName} on the calling thread.
     * Only for use on the context's own instance queue, e.g. to deliver
     * {@code unload} right before teardown.
     */
    public void deliverNow(ScriptContext target, String eventName, Object payload) {
        List<Subscription> snapshot = snapshot(target.getInstance(), eventName, target);
        dispatch(new ScriptEvent(eventName, payload, null, DeliveryMode.LOCAL), snapshot);
    }

    private boolean post(Instance instance, ScriptEvent event, ScriptContext only, BooleanSupplier guard) {
        List<Subscription> snapshot = snapshot(instance, event.name(), only);
        if (snapshot.isEmpty()) {
            return false;
        }
        return instance.getQueue().post(() -> {
            if (guard != null && !guard.getAsBoolean()) {
                return;
            }
            dispatch(event, snapshot);
        });
    }

    private List<Subscription> snapshot(Instance instance, String eventName, ScriptContext only) {
        InstanceSubscribers subs = byInstance.get(instance.getId());
        if (subs == null) {
            return List.of();
        }
        List<Subscription> current = subs.get(eventName);
        if (only == null) {
            return List.copyOf(current);
        }
        List<Subscription> filtered = new ArrayList<>();
        for (Subscription sub : current) {
            if (sub.getContext() == only) {
                filtered.add(sub);
            }
        }
        return filtered;
    }

    private void dispatch(ScriptEvent event, List<Subscription> snapshot) {
        for (Subscription sub : snapshot) {
            if (!sub.isActive()) {
                continue;
            }
            try {
                sub.getListener().onEvent(event);
            } catch (Exception e) {
                log.error("Listener error [{} in {}]: {}", event.name(), sub.getContext().getId(),
                        e.getMessage() != null ? e.getMessage() : e.toString());
            }
        }
    }
}
