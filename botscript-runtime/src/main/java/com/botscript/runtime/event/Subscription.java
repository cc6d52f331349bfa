package com.botscript.runtime.event;

import com.botscript.runtime.script.ScriptContext;

/**
 * A listener registered by a script context for one event name. Active from
 * registration until its context is torn down.
 */
public final class Subscription {

    private final String eventName;
    private final ScriptContext context;
    private final long ordinal;
    private final EventListener listener;
    private volatile boolean active = true;

    Subscription(String eventName, ScriptContext context, long ordinal, EventListener listener) {
        this.eventName = eventName;
        this.context = context;
        this.ordinal = ordinal;
        this.listener = listener;
    }

    public String getEventName() {
        return eventName;
    }

    public ScriptContext getContext() {
        return context;
    }

    /** Position in global registration order. */
    public long getOrdinal() {
        return ordinal;
    }

    EventListener getListener() {
        return listener;
    }

    public boolean isActive() {
        return active;
    }

    void deactivate() {
        active = false;
    }

    @Override
    public String toString() {
        return "Subscription{" + eventName + " #" + ordinal + " " + context.getId() + (active ? "" : " removed") + "}";
    }
}
