package com.botscript.runtime.instance;

import com.botscript.runtime.event.EventBus;

/**
 * Entry point of backend events into the event bus. Events published here have
 * no origin script.
 */
public class BackendEventBridge {

    private final EventBus bus;
    private final Instance instance;

    public BackendEventBridge(EventBus bus, Instance instance) {
        this.bus = bus;
        this.instance = instance;
    }

    /** Deliver a backend event to the scripts of this instance. */
    public void publish(String name, Object payload) {
        bus.emit(instance, name, payload);
    }

    /** Deliver a backend event to the scripts of every instance. */
    public void broadcast(String name, Object payload) {
        bus.broadcast(null, name, payload);
    }

    public void connected() {
        publish("connect", null);
    }

    public void connectionFailed(String reason) {
        publish("connectionFailed", reason);
    }

    public void disconnected(String reason) {
        publish("disconnect", reason);
    }

    public Instance getInstance() {
        return instance;
    }
}
