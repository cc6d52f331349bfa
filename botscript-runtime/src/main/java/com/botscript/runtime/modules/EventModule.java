package com.botscript.runtime.modules;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.event.EventListener;
import com.botscript.runtime.script.ScriptContext;

/**
 * Script-facing view of the event bus, bound to the calling script.
 */
public class EventModule implements ScriptModule {

    private final EventBus bus;
    private final ScriptContext context;

    public EventModule(EventBus bus, ScriptContext context) {
        this.bus = bus;
        this.context = context;
    }

    @Override
    public ModuleKind kind() {
        return ModuleKind.EVENT;
    }

    /** Subscribe until the script is unloaded. */
    public void on(String eventName, EventListener listener) {
        bus.on(context, eventName, listener);
    }

    /** Deliver to the scripts of this instance. */
    public void emit(String eventName, Object payload) {
        bus.emit(context, eventName, payload);
    }

    /**
     * Deliver to the scripts of every running instance, this one included.
     *
     * @throws com.botscript.runtime.error.ValidationError if the payload is not serializable
     */
    public void broadcast(String eventName, Object payload) {
        bus.broadcast(context, eventName, payload);
    }
}
