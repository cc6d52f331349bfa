package com.botscript.runtime.event;

import com.botscript.runtime.script.ScriptContext;

/**
 * A named event as seen by listeners.
 *
 * @param origin emitting script context; null for events raised by the host,
 *               a backend or a connection
 */
public record ScriptEvent(String name, Object payload, ScriptContext origin, DeliveryMode mode) {
}
