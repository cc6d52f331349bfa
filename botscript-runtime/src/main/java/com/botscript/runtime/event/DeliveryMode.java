package com.botscript.runtime.event;

public enum DeliveryMode {
    /** Subscribers of the emitting instance only. */
    LOCAL,
    /** Subscribers of every running instance, the emitting one included. */
    BROADCAST
}
