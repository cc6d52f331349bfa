package com.botscript.runtime.store;

/**
 * Visibility tier of a stored key, narrowest first.
 */
public enum StoreScope {
    /** One script inside one instance. */
    INSTANCE,
    /** One script, shared by every instance running it. */
    SCRIPT,
    /** Every script in every instance. */
    GLOBAL
}
