package com.botscript.runtime.error;

/**
 * A script asked for a module it may not use.
 * <p>
 * Fatal to the script load when the module is declared as required in the
 * manifest; otherwise handed back to script code inside a
 * {@link com.botscript.runtime.capability.ModuleResolution}.
 */
public class CapabilityError extends RuntimeException {

    public enum Reason {
        /** No module of that name exists. */
        UNKNOWN_MODULE,
        /** The module is restricted and the script has no grant for it. */
        NOT_GRANTED,
        /** The module exists but no implementation is installed in this host. */
        UNAVAILABLE
    }

    private final String moduleName;
    private final Reason reason;

    public CapabilityError(String moduleName, Reason reason, String message) {
        super(message);
        this.moduleName = moduleName;
        this.reason = reason;
    }

    public static CapabilityError unknownModule(String moduleName) {
        return new CapabilityError(moduleName, Reason.UNKNOWN_MODULE,
                "unknown module: " + moduleName);
    }

    public static CapabilityError notGranted(String scriptName, String moduleName) {
        return new CapabilityError(moduleName, Reason.NOT_GRANTED,
                "script " + scriptName + " is not allowed to use module " + moduleName);
    }

    public static CapabilityError unavailable(String moduleName) {
        return new CapabilityError(moduleName, Reason.UNAVAILABLE,
                "module " + moduleName + " is not available in this host");
    }

    public String getModuleName() {
        return moduleName;
    }

    public Reason getReason() {
        return reason;
    }
}
