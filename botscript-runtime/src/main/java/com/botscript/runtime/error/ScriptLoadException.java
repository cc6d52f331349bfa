package com.botscript.runtime.error;

import java.util.List;

/**
 * A script could not be loaded into an instance. Nothing the script would have
 * owned (subscriptions, store handles, connections) survives the failure.
 */
public class ScriptLoadException extends RuntimeException {

    private final String scriptName;
    private final List<String> problems;

    public ScriptLoadException(String scriptName, List<String> problems) {
        super("failed to load script " + scriptName + ": " + String.join("; ", problems));
        this.scriptName = scriptName;
        this.problems = List.copyOf(problems);
    }

    public ScriptLoadException(String scriptName, String problem, Throwable cause) {
        super("failed to load script " + scriptName + ": " + problem, cause);
        this.scriptName = scriptName;
        this.problems = List.of(problem);
    }

    public String getScriptName() {
        return scriptName;
    }

    public List<String> getProblems() {
        return problems;
    }
}
