package com.botscript.runtime.event;

@FunctionalInterface
public interface EventListener {

    void onEvent(ScriptEvent event) throws Exception;
}
