package com.botscript.runtime.modules;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.instance.BackendAdapter;
import com.botscript.runtime.instance.Instance;
import lombok.extern.slf4j.Slf4j;

/**
 * Access to the instance's backend client. Every call answers false or null
 * while no adapter is installed.
 */
@Slf4j
public class BackendModule implements ScriptModule {

    private final Instance instance;

    public BackendModule(Instance instance) {
        this.instance = instance;
    }

    @Override
    public ModuleKind kind() {
        return ModuleKind.BACKEND;
    }

    public boolean connect() {
        BackendAdapter adapter = instance.getBackendAdapter();
        return adapter != null && adapter.connect();
    }

    public boolean disconnect() {
        BackendAdapter adapter = instance.getBackendAdapter();
        return adapter != null && adapter.disconnect();
    }

    public boolean isConnected() {
        BackendAdapter adapter = instance.getBackendAdapter();
        return adapter != null && adapter.isConnected();
    }

    public String getBotClientId() {
        BackendAdapter adapter = instance.getBackendAdapter();
        return adapter != null ? adapter.getBotClientId() : null;
    }

    public String getNick() {
        BackendAdapter adapter = instance.getBackendAdapter();
        return adapter != null ? adapter.getNick() : instance.getNick();
    }

    public void chat(String message) {
        BackendAdapter adapter = instance.getBackendAdapter();
        if (adapter == null) {
            log.debug("Dropping chat message on instance {} without backend", instance.getId());
            return;
        }
        adapter.chat(message);
    }
}
