package com.botscript.runtime.script;

import com.botscript.runtime.capability.CapabilityRegistry;
import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.error.CapabilityError;
import com.botscript.runtime.error.ScriptLoadException;
import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.instance.Instance;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Loads scripts into instances and tears them down again.
 * <p>
 * A load is all-or-nothing. The manifest and the declared required modules are
 * checked before a context exists, so a refused script leaves nothing behind.
 * If {@code setup} throws, the context is torn down before the returned future
 * fails.
 */
@Slf4j
public class ScriptLoader {

    /** Version compared against a manifest's {@code engine} constraint. */
    public static final String ENGINE_VERSION = "1.0.0";

    public static final String UNLOAD_EVENT = "unload";

    private final CapabilityRegistry capabilities;
    private final EventBus bus;

    public ScriptLoader(CapabilityRegistry capabilities, EventBus bus) {
        this.capabilities = capabilities;
        this.bus = bus;
    }

    // =========================================================================
    // Validation
    // =========================================================================

    /** Manifest problems that prevent loading into {@code instance}. */
    public List<String> validate(ScriptManifest manifest, Instance instance) {
        List<String> problems = new ArrayList<>();
        if (manifest == null) {
            problems.add("script has no manifest");
            return problems;
        }
        if (manifest.getName() == null || manifest.getName().isBlank()) {
            problems.add("manifest has no name");
        }
        List<String> backends = manifest.getBackends() == null || manifest.getBackends().isEmpty()
                ? List.of("ts3") : manifest.getBackends();
        boolean supported = backends.stream()
                .anyMatch(b -> b != null && b.equalsIgnoreCase(instance.getBackend().name()));
        if (!supported) {
            problems.add("backend " + instance.getBackend() + " is not supported (supports " + backends + ")");
        }
        if (manifest.isHidden() && manifest.getVars() != null && !manifest.getVars().isEmpty()) {
            problems.add("hidden scripts may not declare variables");
        }
        if (manifest.getEngine() != null && !engineSatisfies(manifest.getEngine(), ENGINE_VERSION)) {
            problems.add("requires engine " + manifest.getEngine() + ", running " + ENGINE_VERSION);
        }
        return problems;
    }

    /**
     * Whether {@code version} satisfies a constraint of the form
     * {@code ">= x.y.z"}, {@code "> x.y.z"}, {@code "= x.y.z"} or {@code "x.y.z"}
     * (the last meaning at least).
     */
    static boolean engineSatisfies(String constraint, String version) {
        String c = constraint.trim();
        String op = ">=";
        for (String candidate : List.of(">=", "<=", ">", "<", "=")) {
            if (c.startsWith(candidate)) {
                op = candidate;
                c = c.substring(candidate.length()).trim();
                break;
            }
        }
        int cmp;
        try {
            cmp = compareVersions(version, c);
        } catch (NumberFormatException e) {
            log.warn("Unparseable engine constraint '{}'", constraint);
            return false;
        }
        return switch (op) {
            case ">" -> cmp > 0;
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case "=" -> cmp == 0;
            default -> cmp >= 0;
        };
    }

    private static int compareVersions(String a, String b) {
        String[] pa = a.split("\\.");
        String[] pb = b.split("\\.");
        for (int i = 0; i < Math.max(pa.length, pb.length); i++) {
            int x = i < pa.length ? Integer.parseInt(pa[i].trim()) : 0;
            int y = i < pb.length ? Integer.parseInt(pb[i].trim()) : 0;
            if (x != y) {
                return Integer.compare(x, y);
            }
        }
        return 0;
    }

    /** Manifest defaults overlaid with configured values. */
    static Map<String, Object> effectiveConfig(ScriptManifest manifest, Map<String, Object> configured) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (manifest.getVars() != null) {
            for (ScriptManifest.ScriptVariable var : manifest.getVars()) {
                if (var.getName() != null && var.getDefaultValue() != null) {
                    out.put(var.getName(), var.getDefaultValue());
                }
            }
        }
        if (configured != null) {
            out.putAll(configured);
        }
        return out;
    }

    // =========================================================================
    // Load / unload
    // =========================================================================

    /**
     * Load {@code script} into {@code instance}. The future completes on the
     * instance queue once setup has returned, or fails with
     * {@link ScriptLoadException}.
     */
    public CompletableFuture<ScriptContext> load(Instance instance, BotScript script, Map<String, Object> configured) {
        ScriptManifest manifest = script.getManifest();
        List<String> problems = validate(manifest, instance);
        String name = manifest != null && manifest.getName() != null ? manifest.getName() : script.getClass().getName();
        if (!problems.isEmpty()) {
            log.warn("Not loading {} into {}: {}", name, instance.getId(), problems);
            return CompletableFuture.failedFuture(new ScriptLoadException(name, problems));
        }

        Set<ModuleKind> granted = capabilities.grantsFor(name);
        List<CapabilityError> denied = capabilities.checkRequired(manifest, granted);
        if (!denied.isEmpty()) {
            List<String> reasons = denied.stream().map(Throwable::getMessage).toList();
            log.warn("Not loading {} into {}: {}", name, instance.getId(), reasons);
            ScriptLoadException failure = new ScriptLoadException(name, reasons);
            denied.forEach(failure::addSuppressed);
            return CompletableFuture.failedFuture(failure);
        }

        ScriptContext context = new ScriptContext(instance, manifest, granted, capabilities,
                effectiveConfig(manifest, configured));
        if (!instance.addContext(context)) {
            return CompletableFuture.failedFuture(
                    new ScriptLoadException(name, List.of("already loaded in instance " + instance.getId())));
        }

        CompletableFuture<ScriptContext> result = new CompletableFuture<>();
        boolean posted = instance.getQueue().post(() -> {
            try {
                script.setup(context.api(), context.getConfig());
            } catch (Exception | LinkageError e) {
                log.error("Setup of {} failed: {}", context.getId(), e.toString());
                teardown(context, false);
                result.completeExceptionally(new ScriptLoadException(name, "setup failed: " + e.getMessage(), e));
                return;
            }
            if (context.markActive()) {
                log.info("Loaded script {} {}", context.getId(), manifest.getVersion() != null ? manifest.getVersion() : "");
                result.complete(context);
            } else {
                result.completeExceptionally(new ScriptLoadException(name, List.of("unloaded during setup")));
            }
        });
        if (!posted) {
            teardown(context, false);
            result.completeExceptionally(new ScriptLoadException(name,
                    List.of("instance " + instance.getId() + " is not accepting tasks")));
        }
        return result;
    }

    /**
     * Tear a context down on its instance queue. Listeners of {@code unload}
     * in that context run first; after that no listener of the context fires
     * again and its connections are closed.
     */
    public CompletableFuture<Void> unload(ScriptContext context) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean posted = context.getInstance().getQueue().post(() -> {
            teardown(context, true);
            done.complete(null);
        });
        if (!posted) {
            teardown(context, false);
            done.complete(null);
        }
        return done;
    }

    void teardown(ScriptContext context, boolean notifyUnload) {
        if (context.isDestroyed()) {
            return;
        }
        if (notifyUnload && context.isActive()) {
            bus.deliverNow(context, UNLOAD_EVENT, null);
        }
        context.markDestroyed();
        bus.removeContext(context);
        context.closeResources();
        context.getInstance().removeContext(context);
        log.info("Unloaded script {}", context.getId());
    }
}
