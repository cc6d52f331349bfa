package com.botscript.session;

import com.botscript.common.config.BotScriptConfig;
import com.botscript.common.config.ConfigService;
import com.botscript.runtime.host.ScriptHost;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.script.ScriptCatalog;
import com.botscript.session.websocket.WebSocketPeerServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Assembles a running bot: config, installed scripts, the script host with
 * the session modules, the optional websocket peer server and the configured
 * instances.
 */
@Slf4j
public class HostBootstrap implements AutoCloseable {

    private static final long START_TIMEOUT_SECONDS = 30;

    private final ScriptHost host;
    private final SessionManager sessions;
    private final WebSocketPeerServer peerServer;

    private HostBootstrap(ScriptHost host, SessionManager sessions, WebSocketPeerServer peerServer) {
        this.host = host;
        this.sessions = sessions;
        this.peerServer = peerServer;
    }

    /**
     * Start from a config file, discovering scripts with {@code classLoader}.
     */
    public static HostBootstrap start(Path configPath, ClassLoader classLoader) throws IOException, InterruptedException {
        ScriptCatalog catalog = new ScriptCatalog();
        int found = catalog.discover(classLoader);
        log.info("Discovered {} scripts", found);
        return start(new ConfigService(configPath), catalog);
    }

    public static HostBootstrap start(ConfigService configService, ScriptCatalog catalog)
            throws IOException, InterruptedException {
        BotScriptConfig config = configService.loadConfig();
        ScriptHost host = ScriptHost.create(config, catalog);
        host.setConfigService(configService);
        SessionManager sessions = SessionModules.install(host);

        WebSocketPeerServer peerServer = null;
        BotScriptConfig.WebSocketConfig ws = host.getConfig().getSessions().getWebsocket();
        if (ws != null && ws.getPort() != null) {
            peerServer = new WebSocketPeerServer(host, sessions, ws.getHost(), ws.getPort());
            try {
                peerServer.start();
            } catch (InterruptedException | RuntimeException e) {
                host.close();
                throw e;
            }
            host.addService(peerServer);
        }

        HostBootstrap bootstrap = new HostBootstrap(host, sessions, peerServer);
        bootstrap.startInstances();
        return bootstrap;
    }

    private void startInstances() throws InterruptedException {
        List<CompletableFuture<Void>> starts = new ArrayList<>();
        for (Instance instance : host.createConfiguredInstances()) {
            starts.add(host.startInstance(instance.getId()));
        }
        try {
            CompletableFuture.allOf(starts.toArray(new CompletableFuture<?>[0]))
                    .get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("Bot {} running with {} instances", host.getConfig().getBotId(), starts.size());
        } catch (ExecutionException e) {
            log.error("Instance start failed: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            log.warn("Instances still starting after {}s", START_TIMEOUT_SECONDS);
        }
    }

    public ScriptHost getHost() {
        return host;
    }

    public SessionManager getSessions() {
        return sessions;
    }

    public Optional<WebSocketPeerServer> getPeerServer() {
        return Optional.ofNullable(peerServer);
    }

    @Override
    public void close() {
        host.close();
    }

    public static void main(String[] args) throws Exception {
        Path configPath = Path.of(args.length > 0 ? args[0] : "botscript.json");
        HostBootstrap bootstrap = start(configPath, Thread.currentThread().getContextClassLoader());
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            bootstrap.close();
            stopped.countDown();
        }, "botscript-shutdown"));
        stopped.await();
    }
}
