package com.botscript.session.websocket;

import com.botscript.common.config.BotScriptConfig;
import com.botscript.runtime.host.ScriptHost;
import com.botscript.runtime.modules.EventModule;
import com.botscript.runtime.script.ScriptCatalog;
import com.botscript.runtime.store.ScopedStore;
import com.botscript.session.ConnectionEvent;
import com.botscript.session.SessionManager;
import com.botscript.session.SessionModules;
import com.botscript.session.SessionTestSupport;
import com.botscript.session.TestScripts;
import com.botscript.session.modules.WsModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketPeerServerTest {

    private ScriptCatalog catalog;
    private ScriptHost host;
    private SessionManager sessions;
    private WebSocketPeerServer server;
    private final List<String> scriptEvents = new CopyOnWriteArrayList<>();
    private final HttpClient http = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws Exception {
        catalog = new ScriptCatalog();
        catalog.register(TestScripts.script("chat", List.of("ws"), api -> {
            var ws = api.require("ws", WsModule.class);
            var events = api.require("event", EventModule.class);
            events.on("ws.connect", e -> scriptEvents.add("connect"));
            events.on("ws.close", e -> scriptEvents.add("close"));
            events.on("ws.data", e -> {
                var ce = (ConnectionEvent) e.payload();
                String text = String.valueOf(ce.data());
                if ("bye".equals(text)) {
                    ws.close(ce.connectionId());
                } else if (text.startsWith("all:")) {
                    ws.broadcast(ConnectionEvent.TEXT_MESSAGE, text.substring(4));
                } else {
                    ws.write(ce.connectionId(), ce.messageType(), "echo:" + text);
                }
            });
        }));
        catalog.register(TestScripts.script("quiet", List.of(), api -> {
        }));

        var config = new BotScriptConfig();
        config.setBotId("bot");
        config.setSessions(SessionTestSupport.sessionsConfig(5_000));
        config.setScripts(new BotScriptConfig.ScriptsConfig());
        config.getScripts().getPrivileges().put("chat", List.of("ws"));
        config.setInstances(new ArrayList<>(List.of(TestScripts.instance("i1", "chat", "quiet"))));

        host = new ScriptHost(config, ScopedStore.inMemory(), catalog);
        sessions = SessionModules.install(host);
        host.createConfiguredInstances();
        host.startInstance("i1").get(5, TimeUnit.SECONDS);

        server = new WebSocketPeerServer(host, sessions, "127.0.0.1", 0);
        server.start();
        host.addService(server);
    }

    @AfterEach
    void tearDown() {
        host.close();
    }

    /** Client side of one peer, collecting what the script sends. */
    static class Peer implements WebSocket.Listener {
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        final CompletableFuture<Integer> closed = new CompletableFuture<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closed.complete(statusCode);
            return null;
        }

        String next() throws InterruptedException {
            String message = messages.poll(5, TimeUnit.SECONDS);
            assertNotNull(message, "no message within 5s");
            return message;
        }
    }

    private URI uri(String path) {
        return URI.create("ws://127.0.0.1:" + server.getPort() + path);
    }

    private WebSocket connect(String path, Peer peer) throws Exception {
        return http.newWebSocketBuilder().buildAsync(uri(path), peer).get(5, TimeUnit.SECONDS);
    }

    private void awaitScriptEvents(String... expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (scriptEvents.size() < expected.length && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(List.of(expected), scriptEvents);
    }

    @Nested
    class Messaging {

        @Test
        void textMessage_isEchoedByTheScript() throws Exception {
            var peer = new Peer();
            var socket = connect("/api/v1/b/bot/i/i1/ws/chat", peer);

            socket.sendText("hi", true).get(5, TimeUnit.SECONDS);

            assertEquals("echo:hi", peer.next());
            awaitScriptEvents("connect");
        }

        @Test
        void messages_keepTheirOrder() throws Exception {
            var peer = new Peer();
            var socket = connect("/api/v1/b/bot/i/i1/ws/chat", peer);

            for (int i = 0; i < 20; i++) {
                socket.sendText("m" + i, true).get(5, TimeUnit.SECONDS);
            }

            for (int i = 0; i < 20; i++) {
                assertEquals("echo:m" + i, peer.next());
            }
        }

        @Test
        void broadcast_reachesEveryPeerOfTheScript() throws Exception {
            var first = new Peer();
            var second = new Peer();
            var socket = connect("/api/v1/b/bot/i/i1/ws/chat", first);
            connect("/api/v1/b/bot/i/i1/ws/chat", second);
            awaitScriptEvents("connect", "connect");

            socket.sendText("all:news", true).get(5, TimeUnit.SECONDS);

            assertEquals("news", first.next());
            assertEquals("news", second.next());
        }
    }

    @Nested
    class Closing {

        @Test
        void scriptClose_disconnectsThePeer() throws Exception {
            var peer = new Peer();
            var socket = connect("/api/v1/b/bot/i/i1/ws/chat", peer);

            socket.sendText("bye", true).get(5, TimeUnit.SECONDS);

            peer.closed.get(5, TimeUnit.SECONDS);
            Thread.sleep(100);
            assertEquals(List.of("connect"), scriptEvents);
            assertEquals(0, sessions.size());
        }

        @Test
        void peerClose_isReportedToTheScript() throws Exception {
            var peer = new Peer();
            var socket = connect("/api/v1/b/bot/i/i1/ws/chat", peer);
            awaitScriptEvents("connect");

            socket.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);

            awaitScriptEvents("connect", "close");
        }

        @Test
        void unloadingTheScript_closesItsPeers() throws Exception {
            var peer = new Peer();
            connect("/api/v1/b/bot/i/i1/ws/chat", peer);
            awaitScriptEvents("connect");

            host.unloadScript("i1", "chat").get(5, TimeUnit.SECONDS);

            peer.closed.get(5, TimeUnit.SECONDS);
            assertEquals(0, sessions.size());
        }
    }

    @Nested
    class Routing {

        @Test
        void unknownScript_isRefused() {
            assertThrows(ExecutionException.class, () -> connect("/api/v1/b/bot/i/i1/ws/nope", new Peer()));
        }

        @Test
        void scriptWithoutWs_isRefused() {
            assertThrows(ExecutionException.class, () -> connect("/api/v1/b/bot/i/i1/ws/quiet", new Peer()));
        }

        @Test
        void otherBot_isRefused() {
            assertThrows(ExecutionException.class, () -> connect("/api/v1/b/other/i/i1/ws/chat", new Peer()));
        }

        @Test
        void unknownInstance_isRefused() {
            assertThrows(ExecutionException.class, () -> connect("/api/v1/b/bot/i/i9/ws/chat", new Peer()));
        }

        @Test
        void pathPattern() {
            assertTrue(WebSocketPeerServer.PEER_PATH.matcher("/api/v1/b/bot/i/i1/ws/chat").matches());
            assertTrue(WebSocketPeerServer.PEER_PATH.matcher("/api/v1/b/bot/i/i1/ws/chat/").matches());
            assertFalse(WebSocketPeerServer.PEER_PATH.matcher("/api/v1/b/bot/i/i1/ws").matches());
            assertFalse(WebSocketPeerServer.PEER_PATH.matcher("/api/v1/b/bot/i/i1/ws/a/b").matches());
        }
    }
}
