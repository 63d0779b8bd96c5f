package mta.nzb.checker.service.probe;

import mta.nzb.checker.exception.ProbeException;
import mta.nzb.checker.model.ProviderConfig;
import mta.nzb.checker.support.FakeNntpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DirectDialProbeTest {

    private static final NntpTimeouts TIMEOUTS = new NntpTimeouts(2000, 2000);
    private static final SSLSocketFactory SSL = (SSLSocketFactory) SSLSocketFactory.getDefault();

    private FakeNntpServer server;

    @AfterEach
    void tearDown() throws IOException {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void isAvailable_ArticlePresent_ShouldAuthenticateAndStat() throws Exception {
        server = new FakeNntpServer(Set.of("<present@test>"), "user", "pass");
        DirectDialProbe probe = new DirectDialProbe(provider(server.port(), "user", "pass"), TIMEOUTS, SSL);

        assertTrue(probe.isAvailable("<present@test>", List.of()));

        waitForQuit();
        assertEquals(List.of("AUTHINFO USER user", "AUTHINFO PASS pass", "STAT <present@test>", "QUIT"),
                server.received());
    }

    @Test
    void isAvailable_ArticleMissing_ShouldReturnFalse() throws Exception {
        server = new FakeNntpServer(Set.of("<present@test>"), "user", "pass");
        DirectDialProbe probe = new DirectDialProbe(provider(server.port(), "user", "pass"), TIMEOUTS, SSL);

        assertFalse(probe.isAvailable("<missing@test>", List.of()));
    }

    @Test
    void isAvailable_NoUsername_ShouldSkipAuthentication() throws Exception {
        server = new FakeNntpServer(Set.of("<present@test>"), "user", "pass");
        DirectDialProbe probe = new DirectDialProbe(provider(server.port(), null, null), TIMEOUTS, SSL);

        assertTrue(probe.isAvailable("<present@test>", List.of()));

        waitForQuit();
        assertEquals("STAT <present@test>", server.received().get(0));
    }

    @Test
    void isAvailable_BadCredentials_ShouldThrowProbeException() throws Exception {
        server = new FakeNntpServer(Set.of("<present@test>"), "user", "pass");
        DirectDialProbe probe = new DirectDialProbe(provider(server.port(), "user", "wrong"), TIMEOUTS, SSL);

        ProbeException ex = assertThrows(ProbeException.class, () -> probe.isAvailable("<present@test>", List.of()));

        NntpProtocolException cause = assertInstanceOf(NntpProtocolException.class, ex.getCause());
        assertEquals(481, cause.getStatusCode());
    }

    @Test
    void isAvailable_GreetingRefused_ShouldThrowProbeException() throws Exception {
        server = new FakeNntpServer(Set.of(), "user", "pass", "502 access denied");
        DirectDialProbe probe = new DirectDialProbe(provider(server.port(), "user", "pass"), TIMEOUTS, SSL);

        ProbeException ex = assertThrows(ProbeException.class, () -> probe.isAvailable("<present@test>", List.of()));

        assertEquals("<present@test>", ex.getMessageId());
    }

    @Test
    void isAvailable_ConnectionRefused_ShouldThrowProbeException() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
        DirectDialProbe probe = new DirectDialProbe(provider(closedPort, null, null), TIMEOUTS, SSL);

        assertThrows(ProbeException.class, () -> probe.isAvailable("<present@test>", List.of()));
    }

    @Test
    void isAvailable_IdWithLineBreak_ShouldNotReachServer() throws Exception {
        server = new FakeNntpServer(Set.of("<a@b>"), "user", "pass");
        DirectDialProbe probe = new DirectDialProbe(provider(server.port(), null, null), TIMEOUTS, SSL);

        ProbeException ex = assertThrows(ProbeException.class,
                () -> probe.isAvailable("<a@b>\r\nLIST ACTIVE>", List.of()));

        assertInstanceOf(NntpProtocolException.class, ex.getCause());
        waitForQuit();
        assertTrue(server.received().stream().noneMatch(line -> line.startsWith("STAT") || line.startsWith("LIST")),
                "server saw " + server.received());
    }

    @Test
    void cancelInFlight_StalledStat_ShouldCloseSocketAndFail() throws Exception {
        server = FakeNntpServer.stallingOnStat();
        DirectDialProbe probe = new DirectDialProbe(
                provider(server.port(), null, null), new NntpTimeouts(2000, 30_000), SSL);

        CompletableFuture<Boolean> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return probe.isAvailable("<a@test>", List.of());
            } catch (ProbeException e) {
                throw new IllegalStateException(e);
            }
        });
        for (int i = 0; i < 200 && !server.received().contains("STAT <a@test>"); i++) {
            Thread.sleep(10);
        }

        probe.cancelInFlight();

        ExecutionException ex = assertThrows(ExecutionException.class, () -> pending.get(3, TimeUnit.SECONDS));
        assertInstanceOf(ProbeException.class, ex.getCause().getCause());
        assertTrue(server.awaitDisconnects(1, 3000));
        assertEquals(0, probe.openConnections());
    }

    @Test
    void cancelInFlight_BeforeDialing_ShouldRefuseNewConnections() throws Exception {
        server = new FakeNntpServer(Set.of("<a@test>"), "user", "pass");
        DirectDialProbe probe = new DirectDialProbe(provider(server.port(), null, null), TIMEOUTS, SSL);

        probe.cancelInFlight();

        assertThrows(ProbeException.class, () -> probe.isAvailable("<a@test>", List.of()));
        assertTrue(server.received().isEmpty());
    }

    @Test
    void describe_ShouldUseProviderName() {
        DirectDialProbe probe = new DirectDialProbe(provider(119, null, null), TIMEOUTS, SSL);

        assertEquals("Loopback", probe.describe());
    }

    private static ProviderConfig provider(int port, String username, String password) {
        return new ProviderConfig("Loopback", "127.0.0.1", port, false, username, password, 1, true);
    }

    private void waitForQuit() throws InterruptedException {
        for (int i = 0; i < 100 && !server.received().contains("QUIT"); i++) {
            Thread.sleep(10);
        }
    }
}
