package mta.nzb.checker.service.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sockets opened on behalf of one health check.
 * Thread interrupts do not unblock socket reads, so a cancelled check closes these instead.
 * Once closed, the registry refuses new sockets.
 */
public class SocketRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SocketRegistry.class);

    private final Set<Socket> open = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    /**
     * Tracks a socket until {@link #release(Socket)}.
     *
     * @throws InterruptedIOException if the registry was already closed; the socket is closed too
     */
    void register(Socket socket) throws IOException {
        open.add(socket);
        if (closed) {
            release(socket);
            closeSocket(socket);
            throw new InterruptedIOException("Health check cancelled before connecting");
        }
    }

    void release(Socket socket) {
        open.remove(socket);
    }

    /**
     * Closes every tracked socket and rejects later registrations.
     */
    public void closeAll() {
        closed = true;
        for (Socket socket : open) {
            closeSocket(socket);
        }
        open.clear();
    }

    public int openCount() {
        return open.size();
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Closing NNTP socket failed: {}", e.getMessage());
        }
    }
}
