package mta.nzb.checker.service.probe;

import mta.nzb.checker.model.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * NntpConnection
 * Minimal NNTP client (RFC 3977 / RFC 4643) covering what an existence check needs:
 * greeting, AUTHINFO USER/PASS, STAT and QUIT.
 * Not thread-safe; one connection serves one probe.
 */
public class NntpConnection implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(NntpConnection.class);

    public static final int POSTING_ALLOWED = 200;
    public static final int POSTING_PROHIBITED = 201;
    public static final int ARTICLE_EXISTS = 223;
    public static final int AUTH_ACCEPTED = 281;
    public static final int PASSWORD_REQUIRED = 381;
    public static final int NO_SUCH_ARTICLE_NUMBER = 423;
    public static final int NO_SUCH_ARTICLE_ID = 430;

    private static final int DEFAULT_PORT = 119;
    private static final int DEFAULT_TLS_PORT = 563;
    private static final String CRLF = "\r\n";

    private final Socket socket;
    private final Socket rawSocket;
    private final BufferedReader reader;
    private final Writer writer;
    private final String host;
    private final SocketRegistry registry;

    NntpConnection(Socket socket, Socket rawSocket, String host, SocketRegistry registry) throws IOException {
        this.socket = socket;
        this.rawSocket = rawSocket;
        this.host = host;
        this.registry = registry;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Dials a provider, consumes the greeting and logs in when credentials are configured.
     * The socket stays in {@code registry} until the connection is closed.
     *
     * @throws IOException on connect, TLS, greeting or authentication failure
     */
    public static NntpConnection open(ProviderConfig provider, NntpTimeouts timeouts,
                                      SSLSocketFactory sslSocketFactory, SocketRegistry registry) throws IOException {
        String host = provider.host().trim();
        int port = provider.port() > 0 ? provider.port() : (provider.useTls() ? DEFAULT_TLS_PORT : DEFAULT_PORT);

        Socket raw = new Socket();
        registry.register(raw);
        Socket socket = raw;
        try {
            raw.connect(new InetSocketAddress(host, port), timeouts.connectTimeoutMs());
            raw.setSoTimeout(timeouts.readTimeoutMs());
            if (provider.useTls()) {
                SSLSocket tls = (SSLSocket) sslSocketFactory.createSocket(raw, host, port, true);
                tls.startHandshake();
                socket = tls;
            }

            NntpConnection connection = new NntpConnection(socket, raw, host, registry);
            connection.readGreeting();
            if (provider.username() != null && !provider.username().isBlank()) {
                connection.authenticate(provider.username(), provider.password());
            }
            return connection;
        } catch (IOException | RuntimeException e) {
            registry.release(raw);
            closeSocket(socket);
            throw e;
        }
    }

    /**
     * Issues {@code STAT <message-id>}.
     *
     * @return the reply status code (223 present, 430 unknown message-id)
     */
    public int stat(String messageId) throws IOException {
        int code = command("STAT " + messageId).code();
        logger.debug("STAT {} on {} -> {}", messageId, host, code);
        return code;
    }

    @Override
    public void close() {
        try {
            if (!socket.isClosed()) {
                command("QUIT");
            }
        } catch (IOException e) {
            logger.debug("QUIT to {} failed: {}", host, e.getMessage());
        } finally {
            registry.release(rawSocket);
            closeSocket(socket);
        }
    }

    private void readGreeting() throws IOException {
        Reply greeting = readReply();
        if (greeting.code() != POSTING_ALLOWED && greeting.code() != POSTING_PROHIBITED) {
            throw new NntpProtocolException(greeting.code(), "Server " + host + " refused connection: " + greeting.text());
        }
    }

    private void authenticate(String username, String password) throws IOException {
        Reply reply = command("AUTHINFO USER " + username);
        if (reply.code() == PASSWORD_REQUIRED) {
            reply = command("AUTHINFO PASS " + (password == null ? "" : password));
        }
        if (reply.code() != AUTH_ACCEPTED) {
            throw new NntpProtocolException(reply.code(), "Authentication rejected by " + host + ": " + reply.code());
        }
    }

    private Reply command(String line) throws IOException {
        if (hasControlCharacter(line)) {
            throw new NntpProtocolException(0, "Refusing to send a command containing control characters to " + host);
        }
        writer.write(line);
        writer.write(CRLF);
        writer.flush();
        return readReply();
    }

    private Reply readReply() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new EOFException("Connection to " + host + " closed by server");
        }
        if (line.length() < 3) {
            throw new NntpProtocolException(0, "Malformed reply from " + host + ": " + line);
        }
        try {
            int code = Integer.parseInt(line.substring(0, 3));
            return new Reply(code, line.length() > 4 ? line.substring(4) : "");
        } catch (NumberFormatException e) {
            throw new NntpProtocolException(0, "Malformed reply from " + host + ": " + line);
        }
    }

    private static boolean hasControlCharacter(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c < ' ' || c == 0x7f) {
                return true;
            }
        }
        return false;
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Closing NNTP socket failed: {}", e.getMessage());
        }
    }

    private record Reply(int code, String text) {}
}
