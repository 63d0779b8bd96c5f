package mta.nzb.checker.service.probe;

import mta.nzb.checker.exception.ProbeException;
import mta.nzb.checker.model.ProviderConfig;

import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.util.List;

/**
 * DirectDialProbe
 * Opens a fresh connection to one provider with its own credentials and issues STAT.
 * The verdict covers that provider only, so a false answer is never definitive.
 * A probe lives for one health check; {@link #cancelInFlight()} closes every socket it has open.
 */
public class DirectDialProbe implements ProviderProbe {

    private final ProviderConfig provider;
    private final NntpTimeouts timeouts;
    private final SSLSocketFactory sslSocketFactory;
    private final SocketRegistry sockets = new SocketRegistry();

    public DirectDialProbe(ProviderConfig provider, NntpTimeouts timeouts, SSLSocketFactory sslSocketFactory) {
        this.provider = provider;
        this.timeouts = timeouts;
        this.sslSocketFactory = sslSocketFactory;
    }

    @Override
    public boolean isAvailable(String messageId, List<String> groups) throws ProbeException {
        try (NntpConnection connection = NntpConnection.open(provider, timeouts, sslSocketFactory, sockets)) {
            int code = connection.stat(messageId);
            if (code == NntpConnection.ARTICLE_EXISTS) {
                return true;
            }
            if (code == NntpConnection.NO_SUCH_ARTICLE_ID || code == NntpConnection.NO_SUCH_ARTICLE_NUMBER) {
                return false;
            }
            throw new ProbeException(messageId, "STAT on " + describe() + " returned unexpected status " + code);
        } catch (IOException e) {
            throw new ProbeException(messageId, "STAT on " + describe() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void cancelInFlight() {
        sockets.closeAll();
    }

    int openConnections() {
        return sockets.openCount();
    }

    @Override
    public String describe() {
        return provider.displayName();
    }
}
