package netops.gateway.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import netops.gateway.error.TaskExecutionException;
import netops.gateway.error.UpstreamUnavailableException;
import netops.gateway.model.TaskType;
import netops.gateway.util.Jsons;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * TLS handshake against {@code host:port} (default 443) reporting protocol, cipher and the leaf
 * certificate's subject, issuer and expiry. An untrusted or expired certificate is a successful check
 * with {@code valid:false}; an unreachable host is a retryable failure.
 */
public class SslCheckHandler implements TaskHandler {

    private final SSLSocketFactory socketFactory;
    private final Duration connectTimeout;
    private final Clock clock;

    public SslCheckHandler(Duration connectTimeout, Clock clock) {
        this((SSLSocketFactory) SSLSocketFactory.getDefault(), connectTimeout, clock);
    }

    SslCheckHandler(SSLSocketFactory socketFactory, Duration connectTimeout, Clock clock) {
        this.socketFactory = socketFactory;
        this.connectTimeout = connectTimeout;
        this.clock = clock;
    }

    @Override
    public TaskType type() {
        return TaskType.SSL_CHECK;
    }

    @Override
    public void validate(JsonNode payload) {
        Payloads.requireText(payload, "host");
        Payloads.optionalPort(payload, "port", 443);
    }

    @Override
    public JsonNode execute(JsonNode payload) throws TaskExecutionException {
        String host = Payloads.requireText(payload, "host");
        int port = Payloads.optionalPort(payload, "port", 443);
        int timeoutMs = (int) connectTimeout.toMillis();

        ObjectNode result = Jsons.object();
        result.put("host", host);
        result.put("port", port);

        try (Socket raw = new Socket()) {
            raw.connect(new InetSocketAddress(host, port), timeoutMs);
            raw.setSoTimeout(timeoutMs);
            try (SSLSocket socket = (SSLSocket) socketFactory.createSocket(raw, host, port, false)) {
                SSLParameters parameters = socket.getSSLParameters();
                parameters.setServerNames(List.of(new SNIHostName(host)));
                parameters.setEndpointIdentificationAlgorithm("HTTPS");
                socket.setSSLParameters(parameters);
                socket.startHandshake();

                SSLSession session = socket.getSession();
                result.put("valid", true);
                result.put("protocol", session.getProtocol());
                result.put("cipher_suite", session.getCipherSuite());
                describeLeaf(session.getPeerCertificates(), result);
            }
        } catch (SSLHandshakeException e) {
            result.put("valid", false);
            result.put("error", e.getMessage());
        } catch (IllegalArgumentException e) {
            throw TaskExecutionException.permanent("Invalid host '" + host + "': " + e.getMessage());
        } catch (IOException e) {
            throw new UpstreamUnavailableException(host, "TLS check of " + host + ":" + port + " failed: "
                    + e.getMessage(), e);
        }
        result.put("checked_at", clock.instant().toString());
        return result;
    }

    private void describeLeaf(Certificate[] chain, ObjectNode result) {
        if (chain.length == 0 || !(chain[0] instanceof X509Certificate leaf)) {
            return;
        }
        Instant notAfter = leaf.getNotAfter().toInstant();
        result.put("subject", leaf.getSubjectX500Principal().getName());
        result.put("issuer", leaf.getIssuerX500Principal().getName());
        result.put("not_before", leaf.getNotBefore().toInstant().toString());
        result.put("not_after", notAfter.toString());
        result.put("days_remaining", Duration.between(clock.instant(), notAfter).toDays());
        result.put("chain_length", chain.length);
    }
}
