package io.bdrc.catalogsync.common.http;

import java.net.URI;
import java.net.URISyntaxException;

import io.bdrc.catalogsync.arguments.ArgNameConstants;

import com.beust.jcommander.Parameter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Stores the connection context for the OpenSearch cluster holding the catalog
 */
@Getter
@EqualsAndHashCode(exclude = {"requestTransformer"})
@ToString(exclude = {"requestTransformer"})
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final RequestTransformer requestTransformer;

    private ConnectionContext(IParams params) {
        if (params.getHost() == null || params.getHost().isBlank()) {
            throw new IllegalArgumentException("No host was found");
        }

        try {
            uri = new URI(toUrl(params));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format", e);
        }

        if ("http".equals(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equals(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("No host was found in " + uri);
        }

        if (params.getUsername() != null ^ params.getPassword() != null) {
            throw new IllegalArgumentException("Both username and password must be provided, or neither");
        }

        insecure = !params.isVerifyCerts();
        if (params.getUsername() != null) {
            requestTransformer = new BasicAuthTransformer(params.getUsername(), params.getPassword());
        } else {
            requestTransformer = new NoAuthTransformer();
        }
    }

    private static String toUrl(IParams params) {
        var host = params.getHost().trim();
        if (host.contains("://")) {
            return host;
        }
        return (params.isUseSsl() ? "https" : "http") + "://" + host + ":" + params.getPort();
    }

    public interface IParams {
        String getHost();

        int getPort();

        boolean isUseSsl();

        boolean isVerifyCerts();

        String getUsername();

        String getPassword();

        default ConnectionContext toConnectionContext() {
            return new ConnectionContext(this);
        }
    }

    @Getter
    public static class StoreArgs implements IParams {
        @Parameter(
            names = {"--opensearch-host", "--opensearchHost"},
            description = "The OpenSearch host name, or a full URL such as https://search.example.com:9200")
        public String host = "localhost";

        @Parameter(
            names = {"--opensearch-port", "--opensearchPort"},
            description = "The OpenSearch port; ignored when the host is a full URL")
        public int port = 9200;

        @Parameter(
            names = {"--opensearch-use-ssl", "--opensearchUseSsl"},
            description = "Connect over https",
            arity = 1)
        public boolean useSsl = false;

        @Parameter(
            names = {"--opensearch-verify-certs", "--opensearchVerifyCerts"},
            description = "Verify the cluster's TLS certificate",
            arity = 1)
        public boolean verifyCerts = true;

        @Parameter(
            names = {ArgNameConstants.STORE_USERNAME_ARG_KEBAB_CASE, ArgNameConstants.STORE_USERNAME_ARG_CAMEL_CASE},
            description = "Optional.  The OpenSearch username; if not provided, will assume no auth")
        public String username = null;

        @Parameter(
            names = {ArgNameConstants.STORE_PASSWORD_ARG_KEBAB_CASE, ArgNameConstants.STORE_PASSWORD_ARG_CAMEL_CASE},
            description = "Optional.  The OpenSearch password; if not provided, will assume no auth")
        public String password = null;
    }
}
