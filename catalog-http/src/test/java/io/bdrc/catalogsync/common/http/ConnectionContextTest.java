package io.bdrc.catalogsync.common.http;

import java.util.HashMap;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConnectionContextTest {

    @Test
    void defaults_pointAtLocalPlainHttp() {
        var ctx = new ConnectionContext.StoreArgs().toConnectionContext();

        assertThat(ctx.getProtocol(), equalTo(ConnectionContext.Protocol.HTTP));
        assertThat(ctx.getUri().toString(), equalTo("http://localhost:9200"));
        assertThat(ctx.isInsecure(), equalTo(false));
        assertThat(ctx.getRequestTransformer(), instanceOf(NoAuthTransformer.class));
    }

    @Test
    void useSsl_switchesToHttps() {
        var args = new ConnectionContext.StoreArgs();
        args.host = "search.example.com";
        args.port = 443;
        args.useSsl = true;
        args.verifyCerts = false;

        var ctx = args.toConnectionContext();

        assertThat(ctx.getProtocol(), equalTo(ConnectionContext.Protocol.HTTPS));
        assertThat(ctx.getUri().getHost(), equalTo("search.example.com"));
        assertThat(ctx.isInsecure(), equalTo(true));
    }

    @Test
    void fullUrl_overridesPortAndSslFlags() {
        var args = new ConnectionContext.StoreArgs();
        args.host = "https://search.example.com:9243";
        args.port = 1;

        var ctx = args.toConnectionContext();

        assertThat(ctx.getProtocol(), equalTo(ConnectionContext.Protocol.HTTPS));
        assertThat(ctx.getUri().getPort(), equalTo(9243));
    }

    @Test
    void invalidScheme_throws() {
        var args = new ConnectionContext.StoreArgs();
        args.host = "ftp://localhost";
        assertThrows(IllegalArgumentException.class, args::toConnectionContext);
    }

    @Test
    void blankHost_throws() {
        var args = new ConnectionContext.StoreArgs();
        args.host = " ";
        assertThrows(IllegalArgumentException.class, args::toConnectionContext);
    }

    @Test
    void usernameWithoutPassword_throws() {
        var args = new ConnectionContext.StoreArgs();
        args.username = "admin";
        assertThrows(IllegalArgumentException.class, args::toConnectionContext);
    }

    @Test
    void basicAuth_addsAuthorizationHeader() {
        var args = new ConnectionContext.StoreArgs();
        args.username = "admin";
        args.password = "admin";

        var headers = args.toConnectionContext().getRequestTransformer()
            .transformHeaders("GET", "bec/_doc/W1", new HashMap<>());

        // base64("admin:admin")
        assertThat(headers.get("authorization"), equalTo(List.of("Basic YWRtaW46YWRtaW4=")));
    }
}
