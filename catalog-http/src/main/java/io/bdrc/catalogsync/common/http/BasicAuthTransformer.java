package io.bdrc.catalogsync.common.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.netty.handler.codec.http.HttpHeaderNames;

public class BasicAuthTransformer implements RequestTransformer {
    private final String authorizationValue;

    public BasicAuthTransformer(String username, String password) {
        var credentials = username + ":" + password;
        this.authorizationValue = "Basic " + Base64.getEncoder()
            .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Map<String, List<String>> transformHeaders(String method, String path, Map<String, List<String>> headers) {
        var newHeaders = new HashMap<>(headers);
        newHeaders.put(HttpHeaderNames.AUTHORIZATION.toString(), List.of(authorizationValue));
        return newHeaders;
    }
}
