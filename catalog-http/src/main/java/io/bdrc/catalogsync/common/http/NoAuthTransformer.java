package io.bdrc.catalogsync.common.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class NoAuthTransformer implements RequestTransformer {
    @Override
    public Map<String, List<String>> transformHeaders(String method, String path, Map<String, List<String>> headers) {
        return new HashMap<>(headers);
    }
}
