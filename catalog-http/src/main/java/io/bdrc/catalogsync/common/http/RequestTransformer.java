package io.bdrc.catalogsync.common.http;

import java.util.List;
import java.util.Map;

/**
 * Decorates the headers of every outgoing store request, typically with credentials.
 */
public interface RequestTransformer {
    Map<String, List<String>> transformHeaders(String method, String path, Map<String, List<String>> headers);
}
