package io.bdrc.catalogsync.arguments;

import java.util.List;

public class ArgNameConstants {

    private ArgNameConstants() {
        throw new IllegalStateException("Constant class should not be instantiated");
    }

    public static final String STORE_USERNAME_ARG_KEBAB_CASE = "--opensearch-user";
    public static final String STORE_USERNAME_ARG_CAMEL_CASE = "--opensearchUser";
    public static final String STORE_PASSWORD_ARG_KEBAB_CASE = "--opensearch-password";
    public static final String STORE_PASSWORD_ARG_CAMEL_CASE = "--opensearchPassword";

    public static final List<String> CENSORED_STORE_ARGS =
        List.of(STORE_PASSWORD_ARG_KEBAB_CASE, STORE_PASSWORD_ARG_CAMEL_CASE);
}
