package io.bdrc.catalogsync.testutils;

import java.time.Duration;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.utility.DockerImageName;

/**
 * Single-node OpenSearch cluster with security disabled, for tests that need the real painless runtime.
 */
@Slf4j
public class SearchClusterContainer extends GenericContainer<SearchClusterContainer> {
    public static final String OPENSEARCH_IMAGE = "opensearchproject/opensearch:2.15.0";

    private static final Map<String, String> OPENSEARCH_ENV = Map.of(
        "discovery.type", "single-node",
        "plugins.security.disabled", "true",
        "OPENSEARCH_INITIAL_ADMIN_PASSWORD", "SecurityIsDisabled123$%^",
        "ES_JAVA_OPTS", "-Xms512m -Xmx512m",
        "cluster.routing.allocation.disk.watermark.low", "100%",
        "cluster.routing.allocation.disk.watermark.high", "100%",
        "cluster.routing.allocation.disk.watermark.flood_stage", "100%"
    );

    private final String imageName;

    public SearchClusterContainer() {
        this(OPENSEARCH_IMAGE);
    }

    @SuppressWarnings("resource")
    public SearchClusterContainer(String imageName) {
        super(DockerImageName.parse(imageName));
        this.imageName = imageName;
        this.withExposedPorts(9200, 9300)
            .withEnv(OPENSEARCH_ENV)
            .waitingFor(Wait.forHttp("/").forPort(9200).forStatusCode(200).withStartupTimeout(Duration.ofMinutes(2)));
    }

    @Override
    public void start() {
        log.info("Starting container " + imageName);
        super.start();
    }

    public String getUrl() {
        final var address = this.getHost();
        final var port = this.getMappedPort(9200);
        return "http://" + address + ":" + port;
    }

    @Override
    public void close() {
        log.info("Stopping container " + imageName);
        log.debug("Instance logs:\n" + this.getLogs());
        this.stop();
    }
}
