package io.bdrc.catalogsync.scores;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.riot.system.StreamRDFBase;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Fetches the gzipped Turtle score dump, keeps an uncompressed copy on disk and reads
 * {@code bdr:{id} tmp:entityScore value} triples from it.
 */
@Slf4j
public class EntityScoreLoader {
    public static final String DEFAULT_SCORES_URL = "https://eroux.fr/entityScores.ttl.gz";
    public static final Path DEFAULT_CACHE_FILE = Path.of(".cache", "entityScores.ttl");

    static final String BDR = "http://purl.bdrc.io/resource/";
    static final String TMP = "http://purl.bdrc.io/ontology/tmp/";
    private static final Node ENTITY_SCORE = NodeFactory.createURI(TMP + "entityScore");
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(10);

    @Getter
    private final String scoresUrl;
    @Getter
    private final Path cacheFile;
    private final HttpClient httpClient;

    public EntityScoreLoader() {
        this(DEFAULT_SCORES_URL, DEFAULT_CACHE_FILE);
    }

    public EntityScoreLoader(String scoresUrl, Path cacheFile) {
        this(scoresUrl, cacheFile, HttpClient.create());
    }

    EntityScoreLoader(String scoresUrl, Path cacheFile, HttpClient httpClient) {
        this.scoresUrl = scoresUrl;
        this.cacheFile = cacheFile;
        this.httpClient = httpClient.followRedirect(true);
    }

    /**
     * @param refresh download again even if a cached copy exists
     */
    public EntityScores load(boolean refresh) {
        if (refresh || !Files.exists(cacheFile)) {
            download();
        } else {
            log.atInfo().setMessage("Using cached entity scores from {}").addArgument(cacheFile).log();
        }
        var scores = parse(cacheFile);
        log.atInfo().setMessage("Loaded {} entity scores").addArgument(scores::size).log();
        return scores;
    }

    void download() {
        log.atInfo().setMessage("Downloading entity scores from {}").addArgument(scoresUrl).log();
        byte[] compressed;
        try {
            compressed = httpClient.get()
                .uri(scoresUrl)
                .responseSingle((response, body) -> response.status().code() == 200
                    ? body.asByteArray()
                    : Mono.error(new ScoreLoadException("Score download from " + scoresUrl + " returned "
                        + response.status())))
                .block(DOWNLOAD_TIMEOUT);
        } catch (ScoreLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScoreLoadException("Score download from " + scoresUrl + " failed", e);
        }
        if (compressed == null) {
            throw new ScoreLoadException("Score download from " + scoresUrl + " returned no content");
        }

        try {
            var parent = cacheFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            var tmp = Files.createTempFile(parent, cacheFile.getFileName().toString(), ".part");
            try (var in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
                Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ScoreLoadException("Could not unpack entity scores into " + cacheFile, e);
        }
    }

    static EntityScores parse(Path turtleFile) {
        var collector = new ScoreCollector();
        try {
            RDFParser.create().source(turtleFile).lang(Lang.TURTLE).parse(collector);
        } catch (RiotException e) {
            throw new ScoreLoadException("Could not parse entity scores in " + turtleFile, e);
        }
        return new EntityScores(collector.scores);
    }

    private static class ScoreCollector extends StreamRDFBase {
        private final Map<String, Double> scores = new HashMap<>();

        @Override
        public void triple(Triple triple) {
            if (!ENTITY_SCORE.equals(triple.getPredicate()) || !triple.getSubject().isURI()) {
                return;
            }
            var subject = triple.getSubject().getURI();
            if (!subject.startsWith(BDR) || !triple.getObject().isLiteral()) {
                return;
            }
            var id = subject.substring(BDR.length());
            var value = triple.getObject().getLiteralLexicalForm();
            try {
                scores.put(id, Double.parseDouble(value));
            } catch (NumberFormatException e) {
                log.atWarn().setMessage("Ignoring non-numeric score '{}' for {}").addArgument(value).addArgument(id).log();
            }
        }
    }
}
