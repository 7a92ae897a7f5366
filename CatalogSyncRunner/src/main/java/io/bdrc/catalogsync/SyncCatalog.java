package io.bdrc.catalogsync;

import io.bdrc.catalogsync.arguments.ArgLogUtils;
import io.bdrc.catalogsync.arguments.ArgNameConstants;
import io.bdrc.catalogsync.common.http.ConnectionContext;
import io.bdrc.catalogsync.jcommander.EnvVarParameterPuller;
import io.bdrc.catalogsync.mirror.GitSourceMirror;
import io.bdrc.catalogsync.scores.EntityScoreLoader;
import io.bdrc.catalogsync.sync.SyncController;
import io.bdrc.catalogsync.sync.SyncOptions;
import io.bdrc.catalogsync.trigger.SyncTriggerServer;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;

@Slf4j
public class SyncCatalog {
    public static final int FAILURE_EXIT_CODE = 1;

    public static class Args {
        @Parameter(
            names = {"--help", "-h"},
            help = true,
            description = "Displays information about how to use this tool")
        public boolean help;

        @Parameter(
            names = {"--force"},
            description = "Ignore the stored watermark and import every record file")
        public boolean force = false;

        @Parameter(
            names = {"--type"},
            description = "Record type to sync: work, person or all")
        public String type = CatalogSyncJob.ALL_TYPES;

        @Parameter(
            names = {"--data-dir", "--bdrc-data-dir"},
            description = "Directory holding the local clones of the source repositories")
        public String dataDir = "./bdrc_data";

        @Parameter(
            names = {"--git-base-url"},
            description = "Base URL of the source repositories; each is cloned from {base}/{name}.git")
        public String remoteBaseUrl = GitSourceMirror.DEFAULT_REMOTE_BASE_URL;

        @Parameter(
            names = {"--limit"},
            description = "Optional.  Process at most this many record files per type")
        public Integer limit;

        @Parameter(
            names = {"--dry-run"},
            description = "Parse and log records without writing anything")
        public boolean dryRun = false;

        @Parameter(
            names = {"--batch-size"},
            description = "Number of record files parsed and upserted per bulk request")
        public int batchSize = SyncController.DEFAULT_BATCH_SIZE;

        @Parameter(
            names = {"--refresh-scores"},
            description = "Download the entity scores even if a cached copy exists")
        public boolean refreshScores = false;

        @Parameter(
            names = {"--scores-url"},
            description = "Location of the gzipped Turtle entity scores")
        public String scoresUrl = EntityScoreLoader.DEFAULT_SCORES_URL;

        @Parameter(
            names = {"--scores-cache"},
            description = "Where the uncompressed entity scores are cached")
        public String scoresCache = EntityScoreLoader.DEFAULT_CACHE_FILE.toString();

        @Parameter(
            names = {"--opensearch-index"},
            description = "Index holding catalog records, watermarks and run locks")
        public String indexName = "bec";

        @Parameter(
            names = {"--opensearch-audit-index"},
            description = "Index receiving audit events")
        public String auditIndexName = "bec_changes";

        @Parameter(
            names = {"--serve"},
            description = "Start the sync trigger endpoint instead of running once")
        public boolean serve = false;

        @Parameter(
            names = {"--port", "--api-port"},
            description = "Port of the sync trigger endpoint")
        public int port = 8000;

        @ParametersDelegate
        public ConnectionContext.StoreArgs storeArgs = new ConnectionContext.StoreArgs();
    }

    public static Args parseArgs(String[] args, EnvVarParameterPuller.EnvVarGetter env) {
        var arguments = EnvVarParameterPuller.injectFromEnv(new Args(), env, "");
        JCommander.newBuilder().addObject(arguments).build().parse(args);
        validateArgs(arguments);
        return arguments;
    }

    static void validateArgs(Args arguments) {
        try {
            CatalogSyncJob.typesFor(arguments.type);
        } catch (IllegalArgumentException e) {
            throw new ParameterException("--type must be one of work, person or all, not " + arguments.type);
        }
        if (arguments.limit != null && arguments.limit <= 0) {
            throw new ParameterException("--limit must be positive");
        }
        if (arguments.batchSize <= 0) {
            throw new ParameterException("--batch-size must be positive");
        }
    }

    public static void main(String[] args) throws Exception {
        System.err.println("Starting program with: "
            + String.join(" ", ArgLogUtils.getRedactedArgs(args, ArgNameConstants.CENSORED_STORE_ARGS)));
        // log4j2's own shutdown hook would stop logging before the trigger server's hook has run
        System.setProperty("log4j2.shutdownHookEnabled", "false");

        var arguments = EnvVarParameterPuller.injectFromEnv(new Args(), System::getenv, "");
        var jCommander = JCommander.newBuilder().addObject(arguments).build();
        jCommander.parse(args);
        if (arguments.help) {
            jCommander.usage();
            return;
        }
        validateArgs(arguments);

        int exitCode = 0;
        try {
            var job = CatalogSyncJob.fromArgs(arguments);
            if (arguments.serve) {
                serve(job, arguments.port);
            } else {
                var options = SyncOptions.builder()
                    .force(arguments.force)
                    .limit(arguments.limit)
                    .dryRun(arguments.dryRun)
                    .build();
                job.run(CatalogSyncJob.typesFor(arguments.type), options);
            }
        } catch (Exception e) {
            log.atError().setCause(e).setMessage("Catalog sync failed").log();
            exitCode = FAILURE_EXIT_CODE;
        } finally {
            LogManager.shutdown();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    private static void serve(CatalogSyncJob job, int port) throws InterruptedException {
        var server = new SyncTriggerServer(port, job::run);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.atInfo().setMessage("Stopping sync trigger server").log();
            server.close();
            LogManager.shutdown();
        }, "trigger-shutdown"));
        server.start();
        server.awaitTermination();
    }
}
