package livyrunner;

import com.fasterxml.jackson.databind.ObjectMapper;
import livyrunner.batch.config.Dependencies;
import livyrunner.batch.config.RunnerConfig;
import livyrunner.batch.config.RunnerConfigLoader;
import livyrunner.batch.error.LifecycleException;
import livyrunner.batch.model.JobSubmission;
import livyrunner.batch.model.VerificationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Command-line entry point: runs one Livy batch lifecycle.
 *
 * <pre>
 * java livyrunner.App runner.ini submission.json [none|spark|yarn]
 * </pre>
 *
 * Exit code 0 on success, 1 when the batch failed, 2 on bad usage or configuration.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2 || args.length > 3) {
            System.err.println("Usage: App <config.ini> <submission.json> [none|spark|yarn]");
            return EXIT_USAGE;
        }

        RunnerConfig config;
        JobSubmission submission;
        try {
            config = RunnerConfigLoader.load(new File(args[0]));
            if (args.length == 3) {
                config.withVerificationBackend(VerificationBackend.parse(args[2]));
            }
            submission = MAPPER.readValue(new File(args[1]), JobSubmission.class);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        Dependencies deps = Dependencies.create(config);
        try {
            String batchId = deps.orchestrator().run(submission);
            log.info("Batch {} completed", batchId);
            return EXIT_OK;
        } catch (LifecycleException e) {
            log.error("Batch run failed", e);
            return EXIT_FAILED;
        }
    }
}
