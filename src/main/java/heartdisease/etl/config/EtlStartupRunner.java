package heartdisease.etl.config;

import heartdisease.etl.model.EtlRun;
import heartdisease.etl.service.EtlPipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Batch mode: with etl.run-on-startup=true the application runs the pipeline once
 * when it is ready and exits with 0 on success, 1 on failure.
 */
@Component
public class EtlStartupRunner {

    private static final Logger logger = LoggerFactory.getLogger(EtlStartupRunner.class);

    private final EtlConfig etlConfig;
    private final EtlPipelineService pipelineService;
    private final ApplicationContext applicationContext;

    public EtlStartupRunner(EtlConfig etlConfig, EtlPipelineService pipelineService,
                            ApplicationContext applicationContext) {
        this.etlConfig = etlConfig;
        this.pipelineService = pipelineService;
        this.applicationContext = applicationContext;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!etlConfig.isRunOnStartup()) {
            logger.info("etl.run-on-startup is false, waiting for runs via the API");
            return;
        }

        int exitCode;
        try {
            EtlRun run = pipelineService.runPipeline();
            exitCode = run.isCompleted() ? 0 : 1;
        } catch (RuntimeException e) {
            logger.error("ETL pipeline could not be started: {}", e.getMessage(), e);
            exitCode = 1;
        }
        logger.info("Exiting with status {}", exitCode);
        exit(exitCode);
    }

    protected void exit(int exitCode) {
        System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
    }
}
