package heartdisease.etl.service;

import heartdisease.etl.config.EtlConfig;
import heartdisease.etl.schema.HeartDiseaseSchema;
import heartdisease.etl.schema.TargetPolicy;
import heartdisease.etl.transformer.ColumnNormalizer;
import heartdisease.etl.transformer.DateStandardizer;
import heartdisease.etl.transformer.Deduplicator;
import heartdisease.etl.transformer.DomainValidator;
import heartdisease.etl.transformer.LineageAnnotator;
import heartdisease.etl.transformer.MissingValueResolver;
import heartdisease.etl.transformer.TransformationPipeline;
import heartdisease.etl.transformer.TypeCoercer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory service for creating and caching transformation pipelines.
 *
 * This service:
 * - Builds the fixed step order from configuration
 * - Caches one pipeline per target policy (steps are stateless)
 * - Resolves the schema for the configured target policy
 */
@Service
@Slf4j
public class TransformationPipelineFactory {

    private final EtlConfig etlConfig;
    private final Clock clock;

    private final Map<TargetPolicy, TransformationPipeline> pipelineCache = new ConcurrentHashMap<>();

    public TransformationPipelineFactory(EtlConfig etlConfig, Clock clock) {
        this.etlConfig = etlConfig;
        this.clock = clock;
    }

    /**
     * Pipeline for the configured target policy.
     */
    public TransformationPipeline getPipeline() {
        return getPipeline(etlConfig.getTransform().getTargetPolicy());
    }

    /**
     * Pipeline for the given target policy.
     *
     * Step order:
     * 1. column normalizer
     * 2. type coercer
     * 3. missing-value resolver
     * 4. date standardizer (only when enabled)
     * 5. domain validator
     * 6. deduplicator
     * 7. lineage annotator
     *
     * @param policy target column policy (never null)
     * @return cached pipeline instance
     */
    public TransformationPipeline getPipeline(TargetPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Target policy must not be null");
        }
        return pipelineCache.computeIfAbsent(policy, this::createPipeline);
    }

    public HeartDiseaseSchema getSchema() {
        return HeartDiseaseSchema.forPolicy(etlConfig.getTransform().getTargetPolicy());
    }

    private TransformationPipeline createPipeline(TargetPolicy policy) {
        EtlConfig.Transform transform = etlConfig.getTransform();
        HeartDiseaseSchema schema = HeartDiseaseSchema.forPolicy(policy);

        TransformationPipeline pipeline = new TransformationPipeline(List.of(
                new ColumnNormalizer(),
                new TypeCoercer(schema),
                new MissingValueResolver(schema, transform.getMissingRatioThreshold()),
                new DateStandardizer(transform.isStandardizeDates()),
                new DomainValidator(schema),
                new Deduplicator(),
                new LineageAnnotator(transform.getSourceTag(), clock)));

        log.info("Created transformation pipeline for target policy {}: {}", policy, pipeline.getStepNames());
        return pipeline;
    }

    /**
     * Clear the pipeline cache.
     * Needed after the transform settings change at runtime.
     */
    public void clearCache() {
        log.info("Clearing pipeline cache ({} entries)", pipelineCache.size());
        pipelineCache.clear();
    }
}
