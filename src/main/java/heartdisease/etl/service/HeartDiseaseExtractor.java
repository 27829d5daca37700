package heartdisease.etl.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import heartdisease.etl.config.EtlConfig;
import heartdisease.etl.exception.ExtractionException;
import heartdisease.etl.model.DataTable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;

/**
 * Extracts the Heart Disease dataset from the UCI ML Repository.
 *
 * Two HTTP calls:
 * 1. GET {api-url}?id={dataset-id} returns dataset metadata including the CSV location (data.data_url)
 * 2. GET data_url returns the CSV with features and the diagnosis column
 *
 * The CSV is returned as a raw table of strings; no cleaning happens here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeartDiseaseExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EtlConfig etlConfig;
    private final WebClient.Builder webClientBuilder;
    private final CsvParsingService csvParsingService;

    /**
     * Fetch and parse the dataset.
     *
     * @return raw table
     * @throws ExtractionException if either call fails or the payload is unusable
     */
    public DataTable extract() {
        int datasetId = etlConfig.getExtract().getDatasetId();
        log.info("Extracting data from UCI ML Repository with dataset ID {}", datasetId);

        DatasetMetadata metadata = parseMetadata(fetch(etlConfig.getExtract().getApiUrl() + "?id=" + datasetId));
        log.info("Dataset name: {}", metadata.getName());
        log.info("Number of instances: {}", metadata.getNumInstances());
        log.info("Number of features: {}", metadata.getNumFeatures());

        DataTable raw = csvParsingService.readTable(fetch(metadata.getDataUrl()));

        log.info("Successfully extracted {} records with {} columns", raw.getRowCount(), raw.getColumnCount());
        log.info("Columns: {}", String.join(", ", raw.getColumnNames()));
        logDatasetStats(raw);
        return raw;
    }

    private String fetch(String url) {
        try {
            String body = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(etlConfig.getExtract().getTimeout());
            if (body == null) {
                throw new ExtractionException("Empty response from " + url);
            }
            return body;
        } catch (WebClientResponseException e) {
            log.error("UCI request failed: {} {}", e.getStatusCode(), url);
            throw new ExtractionException("Request to " + url + " failed with status " + e.getStatusCode(), e);
        } catch (ExtractionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error fetching {}: {}", url, e.getMessage(), e);
            throw new ExtractionException("Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Read dataset metadata from the repository API response.
     *
     * @throws ExtractionException if the response reports an error or lacks the data URL
     */
    static DatasetMetadata parseMetadata(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            throw new ExtractionException("Dataset metadata is not valid JSON", e);
        }

        int status = root.path("status").asInt(200);
        if (status != 200) {
            throw new ExtractionException("Dataset metadata request returned status " + status + ": "
                    + root.path("message").asText("no message"));
        }

        JsonNode data = root.path("data");
        String dataUrl = data.path("data_url").asText(null);
        if (dataUrl == null || dataUrl.isBlank()) {
            throw new ExtractionException("Dataset metadata has no data_url; the dataset is not importable");
        }
        return new DatasetMetadata(
                data.path("name").asText("unknown"),
                data.path("num_instances").asLong(0),
                data.path("num_features").asLong(0),
                dataUrl);
    }

    private void logDatasetStats(DataTable raw) {
        long totalMissing = raw.countMissing();
        if (totalMissing > 0) {
            log.info("Found {} missing values in the dataset", totalMissing);
            for (String column : raw.getColumnNames()) {
                long missing = raw.countMissing(column);
                if (missing > 0) {
                    log.info("Column '{}' has {} missing values", column, missing);
                }
            }
        } else {
            log.info("No missing values found in the dataset");
        }

        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Basic statistics for numeric columns:");
        for (String column : raw.getColumnNames()) {
            List<Object> values = raw.getColumn(column);
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0;
            int count = 0;
            boolean numeric = true;
            for (Object value : values) {
                if (value == null) {
                    continue;
                }
                try {
                    double d = Double.parseDouble(value.toString());
                    min = Math.min(min, d);
                    max = Math.max(max, d);
                    sum += d;
                    count++;
                } catch (NumberFormatException e) {
                    numeric = false;
                    break;
                }
            }
            if (numeric && count > 0) {
                log.debug("  {}: min={} max={} mean={}", column, min, max, sum / count);
            }
        }
    }

    /**
     * Parts of the repository metadata the pipeline uses.
     */
    @Getter
    @AllArgsConstructor
    static class DatasetMetadata {
        private final String name;
        private final long numInstances;
        private final long numFeatures;
        private final String dataUrl;
    }
}
