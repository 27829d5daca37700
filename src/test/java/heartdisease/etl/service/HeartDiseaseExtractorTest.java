package heartdisease.etl.service;

import heartdisease.etl.config.EtlConfig;
import heartdisease.etl.exception.ExtractionException;
import heartdisease.etl.model.DataTable;
import heartdisease.etl.util.TestTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeartDiseaseExtractorTest {

    private static final String DATA_URL = "https://archive.ics.uci.edu/static/public/45/data.csv";
    private static final String METADATA = "{\"status\":200,\"data\":{\"uci_id\":45,\"name\":\"Heart Disease\","
            + "\"num_instances\":303,\"num_features\":13,\"data_url\":\"" + DATA_URL + "\"}}";

    private EtlConfig etlConfig;
    private final List<String> requestedUrls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        etlConfig = new EtlConfig();
    }

    private HeartDiseaseExtractor extractor(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requestedUrls.add(request.url().toString());
            return exchange.exchange(request);
        };
        return new HeartDiseaseExtractor(etlConfig, WebClient.builder().exchangeFunction(recording),
                new CsvParsingService(etlConfig));
    }

    private static Mono<ClientResponse> respond(HttpStatus status, MediaType type, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, type.toString())
                .body(body)
                .build());
    }

    @Test
    void testExtract_ResolvesDataUrlThenDownloadsCsv() {
        HeartDiseaseExtractor extractor = extractor(request -> request.url().toString().equals(DATA_URL)
                ? respond(HttpStatus.OK, MediaType.TEXT_PLAIN, TestTables.rawHeartDiseaseCsv())
                : respond(HttpStatus.OK, MediaType.APPLICATION_JSON, METADATA));

        DataTable raw = extractor.extract();

        assertThat(requestedUrls).containsExactly("https://archive.ics.uci.edu/api/dataset?id=45", DATA_URL);
        assertThat(raw.getRowCount()).isEqualTo(5);
        assertThat(raw.getColumnNames()).contains("age", "num");
    }

    @Test
    void testExtract_HttpErrorBecomesExtractionException() {
        HeartDiseaseExtractor extractor = extractor(request ->
                respond(HttpStatus.SERVICE_UNAVAILABLE, MediaType.TEXT_PLAIN, "down"));

        assertThatThrownBy(extractor::extract)
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("503");
    }

    @Test
    void testExtract_EmptyCsvBecomesExtractionException() {
        HeartDiseaseExtractor extractor = extractor(request -> request.url().toString().equals(DATA_URL)
                ? respond(HttpStatus.OK, MediaType.TEXT_PLAIN, "")
                : respond(HttpStatus.OK, MediaType.APPLICATION_JSON, METADATA));

        assertThatThrownBy(extractor::extract).isInstanceOf(ExtractionException.class);
    }

    @Test
    void testParseMetadata() {
        HeartDiseaseExtractor.DatasetMetadata metadata = HeartDiseaseExtractor.parseMetadata(METADATA);

        assertThat(metadata.getName()).isEqualTo("Heart Disease");
        assertThat(metadata.getNumInstances()).isEqualTo(303);
        assertThat(metadata.getNumFeatures()).isEqualTo(13);
        assertThat(metadata.getDataUrl()).isEqualTo(DATA_URL);
    }

    @Test
    void testParseMetadata_ErrorStatus() {
        String json = "{\"status\":404,\"message\":\"dataset not found\"}";

        assertThatThrownBy(() -> HeartDiseaseExtractor.parseMetadata(json))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("dataset not found");
    }

    @Test
    void testParseMetadata_MissingDataUrl() {
        String json = "{\"status\":200,\"data\":{\"name\":\"Heart Disease\"}}";

        assertThatThrownBy(() -> HeartDiseaseExtractor.parseMetadata(json))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("data_url");
    }

    @Test
    void testParseMetadata_InvalidJson() {
        assertThatThrownBy(() -> HeartDiseaseExtractor.parseMetadata("<html>"))
                .isInstanceOf(ExtractionException.class);
    }
}
