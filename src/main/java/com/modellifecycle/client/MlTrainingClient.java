package com.modellifecycle.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modellifecycle.entity.ModelType;
import com.modellifecycle.exception.MlApiException;
import com.modellifecycle.exception.MlApiUnavailableException;
import com.modellifecycle.exception.TrainingFailedException;
import com.modellifecycle.storage.ArtifactStore;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Client for the remote ML service that fits and scores models. Trained artifacts come
 * back base64-encoded and are copied into the {@link ArtifactStore}; evaluation ships the
 * stored bytes back to the service together with the test set reference.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MlTrainingClient implements Trainer, Evaluator {

    private final ArtifactStore artifactStore;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${ml.api.base-url}")
    private String baseUrl;

    @Value("${ml.api.timeout-seconds:600}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(c -> c.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("MlTrainingClient initialised → {}", baseUrl);
    }

    @Override
    public TrainingResult train(String datasetReference) {
        try {
            return trainAsync(datasetReference)
                .blockOptional()
                .orElseThrow(() -> new MlApiException("ML API returned an empty training response"));
        } catch (TrainingFailedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TrainingFailedException("Training failed for dataset " + datasetReference + ": " + ex.getMessage(), ex);
        }
    }

    public Mono<TrainingResult> trainAsync(String datasetReference) {
        ObjectNode body = mapper.createObjectNode();
        body.put("dataset_reference", datasetReference);
        return webClient.post().uri("/train")
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiException("ML API rejected training request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toTrainingResult)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new MlApiUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, MlApiUnavailableException::new);
    }

    @Override
    public Map<String, Double> evaluate(String artifactLocation, String testSetReference) {
        return evaluateAsync(artifactLocation, testSetReference)
            .blockOptional()
            .orElseThrow(() -> new MlApiException("ML API returned an empty evaluation response"));
    }

    public Mono<Map<String, Double>> evaluateAsync(String artifactLocation, String testSetReference) {
        byte[] artifact = artifactStore.get(artifactLocation);
        ObjectNode body = mapper.createObjectNode();
        body.put("artifact_base64", Base64.getEncoder().encodeToString(artifact));
        body.put("test_set_reference", testSetReference);
        return webClient.post().uri("/evaluate")
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiException("ML API rejected evaluation request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new MlApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(json -> readMetrics(json, "evaluation"))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new MlApiUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, MlApiUnavailableException::new);
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> json.hasNonNull("status") && "ok".equals(json.get("status").asText()))
            .onErrorReturn(false);
    }

    private TrainingResult toTrainingResult(JsonNode json) {
        if (json == null || !json.hasNonNull("artifact_base64")) {
            throw new MlApiException("ML API training response missing 'artifact_base64': " + json);
        }
        byte[] artifact;
        try {
            artifact = Base64.getDecoder().decode(json.get("artifact_base64").asText());
        } catch (IllegalArgumentException ex) {
            throw new MlApiException("ML API returned a malformed artifact payload", ex);
        }
        String location = artifactStore.put(artifact);
        ModelType type = readModelType(json);
        Map<String, Double> metrics = json.has("metrics") ? readMetrics(json, "training") : Map.of();
        log.info("Training artifact received | location={} | type={} | bytes={}", location, type, artifact.length);
        return new TrainingResult(location, type, metrics);
    }

    private ModelType readModelType(JsonNode json) {
        JsonNode node = json.get("model_type");
        if (node == null || node.isNull()) {
            return ModelType.ENSEMBLE;
        }
        String raw = node.asText().trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ModelType.valueOf(raw);
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown model type from ML API | modelType={} | falling back to ENSEMBLE", raw);
            return ModelType.ENSEMBLE;
        }
    }

    private Map<String, Double> readMetrics(JsonNode json, String context) {
        JsonNode metrics = json == null ? null : json.get("metrics");
        if (metrics == null || !metrics.isObject()) {
            throw new MlApiException("ML API " + context + " response missing 'metrics': " + json);
        }
        Map<String, Double> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = metrics.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                out.put(field.getKey(), field.getValue().asDouble());
            }
        }
        return out;
    }
}
