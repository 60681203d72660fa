package com.bsl.dimrank.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for a remote vector index exposing {@code /v1/embed} and {@code /v1/candidates}.
 * Connect and read timeouts come from {@code similarity-index.timeout-ms}.
 */
@Component
public class SimilarityIndexGateway implements SimilarityIndexClient {
    private final RestTemplate restTemplate;
    private final SimilarityIndexProperties properties;

    public SimilarityIndexGateway(
        @Qualifier("similarityIndexRestTemplate") RestTemplate restTemplate,
        SimilarityIndexProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public List<Double> embed(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            throw new CandidateFetchException("embed_empty_text");
        }
        EmbedRequest request = new EmbedRequest();
        request.setTexts(List.of(queryText));
        EmbedResponse body = post("/v1/embed", request, EmbedResponse.class, "embed");
        if (body == null || body.getVectors() == null || body.getVectors().isEmpty()) {
            throw new CandidateFetchException("embed_empty_response");
        }
        List<Double> vector = body.getVectors().get(0);
        if (vector == null || vector.isEmpty()) {
            throw new CandidateFetchException("embed_empty_vector");
        }
        return vector;
    }

    @Override
    public List<CandidateHit> fetchCandidates(List<Double> queryEmbedding, int count) {
        if (count <= 0) {
            return List.of();
        }
        CandidatesRequest request = new CandidatesRequest();
        request.setEmbedding(queryEmbedding);
        request.setCount(count);
        request.setCollection(properties.getCollection());
        CandidatesResponse body = post("/v1/candidates", request, CandidatesResponse.class, "fetch");
        if (body == null || body.getHits() == null) {
            throw new CandidateFetchException("fetch_empty_response");
        }
        List<CandidateHit> hits = new ArrayList<>(body.getHits().size());
        for (CandidatesResponse.Hit hit : body.getHits()) {
            if (hit == null || hit.getChunkId() == null || hit.getChunkId().isBlank()) {
                continue;
            }
            hits.add(new CandidateHit(hit.getChunkId(), hit.getSimilarity() == null ? 0.0 : hit.getSimilarity()));
        }
        return hits.size() <= count ? hits : new ArrayList<>(hits.subList(0, count));
    }

    private <T> T post(String path, Object payload, Class<T> responseType, String operation) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new CandidateFetchException(operation + "_base_url_missing");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Object> entity = new HttpEntity<>(payload, headers);
        try {
            ResponseEntity<T> response = restTemplate.exchange(buildUrl(path), HttpMethod.POST, entity, responseType);
            return response.getBody();
        } catch (ResourceAccessException e) {
            String reason = operation + "_unavailable";
            if (e.getCause() instanceof SocketTimeoutException) {
                reason = operation + "_timeout";
            }
            throw new CandidateFetchException(reason, e);
        } catch (HttpStatusCodeException e) {
            throw new CandidateFetchException(operation + "_http_" + e.getStatusCode().value(), e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbedRequest {
        private List<String> texts;

        public List<String> getTexts() {
            return texts;
        }

        public void setTexts(List<String> texts) {
            this.texts = texts;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbedResponse {
        private List<List<Double>> vectors;

        public List<List<Double>> getVectors() {
            return vectors;
        }

        public void setVectors(List<List<Double>> vectors) {
            this.vectors = vectors;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CandidatesRequest {
        private List<Double> embedding;
        private int count;
        private String collection;

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CandidatesResponse {
        private List<Hit> hits;

        public List<Hit> getHits() {
            return hits;
        }

        public void setHits(List<Hit> hits) {
            this.hits = hits;
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Hit {
            @JsonProperty("chunk_id")
            private String chunkId;

            private Double similarity;

            public String getChunkId() {
                return chunkId;
            }

            public void setChunkId(String chunkId) {
                this.chunkId = chunkId;
            }

            public Double getSimilarity() {
                return similarity;
            }

            public void setSimilarity(Double similarity) {
                this.similarity = similarity;
            }
        }
    }
}
