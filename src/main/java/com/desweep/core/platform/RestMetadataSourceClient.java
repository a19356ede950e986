package com.desweep.core.platform;

import com.desweep.core.model.MetadataCollection;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MetadataSourceClient} backed by the platform REST endpoints.
 */
public class RestMetadataSourceClient implements MetadataSourceClient {

    private static final Logger log = LoggerFactory.getLogger(RestMetadataSourceClient.class);

    private final PlatformApiClient api;
    private final PlatformProperties properties;

    public RestMetadataSourceClient(PlatformApiClient api, PlatformProperties properties) {
        this.api = api;
        this.properties = properties;
    }

    @Override
    public void verifyConnection() {
        api.verifyConnectivity();
    }

    @Override
    public List<JsonNode> list(MetadataCollection collection) {
        try {
            var items = switch (collection) {
                case WORKFLOWS -> api.getAllPages("/automation/v1/automations", "items", properties.getPageSize());
                case FILTERS -> api.getAllPages("/automation/v1/filters", "items", properties.getPageSize());
                case QUERIES -> api.getAllPages("/automation/v1/queries", "items", properties.getPageSize());
                case IMPORTS -> api.getAllPages("/automation/v1/imports", "items", properties.getPageSize());
                case TRIGGERED_MESSAGES ->
                        api.getAllPages("/messaging/v1/email/definitions", "definitions", properties.getPageSize());
                case JOURNEYS ->
                        api.getAllPages("/interaction/v1/interactions", "items", properties.getJourneyPageSize());
                case DATA_EXTRACTS -> api.getAllPages("/automation/v1/dataextracts", "items", properties.getPageSize());
            };
            log.debug("Listed {} {}", items.size(), collection.stage());
            return items;
        } catch (PlatformConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(collection, e);
        }
    }

    @Override
    public JsonNode getWorkflowDetail(String workflowId) {
        return api.get("/automation/v1/automations/" + encode(workflowId), Map.of());
    }

    @Override
    public Optional<String> getQueryText(String queryId) {
        JsonNode detail = api.get("/automation/v1/queries/" + encode(queryId), Map.of());
        String text = detail.path("queryText").asText(null);
        return text == null || text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
