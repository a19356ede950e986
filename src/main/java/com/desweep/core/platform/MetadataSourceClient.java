package com.desweep.core.platform;

import com.desweep.core.model.MetadataCollection;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the platform's automation metadata.
 */
public interface MetadataSourceClient {

    /**
     * Confirms credentials and connectivity.
     *
     * @throws PlatformConnectionException when the platform cannot be reached
     */
    void verifyConnection();

    /**
     * Lists every record of one collection.
     *
     * @throws SourceUnavailableException when the collection cannot be fetched
     */
    List<JsonNode> list(MetadataCollection collection);

    /**
     * Full definition of one workflow, including steps, status and last run time.
     */
    JsonNode getWorkflowDetail(String workflowId);

    /**
     * SQL text of one query definition, when the platform returns any.
     */
    Optional<String> getQueryText(String queryId);
}
