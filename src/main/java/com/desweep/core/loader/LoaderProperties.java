package com.desweep.core.loader;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "desweep.loader")
public class LoaderProperties {

    private int workflowDetailBatchSize = 10;
    private int queryTextBatchSize = 500;
    private int queryTextConcurrency = 10;
    private boolean includeWorkflowDetail = true;
    private boolean includeQueryText = true;

    public int getWorkflowDetailBatchSize() { return workflowDetailBatchSize; }
    public void setWorkflowDetailBatchSize(int workflowDetailBatchSize) { this.workflowDetailBatchSize = workflowDetailBatchSize; }
    public int getQueryTextBatchSize() { return queryTextBatchSize; }
    public void setQueryTextBatchSize(int queryTextBatchSize) { this.queryTextBatchSize = queryTextBatchSize; }
    public int getQueryTextConcurrency() { return queryTextConcurrency; }
    public void setQueryTextConcurrency(int queryTextConcurrency) { this.queryTextConcurrency = queryTextConcurrency; }
    public boolean isIncludeWorkflowDetail() { return includeWorkflowDetail; }
    public void setIncludeWorkflowDetail(boolean includeWorkflowDetail) { this.includeWorkflowDetail = includeWorkflowDetail; }
    public boolean isIncludeQueryText() { return includeQueryText; }
    public void setIncludeQueryText(boolean includeQueryText) { this.includeQueryText = includeQueryText; }
}
