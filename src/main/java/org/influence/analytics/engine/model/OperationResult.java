package org.influence.analytics.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one operation invocation, returned to the caller as JSON.
 * A result is either a success carrying a preview or a failure carrying an error kind, never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResult {

    private boolean success;
    private String operation;
    private String criteria;
    private List<String> columns;
    private List<Map<String, Object>> preview;
    private Integer totalCount;
    private String exportUrl;
    private String planSummary;
    private String errorKind;
    private String message;
    private String diagnostic;

    public OperationResult() {
    }

    public static OperationResult success(String operation, String criteria, List<String> columns,
                                          List<Map<String, Object>> preview, int totalCount, String exportUrl,
                                          String planSummary) {
        OperationResult result = new OperationResult();
        result.success = true;
        result.operation = operation;
        result.criteria = criteria;
        result.columns = columns;
        result.preview = preview != null ? preview : new ArrayList<>();
        result.totalCount = totalCount;
        result.exportUrl = exportUrl;
        result.planSummary = planSummary;
        return result;
    }

    public static OperationResult failure(String operation, String errorKind, String message, String diagnostic) {
        OperationResult result = new OperationResult();
        result.success = false;
        result.operation = operation;
        result.errorKind = errorKind;
        result.message = message;
        result.diagnostic = diagnostic;
        return result;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public String getCriteria() {
        return criteria;
    }

    public void setCriteria(String criteria) {
        this.criteria = criteria;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<Map<String, Object>> getPreview() {
        return preview;
    }

    public void setPreview(List<Map<String, Object>> preview) {
        this.preview = preview;
    }

    public Integer getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(Integer totalCount) {
        this.totalCount = totalCount;
    }

    public String getExportUrl() {
        return exportUrl;
    }

    public void setExportUrl(String exportUrl) {
        this.exportUrl = exportUrl;
    }

    public String getPlanSummary() {
        return planSummary;
    }

    public void setPlanSummary(String planSummary) {
        this.planSummary = planSummary;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(String errorKind) {
        this.errorKind = errorKind;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    public void setDiagnostic(String diagnostic) {
        this.diagnostic = diagnostic;
    }
}
