package org.tanzu.ruckusmcp.resource;

import org.tanzu.ruckusmcp.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Body of a RUCKUS One "/query" call.
 * 
 * Only fields that were set are sent. {@link #defaults()} starts from the
 * paging the API documents (page 0, 100 per page, ascending); {@link #empty()}
 * sends nothing the caller did not ask for.
 */
public final class QueryRequest {

    public static final int DEFAULT_PAGE_SIZE = 100;

    private Integer pageSize;
    private Integer page;
    private String sortOrder;
    private String sortField;
    private String searchString;
    private List<String> searchTargetFields;
    private List<String> fields;
    private Object filters;

    private QueryRequest() {
    }

    public static QueryRequest defaults() {
        return new QueryRequest().pageSize(DEFAULT_PAGE_SIZE).page(0).sortOrder("ASC");
    }

    public static QueryRequest empty() {
        return new QueryRequest();
    }

    public QueryRequest pageSize(Integer pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    public QueryRequest page(Integer page) {
        this.page = page;
        return this;
    }

    /**
     * @param sortOrder "ASC" or "DESC" in any case; the API only accepts upper case
     * @throws ValidationException for any other value
     */
    public QueryRequest sortOrder(String sortOrder) {
        if (sortOrder == null) {
            this.sortOrder = null;
            return this;
        }
        String normalized = sortOrder.trim().toUpperCase(Locale.ROOT);
        if (!normalized.equals("ASC") && !normalized.equals("DESC")) {
            throw new ValidationException("sortOrder must be ASC or DESC, got '" + sortOrder + "'");
        }
        this.sortOrder = normalized;
        return this;
    }

    public QueryRequest sortField(String sortField) {
        this.sortField = sortField;
        return this;
    }

    public QueryRequest searchString(String searchString) {
        this.searchString = searchString;
        return this;
    }

    public QueryRequest searchTargetFields(List<String> searchTargetFields) {
        this.searchTargetFields = searchTargetFields;
        return this;
    }

    public QueryRequest fields(List<String> fields) {
        this.fields = fields;
        return this;
    }

    /** Filters in whatever shape the endpoint expects: a list of {type, value} or a map. */
    public QueryRequest filters(Object filters) {
        this.filters = filters;
        return this;
    }

    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        ResourceModule.putIfPresent(body, "pageSize", pageSize);
        ResourceModule.putIfPresent(body, "page", page);
        ResourceModule.putIfPresent(body, "sortOrder", sortOrder);
        ResourceModule.putIfPresent(body, "sortField", sortField);
        ResourceModule.putIfPresent(body, "searchString", searchString);
        ResourceModule.putIfPresent(body, "searchTargetFields", searchTargetFields);
        ResourceModule.putIfPresent(body, "fields", fields);
        ResourceModule.putIfPresent(body, "filters", filters);
        return body;
    }

    static Map<String, Object> bodyOf(QueryRequest query, QueryRequest fallback) {
        return (query != null ? query : fallback).toBody();
    }

    @Override
    public String toString() {
        return "QueryRequest" + toBody();
    }
}
