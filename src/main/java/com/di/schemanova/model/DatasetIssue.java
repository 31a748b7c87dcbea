package com.di.schemanova.model;

import com.di.schemanova.aspect.ErrorCategory;
import lombok.Value;

/**
 * One recorded problem for a dataset. {@code column} is null for dataset-level issues.
 */
@Value
public class DatasetIssue {
    IssueCode code;
    ErrorCategory category;
    String column;
    String message;

    public static DatasetIssue of(IssueCode code, String message) {
        return new DatasetIssue(code, null, null, message);
    }

    public static DatasetIssue ofColumn(IssueCode code, String column, String message) {
        return new DatasetIssue(code, null, column, message);
    }

    public static DatasetIssue failure(IssueCode code, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new DatasetIssue(code, ErrorCategory.categorize(cause), null, message);
    }
}
