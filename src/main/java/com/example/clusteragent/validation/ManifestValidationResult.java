package com.example.clusteragent.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManifestValidationResult {

    private boolean valid;
    @Builder.Default
    private List<ValidationIssue> errors = new ArrayList<>();
    @Builder.Default
    private List<ValidationIssue> warnings = new ArrayList<>();

    /**
     * Errors as text, one per line; what the repair prompt is given.
     */
    public String errorSummary() {
        return errors.stream().map(ValidationIssue::toString).collect(Collectors.joining("\n"));
    }
}
