package com.eyelevel.renamedclient.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The result of a completed PDF split job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PdfSplitResult(String originalFilename, List<SplitDocument> documents, int totalPages) {

    public PdfSplitResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
