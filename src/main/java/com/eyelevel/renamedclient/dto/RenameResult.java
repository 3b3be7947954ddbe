package com.eyelevel.renamedclient.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The outcome of a rename request.
 *
 * @param originalFilename  The name of the uploaded file.
 * @param suggestedFilename The AI-suggested file name.
 * @param folderPath        The suggested folder, if the service proposed one.
 * @param confidence        Confidence score between 0 and 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenameResult(String originalFilename, String suggestedFilename, String folderPath,
                           Double confidence) {
}
