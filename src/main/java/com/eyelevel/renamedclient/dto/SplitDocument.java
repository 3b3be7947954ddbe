package com.eyelevel.renamedclient.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One document produced by a PDF split.
 *
 * @param index       Zero-based position in the split output.
 * @param filename    Suggested name of the document.
 * @param pages       Page range, e.g. {@code 1-3}.
 * @param downloadUrl Signed URL to fetch the document with {@code downloadFile}.
 * @param size        Size in bytes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SplitDocument(int index, String filename, String pages, String downloadUrl, long size) {
}
