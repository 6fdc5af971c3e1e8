package eu.virtualparadox.docindex.ingest.lifecycle;

import java.util.Objects;

/**
 * Identity and attributes of a document about to be indexed.
 *
 * @param fileHash  content hash of the raw bytes
 * @param fileName  logical name, used for orphan cleanup
 * @param mediaType detected media type
 * @param sizeBytes size of the raw bytes
 */
public record DocumentSource(String fileHash, String fileName, String mediaType, long sizeBytes) {

    public DocumentSource {
        Objects.requireNonNull(fileHash, "fileHash");
        Objects.requireNonNull(fileName, "fileName");
        if (mediaType == null) {
            mediaType = "application/octet-stream";
        }
    }
}
