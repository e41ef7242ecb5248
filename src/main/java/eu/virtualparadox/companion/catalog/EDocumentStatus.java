package eu.virtualparadox.companion.catalog;

/**
 * Ingestion state of a document. Transitions only move forward:
 * {@code PROCESSING -> READY} or {@code PROCESSING -> FAILED}; a failed document may go back
 * to {@code PROCESSING} through re-ingestion.
 */
public enum EDocumentStatus {
    PROCESSING,
    READY,
    FAILED
}
