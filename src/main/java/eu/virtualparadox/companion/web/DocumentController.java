package eu.virtualparadox.companion.web;

import eu.virtualparadox.companion.catalog.entity.DocumentEntity;
import eu.virtualparadox.companion.ingest.lifecycle.DocumentLifecycleManager;
import eu.virtualparadox.companion.web.dto.DeleteDocumentResponse;
import eu.virtualparadox.companion.web.dto.DocumentResponse;
import eu.virtualparadox.companion.web.dto.UploadResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentLifecycleManager lifecycleManager;

    /**
     * Stores the file and queues it for ingestion; poll {@code GET /documents} for the outcome.
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public UploadResponse upload(@RequestParam("file") final MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        final DocumentEntity document;
        try (InputStream in = file.getInputStream()) {
            document = lifecycleManager.upload(file.getOriginalFilename(), file.getContentType(), in);
        }
        return new UploadResponse(document.getId(), document.getOriginalFilename(),
                document.getStatus().name().toLowerCase(Locale.ROOT));
    }

    @GetMapping("/documents")
    public List<DocumentResponse> list() {
        return lifecycleManager.listAll().stream().map(DocumentResponse::of).toList();
    }

    @GetMapping("/documents/{id}")
    public DocumentResponse get(@PathVariable("id") final String id) {
        return DocumentResponse.of(lifecycleManager.get(id));
    }

    @DeleteMapping("/documents/{id}")
    public DeleteDocumentResponse delete(@PathVariable("id") final String id) throws IOException {
        final int removed = lifecycleManager.deleteDocument(id);
        return new DeleteDocumentResponse("Document " + id + " deleted", removed);
    }

    @PostMapping("/documents/{id}/reingest")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public DocumentResponse reingest(@PathVariable("id") final String id) {
        return DocumentResponse.of(lifecycleManager.reingest(id));
    }
}
