package eu.virtualparadox.companion.web;

import com.jayway.jsonpath.JsonPath;
import eu.virtualparadox.companion.rag.index.VectorIndexService;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DocumentApiTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private VectorIndexService vectorIndexService;

    /**
     * Polls {@code GET /documents/{id}} until the document reaches {@code expected}.
     */
    static void awaitStatus(MockMvc mockMvc, String documentId, String expected) throws Exception {
        String status = null;
        for (int attempt = 0; attempt < 200; attempt++) {
            String body = mockMvc.perform(get("/documents/{id}", documentId))
                    .andReturn().getResponse().getContentAsString();
            status = JsonPath.read(body, "$.status");
            if (expected.equals(status)) {
                return;
            }
            if (!"processing".equals(status)) {
                break;
            }
            Thread.sleep(50);
        }
        fail("Document " + documentId + " ended up " + status + " instead of " + expected);
    }

    private String upload(String filename, String content) throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", filename, MediaType.TEXT_PLAIN_VALUE,
                content.getBytes(StandardCharsets.UTF_8));
        String body = mockMvc.perform(multipart("/upload").file(file))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.filename").value(filename))
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.document_id");
    }

    private static String sentences(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> StringUtils.rightPad("Sentence number " + i + " covers", 48, 'z') + ".")
                .collect(Collectors.joining(" "));
    }

    @Test
    void testUploadIngestListAndDelete() throws Exception {
        String documentId = upload("long.txt", sentences(180));

        awaitStatus(mockMvc, documentId, "ready");

        mockMvc.perform(get("/documents/{id}", documentId))
                .andExpect(jsonPath("$.chunk_count").value(20))
                .andExpect(jsonPath("$.original_filename").value("long.txt"))
                .andExpect(jsonPath("$.stored_filename").value(documentId + ".txt"))
                .andExpect(jsonPath("$.size_bytes").value(8999))
                .andExpect(jsonPath("$.embed_model").value("hashing-384"));
        mockMvc.perform(get("/documents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == '" + documentId + "')]", hasSize(1)));
        assertThat(vectorIndexService.countByDocument(documentId)).isEqualTo(20);

        mockMvc.perform(delete("/documents/{id}", documentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunks_removed").value(20));

        assertThat(vectorIndexService.countByDocument(documentId)).isZero();
        mockMvc.perform(get("/documents/{id}", documentId))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/documents"))
                .andExpect(jsonPath("$[?(@.id == '" + documentId + "')]", hasSize(0)));
    }

    @Test
    void testUnsupportedFormatIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "slides.docx", MediaType.APPLICATION_OCTET_STREAM_VALUE,
                new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Unsupported file format. Only PDF and TXT are supported."));
    }

    @Test
    void testBrokenPdfEndsUpFailedAndCanBeRetried() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "broken.pdf", "application/pdf",
                "this is not a pdf".getBytes(StandardCharsets.UTF_8));
        String body = mockMvc.perform(multipart("/upload").file(file))
                .andExpect(status().isAccepted())
                .andReturn().getResponse().getContentAsString();
        String documentId = JsonPath.read(body, "$.document_id");

        awaitStatus(mockMvc, documentId, "failed");
        mockMvc.perform(get("/documents/{id}", documentId))
                .andExpect(jsonPath("$.chunk_count").value(0));
        assertThat(vectorIndexService.countByDocument(documentId)).isZero();

        mockMvc.perform(post("/documents/{id}/reingest", documentId))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("processing"));
        awaitStatus(mockMvc, documentId, "failed");
    }

    @Test
    void testReadyDocumentCannotBeReingested() throws Exception {
        String documentId = upload("short.txt", "A short note. Nothing more.");
        awaitStatus(mockMvc, documentId, "ready");

        mockMvc.perform(post("/documents/{id}/reingest", documentId))
                .andExpect(status().isConflict());
    }

    @Test
    void testDeletingUnknownDocumentIs404() throws Exception {
        mockMvc.perform(delete("/documents/{id}", "does-not-exist"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testMissingFilePartIs400() throws Exception {
        mockMvc.perform(multipart("/upload"))
                .andExpect(status().isBadRequest());
    }
}
