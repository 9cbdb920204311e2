package com.resumevault;

import com.fasterxml.jackson.databind.JsonNode;
import com.resumevault.repository.BaseIntegrationTest;
import com.resumevault.storage.BlobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class ResumeVaultE2ETest extends BaseIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private JdbcClient jdbcClient;

    @Autowired
    private BlobStore blobStore;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("""
            TRUNCATE resume_companies, resume_keywords, resumes, companies, keywords,
                     blob_cleanup_tasks, blob_files, blob_chunks CASCADE
            """).update();
    }

    @Test
    @DisplayName("Upload, search, download, update and soft delete a resume")
    void resumeLifecycle() throws Exception {
        byte[] pdf = TestPdfs.withLines("Alice Smith", "B.S. in Computer Science", "Class of 2024");

        ResponseEntity<JsonNode> uploaded = upload("alice-token", pdf, "alice_cv.pdf",
            Map.of("companies", "google, ACME corp", "keywords", "Java"));

        assertThat(uploaded.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        JsonNode data = uploaded.getBody().get("data");
        UUID resumeId = UUID.fromString(data.get("id").asText());
        assertThat(uploaded.getBody().get("message").asText())
            .isEqualTo("Resume \"alice_cv.pdf\" uploaded successfully.");
        assertThat(data.get("name").asText()).isEqualTo("Alice Smith");
        assertThat(data.get("graduationYear").asText()).isEqualTo("2024");
        assertThat(data.get("companies")).extracting(JsonNode::asText).containsExactly("Google", "Acme Corp");
        assertThat(data.get("fileUrl").asText()).isEqualTo("/resumes/" + resumeId + "/file");

        // download returns the uploaded bytes unchanged
        ResponseEntity<byte[]> file = restTemplate.getForEntity("/resumes/{id}/file", byte[].class, resumeId);
        assertThat(file.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(file.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PDF);
        assertThat(file.getHeaders().getContentDisposition().getFilename()).isEqualTo("Alice_Smith.pdf");
        assertThat(file.getBody()).isEqualTo(pdf);

        assertThat(searchCount("company=goo")).isEqualTo(1);
        assertThat(searchCount("company=NonExistentCo123")).isZero();
        assertThat(searchCount("keyword=java&graduationYear=2024")).isEqualTo(1);

        ResponseEntity<JsonNode> filters = restTemplate.getForEntity("/resumes/filters", JsonNode.class);
        assertThat(filters.getBody().get("data").get("companies"))
            .extracting(JsonNode::asText)
            .containsExactly("Acme Corp", "Google");

        // another user may not touch it, anonymous callers are rejected
        assertThat(exchange(HttpMethod.DELETE, "/resumes/" + resumeId, "bob-token", null).getStatusCode())
            .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(exchange(HttpMethod.PUT, "/resumes/" + resumeId, null, Map.of("name", "X")).getStatusCode())
            .isEqualTo(HttpStatus.UNAUTHORIZED);

        ResponseEntity<JsonNode> updated = exchange(HttpMethod.PUT, "/resumes/" + resumeId, "alice-token",
            Map.of("major", "Mathematics", "companies", "Globex"));
        assertThat(updated.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(updated.getBody().get("data").get("major").asText()).isEqualTo("Mathematics");
        assertThat(updated.getBody().get("data").get("companies"))
            .extracting(JsonNode::asText)
            .containsExactly("Globex");

        UUID blobId = jdbcClient.sql("SELECT blob_id FROM resumes WHERE id = :id")
            .param("id", resumeId)
            .query(UUID.class)
            .single();

        ResponseEntity<JsonNode> deleted = exchange(HttpMethod.DELETE, "/resumes/" + resumeId, "alice-token", null);
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(deleted.getBody().get("message").asText()).isEqualTo("Resume deleted successfully.");

        assertThat(restTemplate.getForEntity("/resumes/{id}", JsonNode.class, resumeId).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(restTemplate.getForEntity("/resumes/{id}/file", JsonNode.class, resumeId).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(searchCount("query=alice")).isZero();

        await().atMost(10, TimeUnit.SECONDS)
            .pollInterval(200, TimeUnit.MILLISECONDS)
            .until(() -> !blobStore.exists(blobId));
        assertThat(jdbcClient.sql("SELECT status FROM blob_cleanup_tasks WHERE blob_id = :id")
            .param("id", blobId)
            .query(String.class)
            .single()).isEqualTo("DONE");
    }

    @Test
    @DisplayName("Non-PDF uploads are rejected without leaving rows or blobs behind")
    void rejectsNonPdf() {
        byte[] gif = "GIF89a fake image".getBytes();

        ResponseEntity<JsonNode> response = upload("alice-token", gif, "photo.gif", Map.of());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("message").asText()).isEqualTo("Invalid PDF file format.");
        assertThat(count("resumes")).isZero();
        assertThat(count("blob_files")).isZero();
    }

    @Test
    @DisplayName("Unparseable PDFs are stored with fallback metadata and a parsing warning")
    void fallbackMetadata() {
        byte[] broken = "%PDF-1.4 not really a pdf".getBytes();

        ResponseEntity<JsonNode> response = upload("alice-token", broken, "jane_doe.pdf", Map.of());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        JsonNode data = response.getBody().get("data");
        assertThat(data.get("name").asText()).isEqualTo("jane_doe");
        assertThat(data.get("major").asText()).isEqualTo("Unspecified");
        assertThat(data.get("parsingWarning").isNull()).isFalse();
    }

    @Test
    @DisplayName("Delete all requires an admin and fails when nothing is active")
    void deleteAll() throws Exception {
        upload("alice-token", TestPdfs.withLines("Alice Smith"), "a.pdf", Map.of());
        upload("bob-token", TestPdfs.withLines("Bob Jones"), "b.pdf", Map.of());

        assertThat(exchange(HttpMethod.DELETE, "/resumes/all/delete", "alice-token", null).getStatusCode())
            .isEqualTo(HttpStatus.FORBIDDEN);

        ResponseEntity<JsonNode> deleted = exchange(HttpMethod.DELETE, "/resumes/all/delete", "admin-token", null);
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(deleted.getBody().get("data").get("deletedCount").asInt()).isEqualTo(2);
        assertThat(searchCount("")).isZero();

        ResponseEntity<JsonNode> again = exchange(HttpMethod.DELETE, "/resumes/all/delete", "admin-token", null);
        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(again.getBody().get("message").asText()).isEqualTo("No active resumes found to delete.");

        await().atMost(10, TimeUnit.SECONDS).until(() -> count("blob_files") == 0);
    }

    private ResponseEntity<JsonNode> upload(String token, byte[] content, String filename, Map<String, String> fields) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        fields.forEach(body::add);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setBearerAuth(token);
        return restTemplate.postForEntity("/resumes", new HttpEntity<>(body, headers), JsonNode.class);
    }

    private ResponseEntity<JsonNode> exchange(HttpMethod method, String url, String token, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return restTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class);
    }

    private int searchCount(String query) {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity("/resumes/search?" + query, JsonNode.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return response.getBody().get("count").asInt();
    }

    private long count(String table) {
        return jdbcClient.sql("SELECT COUNT(*) FROM " + table).query(Long.class).single();
    }
}
