package com.williamcallahan.scormingest.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.util.unit.DataSize;

/**
 * Verifies that oversize or non-multipart uploads are refused before the body is read.
 */
class UploadSizeGuardFilterTest {

    private static final String MULTIPART_CONTENT_TYPE = "multipart/form-data; boundary=xyz";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UploadSizeGuardFilter filter = new UploadSizeGuardFilter(DataSize.ofBytes(16), objectMapper);

    @Test
    void rejectsUploadLargerThanLimit() throws ServletException, IOException {
        MockHttpServletRequest request = uploadRequest(MULTIPART_CONTENT_TYPE);
        request.setContent(new byte[32]);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(413, response.getStatus());
        assertNull(chain.getRequest(), "request must not reach the controller");
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("error", body.path("status").asText());
        assertEquals(ApiExceptionHandler.FILE_TOO_LARGE_MESSAGE, body.path("message").asText());
    }

    @Test
    void passesUploadWithinLimit() throws ServletException, IOException {
        MockHttpServletRequest request = uploadRequest(MULTIPART_CONTENT_TYPE);
        request.setContent(new byte[8]);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
    }

    @Test
    void ignoresOtherEndpoints() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/todos");
        request.setContent(new byte[64]);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
    }

    @Test
    void rejectsUploadThatIsNotMultipart() throws ServletException, IOException {
        MockHttpServletRequest request = uploadRequest("application/zip");
        request.setContent(new byte[8]);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(400, response.getStatus());
        assertNull(chain.getRequest());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals(ScormUploadController.NO_FILE_PART_MESSAGE, body.path("message").asText());
    }

    @Test
    void rejectsUploadWithoutContentType() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/upload-scorm");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertEquals(400, response.getStatus());
    }

    private static MockHttpServletRequest uploadRequest(String contentType) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/upload-scorm");
        request.setContentType(contentType);
        return request;
    }
}
