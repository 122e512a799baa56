package com.chicu.trafficvolume.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "traffic.model.artifact-location=classpath:models/absent-model.pmml"
)
class ModelUnavailableSmokeTest {

    @LocalServerPort
    int port;

    private final TestRestTemplate rest = new TestRestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    @Test
    void scenarioFour_healthShouldBeUnhealthy() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/health"), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("unhealthy", resp.getBody().get("status"));
        assertEquals(false, resp.getBody().get("model_loaded"));
    }

    @Test
    void predict_shouldAnswerModelUnavailable() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Map> resp = rest.postForEntity(url("/predict"), new HttpEntity<>("{}", headers), Map.class);

        assertEquals(500, resp.getStatusCode().value());
        assertEquals("model_unavailable", resp.getBody().get("error"));
        assertNotNull(resp.getBody().get("detail"));
    }

    @Test
    void invalidInput_shouldStillBeClientError_beforeModelCheck() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Map> resp = rest.postForEntity(url("/predict"), new HttpEntity<>("{\"hour\":24}", headers), Map.class);

        assertEquals(400, resp.getStatusCode().value());
        assertEquals("validation_error", resp.getBody().get("error"));
    }

    @Test
    void root_shouldReportRunningWithoutModel() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/"), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("running", resp.getBody().get("status"));
        assertEquals(false, resp.getBody().get("model_loaded"));
        assertEquals("1.0.0", resp.getBody().get("version"));
        assertInstanceOf(Map.class, resp.getBody().get("endpoints"));
    }

    @Test
    void actuatorHealth_shouldReportModelDown() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/actuator/health"), Map.class);

        assertEquals(503, resp.getStatusCode().value());
        assertEquals("DOWN", resp.getBody().get("status"));
        Map<?, ?> components = (Map<?, ?>) resp.getBody().get("components");
        Map<?, ?> model = (Map<?, ?>) components.get("model");
        assertEquals("DOWN", model.get("status"));
    }

    @Test
    void unknownPath_shouldReturnStructuredNotFound() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/nope"), Map.class);

        assertEquals(404, resp.getStatusCode().value());
        assertEquals("not_found", resp.getBody().get("error"));
    }

    @Test
    void openApiDocument_shouldBeServed() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/openapi.json"), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        Map<?, ?> paths = (Map<?, ?>) resp.getBody().get("paths");
        assertTrue(paths.containsKey("/predict"));
    }
}
