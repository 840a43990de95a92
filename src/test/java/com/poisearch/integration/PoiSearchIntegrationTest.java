package com.poisearch.integration;

import com.poisearch.index.PoiIndexRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over HTTP. The test profile caps searches at 5 points and
 * refreshes the index on every search.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
public class PoiSearchIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PoiIndexRegistry indexRegistry;

    private TestRestTemplate restTemplate;
    private String baseUrl;

    @BeforeEach
    public void setUp() {
        restTemplate = new TestRestTemplate();
        baseUrl = "http://localhost:" + port + "/api/v1";

        jdbcTemplate.update("DELETE FROM poi_removal");
        jdbcTemplate.update("DELETE FROM poi");
        indexRegistry.resetAll();
    }

    private static Map<String, Object> poi(String name, Double lat, Double lon, Integer category) {
        Map<String, Object> request = new HashMap<>();
        request.put("name", name);
        if (lat != null) {
            request.put("position", Map.of("latitude", lat, "longitude", lon));
        }
        if (category != null) {
            request.put("category", category);
        }
        return request;
    }

    private static Map<String, Object> area(double latMin, double latMax, double lonMin, double lonMax, int category) {
        Map<String, Object> request = new HashMap<>();
        request.put("latitude_min", latMin);
        request.put("latitude_max", latMax);
        request.put("longitude_min", lonMin);
        request.put("longitude_max", lonMax);
        request.put("category", category);
        return request;
    }

    private ResponseEntity<Map> post(String path, Object body) {
        return restTemplate.postForEntity(baseUrl + path, body, Map.class);
    }

    private long create(String name, double lat, double lon, int category) {
        ResponseEntity<Map> response = post("/poi_create", poi(name, lat, lon, category));
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return ((Number) data(response).get("id")).longValue();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ResponseEntity<Map> response) {
        return (Map<String, Object>) response.getBody().get("data");
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> pois(ResponseEntity<Map> response) {
        return (List<Map<String, Object>>) data(response).get("pois");
    }

    private static void assertError(ResponseEntity<Map> response, HttpStatus status, String code) {
        assertEquals(status, response.getStatusCode());
        assertEquals(Boolean.FALSE, response.getBody().get("ok"));
        assertEquals(code, response.getBody().get("code"));
        assertNotNull(response.getBody().get("error"));
        assertNull(response.getBody().get("data"));
    }

    @Test
    public void testCreateThenSearch() {
        // 1. Create a museum and a restaurant at the same spot
        long louvre = create("Louvre", 48.8606, 2.3376, 2);
        create("Le Fumoir", 48.8606, 2.3376, 3);

        // 2. Search museums around it
        ResponseEntity<Map> response = post("/poi_search", area(48.8, 48.9, 2.2, 2.4, 2));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(Boolean.TRUE, response.getBody().get("ok"));
        assertNotNull(response.getBody().get("elapsed"));
        assertEquals(Boolean.FALSE, data(response).get("zoom_in"));
        List<Map<String, Object>> hits = pois(response);
        assertEquals(1, hits.size());
        assertEquals(louvre, ((Number) hits.get(0).get("id")).longValue());
        assertEquals("Louvre", hits.get(0).get("name"));
        @SuppressWarnings("unchecked")
        Map<String, Object> position = (Map<String, Object>) hits.get(0).get("position");
        assertEquals(48.8606, ((Number) position.get("latitude")).doubleValue());
        assertEquals(2.3376, ((Number) position.get("longitude")).doubleValue());
    }

    @Test
    public void testEmptyAreaReturnsEmptyList() {
        create("Louvre", 48.8606, 2.3376, 2);

        ResponseEntity<Map> response = post("/poi_search", area(10, 11, 10, 11, 2));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(Boolean.FALSE, data(response).get("zoom_in"));
        assertTrue(pois(response).isEmpty());
    }

    @Test
    public void testZoomInAboveDisplayCap() {
        for (int i = 0; i < 5; i++) {
            create("r" + i, 45.0 + i * 0.01, 7.0, 3);
        }

        // Exactly the cap is still a list
        ResponseEntity<Map> exact = post("/poi_search", area(44, 46, 6, 8, 3));
        assertEquals(Boolean.FALSE, data(exact).get("zoom_in"));
        assertEquals(5, pois(exact).size());

        // One more asks to zoom in, without any points
        create("r5", 45.5, 7.0, 3);
        ResponseEntity<Map> over = post("/poi_search", area(44, 46, 6, 8, 3));
        assertEquals(HttpStatus.OK, over.getStatusCode());
        assertEquals(Boolean.TRUE, data(over).get("zoom_in"));
        assertNull(data(over).get("pois"));

        // A narrower area lists them again
        ResponseEntity<Map> narrow = post("/poi_search", area(44.99, 45.015, 6, 8, 3));
        assertEquals(2, pois(narrow).size());
    }

    @Test
    public void testDeleteRemovesFromSearch() {
        long louvre = create("Louvre", 48.8606, 2.3376, 2);
        long orsay = create("Orsay", 48.8600, 2.3266, 2);
        assertEquals(2, pois(post("/poi_search", area(48.8, 48.9, 2.2, 2.4, 2))).size());

        Map<String, Object> delete = Map.of("id", louvre);
        ResponseEntity<Map> deleted = post("/poi_delete", delete);
        assertEquals(HttpStatus.OK, deleted.getStatusCode());
        assertEquals(Boolean.TRUE, deleted.getBody().get("ok"));

        List<Map<String, Object>> hits = pois(post("/poi_search", area(48.8, 48.9, 2.2, 2.4, 2)));
        assertEquals(1, hits.size());
        assertEquals(orsay, ((Number) hits.get(0).get("id")).longValue());

        // Deleting twice reports the second as not found
        assertError(post("/poi_delete", delete), HttpStatus.NOT_FOUND, "dnexist");
        assertError(restTemplate.getForEntity(baseUrl + "/pois/" + louvre, Map.class), HttpStatus.NOT_FOUND, "dnexist");
    }

    @Test
    public void testGetById() {
        long id = create("Colosseum", 41.8902, 12.4922, 1);

        ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/pois/" + id, Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("Colosseum", data(response).get("name"));
        assertEquals(1, ((Number) data(response).get("category")).intValue());
        assertNull(data(response).get("latitude"));
    }

    @Test
    public void testCreateValidationErrors() {
        assertError(post("/poi_create", poi("no position", null, null, 2)), HttpStatus.BAD_REQUEST, "pmiss");
        assertError(post("/poi_create", poi("north of north", 91.0, 0.0, 2)), HttpStatus.BAD_REQUEST, "badpos");
        assertError(post("/poi_create", poi("no category", 1.0, 1.0, null)), HttpStatus.BAD_REQUEST, "ctmiss");
        assertError(post("/poi_create", poi("unknown category", 1.0, 1.0, 42)), HttpStatus.BAD_REQUEST, "badpld");

        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM poi", Integer.class));
    }

    @Test
    public void testSearchValidationErrors() {
        assertError(post("/poi_search", area(10, 5, 0, 1, 2)), HttpStatus.BAD_REQUEST, "badarea");
        assertError(post("/poi_search", area(-95, 5, 0, 1, 2)), HttpStatus.BAD_REQUEST, "badarea");

        Map<String, Object> missingBound = area(0, 1, 0, 1, 2);
        missingBound.remove("longitude_max");
        assertError(post("/poi_search", missingBound), HttpStatus.BAD_REQUEST, "badarea");

        Map<String, Object> missingCategory = area(0, 1, 0, 1, 2);
        missingCategory.remove("category");
        assertError(post("/poi_search", missingCategory), HttpStatus.BAD_REQUEST, "ctmiss");
    }

    @Test
    public void testMalformedPayloads() {
        assertError(post("/poi_delete", Map.of()), HttpStatus.BAD_REQUEST, "idmiss");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Map> response = restTemplate.postForEntity(baseUrl + "/poi_create",
                new HttpEntity<>("{\"name\": ", headers), Map.class);
        assertError(response, HttpStatus.BAD_REQUEST, "badpld");

        assertError(restTemplate.getForEntity(baseUrl + "/pois/abc", Map.class), HttpStatus.BAD_REQUEST, "badpld");
        assertError(restTemplate.getForEntity(baseUrl + "/nowhere", Map.class), HttpStatus.NOT_FOUND, "rejected");
    }

    @Test
    public void testStatsAndReset() {
        create("Louvre", 48.8606, 2.3376, 2);

        ResponseEntity<Map> before = restTemplate.getForEntity(baseUrl + "/stats", Map.class);
        assertEquals(Boolean.FALSE, data(before).get("built"));

        post("/poi_search", area(48.8, 48.9, 2.2, 2.4, 2));
        ResponseEntity<Map> after = restTemplate.getForEntity(baseUrl + "/stats", Map.class);
        assertEquals(Boolean.TRUE, data(after).get("built"));
        assertEquals(1, ((Number) data(after).get("size")).intValue());

        ResponseEntity<Map> reset = post("/index/reset", null);
        assertEquals(Boolean.TRUE, data(reset).get("dropped"));
        ResponseEntity<Map> afterReset = restTemplate.getForEntity(baseUrl + "/stats", Map.class);
        assertEquals(Boolean.FALSE, data(afterReset).get("built"));
    }
}
