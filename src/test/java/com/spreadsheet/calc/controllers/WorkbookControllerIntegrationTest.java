package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.CalcApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = CalcApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class WorkbookControllerIntegrationTest {

    @LocalServerPort
    int port;

    private RestTemplate restTemplate;
    private HttpHeaders json;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        json = new HttpHeaders();
        json.setContentType(MediaType.APPLICATION_JSON);
    }

    private String url(String path) {
        return "http://localhost:" + port + "/workbook" + path;
    }

    private long createWorkbook(String body) {
        ResponseEntity<Map> response = restTemplate.postForEntity(url(""), new HttpEntity<>(body, json), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return ((Number) response.getBody().get("id")).longValue();
    }

    /**
     * Creates a workbook, edits a precedent and reads the change-set and values.
     */
    @Test
    void testCreateEditAndRead() {
        String body = "{\n" +
                "  \"sheets\": [\"Sheet1\"],\n" +
                "  \"cells\": [\n" +
                "    {\"sheet\": \"Sheet1\", \"cell\": \"A1\", \"input\": \"10\"},\n" +
                "    {\"sheet\": \"Sheet1\", \"cell\": \"A2\", \"input\": \"20\"},\n" +
                "    {\"sheet\": \"Sheet1\", \"cell\": \"A3\", \"input\": \"=A1+A2\"},\n" +
                "    {\"sheet\": \"Sheet1\", \"cell\": \"B1\", \"input\": \"=A1/0\"}\n" +
                "  ]\n" +
                "}";
        long id = createWorkbook(body);

        String edit = "[{\"sheet\": \"Sheet1\", \"cell\": \"A1\", \"input\": \"15\"}]";
        ResponseEntity<Map> result = restTemplate.exchange(url("/" + id + "/cells"), HttpMethod.PUT,
                new HttpEntity<>(edit, json), Map.class);
        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertEquals(Boolean.TRUE, result.getBody().get("complete"));
        List<Map<String, Object>> changes = (List<Map<String, Object>>) result.getBody().get("changes");
        assertEquals(2, changes.size());
        assertEquals("Sheet1!A1", changes.get(0).get("cell"));
        assertEquals("Sheet1!A3", changes.get(1).get("cell"));
        assertEquals(35, ((Number) changes.get(1).get("value")).intValue());

        ResponseEntity<Map> values = restTemplate.getForEntity(url("/" + id), Map.class);
        assertEquals(HttpStatus.OK, values.getStatusCode());
        assertEquals("#DIV/0!", values.getBody().get("Sheet1!B1"));
        assertEquals(35, ((Number) values.getBody().get("Sheet1!A3")).intValue());
    }

    @Test
    void testCyclesEndpoint() {
        long id = createWorkbook("{\"sheets\": [\"S\"], \"cells\": ["
                + "{\"sheet\": \"S\", \"cell\": \"A1\", \"input\": \"=B1\"},"
                + "{\"sheet\": \"S\", \"cell\": \"B1\", \"input\": \"=A1\"}]}");

        ResponseEntity<List> cycles = restTemplate.getForEntity(url("/" + id + "/cycles"), List.class);
        assertEquals(Collections.singletonList(Arrays.asList("S!A1", "S!B1")), cycles.getBody());

        ResponseEntity<Map> values = restTemplate.getForEntity(url("/" + id), Map.class);
        assertEquals("#CIRCULAR!", values.getBody().get("S!A1"));
    }

    /**
     * Defining a name over HTTP recalculates the formulas using it.
     */
    @Test
    void testNamesEndpoint() {
        long id = createWorkbook("{\"sheets\": [\"S\"], \"cells\": ["
                + "{\"sheet\": \"S\", \"cell\": \"A1\", \"input\": \"2\"},"
                + "{\"sheet\": \"S\", \"cell\": \"A2\", \"input\": \"3\"},"
                + "{\"sheet\": \"S\", \"cell\": \"B1\", \"input\": \"=SUM(Pair)\"}]}");

        HttpHeaders text = new HttpHeaders();
        text.setContentType(MediaType.TEXT_PLAIN);
        restTemplate.exchange(url("/" + id + "/names/Pair"), HttpMethod.PUT,
                new HttpEntity<>("S!A1:A2", text), Map.class);

        ResponseEntity<Map> values = restTemplate.getForEntity(url("/" + id), Map.class);
        assertEquals(5, ((Number) values.getBody().get("S!B1")).intValue());

        restTemplate.delete(url("/" + id + "/names/Pair"));
        values = restTemplate.getForEntity(url("/" + id), Map.class);
        assertEquals("#REF!", values.getBody().get("S!B1"));
    }

    @Test
    void testValidateEndpoint() {
        long id = createWorkbook("{\"sheets\": [\"S\"], \"cells\": ["
                + "{\"sheet\": \"S\", \"cell\": \"A1\", \"input\": \"=ROUND(PMT(0.1,2,100),2)\"}]}");

        String cases = "[{\"sheet\": \"S\", \"cell\": \"A1\", \"expectedValue\": -57.62},"
                + "{\"sheet\": \"S\", \"cell\": \"A1\", \"expectedValue\": -50}]";
        ResponseEntity<Map> report = restTemplate.postForEntity(url("/" + id + "/validate"),
                new HttpEntity<>(cases, json), Map.class);
        assertEquals(HttpStatus.OK, report.getStatusCode());
        assertEquals(2, report.getBody().get("total"));
        assertEquals(1, report.getBody().get("passed"));
        Map<String, Object> breakdown = (Map<String, Object>) report.getBody().get("categoryBreakdown");
        assertTrue(breakdown.containsKey("MATH"));

        HttpClientErrorException bad = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url("/" + id + "/validate"), new HttpEntity<>("[{", json), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, bad.getStatusCode());
    }

    /**
     * Unknown workbooks and sheets are 404, malformed references 400, and a
     * formula nested too deeply 422.
     */
    @Test
    void testErrorResponses() {
        HttpClientErrorException missing = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(url("/999999"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertTrue(missing.getResponseBodyAsString().contains("WORKBOOK_NOT_FOUND"));

        long id = createWorkbook("{\"sheets\": [\"S\"], \"cells\": []}");

        HttpClientErrorException noSheet = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(url("/" + id + "/cells"), HttpMethod.PUT,
                        new HttpEntity<>("[{\"sheet\": \"T\", \"cell\": \"A1\", \"input\": \"1\"}]", json), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, noSheet.getStatusCode());

        HttpClientErrorException badCell = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(url("/" + id + "/cells"), HttpMethod.PUT,
                        new HttpEntity<>("[{\"sheet\": \"S\", \"cell\": \"??\", \"input\": \"1\"}]", json), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, badCell.getStatusCode());

        StringBuilder deep = new StringBuilder("=");
        for (int i = 0; i < 200; i++) {
            deep.append('(');
        }
        deep.append('1');
        for (int i = 0; i < 200; i++) {
            deep.append(')');
        }
        String edit = "[{\"sheet\": \"S\", \"cell\": \"A1\", \"input\": \"" + deep + "\"}]";
        HttpClientErrorException tooDeep = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(url("/" + id + "/cells"), HttpMethod.PUT, new HttpEntity<>(edit, json), Map.class));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, tooDeep.getStatusCode());

        restTemplate.delete(url("/" + id));
        HttpClientErrorException closed = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(url("/" + id), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, closed.getStatusCode());
    }
}
