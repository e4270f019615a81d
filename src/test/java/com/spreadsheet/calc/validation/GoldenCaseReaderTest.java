package com.spreadsheet.calc.validation;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for reading golden cases from JSON.
 */
class GoldenCaseReaderTest {

    private final GoldenCaseReader reader = new GoldenCaseReader();

    /**
     * Decimal numbers keep their exact digits.
     */
    @Test
    void testReadsDecimalsExactly() {
        List<GoldenCase> cases = reader.read("[{\"sheet\":\"S\",\"cell\":\"A1\",\"expectedValue\":0.1,"
                + "\"tolerance\":0.000001,\"category\":\"math\"}]");
        assertEquals(1, cases.size());
        GoldenCase golden = cases.get(0);
        assertEquals(new BigDecimal("0.1"), golden.getExpectedValue());
        assertEquals(new BigDecimal("0.000001"), golden.getTolerance());
        assertEquals("math", golden.getCategory());
    }

    @Test
    void testReadsFixture() throws Exception {
        try (InputStream input = getClass().getResourceAsStream("/golden/loan-cases.json")) {
            List<GoldenCase> cases = reader.read(input);
            assertEquals(7, cases.size());
            assertEquals("Loan", cases.get(0).getSheet());
            assertEquals(Boolean.TRUE, cases.get(3).getExpectedValue());
            assertNull(cases.get(2).getTolerance());
            assertEquals(new BigDecimal("0.01"), cases.get(1).getTolerance());
        }
    }

    @Test
    void testMalformedJson() {
        assertThrows(UncheckedIOException.class, () -> reader.read("[{\"sheet\":"));
    }
}
