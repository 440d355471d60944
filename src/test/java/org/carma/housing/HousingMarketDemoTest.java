package org.carma.housing;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HousingMarketDemoTest {

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream savedErr;

    @BeforeEach
    void captureStandardError() {
        savedErr = System.err;
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStandardError() {
        System.setErr(savedErr);
    }

    @Test
    void unknownPolicyPrintsUsage() {
        assertDoesNotThrow(() -> HousingMarketDemo.main(new String[]{"--policy", "CHEAPEST_FIRST"}));

        String output = err.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Unknown clearing policy: CHEAPEST_FIRST"), output);
        assertTrue(output.contains("Usage: HousingMarketDemo"), output);
    }

    @Test
    void missingPolicyValuePrintsUsage() {
        assertDoesNotThrow(() -> HousingMarketDemo.main(new String[]{"--policy"}));

        assertTrue(err.toString(StandardCharsets.UTF_8).contains("--policy needs a value"));
    }
}
