package com.sponsor.lookup.cli;

import com.sponsor.lookup.SampleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SponsorLookupCli Tests")
class SponsorLookupCliTest {

    @TempDir
    Path tempDir;

    private Path csv;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        csv = SampleRegistry.copyTo(tempDir);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        return run(new StringReader(""), args);
    }

    private int run(Reader input, String... args) {
        CommandLine cmd = new CommandLine(new SponsorLookupCli(input));
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    @DisplayName("No mode should print usage")
    void testUsage() {
        int exitCode = run();

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("Usage: sponsor-lookup"));
        assertTrue(out.toString().contains("--interactive"));
    }

    @Test
    @DisplayName("Missing register should fail with a download hint")
    void testMissingCsv() {
        int exitCode = run("--company", "Barclays", "--csv", tempDir.resolve("missing.csv").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
        assertTrue(err.toString().contains("Download from:"));
    }

    @Test
    @DisplayName("Invalid threshold should be a usage error")
    void testInvalidThreshold() {
        int exitCode = run("--company", "Barclays", "--csv", csv.toString(), "--threshold", "2");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("--threshold must be between 0.0 and 1.0"));
    }

    @Nested
    @DisplayName("Company search")
    class CompanySearch {

        @Test
        @DisplayName("Should print matches and a confirmed verdict")
        void testSponsor() {
            int exitCode = run("--company", "Barclays", "--csv", csv.toString());

            String output = out.toString();
            assertEquals(0, exitCode);
            assertTrue(output.contains("Searching for: 'Barclays'"));
            assertTrue(output.contains("CONFIRMED (Match: 90%)"));
            assertTrue(output.contains("Location: Northampton, Northamptonshire"));
            assertTrue(output.contains("CONFIRMED: This is a registered UK visa sponsor"));
        }

        @Test
        @DisplayName("Partial word match should be a possible match")
        void testPossibleMatch() {
            run("-c", "Barclays Bnk", "--csv", csv.toString(), "-t", "0.3");

            String output = out.toString();
            assertTrue(output.contains("POSSIBLE MATCH (Match: 75%)"));
            assertTrue(output.contains("POSSIBLE MATCH: Review results above"));
        }

        @Test
        @DisplayName("Unknown company should report no matches")
        void testNoMatch() {
            int exitCode = run("-c", "Initech", "--csv", csv.toString());

            assertEquals(0, exitCode);
            assertTrue(out.toString().contains("No matching sponsors found"));
        }

        @Test
        @DisplayName("JSON output should use snake_case fields")
        void testJson() {
            run("-c", "HSBC", "--csv", csv.toString(), "--json");

            String output = out.toString();
            assertTrue(output.contains("\"query\" : \"HSBC\""));
            assertTrue(output.contains("\"match_score\" : 0.9"));
            assertFalse(output.contains("Searching for"));
        }
    }

    @Nested
    @DisplayName("URL analysis")
    class UrlAnalysis {

        @Test
        @DisplayName("Should detect the company and search for it")
        void testDetected() {
            int exitCode = run("--url", "https://www.linkedin.com/company/monzo-bank", "--csv", csv.toString());

            String output = out.toString();
            assertEquals(0, exitCode);
            assertTrue(output.contains("Detected company: 'Monzo Bank'"));
            assertTrue(output.contains("Company: Monzo Bank Ltd"));
        }

        @Test
        @DisplayName("Refused URL should suggest searching by name")
        void testRefused() {
            run("-u", "https://www.linkedin.com/jobs/view/123456", "--csv", csv.toString());

            String output = out.toString();
            assertTrue(output.contains("Could not extract company name from URL"));
            assertTrue(output.contains("Try using --company"));
        }

        @Test
        @DisplayName("JSON output should carry the extraction source")
        void testJson() {
            run("-u", "https://www.linkedin.com/company/monzo-bank", "--csv", csv.toString(), "--json");

            String output = out.toString();
            assertTrue(output.contains("\"extracted_company\" : \"Monzo Bank\""));
            assertTrue(output.contains("\"is_sponsor\" : true"));
        }
    }

    @Nested
    @DisplayName("Interactive mode")
    class Interactive {

        @Test
        @DisplayName("Should answer each query until quit")
        void testSession() {
            int exitCode = run(new StringReader("HSBC\n\nInitech\nquit\nTesco\n"), "-i", "--csv", csv.toString());

            String output = out.toString();
            assertEquals(0, exitCode);
            assertTrue(output.contains("UK SPONSOR LOOKUP - Interactive Mode"));
            assertTrue(output.contains("Company: HSBC UK Bank PLC"));
            assertTrue(output.contains("No matching sponsors found"));
            assertFalse(output.contains("Tesco Stores Limited"));
            assertFalse(output.contains("Goodbye!"));
        }

        @Test
        @DisplayName("End of input should say goodbye")
        void testEndOfInput() {
            run(new StringReader("Monzo\n"), "--interactive", "--csv", csv.toString());

            String output = out.toString();
            assertTrue(output.contains("Company: Monzo Bank Ltd"));
            assertTrue(output.contains("Goodbye!"));
        }

        @Test
        @DisplayName("Should show at most three results per query")
        void testResultLimit() {
            run(new StringReader("Bank\n"), "-i", "--csv", csv.toString());

            long shown = out.toString().lines().filter(line -> line.contains("(Match: ")).count();
            assertEquals(SponsorLookupCli.INTERACTIVE_RESULTS, shown);
        }
    }
}
