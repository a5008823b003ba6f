package com.sponsor.lookup.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sponsor.lookup.api.LookupOptions;
import com.sponsor.lookup.api.SponsorLookup;
import com.sponsor.lookup.api.UrlCheckResult;
import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.format.SponsorResultFormatter;
import com.sponsor.lookup.registry.DataSourceException;
import com.sponsor.lookup.rest.dto.SearchResponse;
import com.sponsor.lookup.rest.dto.UrlCheckResponse;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
    name = "sponsor-lookup",
    mixinStandardHelpOptions = true,
    version = "sponsor-lookup 1.0.0",
    description = "UK Visa Sponsor Lookup Tool",
    footer = {
        "",
        "Examples:",
        "  sponsor-lookup --company \"Google UK\"",
        "  sponsor-lookup --url \"https://www.linkedin.com/company/monzo-bank\"",
        "  sponsor-lookup --interactive"
    }
)
public class SponsorLookupCli implements Callable<Integer> {

    static final String DOWNLOAD_HINT =
        "Download from: https://www.gov.uk/government/publications/register-of-licensed-sponsors-workers";
    static final int INTERACTIVE_RESULTS = 3;
    private static final Set<String> QUIT_COMMANDS = Set.of("quit", "exit", "q");
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--company"}, description = "Company name to search")
    private String company;

    @Option(names = {"-u", "--url"}, description = "Job posting URL to analyze")
    private String url;

    @Option(names = {"-i", "--interactive"}, description = "Interactive mode")
    private boolean interactive;

    @Option(names = {"--csv"}, description = "Path to sponsor CSV file", defaultValue = "uk_sponsors.csv")
    private Path csv;

    @Option(names = {"-t", "--threshold"}, description = "Match threshold (0-1)", defaultValue = "0.5")
    private double threshold;

    @Option(names = {"--limit"}, description = "Results to show", defaultValue = "5")
    private int limit;

    @Option(names = {"--json"}, description = "Print JSON instead of text", defaultValue = "false")
    private boolean json;

    private final Reader input;

    public SponsorLookupCli() {
        this(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    public SponsorLookupCli(Reader input) {
        this.input = input;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SponsorLookupCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (company == null && url == null && !interactive) {
            spec.commandLine().usage(out);
            return 0;
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--threshold must be between 0.0 and 1.0, got " + threshold);
        }
        if (limit <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--limit must be positive");
        }

        SponsorLookup lookup;
        try {
            lookup = SponsorLookup.builder()
                .csvPath(csv)
                .options(LookupOptions.builder().searchThreshold(threshold).build())
                .build();
        } catch (DataSourceException e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Error: " + e.getMessage());
            err.println(DOWNLOAD_HINT);
            return 1;
        }

        if (company != null) {
            return searchCompany(lookup, company.strip(), out);
        } else if (url != null) {
            return analyzeUrl(lookup, url.strip(), out);
        }
        return runInteractive(lookup, out);
    }

    private int searchCompany(SponsorLookup lookup, String query, PrintWriter out) {
        List<MatchResult> results = lookup.search(query, threshold, limit);
        if (json) {
            return printJson(SearchResponse.from(query, results), out);
        }
        out.println();
        out.println("Searching for: '" + query + "'");
        out.println();
        printResults(results, out);
        return 0;
    }

    private int analyzeUrl(SponsorLookup lookup, String jobUrl, PrintWriter out) {
        if (json) {
            UrlCheckResult result = lookup.checkUrl(jobUrl);
            return printJson(UrlCheckResponse.from(result), out);
        }
        out.println();
        out.println("Analyzing URL: " + jobUrl);
        out.println();

        String detected = lookup.extractCompany(jobUrl).orElse(null);
        if (detected == null) {
            out.println("Could not extract company name from URL");
            out.println("Try using --company with the company name directly");
            return 0;
        }
        out.println("Detected company: '" + detected + "'");
        out.println();
        printResults(lookup.search(detected, threshold, limit), out);
        return 0;
    }

    private int runInteractive(SponsorLookup lookup, PrintWriter out) {
        String banner = "=".repeat(50);
        out.println();
        out.println(banner);
        out.println("   UK SPONSOR LOOKUP - Interactive Mode");
        out.println(banner);
        out.println("Enter a company name or 'quit' to exit");
        out.println();

        BufferedReader reader = input instanceof BufferedReader
            ? (BufferedReader) input : new BufferedReader(input);
        try {
            while (true) {
                out.print("Company name > ");
                out.flush();
                String line = reader.readLine();
                if (line == null) {
                    out.println();
                    out.println("Goodbye!");
                    break;
                }
                String query = line.strip();
                if (QUIT_COMMANDS.contains(query.toLowerCase(Locale.ROOT))) {
                    break;
                }
                if (query.isEmpty()) {
                    continue;
                }

                List<MatchResult> results = lookup.search(query, threshold, INTERACTIVE_RESULTS);
                if (results.isEmpty()) {
                    out.println("No matching sponsors found");
                    out.println();
                    continue;
                }
                for (MatchResult match : results) {
                    out.println(SponsorResultFormatter.format(match));
                    out.println();
                }
                out.println(SponsorResultFormatter.verdict(results.get(0).score()));
                out.println();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        }
        out.flush();
        return 0;
    }

    private static void printResults(List<MatchResult> results, PrintWriter out) {
        if (results.isEmpty()) {
            out.println("No matching sponsors found");
            out.flush();
            return;
        }
        for (MatchResult match : results) {
            out.println(SponsorResultFormatter.format(match));
            out.println();
        }
        out.println(SponsorResultFormatter.RULE);
        out.println(SponsorResultFormatter.verdict(results.get(0).score()));
        out.println(SponsorResultFormatter.RULE);
        out.flush();
    }

    private static int printJson(Object response, PrintWriter out) {
        try {
            out.println(MAPPER.writeValueAsString(response));
            out.flush();
            return 0;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
