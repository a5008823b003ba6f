package com.sponsor.lookup.rest;

import com.sponsor.lookup.api.SponsorLookup;
import com.sponsor.lookup.api.UrlCheckResult;
import com.sponsor.lookup.core.model.MatchResult;
import com.sponsor.lookup.health.HealthStatus;
import com.sponsor.lookup.rest.dto.CheckResponse;
import com.sponsor.lookup.rest.dto.ErrorResponse;
import com.sponsor.lookup.rest.dto.HealthResponse;
import com.sponsor.lookup.rest.dto.SearchResponse;
import com.sponsor.lookup.rest.dto.StatsResponse;
import com.sponsor.lookup.rest.dto.UrlCheckRequest;
import com.sponsor.lookup.rest.dto.UrlCheckResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST resource for sponsor lookups.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Searching the register by company name</li>
 *   <li>Checking a single company or a job posting URL</li>
 *   <li>Registry statistics and health</li>
 * </ul>
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Sponsor Lookup", description = "Search and check licensed UK visa sponsors")
public class SponsorLookupResource {
    private static final Logger log = LoggerFactory.getLogger(SponsorLookupResource.class);
    private static final String INTERNAL_ERROR = "An internal error occurred. Check server logs for details.";
    static final String COMPANY_REQUIRED = "Company name required";
    static final String URL_REQUIRED = "URL required in JSON body";

    private final SponsorLookup lookup;

    @Inject
    public SponsorLookupResource(SponsorLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * GET /api/health
     */
    @GET
    @Path("/health")
    @Operation(summary = "Health check", description = "Reports whether the sponsor register is loaded.")
    @APIResponse(responseCode = "200", description = "Registry loaded")
    @APIResponse(responseCode = "503", description = "Registry unavailable")
    public Response health() {
        HealthStatus health = lookup.health();
        Response.Status status = health.status() == HealthStatus.Status.DOWN
                ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK;
        return Response.status(status)
                .entity(HealthResponse.from(health, lookup.getRegistry().size()))
                .build();
    }

    /**
     * Searches sponsors by name, one result per company.
     *
     * GET /api/search?company=NAME&amp;threshold=0.5&amp;limit=10
     */
    @GET
    @Path("/search")
    @Operation(summary = "Search sponsors by name",
            description = "Fuzzy search returning the best match per company name with external search links.")
    @APIResponse(responseCode = "200", description = "Search completed (may be empty)")
    @APIResponse(responseCode = "400", description = "Missing company name or invalid parameters")
    public Response search(
            @Parameter(description = "Company name") @QueryParam("company") String company,
            @Parameter(description = "Minimum score in [0, 1]") @QueryParam("threshold") Double threshold,
            @Parameter(description = "Maximum number of results") @QueryParam("limit") Integer limit) {
        String path = "/api/search";
        try {
            String query = requireCompany(company);
            double effectiveThreshold = threshold != null ? threshold : lookup.getOptions().getSearchThreshold();
            int effectiveLimit = limit != null ? limit : lookup.getOptions().getMaxResults();
            validate(effectiveThreshold, effectiveLimit);

            List<MatchResult> results = lookup.searchDeduplicated(query, effectiveThreshold, effectiveLimit);
            return Response.ok(SearchResponse.from(query, results)).build();

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage(), path);
        } catch (Exception e) {
            log.error("search.failed company='{}' error={}", company, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * Quick yes/no check for a company.
     *
     * GET /api/check?company=NAME&amp;threshold=0.8
     */
    @GET
    @Path("/check")
    @Operation(summary = "Check if a company is a sponsor",
            description = "Returns the matching sponsor if its score reaches the threshold.")
    @APIResponse(responseCode = "200", description = "Check completed")
    @APIResponse(responseCode = "400", description = "Missing company name or invalid threshold")
    public Response check(
            @Parameter(description = "Company name") @QueryParam("company") String company,
            @Parameter(description = "Minimum score in [0, 1]") @QueryParam("threshold") Double threshold) {
        String path = "/api/check";
        try {
            String query = requireCompany(company);
            double effectiveThreshold = threshold != null ? threshold : lookup.getOptions().getCheckThreshold();
            validate(effectiveThreshold, 1);

            Optional<MatchResult> match = lookup.check(query, effectiveThreshold);
            return Response.ok(match.map(CheckResponse::found).orElseGet(CheckResponse::notFound)).build();

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage(), path);
        } catch (Exception e) {
            log.error("check.failed company='{}' error={}", company, e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * Extracts the company from a job posting URL and checks it.
     *
     * POST /api/url
     */
    @POST
    @Path("/url")
    @Operation(summary = "Check a job posting URL",
            description = "Extracts the hiring company from a job board or careers URL and checks it.")
    @APIResponse(responseCode = "200", description = "URL processed")
    @APIResponse(responseCode = "400", description = "Missing URL")
    public Response checkUrl(UrlCheckRequest request) {
        String path = "/api/url";
        if (request == null || request.url() == null || request.url().isBlank()) {
            return badRequest(URL_REQUIRED, path);
        }
        try {
            UrlCheckResult result = lookup.checkUrl(request.url().strip());
            return Response.ok(UrlCheckResponse.from(result)).build();
        } catch (Exception e) {
            log.error("checkUrl.failed url={} error={}", request.url(), e.getMessage(), e);
            return internalError(path);
        }
    }

    /**
     * GET /api/stats
     */
    @GET
    @Path("/stats")
    @Operation(summary = "Registry statistics",
            description = "Sponsor counts, the most common routes and the rating distribution.")
    public Response stats() {
        try {
            return Response.ok(StatsResponse.from(lookup.statistics(),
                    lookup.getMetricsService().queryCount())).build();
        } catch (Exception e) {
            log.error("stats.failed error={}", e.getMessage(), e);
            return internalError("/api/stats");
        }
    }

    /**
     * GET /api
     */
    @GET
    @Operation(summary = "API information", description = "Lists the available endpoints.")
    public Response info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/api/health", "Health check");
        endpoints.put("/api/search?company=NAME", "Search sponsors by name");
        endpoints.put("/api/check?company=NAME", "Quick check if sponsor");
        endpoints.put("/api/url", "POST - Extract company from URL and check");
        endpoints.put("/api/stats", "Database statistics");

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", "UK Sponsor Lookup API");
        info.put("version", "2.0");
        info.put("endpoints", endpoints);
        return Response.ok(info).build();
    }

    // ========== Helpers ==========

    private static String requireCompany(String company) {
        if (company == null || company.isBlank()) {
            throw new IllegalArgumentException(COMPANY_REQUIRED);
        }
        return company.strip();
    }

    private static void validate(double threshold, int limit) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    private static Response badRequest(String message, String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(message, path))
                .build();
    }

    private static Response internalError(String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                .build();
    }
}
