package com.sponsor.lookup.rest.dto;

/**
 * Request DTO for checking a job posting URL.
 */
public record UrlCheckRequest(String url) {
}
