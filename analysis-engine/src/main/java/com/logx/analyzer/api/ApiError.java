package com.logx.analyzer.api;

/**
 * Error body returned by the HTTP API.
 *
 * @param error   short machine-readable code
 * @param message human-readable description
 *
 * @author Naveed Gung
 */
public record ApiError(String error, String message) {
}
