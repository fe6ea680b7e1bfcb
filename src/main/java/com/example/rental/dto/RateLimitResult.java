package com.example.rental.dto;

/**
 * @param allowed        the attempt fits into the window
 * @param firstRejection this is the first refused attempt of the window; only it gets a reply
 */
public record RateLimitResult(boolean allowed, boolean firstRejection) {
}
