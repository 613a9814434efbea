package com.example.changefeed.controller;

final class Paging {

    private Paging() {
    }

    static void check(int limit, int offset, int maxLimit) {
        if (limit < 1 || limit > maxLimit) {
            throw new IllegalArgumentException("limit must be between 1 and " + maxLimit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }
}
