package com.vedant.queryguard.model;

/** Aggregate the caller can run instead of reading a blocked column directly. */
public record SafeAlternative(String original, String safe, String explanation) {}
