package com.flamingo.ai.studymind.service.storage;

/** A file written to object storage. */
public record StoredArtifact(String path, String url, long size, String contentType) {}
