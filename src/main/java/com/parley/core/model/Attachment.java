package com.parley.core.model;

/**
 * Media attached to an inbound message, already downloaded by the platform adapter.
 *
 * @param type     e.g. "photo", "document", "voice"
 * @param filePath path visible to the worker
 * @param fileName original file name, may be null
 * @param fileSize size in bytes, may be null
 * @param mimeType may be null
 */
public record Attachment(
    String type,
    String filePath,
    String fileName,
    Long fileSize,
    String mimeType
) {}
