package com.gentoro.dirsearch.exception;

import java.util.Map;

/**
 * Structured error information written to the log when a tool call fails.
 *
 * @param type simple class name of the failure
 * @param message caller facing message, never null
 * @param code stable error code; {@link DirSearchErrorCode#UNKNOWN} for foreign exceptions
 * @param context stage, path or keyword details carried by the exception
 */
public record ErrorDetails(
    String type, String message, DirSearchErrorCode code, Map<String, Object> context) {}
