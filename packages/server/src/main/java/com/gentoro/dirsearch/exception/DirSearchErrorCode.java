package com.gentoro.dirsearch.exception;

/**
 * Canonical error codes for DirSearch. Inspired by Google/RPC style codes. Codes are stable and
 * suitable for tool results and logs; prefer the most specific code that reflects the failure
 * origin.
 */
public enum DirSearchErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  RESOURCE_EXHAUSTED,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Domain specific
  EXECUTION_ERROR,
  INDEX_ERROR,
  QUERY_ERROR,
}
