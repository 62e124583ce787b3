package com.gentoro.dirsearch.search;

/**
 * One search call.
 *
 * @param directory filesystem path of the directory to index; must name an existing directory
 * @param keyword search expression; must not be blank
 */
public record SearchRequest(String directory, String keyword) {}
