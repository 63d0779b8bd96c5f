package mta.nzb.checker.model;

/**
 * FetchedNzb - Raw NZB payload together with the file name derived from the download.
 */
public record FetchedNzb(byte[] content, String fileName) {}
