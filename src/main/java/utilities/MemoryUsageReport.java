package utilities;

/** JOL report text for a suffix tree together with its retained size. */
public record MemoryUsageReport(String report, long totalBytes, double totalMiB) {}
