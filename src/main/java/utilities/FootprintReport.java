package utilities;

/** JOL footprint text for a suffix tree together with its total size in MiB and node count. */
public record FootprintReport(String report, double totalMiB, int nodeCount) {}
