package org.calista.decipher.graph;

/**
 * Partitions a graph into non-overlapping communities.
 *
 * Implementations must be deterministic and must place every node in exactly one community.
 */
public interface CommunityDetector {

    CommunityPartition detect(CooccurrenceGraph graph);
}
