package com.lending.scope.aggregation;

/**
 * A chunk whose query did not complete. Its rows are missing from the merged result.
 *
 * @param chunkIndex       position of the chunk in execution order, from zero
 * @param idCount          number of entity ids in the chunk
 * @param restrictionCount number of restriction ids in the chunk (zero when unrestricted)
 * @param cause            failure description
 */
public record ChunkFailure(int chunkIndex, int idCount, int restrictionCount, String cause) {
}
