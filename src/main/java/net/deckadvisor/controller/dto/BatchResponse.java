package net.deckadvisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.BatchState;
import net.deckadvisor.service.BatchStatus;

/**
 * One slice of a batch session plus the session's progress.
 */
public record BatchResponse(
    List<Recommendation> recommendations,
    BatchStatus status,
    @JsonProperty("returned_count") int returnedCount,
    @JsonProperty("requested_so_far") int requestedSoFar
) {
    public static BatchResponse of(List<Recommendation> recommendations, BatchState state) {
        return new BatchResponse(recommendations, state.getStatus(), state.getReturnedCount(), state.getRequestedSoFar());
    }
}
