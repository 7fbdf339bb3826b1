package net.pagewise.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import net.pagewise.core.model.Submission;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitResponse(String lane, String processingMode, Long jobId, String status, Object result) {

    public static SubmitResponse from(Submission s) {
        return new SubmitResponse(
                s.lane().name(),
                s.processingMode(),
                s.jobId(),
                s.jobStatus() == null ? null : s.jobStatus().code(),
                s.inlineResult());
    }
}
