package com.phodal.tracebrain.server.dto;

import com.phodal.tracebrain.model.Feedback;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    private Integer rating;

    private String comment;

    private List<String> tags;

    private Map<String, Object> metadata;

    public Feedback toFeedback() {
        return new Feedback(rating, comment, tags, metadata, null);
    }
}
