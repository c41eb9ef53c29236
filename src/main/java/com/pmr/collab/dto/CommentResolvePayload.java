package com.pmr.collab.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommentResolvePayload implements WirePayload {
    private String commentId;

    @Override
    public void validate() {
        WirePayload.require(commentId, "comment_id");
    }
}
