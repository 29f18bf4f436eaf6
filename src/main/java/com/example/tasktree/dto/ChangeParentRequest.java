package com.example.tasktree.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeParentRequest {
    // null detaches the task and makes it a root
    @JsonProperty("parent_id")
    private Long parentId;
}
