package com.pipedesk.drive.model.api.hierarchy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pipedesk.drive.enums.EntityTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityRefRequest {

    private String entityType;

    private String entityId;

    @JsonIgnore
    private EntityTypeEnum entityTypeInner;
}
