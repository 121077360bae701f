package com.pipedesk.drive.model.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.pipedesk.drive.enums.StoreItemTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A folder or file as the external document store describes it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreItem {

    private String id;

    private String name;

    private StoreItemTypeEnum type;

    private String mimeType;

    private String url;

    private Long size;

    private Instant createdAt;

    // single parent in practice
    @Builder.Default
    private List<String> parents = new ArrayList<>();

    private boolean trashed;

    @JsonIgnore
    public boolean isFolder() {
        return this.type == StoreItemTypeEnum.FOLDER;
    }
}
