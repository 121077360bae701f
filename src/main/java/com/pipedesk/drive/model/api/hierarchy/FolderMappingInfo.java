package com.pipedesk.drive.model.api.hierarchy;

import com.pipedesk.drive.model.entity.FolderMappingEntity;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.ObjectUtils;

@Data
@NoArgsConstructor
public class FolderMappingInfo {

    private String entityType;

    private String entityId;

    private String folderId;

    private String folderUrl;

    private String createdAt = "";

    private String deletedAt = "";

    private String deleteReason;

    public FolderMappingInfo(FolderMappingEntity folderMappingEntity) {
        this.entityType = folderMappingEntity.getEntityType();
        this.entityId = folderMappingEntity.getEntityId();
        this.folderId = folderMappingEntity.getExternalFolderId();
        this.folderUrl = folderMappingEntity.getExternalFolderUrl();
        if (ObjectUtils.isNotEmpty(folderMappingEntity.getCreatedTime())) {
            this.createdAt = folderMappingEntity.getCreatedTime().toString();
        }
        if (ObjectUtils.isNotEmpty(folderMappingEntity.getDeletedAt())) {
            this.deletedAt = folderMappingEntity.getDeletedAt().toString();
        }
        this.deleteReason = folderMappingEntity.getDeleteReason();
    }
}
