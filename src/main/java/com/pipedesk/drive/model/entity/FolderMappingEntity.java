package com.pipedesk.drive.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

/**
 * The external folder that represents one entity. At most one live row exists per
 * (entityType, entityId); the unique index covers (entity_type, entity_id, delete_marker).
 */
@EqualsAndHashCode(callSuper = true)
@Data
@TableName("folder_mapping")
public class FolderMappingEntity extends BaseEntity {

    public static final long LIVE_MARKER = 0L;

    @TableId(type = IdType.AUTO)
    private Long folderMappingId;

    private String entityType;

    private String entityId;

    private String externalFolderId;

    private String externalFolderUrl;

    // deletedAt, deletedBy and deleteReason are set together or not at all
    private LocalDateTime deletedAt;

    private String deletedBy;

    private String deleteReason;

    // 0 while live, the row's own id once retired
    @TableField(fill = FieldFill.INSERT)
    private Long deleteMarker;

    public boolean isLive() {
        return this.deletedAt == null;
    }
}
