package com.pipedesk.drive.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDateTime;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("file_mapping")
public class FileMappingEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long fileMappingId;

    private String externalFileId;

    private String parentFolderId;

    private String fileName;

    private String mimeType;

    private Long fileSize;

    private LocalDateTime deletedAt;

    private String deletedBy;

    private String deleteReason;
}
