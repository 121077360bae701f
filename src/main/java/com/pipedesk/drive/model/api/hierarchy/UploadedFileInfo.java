package com.pipedesk.drive.model.api.hierarchy;

import com.pipedesk.drive.model.entity.FileMappingEntity;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class UploadedFileInfo {

    private String fileId;

    private String folderId;

    private String fileName;

    private String mimeType;

    private Long size;

    public UploadedFileInfo(FileMappingEntity fileMappingEntity) {
        this.fileId = fileMappingEntity.getExternalFileId();
        this.folderId = fileMappingEntity.getParentFolderId();
        this.fileName = fileMappingEntity.getFileName();
        this.mimeType = fileMappingEntity.getMimeType();
        this.size = fileMappingEntity.getFileSize();
    }
}
