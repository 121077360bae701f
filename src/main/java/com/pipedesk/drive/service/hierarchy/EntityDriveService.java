package com.pipedesk.drive.service.hierarchy;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.entity.FileMappingEntity;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.cache.FolderListingService;
import com.pipedesk.drive.service.db.impl.FileMappingService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * File level access to an entity's folder. The folder is ensured first, so callers never deal
 * with unmapped entities.
 */
@Slf4j
@Service
public class EntityDriveService {

    private final HierarchyService hierarchyService;

    private final FolderListingService folderListingService;

    private final FileMappingService fileMappingService;

    @Autowired
    public EntityDriveService(
            HierarchyService hierarchyService,
            FolderListingService folderListingService,
            FileMappingService fileMappingService) {
        this.hierarchyService = hierarchyService;
        this.folderListingService = folderListingService;
        this.fileMappingService = fileMappingService;
    }

    public List<StoreItem> listEntityFolder(EntityTypeEnum entityType, String entityId) {
        FolderMappingEntity mapping = this.hierarchyService.ensureStructure(entityType, entityId);
        return this.folderListingService.listChildren(mapping.getExternalFolderId());
    }

    public FileMappingEntity uploadFile(
            EntityTypeEnum entityType,
            String entityId,
            byte[] content,
            String fileName,
            String mimeType) {
        if (ObjectUtils.isEmpty(content) || StringUtils.isBlank(fileName)) {
            throw new ValidationException("uploadFile failed. content or fileName is empty. " +
                    "fileName is %s".formatted(fileName));
        }
        FolderMappingEntity mapping = this.hierarchyService.ensureStructure(entityType, entityId);
        StoreItem storedFile = this.folderListingService.createFile(
                content, fileName.trim(), mimeType, mapping.getExternalFolderId());
        FileMappingEntity fileMappingEntity =
                this.fileMappingService.recordUpload(storedFile, mapping.getExternalFolderId());
        log.info("uploaded '{}' ({} bytes) to {} {}", fileName, content.length, entityType.getCode(), entityId);
        return fileMappingEntity;
    }
}
