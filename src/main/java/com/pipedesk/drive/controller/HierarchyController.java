package com.pipedesk.drive.controller;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.api.global.DriveHttpResponse;
import com.pipedesk.drive.model.api.hierarchy.EntityRefRequest;
import com.pipedesk.drive.model.api.hierarchy.FolderMappingInfo;
import com.pipedesk.drive.model.api.hierarchy.RetireMappingRequest;
import com.pipedesk.drive.model.api.hierarchy.UploadedFileInfo;
import com.pipedesk.drive.model.entity.FileMappingEntity;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.hierarchy.EntityDriveService;
import com.pipedesk.drive.service.hierarchy.HierarchyService;
import com.pipedesk.drive.util.EntityValidationUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;


@RestController
@RequestMapping("/hierarchy")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class HierarchyController {

    private final HierarchyService hierarchyService;

    private final EntityDriveService entityDriveService;

    @Autowired
    public HierarchyController(HierarchyService hierarchyService, EntityDriveService entityDriveService) {
        this.hierarchyService = hierarchyService;
        this.entityDriveService = entityDriveService;
    }

    @PostMapping("/ensure-structure")
    public DriveHttpResponse<FolderMappingInfo> ensureStructure(@RequestBody EntityRefRequest entityRefRequest) {
        EntityValidationUtil.isEntityRefRequestValid(entityRefRequest);
        FolderMappingEntity mapping = this.hierarchyService.ensureStructure(
                entityRefRequest.getEntityTypeInner(),
                entityRefRequest.getEntityId());
        return DriveHttpResponse.success(new FolderMappingInfo(mapping));
    }

    @PostMapping("/repair-structure")
    public DriveHttpResponse<Boolean> repairStructure(@RequestBody EntityRefRequest entityRefRequest) {
        EntityValidationUtil.isEntityRefRequestValid(entityRefRequest);
        boolean repaired = this.hierarchyService.repairStructure(
                entityRefRequest.getEntityTypeInner(),
                entityRefRequest.getEntityId());
        return repaired ?
                DriveHttpResponse.success(true) :
                DriveHttpResponse.success(false, "entity has no folder to repair");
    }

    @PostMapping("/sync-folder-name")
    public DriveHttpResponse<Boolean> syncFolderName(@RequestBody EntityRefRequest entityRefRequest) {
        EntityValidationUtil.isEntityRefRequestValid(entityRefRequest);
        return DriveHttpResponse.success(this.hierarchyService.syncFolderName(
                entityRefRequest.getEntityTypeInner(),
                entityRefRequest.getEntityId()));
    }

    @PostMapping("/retire-mapping")
    public DriveHttpResponse<FolderMappingInfo> retireMapping(
            @RequestBody RetireMappingRequest retireMappingRequest) {
        EntityValidationUtil.isRetireMappingRequestValid(retireMappingRequest);
        FolderMappingEntity retired = this.hierarchyService.retireMapping(
                retireMappingRequest.getEntityTypeInner(),
                retireMappingRequest.getEntityId(),
                retireMappingRequest.getDeletedBy(),
                retireMappingRequest.getReason());
        if (ObjectUtils.isEmpty(retired)) {
            return DriveHttpResponse.success(null, "entity has no live mapping");
        }
        return DriveHttpResponse.success(new FolderMappingInfo(retired));
    }

    @GetMapping("/{entityType}/{entityId}/items")
    public DriveHttpResponse<List<StoreItem>> listItems(
            @PathVariable("entityType") String entityType,
            @PathVariable("entityId") String entityId) {
        EntityTypeEnum entityTypeEnum = EntityValidationUtil.parseEntityType(entityType, entityId);
        return DriveHttpResponse.success(this.entityDriveService.listEntityFolder(entityTypeEnum, entityId));
    }

    @PostMapping("/{entityType}/{entityId}/upload")
    public DriveHttpResponse<UploadedFileInfo> upload(
            @PathVariable("entityType") String entityType,
            @PathVariable("entityId") String entityId,
            @RequestParam("file") MultipartFile file) {
        EntityTypeEnum entityTypeEnum = EntityValidationUtil.parseEntityType(entityType, entityId);
        if (ObjectUtils.isEmpty(file) || file.isEmpty()) {
            throw new ValidationException("upload failed. file is empty");
        }
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new ValidationException("upload failed. can't read file %s".formatted(file.getOriginalFilename()), e);
        }
        FileMappingEntity fileMappingEntity = this.entityDriveService.uploadFile(
                entityTypeEnum,
                entityId,
                content,
                file.getOriginalFilename(),
                file.getContentType());
        return DriveHttpResponse.success(new UploadedFileInfo(fileMappingEntity));
    }
}
