package com.pipedesk.drive.service.hierarchy;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.MappingConflictException;
import com.pipedesk.drive.exception.ResourceNotFoundException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import com.pipedesk.drive.model.internal.EntityFolderContext;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.cache.FolderListingService;
import com.pipedesk.drive.service.db.impl.EntityRecordService;
import com.pipedesk.drive.service.db.impl.FolderMappingService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Keeps one external folder per company, lead and deal.
 *
 * <p>Layout in the store:
 * <pre>
 * root
 *   Companies                      (system_root mapping)
 *     &lt;company&gt;                    (company mapping)
 *       01. Leads / Lead - &lt;name&gt;   (lead mapping)
 *       02. Deals / Deal - &lt;title&gt;  (deal mapping)
 * </pre>
 * Leads and deals without a company sit directly under "Companies".
 *
 * <p>No lock is held while the store is called. Concurrent callers for the same entity may each
 * create a folder; the unique index on the mapping table lets exactly one of them record it and the
 * others return the recorded row. Their folders stay behind unused.
 */
@Slf4j
@Service
public class HierarchyService {

    public static final String SYSTEM_ROOT_ENTITY_ID = "00000000-0000-0000-0000-000000000001";

    public static final String SYSTEM_ROOT_FOLDER_NAME = "Companies";

    public static final String FOLDER_MISSING_REASON = "folder missing in store";

    private static final String SYSTEM_USER = "System";

    private final FolderMappingService folderMappingService;

    private final EntityRecordService entityRecordService;

    private final FolderListingService folderListingService;

    private final TemplateMaterializerService templateMaterializerService;

    @Value("${pipedesk.drive.root-folder-id:}")
    private String rootFolderId;

    @Value("${pipedesk.drive.mapping.validate-on-read:false}")
    private boolean validateOnRead;

    @Value("${pipedesk.drive.template.apply-in-background:false}")
    private boolean applyTemplateInBackground;

    @Autowired
    public HierarchyService(
            FolderMappingService folderMappingService,
            EntityRecordService entityRecordService,
            FolderListingService folderListingService,
            TemplateMaterializerService templateMaterializerService) {
        this.folderMappingService = folderMappingService;
        this.entityRecordService = entityRecordService;
        this.folderListingService = folderListingService;
        this.templateMaterializerService = templateMaterializerService;
    }

    /**
     * Returns the live mapping of the entity, creating its folder, the missing ancestors and the
     * template subtree first when the entity has none yet. Repeated calls return the same row.
     *
     * @throws ResourceNotFoundException when an unmapped entity does not exist
     * @throws com.pipedesk.drive.exception.StoreUnavailableException when the store failed; no
     *         mapping was written for the entity in that case
     */
    public FolderMappingEntity ensureStructure(EntityTypeEnum entityType, String entityId) {
        if (ObjectUtils.isEmpty(entityType) || StringUtils.isBlank(entityId)) {
            throw new ValidationException("ensureStructure failed. entityType or entityId is empty. " +
                    "entityType is %s, entityId is %s".formatted(entityType, entityId));
        }
        if (entityType == EntityTypeEnum.SYSTEM_ROOT) {
            if (!SYSTEM_ROOT_ENTITY_ID.equals(entityId)) {
                throw new ValidationException("ensureStructure failed. unknown system root %s".formatted(entityId));
            }
            return this.getOrCreateSystemRoot();
        }
        FolderMappingEntity existing = this.findLiveMapping(entityType, entityId);
        if (ObjectUtils.isNotEmpty(existing)) {
            return existing;
        }
        EntityFolderContext context = this.entityRecordService.getFolderContext(entityType, entityId);
        String parentFolderId = this.resolveParentFolderId(context);
        StoreItem folder = this.folderListingService.createFolder(context.getFolderName(), parentFolderId);
        return this.recordMapping(entityType, entityId, folder, true);
    }

    /**
     * The shared "Companies" folder under the configured store root. It is found by name before it
     * is created, so a folder left by an earlier installation is adopted.
     */
    public FolderMappingEntity getOrCreateSystemRoot() {
        FolderMappingEntity existing = this.findLiveMapping(EntityTypeEnum.SYSTEM_ROOT, SYSTEM_ROOT_ENTITY_ID);
        if (ObjectUtils.isNotEmpty(existing)) {
            return existing;
        }
        if (StringUtils.isBlank(this.rootFolderId)) {
            throw new ValidationException("getOrCreateSystemRoot failed. pipedesk.drive.root-folder-id is not set");
        }
        StoreItem folder = this.folderListingService.findChildFolder(
                this.rootFolderId, SYSTEM_ROOT_FOLDER_NAME, false);
        if (ObjectUtils.isEmpty(folder)) {
            folder = this.folderListingService.createFolder(SYSTEM_ROOT_FOLDER_NAME, this.rootFolderId);
        } else {
            log.info("adopting existing '{}' folder {}", SYSTEM_ROOT_FOLDER_NAME, folder.getId());
        }
        return this.recordMapping(EntityTypeEnum.SYSTEM_ROOT, SYSTEM_ROOT_ENTITY_ID, folder, false);
    }

    /**
     * Applies the entity's template again to its mapped folder, listing every level straight from
     * the store. The entity folder itself is never recreated.
     *
     * @return false when the entity has no live mapping or its folder is gone from the store
     */
    public boolean repairStructure(EntityTypeEnum entityType, String entityId) {
        if (ObjectUtils.isEmpty(entityType) || StringUtils.isBlank(entityId)) {
            throw new ValidationException("repairStructure failed. entityType or entityId is empty. " +
                    "entityType is %s, entityId is %s".formatted(entityType, entityId));
        }
        FolderMappingEntity mapping = this.folderMappingService.findByEntity(entityType, entityId);
        if (ObjectUtils.isEmpty(mapping)) {
            log.info("repairStructure skipped. {} {} has no folder yet", entityType.getCode(), entityId);
            return false;
        }
        StoreItem folder = this.folderListingService.getItem(mapping.getExternalFolderId());
        if (ObjectUtils.isEmpty(folder) || folder.isTrashed()) {
            log.warn("repairStructure skipped. folder {} of {} {} is missing in store, " +
                            "retire the mapping to rebuild it",
                    mapping.getExternalFolderId(), entityType.getCode(), entityId);
            return false;
        }
        if (!entityType.isBusinessEntity()) {
            return true;
        }
        int created = this.templateMaterializerService.applyTemplate(
                entityType, mapping.getExternalFolderId(), true);
        log.info("repairStructure done for {} {}. {} folders recreated", entityType.getCode(), entityId, created);
        return true;
    }

    /**
     * Renames the mapped folder when the entity's display name changed.
     *
     * @return true when the folder was renamed
     */
    public boolean syncFolderName(EntityTypeEnum entityType, String entityId) {
        if (ObjectUtils.isEmpty(entityType) || !entityType.isBusinessEntity() || StringUtils.isBlank(entityId)) {
            throw new ValidationException("syncFolderName failed. entityType or entityId is invalid. " +
                    "entityType is %s, entityId is %s".formatted(entityType, entityId));
        }
        FolderMappingEntity mapping = this.folderMappingService.findByEntity(entityType, entityId);
        if (ObjectUtils.isEmpty(mapping)) {
            return false;
        }
        EntityFolderContext context = this.entityRecordService.getFolderContext(entityType, entityId);
        StoreItem folder = this.folderListingService.getItem(mapping.getExternalFolderId());
        if (ObjectUtils.isEmpty(folder)) {
            log.warn("syncFolderName skipped. folder {} of {} {} is missing in store",
                    mapping.getExternalFolderId(), entityType.getCode(), entityId);
            return false;
        }
        if (context.getFolderName().equals(StringUtils.trim(folder.getName()))) {
            return false;
        }
        this.folderListingService.renameItem(folder.getId(), context.getFolderName());
        log.info("renamed folder {} of {} {} from '{}' to '{}'",
                folder.getId(), entityType.getCode(), entityId, folder.getName(), context.getFolderName());
        return true;
    }

    /**
     * Soft deletes the live mapping. The folder in the store is left untouched; a later
     * {@link #ensureStructure} for the same entity creates a new folder under a new mapping.
     *
     * @return the retired row, or null when nothing was mapped
     */
    public FolderMappingEntity retireMapping(
            EntityTypeEnum entityType,
            String entityId,
            String deletedBy,
            String reason) {
        return this.folderMappingService.retireMapping(entityType, entityId, deletedBy, reason);
    }

    private FolderMappingEntity findLiveMapping(EntityTypeEnum entityType, String entityId) {
        FolderMappingEntity mapping = this.folderMappingService.findByEntity(entityType, entityId);
        if (ObjectUtils.isEmpty(mapping) || !this.validateOnRead) {
            return mapping;
        }
        StoreItem folder = this.folderListingService.getItem(mapping.getExternalFolderId());
        if (ObjectUtils.isNotEmpty(folder) && !folder.isTrashed()) {
            return mapping;
        }
        log.warn("folder {} of {} {} is missing in store. retiring the mapping",
                mapping.getExternalFolderId(), entityType.getCode(), entityId);
        this.folderMappingService.retireMapping(entityType, entityId, SYSTEM_USER, FOLDER_MISSING_REASON);
        return null;
    }

    private String resolveParentFolderId(EntityFolderContext context) {
        if (context.getEntityType() == EntityTypeEnum.COMPANY) {
            return this.getOrCreateSystemRoot().getExternalFolderId();
        }
        String companyId = context.getCompanyId();
        if (StringUtils.isBlank(companyId)) {
            log.warn("{} {} has no company. creating its folder under '{}'",
                    context.getEntityType().getCode(), context.getEntityId(), SYSTEM_ROOT_FOLDER_NAME);
            return this.getOrCreateSystemRoot().getExternalFolderId();
        }
        FolderMappingEntity companyMapping;
        try {
            companyMapping = this.ensureStructure(EntityTypeEnum.COMPANY, companyId);
        } catch (ResourceNotFoundException e) {
            log.warn("{} {} points at missing company {}. creating its folder under '{}'",
                    context.getEntityType().getCode(), context.getEntityId(), companyId, SYSTEM_ROOT_FOLDER_NAME);
            return this.getOrCreateSystemRoot().getExternalFolderId();
        }
        return this.getOrCreateStructuralFolder(
                companyMapping.getExternalFolderId(),
                context.getEntityType().getStructuralFolderName());
    }

    // first folder with the name wins
    private String getOrCreateStructuralFolder(String companyFolderId, String structuralFolderName) {
        StoreItem folder = this.folderListingService.findChildFolder(companyFolderId, structuralFolderName, false);
        if (ObjectUtils.isNotEmpty(folder)) {
            return folder.getId();
        }
        return this.folderListingService.createFolder(structuralFolderName, companyFolderId).getId();
    }

    private FolderMappingEntity recordMapping(
            EntityTypeEnum entityType,
            String entityId,
            StoreItem folder,
            boolean applyTemplate) {
        FolderMappingEntity inserted;
        try {
            inserted = this.folderMappingService.insertMapping(entityType, entityId, folder.getId(), folder.getUrl());
        } catch (MappingConflictException e) {
            FolderMappingEntity winner = this.folderMappingService.findByEntity(entityType, entityId);
            if (ObjectUtils.isEmpty(winner)) {
                // the conflict was not on the entity key
                throw e;
            }
            log.warn("lost the mapping race for {} {}. using folder {}, folder {} is left orphaned",
                    entityType.getCode(), entityId, winner.getExternalFolderId(), folder.getId());
            return winner;
        }
        if (applyTemplate) {
            if (this.applyTemplateInBackground) {
                this.templateMaterializerService.applyTemplateInBackground(entityType, inserted.getExternalFolderId());
            } else {
                this.templateMaterializerService.applyTemplate(entityType, inserted.getExternalFolderId());
            }
        }
        return inserted;
    }
}
