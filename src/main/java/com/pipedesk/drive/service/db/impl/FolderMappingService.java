package com.pipedesk.drive.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.DbException;
import com.pipedesk.drive.exception.MappingConflictException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.mapper.FolderMappingMapper;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import com.pipedesk.drive.service.db.IFolderMappingService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

@Service
@Slf4j
public class FolderMappingService
        extends ServiceImpl<FolderMappingMapper, FolderMappingEntity>
        implements IFolderMappingService {

    public FolderMappingEntity findByEntity(EntityTypeEnum entityType, String entityId) throws ValidationException {
        this.checkEntityKey(entityType, entityId);
        LambdaQueryWrapper<FolderMappingEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderMappingEntity::getEntityType, entityType.getCode());
        queryWrapper.eq(FolderMappingEntity::getEntityId, entityId);
        queryWrapper.eq(FolderMappingEntity::getDeleteMarker, FolderMappingEntity.LIVE_MARKER);
        List<FolderMappingEntity> dbResult = this.list(queryWrapper);
        if (CollectionUtils.isEmpty(dbResult)) {
            return null;
        }
        if (dbResult.size() > 1) {
            throw new DbException("FolderMapping has more than one live row. %s".formatted(dbResult));
        }
        return dbResult.get(0);
    }

    // live row first, then retired rows newest first
    public List<FolderMappingEntity> findByEntityIncludingDeleted(
            EntityTypeEnum entityType,
            String entityId) throws ValidationException {
        this.checkEntityKey(entityType, entityId);
        LambdaQueryWrapper<FolderMappingEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderMappingEntity::getEntityType, entityType.getCode());
        queryWrapper.eq(FolderMappingEntity::getEntityId, entityId);
        queryWrapper.orderByDesc(FolderMappingEntity::getFolderMappingId);
        List<FolderMappingEntity> dbResult = this.list(queryWrapper);
        if (CollectionUtils.isEmpty(dbResult)) {
            return Collections.emptyList();
        }
        // stable, keeps newest first within retired rows
        dbResult.sort(Comparator.comparing(FolderMappingEntity::isLive).reversed());
        return dbResult;
    }

    public FolderMappingEntity findByExternalFolderId(String externalFolderId) throws ValidationException {
        if (StringUtils.isBlank(externalFolderId)) {
            throw new ValidationException("findByExternalFolderId failed. externalFolderId is blank");
        }
        LambdaQueryWrapper<FolderMappingEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderMappingEntity::getExternalFolderId, externalFolderId);
        List<FolderMappingEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    /**
     * Inserts a live mapping in its own transaction.
     *
     * @throws MappingConflictException when a live mapping for the same entity already exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FolderMappingEntity insertMapping(
            EntityTypeEnum entityType,
            String entityId,
            String externalFolderId,
            String externalFolderUrl) throws MappingConflictException, ValidationException, DbException {
        this.checkEntityKey(entityType, entityId);
        if (StringUtils.isBlank(externalFolderId)) {
            throw new ValidationException("insertMapping failed. externalFolderId is blank");
        }
        FolderMappingEntity folderMappingEntity = new FolderMappingEntity();
        folderMappingEntity.setEntityType(entityType.getCode());
        folderMappingEntity.setEntityId(entityId);
        folderMappingEntity.setExternalFolderId(externalFolderId);
        folderMappingEntity.setExternalFolderUrl(externalFolderUrl);
        folderMappingEntity.setDeleteMarker(FolderMappingEntity.LIVE_MARKER);
        try {
            boolean saved = this.save(folderMappingEntity);
            if (!saved) {
                throw new DbException("insertMapping failed. can't save mapping to database. %s"
                        .formatted(folderMappingEntity));
            }
        } catch (DuplicateKeyException e) {
            throw new MappingConflictException("insertMapping failed. live mapping already exists. " +
                    "entityType is %s, entityId is %s".formatted(entityType.getCode(), entityId), e);
        }
        log.info("mapped {} {} to folder {}", entityType.getCode(), entityId, externalFolderId);
        return folderMappingEntity;
    }

    /**
     * Soft deletes the live mapping. The row stays; its delete marker moves off the live value so a
     * fresh mapping can be inserted for the same entity later.
     *
     * @return the retired row, or null when the entity had no live mapping
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FolderMappingEntity retireMapping(
            EntityTypeEnum entityType,
            String entityId,
            String deletedBy,
            String deleteReason) throws ValidationException, DbException {
        if (StringUtils.isAnyBlank(deletedBy, deleteReason)) {
            throw new ValidationException("retireMapping failed. deletedBy or deleteReason is blank");
        }
        FolderMappingEntity dbResult = this.findByEntity(entityType, entityId);
        if (ObjectUtils.isEmpty(dbResult)) {
            return null;
        }
        dbResult.setDeletedAt(LocalDateTime.now());
        dbResult.setDeletedBy(deletedBy);
        dbResult.setDeleteReason(deleteReason);
        dbResult.setDeleteMarker(dbResult.getFolderMappingId());
        boolean updated = this.updateById(dbResult);
        if (!updated) {
            throw new DbException("retireMapping failed. can't write to database. %s".formatted(dbResult));
        }
        log.info("retired mapping {} {} (folder {}). reason: {}",
                entityType.getCode(), entityId, dbResult.getExternalFolderId(), deleteReason);
        return dbResult;
    }

    public long countLiveByEntity(EntityTypeEnum entityType, String entityId) throws ValidationException {
        this.checkEntityKey(entityType, entityId);
        LambdaQueryWrapper<FolderMappingEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderMappingEntity::getEntityType, entityType.getCode());
        queryWrapper.eq(FolderMappingEntity::getEntityId, entityId);
        queryWrapper.eq(FolderMappingEntity::getDeleteMarker, FolderMappingEntity.LIVE_MARKER);
        return this.count(queryWrapper);
    }

    private void checkEntityKey(EntityTypeEnum entityType, String entityId) throws ValidationException {
        if (ObjectUtils.isEmpty(entityType) || StringUtils.isBlank(entityId)) {
            throw new ValidationException("entityType or entityId is empty. " +
                    "entityType is %s, entityId is %s".formatted(entityType, entityId));
        }
    }
}
