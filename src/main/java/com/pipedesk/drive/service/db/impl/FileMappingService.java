package com.pipedesk.drive.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.pipedesk.drive.exception.DbException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.mapper.FileMappingMapper;
import com.pipedesk.drive.model.entity.FileMappingEntity;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.db.IFileMappingService;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;

@Service
public class FileMappingService
        extends ServiceImpl<FileMappingMapper, FileMappingEntity>
        implements IFileMappingService {

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FileMappingEntity recordUpload(StoreItem storedFile, String parentFolderId)
            throws ValidationException, DbException {
        if (ObjectUtils.isEmpty(storedFile) || StringUtils.isAnyBlank(storedFile.getId(), parentFolderId)) {
            throw new ValidationException("recordUpload failed. storedFile or parentFolderId is empty. " +
                    "storedFile is %s, parentFolderId is %s".formatted(storedFile, parentFolderId));
        }
        FileMappingEntity fileMappingEntity = new FileMappingEntity();
        fileMappingEntity.setExternalFileId(storedFile.getId());
        fileMappingEntity.setParentFolderId(parentFolderId);
        fileMappingEntity.setFileName(storedFile.getName());
        fileMappingEntity.setMimeType(storedFile.getMimeType());
        fileMappingEntity.setFileSize(storedFile.getSize());
        boolean saved = this.save(fileMappingEntity);
        if (!saved) {
            throw new DbException("recordUpload failed. can't save file mapping to database. %s"
                    .formatted(fileMappingEntity));
        }
        return fileMappingEntity;
    }

    public List<FileMappingEntity> getLiveByParentFolderId(String parentFolderId) throws ValidationException {
        if (StringUtils.isBlank(parentFolderId)) {
            throw new ValidationException("getLiveByParentFolderId failed. parentFolderId is blank");
        }
        LambdaQueryWrapper<FileMappingEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FileMappingEntity::getParentFolderId, parentFolderId);
        queryWrapper.isNull(FileMappingEntity::getDeletedAt);
        queryWrapper.orderByAsc(FileMappingEntity::getFileMappingId);
        List<FileMappingEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? Collections.emptyList() : dbResult;
    }
}
