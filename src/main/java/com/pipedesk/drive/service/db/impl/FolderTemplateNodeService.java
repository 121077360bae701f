package com.pipedesk.drive.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.pipedesk.drive.exception.DbException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.mapper.FolderTemplateNodeMapper;
import com.pipedesk.drive.model.entity.FolderTemplateNodeEntity;
import com.pipedesk.drive.service.db.IFolderTemplateNodeService;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

@Service
public class FolderTemplateNodeService
        extends ServiceImpl<FolderTemplateNodeMapper, FolderTemplateNodeEntity>
        implements IFolderTemplateNodeService {

    public List<FolderTemplateNodeEntity> getByTemplateId(Long templateId) throws ValidationException {
        if (ObjectUtils.isEmpty(templateId)) {
            throw new ValidationException("getByTemplateId failed. templateId is null");
        }
        LambdaQueryWrapper<FolderTemplateNodeEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderTemplateNodeEntity::getTemplateId, templateId);
        queryWrapper.orderByAsc(FolderTemplateNodeEntity::getSortOrder);
        queryWrapper.orderByAsc(FolderTemplateNodeEntity::getNodeId);
        List<FolderTemplateNodeEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? Collections.emptyList() : dbResult;
    }

    // the parent, when given, must already be stored in the same template
    public FolderTemplateNodeEntity createNode(
            Long templateId,
            Long parentNodeId,
            String nodeName,
            int sortOrder) throws ValidationException, DbException {
        if (ObjectUtils.isEmpty(templateId) || StringUtils.isBlank(nodeName)) {
            throw new ValidationException("createNode failed. templateId or nodeName is empty. " +
                    "templateId is %s, nodeName is %s".formatted(templateId, nodeName));
        }
        if (ObjectUtils.isNotEmpty(parentNodeId)) {
            FolderTemplateNodeEntity parent = this.getById(parentNodeId);
            if (ObjectUtils.isEmpty(parent) || !templateId.equals(parent.getTemplateId())) {
                throw new ValidationException("createNode failed. parent node %s is not part of template %s"
                        .formatted(parentNodeId, templateId));
            }
        }
        FolderTemplateNodeEntity node = new FolderTemplateNodeEntity();
        node.setTemplateId(templateId);
        node.setParentNodeId(parentNodeId);
        node.setNodeName(nodeName.trim());
        node.setSortOrder(sortOrder);
        boolean saved = this.save(node);
        if (!saved) {
            throw new DbException("createNode failed. can't save node to database. %s".formatted(node));
        }
        return node;
    }
}
