package com.pipedesk.drive.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.DbException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.mapper.FolderTemplateMapper;
import com.pipedesk.drive.model.entity.FolderTemplateEntity;
import com.pipedesk.drive.model.entity.FolderTemplateNodeEntity;
import com.pipedesk.drive.model.internal.TemplateNodeDefinition;
import com.pipedesk.drive.service.db.IFolderTemplateService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
public class FolderTemplateService
        extends ServiceImpl<FolderTemplateMapper, FolderTemplateEntity>
        implements IFolderTemplateService {

    private final FolderTemplateNodeService folderTemplateNodeService;

    @Autowired
    public FolderTemplateService(FolderTemplateNodeService folderTemplateNodeService) {
        this.folderTemplateNodeService = folderTemplateNodeService;
    }

    /**
     * Loads the active template of an entity type together with all of its nodes. When more than
     * one template is active the oldest one wins.
     *
     * @return the template, or null when the entity type has none
     */
    public FolderTemplateEntity getActiveTemplate(EntityTypeEnum entityType) throws ValidationException {
        if (ObjectUtils.isEmpty(entityType)) {
            throw new ValidationException("getActiveTemplate failed. entityType is null");
        }
        LambdaQueryWrapper<FolderTemplateEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderTemplateEntity::getEntityType, entityType.getCode());
        queryWrapper.eq(FolderTemplateEntity::getActive, Boolean.TRUE);
        queryWrapper.orderByAsc(FolderTemplateEntity::getTemplateId);
        List<FolderTemplateEntity> dbResult = this.list(queryWrapper);
        if (CollectionUtils.isEmpty(dbResult)) {
            return null;
        }
        if (dbResult.size() > 1) {
            log.warn("{} active templates for {}, using {}",
                    dbResult.size(), entityType.getCode(), dbResult.get(0).getTemplateName());
        }
        FolderTemplateEntity template = dbResult.get(0);
        template.setNodes(this.folderTemplateNodeService.getByTemplateId(template.getTemplateId()));
        return template;
    }

    public FolderTemplateEntity getByTemplateName(String templateName) throws ValidationException {
        if (StringUtils.isBlank(templateName)) {
            throw new ValidationException("getByTemplateName failed. templateName is blank");
        }
        LambdaQueryWrapper<FolderTemplateEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(FolderTemplateEntity::getTemplateName, templateName);
        return this.getOne(queryWrapper);
    }

    /**
     * Stores a template and its node tree. Parents are always written before their children, so
     * every parent reference points at an existing node of the same template.
     */
    @Transactional
    public FolderTemplateEntity createTemplate(
            String templateName,
            EntityTypeEnum entityType,
            boolean active,
            List<TemplateNodeDefinition> rootNodes) throws ValidationException, DbException {
        if (StringUtils.isBlank(templateName) || ObjectUtils.isEmpty(entityType)) {
            throw new ValidationException("createTemplate failed. templateName or entityType is empty");
        }
        if (!entityType.isBusinessEntity()) {
            throw new ValidationException("createTemplate failed. %s can't have a template"
                    .formatted(entityType.getCode()));
        }
        if (ObjectUtils.isNotEmpty(this.getByTemplateName(templateName))) {
            throw new ValidationException("createTemplate failed. templateName %s is duplicate"
                    .formatted(templateName));
        }
        FolderTemplateEntity template = new FolderTemplateEntity();
        template.setTemplateName(templateName);
        template.setEntityType(entityType.getCode());
        template.setActive(active);
        boolean saved = this.save(template);
        if (!saved) {
            throw new DbException("createTemplate failed. can't save template to database.");
        }
        this.createNodes(template.getTemplateId(), null, rootNodes);
        template.setNodes(this.folderTemplateNodeService.getByTemplateId(template.getTemplateId()));
        log.info("created template '{}' for {} with {} nodes",
                templateName, entityType.getCode(), template.getNodes().size());
        return template;
    }

    @Transactional
    public void setActive(Long templateId, boolean active) throws ValidationException, DbException {
        FolderTemplateEntity dbResult = this.getById(templateId);
        if (ObjectUtils.isEmpty(dbResult)) {
            throw new ValidationException("setActive failed. template %s does not exist".formatted(templateId));
        }
        dbResult.setActive(active);
        boolean updated = this.updateById(dbResult);
        if (!updated) {
            throw new DbException("setActive failed. can't write to database. %s".formatted(dbResult));
        }
    }

    private void createNodes(Long templateId, Long parentNodeId, List<TemplateNodeDefinition> definitions) {
        if (CollectionUtils.isEmpty(definitions)) {
            return;
        }
        for (int i = 0; i < definitions.size(); i++) {
            TemplateNodeDefinition definition = definitions.get(i);
            FolderTemplateNodeEntity node = this.folderTemplateNodeService.createNode(
                    templateId, parentNodeId, definition.getName(), i);
            this.createNodes(templateId, node.getNodeId(), definition.getChildren());
        }
    }
}
